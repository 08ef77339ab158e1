// Copyright 2020 The Whiley Project Developers
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
package bpl.tasks;

import static bpl.core.BoogieFile.AND;
import static bpl.core.BoogieFile.ASSERT;
import static bpl.core.BoogieFile.ASSERT_REQUIRES;
import static bpl.core.BoogieFile.ASSIGN;
import static bpl.core.BoogieFile.ASSUME;
import static bpl.core.BoogieFile.EXISTS;
import static bpl.core.BoogieFile.FORALL;
import static bpl.core.BoogieFile.HAVOC;
import static bpl.core.BoogieFile.IMPLIES;
import static bpl.core.BoogieFile.STATE;
import static bpl.core.BoogieFile.VAR;
import static bpl.core.BoogieFile.VARIABLE;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.flogger.GoogleLogger;

import bpl.core.BoogieFile.Cmd;
import bpl.core.BoogieFile.Decl;
import bpl.core.BoogieFile.Expr;
import bpl.core.BoogieFile.Type;
import bpl.util.Substituter;
import bpl.util.TypeSubstituter;

/**
 * Expands a call into primitive commands according to the callee's contract,
 * without looking at any implementation of the callee. For a call
 * <code>call aouts := P(ains)</code> the expansion is:
 *
 * <pre>
 * cins := ains;           // or havoc for each wildcard
 * assert Pre[ins := cins];
 * cframe := frame;        // snapshot of the modified globals
 * havoc frame, couts;
 * assume Post[ins, outs, old(frame) := cins, couts, cframe];
 * aouts := couts;
 * </pre>
 *
 * All temporaries are local to the resulting state command.
 *
 * @author David J. Pearce
 *
 */
public class CallDesugarer implements Cmd.Desugarer {
	private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

	public static final String FORMAL = "formal@";
	public static final String OLD = "old@";
	public static final String BOUND = "forall@";

	public static final CallDesugarer INSTANCE = new CallDesugarer();

	/**
	 * Get the (cached) desugaring of a resolved call or call forall.
	 *
	 * @param call
	 * @return
	 */
	public static Cmd.State getDesugaring(Cmd.CallCommonality call) {
		return call.getDesugaring(INSTANCE);
	}

	/**
	 * Desugar a resolved call.
	 *
	 * @param call
	 * @return
	 */
	@Override
	public Cmd.State desugar(Cmd.Call call) {
		Preconditions.checkState(call.isResolved(), "call to %s desugared before resolution", call.getCallee());
		Preconditions.checkState(call.getTypeInstantiation() != null, "call to %s desugared before type checking",
				call.getCallee());
		Decl.Procedure proc = call.getProcedure();
		Map<String, Type> instantiation = call.getTypeInstantiation();
		List<Decl.Variable> tempVars = new ArrayList<>();
		List<Cmd> cmds = new ArrayList<>();
		Map<String, Expr.VariableAccess> substMap = new HashMap<>();
		Map<String, Expr.VariableAccess> substMapOld = new HashMap<>();
		Map<String, Expr.VariableAccess> substMapBound = new HashMap<>();
		List<Decl.Parameter> wildcardVars = new ArrayList<>();
		// Create an incarnation of each in-parameter
		List<Decl.Variable> cins = new ArrayList<>();
		for (int i = 0; i != proc.getParameters().size(); ++i) {
			Decl.Variable param = proc.getParameters().get(i);
			Type type = TypeSubstituter.apply(param.getType(), instantiation);
			Decl.Variable cin = VARIABLE(temporary(call, FORMAL, param), type);
			cins.add(cin);
			tempVars.add(cin);
			substMap.put(param.getName(), VAR(cin.getName()));
			if (call.getIns().get(i) == null) {
				Decl.Parameter bound = new Decl.Parameter(temporary(call, BOUND, param), type);
				wildcardVars.add(bound);
				substMapBound.put(param.getName(), VAR(bound.getName()));
			} else {
				substMapBound.put(param.getName(), VAR(cin.getName()));
			}
		}
		// cins := ains (or havoc cin for a wildcard)
		for (int i = 0; i != cins.size(); ++i) {
			Expr actual = call.getIns().get(i);
			if (actual != null) {
				cmds.add(ASSIGN(VAR(cins.get(i).getName()), actual));
			} else {
				cmds.add(HAVOC(VAR(cins.get(i).getName())));
			}
		}
		// Check the precondition
		if (!wildcardVars.isEmpty()) {
			List<Expr.Logical> pre = new ArrayList<>();
			for (Expr.Logical req : proc.getRequires()) {
				pre.add(Substituter.apply(substMapBound, req));
			}
			cmds.add(ASSERT(EXISTS(wildcardVars, AND(pre))));
			// Make the precondition available to what follows
			for (Expr.Logical req : proc.getRequires()) {
				cmds.add(ASSUME(Substituter.apply(substMap, req)));
			}
		} else {
			for (Expr.Logical req : proc.getRequires()) {
				cmds.add(ASSERT_REQUIRES(call, req, Substituter.apply(substMapBound, req)));
			}
		}
		// cframe := frame
		List<Expr.VariableAccess> havocs = new ArrayList<>();
		for (Decl.Variable g : call.getFrame()) {
			Decl.Variable old = VARIABLE(temporary(call, OLD, g), g.getType());
			tempVars.add(old);
			substMapOld.put(g.getName(), VAR(old.getName()));
			cmds.add(ASSIGN(VAR(old.getName()), VAR(g.getName())));
			havocs.add(VAR(g.getName()));
		}
		// Create an incarnation of each out-parameter
		List<String> couts = new ArrayList<>();
		for (Decl.Variable param : proc.getReturns()) {
			String name = temporary(call, FORMAL, param);
			couts.add(name);
			substMap.put(param.getName(), VAR(name));
			havocs.add(VAR(name));
		}
		// where clauses can mention any parameter, so wait for the full map
		for (int i = 0; i != couts.size(); ++i) {
			Decl.Variable param = proc.getReturns().get(i);
			Type type = TypeSubstituter.apply(param.getType(), instantiation);
			Expr.Logical where = param.getWhere() == null ? null : Substituter.apply(substMap, param.getWhere());
			tempVars.add(VARIABLE(couts.get(i), type, where));
		}
		cmds.add(HAVOC(havocs));
		// Assume the postcondition
		for (Expr.Logical ens : ensures(proc)) {
			cmds.add(ASSUME(Substituter.applyReplacingOldExprs(substMap, substMapOld, ens)));
		}
		// aouts := couts
		for (int i = 0; i != call.getOuts().size(); ++i) {
			Expr.VariableAccess out = call.getOuts().get(i);
			if (out != null) {
				cmds.add(ASSIGN(out, VAR(couts.get(i))));
			}
		}
		logger.atFine().log("desugared call to %s into %d commands", call.getCallee(), cmds.size());
		return STATE(tempVars, cmds);
	}

	/**
	 * Desugar a resolved <code>call forall</code>. This produces a single
	 * assumption, namely <code>forall wildcards :: Pre ==> (exists outs :: Post)</code>
	 * with the universal and existential quantifiers dropped when there is nothing
	 * to quantify. Nothing is assigned, not even temporaries.
	 *
	 * @param call
	 * @return
	 */
	@Override
	public Cmd.State desugar(Cmd.CallForall call) {
		Preconditions.checkState(call.isResolved(), "call forall to %s desugared before resolution",
				call.getCallee());
		Preconditions.checkState(call.getInstantiatedTypes() != null,
				"call forall to %s desugared before type checking", call.getCallee());
		Decl.Procedure proc = call.getProcedure();
		Map<String, Expr> substMap = new HashMap<>();
		List<Decl.Parameter> wildcardVars = new ArrayList<>();
		// Actual arguments are used in place, the substitution renames any binder
		// they would otherwise be captured by. Only wildcards need a variable.
		for (int i = 0; i != proc.getParameters().size(); ++i) {
			Decl.Variable param = proc.getParameters().get(i);
			Expr actual = call.getIns().get(i);
			if (actual == null) {
				String name = temporary(call, BOUND, param);
				wildcardVars.add(new Decl.Parameter(name, call.getInstantiatedTypes().get(i)));
				substMap.put(param.getName(), VAR(name));
			} else {
				substMap.put(param.getName(), actual);
			}
		}
		List<Expr.Logical> pre = new ArrayList<>();
		for (Expr.Logical req : proc.getRequires()) {
			pre.add(Substituter.apply(substMap, req));
		}
		// Create bound incarnations of each out-parameter
		List<String> couts = new ArrayList<>();
		for (Decl.Variable param : proc.getReturns()) {
			String name = temporary(call, BOUND, param);
			couts.add(name);
			substMap.put(param.getName(), VAR(name));
		}
		List<Decl.Parameter> outVars = new ArrayList<>();
		for (int i = 0; i != couts.size(); ++i) {
			Decl.Variable param = proc.getReturns().get(i);
			Expr.Logical where = param.getWhere() == null ? null : Substituter.apply(substMap, param.getWhere());
			outVars.add(VARIABLE(couts.get(i), param.getType(), where));
		}
		List<Expr.Logical> post = new ArrayList<>();
		for (Expr.Logical ens : ensures(proc)) {
			post.add(Substituter.apply(substMap, ens));
		}
		Expr.Logical body = AND(post);
		if (!outVars.isEmpty()) {
			body = EXISTS(outVars, body);
		}
		body = IMPLIES(AND(pre), body);
		if (!wildcardVars.isEmpty()) {
			body = FORALL(wildcardVars, body);
		}
		return STATE(new ArrayList<>(), Arrays.<Cmd>asList(ASSUME(body)));
	}

	private static List<Expr.Logical> ensures(Decl.Procedure proc) {
		List<Expr.Logical> ens = new ArrayList<>(proc.getEnsures());
		ens.addAll(proc.getFreeEnsures());
		return ens;
	}

	private static String temporary(Cmd.CallCommonality call, String kind, Decl.Parameter param) {
		return "call" + call.getUniqueId() + kind + param.getName();
	}
}
