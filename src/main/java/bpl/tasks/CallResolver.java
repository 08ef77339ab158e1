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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.common.flogger.GoogleLogger;

import bpl.core.BigBlock;
import bpl.core.BoogieFile.Cmd;
import bpl.core.BoogieFile.Decl;
import bpl.core.BoogieFile.Expr;
import bpl.core.BoogieFile.LVal;
import bpl.core.BoogieFile.Type;
import bpl.core.StmtList;
import bpl.core.StructuredCmd;
import bpl.util.ErrorHandler;
import bpl.util.ErrorMessages;
import bpl.util.TypeSubstituter;
import bpl.util.Util;

/**
 * Resolves and type checks the commands of an implementation body. For calls,
 * this binds the callee's declaration and determines the instantiation of its
 * type parameters, after which the call can be desugared. Errors are reported
 * to the given handler and the offending command is left unresolved.
 *
 * @author David J. Pearce
 *
 */
public class CallResolver {
	private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

	private final ResolutionContext context;
	private final ErrorHandler handler;

	public CallResolver(ResolutionContext context, ErrorHandler handler) {
		this.context = context;
		this.handler = handler;
	}

	public void resolve(StmtList stmtList) {
		for (BigBlock b : stmtList.getBigBlocks()) {
			for (Cmd c : b.getSimpleCmds()) {
				resolve(c);
			}
			StructuredCmd sc = b.getStructuredCmd();
			if (sc instanceof StructuredCmd.While) {
				StructuredCmd.While w = (StructuredCmd.While) sc;
				checkPredicate(w.getGuard(), "loop guard");
				for (Cmd.Predicate inv : w.getInvariants()) {
					resolve(inv);
				}
				resolve(w.getBody());
			} else if (sc instanceof StructuredCmd.If) {
				for (StructuredCmd.If i = (StructuredCmd.If) sc; i != null; i = i.getElseIf()) {
					checkPredicate(i.getGuard(), "if guard");
					resolve(i.getThen());
					if (i.getElse() != null) {
						resolve(i.getElse());
					}
				}
			}
		}
	}

	public void resolve(Cmd cmd) {
		if (cmd instanceof Cmd.Call) {
			resolveCall((Cmd.Call) cmd);
		} else if (cmd instanceof Cmd.CallForall) {
			resolveCallForall((Cmd.CallForall) cmd);
		} else if (cmd instanceof Cmd.Assignment) {
			resolveAssignment((Cmd.Assignment) cmd);
		} else if (cmd instanceof Cmd.Assert) {
			checkPredicate(((Cmd.Assert) cmd).getCondition(), "assert");
		} else if (cmd instanceof Cmd.Assume) {
			checkPredicate(((Cmd.Assume) cmd).getCondition(), "assume");
		} else if (cmd instanceof Cmd.Havoc) {
			for (Expr.VariableAccess v : ((Cmd.Havoc) cmd).getVariables()) {
				checkDeclared(v);
			}
		} else if (cmd instanceof Cmd.State) {
			for (Cmd c : ((Cmd.State) cmd).getCmds()) {
				resolve(c);
			}
		}
	}

	private void resolveCall(Cmd.Call call) {
		Decl.Procedure proc = context.getProcedure(call.getCallee());
		if (proc == null) {
			handler.report(ErrorMessages.syntaxError(call, ErrorMessages.UNDECLARED_PROCEDURE, call.getCallee()));
			return;
		}
		int errors = handler.getErrorCount();
		// Check output variables
		Set<String> outs = new HashSet<>();
		for (Expr.VariableAccess out : call.getOuts()) {
			if (out != null) {
				checkDeclared(out);
				if (!outs.add(out.getVariable())) {
					handler.report(ErrorMessages.syntaxError(call, ErrorMessages.DUPLICATE_PARALLEL_ASSIGNMENT_TARGET,
							out.getVariable()));
				}
			}
		}
		if (call.getIns().size() != proc.getParameters().size()) {
			handler.report(ErrorMessages.syntaxError(call, ErrorMessages.ARITY_MISMATCH, "arguments",
					call.getCallee(), call.getIns().size()));
		}
		if (call.getOuts().size() != proc.getReturns().size()) {
			handler.report(ErrorMessages.syntaxError(call, ErrorMessages.ARITY_MISMATCH, "result variables",
					call.getCallee(), call.getOuts().size()));
		}
		if (call.isAsync() && call.getOuts().size() > 1) {
			handler.report(ErrorMessages.syntaxError(call, ErrorMessages.ASYNC_ARITY_OR_TYPE_ERROR, call.getCallee(),
					"must have at most one output"));
		}
		// Resolve the frame
		List<Decl.Variable> frame = new ArrayList<>();
		for (String name : proc.getModifies()) {
			Decl.Variable g = context.getGlobal(name);
			if (g == null) {
				handler.report(ErrorMessages.syntaxError(call, ErrorMessages.UNDECLARED_VARIABLE, name));
			} else if (!frame.contains(g)) {
				// a global named twice is snapshot and havocked once
				frame.add(g);
			}
		}
		if (handler.getErrorCount() != errors) {
			return;
		}
		// Infer type parameters from the actual arguments
		Map<String, Type> instantiation = new HashMap<>();
		for (int i = 0; i != call.getIns().size(); ++i) {
			Decl.Variable formal = proc.getParameters().get(i);
			Expr actual = call.getIns().get(i);
			if (actual != null) {
				match(call, formal, context.typeOf(actual), instantiation);
			}
		}
		for (int i = 0; i != call.getOuts().size(); ++i) {
			Decl.Variable formal = proc.getReturns().get(i);
			Expr.VariableAccess actual = call.getOuts().get(i);
			if (actual != null) {
				match(call, formal, context.typeOf(actual), instantiation);
			}
		}
		if (call.isAsync() && call.getOuts().size() == 1 && call.getOuts().get(0) != null) {
			Type t = TypeSubstituter.apply(proc.getReturns().get(0).getType(), instantiation);
			if (!Type.Int.equals(t)) {
				handler.report(ErrorMessages.syntaxError(call, ErrorMessages.ASYNC_ARITY_OR_TYPE_ERROR,
						call.getCallee(), "must return an integer"));
			}
		}
		if (handler.getErrorCount() != errors) {
			return;
		}
		call.setProcedure(proc);
		call.setFrame(frame);
		call.setTypeInstantiation(instantiation);
		logger.atFine().log("resolved call to %s (%d type parameters bound)", call.getCallee(), instantiation.size());
	}

	private void resolveCallForall(Cmd.CallForall call) {
		Decl.Procedure proc = context.getProcedure(call.getCallee());
		if (proc == null) {
			handler.report(ErrorMessages.syntaxError(call, ErrorMessages.UNDECLARED_PROCEDURE, call.getCallee()));
			return;
		}
		if (call.getIns().size() != proc.getParameters().size()) {
			handler.report(ErrorMessages.syntaxError(call, ErrorMessages.ARITY_MISMATCH, "arguments",
					call.getCallee(), call.getIns().size()));
			return;
		}
		int errors = handler.getErrorCount();
		Map<String, Type> instantiation = new HashMap<>();
		for (int i = 0; i != call.getIns().size(); ++i) {
			Expr actual = call.getIns().get(i);
			if (actual != null) {
				match(call, proc.getParameters().get(i), context.typeOf(actual), instantiation);
			}
		}
		if (!proc.getModifies().isEmpty()) {
			handler.report(ErrorMessages.syntaxError(call, ErrorMessages.MODIFIES_CLAUSE_VIOLATION));
		}
		if (handler.getErrorCount() != errors) {
			return;
		}
		List<Type> types = new ArrayList<>();
		for (Decl.Variable formal : proc.getParameters()) {
			types.add(TypeSubstituter.apply(formal.getType(), instantiation));
		}
		call.setProcedure(proc);
		call.setInstantiatedTypes(types);
	}

	private void match(Cmd.CallCommonality call, Decl.Variable formal, Type actual, Map<String, Type> instantiation) {
		// NOTE: an actual whose type cannot be determined is accepted as is
		if (actual != null && !TypeSubstituter.unify(formal.getType(), actual, instantiation)) {
			handler.report(ErrorMessages.syntaxError(call, ErrorMessages.INCOMPATIBLE_ARGUMENT_TYPE, formal.getName(),
					call.getCallee()));
		}
	}

	private void resolveAssignment(Cmd.Assignment stmt) {
		List<LVal> lhs = stmt.getLeftHandSides();
		if (lhs.size() != stmt.getRightHandSides().size()) {
			handler.report(ErrorMessages.syntaxError(stmt, ErrorMessages.ASSIGNMENT_COUNT_MISMATCH, lhs.size(),
					stmt.getRightHandSides().size()));
		}
		Set<String> assigned = new HashSet<>();
		for (LVal lv : lhs) {
			Expr.VariableAccess v = Util.getDeepAssignedVariable(lv);
			checkDeclared(v);
			if (!assigned.add(v.getVariable())) {
				handler.report(ErrorMessages.syntaxError(stmt, ErrorMessages.DUPLICATE_PARALLEL_ASSIGNMENT_TARGET,
						v.getVariable()));
			}
		}
	}

	private void checkDeclared(Expr.VariableAccess v) {
		if (context.getVariable(v.getVariable()) == null) {
			handler.report(ErrorMessages.syntaxError(v, ErrorMessages.UNDECLARED_VARIABLE, v.getVariable()));
		}
	}

	private void checkPredicate(Expr.Logical e, String kind) {
		if (e != null) {
			Type t = context.typeOf(e);
			if (t != null && !Type.Bool.equals(t)) {
				handler.report(ErrorMessages.syntaxError(e, ErrorMessages.NON_BOOLEAN_PREDICATE, kind));
			}
		}
	}
}
