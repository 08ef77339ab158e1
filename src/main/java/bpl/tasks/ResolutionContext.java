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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import bpl.core.BoogieFile;
import bpl.core.BoogieFile.Decl;
import bpl.core.BoogieFile.Expr;
import bpl.core.BoogieFile.Type;

/**
 * Provides the declarations visible at some point in a Boogie file: the
 * procedures, functions and global variables of the file together with the
 * parameters and locals of the enclosing implementation (if any).
 *
 * @author David J. Pearce
 *
 */
public class ResolutionContext {
	private final Map<String, Decl.Procedure> procedures;
	private final Map<String, Decl.Function> functions;
	private final Map<String, Decl.Parameter> globals;
	private final Map<String, Decl.Parameter> locals;

	private ResolutionContext(Map<String, Decl.Procedure> procedures, Map<String, Decl.Function> functions,
			Map<String, Decl.Parameter> globals, Map<String, Decl.Parameter> locals) {
		this.procedures = procedures;
		this.functions = functions;
		this.globals = globals;
		this.locals = locals;
	}

	public ResolutionContext() {
		this(new HashMap<>(), new HashMap<>(), new HashMap<>(), new HashMap<>());
	}

	/**
	 * Construct a context from the top-level declarations of a file.
	 *
	 * @param file
	 * @return
	 */
	public static ResolutionContext of(BoogieFile file) {
		ResolutionContext ctx = new ResolutionContext();
		for (Decl d : file.getDeclarations()) {
			ctx.declare(d);
		}
		return ctx;
	}

	public void declare(Decl d) {
		if (d instanceof Decl.Procedure) {
			Decl.Procedure p = (Decl.Procedure) d;
			procedures.put(p.getName(), p);
		} else if (d instanceof Decl.Function) {
			Decl.Function f = (Decl.Function) d;
			functions.put(f.getName(), f);
		} else if (d instanceof Decl.Variable || d instanceof Decl.Constant) {
			Decl.Parameter v = (Decl.Parameter) d;
			globals.put(v.getName(), v);
		}
	}

	/**
	 * Construct a context for the body of a given implementation. This shares the
	 * top-level declarations of this context.
	 *
	 * @param impl
	 * @return
	 */
	public ResolutionContext enter(Decl.Implementation impl) {
		Map<String, Decl.Parameter> scope = new HashMap<>();
		addAll(scope, impl.getParameters());
		addAll(scope, impl.getReturns());
		addAll(scope, impl.getLocals());
		return new ResolutionContext(procedures, functions, globals, scope);
	}

	private static void addAll(Map<String, Decl.Parameter> scope, List<Decl.Variable> vars) {
		for (Decl.Variable v : vars) {
			scope.put(v.getName(), v);
		}
	}

	public Decl.Procedure getProcedure(String name) {
		return procedures.get(name);
	}

	public Decl.Function getFunction(String name) {
		return functions.get(name);
	}

	public Decl.Variable getGlobal(String name) {
		Decl.Parameter p = globals.get(name);
		return p instanceof Decl.Variable ? (Decl.Variable) p : null;
	}

	/**
	 * Look up a variable, with locals shadowing globals.
	 *
	 * @param name
	 * @return
	 */
	public Decl.Parameter getVariable(String name) {
		Decl.Parameter p = locals.get(name);
		return p != null ? p : globals.get(name);
	}

	/**
	 * Determine the type of an expression, where this can be done from
	 * declarations alone. Otherwise, <code>null</code> is returned.
	 *
	 * @param e
	 * @return
	 */
	public Type typeOf(Expr e) {
		if (e instanceof Expr.VariableAccess) {
			Decl.Parameter p = getVariable(((Expr.VariableAccess) e).getVariable());
			return p == null ? null : p.getType();
		} else if (e instanceof Expr.Integer) {
			return Type.Int;
		} else if (e instanceof Expr.Old) {
			return typeOf(((Expr.Old) e).getOperand());
		} else if (e instanceof Expr.Invoke) {
			Decl.Function f = getFunction(((Expr.Invoke) e).getName());
			return f == null ? null : f.getReturns();
		} else if (e instanceof Expr.DictionaryAccess) {
			Type t = typeOf(((Expr.DictionaryAccess) e).getSource());
			return t instanceof Type.Dictionary ? ((Type.Dictionary) t).getValue() : null;
		} else if (e instanceof Expr.DictionaryUpdate) {
			return typeOf(((Expr.DictionaryUpdate) e).getSource());
		} else if (e instanceof Expr.Negation) {
			return typeOf(((Expr.Negation) e).getOperand());
		} else if (e instanceof Expr.BinaryOperator && !(e instanceof Expr.Logical)) {
			// arithmetic
			return typeOf(((Expr.BinaryOperator) e).getLeftHandSide());
		} else if (e instanceof Expr.Logical) {
			return Type.Bool;
		} else {
			return null;
		}
	}
}
