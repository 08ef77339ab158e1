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

import static bpl.core.BoogieFile.ADD;
import static bpl.core.BoogieFile.CONST;
import static bpl.core.BoogieFile.EQ;
import static bpl.core.BoogieFile.FORALL;
import static bpl.core.BoogieFile.GT;
import static bpl.core.BoogieFile.GTEQ;
import static bpl.core.BoogieFile.LT;
import static bpl.core.BoogieFile.LTEQ;
import static bpl.core.BoogieFile.OLD;
import static bpl.core.BoogieFile.PROCEDURE;
import static bpl.core.BoogieFile.VAR;
import static bpl.core.BoogieFile.VARIABLE;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import bpl.core.BoogieFile;
import bpl.core.BoogieFile.Decl;
import bpl.core.BoogieFile.Expr;
import bpl.core.BoogieFile.Type;
import bpl.core.StmtList;
import bpl.core.StmtListBuilder;

/**
 * A small program shared by the resolution and desugaring tests:
 *
 * <pre>
 * var g : int;
 * procedure P(x : int) returns (r : int);
 *    requires x &gt; 0;
 *    modifies g;
 *    ensures r == old(g) + x;
 *    free ensures g &gt;= 0;
 * procedure Q(x : int, y : int);
 *    requires x &lt; y;
 *    ensures x + 1 &lt;= y;
 * procedure R(x : int) returns (z : int);
 *    ensures z &gt; x;
 * procedure Id&lt;T&gt;(v : T) returns (w : T);
 * procedure Flag() returns (f : bool);
 * procedure Two() returns (p : int, q : int);
 * procedure Bad();
 *    modifies h;
 * procedure Twice();
 *    modifies g, g;
 * procedure S(x : int);
 *    requires (forall y : int :: x &lt;= y);
 *    ensures x &gt; 0;
 * implementation main() { var a : int; var y : int; var b : bool; ... }
 * </pre>
 */
final class CallFixtures {
	static final Decl.Variable G = VARIABLE("g", Type.Int);

	static final Decl.Procedure P = new Decl.Procedure("P", Collections.<String>emptyList(),
			Arrays.asList(VARIABLE("x", Type.Int)), Arrays.asList(VARIABLE("r", Type.Int)),
			Arrays.<Expr.Logical>asList(GT(VAR("x"), CONST(0))), Collections.<Expr.Logical>emptyList(),
			Arrays.<Expr.Logical>asList(EQ(VAR("r"), ADD(OLD(VAR("g")), VAR("x")))),
			Arrays.<Expr.Logical>asList(GTEQ(VAR("g"), CONST(0))), Arrays.asList("g"));

	static final Decl.Procedure Q = PROCEDURE("Q", Arrays.asList(VARIABLE("x", Type.Int), VARIABLE("y", Type.Int)),
			Collections.<Decl.Variable>emptyList(), Arrays.<Expr.Logical>asList(LT(VAR("x"), VAR("y"))),
			Arrays.<Expr.Logical>asList(LTEQ(ADD(VAR("x"), CONST(1)), VAR("y"))), Collections.<String>emptyList());

	static final Decl.Procedure R = PROCEDURE("R", Arrays.asList(VARIABLE("x", Type.Int)),
			Arrays.asList(VARIABLE("z", Type.Int)), Collections.<Expr.Logical>emptyList(),
			Arrays.<Expr.Logical>asList(GT(VAR("z"), VAR("x"))), Collections.<String>emptyList());

	static final Decl.Procedure ID = new Decl.Procedure("Id", Arrays.asList("T"),
			Arrays.asList(VARIABLE("v", new Type.Variable("T"))), Arrays.asList(VARIABLE("w", new Type.Variable("T"))),
			Collections.<Expr.Logical>emptyList(), Collections.<Expr.Logical>emptyList(),
			Collections.<Expr.Logical>emptyList(), Collections.<Expr.Logical>emptyList(),
			Collections.<String>emptyList());

	static final Decl.Procedure FLAG = PROCEDURE("Flag", Collections.<Decl.Variable>emptyList(),
			Arrays.asList(VARIABLE("f", Type.Bool)));

	static final Decl.Procedure TWO = PROCEDURE("Two", Collections.<Decl.Variable>emptyList(),
			Arrays.asList(VARIABLE("p", Type.Int), VARIABLE("q", Type.Int)));

	static final Decl.Procedure BAD = PROCEDURE("Bad", Collections.<Decl.Variable>emptyList(),
			Collections.<Decl.Variable>emptyList(), Collections.<Expr.Logical>emptyList(),
			Collections.<Expr.Logical>emptyList(), Arrays.asList("h"));

	static final Decl.Procedure TWICE = PROCEDURE("Twice", Collections.<Decl.Variable>emptyList(),
			Collections.<Decl.Variable>emptyList(), Collections.<Expr.Logical>emptyList(),
			Collections.<Expr.Logical>emptyList(), Arrays.asList("g", "g"));

	static final Decl.Procedure S = PROCEDURE("S", Arrays.asList(VARIABLE("x", Type.Int)),
			Collections.<Decl.Variable>emptyList(),
			Arrays.<Expr.Logical>asList(FORALL("y", Type.Int, LTEQ(VAR("x"), VAR("y")))),
			Arrays.<Expr.Logical>asList(GT(VAR("x"), CONST(0))), Collections.<String>emptyList());

	static final List<Decl.Variable> LOCALS = Arrays.asList(VARIABLE("a", Type.Int), VARIABLE("y", Type.Int),
			VARIABLE("b", Type.Bool));

	private CallFixtures() {
	}

	static Decl.Implementation implementation(StmtList body) {
		return new Decl.Implementation("main", Collections.<Decl.Variable>emptyList(),
				Collections.<Decl.Variable>emptyList(), LOCALS, body);
	}

	static BoogieFile file(Decl.Implementation... impls) {
		BoogieFile file = new BoogieFile(Arrays.<Decl>asList(G, P, Q, R, ID, FLAG, TWO, BAD, TWICE, S));
		file.getDeclarations().addAll(Arrays.asList(impls));
		return file;
	}

	/**
	 * A context for resolving commands within the body of <code>main</code>.
	 */
	static ResolutionContext context() {
		Decl.Implementation impl = implementation(new StmtListBuilder().collect());
		return ResolutionContext.of(file()).enter(impl);
	}
}
