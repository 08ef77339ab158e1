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
package bpl.io;

import static bpl.core.BoogieFile.ADD;
import static bpl.core.BoogieFile.AND;
import static bpl.core.BoogieFile.ASSERT;
import static bpl.core.BoogieFile.ASSIGN;
import static bpl.core.BoogieFile.ASYNC_CALL;
import static bpl.core.BoogieFile.CALL;
import static bpl.core.BoogieFile.CALL_FORALL;
import static bpl.core.BoogieFile.COMMENT;
import static bpl.core.BoogieFile.CONST;
import static bpl.core.BoogieFile.EQ;
import static bpl.core.BoogieFile.GET;
import static bpl.core.BoogieFile.GT;
import static bpl.core.BoogieFile.GTEQ;
import static bpl.core.BoogieFile.HAVOC;
import static bpl.core.BoogieFile.IDIV;
import static bpl.core.BoogieFile.IMPLIES;
import static bpl.core.BoogieFile.INVOKE;
import static bpl.core.BoogieFile.LT;
import static bpl.core.BoogieFile.NEG;
import static bpl.core.BoogieFile.OLD;
import static bpl.core.BoogieFile.PUT;
import static bpl.core.BoogieFile.REM;
import static bpl.core.BoogieFile.STATE;
import static bpl.core.BoogieFile.VAR;
import static bpl.core.BoogieFile.VARIABLE;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;

import org.junit.Test;

import bpl.core.BoogieFile;
import bpl.core.BoogieFile.Cmd;
import bpl.core.BoogieFile.Decl;
import bpl.core.BoogieFile.Expr;
import bpl.core.BoogieFile.Type;
import bpl.core.StmtList;
import bpl.core.StmtListBuilder;
import bpl.core.StructuredCmd;
import bpl.tasks.LoweringTask;
import bpl.util.ErrorHandler;

public class BoogieFilePrinterTest {
	private static final Decl.Variable G = VARIABLE("g", Type.Int);

	private static final Decl.Procedure P = new Decl.Procedure("P", Collections.<String>emptyList(),
			Arrays.asList(VARIABLE("x", Type.Int)), Arrays.asList(VARIABLE("r", Type.Int)),
			Arrays.<Expr.Logical>asList(GT(VAR("x"), CONST(0))), Collections.<Expr.Logical>emptyList(),
			Arrays.<Expr.Logical>asList(EQ(VAR("r"), ADD(OLD(VAR("g")), VAR("x")))),
			Arrays.<Expr.Logical>asList(GTEQ(VAR("g"), CONST(0))), Arrays.asList("g"));

	@Test
	public void test_expressions() {
		assertEquals("m[i := v][j]", BoogieFilePrinter.toString(GET(PUT(VAR("m"), VAR("i"), VAR("v")), VAR("j"))));
		assertEquals("f(a, 1)", BoogieFilePrinter.toString(INVOKE("f", Arrays.<Expr>asList(VAR("a"), CONST(1)))));
		assertEquals("(-(x div 2)) + (x mod 2)",
				BoogieFilePrinter.toString(ADD(NEG(IDIV(VAR("x"), CONST(2))), REM(VAR("x"), CONST(2)))));
		assertEquals("(a && b) ==> c",
				BoogieFilePrinter.toString(IMPLIES(AND(VAR("a"), VAR("b")), VAR("c"))));
	}

	@Test
	public void test_calls() {
		Cmd call = CALL("P", Arrays.asList(VAR("y"), null), Arrays.<Expr>asList(VAR("a"), null));
		assertEquals("call y, * := P(a, *);", BoogieFilePrinter.toString(call));
		Cmd async = ASYNC_CALL("P", Arrays.asList(VAR("y")), Arrays.<Expr>asList(VAR("a")));
		assertEquals("call {:async} y := P(a);", BoogieFilePrinter.toString(async));
		Cmd forall = CALL_FORALL("Q", Arrays.<Expr>asList(VAR("a"), null));
		assertEquals("call forall Q(a, *);", BoogieFilePrinter.toString(forall));
	}

	@Test
	public void test_declarations() {
		Decl.Variable x = VARIABLE("x", Type.Int, GTEQ(VAR("x"), CONST(0)));
		Decl.Procedure id = new Decl.Procedure("Id", Arrays.asList("T"),
				Arrays.asList(VARIABLE("v", new Type.Variable("T"))),
				Arrays.asList(VARIABLE("w", new Type.Dictionary(Type.Int, new Type.Variable("T")))),
				Collections.<Expr.Logical>emptyList(), Collections.<Expr.Logical>emptyList(),
				Collections.<Expr.Logical>emptyList(), Collections.<Expr.Logical>emptyList(),
				Collections.<String>emptyList());
		String text = print(new BoogieFile(Arrays.<Decl>asList(x, P, id)), false);
		assertEquals(lines(
				"var x : int where x >= 0;",
				"procedure P(x : int) returns (r : int);",
				"   requires x > 0;",
				"   modifies g;",
				"   ensures r == (old(g) + x);",
				"   free ensures g >= 0;",
				"procedure Id<T>(v : T) returns (w : [int]T);"), text);
	}

	@Test
	public void test_other_declarations() {
		Decl.Function f = new Decl.Function("f", Arrays.asList(new Decl.Parameter("x", Type.Int)), Type.Bool,
				GT(VAR("x"), CONST(0)));
		Decl.Function h = new Decl.Function("h", Arrays.asList(new Decl.Parameter("x", Type.Int)), Type.Int, null);
		BoogieFile file = new BoogieFile(Arrays.<Decl>asList(new Decl.LineComment("globals"),
				new Decl.Constant(true, "c", new Type.BitVector(32)), new Decl.Constant(false, "r", Type.Real),
				new Decl.Constant(false, "s", new Type.Synonym("Ref")), f, h,
				new Decl.Axiom(INVOKE("f", CONST(1)))));
		assertEquals(lines(
				"// globals",
				"const unique c : bv32;",
				"const r : real;",
				"const s : Ref;",
				"function f(x : int) returns (bool) {",
				"   x > 0",
				"}",
				"function h(x : int) returns (int);",
				"axiom f(1);"), print(file, false));
	}

	@Test
	public void test_comment_and_state() {
		assertEquals("// note", BoogieFilePrinter.toString(COMMENT("note")));
		Cmd state = STATE(Arrays.asList(VARIABLE("t", Type.Int)), Arrays.<Cmd>asList(HAVOC(VAR("t"))));
		assertEquals("{\n   var t : int;\n   havoc t;\n}", BoogieFilePrinter.toString(state));
	}

	@Test
	public void test_structured_and_lowered_implementation() {
		Decl.Implementation impl = implementation();
		assertEquals(lines(
				"implementation main()",
				"{",
				"   var a : int;",
				"",
				"   while (a < 10)",
				"      invariant a >= 0;",
				"   {",
				"   L:",
				"      a := a + 1;",
				"      if (*) {",
				"         break;",
				"      }",
				"   }",
				"}",
				""), print(impl));
		BoogieFile lowered = new LoweringTask().run(new BoogieFile(Arrays.<Decl>asList(impl)));
		assertEquals(lines(
				"implementation main()",
				"{",
				"   var a : int;",
				"",
				"anon0:",
				"   goto anon2_LoopHead;",
				"",
				"anon2_LoopHead:",
				"   assert a >= 0;",
				"   goto anon2_LoopDone, anon2_LoopBody;",
				"",
				"anon2_LoopBody:",
				"   assume a < 10;",
				"   goto L;",
				"",
				"L:",
				"   a := a + 1;",
				"   goto anon3_Then, anon3_Else;",
				"",
				"anon3_Then:",
				"   return;",
				"",
				"anon3_Else:",
				"   goto anon2_LoopHead;",
				"",
				"anon2_LoopDone:",
				"   assume !(a < 10);",
				"   return;",
				"}",
				""), print(lowered.getDeclarations().get(0)));
	}

	@Test
	public void test_print_desugarings() {
		Decl.Implementation impl = new Decl.Implementation("main", Collections.<Decl.Variable>emptyList(),
				Collections.<Decl.Variable>emptyList(), Arrays.asList(VARIABLE("y", Type.Int)),
				new StmtListBuilder().add(CALL("P", Arrays.asList(VAR("y")), Arrays.<Expr>asList(CONST(1))))
						.collect());
		ErrorHandler.Default handler = new ErrorHandler.Default();
		BoogieFile lowered = new LoweringTask().setErrorHandler(handler)
				.run(new BoogieFile(Arrays.<Decl>asList(G, P, impl)));
		assertEquals(0, handler.getErrorCount());
		String text = print(new BoogieFile(Arrays.<Decl>asList(lowered.getDeclarations().get(2))), true);
		assertTrue(text.contains("   call y := P(1);\n   /*** desugaring:\n   {\n"));
		assertTrue(text.contains("      havoc g, "));
		assertTrue(text.contains("   }\n   **** end desugaring */\n   return;\n"));
	}

	@Test
	public void test_mapping() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		BoogieFilePrinter printer = new BoogieFilePrinter(out);
		printer.write(new BoogieFile(Arrays.<Decl>asList(G, P)));
		assertSame(G, printer.getMapping().get(1, 0));
		assertSame(P, printer.getMapping().get(2, 0));
		assertSame(P.getRequires().get(0), printer.getMapping().get(3, 3));
	}

	/**
	 * <pre>
	 * while (a &lt; 10) invariant a &gt;= 0; { L: a := a + 1; if (*) { break; } }
	 * </pre>
	 */
	private static Decl.Implementation implementation() {
		StmtList brk = new StmtListBuilder().add(new StructuredCmd.Break()).collect();
		StmtList loopBody = new StmtListBuilder().addLabel("L").add(ASSIGN(VAR("a"), ADD(VAR("a"), CONST(1))))
				.add(new StructuredCmd.If(null, brk, null, null)).collect();
		StmtList body = new StmtListBuilder().add(new StructuredCmd.While(LT(VAR("a"), CONST(10)),
				Arrays.<Cmd.Predicate>asList(ASSERT(GTEQ(VAR("a"), CONST(0)))), loopBody)).collect();
		return new Decl.Implementation("main", Collections.<Decl.Variable>emptyList(),
				Collections.<Decl.Variable>emptyList(), Arrays.asList(VARIABLE("a", Type.Int)), body);
	}

	private static String print(Decl d) {
		return print(new BoogieFile(Arrays.asList(d)), false);
	}

	private static String print(BoogieFile file, boolean desugarings) {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		new BoogieFilePrinter(out).setPrintDesugarings(desugarings).write(file);
		return new String(out.toByteArray(), StandardCharsets.UTF_8).replace(System.lineSeparator(), "\n");
	}

	private static String lines(String... lines) {
		return String.join("\n", lines) + "\n";
	}
}
