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

import static bpl.core.BoogieFile.CALL;
import static bpl.core.BoogieFile.CALL_FORALL;
import static bpl.core.BoogieFile.VAR;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.junit.Test;

import bpl.core.BoogieFile.Cmd;
import bpl.core.BoogieFile.Decl;
import bpl.core.BoogieFile.Expr;
import bpl.core.BoogieFile.Type;
import bpl.io.BoogieFilePrinter;
import bpl.util.ErrorHandler;

public class CallDesugarerTest {

	@Test
	public void test_desugar_call() {
		Cmd.Call call = resolve(CALL("P", Arrays.asList(VAR("y")), Arrays.<Expr>asList(VAR("a"))));
		String c = "call" + call.getUniqueId();
		Cmd.State state = CallDesugarer.getDesugaring(call);
		assertEquals(Arrays.asList(c + "formal@x", c + "old@g", c + "formal@r"), names(state.getLocals()));
		assertEquals(Arrays.asList(
				c + "formal@x := a;",
				"assert " + c + "formal@x > 0;",
				c + "old@g := g;",
				"havoc g, " + c + "formal@r;",
				"assume " + c + "formal@r == (" + c + "old@g + " + c + "formal@x);",
				"assume g >= 0;",
				"y := " + c + "formal@r;"), cmds(state));
	}

	@Test
	public void test_requires_checked_against_call() {
		Cmd.Call call = resolve(CALL("P", Arrays.asList(VAR("y")), Arrays.<Expr>asList(VAR("a"))));
		Cmd cmd = CallDesugarer.getDesugaring(call).getCmds().get(1);
		assertTrue(cmd instanceof Cmd.AssertRequires);
		Cmd.AssertRequires ar = (Cmd.AssertRequires) cmd;
		assertSame(call, ar.getCall());
		assertSame(CallFixtures.P.getRequires().get(0), ar.getRequires());
	}

	@Test
	public void test_desugaring_memoised() {
		Cmd.Call call = resolve(CALL("P", Arrays.asList(VAR("y")), Arrays.<Expr>asList(VAR("a"))));
		assertSame(CallDesugarer.getDesugaring(call), CallDesugarer.getDesugaring(call));
		assertTrue(call.isDesugared());
	}

	@Test
	public void test_wildcard_argument() {
		Cmd.Call call = resolve(CALL("P", Arrays.asList(VAR("y")), Arrays.asList((Expr) null)));
		String c = "call" + call.getUniqueId();
		Cmd.State state = CallDesugarer.getDesugaring(call);
		List<String> cmds = cmds(state);
		assertEquals(8, cmds.size());
		assertEquals("havoc " + c + "formal@x;", cmds.get(0));
		assertEquals("assert (exists " + c + "forall@x : int :: " + c + "forall@x > 0);", cmds.get(1));
		assertEquals("assume " + c + "formal@x > 0;", cmds.get(2));
		// bound variables are not locals of the state
		assertEquals(Arrays.asList(c + "formal@x", c + "old@g", c + "formal@r"), names(state.getLocals()));
	}

	@Test
	public void test_wildcard_result_discarded() {
		Cmd.Call call = resolve(CALL("P", Arrays.asList((Expr.VariableAccess) null), Arrays.<Expr>asList(VAR("a"))));
		List<String> cmds = cmds(CallDesugarer.getDesugaring(call));
		// no final assignment
		assertEquals(6, cmds.size());
		assertTrue(cmds.get(5).startsWith("assume g >= 0"));
	}

	@Test
	public void test_no_frame_still_havocs_results() {
		Cmd.Call call = resolve(CALL("R", Arrays.asList(VAR("y")), Arrays.<Expr>asList(VAR("a"))));
		String c = "call" + call.getUniqueId();
		assertEquals(Arrays.asList(
				c + "formal@x := a;",
				"havoc " + c + "formal@z;",
				"assume " + c + "formal@z > " + c + "formal@x;",
				"y := " + c + "formal@z;"), cmds(CallDesugarer.getDesugaring(call)));
	}

	@Test
	public void test_instantiated_temporaries() {
		Cmd.Call call = resolve(CALL("Id", Arrays.asList(VAR("y")), Arrays.<Expr>asList(VAR("a"))));
		Cmd.State state = CallDesugarer.getDesugaring(call);
		assertEquals(2, state.getLocals().size());
		assertEquals(Type.Int, state.getLocals().get(0).getType());
		assertEquals(Type.Int, state.getLocals().get(1).getType());
	}

	@Test
	public void test_call_forall_with_wildcard() {
		Cmd.CallForall call = resolve(CALL_FORALL("Q", Arrays.<Expr>asList(VAR("a"), null)));
		String c = "call" + call.getUniqueId();
		Cmd.State state = CallDesugarer.getDesugaring(call);
		assertTrue(state.getLocals().isEmpty());
		assertEquals(Arrays.asList("assume (forall " + c + "forall@y : int :: (a < " + c + "forall@y) ==> ((a + 1) <= "
				+ c + "forall@y));"), cmds(state));
	}

	@Test
	public void test_call_forall_with_results() {
		Cmd.CallForall call = resolve(CALL_FORALL("R", Arrays.asList((Expr) null)));
		String c = "call" + call.getUniqueId();
		assertEquals(Arrays.asList("assume (forall " + c + "forall@x : int :: (exists " + c + "forall@z : int :: " + c
				+ "forall@z > " + c + "forall@x));"), cmds(CallDesugarer.getDesugaring(call)));
	}

	@Test
	public void test_call_forall_without_wildcards() {
		Cmd.CallForall call = resolve(CALL_FORALL("Q", Arrays.<Expr>asList(VAR("a"), VAR("y"))));
		assertEquals(Arrays.asList("assume (a < y) ==> ((a + 1) <= y);"), cmds(CallDesugarer.getDesugaring(call)));
	}

	@Test
	public void test_desugaring_cached_across_desugarers() {
		Cmd.Call call = resolve(CALL("R", Arrays.asList(VAR("y")), Arrays.<Expr>asList(VAR("a"))));
		Cmd.State first = CallDesugarer.getDesugaring(call);
		assertSame(first, call.getDesugaring(new CallDesugarer()));
	}

	@Test
	public void test_global_modified_twice() {
		Cmd.Call call = resolve(CALL("Twice", Collections.<Expr>emptyList()));
		String c = "call" + call.getUniqueId();
		assertEquals(Arrays.asList(c + "old@g := g;", "havoc g;"), cmds(CallDesugarer.getDesugaring(call)));
		assertEquals(Arrays.asList(c + "old@g"), names(CallDesugarer.getDesugaring(call).getLocals()));
	}

	@Test
	public void test_call_forall_argument_not_captured() {
		// The argument y must stay free; the callee's own y is renamed apart
		Cmd.CallForall call = resolve(CALL_FORALL("S", Arrays.<Expr>asList(VAR("y"))));
		assertEquals(Arrays.asList("assume (forall y#0 : int :: y <= y#0) ==> (y > 0);"),
				cmds(CallDesugarer.getDesugaring(call)));
	}

	@Test
	public void test_call_argument_not_captured() {
		Cmd.Call call = resolve(CALL("S", Arrays.<Expr>asList(VAR("y"))));
		String c = "call" + call.getUniqueId();
		List<String> cmds = cmds(CallDesugarer.getDesugaring(call));
		assertEquals(c + "formal@x := y;", cmds.get(0));
		assertEquals("assert (forall y : int :: " + c + "formal@x <= y);", cmds.get(1));
	}

	@Test(expected = IllegalStateException.class)
	public void test_unresolved_call_cannot_desugar() {
		CallDesugarer.getDesugaring(CALL("P", Arrays.asList(VAR("y")), Arrays.<Expr>asList(VAR("a"))));
	}

	private static <T extends Cmd> T resolve(T cmd) {
		ErrorHandler.Default handler = new ErrorHandler.Default();
		new CallResolver(CallFixtures.context(), handler).resolve(cmd);
		assertEquals(Collections.emptyList(), handler.getErrors());
		return cmd;
	}

	private static List<String> names(List<Decl.Variable> vars) {
		List<String> names = new ArrayList<>();
		for (Decl.Variable v : vars) {
			names.add(v.getName());
		}
		return names;
	}

	private static List<String> cmds(Cmd.State state) {
		List<String> cmds = new ArrayList<>();
		for (Cmd c : state.getCmds()) {
			cmds.add(BoogieFilePrinter.toString(c));
		}
		return cmds;
	}
}
