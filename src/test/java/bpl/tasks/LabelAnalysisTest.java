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

import static bpl.core.BoogieFile.ASSIGN;
import static bpl.core.BoogieFile.CONST;
import static bpl.core.BoogieFile.VAR;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Collections;

import org.junit.Test;

import bpl.core.BigBlock;
import bpl.core.BoogieFile.Cmd;
import bpl.core.StmtList;
import bpl.core.StmtListBuilder;
import bpl.core.StructuredCmd;
import bpl.core.TransferCmd;
import bpl.util.ErrorHandler;
import bpl.util.ErrorMessages;
import bpl.util.SyntaxError;

public class LabelAnalysisTest {

	@Test
	public void test_goto_into_nested_list() {
		StmtList inner = new StmtListBuilder().addLabel("inner").add(ASSIGN(VAR("x"), CONST(1))).collect();
		TransferCmd.Goto g = new TransferCmd.Goto("inner");
		StmtList body = new StmtListBuilder().add(new StructuredCmd.If(VAR("b"), inner, null, null)).add(g)
				.collect();
		SyntaxError err = analyseExpectingError(body);
		assertEquals(ErrorMessages.UNDEFINED_OR_OUT_OF_REACH_LABEL, err.getErrorCode());
		assertEquals("goto label 'inner' is undefined or out of reach", err.getMessage());
		assertSame(g, err.getElement());
	}

	@Test
	public void test_goto_to_enclosing_list() {
		StmtList inner = new StmtListBuilder().add(new TransferCmd.Goto("outer")).collect();
		StmtList body = new StmtListBuilder().add(new StructuredCmd.If(VAR("b"), inner, null, null))
				.addLabel("outer").add(ASSIGN(VAR("x"), CONST(1))).collect();
		assertTrue(analyse(body, new ErrorHandler.Default()));
	}

	@Test
	public void test_goto_undefined_label() {
		StmtList body = new StmtListBuilder().add(new TransferCmd.Goto("nowhere")).collect();
		assertEquals(ErrorMessages.UNDEFINED_OR_OUT_OF_REACH_LABEL, analyseExpectingError(body).getErrorCode());
	}

	@Test
	public void test_duplicate_label() {
		StmtList body = new StmtListBuilder().addLabel("L").add(ASSIGN(VAR("x"), CONST(0))).addLabel("L")
				.add(ASSIGN(VAR("x"), CONST(1))).collect();
		SyntaxError err = analyseExpectingError(body);
		assertEquals(ErrorMessages.DUPLICATE_LABEL, err.getErrorCode());
		assertEquals("label 'L' is declared more than once", err.getMessage());
		assertSame(body.getBigBlocks().get(1), err.getElement());
	}

	@Test
	public void test_duplicate_label_in_nested_list() {
		StmtList inner = new StmtListBuilder().addLabel("L").add(ASSIGN(VAR("x"), CONST(1))).collect();
		StmtList body = new StmtListBuilder().addLabel("L").add(new StructuredCmd.If(VAR("b"), inner, null, null))
				.collect();
		assertEquals(ErrorMessages.DUPLICATE_LABEL, analyseExpectingError(body).getErrorCode());
	}

	@Test
	public void test_break_outside_loop() {
		StmtList body = new StmtListBuilder().add(new StructuredCmd.Break()).collect();
		SyntaxError err = analyseExpectingError(body);
		assertEquals(ErrorMessages.BREAK_OUTSIDE_LOOP, err.getErrorCode());
		assertEquals("break statement is not inside a loop", err.getMessage());
	}

	@Test
	public void test_unlabelled_break_inside_if_only() {
		StmtList brk = new StmtListBuilder().add(new StructuredCmd.Break()).collect();
		StmtList body = new StmtListBuilder().add(new StructuredCmd.If(VAR("b"), brk, null, null)).collect();
		assertEquals(ErrorMessages.BREAK_OUTSIDE_LOOP, analyseExpectingError(body).getErrorCode());
	}

	@Test
	public void test_break_label_undefined() {
		StmtList brk = new StmtListBuilder().add(new StructuredCmd.Break("L")).collect();
		StmtList body = new StmtListBuilder()
				.add(new StructuredCmd.While(null, Collections.<Cmd.Predicate>emptyList(), brk)).collect();
		SyntaxError err = analyseExpectingError(body);
		assertEquals(ErrorMessages.BREAK_LABEL_UNDEFINED, err.getErrorCode());
		assertEquals("break label 'L' must designate an enclosing statement", err.getMessage());
	}

	@Test
	public void test_break_label_names_simple_command() {
		// L: x := 1; if (b) { break L; }
		StmtList brk = new StmtListBuilder().add(new StructuredCmd.Break("L")).collect();
		StmtList body = new StmtListBuilder().addLabel("L").add(ASSIGN(VAR("x"), CONST(1)))
				.add(new StructuredCmd.If(VAR("b"), brk, null, null)).collect();
		assertEquals(ErrorMessages.BREAK_TARGET_INVALID, analyseExpectingError(body).getErrorCode());
	}

	@Test
	public void test_nearest_loop_is_break_target() {
		StructuredCmd.Break brk = new StructuredCmd.Break();
		StmtList innerBody = new StmtListBuilder().add(brk).collect();
		StmtList outerBody = new StmtListBuilder()
				.add(new StructuredCmd.While(null, Collections.<Cmd.Predicate>emptyList(), innerBody)).collect();
		StmtList body = new StmtListBuilder()
				.add(new StructuredCmd.While(null, Collections.<Cmd.Predicate>emptyList(), outerBody)).collect();
		assertTrue(analyse(body, new ErrorHandler.Default()));
		assertSame(outerBody.getFirst(), brk.getBreakEnclosure());
	}

	@Test
	public void test_labelled_break_skips_inner_loop() {
		StructuredCmd.Break brk = new StructuredCmd.Break("outer");
		StmtList innerBody = new StmtListBuilder().add(brk).collect();
		StmtList outerBody = new StmtListBuilder()
				.add(new StructuredCmd.While(null, Collections.<Cmd.Predicate>emptyList(), innerBody)).collect();
		StmtList body = new StmtListBuilder().addLabel("outer")
				.add(new StructuredCmd.While(null, Collections.<Cmd.Predicate>emptyList(), outerBody)).collect();
		assertTrue(analyse(body, new ErrorHandler.Default()));
		assertSame(body.getFirst(), brk.getBreakEnclosure());
	}

	@Test
	public void test_anonymous_blocks_named() {
		StmtList thn = new StmtListBuilder().add(ASSIGN(VAR("x"), CONST(1))).collect();
		StmtList body = new StmtListBuilder().add(new StructuredCmd.If(VAR("b"), thn, null, null)).addLabel("L")
				.add(ASSIGN(VAR("y"), CONST(1))).collect();
		assertTrue(analyse(body, new ErrorHandler.Default()));
		BigBlock first = body.getFirst();
		assertEquals("anon0", first.getLabel());
		assertTrue(first.isAnonymous());
		assertEquals("anon1", thn.getFirst().getLabel());
		assertEquals("L", body.getLast().getLabel());
		assertFalse(body.getLast().isAnonymous());
	}

	@Test
	public void test_successors_recorded() {
		StmtList thn = new StmtListBuilder().add(ASSIGN(VAR("x"), CONST(1))).collect();
		StmtList body = new StmtListBuilder().add(new StructuredCmd.If(VAR("b"), thn, null, null))
				.add(ASSIGN(VAR("y"), CONST(1))).collect();
		assertTrue(analyse(body, new ErrorHandler.Default()));
		assertSame(body.getLast(), body.getFirst().getSuccessor());
		assertNull(body.getLast().getSuccessor());
		// the end of a branch continues after the conditional
		assertSame(body.getLast(), thn.getLast().getSuccessor());
	}

	@Test
	public void test_parents_linked() {
		StmtList thn = new StmtListBuilder().add(ASSIGN(VAR("x"), CONST(1))).collect();
		StmtList body = new StmtListBuilder().addLabel("L").add(new StructuredCmd.If(VAR("b"), thn, null, null))
				.collect();
		assertTrue(analyse(body, new ErrorHandler.Default()));
		assertNull(body.getParentContext());
		assertNull(body.getParentBigBlock());
		assertSame(body, thn.getParentContext());
		assertSame(body.getFirst(), thn.getParentBigBlock());
		assertEquals(Collections.singleton("L"), body.getLabels());
	}

	@Test(expected = IllegalStateException.class)
	public void test_analysis_cannot_run_twice() {
		StmtList body = new StmtListBuilder().add(ASSIGN(VAR("x"), CONST(1))).collect();
		analyse(body, new ErrorHandler.Default());
		analyse(body, new ErrorHandler.Default());
	}

	private static boolean analyse(StmtList body, ErrorHandler handler) {
		return new LabelAnalysis(new NamingContext(), handler).apply(body);
	}

	private static SyntaxError analyseExpectingError(StmtList body) {
		ErrorHandler.Default handler = new ErrorHandler.Default();
		assertFalse(analyse(body, handler));
		assertEquals(1, handler.getErrorCount());
		return handler.getErrors().get(0);
	}
}
