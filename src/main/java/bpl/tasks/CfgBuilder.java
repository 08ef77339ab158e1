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

import static bpl.core.BoogieFile.ASSUME;
import static bpl.core.BoogieFile.NOT;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;

import bpl.core.BigBlock;
import bpl.core.Block;
import bpl.core.BoogieFile.Cmd;
import bpl.core.BoogieFile.Expr;
import bpl.core.StmtList;
import bpl.core.StructuredCmd;
import bpl.core.TransferCmd;
import bpl.util.Util;

/**
 * Lowers a structured body into a flat list of basic blocks. The body must
 * already have been through {@link LabelAnalysis} without error, so that every
 * big block is named, linked to its successor and every <code>break</code>
 * resolved.
 *
 * <p>
 * Loops are lowered as follows, where <code>N</code> is a fresh name:
 * </p>
 *
 * <pre>
 * L: cmds; goto N_LoopHead;
 * N_LoopHead: invariants; goto N_LoopDone, N_LoopBody;
 * N_LoopBody: assume G; goto ...;
 * ... body (falling off the end goes to N_LoopHead) ...
 * N_LoopDone: assume !G; goto ...;
 * </pre>
 *
 * Conditionals are lowered into a block per arm, each assuming the guard (or
 * its negation) before jumping to the arm's body. Wherever possible the
 * assumption is placed into the first block of the body itself, rather than
 * into a separate block.
 *
 * @author David J. Pearce
 *
 */
public class CfgBuilder {
	private final NamingContext naming;
	private final List<Block> blocks = new ArrayList<>();
	/**
	 * Where control goes on leaving each compound statement seen so far, or
	 * <code>null</code> for a return. Breaks jump here.
	 */
	private final Map<BigBlock, String> exits = new HashMap<>();

	public CfgBuilder(NamingContext naming) {
		this.naming = naming;
	}

	/**
	 * Generate the blocks for a body and resolve the targets of every
	 * <code>goto</code> among them.
	 *
	 * @param body
	 * @return
	 */
	public List<Block> build(StmtList body) {
		createBlocks(body, null);
		resolveGotos(blocks);
		return Collections.unmodifiableList(new ArrayList<>(blocks));
	}

	/**
	 * Generate blocks for a statement list.
	 *
	 * @param stmtList
	 * @param runOffTheEndLabel
	 *            If non-null, the last block of this list (when it falls through)
	 *            jumps here rather than to its successor.
	 */
	private void createBlocks(StmtList stmtList, String runOffTheEndLabel) {
		List<Cmd> cmdPrefixToApply = stmtList.getPrefixCommands();
		int n = stmtList.getBigBlocks().size();
		for (BigBlock b : stmtList.getBigBlocks()) {
			n--;
			boolean last = (n == 0);
			List<Cmd> cmds = b.getSimpleCmds();
			if (cmdPrefixToApply != null) {
				cmds = Util.append(cmdPrefixToApply, cmds);
				cmdPrefixToApply = null;
			}
			StructuredCmd sc = b.getStructuredCmd();
			if (b.getTransferCmd() != null) {
				emit(b.getLabel(), cmds, b.getTransferCmd());
			} else if (sc == null) {
				emit(b.getLabel(), cmds, fallThrough(b, last, runOffTheEndLabel));
			} else if (sc instanceof StructuredCmd.Break) {
				BigBlock enclosure = ((StructuredCmd.Break) sc).getBreakEnclosure();
				Preconditions.checkState(enclosure != null && exits.containsKey(enclosure),
						"unresolved break in block %s", b.getLabel());
				emit(b.getLabel(), cmds, gotoOrReturn(exits.get(enclosure)));
			} else if (sc instanceof StructuredCmd.While) {
				exits.put(b, exitLabel(b, last, runOffTheEndLabel));
				createLoopBlocks(b, (StructuredCmd.While) sc, cmds, last, runOffTheEndLabel);
			} else {
				exits.put(b, exitLabel(b, last, runOffTheEndLabel));
				createConditionalBlocks(b, (StructuredCmd.If) sc, cmds, last, runOffTheEndLabel);
			}
		}
	}

	private void createLoopBlocks(BigBlock b, StructuredCmd.While w, List<Cmd> cmds, boolean last,
			String runOffTheEndLabel) {
		String name = naming.fresh();
		String loopHeadLabel = name + "_LoopHead";
		String loopBodyLabel = name + "_LoopBody";
		String loopDoneLabel = name + "_LoopDone";
		List<Cmd> ssBody = new ArrayList<>();
		List<Cmd> ssDone = new ArrayList<>();
		if (w.getGuard() != null) {
			ssBody.add(ASSUME(w.getGuard()));
			ssDone.add(ASSUME(NOT(w.getGuard())));
		}
		StmtList body = w.getBody();
		boolean squeezed = body.prefixFirstBlock(ssBody, loopBodyLabel);
		String bodyEntry = squeezed ? body.getFirst().getLabel() : loopBodyLabel;
		// Entry into the loop
		emit(b.getLabel(), cmds, new TransferCmd.Goto(loopHeadLabel));
		// Loop head (invariants are checked/assumed here)
		emit(loopHeadLabel, new ArrayList<Cmd>(w.getInvariants()), new TransferCmd.Goto(loopDoneLabel, bodyEntry));
		if (!squeezed) {
			emit(loopBodyLabel, ssBody, new TransferCmd.Goto(body.getFirst().getLabel()));
		}
		// The body, whose end leads back to the head
		createBlocks(body, loopHeadLabel);
		// Loop exit
		emit(loopDoneLabel, ssDone, fallThrough(b, last, runOffTheEndLabel));
	}

	private void createConditionalBlocks(BigBlock b, StructuredCmd.If ifcmd, List<Cmd> cmds, boolean last,
			String runOffTheEndLabel) {
		String predLabel = b.getLabel();
		List<Cmd> predCmds = cmds;
		String runOff = last ? runOffTheEndLabel : null;
		for (StructuredCmd.If c = ifcmd; c != null; c = c.getElseIf()) {
			String name = naming.fresh();
			String thenLabel = name + "_Then";
			String elseLabel = name + "_Else";
			List<Cmd> ssThen = new ArrayList<>();
			List<Cmd> ssElse = new ArrayList<>();
			Expr.Logical guard = c.getGuard();
			if (guard != null) {
				ssThen.add(ASSUME(guard));
				ssElse.add(ASSUME(NOT(guard)));
			}
			StmtList thn = c.getThen();
			StmtList els = c.getElse();
			boolean thenSqueezed = thn.prefixFirstBlock(ssThen, thenLabel);
			String thenEntry = thenSqueezed ? thn.getFirst().getLabel() : thenLabel;
			boolean elseSqueezed = false;
			String elseEntry = elseLabel;
			if (els != null) {
				elseSqueezed = els.prefixFirstBlock(ssElse, elseLabel);
				if (elseSqueezed) {
					elseEntry = els.getFirst().getLabel();
				}
			}
			// Dispatch on the guard
			emit(predLabel, predCmds, new TransferCmd.Goto(thenEntry, elseEntry));
			// True branch
			if (!thenSqueezed) {
				emit(thenLabel, ssThen, new TransferCmd.Goto(thn.getFirst().getLabel()));
			}
			createBlocks(thn, runOff);
			// False branch
			if (els != null) {
				if (!elseSqueezed) {
					emit(elseLabel, ssElse, new TransferCmd.Goto(els.getFirst().getLabel()));
				}
				createBlocks(els, runOff);
			} else if (c.getElseIf() != null) {
				// next link in the chain dispatches from the else block
				predLabel = elseLabel;
				predCmds = ssElse;
			} else {
				emit(elseLabel, ssElse, fallThrough(b, last, runOffTheEndLabel));
			}
		}
	}

	private static TransferCmd fallThrough(BigBlock b, boolean last, String runOffTheEndLabel) {
		return gotoOrReturn(exitLabel(b, last, runOffTheEndLabel));
	}

	/**
	 * Determine where control goes after a big block, or <code>null</code> if
	 * the body ends there.
	 */
	private static String exitLabel(BigBlock b, boolean last, String runOffTheEndLabel) {
		if (last && runOffTheEndLabel != null) {
			return runOffTheEndLabel;
		} else if (b.getSuccessor() != null) {
			return b.getSuccessor().getLabel();
		} else {
			return null;
		}
	}

	private static TransferCmd gotoOrReturn(String label) {
		if (label != null) {
			return new TransferCmd.Goto(label);
		} else {
			return new TransferCmd.Return();
		}
	}

	private void emit(String label, List<Cmd> cmds, TransferCmd transfer) {
		blocks.add(new Block(label, cmds, transfer));
	}

	/**
	 * Bind every <code>goto</code> in a list of blocks to the blocks it targets.
	 *
	 * @param blocks
	 */
	public static void resolveGotos(List<Block> blocks) {
		Map<String, Block> labels = new HashMap<>();
		for (Block b : blocks) {
			Block prev = labels.put(b.getLabel(), b);
			Preconditions.checkState(prev == null, "duplicate block label %s", b.getLabel());
		}
		for (Block b : blocks) {
			if (b.getTransferCmd() instanceof TransferCmd.Goto) {
				TransferCmd.Goto g = (TransferCmd.Goto) b.getTransferCmd();
				List<Block> targets = new ArrayList<>();
				for (String label : g.getLabels()) {
					Block target = labels.get(label);
					Preconditions.checkState(target != null, "goto target %s missing from block list", label);
					targets.add(target);
				}
				g.setTargets(targets);
			}
		}
	}
}
