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

import java.util.HashSet;
import java.util.Set;

import com.google.common.flogger.GoogleLogger;

import bpl.core.BigBlock;
import bpl.core.StmtList;
import bpl.core.StructuredCmd;
import bpl.core.TransferCmd;
import bpl.util.ErrorHandler;
import bpl.util.ErrorMessages;

/**
 * Prepares a structured body for lowering. This checks that every
 * <code>goto</code> and <code>break</code> refers to something it can
 * legally reach, chooses a label prefix which cannot clash with any declared
 * label, names all anonymous big blocks and, finally, links each big block to
 * its textual successor.
 *
 * @author David J. Pearce
 *
 */
public class LabelAnalysis {
	private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

	private final NamingContext naming;
	private final ErrorHandler handler;
	// every label declared anywhere in the body
	private final Set<String> declared = new HashSet<>();

	public LabelAnalysis(NamingContext naming, ErrorHandler handler) {
		this.naming = naming;
		this.handler = handler;
	}

	/**
	 * Run all analyses over the outermost statement list of a body.
	 *
	 * @param body
	 * @return <code>true</code> if no errors were reported.
	 */
	public boolean apply(StmtList body) {
		int startErrorCount = handler.getErrorCount();
		checkLegalLabels(body, null, null);
		nameAnonymousBlocks(body);
		recordSuccessors(body, null);
		logger.atFine().log("label prefix \"%s\" chosen, %d names used", naming.getPrefix(), naming.getCounter());
		return handler.getErrorCount() == startErrorCount;
	}

	public void checkLegalLabels(StmtList stmtList, StmtList parentContext, BigBlock parentBigBlock) {
		stmtList.setParent(parentContext, parentBigBlock);
		// Record labels declared here
		for (BigBlock b : stmtList.getBigBlocks()) {
			if (!b.isAnonymous()) {
				if (!declared.add(b.getLabel())) {
					handler.report(ErrorMessages.syntaxError(b, ErrorMessages.DUPLICATE_LABEL, b.getLabel()));
				}
				naming.reserve(b.getLabel());
				stmtList.declareLabel(b.getLabel());
			}
		}
		// Check nested labels
		for (BigBlock b : stmtList.getBigBlocks()) {
			if (b.getTransferCmd() instanceof TransferCmd.Goto) {
				checkGoto(stmtList, (TransferCmd.Goto) b.getTransferCmd());
			} else if (b.getStructuredCmd() instanceof StructuredCmd.Break) {
				checkBreak(stmtList, (StructuredCmd.Break) b.getStructuredCmd());
			} else if (b.getStructuredCmd() instanceof StructuredCmd.While) {
				StructuredCmd.While w = (StructuredCmd.While) b.getStructuredCmd();
				checkLegalLabels(w.getBody(), stmtList, b);
			} else if (b.getStructuredCmd() instanceof StructuredCmd.If) {
				for (StructuredCmd.If i = (StructuredCmd.If) b.getStructuredCmd(); i != null; i = i.getElseIf()) {
					checkLegalLabels(i.getThen(), stmtList, b);
					if (i.getElse() != null) {
						checkLegalLabels(i.getElse(), stmtList, b);
					}
				}
			}
		}
	}

	private void checkGoto(StmtList stmtList, TransferCmd.Goto g) {
		for (String label : g.getLabels()) {
			boolean found = false;
			for (StmtList sl = stmtList; sl != null && !found; sl = sl.getParentContext()) {
				found = sl.getLabels().contains(label);
			}
			if (!found) {
				handler.report(ErrorMessages.syntaxError(g, ErrorMessages.UNDEFINED_OR_OUT_OF_REACH_LABEL, label));
			}
		}
	}

	private void checkBreak(StmtList stmtList, StructuredCmd.Break brk) {
		String label = brk.getLabel();
		for (StmtList sl = stmtList; sl.getParentBigBlock() != null; sl = sl.getParentContext()) {
			BigBlock bb = sl.getParentBigBlock();
			if (label == null) {
				if (bb.getStructuredCmd() instanceof StructuredCmd.While) {
					brk.setBreakEnclosure(bb);
					return;
				}
			} else if (label.equals(bb.getLabel())) {
				// The first match ends the search, even when it is not a valid target
				if (bb.getSimpleCmds().isEmpty()) {
					brk.setBreakEnclosure(bb);
				} else {
					// label names the leading simple command, not the compound statement
					handler.report(ErrorMessages.syntaxError(brk, ErrorMessages.BREAK_TARGET_INVALID, label));
				}
				return;
			}
		}
		if (label == null) {
			handler.report(ErrorMessages.syntaxError(brk, ErrorMessages.BREAK_OUTSIDE_LOOP));
		} else {
			handler.report(ErrorMessages.syntaxError(brk, ErrorMessages.BREAK_LABEL_UNDEFINED, label));
		}
	}

	public void nameAnonymousBlocks(StmtList stmtList) {
		for (BigBlock b : stmtList.getBigBlocks()) {
			if (b.getLabel() == null) {
				b.assignName(naming.fresh());
			}
			if (b.getStructuredCmd() instanceof StructuredCmd.While) {
				nameAnonymousBlocks(((StructuredCmd.While) b.getStructuredCmd()).getBody());
			} else if (b.getStructuredCmd() instanceof StructuredCmd.If) {
				for (StructuredCmd.If i = (StructuredCmd.If) b.getStructuredCmd(); i != null; i = i.getElseIf()) {
					nameAnonymousBlocks(i.getThen());
					if (i.getElse() != null) {
						nameAnonymousBlocks(i.getElse());
					}
				}
			}
		}
	}

	/**
	 * Link each big block to the one which follows it. The last block in a list
	 * is linked to whatever follows the enclosing statement.
	 *
	 * @param stmtList
	 * @param successor
	 */
	public void recordSuccessors(StmtList stmtList, BigBlock successor) {
		for (int i = stmtList.getBigBlocks().size() - 1; i >= 0; --i) {
			BigBlock b = stmtList.getBigBlocks().get(i);
			b.setSuccessor(successor);
			if (b.getStructuredCmd() instanceof StructuredCmd.While) {
				recordSuccessors(((StructuredCmd.While) b.getStructuredCmd()).getBody(), successor);
			} else if (b.getStructuredCmd() instanceof StructuredCmd.If) {
				for (StructuredCmd.If c = (StructuredCmd.If) b.getStructuredCmd(); c != null; c = c.getElseIf()) {
					recordSuccessors(c.getThen(), successor);
					if (c.getElse() != null) {
						recordSuccessors(c.getElse(), successor);
					}
				}
			}
			successor = b;
		}
	}
}
