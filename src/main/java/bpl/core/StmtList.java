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
package bpl.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import com.google.common.base.Preconditions;

import bpl.core.BoogieFile.Cmd;

/**
 * One compound-statement body (i.e. <code>{ ... }</code>) of a structured
 * implementation. A statement list is a non-empty sequence of
 * {@link BigBlock}s. Once label analysis has run, every list knows the list
 * and big block enclosing it, and the set of labels declared directly within
 * it.
 *
 * @author David J. Pearce
 *
 */
public class StmtList {
	private final List<BigBlock> bigBlocks;
	private final Set<String> labels;
	private StmtList parentContext;
	private BigBlock parentBigBlock;
	private boolean linked;
	/**
	 * Commands to be placed at the start of the first block emitted for this
	 * list. This can be set at most once.
	 */
	private List<Cmd> prefixCommands;

	public StmtList(List<BigBlock> bigBlocks) {
		if (bigBlocks.isEmpty()) {
			throw new IllegalArgumentException("A statement list requires at least one big block");
		}
		this.bigBlocks = Collections.unmodifiableList(new ArrayList<>(bigBlocks));
		this.labels = new LinkedHashSet<>();
	}

	public List<BigBlock> getBigBlocks() {
		return bigBlocks;
	}

	public BigBlock getFirst() {
		return bigBlocks.get(0);
	}

	public BigBlock getLast() {
		return bigBlocks.get(bigBlocks.size() - 1);
	}

	/**
	 * Get the labels declared directly in this list (i.e. not including those of
	 * nested lists).
	 *
	 * @return
	 */
	public Set<String> getLabels() {
		return Collections.unmodifiableSet(labels);
	}

	public void declareLabel(String label) {
		labels.add(label);
	}

	public StmtList getParentContext() {
		return parentContext;
	}

	public BigBlock getParentBigBlock() {
		return parentBigBlock;
	}

	/**
	 * Link this list into its enclosing context. For the outermost list of a body
	 * both arguments are <code>null</code>.
	 *
	 * @param parentContext
	 * @param parentBigBlock
	 */
	public void setParent(StmtList parentContext, BigBlock parentBigBlock) {
		Preconditions.checkState(!linked, "statement list already linked into its context");
		Preconditions.checkArgument((parentContext == null) == (parentBigBlock == null));
		this.parentContext = parentContext;
		this.parentBigBlock = parentBigBlock;
		this.linked = true;
	}

	public List<Cmd> getPrefixCommands() {
		return prefixCommands;
	}

	/**
	 * Attempt to place a given sequence of commands at the start of this list.
	 * This succeeds when there are no commands to place, or when the first big
	 * block is anonymous (hence, it cannot be the target of any
	 * <code>goto</code>). On success, an anonymous first block takes on the
	 * suggested label and the caller should jump to the label of the first big
	 * block. On failure, nothing is changed and the caller must emit its own block
	 * (labelled with the suggestion) containing the commands.
	 *
	 * @param prefix
	 *            Commands to be executed before the first big block.
	 * @param suggestedLabel
	 *            Label to use for the entry of this list.
	 * @return
	 */
	public boolean prefixFirstBlock(List<Cmd> prefix, String suggestedLabel) {
		Preconditions.checkState(prefixCommands == null, "prefix commands already set");
		BigBlock first = getFirst();
		if (prefix.isEmpty()) {
			if (first.isAnonymous()) {
				first.setLabel(suggestedLabel);
			}
			return true;
		} else if (first.isAnonymous()) {
			prefixCommands = Collections.unmodifiableList(new ArrayList<>(prefix));
			first.setLabel(suggestedLabel);
			return true;
		} else {
			return false;
		}
	}
}
