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
import java.util.List;

import bpl.core.BoogieFile.Cmd;

/**
 * A group of simple commands optionally terminated by either a structured
 * command or a transfer command (but not both). A big block without a label
 * is <i>anonymous</i>; it is given a synthetic name during label analysis but
 * remains anonymous in the sense that no <code>goto</code> can refer to it.
 *
 * @author David J. Pearce
 *
 */
public class BigBlock {
	private String label;
	private final boolean anonymous;
	private final List<Cmd> simpleCmds;
	private final StructuredCmd structuredCmd;
	private final TransferCmd transferCmd;
	private BigBlock successor;

	public BigBlock(String label, List<Cmd> simpleCmds, StructuredCmd structuredCmd, TransferCmd transferCmd) {
		if (structuredCmd != null && transferCmd != null) {
			throw new IllegalArgumentException("A big block cannot have both a structured and a transfer command");
		}
		this.label = label;
		this.anonymous = (label == null);
		this.simpleCmds = Collections.unmodifiableList(new ArrayList<>(simpleCmds));
		this.structuredCmd = structuredCmd;
		this.transferCmd = transferCmd;
	}

	public String getLabel() {
		return label;
	}

	void setLabel(String label) {
		this.label = label;
	}

	/**
	 * Give this block a synthetic name. This applies only to blocks which don't
	 * already have one.
	 *
	 * @param label
	 */
	public void assignName(String label) {
		if (this.label != null) {
			throw new IllegalStateException("big block already named " + this.label);
		}
		this.label = label;
	}

	public boolean isAnonymous() {
		return anonymous;
	}

	public List<Cmd> getSimpleCmds() {
		return simpleCmds;
	}

	public StructuredCmd getStructuredCmd() {
		return structuredCmd;
	}

	public TransferCmd getTransferCmd() {
		return transferCmd;
	}

	/**
	 * Get the big block which textually follows this one, or <code>null</code>
	 * if control leaves the body after this block.
	 *
	 * @return
	 */
	public BigBlock getSuccessor() {
		return successor;
	}

	public void setSuccessor(BigBlock successor) {
		this.successor = successor;
	}

	@Override
	public String toString() {
		return "BigBlock(" + label + ")";
	}
}
