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

import com.google.common.base.Preconditions;

import bpl.core.BoogieFile.Cmd;

/**
 * A basic block in the control-flow graph of a lowered implementation. Every
 * block has a label, a sequence of simple commands and exactly one transfer
 * command.
 *
 * @author David J. Pearce
 *
 */
public class Block {
	private final String label;
	private final List<Cmd> cmds;
	private final TransferCmd transfer;

	public Block(String label, List<Cmd> cmds, TransferCmd transfer) {
		this.label = Preconditions.checkNotNull(label);
		this.cmds = Collections.unmodifiableList(new ArrayList<>(cmds));
		this.transfer = Preconditions.checkNotNull(transfer);
	}

	public String getLabel() {
		return label;
	}

	public List<Cmd> getCmds() {
		return cmds;
	}

	public TransferCmd getTransferCmd() {
		return transfer;
	}

	@Override
	public String toString() {
		return label + ": " + cmds.size() + " cmds; " + transfer;
	}
}
