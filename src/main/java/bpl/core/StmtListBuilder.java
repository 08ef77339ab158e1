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
import java.util.List;

import bpl.core.BoogieFile.Cmd;

/**
 * Incrementally constructs a {@link StmtList} in the order statements appear
 * in the source. Simple commands accumulate into the current big block,
 * which is closed off by a structured command, a transfer command or a new
 * label.
 *
 * @author David J. Pearce
 *
 */
public class StmtListBuilder {
	private final List<BigBlock> bigBlocks = new ArrayList<>();
	private String label;
	private List<Cmd> simpleCmds;

	private void dump(StructuredCmd structuredCmd, TransferCmd transferCmd) {
		if (label != null || simpleCmds != null || structuredCmd != null || transferCmd != null) {
			List<Cmd> cmds = simpleCmds == null ? new ArrayList<>() : simpleCmds;
			bigBlocks.add(new BigBlock(label, cmds, structuredCmd, transferCmd));
			label = null;
			simpleCmds = null;
		}
	}

	/**
	 * Collects the StmtList built so far and returns it. The StmtListBuilder
	 * should no longer be used once this method has been invoked.
	 *
	 * @return
	 */
	public StmtList collect() {
		dump(null, null);
		if (bigBlocks.isEmpty()) {
			// an empty body still needs somewhere for control to go
			bigBlocks.add(new BigBlock(null, new ArrayList<>(), null, null));
		}
		return new StmtList(bigBlocks);
	}

	public StmtListBuilder add(Cmd cmd) {
		if (simpleCmds == null) {
			simpleCmds = new ArrayList<>();
		}
		simpleCmds.add(cmd);
		return this;
	}

	public StmtListBuilder add(StructuredCmd scmd) {
		dump(scmd, null);
		return this;
	}

	public StmtListBuilder add(TransferCmd tcmd) {
		dump(null, tcmd);
		return this;
	}

	public StmtListBuilder addLabel(String label) {
		dump(null, null);
		this.label = label;
		return this;
	}
}
