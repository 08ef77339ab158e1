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

import java.util.List;

import com.google.common.flogger.GoogleLogger;

import bpl.core.Block;
import bpl.core.StmtList;
import bpl.util.ErrorHandler;

/**
 * Lowers one structured body into basic blocks. Label analysis runs first
 * and, only if it reports no errors, are blocks generated. The result is
 * computed once; subsequent requests return the same blocks.
 *
 * @author David J. Pearce
 *
 */
public class StructuredLowering {
	private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

	private final String name;
	private final StmtList body;
	private final String labelPrefix;
	private final ErrorHandler handler;
	private boolean done;
	private List<Block> blocks;

	public StructuredLowering(String name, StmtList body, String labelPrefix, ErrorHandler handler) {
		this.name = name;
		this.body = body;
		this.labelPrefix = labelPrefix;
		this.handler = handler;
	}

	public StructuredLowering(StmtList body, ErrorHandler handler) {
		this("<anonymous>", body, NamingContext.DEFAULT_PREFIX, handler);
	}

	/**
	 * Get the blocks for this body, or <code>null</code> if label analysis
	 * reported errors.
	 *
	 * @return
	 */
	public List<Block> getBlocks() {
		if (!done) {
			done = true;
			blocks = lower();
		}
		return blocks;
	}

	private List<Block> lower() {
		NamingContext naming = new NamingContext(labelPrefix);
		LabelAnalysis analysis = new LabelAnalysis(naming, handler);
		if (!analysis.apply(body)) {
			logger.atWarning().log("lowering of %s aborted due to label errors", name);
			return null;
		}
		List<Block> result = new CfgBuilder(naming).build(body);
		logger.atFine().log("lowered %s into %d blocks", name, result.size());
		return result;
	}
}
