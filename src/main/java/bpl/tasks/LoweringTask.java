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

import java.util.ArrayList;
import java.util.List;

import com.google.common.flogger.GoogleLogger;

import bpl.core.Block;
import bpl.core.BoogieFile;
import bpl.core.BoogieFile.Cmd;
import bpl.core.BoogieFile.Decl;
import bpl.core.TransferCmd;
import bpl.util.ErrorHandler;

/**
 * Lowers every structured implementation in a Boogie file. Calls are resolved
 * against the file's procedures, then each body is turned into basic blocks.
 * The result is a new file in which every successfully lowered implementation
 * carries blocks instead of a structured body. An implementation with errors
 * is copied across unchanged; the error handler records why.
 *
 * @author David J. Pearce
 *
 */
public class LoweringTask {
	private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();
	/**
	 * Specify whether to print verbose progress messages or not
	 */
	private boolean verbose = false;
	/**
	 * Specify whether calls should be replaced by their desugaring in the
	 * generated blocks.
	 */
	private boolean desugarCalls = false;
	/**
	 * Prefix used for synthesised labels (which may be extended to avoid clashes)
	 */
	private String labelPrefix = NamingContext.DEFAULT_PREFIX;
	/**
	 * Destination for any errors encountered.
	 */
	private ErrorHandler handler = new ErrorHandler.Default();

	public LoweringTask setVerbose(boolean flag) {
		this.verbose = flag;
		return this;
	}

	public LoweringTask setDesugarCalls(boolean flag) {
		this.desugarCalls = flag;
		return this;
	}

	public LoweringTask setLabelPrefix(String prefix) {
		if (prefix == null || prefix.isEmpty()) {
			throw new IllegalArgumentException("label prefix cannot be empty");
		}
		this.labelPrefix = prefix;
		return this;
	}

	public LoweringTask setErrorHandler(ErrorHandler handler) {
		this.handler = handler;
		return this;
	}

	public ErrorHandler getErrorHandler() {
		return handler;
	}

	public BoogieFile run(BoogieFile source) {
		ResolutionContext context = ResolutionContext.of(source);
		BoogieFile target = new BoogieFile();
		int lowered = 0;
		int failed = 0;
		for (Decl d : source.getDeclarations()) {
			if (d instanceof Decl.Implementation && ((Decl.Implementation) d).getBody() != null) {
				Decl.Implementation impl = (Decl.Implementation) d;
				Decl.Implementation r = lower(impl, context.enter(impl));
				if (r == impl) {
					failed++;
				} else {
					lowered++;
				}
				target.getDeclarations().add(r);
			} else {
				target.getDeclarations().add(d);
			}
		}
		if (verbose) {
			logger.atInfo().log("lowered %d implementation(s), %d failed with %d error(s)", lowered, failed,
					handler.getErrorCount());
		}
		return target;
	}

	private Decl.Implementation lower(Decl.Implementation impl, ResolutionContext context) {
		int errors = handler.getErrorCount();
		new CallResolver(context, handler).resolve(impl.getBody());
		if (handler.getErrorCount() != errors) {
			logger.atWarning().log("skipping lowering of %s due to resolution errors", impl.getName());
			return impl;
		}
		List<Block> blocks = new StructuredLowering(impl.getName(), impl.getBody(), labelPrefix, handler).getBlocks();
		if (blocks == null) {
			return impl;
		}
		if (desugarCalls) {
			blocks = desugarCalls(blocks);
		}
		return new Decl.Implementation(impl.getName(), impl.getParameters(), impl.getReturns(), impl.getLocals(),
				blocks, impl.getAttributes());
	}

	/**
	 * Replace every call in a list of blocks by its desugaring. Since blocks are
	 * immutable, fresh blocks are constructed and their gotos resolved again.
	 *
	 * @param blocks
	 * @return
	 */
	private static List<Block> desugarCalls(List<Block> blocks) {
		List<Block> result = new ArrayList<>();
		for (Block b : blocks) {
			List<Cmd> cmds = new ArrayList<>();
			for (Cmd c : b.getCmds()) {
				if (c instanceof Cmd.CallCommonality) {
					cmds.add(CallDesugarer.getDesugaring((Cmd.CallCommonality) c));
				} else {
					cmds.add(c);
				}
			}
			TransferCmd transfer = b.getTransferCmd();
			if (transfer instanceof TransferCmd.Goto) {
				transfer = new TransferCmd.Goto(((TransferCmd.Goto) transfer).getLabels());
			}
			result.add(new Block(b.getLabel(), cmds, transfer));
		}
		CfgBuilder.resolveGotos(result);
		return result;
	}
}
