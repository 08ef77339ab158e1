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
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.google.common.base.Preconditions;

/**
 * A control transfer which already has flat form: either a (possibly
 * nondeterministic) <code>goto</code> or a <code>return</code>.
 *
 * @author David J. Pearce
 *
 */
public interface TransferCmd {

	public static class Goto implements TransferCmd {
		private final List<String> labels;
		private List<Block> targets;

		public Goto(List<String> labels) {
			if (labels.isEmpty()) {
				throw new IllegalArgumentException("A goto requires at least one target");
			}
			this.labels = Collections.unmodifiableList(new ArrayList<>(labels));
		}

		public Goto(String... labels) {
			this(Arrays.asList(labels));
		}

		public List<String> getLabels() {
			return labels;
		}

		/**
		 * Get the blocks this goto targets, or <code>null</code> if it has not been
		 * resolved against a block list.
		 *
		 * @return
		 */
		public List<Block> getTargets() {
			return targets;
		}

		public void setTargets(List<Block> targets) {
			Preconditions.checkState(this.targets == null, "goto targets already resolved");
			Preconditions.checkArgument(targets.size() == labels.size());
			this.targets = Collections.unmodifiableList(new ArrayList<>(targets));
		}

		@Override
		public String toString() {
			return "goto " + String.join(", ", labels);
		}
	}

	public static class Return implements TransferCmd {
		@Override
		public String toString() {
			return "return";
		}
	}
}
