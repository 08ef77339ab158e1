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
import bpl.core.BoogieFile.Expr;

/**
 * A control construct which is retained in tree form until the body is
 * lowered into basic blocks. There are exactly three kinds:
 * <code>if</code>, <code>while</code> and <code>break</code>.
 *
 * @author David J. Pearce
 *
 */
public interface StructuredCmd {

	/**
	 * A conditional <code>if (G) { ... } else ...</code>. The guard is
	 * <code>null</code> for a nondeterministic choice <code>if (*)</code>. A
	 * conditional continues either with a chained <code>else if</code> or an
	 * <code>else</code> body, never both.
	 *
	 */
	public static class If implements StructuredCmd {
		private final Expr.Logical guard;
		private final StmtList thn;
		private final If elseIf;
		private final StmtList elseBlock;

		public If(Expr.Logical guard, StmtList thn, If elseIf, StmtList elseBlock) {
			if (elseIf != null && elseBlock != null) {
				throw new IllegalArgumentException("A conditional cannot have both an else-if and an else body");
			}
			this.guard = guard;
			this.thn = Preconditions.checkNotNull(thn);
			this.elseIf = elseIf;
			this.elseBlock = elseBlock;
		}

		public Expr.Logical getGuard() {
			return guard;
		}

		public StmtList getThen() {
			return thn;
		}

		public If getElseIf() {
			return elseIf;
		}

		public StmtList getElse() {
			return elseBlock;
		}
	}

	/**
	 * A loop <code>while (G) invariant I; { ... }</code>. Each invariant is
	 * either an <code>assert</code> (checked) or an <code>assume</code> (free).
	 * The guard is <code>null</code> for a nondeterministic loop.
	 */
	public static class While implements StructuredCmd {
		private final Expr.Logical guard;
		private final List<Cmd.Predicate> invariants;
		private final StmtList body;

		public While(Expr.Logical guard, List<Cmd.Predicate> invariants, StmtList body) {
			this.guard = guard;
			this.invariants = Collections.unmodifiableList(new ArrayList<>(invariants));
			this.body = Preconditions.checkNotNull(body);
		}

		public Expr.Logical getGuard() {
			return guard;
		}

		public List<Cmd.Predicate> getInvariants() {
			return invariants;
		}

		public StmtList getBody() {
			return body;
		}
	}

	/**
	 * An unlabelled <code>break</code> leaves the innermost enclosing loop,
	 * whilst a labelled one leaves the enclosing statement with that label.
	 */
	public static class Break implements StructuredCmd {
		private final String label;
		private BigBlock breakEnclosure;

		public Break(String label) {
			this.label = label;
		}

		public Break() {
			this(null);
		}

		public String getLabel() {
			return label;
		}

		/**
		 * Get the big block this break leaves, or <code>null</code> if it has not
		 * been resolved.
		 *
		 * @return
		 */
		public BigBlock getBreakEnclosure() {
			return breakEnclosure;
		}

		public void setBreakEnclosure(BigBlock enclosure) {
			Preconditions.checkState(breakEnclosure == null, "break target already resolved");
			this.breakEnclosure = Preconditions.checkNotNull(enclosure);
		}
	}
}
