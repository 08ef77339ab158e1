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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

import com.google.common.base.Preconditions;

/**
 * An in-memory representation of a Boogie program. A file is a list of
 * top-level declarations. Procedure bodies start out <i>structured</i> (see
 * {@link StmtList}) and are later lowered into a flat list of {@link Block}s.
 *
 * @author David J. Pearce
 *
 */
public class BoogieFile {
	/**
	 * The list of top-level declarations within this file.
	 */
	private final List<Decl> declarations;

	public BoogieFile() {
		this.declarations = new ArrayList<>();
	}

	public BoogieFile(Collection<? extends Decl> declarations) {
		this.declarations = new ArrayList<>(declarations);
	}

	public List<Decl> getDeclarations() {
		return declarations;
	}

	// =========================================================================
	// Top-Level Item
	// =========================================================================

	public interface Item {
		/**
		 * Get a particular attribute associated with this item.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T getAttribute(Class<T> kind);

		/**
		 * Get all attributes within this item.
		 * @return
		 */
		public Attribute[] getAttributes();
	}

	public static class AbstractItem implements Item {
		private final Attribute[] attributes;

		public AbstractItem(Attribute[] attributes) {
			this.attributes = attributes;
		}

		@Override
		public <T> T getAttribute(Class<T> kind) {
			for(int i=0;i!=attributes.length;++i) {
				T ith = attributes[i].as(kind);
				if(ith != null) {
					return ith;
				}
			}
			return null;
		}

		@Override
		public Attribute[] getAttributes() {
			return attributes;
		}

		public boolean isFalse() {
			return (this instanceof Expr.Boolean) && !((Expr.Boolean) this).getValue();
		}

		public boolean isTrue() {
			return (this instanceof Expr.Boolean) && ((Expr.Boolean) this).getValue();
		}
	}

	// =========================================================================
	// Declarations
	// =========================================================================

	public interface Decl extends Item {

		/**
		 * Axioms are used to postulate properties of constants and functions, though
		 * cannot refer to global variables.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Axiom extends AbstractItem implements Decl {
			private final Expr.Logical operand;

			public Axiom(Expr.Logical operand, Attribute... attributes) {
				super(attributes);
				this.operand = operand;
			}

			public Expr.Logical getOperand() {
				return operand;
			}
		}

		/**
		 * Allows a line comment to be included in a <code>BoogieFile</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class LineComment extends AbstractItem implements Decl {
			private final String message;

			public LineComment(String message, Attribute... attributes) {
				super(attributes);
				this.message = message;
			}

			public String getMessage() {
				return message;
			}
		}

		/**
		 * Represents a global (symbolic) constant value. A constant can be marked
		 * <i>unique</i>, meaning it will not compare equal with any other unique
		 * constant.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Constant extends Parameter implements Decl {
			private final boolean unique;

			public Constant(boolean unique, String name, Type type, Attribute... attributes) {
				super(name, type, attributes);
				this.unique = unique;
			}

			public boolean isUnique() {
				return unique;
			}
		}

		public static class Function extends AbstractItem implements Decl {
			private final String name;
			private final List<Parameter> parameters;
			private final Type returns;
			private final Expr body;

			public Function(String name, List<Parameter> parameters, Type returns, Expr body, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.returns = returns;
				this.body = body;
			}

			public String getName() {
				return name;
			}

			public List<Parameter> getParameters() {
				return parameters;
			}

			public Type getReturns() {
				return returns;
			}

			public Expr getBody() {
				return body;
			}
		}

		/**
		 * A procedure declaration gives the signature and contract of a procedure:
		 * its type parameters, in- and out-parameters, checked and free pre- and
		 * postconditions and the set of global variables it may modify. Calls are
		 * verified against this contract alone, never against an implementation.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Procedure extends AbstractItem implements Decl {
			private final String name;
			private final List<String> typeParameters;
			private final List<Variable> parameters;
			private final List<Variable> returns;
			private final List<Expr.Logical> requires;
			private final List<Expr.Logical> freeRequires;
			private final List<Expr.Logical> ensures;
			private final List<Expr.Logical> freeEnsures;
			private final List<String> modifies;

			public Procedure(String name, List<String> typeParameters, List<Variable> parameters, List<Variable> returns,
					List<Expr.Logical> requires, List<Expr.Logical> freeRequires, List<Expr.Logical> ensures,
					List<Expr.Logical> freeEnsures, List<String> modifies, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.typeParameters = new ArrayList<>(typeParameters);
				this.parameters = new ArrayList<>(parameters);
				this.returns = new ArrayList<>(returns);
				this.requires = new ArrayList<>(requires);
				this.freeRequires = new ArrayList<>(freeRequires);
				this.ensures = new ArrayList<>(ensures);
				this.freeEnsures = new ArrayList<>(freeEnsures);
				this.modifies = new ArrayList<>(modifies);
			}

			public String getName() {
				return name;
			}

			public List<String> getTypeParameters() {
				return typeParameters;
			}

			public List<Variable> getParameters() {
				return parameters;
			}

			public List<Variable> getReturns() {
				return returns;
			}

			/**
			 * Get the checked preconditions. These must be established by every caller.
			 *
			 * @return
			 */
			public List<Expr.Logical> getRequires() {
				return requires;
			}

			/**
			 * Get the free preconditions. These are assumed on entry to an implementation
			 * but are never checked at call sites.
			 *
			 * @return
			 */
			public List<Expr.Logical> getFreeRequires() {
				return freeRequires;
			}

			public List<Expr.Logical> getEnsures() {
				return ensures;
			}

			public List<Expr.Logical> getFreeEnsures() {
				return freeEnsures;
			}

			public List<String> getModifies() {
				return modifies;
			}
		}

		/**
		 * An implementation declaration spells out a set of execution traces by giving
		 * a body of code. The body is either structured (as written) or, once
		 * lowered, a flat list of basic blocks.
		 *
		 * @author djp
		 *
		 */
		public static class Implementation extends AbstractItem implements Decl {
			private final String name;
			private final List<Variable> parameters;
			private final List<Variable> returns;
			private final List<Variable> locals;
			private final StmtList body;
			private final List<Block> blocks;

			public Implementation(String name, List<Variable> parameters, List<Variable> returns,
					List<Variable> locals, StmtList body, Attribute... attributes) {
				this(name, parameters, returns, locals, body, null, attributes);
			}

			public Implementation(String name, List<Variable> parameters, List<Variable> returns,
					List<Variable> locals, List<Block> blocks, Attribute... attributes) {
				this(name, parameters, returns, locals, null, blocks, attributes);
			}

			private Implementation(String name, List<Variable> parameters, List<Variable> returns,
					List<Variable> locals, StmtList body, List<Block> blocks, Attribute... attributes) {
				super(attributes);
				if (body == null && blocks == null) {
					throw new IllegalArgumentException("Implementation requires either a structured body or blocks");
				}
				this.name = name;
				this.parameters = new ArrayList<>(parameters);
				this.returns = new ArrayList<>(returns);
				this.locals = new ArrayList<>(locals);
				this.body = body;
				this.blocks = blocks == null ? null : new ArrayList<>(blocks);
			}

			public String getName() {
				return name;
			}

			public List<Variable> getParameters() {
				return parameters;
			}

			public List<Variable> getReturns() {
				return returns;
			}

			public List<Variable> getLocals() {
				return locals;
			}

			/**
			 * Get the structured body of this implementation, or <code>null</code> if it
			 * is only available in flat form.
			 *
			 * @return
			 */
			public StmtList getBody() {
				return body;
			}

			/**
			 * Get the flat block list of this implementation, or <code>null</code> if it
			 * has not been lowered.
			 *
			 * @return
			 */
			public List<Block> getBlocks() {
				return blocks;
			}
		}

		public static class Parameter extends AbstractItem implements Item {
			private final String name;
			private final Type type;

			public Parameter(String name, Type type, Attribute... attributes) {
				super(attributes);
				this.name = name;
				this.type = type;
			}

			public String getName() {
				return name;
			}

			public Type getType() {
				return type;
			}
		}

		/**
		 * A (global or local) variable. A variable may carry a <code>where</code>
		 * clause, which constrains the values it may take after being havoced.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Variable extends Parameter implements Decl {
			private final Expr.Logical where;

			public Variable(String name, Type type) {
				this(name, type, null);
			}

			public Variable(String name, Type type, Expr.Logical where, Attribute... attributes) {
				super(name, type, attributes);
				this.where = where;
			}

			public Expr.Logical getWhere() {
				return where;
			}
		}
	}

	// =========================================================================
	// Commands
	// =========================================================================

	/**
	 * A simple command. These are the commands which may appear in the body of a
	 * {@link BigBlock} or a {@link Block}.
	 *
	 * @author David J. Pearce
	 *
	 */
	public interface Cmd extends Item {

		/**
		 * A command whose meaning is a boolean filter on execution (i.e.
		 * <code>assert</code> or <code>assume</code>).
		 */
		public interface Predicate extends Cmd {
			public Expr.Logical getCondition();
		}

		public static class Assert extends AbstractItem implements Predicate {
			private final Expr.Logical condition;

			private Assert(Expr.Logical condition, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
			}

			@Override
			public Expr.Logical getCondition() {
				return condition;
			}
		}

		/**
		 * An assertion introduced when desugaring a call, which checks one of the
		 * callee's preconditions. It records where it came from so failures can be
		 * reported against the call and the precondition in question.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class AssertRequires extends Assert {
			private final Call call;
			private final Expr.Logical requires;

			private AssertRequires(Call call, Expr.Logical requires, Expr.Logical condition, Attribute[] attributes) {
				super(condition, attributes);
				this.call = call;
				this.requires = requires;
			}

			public Call getCall() {
				return call;
			}

			public Expr.Logical getRequires() {
				return requires;
			}
		}

		public static class Assume extends AbstractItem implements Predicate {
			private final Expr.Logical condition;

			private Assume(Expr.Logical condition, Attribute[] attributes) {
				super(attributes);
				this.condition = condition;
			}

			@Override
			public Expr.Logical getCondition() {
				return condition;
			}
		}

		/**
		 * A parallel assignment <code>x, m[i] := e1, e2</code>. Every right-hand
		 * side is evaluated before any left-hand side is updated.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Assignment extends AbstractItem implements Cmd {
			private final List<LVal> lhs;
			private final List<Expr> rhs;

			private Assignment(List<LVal> lhs, List<Expr> rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = new ArrayList<>(lhs);
				this.rhs = new ArrayList<>(rhs);
			}

			public List<LVal> getLeftHandSides() {
				return lhs;
			}

			public List<Expr> getRightHandSides() {
				return rhs;
			}

			/**
			 * Get the equivalent assignment in which every left-hand side is a plain
			 * variable. For example, <code>m[i][j] := v</code> becomes
			 * <code>m := m[i := m[i][j := v]]</code>.
			 *
			 * @return
			 */
			public Assignment getAsSimpleAssignment() {
				List<LVal> vars = new ArrayList<>();
				List<Expr> values = new ArrayList<>();
				for (int i = 0; i != lhs.size(); ++i) {
					LVal lv = lhs.get(i);
					Expr value = rhs.get(i);
					while (lv instanceof Expr.DictionaryAccess) {
						Expr.DictionaryAccess access = (Expr.DictionaryAccess) lv;
						if (!(access.getSource() instanceof LVal)) {
							throw new IllegalArgumentException("invalid left-hand side: " + lhs.get(i));
						}
						value = PUT(access.getSource(), access.getIndex(), value);
						lv = (LVal) access.getSource();
					}
					vars.add(lv);
					values.add(value);
				}
				return new Assignment(vars, values, getAttributes());
			}
		}

		public static class Havoc extends AbstractItem implements Cmd {
			private final List<Expr.VariableAccess> variables;

			private Havoc(Collection<Expr.VariableAccess> variables, Attribute[] attributes) {
				super(attributes);
				this.variables = new ArrayList<>(variables);
			}

			public List<Expr.VariableAccess> getVariables() {
				return variables;
			}
		}

		public static class Comment extends AbstractItem implements Cmd {
			private final String message;

			private Comment(String message, Attribute[] attributes) {
				super(attributes);
				this.message = message;
			}

			public String getMessage() {
				return message;
			}
		}

		/**
		 * An imperative-let binding around a sequence of commands. There is no user
		 * syntax for this; it only arises as the desugaring of a call.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class State extends AbstractItem implements Cmd {
			private final List<Decl.Variable> locals;
			private final List<Cmd> cmds;

			private State(List<Decl.Variable> locals, List<Cmd> cmds, Attribute[] attributes) {
				super(attributes);
				this.locals = Collections.unmodifiableList(new ArrayList<>(locals));
				this.cmds = Collections.unmodifiableList(new ArrayList<>(cmds));
			}

			public List<Decl.Variable> getLocals() {
				return locals;
			}

			public List<Cmd> getCmds() {
				return cmds;
			}
		}

		/**
		 * Expands sugared commands into primitive ones. The expansion lives outside
		 * the model, which only caches its result.
		 */
		public interface Desugarer {
			public State desugar(Call call);

			public State desugar(CallForall call);
		}

		/**
		 * A command which stands for some other (more primitive) command. The
		 * desugaring is computed on first request and cached for the lifetime of
		 * this command.
		 *
		 * @author David J. Pearce
		 *
		 */
		public abstract static class Sugared extends AbstractItem implements Cmd {
			private State desugaring;

			public Sugared(Attribute[] attributes) {
				super(attributes);
			}

			/**
			 * Get the desugaring of this command, computing it with the given desugarer
			 * on the first request only. Later requests return the cached result,
			 * whichever desugarer they pass.
			 *
			 * @param desugarer
			 * @return
			 */
			public State getDesugaring(Desugarer desugarer) {
				if (desugaring == null) {
					desugaring = computeDesugaring(desugarer);
				}
				return desugaring;
			}

			public boolean isDesugared() {
				return desugaring != null;
			}

			protected abstract State computeDesugaring(Desugarer desugarer);
		}

		/**
		 * Common aspects of <code>call</code> and <code>call forall</code>. The callee
		 * is named only until resolution fixes the procedure declaration, after which
		 * it does not change.
		 *
		 * @author David J. Pearce
		 *
		 */
		public abstract static class CallCommonality extends Sugared {
			private static final AtomicInteger UNIQUE_IDS = new AtomicInteger();

			private final int uniqueId;
			private final String callee;
			private final List<Expr> ins;
			private Decl.Procedure procedure;

			public CallCommonality(String callee, List<Expr> ins, Attribute[] attributes) {
				super(attributes);
				this.uniqueId = UNIQUE_IDS.getAndIncrement();
				this.callee = callee;
				// NOTE: entries may be null, which indicates a wildcard
				this.ins = new ArrayList<>(ins);
			}

			public int getUniqueId() {
				return uniqueId;
			}

			public String getCallee() {
				return callee;
			}

			/**
			 * Get the actual in-arguments. A <code>null</code> entry denotes a wildcard
			 * (<code>*</code>) argument.
			 *
			 * @return
			 */
			public List<Expr> getIns() {
				return ins;
			}

			public boolean isResolved() {
				return procedure != null;
			}

			public Decl.Procedure getProcedure() {
				return procedure;
			}

			public void setProcedure(Decl.Procedure procedure) {
				Preconditions.checkState(this.procedure == null, "call to %s already resolved", callee);
				this.procedure = Preconditions.checkNotNull(procedure);
			}

			public boolean hasWildcardIns() {
				return ins.contains(null);
			}
		}

		/**
		 * A deterministic procedure call <code>call x, * := P(e, *)</code>.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class Call extends CallCommonality {
			private final List<Expr.VariableAccess> outs;
			private final boolean async;
			private Map<String, Type> typeInstantiation;
			private List<Decl.Variable> frame;

			private Call(String callee, List<Expr.VariableAccess> outs, List<Expr> ins, boolean async,
					Attribute[] attributes) {
				super(callee, ins, attributes);
				// NOTE: entries may be null, which indicates a wildcard
				this.outs = new ArrayList<>(outs);
				this.async = async;
			}

			/**
			 * Get the actual out-targets. A <code>null</code> entry denotes a wildcard
			 * (<code>*</code>) whose result is discarded.
			 *
			 * @return
			 */
			public List<Expr.VariableAccess> getOuts() {
				return outs;
			}

			public boolean isAsync() {
				return async;
			}

			/**
			 * Get the instantiation of the callee's type parameters, or <code>null</code>
			 * if this call has not been type checked.
			 *
			 * @return
			 */
			public Map<String, Type> getTypeInstantiation() {
				return typeInstantiation;
			}

			public void setTypeInstantiation(Map<String, Type> instantiation) {
				Preconditions.checkState(typeInstantiation == null, "call to %s already type checked", getCallee());
				this.typeInstantiation = Collections.unmodifiableMap(new HashMap<>(instantiation));
			}

			/**
			 * Get the global variables named in the callee's modifies clause, or
			 * <code>null</code> if this call has not been resolved.
			 *
			 * @return
			 */
			public List<Decl.Variable> getFrame() {
				return frame;
			}

			public void setFrame(List<Decl.Variable> frame) {
				Preconditions.checkState(this.frame == null, "frame of call to %s already resolved", getCallee());
				this.frame = Collections.unmodifiableList(new ArrayList<>(frame));
			}

			@Override
			protected State computeDesugaring(Desugarer desugarer) {
				return desugarer.desugar(this);
			}
		}

		/**
		 * A universally quantified ghost call <code>call forall P(e, *)</code>. It
		 * assigns nothing; its effect is to assume the callee's contract for every
		 * value of the wildcard arguments.
		 *
		 * @author David J. Pearce
		 *
		 */
		public static class CallForall extends CallCommonality {
			private List<Type> instantiatedTypes;

			private CallForall(String callee, List<Expr> ins, Attribute[] attributes) {
				super(callee, ins, attributes);
			}

			/**
			 * Get the types of the formal in-parameters after instantiating every type
			 * parameter determined by the non-wildcard arguments, or <code>null</code> if
			 * this call has not been type checked.
			 *
			 * @return
			 */
			public List<Type> getInstantiatedTypes() {
				return instantiatedTypes;
			}

			public void setInstantiatedTypes(List<Type> types) {
				Preconditions.checkState(instantiatedTypes == null, "call forall to %s already type checked", getCallee());
				this.instantiatedTypes = Collections.unmodifiableList(new ArrayList<>(types));
			}

			@Override
			protected State computeDesugaring(Desugarer desugarer) {
				return desugarer.desugar(this);
			}
		}
	}

	// =========================================================================
	// Expressions
	// =========================================================================

	public interface Expr extends Item {

		/**
		 * An expression of type <code>bool</code>. Guards, invariants, assertions and
		 * assumptions must all be logical.
		 */
		public interface Logical extends Expr {
			public boolean isFalse();
			public boolean isTrue();
		}

		public interface Quantifier extends Logical {
			public List<Decl.Parameter> getParameters();

			public Expr.Logical getBody();
		}

		public interface UnaryOperator {
			Expr getOperand();
		}

		public interface BinaryOperator {
			Expr getLeftHandSide();
			Expr getRightHandSide();
		}

		public interface NaryOperator {
			List<? extends Expr> getOperands();
		}

		public abstract static class AbstractBinaryOperator extends AbstractItem implements BinaryOperator {
			private final Expr lhs;
			private final Expr rhs;

			private AbstractBinaryOperator(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(attributes);
				this.lhs = lhs;
				this.rhs = rhs;
			}

			@Override
			public Expr getLeftHandSide() {
				return lhs;
			}

			@Override
			public Expr getRightHandSide() {
				return rhs;
			}
		}

		public static class Equals extends AbstractBinaryOperator implements Logical {
			private Equals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class NotEquals extends AbstractBinaryOperator implements Logical {
			private NotEquals(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LessThan extends AbstractBinaryOperator implements Logical {
			private LessThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class LessThanOrEqual extends AbstractBinaryOperator implements Logical {
			private LessThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThan extends AbstractBinaryOperator implements Logical {
			private GreaterThan(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class GreaterThanOrEqual extends AbstractBinaryOperator implements Logical {
			private GreaterThanOrEqual(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Iff extends AbstractBinaryOperator implements Logical {
			private Iff(Logical lhs, Logical rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}

			@Override
			public Logical getLeftHandSide() {
				return (Logical) super.getLeftHandSide();
			}

			@Override
			public Logical getRightHandSide() {
				return (Logical) super.getRightHandSide();
			}
		}

		public static class Implies extends AbstractBinaryOperator implements Logical {
			private Implies(Logical lhs, Logical rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}

			@Override
			public Logical getLeftHandSide() {
				return (Logical) super.getLeftHandSide();
			}

			@Override
			public Logical getRightHandSide() {
				return (Logical) super.getRightHandSide();
			}
		}

		public static class Addition extends AbstractBinaryOperator implements Expr {
			private Addition(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Subtraction extends AbstractBinaryOperator implements Expr {
			private Subtraction(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Multiplication extends AbstractBinaryOperator implements Expr {
			private Multiplication(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class IntegerDivision extends AbstractBinaryOperator implements Expr {
			private IntegerDivision(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Remainder extends AbstractBinaryOperator implements Expr {
			private Remainder(Expr lhs, Expr rhs, Attribute[] attributes) {
				super(lhs, rhs, attributes);
			}
		}

		public static class Boolean extends AbstractItem implements Logical {
			private final boolean value;

			private Boolean(boolean v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public boolean getValue() {
				return value;
			}

			@Override
			public String toString() {
				return value ? "TRUE" : "FALSE";
			}
		}

		public static class Integer extends AbstractItem implements Expr {
			private final BigInteger value;

			private Integer(BigInteger v, Attribute[] attributes) {
				super(attributes);
				this.value = v;
			}

			public BigInteger getValue() {
				return value;
			}

			@Override
			public String toString() {
				return "INT(" + value + ")";
			}
		}

		/**
		 * A map select <code>m[i]</code>. This may also appear on the left-hand side
		 * of an assignment.
		 */
		public static class DictionaryAccess extends AbstractItem implements Logical, LVal {
			private final Expr source;
			private final Expr index;

			private DictionaryAccess(Expr source, Expr index, Attribute[] attributes) {
				super(attributes);
				this.source = source;
				this.index = index;
			}

			public Expr getSource() {
				return source;
			}

			public Expr getIndex() {
				return index;
			}

			@Override
			public String toString() {
				return "GET(" + source + ", " + index + ")";
			}
		}

		public static class DictionaryUpdate extends AbstractItem implements Expr {
			private final Expr source;
			private final Expr index;
			private final Expr value;

			private DictionaryUpdate(Expr source, Expr index, Expr value, Attribute[] attributes) {
				super(attributes);
				this.source = source;
				this.index = index;
				this.value = value;
			}

			public Expr getSource() {
				return source;
			}

			public Expr getIndex() {
				return index;
			}

			public Expr getValue() {
				return value;
			}

			@Override
			public String toString() {
				return "PUT(" + source + ", " + index + "," + value + ")";
			}
		}

		public static class Invoke extends AbstractItem implements Logical {
			private final String name;
			private final List<Expr> arguments;

			private Invoke(String name, Collection<Expr> arguments, Attribute[] attributes) {
				super(attributes);
				this.name = name;
				this.arguments = new ArrayList<>(arguments);
			}

			public String getName() {
				return name;
			}

			public List<Expr> getArguments() {
				return arguments;
			}

			@Override
			public String toString() {
				return "FNCALL(" + name + "," + arguments.toString() + ")";
			}
		}

		public static class Negation extends AbstractItem implements Expr, UnaryOperator {
			private final Expr operand;

			private Negation(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}
		}

		/**
		 * The value of an expression in the pre-state of the enclosing procedure.
		 */
		public static class Old extends AbstractItem implements Logical, UnaryOperator {
			private final Expr operand;

			private Old(Expr operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Expr getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return "OLD(" + operand + ")";
			}
		}

		public static class LogicalNot extends AbstractItem implements Logical, UnaryOperator {
			private final Logical operand;

			private LogicalNot(Logical operand, Attribute[] attributes) {
				super(attributes);
				this.operand = operand;
			}

			@Override
			public Logical getOperand() {
				return operand;
			}

			@Override
			public String toString() {
				return "NOT(" + operand + ")";
			}
		}

		public static class LogicalAnd extends AbstractItem implements Logical, NaryOperator {
			private final List<Logical> operands;

			private LogicalAnd(List<Logical> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = new ArrayList<>(operands);
			}

			@Override
			public List<Logical> getOperands() {
				return operands;
			}
		}

		public static class LogicalOr extends AbstractItem implements Logical, NaryOperator {
			private final List<Logical> operands;

			private LogicalOr(List<Logical> operands, Attribute[] attributes) {
				super(attributes);
				this.operands = new ArrayList<>(operands);
			}

			@Override
			public List<Logical> getOperands() {
				return operands;
			}
		}

		public static class UniversalQuantifier extends AbstractItem implements Quantifier {
			private final List<Decl.Parameter> parameters;
			private final Logical body;

			private UniversalQuantifier(Collection<Decl.Parameter> parameters, Expr.Logical body, Attribute[] attributes) {
				super(attributes);
				this.parameters = new ArrayList<>(parameters);
				this.body = body;
			}

			@Override
			public List<Decl.Parameter> getParameters() {
				return parameters;
			}

			@Override
			public Logical getBody() {
				return body;
			}
		}

		public static class ExistentialQuantifier extends AbstractItem implements Quantifier {
			private final List<Decl.Parameter> parameters;
			private final Logical body;

			private ExistentialQuantifier(Collection<Decl.Parameter> parameters, Expr.Logical body, Attribute[] attributes) {
				super(attributes);
				this.parameters = new ArrayList<>(parameters);
				this.body = body;
			}

			@Override
			public List<Decl.Parameter> getParameters() {
				return parameters;
			}

			@Override
			public Logical getBody() {
				return body;
			}
		}

		public static class VariableAccess extends AbstractItem implements Logical, LVal {
			private final String variable;

			private VariableAccess(String var, Attribute[] attributes) {
				super(attributes);
				if(var == null) {
					throw new IllegalArgumentException();
				}
				this.variable = var;
			}

			public String getVariable() {
				return variable;
			}

			@Override
			public String toString() {
				return "VAR(" + variable + ")";
			}
		}
	}

	/**
	 * An expression which can be assigned to.
	 */
	public interface LVal extends Expr {

	}

	// =========================================================================
	// Types
	// =========================================================================

	public interface Type extends Item {
		public static final Type Bool = new Bool();
		public static final Type Int = new Int();
		public static final Type Real = new Real();

		public static class Bool extends AbstractItem implements Type {
			public Bool(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Bool;
			}

			@Override
			public int hashCode() {
				return 1;
			}
		}

		public static class Int extends AbstractItem implements Type {
			public Int(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Int;
			}

			@Override
			public int hashCode() {
				return 2;
			}
		}

		public static class Real extends AbstractItem implements Type {
			public Real(Attribute... attributes) {
				super(attributes);
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Real;
			}

			@Override
			public int hashCode() {
				return 3;
			}
		}

		public static class Synonym extends AbstractItem implements Type {
			private final String name;

			public Synonym(String name, Attribute... attributes) {
				super(attributes);
				this.name = name;
			}

			public String getSynonym() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Synonym && ((Synonym) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return name.hashCode();
			}
		}

		/**
		 * A type parameter of a polymorphic procedure, such as <code>T</code> in
		 * <code>procedure P&lt;T&gt;(x : T)</code>.
		 */
		public static class Variable extends AbstractItem implements Type {
			private final String name;

			public Variable(String name, Attribute... attributes) {
				super(attributes);
				this.name = name;
			}

			public String getName() {
				return name;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof Variable && ((Variable) o).name.equals(name);
			}

			@Override
			public int hashCode() {
				return 31 * name.hashCode();
			}
		}

		public static class BitVector extends AbstractItem implements Type {
			private final int digits;

			public BitVector(int digits, Attribute... attributes) {
				super(attributes);
				this.digits = digits;
			}

			public int getDigits() {
				return digits;
			}

			@Override
			public boolean equals(Object o) {
				return o instanceof BitVector && ((BitVector) o).digits == digits;
			}

			@Override
			public int hashCode() {
				return digits;
			}
		}

		public static class Dictionary extends AbstractItem implements Type {
			private final Type key;
			private final Type value;

			public Dictionary(Type key, Type value, Attribute... attributes) {
				super(attributes);
				this.key = key;
				this.value = value;
			}

			public Type getKey() {
				return key;
			}

			public Type getValue() {
				return value;
			}

			@Override
			public boolean equals(Object o) {
				if (o instanceof Dictionary) {
					Dictionary d = (Dictionary) o;
					return key.equals(d.key) && value.equals(d.value);
				}
				return false;
			}

			@Override
			public int hashCode() {
				return Objects.hash(key, value);
			}
		}
	}

	// =========================================================================
	// Attributes
	// =========================================================================

	public interface Attribute {
		/**
		 * Get the contents of this attribute as a given kind.  If that doesn't match, then return <code>null</code>.
		 * @param kind
		 * @param <T>
		 * @return
		 */
		public <T> T as(Class<T> kind);
	}

	// =======================================================
	// Constructor API (for convenience)
	// =======================================================

	public static Attribute ATTRIBUTE(Object o) {
		return new Attribute() {
			@Override
			public <T> T as(Class<T> kind) {
				if(kind.isInstance(o)) {
					return kind.cast(o);
				} else {
					return null;
				}
			}
			@Override
			public String toString() {
				return "ATTR(" + o + ")";
			}
		};
	}

	// Declarations

	public static Decl.Variable VARIABLE(String name, Type type, Attribute... attributes) {
		return new Decl.Variable(name, type, null, attributes);
	}

	public static Decl.Variable VARIABLE(String name, Type type, Expr.Logical where, Attribute... attributes) {
		return new Decl.Variable(name, type, where, attributes);
	}

	public static Decl.Procedure PROCEDURE(String name, List<Decl.Variable> parameters, List<Decl.Variable> returns) {
		return new Decl.Procedure(name, Collections.emptyList(), parameters, returns, Collections.emptyList(),
				Collections.emptyList(), Collections.emptyList(), Collections.emptyList(), Collections.emptyList());
	}

	public static Decl.Procedure PROCEDURE(String name, List<Decl.Variable> parameters, List<Decl.Variable> returns,
			List<Expr.Logical> requires, List<Expr.Logical> ensures, List<String> modifies) {
		return new Decl.Procedure(name, Collections.emptyList(), parameters, returns, requires, Collections.emptyList(),
				ensures, Collections.emptyList(), modifies);
	}

	// Commands
	public static Cmd.Assert ASSERT(Expr.Logical condition, Attribute... attributes) {
		return new Cmd.Assert(condition,attributes);
	}
	public static Cmd.AssertRequires ASSERT_REQUIRES(Cmd.Call call, Expr.Logical requires, Expr.Logical condition, Attribute... attributes) {
		return new Cmd.AssertRequires(call, requires, condition, attributes);
	}
	public static Cmd.Assume ASSUME(Expr.Logical condition, Attribute... attributes) {
		return new Cmd.Assume(condition,attributes);
	}
	public static Cmd.Assignment ASSIGN(LVal lhs, Expr rhs, Attribute... attributes) {
		return new Cmd.Assignment(Arrays.asList(lhs), Arrays.asList(rhs), attributes);
	}
	public static Cmd.Assignment ASSIGN(List<LVal> lhs, List<Expr> rhs, Attribute... attributes) {
		return new Cmd.Assignment(lhs, rhs, attributes);
	}
	public static Cmd.Havoc HAVOC(Expr.VariableAccess variable, Attribute... attributes) {
		return new Cmd.Havoc(Arrays.asList(variable), attributes);
	}
	public static Cmd.Havoc HAVOC(List<Expr.VariableAccess> variables, Attribute... attributes) {
		return new Cmd.Havoc(variables, attributes);
	}
	public static Cmd.Comment COMMENT(String message, Attribute... attributes) {
		return new Cmd.Comment(message, attributes);
	}
	public static Cmd.State STATE(List<Decl.Variable> locals, List<Cmd> cmds, Attribute... attributes) {
		return new Cmd.State(locals, cmds, attributes);
	}
	public static Cmd.Call CALL(String name, List<Expr.VariableAccess> outs, List<Expr> ins, Attribute... attributes) {
		return new Cmd.Call(name, outs, ins, false, attributes);
	}
	public static Cmd.Call CALL(String name, List<Expr> ins, Attribute... attributes) {
		return new Cmd.Call(name, Collections.emptyList(), ins, false, attributes);
	}
	public static Cmd.Call ASYNC_CALL(String name, List<Expr.VariableAccess> outs, List<Expr> ins, Attribute... attributes) {
		return new Cmd.Call(name, outs, ins, true, attributes);
	}
	public static Cmd.CallForall CALL_FORALL(String name, List<Expr> ins, Attribute... attributes) {
		return new Cmd.CallForall(name, ins, attributes);
	}

	// Logical Operators
	public static Expr.Logical AND(List<Expr.Logical> operands, Attribute... attributes) {
		ArrayList<Expr.Logical> noperands = new ArrayList<>();
		for(int i=0;i!=operands.size();++i) {
			Expr.Logical ith = operands.get(i);
			if (ith.isFalse()) {
				return new Expr.Boolean(false, attributes);
			} else if (!ith.isTrue()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
			case 0:
				return new Expr.Boolean(true,attributes);
			case 1:
				return noperands.get(0);
			default:
				return new Expr.LogicalAnd(noperands, attributes);
		}
	}

	public static Expr.Logical AND(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return AND(Arrays.asList(operand1, operand2),attributes);
	}

	public static Expr.UniversalQuantifier FORALL(String name, Type type, Expr.Logical body, Attribute... attributes) {
		return new Expr.UniversalQuantifier(Arrays.asList(new Decl.Parameter(name, type)),body, attributes);
	}

	public static Expr.UniversalQuantifier FORALL(List<Decl.Parameter> parameters, Expr.Logical body, Attribute... attributes) {
		return new Expr.UniversalQuantifier(parameters, body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(String name, Type type, Expr.Logical body, Attribute... attributes) {
		return new Expr.ExistentialQuantifier(Arrays.asList(new Decl.Parameter(name, type)),body, attributes);
	}

	public static Expr.ExistentialQuantifier EXISTS(List<Decl.Parameter> parameters, Expr.Logical body, Attribute... attributes) {
		return new Expr.ExistentialQuantifier(parameters, body, attributes);
	}

	public static Expr.Logical IFF(Expr.Logical lhs, Expr.Logical rhs, Attribute... attributes) {
		return new Expr.Iff(lhs, rhs, attributes);
	}

	public static Expr.Logical IMPLIES(Expr.Logical lhs, Expr.Logical rhs, Attribute... attributes) {
		if(lhs.isFalse() || rhs.isTrue()) {
			return new Expr.Boolean(true,attributes);
		} else if(lhs.isTrue()) {
			return rhs;
		} else {
			return new Expr.Implies(lhs, rhs, attributes);
		}
	}

	public static Expr.Logical NOT(Expr.Logical lhs, Attribute... attributes) {
		if(lhs.isFalse()) {
			return new Expr.Boolean(true,attributes);
		} else if(lhs.isTrue()) {
			return new Expr.Boolean(false,attributes);
		} else {
			return new Expr.LogicalNot(lhs, attributes);
		}
	}

	public static Expr.Logical OR(List<Expr.Logical> operands, Attribute... attributes) {
		ArrayList<Expr.Logical> noperands = new ArrayList<>();
		for(int i=0;i!=operands.size();++i) {
			Expr.Logical ith = operands.get(i);
			if(ith.isTrue()) {
				return new Expr.Boolean(true,attributes);
			} else if(!ith.isFalse()) {
				noperands.add(ith);
			}
		}
		switch (noperands.size()) {
			case 0:
				return new Expr.Boolean(false,attributes);
			case 1:
				return noperands.get(0);
			default:
				return new Expr.LogicalOr(noperands, attributes);
		}
	}

	public static Expr.Logical OR(Expr.Logical operand1, Expr.Logical operand2, Attribute... attributes) {
		return OR(Arrays.asList(operand1, operand2), attributes);
	}

	// Relational Operators

	public static Expr.Equals EQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Equals(lhs, rhs,attributes);
	}

	public static Expr.NotEquals NEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.NotEquals(lhs, rhs,attributes);
	}

	public static Expr.GreaterThanOrEqual GTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThanOrEqual(lhs, rhs,attributes);
	}

	public static Expr.GreaterThan GT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.GreaterThan(lhs, rhs,attributes);
	}

	public static Expr.LessThanOrEqual LTEQ(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThanOrEqual(lhs, rhs,attributes);
	}

	public static Expr.LessThan LT(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.LessThan(lhs, rhs, attributes);
	}

	// Arithmetic Operators
	public static Expr.Addition ADD(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Addition(lhs, rhs, attributes);
	}

	public static Expr.Negation NEG(Expr lhs, Attribute... attributes) {
		return new Expr.Negation(lhs, attributes);
	}

	public static Expr.Subtraction SUB(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Subtraction(lhs, rhs, attributes);
	}
	public static Expr.Multiplication MUL(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Multiplication(lhs, rhs, attributes);
	}
	public static Expr.IntegerDivision IDIV(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.IntegerDivision(lhs, rhs, attributes);
	}
	public static Expr.Remainder REM(Expr lhs, Expr rhs, Attribute... attributes) {
		return new Expr.Remainder(lhs, rhs, attributes);
	}
	// Dictionaries
	public static Expr.DictionaryAccess GET(Expr src, Expr index, Attribute... attributes) {
		return new Expr.DictionaryAccess(src, index, attributes);
	}
	public static Expr.DictionaryUpdate PUT(Expr src, Expr index, Expr value, Attribute... attributes) {
		return new Expr.DictionaryUpdate(src, index, value, attributes);
	}
	// Misc
	public static Expr.Logical CONST(boolean b, Attribute... attributes) {
		return new Expr.Boolean(b,attributes);
	}

	public static Expr.Integer CONST(int i, Attribute... attributes) {
		return new Expr.Integer(BigInteger.valueOf(i), attributes);
	}

	public static Expr.Integer CONST(BigInteger i, Attribute... attributes) {
		return new Expr.Integer(i, attributes);
	}

	public static Expr.Old OLD(Expr lhs, Attribute... attributes) {
		return new Expr.Old(lhs, attributes);
	}

	public static Expr.Invoke INVOKE(String name, List<Expr> parameters, Attribute... attributes) {
		return new Expr.Invoke(name, parameters,attributes);
	}
	public static Expr.Invoke INVOKE(String name, Expr parameter, Attribute... attributes) {
		return new Expr.Invoke(name, Arrays.asList(parameter),attributes);
	}
	public static Expr.VariableAccess VAR(String name, Attribute... attributes) {
		return new Expr.VariableAccess(name,attributes);
	}
}
