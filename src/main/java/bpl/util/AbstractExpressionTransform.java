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
package bpl.util;

import java.util.ArrayList;
import java.util.List;

import bpl.core.BoogieFile;
import bpl.core.BoogieFile.Expr;

/**
 * Rewrites an expression bottom-up. A node is only rebuilt when one or more of
 * its children actually changed, hence transforming an expression which
 * contains nothing of interest returns the original expression. Subclasses
 * hook in by overriding the handful of <code>transform</code> methods for
 * leaves and binders; operators are handled uniformly.
 */
public abstract class AbstractExpressionTransform {

    public Expr.Logical transform(Expr.Logical expr) {
        return asLogical(transform((Expr) expr));
    }

    public Expr transform(Expr expr) {
        if (expr instanceof Expr.VariableAccess) {
            return transformVariableAccess((Expr.VariableAccess) expr);
        } else if (expr instanceof Expr.Integer || expr instanceof Expr.Boolean) {
            return expr;
        } else if (expr instanceof Expr.AbstractBinaryOperator) {
            return transformBinary((Expr.AbstractBinaryOperator) expr);
        } else if (expr instanceof Expr.LogicalAnd || expr instanceof Expr.LogicalOr) {
            return transformNary(expr);
        } else if (expr instanceof Expr.Negation) {
            Expr.Negation e = (Expr.Negation) expr;
            Expr operand = transform(e.getOperand());
            return operand == e.getOperand() ? e : BoogieFile.NEG(operand, e.getAttributes());
        } else if (expr instanceof Expr.LogicalNot) {
            Expr.LogicalNot e = (Expr.LogicalNot) expr;
            Expr operand = transform(e.getOperand());
            return operand == e.getOperand() ? e : BoogieFile.NOT(asLogical(operand), e.getAttributes());
        } else if (expr instanceof Expr.Old) {
            return transformOld((Expr.Old) expr);
        } else if (expr instanceof Expr.Quantifier) {
            return transformQuantifier((Expr.Quantifier) expr);
        } else if (expr instanceof Expr.DictionaryAccess) {
            Expr.DictionaryAccess e = (Expr.DictionaryAccess) expr;
            Expr source = transform(e.getSource());
            Expr index = transform(e.getIndex());
            if (source == e.getSource() && index == e.getIndex()) {
                return e;
            }
            return BoogieFile.GET(source, index, e.getAttributes());
        } else if (expr instanceof Expr.DictionaryUpdate) {
            Expr.DictionaryUpdate e = (Expr.DictionaryUpdate) expr;
            Expr source = transform(e.getSource());
            Expr index = transform(e.getIndex());
            Expr value = transform(e.getValue());
            if (source == e.getSource() && index == e.getIndex() && value == e.getValue()) {
                return e;
            }
            return BoogieFile.PUT(source, index, value, e.getAttributes());
        } else if (expr instanceof Expr.Invoke) {
            Expr.Invoke e = (Expr.Invoke) expr;
            List<Expr> arguments = transformAll(e.getArguments());
            return arguments == null ? e : BoogieFile.INVOKE(e.getName(), arguments, e.getAttributes());
        } else {
            throw new IllegalArgumentException("unknown expression encountered (" + expr.getClass().getName() + ")");
        }
    }

    protected Expr transformVariableAccess(Expr.VariableAccess expr) {
        return expr;
    }

    protected Expr transformOld(Expr.Old expr) {
        Expr operand = transform(expr.getOperand());
        return operand == expr.getOperand() ? expr : BoogieFile.OLD(operand, expr.getAttributes());
    }

    protected Expr transformQuantifier(Expr.Quantifier expr) {
        Expr.Logical body = transform(expr.getBody());
        if (body == expr.getBody()) {
            return expr;
        } else if (expr instanceof Expr.UniversalQuantifier) {
            return BoogieFile.FORALL(expr.getParameters(), body, expr.getAttributes());
        } else {
            return BoogieFile.EXISTS(expr.getParameters(), body, expr.getAttributes());
        }
    }

    private Expr transformBinary(Expr.AbstractBinaryOperator expr) {
        Expr lhs = transform(expr.getLeftHandSide());
        Expr rhs = transform(expr.getRightHandSide());
        if (lhs == expr.getLeftHandSide() && rhs == expr.getRightHandSide()) {
            return (Expr) expr;
        }
        BoogieFile.Attribute[] attributes = expr.getAttributes();
        if (expr instanceof Expr.Addition) {
            return BoogieFile.ADD(lhs, rhs, attributes);
        } else if (expr instanceof Expr.Subtraction) {
            return BoogieFile.SUB(lhs, rhs, attributes);
        } else if (expr instanceof Expr.Multiplication) {
            return BoogieFile.MUL(lhs, rhs, attributes);
        } else if (expr instanceof Expr.IntegerDivision) {
            return BoogieFile.IDIV(lhs, rhs, attributes);
        } else if (expr instanceof Expr.Remainder) {
            return BoogieFile.REM(lhs, rhs, attributes);
        } else if (expr instanceof Expr.Equals) {
            return BoogieFile.EQ(lhs, rhs, attributes);
        } else if (expr instanceof Expr.NotEquals) {
            return BoogieFile.NEQ(lhs, rhs, attributes);
        } else if (expr instanceof Expr.LessThan) {
            return BoogieFile.LT(lhs, rhs, attributes);
        } else if (expr instanceof Expr.LessThanOrEqual) {
            return BoogieFile.LTEQ(lhs, rhs, attributes);
        } else if (expr instanceof Expr.GreaterThan) {
            return BoogieFile.GT(lhs, rhs, attributes);
        } else if (expr instanceof Expr.GreaterThanOrEqual) {
            return BoogieFile.GTEQ(lhs, rhs, attributes);
        } else if (expr instanceof Expr.Implies) {
            return BoogieFile.IMPLIES(asLogical(lhs), asLogical(rhs), attributes);
        } else if (expr instanceof Expr.Iff) {
            return BoogieFile.IFF(asLogical(lhs), asLogical(rhs), attributes);
        } else {
            throw new IllegalArgumentException("unknown binary operator (" + expr.getClass().getName() + ")");
        }
    }

    private Expr transformNary(Expr expr) {
        List<Expr> operands = transformAll(((Expr.NaryOperator) expr).getOperands());
        if (operands == null) {
            return expr;
        }
        List<Expr.Logical> logicals = Util.map(operands, AbstractExpressionTransform::asLogical);
        if (expr instanceof Expr.LogicalAnd) {
            return BoogieFile.AND(logicals, expr.getAttributes());
        } else {
            return BoogieFile.OR(logicals, expr.getAttributes());
        }
    }

    /**
     * Transform each expression in a list, returning <code>null</code> when none
     * of them changed.
     */
    private List<Expr> transformAll(List<? extends Expr> exprs) {
        List<Expr> result = new ArrayList<>(exprs.size());
        boolean changed = false;
        for (Expr e : exprs) {
            Expr r = transform(e);
            changed |= (r != e);
            result.add(r);
        }
        return changed ? result : null;
    }

    protected static Expr.Logical asLogical(Expr e) {
        if (e instanceof Expr.Logical) {
            return (Expr.Logical) e;
        }
        throw new IllegalArgumentException("expected predicate, found " + e);
    }
}
