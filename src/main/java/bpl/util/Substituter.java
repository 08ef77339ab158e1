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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import bpl.core.BoogieFile;
import bpl.core.BoogieFile.Decl;
import bpl.core.BoogieFile.Expr;

/**
 * Replaces free occurrences of variables with expressions. Variables
 * bound by an enclosing quantifier are never replaced. A quantified variable
 * whose name occurs in one of the replacement expressions is renamed apart
 * first, so that the replacement cannot be captured. When constructed with
 * an <i>old</i> mapping, every <code>old(e)</code> is replaced by
 * <code>e</code> where variables in the old mapping take precedence over those
 * in the ordinary mapping.
 */
public class Substituter extends AbstractExpressionTransform {
    private final Map<String, Expr> always;
    private final Map<String, Expr> forOld;
    /**
     * Enclosing binders, innermost first. A bound name maps to its renaming, or
     * to <code>null</code> when it keeps its name.
     */
    private final Deque<Map<String, Expr.VariableAccess>> bound = new ArrayDeque<>();
    private Set<String> capturable;
    private int oldDepth;

    public Substituter(Map<String, ? extends Expr> always) {
        this(always, null);
    }

    public Substituter(Map<String, ? extends Expr> always, Map<String, ? extends Expr> forOld) {
        this.always = new HashMap<String, Expr>(always);
        this.forOld = forOld == null ? null : new HashMap<String, Expr>(forOld);
    }

    /**
     * Substitute through a predicate using a single mapping.
     *
     * @param map
     * @param e
     * @return
     */
    public static Expr.Logical apply(Map<String, ? extends Expr> map, Expr.Logical e) {
        return new Substituter(map).transform(e);
    }

    /**
     * Substitute through a predicate, eliminating <code>old</code> expressions.
     *
     * @param always
     * @param forOld
     * @param e
     * @return
     */
    public static Expr.Logical applyReplacingOldExprs(Map<String, ? extends Expr> always,
            Map<String, ? extends Expr> forOld, Expr.Logical e) {
        return new Substituter(always, forOld).transform(e);
    }

    public Map<String, Expr> getMapping() {
        return Collections.unmodifiableMap(always);
    }

    @Override
    protected Expr transformVariableAccess(Expr.VariableAccess expr) {
        String name = expr.getVariable();
        for (Map<String, Expr.VariableAccess> scope : bound) {
            if (scope.containsKey(name)) {
                Expr.VariableAccess renamed = scope.get(name);
                return renamed == null ? expr : renamed;
            }
        }
        if (oldDepth > 0 && forOld.containsKey(name)) {
            return forOld.get(name);
        } else if (always.containsKey(name)) {
            return always.get(name);
        } else {
            return expr;
        }
    }

    @Override
    protected Expr transformOld(Expr.Old expr) {
        if (forOld == null) {
            return super.transformOld(expr);
        }
        oldDepth++;
        try {
            // NOTE: the old wrapper is dropped here
            return transform(expr.getOperand());
        } finally {
            oldDepth--;
        }
    }

    @Override
    protected Expr transformQuantifier(Expr.Quantifier expr) {
        Set<String> capturable = getCapturable();
        Map<String, Expr.VariableAccess> scope = new HashMap<>();
        Set<String> taken = null;
        for (Decl.Parameter p : expr.getParameters()) {
            if (capturable.contains(p.getName())) {
                if (taken == null) {
                    taken = new HashSet<>(capturable);
                    taken.addAll(Util.getAccessedVariables(expr));
                }
                String fresh = freshName(p.getName(), taken);
                taken.add(fresh);
                scope.put(p.getName(), BoogieFile.VAR(fresh));
            } else {
                scope.put(p.getName(), null);
            }
        }
        bound.push(scope);
        try {
            if (taken == null) {
                return super.transformQuantifier(expr);
            }
            List<Decl.Parameter> parameters = new ArrayList<>();
            for (Decl.Parameter p : expr.getParameters()) {
                parameters.add(rename(p, scope.get(p.getName())));
            }
            Expr.Logical body = transform(expr.getBody());
            if (expr instanceof Expr.UniversalQuantifier) {
                return BoogieFile.FORALL(parameters, body, expr.getAttributes());
            } else {
                return BoogieFile.EXISTS(parameters, body, expr.getAttributes());
            }
        } finally {
            bound.pop();
        }
    }

    private Decl.Parameter rename(Decl.Parameter p, Expr.VariableAccess renamed) {
        String name = renamed == null ? p.getName() : renamed.getVariable();
        if (p instanceof Decl.Variable && ((Decl.Variable) p).getWhere() != null) {
            return new Decl.Variable(name, p.getType(), transform(((Decl.Variable) p).getWhere()), p.getAttributes());
        } else if (renamed == null) {
            return p;
        } else {
            return new Decl.Parameter(name, p.getType(), p.getAttributes());
        }
    }

    /**
     * Names which a quantifier must not bind, since they occur in some
     * replacement expression.
     */
    private Set<String> getCapturable() {
        if (capturable == null) {
            capturable = new HashSet<>();
            for (Expr e : always.values()) {
                capturable.addAll(Util.getAccessedVariables(e));
            }
            if (forOld != null) {
                for (Expr e : forOld.values()) {
                    capturable.addAll(Util.getAccessedVariables(e));
                }
            }
        }
        return capturable;
    }

    private static String freshName(String name, Set<String> taken) {
        for (int i = 0;; ++i) {
            String candidate = name + "#" + i;
            if (!taken.contains(candidate)) {
                return candidate;
            }
        }
    }
}
