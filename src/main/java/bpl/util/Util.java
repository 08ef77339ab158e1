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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.function.Function;

import bpl.core.BoogieFile.Cmd;
import bpl.core.BoogieFile.Decl;
import bpl.core.BoogieFile.Expr;
import bpl.core.BoogieFile.LVal;

public class Util {

    /**
     * Map a given list of elements from one kind to another.
     *
     * @param items
     * @param fn
     * @param <T>
     * @return
     */
    public static <S,T> List<T> map(List<S> items, Function<S,T> fn) {
        ArrayList<T> rs = new ArrayList<>();
        for(int i=0;i!=items.size();++i) {
            rs.add(fn.apply(items.get(i)));
        }
        return rs;
    }

    /**
     * Functional list append.  This creates a fresh list containing both <code>left</code> and <code>right</code> operands.
     * @param left
     * @param right
     * @param <T>
     * @return
     */
    public static <T> List<T> append(List<T> left, List<T> right) {
        ArrayList<T> result = new ArrayList<>();
        result.addAll(left);
        result.addAll(right);
        return result;
    }

    /**
     * Determine the variable ultimately updated by assigning to a given
     * left-hand side. For example, assigning to <code>m[i][j]</code> updates
     * <code>m</code>.
     *
     * @param lval
     * @return
     */
    public static Expr.VariableAccess getDeepAssignedVariable(LVal lval) {
        if (lval instanceof Expr.VariableAccess) {
            return (Expr.VariableAccess) lval;
        } else if (lval instanceof Expr.DictionaryAccess) {
            Expr source = ((Expr.DictionaryAccess) lval).getSource();
            if (source instanceof LVal) {
                return getDeepAssignedVariable((LVal) source);
            }
        }
        throw new IllegalArgumentException("invalid left-hand side: " + lval);
    }

    /**
     * Determine the names of all variables accessed anywhere in a given
     * expression, whether free or bound by a quantifier.
     *
     * @param expr
     * @return
     */
    public static Set<String> getAccessedVariables(Expr expr) {
        LinkedHashSet<String> vars = new LinkedHashSet<>();
        new AbstractExpressionTransform() {
            @Override
            protected Expr transformVariableAccess(Expr.VariableAccess e) {
                vars.add(e.getVariable());
                return e;
            }
        }.transform(expr);
        return vars;
    }

    /**
     * Determine the names of all variables which may be modified by executing a
     * given command. For a resolved call this includes every global in the
     * callee's modifies clause.
     *
     * @param cmd
     * @return
     */
    public static Set<String> getAssignedVariables(Cmd cmd) {
        LinkedHashSet<String> vars = new LinkedHashSet<>();
        addAssignedVariables(cmd, vars);
        return vars;
    }

    private static void addAssignedVariables(Cmd cmd, Set<String> vars) {
        if (cmd instanceof Cmd.Assignment) {
            for (LVal lhs : ((Cmd.Assignment) cmd).getLeftHandSides()) {
                vars.add(getDeepAssignedVariable(lhs).getVariable());
            }
        } else if (cmd instanceof Cmd.Havoc) {
            for (Expr.VariableAccess v : ((Cmd.Havoc) cmd).getVariables()) {
                vars.add(v.getVariable());
            }
        } else if (cmd instanceof Cmd.Call) {
            Cmd.Call call = (Cmd.Call) cmd;
            for (Expr.VariableAccess v : call.getOuts()) {
                if (v != null) {
                    vars.add(v.getVariable());
                }
            }
            if (call.isResolved()) {
                vars.addAll(call.getProcedure().getModifies());
            }
        } else if (cmd instanceof Cmd.State) {
            Cmd.State state = (Cmd.State) cmd;
            LinkedHashSet<String> inner = new LinkedHashSet<>();
            for (Cmd c : state.getCmds()) {
                addAssignedVariables(c, inner);
            }
            for (Decl.Variable v : state.getLocals()) {
                inner.remove(v.getName());
            }
            vars.addAll(inner);
        }
    }
}
