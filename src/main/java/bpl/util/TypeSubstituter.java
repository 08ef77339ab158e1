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

import java.util.Map;

import bpl.core.BoogieFile.Type;

/**
 * Instantiates the type parameters occurring in a type, and infers such
 * instantiations by matching a type containing parameters against a concrete
 * one.
 */
public class TypeSubstituter {

    /**
     * Replace every type parameter in a given type which has a binding in the
     * given instantiation. Unbound parameters are left as is.
     *
     * @param type
     * @param instantiation
     * @return
     */
    public static Type apply(Type type, Map<String, Type> instantiation) {
        if (type instanceof Type.Variable) {
            Type t = instantiation.get(((Type.Variable) type).getName());
            return t == null ? type : t;
        } else if (type instanceof Type.Dictionary) {
            Type.Dictionary t = (Type.Dictionary) type;
            Type key = apply(t.getKey(), instantiation);
            Type value = apply(t.getValue(), instantiation);
            if (key == t.getKey() && value == t.getValue()) {
                return type;
            }
            return new Type.Dictionary(key, value, t.getAttributes());
        } else {
            return type;
        }
    }

    /**
     * Match a formal type against an actual type, extending the given bindings for
     * type parameters as necessary.
     *
     * @param formal
     *            Type which may contain parameters.
     * @param actual
     *            Concrete type being matched.
     * @param bindings
     *            Bindings determined so far (updated in place).
     * @return <code>false</code> if the types cannot be matched.
     */
    public static boolean unify(Type formal, Type actual, Map<String, Type> bindings) {
        if (formal instanceof Type.Variable) {
            String name = ((Type.Variable) formal).getName();
            Type bound = bindings.get(name);
            if (bound == null) {
                bindings.put(name, actual);
                return true;
            }
            return bound.equals(actual);
        } else if (formal instanceof Type.Dictionary && actual instanceof Type.Dictionary) {
            Type.Dictionary f = (Type.Dictionary) formal;
            Type.Dictionary a = (Type.Dictionary) actual;
            return unify(f.getKey(), a.getKey(), bindings) && unify(f.getValue(), a.getValue(), bindings);
        } else {
            return formal.equals(actual);
        }
    }
}
