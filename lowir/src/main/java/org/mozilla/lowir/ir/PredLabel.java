/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;

/**
 * Label of the source-level procedure a function was generated from. Either an ordinary
 * predicate or function, or a compiler generated special procedure for a type (unify, compare,
 * index).
 */
public abstract class PredLabel {

    private PredLabel() {}

    /**
     * Returns the mangled label used when deriving the names of generated entities, such as
     * environment structs.
     */
    public abstract String mangledName();

    @Override
    public String toString() {
        return mangledName();
    }

    /** Converts a dotted module name to its mangled form, {@code a.b} becomes {@code a__b}. */
    public static String mangleModuleName(String moduleName) {
        return moduleName.replace(".", "__");
    }

    public static Proc predicate(String name, int arity) {
        return new Proc(false, null, name, arity);
    }

    public static Proc function(String name, int arity) {
        return new Proc(true, null, name, arity);
    }

    /** An ordinary predicate or function. */
    public static final class Proc extends PredLabel {
        private final boolean isFunction;
        private final String definingModule;
        private final String name;
        private final int arity;

        /**
         * @param isFunction {@code true} for a function, {@code false} for a predicate
         * @param definingModule the defining module if it differs from the module the code is
         *     generated in, else {@code null}
         * @param name the procedure name
         * @param arity the procedure arity
         */
        public Proc(boolean isFunction, String definingModule, String name, int arity) {
            this.isFunction = isFunction;
            this.definingModule = definingModule;
            this.name = Objects.requireNonNull(name);
            this.arity = arity;
        }

        public boolean isFunction() {
            return isFunction;
        }

        public String getDefiningModule() {
            return definingModule;
        }

        public String getName() {
            return name;
        }

        public int getArity() {
            return arity;
        }

        @Override
        public String mangledName() {
            String suffix = isFunction ? "f" : "p";
            if (definingModule != null) {
                return String.format(
                        "%s_%d_%s_in__%s", name, arity, suffix, mangleModuleName(definingModule));
            }
            return String.format("%s_%d_%s", name, arity, suffix);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Proc)) return false;
            Proc other = (Proc) obj;
            return isFunction == other.isFunction
                    && arity == other.arity
                    && name.equals(other.name)
                    && Objects.equals(definingModule, other.definingModule);
        }

        @Override
        public int hashCode() {
            return Objects.hash(isFunction, definingModule, name, arity);
        }
    }

    /** A compiler generated procedure for a type, e.g. {@code __Unify__} for {@code list/1}. */
    public static final class Special extends PredLabel {
        private final String predName;
        private final String typeModule;
        private final String typeName;
        private final int typeArity;

        public Special(String predName, String typeModule, String typeName, int typeArity) {
            this.predName = Objects.requireNonNull(predName);
            this.typeModule = typeModule;
            this.typeName = Objects.requireNonNull(typeName);
            this.typeArity = typeArity;
        }

        public String getPredName() {
            return predName;
        }

        public String getTypeModule() {
            return typeModule;
        }

        public String getTypeName() {
            return typeName;
        }

        public int getTypeArity() {
            return typeArity;
        }

        @Override
        public String mangledName() {
            if (typeModule != null) {
                return String.format(
                        "%s__%s__%s_%d",
                        predName, mangleModuleName(typeModule), typeName, typeArity);
            }
            return String.format("%s__%s_%d", predName, typeName, typeArity);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Special)) return false;
            Special other = (Special) obj;
            return typeArity == other.typeArity
                    && predName.equals(other.predName)
                    && typeName.equals(other.typeName)
                    && Objects.equals(typeModule, other.typeModule);
        }

        @Override
        public int hashCode() {
            return Objects.hash(predName, typeModule, typeName, typeArity);
        }
    }
}
