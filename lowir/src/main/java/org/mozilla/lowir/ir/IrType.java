/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.List;
import java.util.Objects;
import org.mozilla.lowir.Kit;

/** Types of the low level IR. */
public abstract class IrType {

    private IrType() {}

    /** A boxed value of any type, the IR equivalent of {@code MR_Box}. */
    public static final IrType GENERIC = new Singleton("MR_Box");

    /** A pointer to some environment struct, the IR equivalent of {@code void *}. */
    public static final IrType GENERIC_ENV_PTR = new Singleton("void *");

    /**
     * Placeholder the code generator leaves on references whose type is only known once the
     * enclosing environment has been built.
     */
    public static final IrType UNKNOWN = new Singleton("<unknown>");

    public static IrType named(String name) {
        return new Native(name);
    }

    public static IrType pointerTo(IrType target) {
        return new Pointer(target);
    }

    /** Type spelling as used by {@code toSource}. */
    public abstract String toSource();

    @Override
    public String toString() {
        return toSource();
    }

    private static final class Singleton extends IrType {
        private final String spelling;

        Singleton(String spelling) {
            this.spelling = spelling;
        }

        @Override
        public String toSource() {
            return spelling;
        }
    }

    /** A target language type named directly, e.g. {@code MR_Integer}. */
    public static final class Native extends IrType {
        private final String name;

        public Native(String name) {
            this.name = Objects.requireNonNull(name);
        }

        public String getName() {
            return name;
        }

        @Override
        public String toSource() {
            return name;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Native && name.equals(((Native) obj).name);
        }

        @Override
        public int hashCode() {
            return name.hashCode();
        }
    }

    public static final class Pointer extends IrType {
        private final IrType target;

        public Pointer(IrType target) {
            this.target = Objects.requireNonNull(target);
        }

        public IrType getTarget() {
            return target;
        }

        @Override
        public String toSource() {
            return target.toSource() + " *";
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Pointer && target.equals(((Pointer) obj).target);
        }

        @Override
        public int hashCode() {
            return target.hashCode() * 17 + 1;
        }
    }

    /** A struct (value type) or class (reference type) declared in some module. */
    public static final class ClassType extends IrType {

        public enum Kind {
            STRUCT,
            CLASS
        }

        private final String moduleName;
        private final String className;
        private final int arity;
        private final Kind kind;

        public ClassType(String moduleName, String className, int arity, Kind kind) {
            this.moduleName = Objects.requireNonNull(moduleName);
            this.className = Objects.requireNonNull(className);
            this.arity = arity;
            this.kind = Objects.requireNonNull(kind);
        }

        public String getModuleName() {
            return moduleName;
        }

        public String getClassName() {
            return className;
        }

        public int getArity() {
            return arity;
        }

        public Kind getKind() {
            return kind;
        }

        /**
         * The qualifier of members of this class: the module name with the class name appended.
         */
        public String getMemberQualifier() {
            String name = arity == 0 ? className : className + "_" + arity;
            return moduleName + "." + name;
        }

        @Override
        public String toSource() {
            return (kind == Kind.STRUCT ? "struct " : "class ") + className;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof ClassType)) return false;
            ClassType other = (ClassType) obj;
            return arity == other.arity
                    && kind == other.kind
                    && moduleName.equals(other.moduleName)
                    && className.equals(other.className);
        }

        @Override
        public int hashCode() {
            return Objects.hash(moduleName, className, arity, kind);
        }
    }

    /** Type of a pointer to a function with the given signature. */
    public static final class FuncType extends IrType {
        private final FuncSignature signature;

        public FuncType(FuncSignature signature) {
            this.signature = Objects.requireNonNull(signature);
        }

        public FuncSignature getSignature() {
            return signature;
        }

        @Override
        public String toSource() {
            StringBuilder sb = new StringBuilder();
            List<IrType> returns = signature.getReturnTypes();
            if (returns.isEmpty()) {
                sb.append("void");
            } else if (returns.size() == 1) {
                sb.append(returns.get(0).toSource());
            } else {
                sb.append("(").append(join(returns)).append(")");
            }
            sb.append(" (*)(").append(join(signature.getArgTypes())).append(")");
            return sb.toString();
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof FuncType && signature.equals(((FuncType) obj).signature);
        }

        @Override
        public int hashCode() {
            return signature.hashCode();
        }
    }

    /** Returns the class type behind an environment type, failing if it is something else. */
    public static ClassType asClassType(IrType type) {
        if (!(type instanceof ClassType)) {
            throw Kit.codeBug("expected a class type, got " + type);
        }
        return (ClassType) type;
    }

    static String join(List<IrType> types) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < types.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(types.get(i).toSource());
        }
        return sb.toString();
    }
}
