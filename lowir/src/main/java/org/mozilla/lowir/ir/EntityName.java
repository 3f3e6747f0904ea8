/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;

/** The name of a definition: a function, a data item (variable) or a type. */
public abstract class EntityName {

    private EntityName() {}

    /** The name as it appears in generated code. */
    public abstract String toIdentifier();

    @Override
    public String toString() {
        return toIdentifier();
    }

    /**
     * Name of a function generated for one mode of a procedure. Nested functions and other
     * auxiliary functions of the same procedure are told apart by their sequence number.
     */
    public static final class FunctionName extends EntityName {
        private final PredLabel predLabel;
        private final int modeNum;
        private final Integer seqNum;

        public FunctionName(PredLabel predLabel, int modeNum, Integer seqNum) {
            this.predLabel = Objects.requireNonNull(predLabel);
            this.modeNum = modeNum;
            this.seqNum = seqNum;
        }

        public PredLabel getPredLabel() {
            return predLabel;
        }

        public int getModeNum() {
            return modeNum;
        }

        /** Returns the sequence number, or {@code null} for the procedure's main function. */
        public Integer getSeqNum() {
            return seqNum;
        }

        @Override
        public String toIdentifier() {
            String base = predLabel.mangledName() + "_" + modeNum;
            return seqNum == null ? base : base + "_" + seqNum;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof FunctionName)) return false;
            FunctionName other = (FunctionName) obj;
            return modeNum == other.modeNum
                    && predLabel.equals(other.predLabel)
                    && Objects.equals(seqNum, other.seqNum);
        }

        @Override
        public int hashCode() {
            return Objects.hash(predLabel, modeNum, seqNum);
        }
    }

    /** Name of a variable, a field or a constant. */
    public static final class DataName extends EntityName {
        private final VarName varName;

        public DataName(VarName varName) {
            this.varName = Objects.requireNonNull(varName);
        }

        public VarName getVarName() {
            return varName;
        }

        @Override
        public String toIdentifier() {
            return varName.toIdentifier();
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof DataName && varName.equals(((DataName) obj).varName);
        }

        @Override
        public int hashCode() {
            return varName.hashCode();
        }
    }

    /** Name of a struct or class type. */
    public static final class TypeName extends EntityName {
        private final String className;
        private final int arity;

        public TypeName(String className, int arity) {
            this.className = Objects.requireNonNull(className);
            this.arity = arity;
        }

        public String getClassName() {
            return className;
        }

        public int getArity() {
            return arity;
        }

        @Override
        public String toIdentifier() {
            return arity == 0 ? className : className + "_" + arity;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof TypeName)) return false;
            TypeName other = (TypeName) obj;
            return arity == other.arity && className.equals(other.className);
        }

        @Override
        public int hashCode() {
            return className.hashCode() * 31 + arity;
        }
    }
}
