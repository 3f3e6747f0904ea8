/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/** An lvalue: something that can be assigned to. */
public abstract class Lval extends IrNode {

    private Lval() {}

    /** A variable reference. Every variable occurrence in the IR is one of these. */
    public static final class Var extends Lval {
        private final QualVar var;
        private final IrType varType;

        {
            type = Token.VAR;
        }

        public Var(QualVar var, IrType varType) {
            this.var = Objects.requireNonNull(var);
            this.varType = Objects.requireNonNull(varType);
        }

        public QualVar getVar() {
            return var;
        }

        public IrType getVarType() {
            return varType;
        }

        @Override
        public String toSource(int depth) {
            return var.getVarName().toIdentifier();
        }

        @Override
        public void visit(IrVisitor v) {
            v.visit(this);
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Var)) return false;
            Var other = (Var) obj;
            return var.equals(other.var) && varType.equals(other.varType);
        }

        @Override
        public int hashCode() {
            return var.hashCode() * 31 + varType.hashCode();
        }
    }

    /** Identifies a field either by name or by word offset. */
    public abstract static class FieldId {
        private FieldId() {}
    }

    /** A field named {@code qualifier.fieldName} of the class {@code classPtrType} points to. */
    public static final class NamedField extends FieldId {
        private final String qualifier;
        private final String fieldName;
        private final IrType classPtrType;

        public NamedField(String qualifier, String fieldName, IrType classPtrType) {
            this.qualifier = Objects.requireNonNull(qualifier);
            this.fieldName = Objects.requireNonNull(fieldName);
            this.classPtrType = Objects.requireNonNull(classPtrType);
        }

        public String getQualifier() {
            return qualifier;
        }

        public String getFieldName() {
            return fieldName;
        }

        public IrType getClassPtrType() {
            return classPtrType;
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof NamedField)) return false;
            NamedField other = (NamedField) obj;
            return qualifier.equals(other.qualifier)
                    && fieldName.equals(other.fieldName)
                    && classPtrType.equals(other.classPtrType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(qualifier, fieldName, classPtrType);
        }
    }

    public static final class OffsetField extends FieldId {
        private final Rval offset;

        public OffsetField(Rval offset) {
            this.offset = Objects.requireNonNull(offset);
        }

        public Rval getOffset() {
            return offset;
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof OffsetField && offset.equals(((OffsetField) obj).offset);
        }

        @Override
        public int hashCode() {
            return offset.hashCode();
        }
    }

    /**
     * A field of the object {@code ptr} points to. A tag of zero marks a direct, zero-offset
     * access, which lets back ends address the field without untagging the pointer.
     */
    public static final class Field extends Lval {
        private final Integer tag;
        private final Rval ptr;
        private final FieldId fieldId;
        private final IrType fieldType;
        private final IrType ptrType;

        {
            type = Token.FIELD;
        }

        /**
         * @param tag the primary tag of {@code ptr}, or {@code null} if unknown
         */
        public Field(Integer tag, Rval ptr, FieldId fieldId, IrType fieldType, IrType ptrType) {
            this.tag = tag;
            this.ptr = Objects.requireNonNull(ptr);
            this.fieldId = Objects.requireNonNull(fieldId);
            this.fieldType = Objects.requireNonNull(fieldType);
            this.ptrType = Objects.requireNonNull(ptrType);
        }

        public Integer getTag() {
            return tag;
        }

        public Rval getPtr() {
            return ptr;
        }

        public FieldId getFieldId() {
            return fieldId;
        }

        public IrType getFieldType() {
            return fieldType;
        }

        public IrType getPtrType() {
            return ptrType;
        }

        /** Returns a copy of this field access with a different pointer. */
        public Field withPtr(Rval newPtr) {
            return new Field(tag, newPtr, fieldId, fieldType, ptrType);
        }

        @Override
        public String toSource(int depth) {
            String ptrSource = ptr.toSource(0);
            boolean direct = tag != null && tag == 0;
            if (fieldId instanceof NamedField) {
                String name = ((NamedField) fieldId).getFieldName();
                if (direct) {
                    return ptrSource + "->" + name;
                }
                return "MR_field(" + tag + ", " + ptrSource + ", " + name + ")";
            }
            String offset = ((OffsetField) fieldId).getOffset().toSource(0);
            if (direct) {
                return "MR_hl_field(" + ptrSource + ", " + offset + ")";
            }
            return "MR_field(" + tag + ", " + ptrSource + ", " + offset + ")";
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                ptr.visit(v);
                if (fieldId instanceof OffsetField) {
                    ((OffsetField) fieldId).getOffset().visit(v);
                }
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof Field)) return false;
            Field other = (Field) obj;
            return Objects.equals(tag, other.tag)
                    && ptr.equals(other.ptr)
                    && fieldId.equals(other.fieldId)
                    && fieldType.equals(other.fieldType)
                    && ptrType.equals(other.ptrType);
        }

        @Override
        public int hashCode() {
            return Objects.hash(tag, ptr, fieldId, fieldType, ptrType);
        }
    }

    /** The memory {@code addr} points to. */
    public static final class MemRef extends Lval {
        private final Rval addr;
        private final IrType refType;

        {
            type = Token.MEM_REF;
        }

        public MemRef(Rval addr, IrType refType) {
            this.addr = Objects.requireNonNull(addr);
            this.refType = Objects.requireNonNull(refType);
        }

        public Rval getAddr() {
            return addr;
        }

        public IrType getRefType() {
            return refType;
        }

        @Override
        public String toSource(int depth) {
            return "*" + addr.toSource(0);
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                addr.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (this == obj) return true;
            if (!(obj instanceof MemRef)) return false;
            MemRef other = (MemRef) obj;
            return addr.equals(other.addr) && refType.equals(other.refType);
        }

        @Override
        public int hashCode() {
            return addr.hashCode() * 31 + refType.hashCode();
        }
    }
}
