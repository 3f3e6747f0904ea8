/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/** An rvalue: an expression without side effects. */
public abstract class Rval extends IrNode {

    private Rval() {}

    public static LvalRef of(Lval lval) {
        return new LvalRef(lval);
    }

    public static Unop cast(IrType toType, Rval operand) {
        return new Unop(null, toType, operand);
    }

    public static Unop unop(String op, Rval operand) {
        return new Unop(op, null, operand);
    }

    public static Binop binop(String op, Rval left, Rval right) {
        return new Binop(op, left, right);
    }

    /** The value currently held by an lvalue. */
    public static final class LvalRef extends Rval {
        private final Lval lval;

        {
            type = Token.LVAL;
        }

        public LvalRef(Lval lval) {
            this.lval = Objects.requireNonNull(lval);
        }

        public Lval getLval() {
            return lval;
        }

        @Override
        public String toSource(int depth) {
            return lval.toSource(0);
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                lval.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof LvalRef && lval.equals(((LvalRef) obj).lval);
        }

        @Override
        public int hashCode() {
            return lval.hashCode() + 7;
        }
    }

    /** A tagged pointer: {@code operand} with primary tag {@code tag}. */
    public static final class MkWord extends Rval {
        private final int tag;
        private final Rval operand;

        {
            type = Token.MKWORD;
        }

        public MkWord(int tag, Rval operand) {
            this.tag = tag;
            this.operand = Objects.requireNonNull(operand);
        }

        public int getTag() {
            return tag;
        }

        public Rval getOperand() {
            return operand;
        }

        @Override
        public String toSource(int depth) {
            return "MR_mkword(" + tag + ", " + operand.toSource(0) + ")";
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                operand.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof MkWord)) return false;
            MkWord other = (MkWord) obj;
            return tag == other.tag && operand.equals(other.operand);
        }

        @Override
        public int hashCode() {
            return tag * 31 + operand.hashCode();
        }
    }

    /** A constant. */
    public static final class Const extends Rval {

        public enum Kind {
            INT,
            FLOAT,
            STRING,
            NULL,
            CODE_ADDR
        }

        private final Kind kind;
        private final Object value;

        {
            type = Token.CONST;
        }

        private Const(Kind kind, Object value) {
            this.kind = kind;
            this.value = value;
        }

        public static Const intConst(long value) {
            return new Const(Kind.INT, value);
        }

        public static Const floatConst(double value) {
            return new Const(Kind.FLOAT, value);
        }

        public static Const stringConst(String value) {
            return new Const(Kind.STRING, Objects.requireNonNull(value));
        }

        /** The null pointer of the given type. */
        public static Const nullConst(IrType pointerType) {
            return new Const(Kind.NULL, Objects.requireNonNull(pointerType));
        }

        public static Const codeAddr(CodeAddr addr) {
            return new Const(Kind.CODE_ADDR, Objects.requireNonNull(addr));
        }

        public Kind getKind() {
            return kind;
        }

        /**
         * Returns the constant's value: a {@code Long}, {@code Double} or {@code String}, the
         * pointer type of a null constant, or a {@link CodeAddr}.
         */
        public Object getValue() {
            return value;
        }

        @Override
        public String toSource(int depth) {
            switch (kind) {
                case STRING:
                    return "\"" + ((String) value).replace("\\", "\\\\").replace("\"", "\\\"")
                            + "\"";
                case NULL:
                    return "NULL";
                case CODE_ADDR:
                    return "&" + value;
                default:
                    return String.valueOf(value);
            }
        }

        @Override
        public void visit(IrVisitor v) {
            v.visit(this);
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Const)) return false;
            Const other = (Const) obj;
            return kind == other.kind && value.equals(other.value);
        }

        @Override
        public int hashCode() {
            return kind.hashCode() * 31 + value.hashCode();
        }
    }

    /** A unary operation, or a cast if {@link #getCastType()} is non-null. */
    public static final class Unop extends Rval {
        private final String op;
        private final IrType castType;
        private final Rval operand;

        {
            type = Token.UNOP;
        }

        Unop(String op, IrType castType, Rval operand) {
            this.op = op;
            this.castType = castType;
            this.operand = Objects.requireNonNull(operand);
        }

        public String getOp() {
            return op;
        }

        public IrType getCastType() {
            return castType;
        }

        public boolean isCast() {
            return castType != null;
        }

        public Rval getOperand() {
            return operand;
        }

        public Unop withOperand(Rval newOperand) {
            return new Unop(op, castType, newOperand);
        }

        @Override
        public String toSource(int depth) {
            if (castType != null) {
                return "((" + castType.toSource() + ") " + operand.toSource(0) + ")";
            }
            return op + "(" + operand.toSource(0) + ")";
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                operand.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Unop)) return false;
            Unop other = (Unop) obj;
            return Objects.equals(op, other.op)
                    && Objects.equals(castType, other.castType)
                    && operand.equals(other.operand);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, castType, operand);
        }
    }

    public static final class Binop extends Rval {
        private final String op;
        private final Rval left;
        private final Rval right;

        {
            type = Token.BINOP;
        }

        Binop(String op, Rval left, Rval right) {
            this.op = Objects.requireNonNull(op);
            this.left = Objects.requireNonNull(left);
            this.right = Objects.requireNonNull(right);
        }

        public String getOp() {
            return op;
        }

        public Rval getLeft() {
            return left;
        }

        public Rval getRight() {
            return right;
        }

        @Override
        public String toSource(int depth) {
            return "(" + left.toSource(0) + " " + op + " " + right.toSource(0) + ")";
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                left.visit(v);
                right.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Binop)) return false;
            Binop other = (Binop) obj;
            return op.equals(other.op) && left.equals(other.left) && right.equals(other.right);
        }

        @Override
        public int hashCode() {
            return Objects.hash(op, left, right);
        }
    }

    /** The address of an lvalue. */
    public static final class MemAddr extends Rval {
        private final Lval lval;

        {
            type = Token.MEM_ADDR;
        }

        public MemAddr(Lval lval) {
            this.lval = Objects.requireNonNull(lval);
        }

        public Lval getLval() {
            return lval;
        }

        @Override
        public String toSource(int depth) {
            return "&" + lval.toSource(0);
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                lval.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof MemAddr && lval.equals(((MemAddr) obj).lval);
        }

        @Override
        public int hashCode() {
            return lval.hashCode() + 11;
        }
    }

    /** The object a method is invoked on. */
    public static final class Self extends Rval {
        private final IrType selfType;

        {
            type = Token.SELF;
        }

        public Self(IrType selfType) {
            this.selfType = Objects.requireNonNull(selfType);
        }

        public IrType getSelfType() {
            return selfType;
        }

        @Override
        public String toSource(int depth) {
            return "this";
        }

        @Override
        public void visit(IrVisitor v) {
            v.visit(this);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Self && selfType.equals(((Self) obj).selfType);
        }

        @Override
        public int hashCode() {
            return selfType.hashCode() + 13;
        }
    }
}
