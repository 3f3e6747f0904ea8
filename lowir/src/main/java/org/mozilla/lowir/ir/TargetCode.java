/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/** A component of an {@link AtomicStatement.InlineTargetCode} statement. */
public abstract class TargetCode extends IrNode {

    {
        type = Token.TARGET_CODE;
    }

    private TargetCode() {}

    /** Literal target language text. */
    public static final class Raw extends TargetCode {
        private final String code;

        public Raw(String code) {
            this.code = Objects.requireNonNull(code);
        }

        public String getCode() {
            return code;
        }

        @Override
        public String toSource(int depth) {
            return code;
        }

        @Override
        public void visit(IrVisitor v) {
            v.visit(this);
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Raw && code.equals(((Raw) obj).code);
        }

        @Override
        public int hashCode() {
            return code.hashCode();
        }
    }

    /** An IR value read by the target code. */
    public static final class Input extends TargetCode {
        private final Rval value;

        public Input(Rval value) {
            this.value = Objects.requireNonNull(value);
        }

        public Rval getValue() {
            return value;
        }

        @Override
        public String toSource(int depth) {
            return value.toSource(0);
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                value.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Input && value.equals(((Input) obj).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode() + 1;
        }
    }

    /** An IR location written by the target code. */
    public static final class Output extends TargetCode {
        private final Lval target;

        public Output(Lval target) {
            this.target = Objects.requireNonNull(target);
        }

        public Lval getTarget() {
            return target;
        }

        @Override
        public String toSource(int depth) {
            return target.toSource(0);
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                target.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Output && target.equals(((Output) obj).target);
        }

        @Override
        public int hashCode() {
            return target.hashCode() + 2;
        }
    }
}
