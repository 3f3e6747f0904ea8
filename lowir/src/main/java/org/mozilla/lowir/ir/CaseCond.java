/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/** A switch case match condition: a single value or an inclusive range. */
public abstract class CaseCond extends IrNode {

    private CaseCond() {}

    public static final class MatchValue extends CaseCond {
        private final Rval value;

        {
            type = Token.MATCH_VALUE;
        }

        public MatchValue(Rval value) {
            this.value = Objects.requireNonNull(value);
        }

        public Rval getValue() {
            return value;
        }

        @Override
        public String toSource(int depth) {
            return "case " + value.toSource(0);
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                value.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof MatchValue && value.equals(((MatchValue) obj).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    public static final class MatchRange extends CaseCond {
        private final Rval low;
        private final Rval high;

        {
            type = Token.MATCH_RANGE;
        }

        public MatchRange(Rval low, Rval high) {
            this.low = Objects.requireNonNull(low);
            this.high = Objects.requireNonNull(high);
        }

        public Rval getLow() {
            return low;
        }

        public Rval getHigh() {
            return high;
        }

        @Override
        public String toSource(int depth) {
            return "case " + low.toSource(0) + " ... " + high.toSource(0);
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                low.visit(v);
                high.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof MatchRange)) return false;
            MatchRange other = (MatchRange) obj;
            return low.equals(other.low) && high.equals(other.high);
        }

        @Override
        public int hashCode() {
            return low.hashCode() * 31 + high.hashCode();
        }
    }
}
