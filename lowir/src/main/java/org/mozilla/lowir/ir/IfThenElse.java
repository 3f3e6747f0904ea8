/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/** If-then-else statement. The else part is optional. */
public class IfThenElse extends Statement {

    private final Rval condition;
    private final Statement thenPart;
    private final Statement elsePart;

    {
        type = Token.IF;
    }

    public IfThenElse(Rval condition, Statement thenPart, Statement elsePart, Context context) {
        super(context);
        this.condition = Objects.requireNonNull(condition);
        this.thenPart = Objects.requireNonNull(thenPart);
        this.elsePart = elsePart;
    }

    public Rval getCondition() {
        return condition;
    }

    public Statement getThenPart() {
        return thenPart;
    }

    /** Returns the else part, or {@code null} if there is none. */
    public Statement getElsePart() {
        return elsePart;
    }

    @Override
    public String toSource(int depth) {
        String pad = makeIndent(depth);
        StringBuilder sb = new StringBuilder();
        sb.append(pad).append("if (").append(condition.toSource(0)).append(")\n");
        sb.append(nested(thenPart, depth));
        if (elsePart != null) {
            sb.append(pad).append("else\n");
            sb.append(nested(elsePart, depth));
        }
        return sb.toString();
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            condition.visit(v);
            thenPart.visit(v);
            if (elsePart != null) {
                elsePart.visit(v);
            }
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IfThenElse)) return false;
        IfThenElse other = (IfThenElse) obj;
        return context.equals(other.context)
                && condition.equals(other.condition)
                && thenPart.equals(other.thenPart)
                && Objects.equals(elsePart, other.elsePart);
    }

    @Override
    public int hashCode() {
        return Objects.hash(condition, thenPart, elsePart);
    }
}
