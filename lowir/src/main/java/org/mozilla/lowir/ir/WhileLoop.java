/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/**
 * A while loop. If {@code loopAtLeastOnce} is set the condition is tested after the body, as in
 * a do-while loop.
 */
public class WhileLoop extends Statement {

    private final Rval condition;
    private final Statement body;
    private final boolean loopAtLeastOnce;

    {
        type = Token.WHILE;
    }

    public WhileLoop(Rval condition, Statement body, boolean loopAtLeastOnce, Context context) {
        super(context);
        this.condition = Objects.requireNonNull(condition);
        this.body = Objects.requireNonNull(body);
        this.loopAtLeastOnce = loopAtLeastOnce;
    }

    public Rval getCondition() {
        return condition;
    }

    public Statement getBody() {
        return body;
    }

    public boolean isLoopAtLeastOnce() {
        return loopAtLeastOnce;
    }

    @Override
    public String toSource(int depth) {
        String pad = makeIndent(depth);
        if (loopAtLeastOnce) {
            return pad + "do\n" + nested(body, depth) + pad + "while (" + condition.toSource(0)
                    + ");\n";
        }
        return pad + "while (" + condition.toSource(0) + ")\n" + nested(body, depth);
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            condition.visit(v);
            body.visit(v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof WhileLoop)) return false;
        WhileLoop other = (WhileLoop) obj;
        return loopAtLeastOnce == other.loopAtLeastOnce
                && context.equals(other.context)
                && condition.equals(other.condition)
                && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return condition.hashCode() * 31 + body.hashCode();
    }
}
