/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/** Jump to a label in the same function. */
public class GotoStatement extends Statement {

    private final String target;

    {
        type = Token.GOTO;
    }

    public GotoStatement(String target, Context context) {
        super(context);
        this.target = Objects.requireNonNull(target);
    }

    public String getTarget() {
        return target;
    }

    @Override
    public String toSource(int depth) {
        return makeIndent(depth) + "goto " + target + ";\n";
    }

    @Override
    public void visit(IrVisitor v) {
        v.visit(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof GotoStatement)) return false;
        GotoStatement other = (GotoStatement) obj;
        return context.equals(other.context) && target.equals(other.target);
    }

    @Override
    public int hashCode() {
        return target.hashCode() + 1;
    }
}
