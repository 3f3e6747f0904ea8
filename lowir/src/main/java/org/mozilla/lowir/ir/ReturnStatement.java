/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.List;
import org.mozilla.lowir.Kit;
import org.mozilla.lowir.Token;

/** Return from the enclosing function, possibly with several values. */
public class ReturnStatement extends Statement {

    private final List<Rval> values;

    {
        type = Token.RETURN;
    }

    public ReturnStatement(List<Rval> values, Context context) {
        super(context);
        this.values = Kit.immutableList(values);
    }

    public List<Rval> getValues() {
        return values;
    }

    @Override
    public String toSource(int depth) {
        StringBuilder sb = new StringBuilder(makeIndent(depth)).append("return");
        if (values.size() == 1) {
            sb.append(" ").append(values.get(0).toSource(0));
        } else if (!values.isEmpty()) {
            sb.append(" (").append(printList(values)).append(")");
        }
        return sb.append(";\n").toString();
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            visitAll(values, v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ReturnStatement)) return false;
        ReturnStatement other = (ReturnStatement) obj;
        return context.equals(other.context) && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode() + 5;
    }
}
