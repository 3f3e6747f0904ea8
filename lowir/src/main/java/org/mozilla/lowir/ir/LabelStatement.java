/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

public class LabelStatement extends Statement {

    private final String label;

    {
        type = Token.LABEL;
    }

    public LabelStatement(String label, Context context) {
        super(context);
        this.label = Objects.requireNonNull(label);
    }

    public String getLabel() {
        return label;
    }

    @Override
    public String toSource(int depth) {
        return makeIndent(depth) + label + ":\n";
    }

    @Override
    public void visit(IrVisitor v) {
        v.visit(this);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof LabelStatement)) return false;
        LabelStatement other = (LabelStatement) obj;
        return context.equals(other.context) && label.equals(other.label);
    }

    @Override
    public int hashCode() {
        return label.hashCode();
    }
}
