/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.List;
import java.util.Objects;
import org.mozilla.lowir.Kit;
import org.mozilla.lowir.Token;

/** Jump to the label selected by {@code index}, counting from zero. */
public class ComputedGoto extends Statement {

    private final Rval index;
    private final List<String> labels;

    {
        type = Token.COMPUTED_GOTO;
    }

    public ComputedGoto(Rval index, List<String> labels, Context context) {
        super(context);
        this.index = Objects.requireNonNull(index);
        this.labels = Kit.immutableList(labels);
    }

    public Rval getIndex() {
        return index;
    }

    public List<String> getLabels() {
        return labels;
    }

    @Override
    public String toSource(int depth) {
        return makeIndent(depth) + "goto (" + index.toSource(0) + ") " + labels + ";\n";
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            index.visit(v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ComputedGoto)) return false;
        ComputedGoto other = (ComputedGoto) obj;
        return context.equals(other.context)
                && index.equals(other.index)
                && labels.equals(other.labels);
    }

    @Override
    public int hashCode() {
        return index.hashCode() * 31 + labels.hashCode();
    }
}
