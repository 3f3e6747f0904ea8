/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/** Commits to the first solution, unwinding to the matching {@link TryCommit}. */
public class DoCommit extends Statement {

    private final Rval ref;

    {
        type = Token.DO_COMMIT;
    }

    public DoCommit(Rval ref, Context context) {
        super(context);
        this.ref = Objects.requireNonNull(ref);
    }

    public Rval getRef() {
        return ref;
    }

    @Override
    public String toSource(int depth) {
        return makeIndent(depth) + "do_commit(" + ref.toSource(0) + ");\n";
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            ref.visit(v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DoCommit)) return false;
        DoCommit other = (DoCommit) obj;
        return context.equals(other.context) && ref.equals(other.ref);
    }

    @Override
    public int hashCode() {
        return ref.hashCode() + 17;
    }
}
