/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/**
 * Runs {@code body}; a {@link DoCommit} on {@code ref} inside it transfers control to
 * {@code handler}. The transfer is non-local, so anything the body pushed on a stack is not
 * popped on the way out.
 */
public class TryCommit extends Statement {

    private final Lval ref;
    private final Statement body;
    private final Statement handler;

    {
        type = Token.TRY_COMMIT;
    }

    public TryCommit(Lval ref, Statement body, Statement handler, Context context) {
        super(context);
        this.ref = Objects.requireNonNull(ref);
        this.body = Objects.requireNonNull(body);
        this.handler = Objects.requireNonNull(handler);
    }

    public Lval getRef() {
        return ref;
    }

    public Statement getBody() {
        return body;
    }

    public Statement getHandler() {
        return handler;
    }

    @Override
    public String toSource(int depth) {
        String pad = makeIndent(depth);
        return pad + "try_commit (" + ref.toSource(0) + ")\n"
                + nested(body, depth)
                + pad + "commit\n"
                + nested(handler, depth);
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            ref.visit(v);
            body.visit(v);
            handler.visit(v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof TryCommit)) return false;
        TryCommit other = (TryCommit) obj;
        return context.equals(other.context)
                && ref.equals(other.ref)
                && body.equals(other.body)
                && handler.equals(other.handler);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ref, body, handler);
    }
}
