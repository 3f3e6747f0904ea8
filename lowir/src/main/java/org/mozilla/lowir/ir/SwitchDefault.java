/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/** What a {@link SwitchStatement} does when no case matches. */
public class SwitchDefault extends IrNode {

    public enum Kind {
        /** No case can fail to match. */
        UNREACHABLE,
        DO_NOTHING,
        CASE
    }

    public static final SwitchDefault UNREACHABLE = new SwitchDefault(Kind.UNREACHABLE, null);
    public static final SwitchDefault DO_NOTHING = new SwitchDefault(Kind.DO_NOTHING, null);

    private final Kind kind;
    private final Statement body;

    {
        type = Token.DEFAULT;
    }

    private SwitchDefault(Kind kind, Statement body) {
        this.kind = kind;
        this.body = body;
    }

    public static SwitchDefault of(Statement body) {
        return new SwitchDefault(Kind.CASE, Objects.requireNonNull(body));
    }

    public Kind getKind() {
        return kind;
    }

    /** Returns the default body, or {@code null} unless the kind is {@link Kind#CASE}. */
    public Statement getBody() {
        return body;
    }

    @Override
    public String toSource(int depth) {
        String pad = makeIndent(depth);
        switch (kind) {
            case UNREACHABLE:
                return pad + "default: /* unreachable */\n";
            case DO_NOTHING:
                return "";
            default:
                return pad + "default:\n" + body.toSource(depth + 1);
        }
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this) && body != null) {
            body.visit(v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SwitchDefault)) return false;
        SwitchDefault other = (SwitchDefault) obj;
        return kind == other.kind && Objects.equals(body, other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, body);
    }
}
