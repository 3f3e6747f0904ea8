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

/** One arm of a {@link SwitchStatement}: the body runs if any of the conditions match. */
public class SwitchCase extends IrNode {

    private final List<CaseCond> conditions;
    private final Statement body;

    {
        type = Token.CASE;
    }

    public SwitchCase(List<CaseCond> conditions, Statement body) {
        if (conditions == null || conditions.isEmpty()) {
            throw new IllegalArgumentException("switch case without conditions");
        }
        this.conditions = Kit.immutableList(conditions);
        this.body = Objects.requireNonNull(body);
    }

    public List<CaseCond> getConditions() {
        return conditions;
    }

    public Statement getBody() {
        return body;
    }

    @Override
    public String toSource(int depth) {
        StringBuilder sb = new StringBuilder();
        for (CaseCond cond : conditions) {
            sb.append(makeIndent(depth)).append(cond.toSource(0)).append(":\n");
        }
        sb.append(body.toSource(depth + 1));
        return sb.toString();
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            visitAll(conditions, v);
            body.visit(v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SwitchCase)) return false;
        SwitchCase other = (SwitchCase) obj;
        return conditions.equals(other.conditions) && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return conditions.hashCode() * 31 + body.hashCode();
    }
}
