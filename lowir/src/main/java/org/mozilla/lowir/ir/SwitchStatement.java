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

/**
 * A multi-way branch on {@code value}. Cases do not fall through: control continues after the
 * switch when a case body completes.
 */
public class SwitchStatement extends Statement {

    private final IrType valueType;
    private final Rval value;
    private final List<SwitchCase> cases;
    private final SwitchDefault defaultCase;

    {
        type = Token.SWITCH;
    }

    public SwitchStatement(
            IrType valueType,
            Rval value,
            List<SwitchCase> cases,
            SwitchDefault defaultCase,
            Context context) {
        super(context);
        this.valueType = Objects.requireNonNull(valueType);
        this.value = Objects.requireNonNull(value);
        this.cases = Kit.immutableList(cases);
        this.defaultCase = Objects.requireNonNull(defaultCase);
    }

    public IrType getValueType() {
        return valueType;
    }

    public Rval getValue() {
        return value;
    }

    public List<SwitchCase> getCases() {
        return cases;
    }

    public SwitchDefault getDefault() {
        return defaultCase;
    }

    @Override
    public String toSource(int depth) {
        String pad = makeIndent(depth);
        StringBuilder sb = new StringBuilder();
        sb.append(pad).append("switch (").append(value.toSource(0)).append(") {\n");
        for (SwitchCase c : cases) {
            sb.append(c.toSource(depth));
        }
        sb.append(defaultCase.toSource(depth));
        sb.append(pad).append("}\n");
        return sb.toString();
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            value.visit(v);
            visitAll(cases, v);
            defaultCase.visit(v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof SwitchStatement)) return false;
        SwitchStatement other = (SwitchStatement) obj;
        return context.equals(other.context)
                && valueType.equals(other.valueType)
                && value.equals(other.value)
                && cases.equals(other.cases)
                && defaultCase.equals(other.defaultCase);
    }

    @Override
    public int hashCode() {
        return Objects.hash(value, cases, defaultCase);
    }
}
