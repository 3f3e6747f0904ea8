/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/** A formal parameter, with the GC trace statement for it if it holds heap pointers. */
public class Argument extends IrNode {

    private final EntityName name;
    private final IrType argType;
    private final Statement gcTrace;

    {
        type = Token.ARGUMENT;
    }

    public Argument(EntityName name, IrType argType, Statement gcTrace) {
        this.name = Objects.requireNonNull(name);
        this.argType = Objects.requireNonNull(argType);
        this.gcTrace = gcTrace;
    }

    public EntityName getName() {
        return name;
    }

    /** Returns the variable name, or {@code null} if the argument is not a plain variable. */
    public VarName getVarName() {
        if (name instanceof EntityName.DataName) {
            return ((EntityName.DataName) name).getVarName();
        }
        return null;
    }

    public IrType getArgType() {
        return argType;
    }

    public Statement getGcTrace() {
        return gcTrace;
    }

    public Argument withGcTrace(Statement newGcTrace) {
        return new Argument(name, argType, newGcTrace);
    }

    @Override
    public String toSource(int depth) {
        return argType.toSource() + " " + name.toIdentifier();
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this) && gcTrace != null) {
            gcTrace.visit(v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Argument)) return false;
        Argument other = (Argument) obj;
        return name.equals(other.name)
                && argType.equals(other.argType)
                && Objects.equals(gcTrace, other.gcTrace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, argType, gcTrace);
    }
}
