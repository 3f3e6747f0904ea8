/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/**
 * A variable, constant or field definition. The optional GC trace statement tells an accurate
 * collector how to trace the heap pointers the variable holds.
 */
public class DataDefn extends DefnBody {

    private final IrType dataType;
    private final Initializer initializer;
    private final Statement gcTrace;

    {
        type = Token.DATA;
    }

    public DataDefn(IrType dataType, Initializer initializer, Statement gcTrace) {
        this.dataType = Objects.requireNonNull(dataType);
        this.initializer = Objects.requireNonNull(initializer);
        this.gcTrace = gcTrace;
    }

    public IrType getDataType() {
        return dataType;
    }

    public Initializer getInitializer() {
        return initializer;
    }

    /** Returns the GC trace statement, or {@code null} if the data needs no tracing. */
    public Statement getGcTrace() {
        return gcTrace;
    }

    public DataDefn withInitializer(Initializer newInitializer) {
        return new DataDefn(dataType, newInitializer, gcTrace);
    }

    public DataDefn withGcTrace(Statement newGcTrace) {
        return new DataDefn(dataType, initializer, newGcTrace);
    }

    @Override
    String declare(String name, DeclFlags flags, int depth) {
        StringBuilder sb = new StringBuilder();
        sb.append(flags.toSource()).append(dataType.toSource()).append(' ').append(name);
        if (!initializer.isNone()) {
            sb.append(" = ").append(initializer.toSource(0));
        }
        sb.append(";\n");
        if (gcTrace != null) {
            sb.append(makeIndent(depth)).append("gc_trace ").append(name).append('\n');
            sb.append(gcTrace.toSource(depth + 1));
        }
        return sb.toString();
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            initializer.visit(v);
            if (gcTrace != null) {
                gcTrace.visit(v);
            }
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DataDefn)) return false;
        DataDefn other = (DataDefn) obj;
        return dataType.equals(other.dataType)
                && initializer.equals(other.initializer)
                && Objects.equals(gcTrace, other.gcTrace);
    }

    @Override
    public int hashCode() {
        return Objects.hash(dataType, initializer, gcTrace);
    }
}
