/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

/** The body of a {@link Defn}: a {@link FunctionDefn}, {@link DataDefn} or {@link ClassDefn}. */
public abstract class DefnBody extends IrNode {

    DefnBody() {}

    /**
     * Prints the declaration of an entity with this body. The first line carries no indentation;
     * any further lines are indented for {@code depth}.
     */
    abstract String declare(String name, DeclFlags flags, int depth);

    /** Prints the body as if it belonged to an anonymous local definition. */
    @Override
    public String toSource(int depth) {
        return makeIndent(depth) + declare("_", DeclFlags.LOCAL_VAR, depth);
    }
}
