/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;

/**
 * Base class for statements. Every statement records the source context it was generated from.
 * {@link #toSource(int)} of a statement starts with the indentation for {@code depth} and ends
 * with a newline.
 */
public abstract class Statement extends IrNode {

    protected final Context context;

    protected Statement(Context context) {
        this.context = Objects.requireNonNull(context);
    }

    public Context getContext() {
        return context;
    }

    /** Prints a nested statement one level deeper than {@code depth}. */
    protected static String nested(Statement statement, int depth) {
        return statement.toSource(depth + 1);
    }
}
