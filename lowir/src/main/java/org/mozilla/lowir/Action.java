/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

/** The transformations {@link ElimNested} can perform. */
public enum Action {
    /** Eliminate nested functions by hoisting them and their captured variables. */
    HOIST_NESTED_FUNCS,
    /**
     * Put every variable that may hold heap pointers in a frame record, and chain the records
     * into a shadow stack an accurate collector can walk.
     */
    CHAIN_GC_STACK_FRAMES
}
