/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.List;
import org.mozilla.lowir.Kit;

/** Argument and return types of a function, without the argument names. */
public final class FuncSignature {

    private final List<IrType> argTypes;
    private final List<IrType> returnTypes;

    public FuncSignature(List<IrType> argTypes, List<IrType> returnTypes) {
        this.argTypes = Kit.immutableList(argTypes);
        this.returnTypes = Kit.immutableList(returnTypes);
    }

    public List<IrType> getArgTypes() {
        return argTypes;
    }

    public List<IrType> getReturnTypes() {
        return returnTypes;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FuncSignature)) return false;
        FuncSignature other = (FuncSignature) obj;
        return argTypes.equals(other.argTypes) && returnTypes.equals(other.returnTypes);
    }

    @Override
    public int hashCode() {
        return argTypes.hashCode() * 31 + returnTypes.hashCode();
    }

    @Override
    public String toString() {
        return "(" + IrType.join(argTypes) + ") -> (" + IrType.join(returnTypes) + ")";
    }
}
