/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.mozilla.lowir.Kit;

/** The formal parameters and return types of a function. */
public final class FuncParams {

    private final List<Argument> args;
    private final List<IrType> returnTypes;

    public FuncParams(List<Argument> args, List<IrType> returnTypes) {
        this.args = Kit.immutableList(args);
        this.returnTypes = Kit.immutableList(returnTypes);
    }

    public List<Argument> getArgs() {
        return args;
    }

    public List<IrType> getReturnTypes() {
        return returnTypes;
    }

    public FuncParams withArgs(List<Argument> newArgs) {
        return new FuncParams(newArgs, returnTypes);
    }

    public FuncSignature getSignature() {
        List<IrType> argTypes = new ArrayList<>(args.size());
        for (Argument arg : args) {
            argTypes.add(arg.getArgType());
        }
        return new FuncSignature(argTypes, returnTypes);
    }

    String returnTypesSource() {
        if (returnTypes.isEmpty()) {
            return "void";
        }
        if (returnTypes.size() == 1) {
            return returnTypes.get(0).toSource();
        }
        return "(" + IrType.join(returnTypes) + ")";
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FuncParams)) return false;
        FuncParams other = (FuncParams) obj;
        return args.equals(other.args) && returnTypes.equals(other.returnTypes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(args, returnTypes);
    }
}
