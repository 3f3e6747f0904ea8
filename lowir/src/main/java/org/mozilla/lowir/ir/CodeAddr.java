/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;

/**
 * The address of a function. A function name without a sequence number refers to the main
 * function of a procedure; one with a sequence number refers to an internal (auxiliary) function
 * of that procedure.
 */
public final class CodeAddr {

    private final String moduleName;
    private final EntityName.FunctionName name;
    private final FuncSignature signature;

    public CodeAddr(String moduleName, EntityName.FunctionName name, FuncSignature signature) {
        this.moduleName = Objects.requireNonNull(moduleName);
        this.name = Objects.requireNonNull(name);
        this.signature = Objects.requireNonNull(signature);
    }

    public String getModuleName() {
        return moduleName;
    }

    public EntityName.FunctionName getName() {
        return name;
    }

    public FuncSignature getSignature() {
        return signature;
    }

    public boolean isInternal() {
        return name.getSeqNum() != null;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof CodeAddr)) return false;
        CodeAddr other = (CodeAddr) obj;
        return moduleName.equals(other.moduleName)
                && name.equals(other.name)
                && signature.equals(other.signature);
    }

    @Override
    public int hashCode() {
        return Objects.hash(moduleName, name, signature);
    }

    @Override
    public String toString() {
        return name.toIdentifier();
    }
}
