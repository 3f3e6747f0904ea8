/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;

/** A variable name qualified by the module that declares it. */
public final class QualVar {

    private final String moduleName;
    private final VarName varName;

    public QualVar(String moduleName, VarName varName) {
        this.moduleName = Objects.requireNonNull(moduleName);
        this.varName = Objects.requireNonNull(varName);
    }

    public String getModuleName() {
        return moduleName;
    }

    public VarName getVarName() {
        return varName;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof QualVar)) return false;
        QualVar other = (QualVar) obj;
        return moduleName.equals(other.moduleName) && varName.equals(other.varName);
    }

    @Override
    public int hashCode() {
        return moduleName.hashCode() * 31 + varName.hashCode();
    }

    @Override
    public String toString() {
        return moduleName + "." + varName;
    }
}
