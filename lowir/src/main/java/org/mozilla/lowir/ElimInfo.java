/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.mozilla.lowir.ir.DataDefn;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.IrType;
import org.mozilla.lowir.ir.Lval;
import org.mozilla.lowir.ir.QualVar;
import org.mozilla.lowir.ir.VarName;

/**
 * State accumulated while one top level function is flattened: the nested functions to hoist,
 * the locals to put in the record, and a counter for naming saved stack chain variables. Lists
 * are kept in encounter order.
 */
final class ElimInfo {

    private final ElimStrategy strategy;
    private final String moduleName;
    private final IrType.ClassType envType;
    private final IrType envPtrType;
    private final Lval.Var stackChainVar;

    private final List<Defn> nestedFuncs = new ArrayList<>();
    private final List<Defn> localData = new ArrayList<>();
    private int savedStackChainCounter;

    ElimInfo(
            ElimStrategy strategy,
            String moduleName,
            IrType.ClassType envType,
            IrType envPtrType,
            Lval.Var stackChainVar) {
        this.strategy = strategy;
        this.moduleName = moduleName;
        this.envType = envType;
        this.envPtrType = envPtrType;
        this.stackChainVar = stackChainVar;
    }

    ElimStrategy getStrategy() {
        return strategy;
    }

    String getModuleName() {
        return moduleName;
    }

    IrType.ClassType getEnvType() {
        return envType;
    }

    IrType getEnvPtrType() {
        return envPtrType;
    }

    /** The global {@code stack_chain} pointer. */
    Lval.Var getStackChainVar() {
        return stackChainVar;
    }

    /** The {@code env_ptr} or {@code frame_ptr} variable of the current function. */
    Lval.Var getEnvPtrVar() {
        return new Lval.Var(
                new QualVar(moduleName, new VarName(strategy.envPtrName())), envPtrType);
    }

    void addNestedFunc(Defn func) {
        nestedFuncs.add(func);
    }

    List<Defn> getNestedFuncs() {
        return Collections.unmodifiableList(nestedFuncs);
    }

    void addLocalData(Defn local) {
        localData.add(local);
    }

    /** Replaces a local added earlier, keeping its position. */
    void replaceLocalData(Defn oldLocal, Defn newLocal) {
        int index = localData.indexOf(oldLocal);
        if (index < 0) {
            throw Kit.codeBug("local data not found: " + oldLocal.getName());
        }
        localData.set(index, newLocal);
    }

    List<Defn> getLocalData() {
        return Collections.unmodifiableList(localData);
    }

    /**
     * Returns the type of the captured variable with this name, or {@code null} if no such
     * variable has been captured. Static constants are hoisted rather than captured and are never
     * found here.
     */
    IrType getCapturedVarType(VarName name) {
        Set<IrType> types = new LinkedHashSet<>();
        for (Defn local : localData) {
            if (!local.isStaticConst() && name.equals(local.getVarName())) {
                types.add(((DataDefn) local.getBody()).getDataType());
            }
        }
        if (types.isEmpty()) {
            return null;
        }
        if (types.size() > 1) {
            throw Kit.codeBug("captured variable " + name + " has conflicting types " + types);
        }
        return types.iterator().next();
    }

    int allocateSavedStackChainId() {
        return savedStackChainCounter++;
    }
}
