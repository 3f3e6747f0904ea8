/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import org.mozilla.lowir.ir.Argument;
import org.mozilla.lowir.ir.AtomicStatement;
import org.mozilla.lowir.ir.ClassDefn;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.EntityName;
import org.mozilla.lowir.ir.FunctionDefn;
import org.mozilla.lowir.ir.IrModule;
import org.mozilla.lowir.ir.IrNode;
import org.mozilla.lowir.ir.IrSearch;
import org.mozilla.lowir.ir.Lval;
import org.mozilla.lowir.ir.QualVar;
import org.mozilla.lowir.ir.Rval;
import org.mozilla.lowir.ir.VarName;

/**
 * Checks a transformed module. Any violation is a bug in the pass and is reported through
 * {@link Kit#codeBug(String)}.
 */
final class IrValidator {

    private final ElimStrategy strategy;
    private final IrEnvirons environs;

    IrValidator(Action action, IrEnvirons environs) {
        this.strategy = ElimStrategy.forAction(action);
        this.environs = environs;
    }

    void validate(IrModule module) {
        Map<String, ClassDefn> records = new HashMap<>();
        for (Defn defn : module.getDefns()) {
            if (defn.getName() instanceof EntityName.TypeName
                    && defn.getBody() instanceof ClassDefn) {
                records.put(
                        ((EntityName.TypeName) defn.getName()).getClassName(),
                        (ClassDefn) defn.getBody());
            }
        }
        for (Defn defn : module.getDefns()) {
            if (!defn.isFunction()) {
                continue;
            }
            FunctionDefn fn = (FunctionDefn) defn.getBody();
            if (!fn.isDefinedHere()) {
                continue;
            }
            if (strategy.hoistsNestedFunctions()) {
                checkNoNestedFunctions(defn);
            }
            ClassDefn record =
                    records.get(
                            EnvBuilder.envClassName(
                                    (EntityName.FunctionName) defn.getName(), strategy));
            if (record != null) {
                checkNoRawReferences(module.getName(), defn, record);
            }
            if (strategy.chainsStackFrames()) {
                checkLinks(module.getName(), defn, record != null);
            }
        }
    }

    private static void checkNoNestedFunctions(Defn defn) {
        FunctionDefn fn = (FunctionDefn) defn.getBody();
        for (Defn inner : IrSearch.collectDefns(Collections.singletonList(fn.getBody()))) {
            if (inner.isFunction()) {
                throw Kit.codeBug(
                        "nested function " + inner.getName() + " left in " + defn.getName());
            }
        }
    }

    /** A captured variable may only be reached through the record, except for parameters. */
    private void checkNoRawReferences(String moduleName, Defn defn, ClassDefn record) {
        FunctionDefn fn = (FunctionDefn) defn.getBody();
        Set<VarName> params = new HashSet<>();
        for (Argument arg : fn.getParams().getArgs()) {
            if (arg.getVarName() != null) {
                params.add(arg.getVarName());
            }
        }
        for (Defn field : record.getFields()) {
            VarName name = field.getVarName();
            if (name == null || params.contains(name) || isHeaderField(name)) {
                continue;
            }
            if (IrSearch.containsVar(fn.getBody(), new QualVar(moduleName, name))) {
                throw Kit.codeBug(
                        "captured variable " + name + " still referenced directly in "
                                + defn.getName());
            }
        }
    }

    private boolean isHeaderField(VarName name) {
        if (!strategy.chainsStackFrames() || name.getSeqNum() != null) {
            return false;
        }
        return StackChainUnlinker.PREV_FIELD.equals(name.getName())
                || EnvBuilder.TRACE_FIELD.equals(name.getName());
    }

    /** A function with a frame links it exactly once; one without never does. */
    private void checkLinks(String moduleName, Defn defn, boolean hasFrame) {
        final QualVar stackChain =
                StackChainUnlinker.stackChainVar(environs.getPrivateBuiltinModule()).getVar();
        final QualVar framePtr = new QualVar(moduleName, new VarName(strategy.envPtrName()));
        FunctionDefn fn = (FunctionDefn) defn.getBody();
        int links =
                IrSearch.count(
                        fn.getBody(),
                        new IrSearch.NodeFilter() {
                            @Override
                            public boolean accept(IrNode node) {
                                if (!(node instanceof AtomicStatement.Assign)) {
                                    return false;
                                }
                                AtomicStatement.Assign assign = (AtomicStatement.Assign) node;
                                return isVar(assign.getTarget(), stackChain)
                                        && assign.getValue() instanceof Rval.LvalRef
                                        && isVar(
                                                ((Rval.LvalRef) assign.getValue()).getLval(),
                                                framePtr);
                            }
                        });
        int expected = hasFrame ? 1 : 0;
        if (links != expected) {
            throw Kit.codeBug(
                    defn.getName() + " links its frame " + links + " times, expected "
                            + expected);
        }
    }

    private static boolean isVar(Lval lval, QualVar var) {
        return lval instanceof Lval.Var && ((Lval.Var) lval).getVar().equals(var);
    }
}
