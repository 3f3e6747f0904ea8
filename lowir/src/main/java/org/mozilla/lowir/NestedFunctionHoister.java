/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.mozilla.lowir.ir.Argument;
import org.mozilla.lowir.ir.Block;
import org.mozilla.lowir.ir.Context;
import org.mozilla.lowir.ir.DataDefn;
import org.mozilla.lowir.ir.DeclFlags;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.EntityName;
import org.mozilla.lowir.ir.FuncParams;
import org.mozilla.lowir.ir.FunctionDefn;
import org.mozilla.lowir.ir.Initializer;
import org.mozilla.lowir.ir.IrType;
import org.mozilla.lowir.ir.PredLabel;
import org.mozilla.lowir.ir.Statement;

/**
 * Rewrites one top level function. The result is the list of definitions that replaces it: the
 * record type, the hoisted static constants, the trace function and the hoisted nested
 * functions, in that order, followed by the rewritten function itself.
 */
final class NestedFunctionHoister {

    /** The runtime predicate that drives tracing; it must never get a frame of its own. */
    static final String GC_TRACE_PRED = "gc_trace";

    private final ElimStrategy strategy;
    private final IrEnvirons environs;

    NestedFunctionHoister(ElimStrategy strategy, IrEnvirons environs) {
        this.strategy = strategy;
        this.environs = environs;
    }

    List<Defn> elimNestedDefns(String moduleName, Defn defn) {
        if (!defn.isFunction()) {
            return Collections.singletonList(defn);
        }
        FunctionDefn fn = (FunctionDefn) defn.getBody();
        if (!fn.isDefinedHere() || isGcTracePred(moduleName, defn)) {
            return Collections.singletonList(defn);
        }
        EntityName.FunctionName funcName = (EntityName.FunctionName) defn.getName();
        Context context = defn.getContext();

        IrType.ClassType envType =
                EnvBuilder.envType(
                        moduleName, EnvBuilder.envClassName(funcName, strategy), environs);
        IrType envPtrType = EnvBuilder.envPtrType(envType, environs);
        ElimInfo info =
                new ElimInfo(
                        strategy,
                        moduleName,
                        envType,
                        envPtrType,
                        StackChainUnlinker.stackChainVar(environs.getPrivateBuiltinModule()));
        Flattener flattener = new Flattener(info);

        Statement originalBody = fn.getBody();
        List<Argument> args = fn.getParams().getArgs();
        maybeAddArgs(flattener, info, args, originalBody, context);
        List<Argument> flatArgs = flattener.flattenArguments(args);
        Statement body = flattener.flattenStatement(originalBody);

        List<Defn> statics = new ArrayList<>();
        List<Defn> vars = new ArrayList<>();
        for (Defn local : info.getLocalData()) {
            if (local.isStaticConst()) {
                statics.add(
                        local.withFlags(local.getFlags().withAccess(DeclFlags.Access.PRIVATE)));
            } else {
                vars.add(local);
            }
        }

        List<Defn> nestedFuncs = info.getNestedFuncs();
        List<Defn> hoisted;
        if (strategy.needsNoRecord(nestedFuncs, vars)) {
            hoisted = Kit.concat(statics, nestedFuncs);
        } else {
            EnvBuilder builder = new EnvBuilder(info, environs);
            EnvBuilder.Env env = builder.createEnv(vars, funcName, context);

            List<Defn> fixedNested = new ArrayList<>(nestedFuncs.size());
            boolean insertedEnv = false;
            for (Defn nested : nestedFuncs) {
                Defn withEnv = builder.insertInitEnv(nested);
                if (withEnv != null) {
                    insertedEnv = true;
                    fixedNested.add(withEnv);
                } else {
                    fixedNested.add(nested);
                }
            }

            if (strategy.hoistsNestedFunctions() && !insertedEnv) {
                // nothing reads the record, so the function does not need one
                hoisted = Kit.concat(statics, env.traceFuncs, fixedNested);
            } else {
                List<Statement> statements = new ArrayList<>(env.initStatements);
                statements.addAll(builder.copyArgs(args, originalBody, context));
                if (strategy.chainsStackFrames()) {
                    StackChainUnlinker unlinker = new StackChainUnlinker(info);
                    statements.add(unlinker.addUnchain(body));
                    if (fn.getParams().getReturnTypes().isEmpty()) {
                        statements.add(unlinker.unchainFrame(context));
                    }
                } else {
                    statements.add(body);
                }
                body = new Block(env.decls, statements, context);
                hoisted =
                        Kit.concat(
                                Collections.singletonList(env.typeDefn),
                                statics,
                                env.traceFuncs,
                                fixedNested);
            }
        }

        if (strategy.chainsStackFrames()) {
            flatArgs = stripGcTraces(flatArgs);
        }
        FuncParams params = fn.getParams().withArgs(flatArgs);
        Defn result = defn.withBody(fn.withParams(params).withBody(body));
        hoisted.add(result);
        return hoisted;
    }

    /**
     * Adds the arguments that need capturing to the captured locals, as if they had been
     * declared as local variables of the body.
     */
    private void maybeAddArgs(
            Flattener flattener,
            ElimInfo info,
            List<Argument> args,
            Statement originalBody,
            Context context) {
        for (Argument arg : args) {
            if (arg.getVarName() == null) {
                continue;
            }
            if (strategy.needsCapture(
                    info.getModuleName(),
                    arg.getVarName(),
                    arg.getGcTrace(),
                    Collections.<Defn>emptyList(),
                    Collections.singletonList(originalBody))) {
                flattener.addAndFlattenLocalData(
                        new Defn(
                                arg.getName(),
                                context,
                                DeclFlags.LOCAL_VAR,
                                new DataDefn(
                                        arg.getArgType(), Initializer.NONE, arg.getGcTrace())));
            }
        }
    }

    /** Frame tracing now covers the arguments; their own trace code must not run twice. */
    private static List<Argument> stripGcTraces(List<Argument> args) {
        List<Argument> result = new ArrayList<>(args.size());
        for (Argument arg : args) {
            result.add(arg.getGcTrace() == null ? arg : arg.withGcTrace(null));
        }
        return result;
    }

    private boolean isGcTracePred(String moduleName, Defn defn) {
        if (!moduleName.equals(environs.getPrivateBuiltinModule())) {
            return false;
        }
        PredLabel label = ((EntityName.FunctionName) defn.getName()).getPredLabel();
        if (!(label instanceof PredLabel.Proc)) {
            return false;
        }
        PredLabel.Proc proc = (PredLabel.Proc) label;
        return !proc.isFunction() && GC_TRACE_PRED.equals(proc.getName()) && proc.getArity() == 1;
    }
}
