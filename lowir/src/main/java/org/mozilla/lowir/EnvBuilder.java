/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.mozilla.lowir.ir.Argument;
import org.mozilla.lowir.ir.AtomicStatement;
import org.mozilla.lowir.ir.Block;
import org.mozilla.lowir.ir.ClassDefn;
import org.mozilla.lowir.ir.CodeAddr;
import org.mozilla.lowir.ir.Context;
import org.mozilla.lowir.ir.DataDefn;
import org.mozilla.lowir.ir.DeclFlags;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.EntityName;
import org.mozilla.lowir.ir.FuncParams;
import org.mozilla.lowir.ir.FuncSignature;
import org.mozilla.lowir.ir.FunctionDefn;
import org.mozilla.lowir.ir.Initializer;
import org.mozilla.lowir.ir.IrSearch;
import org.mozilla.lowir.ir.IrType;
import org.mozilla.lowir.ir.Lval;
import org.mozilla.lowir.ir.QualVar;
import org.mozilla.lowir.ir.Rval;
import org.mozilla.lowir.ir.Statement;
import org.mozilla.lowir.ir.VarName;

/**
 * Builds the environment or frame record of a function: its type, the record and pointer
 * variables, the statements that set them up, and for GC frames the trace function.
 *
 * <p>A frame record starts with the header the runtime stack walker expects:
 *
 * <pre>
 * struct foo_1_frame {
 *     void *prev;
 *     void (*trace)(MR_Box);
 *     ... captured variables ...
 * };
 * </pre>
 */
final class EnvBuilder {

    static final String TRACE_FIELD = "trace";
    static final String THIS_FRAME = "this_frame";
    static final String ENV_PTR_ARG = "env_ptr_arg";

    /** Added to a function's sequence number to name its trace function. */
    static final int TRACE_FUNC_SEQ_OFFSET = 100000;

    /** The pieces {@link #createEnv} produces. */
    static final class Env {
        final Defn typeDefn;
        final List<Defn> decls;
        final List<Statement> initStatements;
        final List<Defn> traceFuncs;

        Env(Defn typeDefn, List<Defn> decls, List<Statement> initStatements,
                List<Defn> traceFuncs) {
            this.typeDefn = typeDefn;
            this.decls = decls;
            this.initStatements = initStatements;
            this.traceFuncs = traceFuncs;
        }
    }

    private final ElimInfo info;
    private final IrEnvirons environs;

    EnvBuilder(ElimInfo info, IrEnvirons environs) {
        this.info = info;
        this.environs = environs;
    }

    /** Names the record type of a function, e.g. {@code foo_1_p_0_env}. */
    static String envClassName(EntityName.FunctionName funcName, ElimStrategy strategy) {
        return funcName.toIdentifier() + "_" + strategy.envNameBase();
    }

    /** Heap allocated records are classes; records on the stack are structs. */
    static IrType.ClassType envType(String moduleName, String className, IrEnvirons environs) {
        IrType.ClassType.Kind kind =
                environs.isEnvOnHeap() ? IrType.ClassType.Kind.CLASS : IrType.ClassType.Kind.STRUCT;
        return new IrType.ClassType(moduleName, className, 0, kind);
    }

    /**
     * The type of the record pointer: the record type itself for a heap record on a target whose
     * classes are references, otherwise a pointer to it.
     */
    static IrType envPtrType(IrType.ClassType envType, IrEnvirons environs) {
        if (environs.isEnvOnHeap() && environs.getTarget().hasReferencePointers()) {
            return envType;
        }
        return IrType.pointerTo(envType);
    }

    static EntityName.FunctionName traceFunctionName(EntityName.FunctionName funcName) {
        int seq = funcName.getSeqNum() == null ? 0 : funcName.getSeqNum();
        return new EntityName.FunctionName(
                funcName.getPredLabel(), funcName.getModeNum(), seq + TRACE_FUNC_SEQ_OFFSET);
    }

    Env createEnv(List<Defn> localVars, EntityName.FunctionName funcName, Context context) {
        ElimStrategy strategy = info.getStrategy();
        IrType.ClassType envType = info.getEnvType();
        boolean onHeap = environs.isEnvOnHeap();

        List<Defn> fields = new ArrayList<>();
        List<Statement> traceStatements = new ArrayList<>();
        for (Defn local : localVars) {
            Defn field = local;
            if (field.getFlags().getAccess() == DeclFlags.Access.LOCAL) {
                field = field.withFlags(field.getFlags().withAccess(DeclFlags.Access.PUBLIC));
            }
            DataDefn data = (DataDefn) field.getBody();
            if (data.getGcTrace() != null) {
                traceStatements.add(data.getGcTrace());
                field = field.withBody(data.withGcTrace(null));
            }
            fields.add(field);
        }

        Initializer envInit = Initializer.NONE;
        Statement envTrace = null;
        List<Statement> headerInit = Collections.emptyList();
        List<Statement> link = Collections.emptyList();
        List<Defn> traceFuncs = Collections.emptyList();

        if (strategy.chainsStackFrames()) {
            FuncParams traceParams =
                    new FuncParams(
                            Collections.singletonList(
                                    new Argument(
                                            new EntityName.DataName(new VarName(THIS_FRAME)),
                                            IrType.GENERIC,
                                            null)),
                            Collections.<IrType>emptyList());
            FuncSignature traceSignature = traceParams.getSignature();
            EntityName.FunctionName traceName = traceFunctionName(funcName);
            Rval traceAddr =
                    Rval.Const.codeAddr(
                            new CodeAddr(info.getModuleName(), traceName, traceSignature));
            traceFuncs =
                    Collections.singletonList(
                            genTraceFunction(
                                    traceName, traceParams, traceStatements, context));

            List<Defn> header = new ArrayList<>();
            header.add(publicField(StackChainUnlinker.PREV_FIELD, IrType.GENERIC_ENV_PTR, context));
            header.add(publicField(TRACE_FIELD, new IrType.FuncType(traceSignature), context));
            List<Defn> captured = fields;
            fields = Kit.concat(header, captured);

            Rval stackChain = Rval.of(info.getStackChainVar());
            if (!onHeap && environs.getTarget().hasImplicitZeroInit()) {
                // the fields after the header are zero-filled
                envInit =
                        new Initializer.Struct(
                                envType,
                                Arrays.<Initializer>asList(
                                        Initializer.of(stackChain), Initializer.of(traceAddr)));
            } else {
                headerInit = explicitFrameInit(header, captured, stackChain, traceAddr, context);
            }
            link =
                    Collections.<Statement>singletonList(
                            new AtomicStatement.Assign(
                                    info.getStackChainVar(),
                                    Rval.of(info.getEnvPtrVar()),
                                    context));
        } else if (!traceStatements.isEmpty()) {
            envTrace = new Block(Collections.<Defn>emptyList(), traceStatements, context);
        }

        List<IrType> baseClasses =
                onHeap
                        ? Collections.singletonList(IrType.GENERIC_ENV_PTR)
                        : Collections.<IrType>emptyList();
        Defn typeDefn =
                new Defn(
                        new EntityName.TypeName(envType.getClassName(), 0),
                        context,
                        DeclFlags.PRIVATE_ONE_COPY,
                        new ClassDefn(
                                envType.getKind(),
                                baseClasses,
                                null,
                                null,
                                fields));

        VarName envVarName = new VarName(strategy.envNameBase());
        Defn envVarDecl =
                new Defn(
                        new EntityName.DataName(envVarName),
                        context,
                        DeclFlags.LOCAL_VAR,
                        new DataDefn(envType, envInit, envTrace));
        Lval.Var envVar = new Lval.Var(new QualVar(info.getModuleName(), envVarName), envType);

        List<Statement> init = new ArrayList<>();
        Rval envAddr;
        if (onHeap) {
            init.add(
                    new AtomicStatement.NewObject(
                            envVar, null, false, envType, null, null, null, null, context));
            envAddr = Rval.of(envVar);
        } else {
            envAddr = new Rval.MemAddr(envVar);
        }
        init.add(initEnvPtr(envAddr, context));
        init.addAll(headerInit);
        init.addAll(link);

        return new Env(
                typeDefn, Arrays.asList(envVarDecl, envPtrDecl(context)), init, traceFuncs);
    }

    /**
     * Assignments that set up a frame whose initializer cannot be relied on to zero the captured
     * fields: the header first, then every captured field, so the collector never traces garbage.
     */
    private List<Statement> explicitFrameInit(
            List<Defn> header, List<Defn> captured, Rval stackChain, Rval traceAddr,
            Context context) {
        List<Statement> result = new ArrayList<>();
        result.add(
                new AtomicStatement.Assign(envField(header.get(0)), stackChain, context));
        result.add(new AtomicStatement.Assign(envField(header.get(1)), traceAddr, context));
        for (Defn field : captured) {
            IrType fieldType = ((DataDefn) field.getBody()).getDataType();
            result.add(
                    new AtomicStatement.Assign(
                            envField(field),
                            Rval.cast(fieldType, Rval.Const.intConst(0)),
                            context));
        }
        return result;
    }

    /** {@code env_ptr->name} for a field of the record. */
    Lval.Field envField(Defn field) {
        return envField(
                field.getVarName().toIdentifier(), ((DataDefn) field.getBody()).getDataType());
    }

    Lval.Field envField(String name, IrType fieldType) {
        return new Lval.Field(
                0,
                Rval.of(info.getEnvPtrVar()),
                new Lval.NamedField(
                        info.getEnvType().getMemberQualifier(), name, info.getEnvPtrType()),
                fieldType,
                info.getEnvPtrType());
    }

    private static Defn publicField(String name, IrType type, Context context) {
        return new Defn(
                new EntityName.DataName(new VarName(name)),
                context,
                DeclFlags.PUBLIC_FIELD,
                new DataDefn(type, Initializer.NONE, null));
    }

    /**
     * <pre>
     * void foo_1_p_0_100000(MR_Box this_frame) {
     *     struct foo_1_p_0_frame *frame_ptr;
     *     frame_ptr = (struct foo_1_p_0_frame *) this_frame;
     *     ... trace statements ...
     * }
     * </pre>
     */
    private Defn genTraceFunction(
            EntityName.FunctionName traceName,
            FuncParams params,
            List<Statement> traceStatements,
            Context context) {
        Lval.Var thisFrame =
                new Lval.Var(
                        new QualVar(info.getModuleName(), new VarName(THIS_FRAME)),
                        IrType.GENERIC);
        Rval castFrame = Rval.cast(info.getEnvPtrType(), Rval.of(thisFrame));
        List<Statement> statements = new ArrayList<>();
        statements.add(initEnvPtr(castFrame, context));
        statements.addAll(traceStatements);
        Block body = new Block(Collections.singletonList(envPtrDecl(context)), statements, context);
        return new Defn(
                traceName,
                context,
                DeclFlags.PRIVATE_ONE_COPY,
                new FunctionDefn(params, body, null));
    }

    /** Declares the record pointer variable. It never needs tracing. */
    private Defn envPtrDecl(Context context) {
        return new Defn(
                new EntityName.DataName(new VarName(info.getStrategy().envPtrName())),
                context,
                DeclFlags.LOCAL_VAR,
                new DataDefn(info.getEnvPtrType(), Initializer.NONE, null));
    }

    private Statement initEnvPtr(Rval value, Context context) {
        return new AtomicStatement.Assign(info.getEnvPtrVar(), value, context);
    }

    /**
     * If a hoisted function uses {@code env_ptr}, declares it and initializes it from the
     * function's {@code env_ptr_arg} parameter. Returns {@code null} if the function does not use
     * the environment.
     */
    Defn insertInitEnv(Defn nestedFunc) {
        FunctionDefn fn = (FunctionDefn) nestedFunc.getBody();
        QualVar envPtr =
                new QualVar(info.getModuleName(), new VarName(info.getStrategy().envPtrName()));
        if (fn.getBody() == null || !IrSearch.containsVar(fn.getBody(), envPtr)) {
            return null;
        }
        Context context = nestedFunc.getContext();
        Lval.Var envPtrArg =
                new Lval.Var(
                        new QualVar(info.getModuleName(), new VarName(ENV_PTR_ARG)),
                        IrType.GENERIC_ENV_PTR);
        Statement init = initEnvPtr(Rval.cast(info.getEnvPtrType(), Rval.of(envPtrArg)), context);
        Block body =
                new Block(
                        Collections.singletonList(envPtrDecl(context)),
                        Arrays.asList(init, fn.getBody()),
                        context);
        return nestedFunc.withBody(fn.withBody(body));
    }

    /**
     * Copies the captured arguments into the record, e.g. {@code env_ptr->x = x;}, in argument
     * order.
     */
    List<Statement> copyArgs(List<Argument> args, Statement originalBody, Context context) {
        List<Statement> result = new ArrayList<>();
        for (Argument arg : args) {
            VarName name = arg.getVarName();
            if (name != null
                    && info.getStrategy()
                            .needsCapture(
                                    info.getModuleName(),
                                    name,
                                    arg.getGcTrace(),
                                    Collections.<Defn>emptyList(),
                                    Collections.singletonList(originalBody))) {
                Lval.Var argVar =
                        new Lval.Var(new QualVar(info.getModuleName(), name), arg.getArgType());
                result.add(
                        new AtomicStatement.Assign(
                                envField(name.toIdentifier(), arg.getArgType()),
                                Rval.of(argVar),
                                context));
            }
        }
        return result;
    }
}
