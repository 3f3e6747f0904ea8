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
import org.mozilla.lowir.ir.AtomicStatement;
import org.mozilla.lowir.ir.Block;
import org.mozilla.lowir.ir.CallStatement;
import org.mozilla.lowir.ir.Context;
import org.mozilla.lowir.ir.DataDefn;
import org.mozilla.lowir.ir.DeclFlags;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.EntityName;
import org.mozilla.lowir.ir.IfThenElse;
import org.mozilla.lowir.ir.Initializer;
import org.mozilla.lowir.ir.IrType;
import org.mozilla.lowir.ir.Lval;
import org.mozilla.lowir.ir.QualVar;
import org.mozilla.lowir.ir.ReturnStatement;
import org.mozilla.lowir.ir.Rval;
import org.mozilla.lowir.ir.Statement;
import org.mozilla.lowir.ir.SwitchCase;
import org.mozilla.lowir.ir.SwitchDefault;
import org.mozilla.lowir.ir.SwitchStatement;
import org.mozilla.lowir.ir.TryCommit;
import org.mozilla.lowir.ir.VarName;
import org.mozilla.lowir.ir.WhileLoop;

/**
 * Keeps the shadow stack balanced: a function that linked its frame unlinks it on every way out,
 * and a commit restores the chain the protected code may have left pushed.
 */
final class StackChainUnlinker {

    static final String STACK_CHAIN = "stack_chain";
    static final String STACK_CHAIN_TYPE = "StackChain";
    static final String PREV_FIELD = "prev";
    static final String SAVED_STACK_CHAIN = "saved_stack_chain";

    private final ElimInfo info;

    StackChainUnlinker(ElimInfo info) {
        this.info = info;
    }

    /** The {@code stack_chain} global of the given runtime module. */
    static Lval.Var stackChainVar(String privateBuiltinModule) {
        return new Lval.Var(
                new QualVar(privateBuiltinModule, new VarName(STACK_CHAIN)),
                IrType.GENERIC_ENV_PTR);
    }

    /**
     * Generates {@code stack_chain = ((struct StackChain *) stack_chain)->prev;}. Every frame
     * record starts with the same header as the runtime's StackChain struct, so the cast is valid
     * whichever function pushed the top frame.
     */
    Statement unchainFrame(Context context) {
        Lval.Var stackChain = info.getStackChainVar();
        IrType.ClassType chainType =
                new IrType.ClassType(
                        stackChain.getVar().getModuleName(),
                        STACK_CHAIN_TYPE,
                        0,
                        IrType.ClassType.Kind.STRUCT);
        IrType chainPtrType = IrType.pointerTo(chainType);
        Lval.Field prev =
                new Lval.Field(
                        0,
                        Rval.cast(chainPtrType, Rval.of(stackChain)),
                        new Lval.NamedField(
                                chainType.getMemberQualifier(), PREV_FIELD, chainPtrType),
                        IrType.GENERIC_ENV_PTR,
                        chainPtrType);
        return new AtomicStatement.Assign(stackChain, Rval.of(prev), context);
    }

    /** Inserts an unlink before every return, tail call and no-return call. */
    Statement addUnchain(Statement stmt) {
        Context context = stmt.getContext();
        switch (stmt.getType()) {
            case Token.BLOCK:
                {
                    Block block = (Block) stmt;
                    return new Block(
                            block.getDefns(), addUnchain(block.getStatements()), context);
                }
            case Token.WHILE:
                {
                    WhileLoop loop = (WhileLoop) stmt;
                    return new WhileLoop(
                            loop.getCondition(),
                            addUnchain(loop.getBody()),
                            loop.isLoopAtLeastOnce(),
                            context);
                }
            case Token.IF:
                {
                    IfThenElse ite = (IfThenElse) stmt;
                    Statement elsePart = ite.getElsePart();
                    return new IfThenElse(
                            ite.getCondition(),
                            addUnchain(ite.getThenPart()),
                            elsePart == null ? null : addUnchain(elsePart),
                            context);
                }
            case Token.SWITCH:
                {
                    SwitchStatement sw = (SwitchStatement) stmt;
                    List<SwitchCase> cases = new ArrayList<>();
                    for (SwitchCase c : sw.getCases()) {
                        cases.add(new SwitchCase(c.getConditions(), addUnchain(c.getBody())));
                    }
                    SwitchDefault def = sw.getDefault();
                    if (def.getKind() == SwitchDefault.Kind.CASE) {
                        def = SwitchDefault.of(addUnchain(def.getBody()));
                    }
                    return new SwitchStatement(
                            sw.getValueType(), sw.getValue(), cases, def, context);
                }
            case Token.CALL:
                return addUnchainToCall((CallStatement) stmt);
            case Token.RETURN:
                return prependUnchain(stmt);
            case Token.TRY_COMMIT:
                {
                    TryCommit tc = (TryCommit) stmt;
                    return new TryCommit(
                            tc.getRef(),
                            addUnchain(tc.getBody()),
                            addUnchain(tc.getHandler()),
                            context);
                }
            default:
                // labels, gotos, commits and atomic statements never leave the function
                return stmt;
        }
    }

    private List<Statement> addUnchain(List<Statement> statements) {
        List<Statement> result = new ArrayList<>(statements.size());
        for (Statement s : statements) {
            result.add(addUnchain(s));
        }
        return result;
    }

    private Statement addUnchainToCall(CallStatement call) {
        Context context = call.getContext();
        switch (call.getCallKind()) {
            case NO_RETURN:
                return prependUnchain(call);
            case TAIL:
                {
                    // The return keeps control from falling through past the call and unlinking
                    // the frame a second time.
                    List<Rval> results = new ArrayList<>();
                    for (Lval lval : call.getReturnLvals()) {
                        results.add(Rval.of(lval));
                    }
                    Statement ret = new ReturnStatement(results, context);
                    return new Block(
                            Collections.<Defn>emptyList(),
                            Arrays.asList(unchainFrame(context), call, ret),
                            context);
                }
            default:
                return call;
        }
    }

    private Statement prependUnchain(Statement stmt) {
        Context context = stmt.getContext();
        return new Block(
                Collections.<Defn>emptyList(),
                Arrays.asList(unchainFrame(context), stmt),
                context);
    }

    /**
     * Wraps a commit so that the stack chain is saved before the protected statement and restored
     * at the start of the handler:
     *
     * <pre>
     * {
     *     void *saved_stack_chain_N;
     *     try_commit (ref)
     *         { saved_stack_chain_N = stack_chain; body }
     *     commit
     *         { stack_chain = saved_stack_chain_N; handler }
     * }
     * </pre>
     */
    static Block saveAndRestoreStackChain(TryCommit tc, ElimInfo info) {
        int id = info.allocateSavedStackChainId();
        VarName savedName = new VarName(SAVED_STACK_CHAIN, id);
        Lval.Var saved =
                new Lval.Var(
                        new QualVar(info.getModuleName(), savedName), IrType.GENERIC_ENV_PTR);
        Lval.Var stackChain = info.getStackChainVar();
        Context bodyContext = tc.getBody().getContext();
        Context handlerContext = tc.getHandler().getContext();

        Defn savedDecl =
                new Defn(
                        new EntityName.DataName(savedName),
                        bodyContext,
                        DeclFlags.LOCAL_VAR,
                        new DataDefn(IrType.GENERIC_ENV_PTR, Initializer.NONE, null));
        Statement save = new AtomicStatement.Assign(saved, Rval.of(stackChain), bodyContext);
        Statement restore =
                new AtomicStatement.Assign(stackChain, Rval.of(saved), handlerContext);
        Statement body =
                new Block(
                        Collections.<Defn>emptyList(),
                        Arrays.asList(save, tc.getBody()),
                        bodyContext);
        Statement handler =
                new Block(
                        Collections.<Defn>emptyList(),
                        Arrays.asList(restore, tc.getHandler()),
                        handlerContext);
        TryCommit wrapped = new TryCommit(tc.getRef(), body, handler, tc.getContext());
        return new Block(
                Collections.singletonList(savedDecl),
                Collections.<Statement>singletonList(wrapped),
                tc.getContext());
    }
}
