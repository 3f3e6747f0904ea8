/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import java.util.ArrayList;
import java.util.List;
import org.mozilla.lowir.ir.Argument;
import org.mozilla.lowir.ir.AtomicStatement;
import org.mozilla.lowir.ir.Block;
import org.mozilla.lowir.ir.CallStatement;
import org.mozilla.lowir.ir.ComputedGoto;
import org.mozilla.lowir.ir.DataDefn;
import org.mozilla.lowir.ir.DeclFlags;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.DoCommit;
import org.mozilla.lowir.ir.FunctionDefn;
import org.mozilla.lowir.ir.IfThenElse;
import org.mozilla.lowir.ir.Initializer;
import org.mozilla.lowir.ir.IrSearch;
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
 * Walks a function body depth first, removing the definitions that have to leave their block and
 * rewriting every variable reference through a {@link VarFixer}.
 *
 * <p>Nested functions are flattened recursively against the same {@link ElimInfo}. When
 * hoisting they are taken out of their block; otherwise they stay where they are. Static
 * constants always leave the block. Locals the strategy wants captured leave the block too, and
 * their initializers turn into assignments at the start of the block's statements.
 */
final class Flattener {

    private final ElimInfo info;
    private final VarFixer fixer;

    Flattener(ElimInfo info) {
        this.info = info;
        this.fixer = new VarFixer(info);
    }

    VarFixer getFixer() {
        return fixer;
    }

    /** The definitions left in a block and the assignments that replace moved initializers. */
    static final class FlattenedDefns {
        final List<Defn> defns;
        final List<Statement> initStatements;

        FlattenedDefns(List<Defn> defns, List<Statement> initStatements) {
            this.defns = defns;
            this.initStatements = initStatements;
        }
    }

    List<Argument> flattenArguments(List<Argument> args) {
        List<Argument> result = new ArrayList<>(args.size());
        for (Argument arg : args) {
            Statement trace = arg.getGcTrace();
            result.add(trace == null ? arg : arg.withGcTrace(flattenStatement(trace)));
        }
        return result;
    }

    List<Statement> flattenStatements(List<Statement> statements) {
        List<Statement> result = new ArrayList<>(statements.size());
        for (Statement statement : statements) {
            result.add(flattenStatement(statement));
        }
        return result;
    }

    Statement flattenMaybeStatement(Statement statement) {
        return statement == null ? null : flattenStatement(statement);
    }

    Statement flattenStatement(Statement stmt) {
        switch (stmt.getType()) {
            case Token.BLOCK:
                {
                    Block block = (Block) stmt;
                    FlattenedDefns flat =
                            flattenNestedDefns(block.getDefns(), block.getStatements());
                    List<Statement> statements =
                            flattenStatements(
                                    Kit.concat(flat.initStatements, block.getStatements()));
                    return new Block(flat.defns, statements, stmt.getContext());
                }
            case Token.WHILE:
                {
                    WhileLoop loop = (WhileLoop) stmt;
                    return new WhileLoop(
                            fixer.fixRval(loop.getCondition()),
                            flattenStatement(loop.getBody()),
                            loop.isLoopAtLeastOnce(),
                            stmt.getContext());
                }
            case Token.IF:
                {
                    IfThenElse ite = (IfThenElse) stmt;
                    return new IfThenElse(
                            fixer.fixRval(ite.getCondition()),
                            flattenStatement(ite.getThenPart()),
                            flattenMaybeStatement(ite.getElsePart()),
                            stmt.getContext());
                }
            case Token.SWITCH:
                {
                    SwitchStatement sw = (SwitchStatement) stmt;
                    List<SwitchCase> cases = new ArrayList<>(sw.getCases().size());
                    for (SwitchCase c : sw.getCases()) {
                        cases.add(
                                new SwitchCase(
                                        fixer.fixCaseConds(c.getConditions()),
                                        flattenStatement(c.getBody())));
                    }
                    return new SwitchStatement(
                            sw.getValueType(),
                            fixer.fixRval(sw.getValue()),
                            cases,
                            flattenDefault(sw.getDefault()),
                            stmt.getContext());
                }
            case Token.LABEL:
            case Token.GOTO:
                return stmt;
            case Token.COMPUTED_GOTO:
                {
                    ComputedGoto cg = (ComputedGoto) stmt;
                    return new ComputedGoto(
                            fixer.fixRval(cg.getIndex()), cg.getLabels(), stmt.getContext());
                }
            case Token.CALL:
                {
                    CallStatement call = (CallStatement) stmt;
                    return new CallStatement(
                            call.getSignature(),
                            fixer.fixRval(call.getFunction()),
                            fixer.fixMaybeRval(call.getObject()),
                            fixer.fixRvals(call.getArgs()),
                            fixer.fixLvals(call.getReturnLvals()),
                            call.getCallKind(),
                            stmt.getContext());
                }
            case Token.RETURN:
                return new ReturnStatement(
                        fixer.fixRvals(((ReturnStatement) stmt).getValues()), stmt.getContext());
            case Token.DO_COMMIT:
                return new DoCommit(
                        fixer.fixRval(((DoCommit) stmt).getRef()), stmt.getContext());
            case Token.TRY_COMMIT:
                {
                    TryCommit tc = (TryCommit) stmt;
                    TryCommit flat =
                            new TryCommit(
                                    fixer.fixLval(tc.getRef()),
                                    flattenStatement(tc.getBody()),
                                    flattenStatement(tc.getHandler()),
                                    stmt.getContext());
                    if (info.getStrategy().chainsStackFrames()) {
                        return StackChainUnlinker.saveAndRestoreStackChain(flat, info);
                    }
                    return flat;
                }
            default:
                if (stmt instanceof AtomicStatement) {
                    return fixer.fixAtomic((AtomicStatement) stmt);
                }
                throw Kit.codeBug("unexpected statement " + stmt.shortName());
        }
    }

    private SwitchDefault flattenDefault(SwitchDefault def) {
        if (def.getKind() == SwitchDefault.Kind.CASE) {
            return SwitchDefault.of(flattenStatement(def.getBody()));
        }
        return def;
    }

    /**
     * Processes the definitions of one block.
     *
     * <p>A captured local's initializer is run later, as an assignment. Any later sibling whose
     * initializer reads such a deferred variable is deferred as well, even if it stays in the
     * block, so the assignments run in declaration order and each sees the values it depends on.
     *
     * @param followingStatements the statements of the block, searched for later uses
     */
    FlattenedDefns flattenNestedDefns(List<Defn> defns, List<Statement> followingStatements) {
        List<Defn> kept = new ArrayList<>();
        List<Statement> initStatements = new ArrayList<>();
        List<QualVar> deferred = new ArrayList<>();
        for (int i = 0, n = defns.size(); i < n; i++) {
            Defn defn = defns.get(i);
            List<Defn> followingDefns = defns.subList(i + 1, n);
            if (defn.getBody() instanceof FunctionDefn) {
                Defn flat = flattenFunction(defn);
                if (info.getStrategy().hoistsNestedFunctions()) {
                    DeclFlags flags =
                            flat.getFlags()
                                    .withAccess(DeclFlags.Access.PRIVATE)
                                    .withPerInstance(DeclFlags.PerInstance.ONE_COPY);
                    info.addNestedFunc(flat.withFlags(flags));
                } else {
                    kept.add(flat);
                }
            } else if (defn.getBody() instanceof DataDefn) {
                flattenLocalData(
                        defn, followingDefns, followingStatements, kept, initStatements, deferred);
            } else {
                // nested classes are left alone
                kept.add(defn);
            }
        }
        return new FlattenedDefns(kept, initStatements);
    }

    private void flattenLocalData(
            Defn defn,
            List<Defn> followingDefns,
            List<Statement> followingStatements,
            List<Defn> kept,
            List<Statement> initStatements,
            List<QualVar> deferred) {
        DataDefn data = (DataDefn) defn.getBody();
        VarName name = defn.getVarName();
        if (defn.isStaticConst()) {
            addAndFlattenLocalData(defn);
            return;
        }
        if (name != null
                && info.getStrategy()
                        .needsCapture(
                                info.getModuleName(),
                                name,
                                data.getGcTrace(),
                                followingDefns,
                                followingStatements)) {
            Defn local = defn;
            if (!data.getInitializer().isNone()) {
                initToAssignments(defn, initStatements);
                deferred.add(new QualVar(info.getModuleName(), name));
                local = defn.withBody(data.withInitializer(Initializer.NONE));
            }
            addAndFlattenLocalData(local);
            return;
        }
        Statement trace = flattenMaybeStatement(data.getGcTrace());
        if (name != null && readsAny(data.getInitializer(), deferred)) {
            initToAssignments(defn, initStatements);
            deferred.add(new QualVar(info.getModuleName(), name));
            kept.add(defn.withBody(new DataDefn(data.getDataType(), Initializer.NONE, trace)));
            return;
        }
        Initializer init = fixer.fixInitializer(data.getInitializer());
        kept.add(defn.withBody(new DataDefn(data.getDataType(), init, trace)));
    }

    private static boolean readsAny(Initializer init, List<QualVar> vars) {
        for (QualVar var : vars) {
            if (IrSearch.containsVar(init, var)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Turns {@code T x = init;} into assignments, left unflattened. A plain initializer becomes
     * {@code x = e;}. An array or struct initializer becomes one assignment per element or member
     * in order, each to the boxed word at that offset of {@code x}. Missing members are skipped.
     */
    private void initToAssignments(Defn defn, List<Statement> result) {
        DataDefn data = (DataDefn) defn.getBody();
        Lval.Var var =
                new Lval.Var(
                        new QualVar(info.getModuleName(), defn.getVarName()), data.getDataType());
        initToAssignments(var, data.getDataType(), data.getInitializer(), defn, result);
    }

    private void initToAssignments(
            Lval target, IrType targetType, Initializer init, Defn defn, List<Statement> result) {
        if (init.isNone()) {
            return;
        }
        switch (init.getType()) {
            case Token.INIT_OBJ:
                result.add(
                        new AtomicStatement.Assign(
                                target, ((Initializer.Obj) init).getValue(), defn.getContext()));
                break;
            case Token.INIT_STRUCT:
                aggregateToAssignments(
                        target, targetType, ((Initializer.Struct) init).getMembers(), defn, result);
                break;
            case Token.INIT_ARRAY:
                aggregateToAssignments(
                        target, targetType, ((Initializer.Array) init).getElements(), defn, result);
                break;
            default:
                throw Kit.codeBug("unexpected initializer of " + defn.getName());
        }
    }

    private void aggregateToAssignments(
            Lval target,
            IrType targetType,
            List<Initializer> parts,
            Defn defn,
            List<Statement> result) {
        Rval addr = new Rval.MemAddr(target);
        IrType ptrType = IrType.pointerTo(targetType);
        for (int i = 0; i < parts.size(); i++) {
            Lval.Field slot =
                    new Lval.Field(
                            0,
                            addr,
                            new Lval.OffsetField(Rval.Const.intConst(i)),
                            IrType.GENERIC,
                            ptrType);
            initToAssignments(slot, IrType.GENERIC, parts.get(i), defn, result);
        }
    }

    /**
     * Records a local in the pass state, then flattens its GC trace statement. The local has to
     * be recorded first so that references to itself inside the trace code get rewritten.
     */
    void addAndFlattenLocalData(Defn local) {
        info.addLocalData(local);
        DataDefn data = (DataDefn) local.getBody();
        if (data.getGcTrace() != null) {
            Defn flat = local.withBody(data.withGcTrace(flattenStatement(data.getGcTrace())));
            info.replaceLocalData(local, flat);
        }
    }

    private Defn flattenFunction(Defn defn) {
        FunctionDefn fn = (FunctionDefn) defn.getBody();
        if (fn.getBody() == null) {
            return defn;
        }
        return defn.withBody(fn.withBody(flattenStatement(fn.getBody())));
    }
}
