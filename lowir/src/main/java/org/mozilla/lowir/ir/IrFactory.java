/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Builds IR nodes for one module. Every node gets the factory's current source context, which
 * can be changed with {@link #setContext}.
 */
public final class IrFactory {

    private final String moduleName;
    private Context context;

    public IrFactory(String moduleName) {
        this(moduleName, Context.NONE);
    }

    public IrFactory(String moduleName, Context context) {
        this.moduleName = Objects.requireNonNull(moduleName);
        this.context = Objects.requireNonNull(context);
    }

    public String getModuleName() {
        return moduleName;
    }

    public Context getContext() {
        return context;
    }

    public void setContext(Context context) {
        this.context = Objects.requireNonNull(context);
    }

    public IrFactory at(int lineno) {
        setContext(new Context(context.getFileName(), lineno));
        return this;
    }

    // Variables and expressions

    public QualVar qualVar(String name) {
        return new QualVar(moduleName, new VarName(name));
    }

    public Lval.Var var(String name, IrType varType) {
        return new Lval.Var(qualVar(name), varType);
    }

    public Lval.Var var(VarName name, IrType varType) {
        return new Lval.Var(new QualVar(moduleName, name), varType);
    }

    public Rval.LvalRef ref(String name, IrType varType) {
        return Rval.of(var(name, varType));
    }

    public static Rval.Const intConst(long value) {
        return Rval.Const.intConst(value);
    }

    /** {@code ptr->fieldName} for a field of {@code classType} reached through {@code ptr}. */
    public static Lval.Field field(
            Rval ptr,
            IrType.ClassType classType,
            IrType ptrType,
            String fieldName,
            IrType fieldType) {
        Lval.NamedField id =
                new Lval.NamedField(classType.getMemberQualifier(), fieldName, ptrType);
        return new Lval.Field(0, ptr, id, fieldType, ptrType);
    }

    // Statements

    public Block block(List<Defn> defns, List<Statement> statements) {
        return new Block(defns, statements, context);
    }

    public Block block(Statement... statements) {
        return new Block(Collections.<Defn>emptyList(), Arrays.asList(statements), context);
    }

    /**
     * A block of the given definitions and statements, or the statement itself if there is exactly
     * one statement and no definitions.
     */
    public Statement blockOrSingle(List<Defn> defns, List<Statement> statements) {
        if (defns.isEmpty() && statements.size() == 1) {
            return statements.get(0);
        }
        return block(defns, statements);
    }

    public AtomicStatement.Assign assign(Lval target, Rval value) {
        return new AtomicStatement.Assign(target, value, context);
    }

    public AtomicStatement.Comment comment(String text) {
        return new AtomicStatement.Comment(text, context);
    }

    public AtomicStatement.GcCheck gcCheck() {
        return new AtomicStatement.GcCheck(context);
    }

    public AtomicStatement.NewObject newObject(Lval target, IrType objectType) {
        return new AtomicStatement.NewObject(
                target, null, false, objectType, null, null, null, null, context);
    }

    public ReturnStatement ret(Rval... values) {
        return new ReturnStatement(Arrays.asList(values), context);
    }

    public CallStatement call(
            FuncSignature signature,
            Rval function,
            List<Rval> args,
            List<Lval> returnLvals,
            CallStatement.CallKind kind) {
        return new CallStatement(signature, function, null, args, returnLvals, kind, context);
    }

    public IfThenElse ifThenElse(Rval cond, Statement thenPart, Statement elsePart) {
        return new IfThenElse(cond, thenPart, elsePart, context);
    }

    public WhileLoop whileLoop(Rval cond, Statement body) {
        return new WhileLoop(cond, body, false, context);
    }

    public TryCommit tryCommit(Lval ref, Statement body, Statement handler) {
        return new TryCommit(ref, body, handler, context);
    }

    public DoCommit doCommit(Rval ref) {
        return new DoCommit(ref, context);
    }

    // Definitions

    public Defn localVar(String name, IrType varType, Initializer init, Statement gcTrace) {
        return localVar(new VarName(name), varType, init, gcTrace);
    }

    public Defn localVar(VarName name, IrType varType, Initializer init, Statement gcTrace) {
        return new Defn(
                new EntityName.DataName(name),
                context,
                DeclFlags.LOCAL_VAR,
                new DataDefn(varType, init, gcTrace));
    }

    public Defn localVar(String name, IrType varType) {
        return localVar(name, varType, Initializer.NONE, null);
    }

    public Defn staticConst(String name, IrType constType, Initializer init) {
        return new Defn(
                new EntityName.DataName(new VarName(name)),
                context,
                DeclFlags.LOCAL_CONST,
                new DataDefn(constType, init, null));
    }

    public Argument arg(String name, IrType argType, Statement gcTrace) {
        return new Argument(new EntityName.DataName(new VarName(name)), argType, gcTrace);
    }

    public Argument arg(String name, IrType argType) {
        return arg(name, argType, null);
    }

    public Defn function(
            EntityName.FunctionName name,
            DeclFlags flags,
            List<Argument> args,
            List<IrType> returnTypes,
            Statement body) {
        FunctionDefn fn = new FunctionDefn(new FuncParams(args, returnTypes), body, null);
        return new Defn(name, context, flags, fn);
    }

    public static EntityName.FunctionName functionName(PredLabel label, int modeNum, Integer seq) {
        return new EntityName.FunctionName(label, modeNum, seq);
    }

    public Rval.Const codeAddr(EntityName.FunctionName name, FuncSignature signature) {
        return Rval.Const.codeAddr(new CodeAddr(moduleName, name, signature));
    }

    /** A list holding the non-null elements given. */
    @SafeVarargs
    public static <T> List<T> listOf(T... items) {
        List<T> list = new ArrayList<>(items.length);
        for (T item : items) {
            if (item != null) {
                list.add(item);
            }
        }
        return list;
    }

    public IrModule module(List<String> imports, List<Defn> defns) {
        return new IrModule(moduleName, imports, defns);
    }
}
