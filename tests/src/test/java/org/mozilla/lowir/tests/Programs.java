/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.tests;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.mozilla.lowir.ir.Argument;
import org.mozilla.lowir.ir.CallStatement;
import org.mozilla.lowir.ir.CodeAddr;
import org.mozilla.lowir.ir.DataDefn;
import org.mozilla.lowir.ir.DeclFlags;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.EntityName;
import org.mozilla.lowir.ir.FuncSignature;
import org.mozilla.lowir.ir.Initializer;
import org.mozilla.lowir.ir.IrFactory;
import org.mozilla.lowir.ir.IrModule;
import org.mozilla.lowir.ir.IrNode;
import org.mozilla.lowir.ir.IrSearch;
import org.mozilla.lowir.ir.IrType;
import org.mozilla.lowir.ir.Lval;
import org.mozilla.lowir.ir.PredLabel;
import org.mozilla.lowir.ir.Rval;
import org.mozilla.lowir.ir.Statement;
import org.mozilla.lowir.ir.VarName;

/** Sample modules for the transformation tests. */
final class Programs {

    static final String MODULE = "m";
    static final IrType INT = IrType.named("int");

    static final EntityName.FunctionName FOO = name("foo", 1, null);
    static final EntityName.FunctionName BAR = name("foo", 1, 1);
    static final EntityName.FunctionName BAZ = name("baz", 1, null);
    static final EntityName.FunctionName G = name("g", 1, null);
    static final EntityName.FunctionName GC_TRACE = name("gc_trace", 1, null);

    static final String UNCHAIN = "stack_chain = ((struct StackChain *) stack_chain)->prev;";

    private static final FuncSignature TRACE_SIG =
            new FuncSignature(
                    Collections.singletonList(IrType.GENERIC_ENV_PTR),
                    Collections.<IrType>emptyList());
    private static final FuncSignature G_SIG =
            new FuncSignature(
                    Collections.singletonList(IrType.GENERIC), Collections.<IrType>emptyList());

    private Programs() {}

    static EntityName.FunctionName name(String pred, int arity, Integer seq) {
        return IrFactory.functionName(PredLabel.predicate(pred, arity), 0, seq);
    }

    /** {@code gc_trace(&var);} */
    static Statement traceOf(IrFactory f, String var) {
        Rval tracer =
                Rval.Const.codeAddr(new CodeAddr("private_builtin", GC_TRACE, TRACE_SIG));
        return f.call(
                TRACE_SIG,
                tracer,
                Collections.<Rval>singletonList(new Rval.MemAddr(f.var(var, IrType.GENERIC))),
                Collections.<Lval>emptyList(),
                CallStatement.CallKind.ORDINARY);
    }

    /** {@code g(var);} with the given call kind. */
    static Statement callG(IrFactory f, String var, CallStatement.CallKind kind) {
        return f.call(
                G_SIG,
                f.codeAddr(G, G_SIG),
                Collections.<Rval>singletonList(f.ref(var, IrType.GENERIC)),
                Collections.<Lval>emptyList(),
                kind);
    }

    /** A nested function that adds its argument to whatever {@code reads} names. */
    static Defn nestedAdder(IrFactory f, EntityName.FunctionName name, String reads) {
        return f.function(
                name,
                DeclFlags.NESTED_FUNCTION,
                Arrays.asList(f.arg("env_ptr_arg", IrType.GENERIC_ENV_PTR), f.arg("y", INT)),
                Collections.singletonList(INT),
                f.block(f.ret(Rval.binop("+", f.ref(reads, INT), f.ref("y", INT)))));
    }

    /**
     * <pre>
     * int foo(int x) {
     *     int r;
     *     int bar(int y) { return x + y; }
     *     r = bar(env_ptr, 1);
     *     return r;
     * }
     * </pre>
     */
    static IrModule closure() {
        IrFactory f = new IrFactory(MODULE);
        FuncSignature barSig =
                new FuncSignature(
                        Arrays.asList(IrType.GENERIC_ENV_PTR, INT),
                        Collections.singletonList(INT));
        Statement call =
                f.call(
                        barSig,
                        f.codeAddr(BAR, barSig),
                        Arrays.<Rval>asList(
                                f.ref("env_ptr", IrType.UNKNOWN), IrFactory.intConst(1)),
                        Collections.<Lval>singletonList(f.var("r", INT)),
                        CallStatement.CallKind.ORDINARY);
        Statement body =
                f.block(
                        Arrays.asList(f.localVar("r", INT), nestedAdder(f, BAR, "x")),
                        Arrays.asList(call, f.ret(f.ref("r", INT))));
        Defn foo =
                f.function(
                        FOO,
                        DeclFlags.EXPORTED_FUNCTION,
                        Collections.singletonList(f.arg("x", INT)),
                        Collections.singletonList(INT),
                        body);
        return f.module(Collections.<String>emptyList(), Collections.singletonList(foo));
    }

    /**
     * A captured local whose initializer a later sibling reads:
     *
     * <pre>
     * int foo() {
     *     int a = 1;
     *     int b = a + 1;
     *     int bar(int y) { return a + y; }
     *     return b;
     * }
     * </pre>
     */
    static IrModule deferredInitializers() {
        IrFactory f = new IrFactory(MODULE);
        Defn a = f.localVar("a", INT, Initializer.of(IrFactory.intConst(1)), null);
        Defn b =
                f.localVar(
                        "b",
                        INT,
                        Initializer.of(Rval.binop("+", f.ref("a", INT), IrFactory.intConst(1))),
                        null);
        Statement body =
                f.block(
                        Arrays.asList(a, b, nestedAdder(f, BAR, "a")),
                        Collections.<Statement>singletonList(f.ret(f.ref("b", INT))));
        Defn foo =
                f.function(
                        FOO,
                        DeclFlags.EXPORTED_FUNCTION,
                        Collections.<Argument>emptyList(),
                        Collections.singletonList(INT),
                        body);
        return f.module(Collections.<String>emptyList(), Collections.singletonList(foo));
    }

    /** A nested function that touches nothing of its parent. */
    static IrModule independentNested() {
        IrFactory f = new IrFactory(MODULE);
        Statement body =
                f.block(
                        Collections.singletonList(nestedAdder(f, BAR, "y")),
                        Collections.<Statement>singletonList(f.ret(f.ref("x", INT))));
        Defn foo =
                f.function(
                        FOO,
                        DeclFlags.EXPORTED_FUNCTION,
                        Collections.singletonList(f.arg("x", INT)),
                        Collections.singletonList(INT),
                        body);
        return f.module(Collections.<String>emptyList(), Collections.singletonList(foo));
    }

    /** Plain code: a global, and a function without nested definitions or traced locals. */
    static IrModule flat() {
        IrFactory f = new IrFactory(MODULE);
        Defn global =
                new Defn(
                        new EntityName.DataName(new VarName("counter")),
                        f.getContext(),
                        DeclFlags.PRIVATE_ONE_COPY,
                        new DataDefn(
                                INT, Initializer.of(IrFactory.intConst(0)), null));
        Statement body =
                f.block(
                        Collections.singletonList(f.localVar("t", INT)),
                        Arrays.asList(
                                f.assign(f.var("t", INT), f.ref("x", INT)),
                                f.whileLoop(f.ref("t", INT), f.gcCheck()),
                                f.ret(f.ref("t", INT))));
        Defn id =
                f.function(
                        name("id", 1, null),
                        DeclFlags.EXPORTED_FUNCTION,
                        Collections.singletonList(f.arg("x", INT)),
                        Collections.singletonList(INT),
                        body);
        return f.module(Collections.<String>emptyList(), Arrays.asList(global, id));
    }

    /** Two functions that declare the same static constant. */
    static IrModule sharedConstant() {
        IrFactory f = new IrFactory(MODULE);
        Defn one = returnsConstant(f, name("one", 0, null));
        Defn two = returnsConstant(f, name("two", 0, null));
        return f.module(Collections.<String>emptyList(), Arrays.asList(one, two));
    }

    private static Defn returnsConstant(IrFactory f, EntityName.FunctionName fname) {
        Statement body =
                f.block(
                        Collections.singletonList(
                                f.staticConst("k", INT, Initializer.of(IrFactory.intConst(5)))),
                        Collections.<Statement>singletonList(f.ret(f.ref("k", INT))));
        return f.function(
                fname,
                DeclFlags.EXPORTED_FUNCTION,
                Collections.<Argument>emptyList(),
                Collections.singletonList(INT),
                body);
    }

    /**
     * <pre>
     * void baz(MR_Box p) {       // p traced
     *     MR_Box q;              // q traced
     *     q = p;
     *     g(q);
     * }
     * </pre>
     */
    static IrModule framed() {
        IrFactory f = new IrFactory(MODULE);
        Statement body =
                f.block(
                        Collections.singletonList(
                                f.localVar("q", IrType.GENERIC, Initializer.NONE, traceOf(f, "q"))),
                        Arrays.asList(
                                f.assign(f.var("q", IrType.GENERIC), f.ref("p", IrType.GENERIC)),
                                callG(f, "q", CallStatement.CallKind.ORDINARY)));
        Defn baz =
                f.function(
                        BAZ,
                        DeclFlags.EXPORTED_FUNCTION,
                        Collections.singletonList(f.arg("p", IrType.GENERIC, traceOf(f, "p"))),
                        Collections.<IrType>emptyList(),
                        body);
        return f.module(Collections.<String>emptyList(), Collections.singletonList(baz));
    }

    /**
     * A function with a result, a traced local and several exits:
     *
     * <pre>
     * MR_Box baz(int c) {
     *     MR_Box q;            // traced
     *     if (c) return q;
     *     try_commit (q) { tail call g(q); } commit { no return g(q); }
     *     return q;
     * }
     * </pre>
     */
    static IrModule framedWithExits() {
        IrFactory f = new IrFactory(MODULE);
        Statement tryCommit =
                f.tryCommit(
                        f.var("q", IrType.GENERIC),
                        f.block(callG(f, "q", CallStatement.CallKind.TAIL)),
                        f.block(callG(f, "q", CallStatement.CallKind.NO_RETURN)));
        Statement body =
                f.block(
                        Collections.singletonList(
                                f.localVar("q", IrType.GENERIC, Initializer.NONE, traceOf(f, "q"))),
                        Arrays.asList(
                                f.ifThenElse(
                                        f.ref("c", INT), f.ret(f.ref("q", IrType.GENERIC)), null),
                                tryCommit,
                                f.ret(f.ref("q", IrType.GENERIC))));
        Defn baz =
                f.function(
                        BAZ,
                        DeclFlags.EXPORTED_FUNCTION,
                        Collections.singletonList(f.arg("c", INT)),
                        Collections.singletonList(IrType.GENERIC),
                        body);
        return f.module(Collections.<String>emptyList(), Collections.singletonList(baz));
    }

    /**
     * A traced local with an aggregate initializer:
     *
     * <pre>
     * void baz() {
     *     MR_Box q[] = { 0 };  // traced
     *     g(q);
     * }
     * </pre>
     */
    static IrModule tracedAggregate() {
        IrFactory f = new IrFactory(MODULE);
        Initializer init =
                new Initializer.Array(
                        Collections.<Initializer>singletonList(
                                Initializer.of(IrFactory.intConst(0))));
        Statement body =
                f.block(
                        Collections.singletonList(
                                f.localVar("q", IrType.GENERIC, init, traceOf(f, "q"))),
                        Collections.singletonList(
                                callG(f, "q", CallStatement.CallKind.ORDINARY)));
        Defn baz =
                f.function(
                        BAZ,
                        DeclFlags.EXPORTED_FUNCTION,
                        Collections.<Argument>emptyList(),
                        Collections.<IrType>emptyList(),
                        body);
        return f.module(Collections.<String>emptyList(), Collections.singletonList(baz));
    }

    /** The runtime's own {@code gc_trace/1}, which must never get a frame. */
    static IrModule gcTracePredicate() {
        IrFactory f = new IrFactory("private_builtin");
        Defn gcTrace =
                f.function(
                        GC_TRACE,
                        DeclFlags.EXPORTED_FUNCTION,
                        Collections.singletonList(f.arg("p", IrType.GENERIC, f.comment("self"))),
                        Collections.<IrType>emptyList(),
                        f.block(f.gcCheck()));
        return f.module(Collections.<String>emptyList(), Collections.singletonList(gcTrace));
    }

    /** Returns the top level definition with the given name. */
    static Defn find(IrModule module, EntityName name) {
        for (Defn defn : module.getDefns()) {
            if (defn.getName().equals(name)) {
                return defn;
            }
        }
        throw new AssertionError("no definition " + name);
    }

    static List<Defn> nestedFunctions(Defn function) {
        List<Defn> result = new ArrayList<>();
        for (Defn defn : IrSearch.collectDefns(Collections.singletonList(function.getBody()))) {
            if (defn != function && defn.isFunction()) {
                result.add(defn);
            }
        }
        return result;
    }

    /** Counts the statements whose text, trimmed, is {@code text}. */
    static int countStatements(IrNode root, final String text) {
        return IrSearch.count(
                root,
                new IrSearch.NodeFilter() {
                    @Override
                    public boolean accept(IrNode node) {
                        return node instanceof Statement && node.toSource().trim().equals(text);
                    }
                });
    }
}
