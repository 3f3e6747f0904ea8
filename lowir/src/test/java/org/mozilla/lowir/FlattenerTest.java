/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mozilla.lowir.ir.Block;
import org.mozilla.lowir.ir.DeclFlags;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.EntityName;
import org.mozilla.lowir.ir.Initializer;
import org.mozilla.lowir.ir.IrFactory;
import org.mozilla.lowir.ir.IrType;
import org.mozilla.lowir.ir.PredLabel;
import org.mozilla.lowir.ir.Rval;
import org.mozilla.lowir.ir.Statement;
import org.mozilla.lowir.ir.TryCommit;

class FlattenerTest {

    private static final IrType INT = IrType.named("int");

    private IrFactory f;

    @BeforeEach
    void setUp() {
        f = new IrFactory("m");
    }

    private static ElimInfo newInfo(ElimStrategy strategy) {
        IrEnvirons environs = new IrEnvirons();
        IrType.ClassType envType =
                EnvBuilder.envType("m", "foo_1_p_0_" + strategy.envNameBase(), environs);
        return new ElimInfo(
                strategy,
                "m",
                envType,
                EnvBuilder.envPtrType(envType, environs),
                StackChainUnlinker.stackChainVar(IrEnvirons.DEFAULT_PRIVATE_BUILTIN_MODULE));
    }

    private Defn nestedFunction(String usedVar) {
        EntityName.FunctionName name =
                IrFactory.functionName(PredLabel.predicate("foo", 1), 0, 1);
        return f.function(
                name,
                DeclFlags.NESTED_FUNCTION,
                Collections.singletonList(f.arg("env_ptr_arg", IrType.GENERIC_ENV_PTR)),
                Collections.singletonList(INT),
                f.block(f.ret(f.ref(usedVar, INT))));
    }

    @Nested
    class Hoisting {

        private ElimInfo info;
        private Flattener flattener;

        @BeforeEach
        void setUp() {
            info = newInfo(ElimStrategy.HOIST);
            flattener = new Flattener(info);
        }

        @Test
        void nestedFunctionLeavesItsBlock() {
            Block block =
                    f.block(
                            Collections.singletonList(nestedFunction("y")),
                            Collections.<Statement>singletonList(f.ret(IrFactory.intConst(0))));
            Block flat = (Block) flattener.flattenStatement(block);
            assertTrue(flat.getDefns().isEmpty());
            assertEquals(1, info.getNestedFuncs().size());
            assertEquals(DeclFlags.PRIVATE_ONE_COPY, info.getNestedFuncs().get(0).getFlags());
        }

        @Test
        void capturedInitializerBecomesAssignment() {
            Defn a = f.localVar("a", INT, Initializer.of(IrFactory.intConst(1)), null);
            Block block =
                    f.block(
                            Arrays.asList(a, nestedFunction("a")),
                            Collections.<Statement>singletonList(f.ret(f.ref("a", INT))));
            Block flat = (Block) flattener.flattenStatement(block);
            assertEquals(
                    "{\n" + "    env_ptr->a = 1;\n" + "    return env_ptr->a;\n" + "}\n",
                    flat.toSource());
            assertEquals(1, info.getLocalData().size());
            assertEquals("int a;\n", info.getLocalData().get(0).toSource());
        }

        @Test
        void laterInitializerReadingDeferredVariableIsDeferredToo() {
            Defn a = f.localVar("a", INT, Initializer.of(IrFactory.intConst(1)), null);
            Defn b =
                    f.localVar(
                            "b",
                            INT,
                            Initializer.of(Rval.binop("+", f.ref("a", INT), IrFactory.intConst(1))),
                            null);
            Defn c = f.localVar("c", INT, Initializer.of(IrFactory.intConst(7)), null);
            Block block =
                    f.block(
                            Arrays.asList(a, b, c, nestedFunction("a")),
                            Collections.<Statement>singletonList(f.ret(f.ref("b", INT))));
            Block flat = (Block) flattener.flattenStatement(block);
            assertEquals(
                    "{\n"
                            + "    int b;\n"
                            + "    int c = 7;\n"
                            + "    env_ptr->a = 1;\n"
                            + "    b = (env_ptr->a + 1);\n"
                            + "    return b;\n"
                            + "}\n",
                    flat.toSource());
        }

        @Test
        void uncapturedLocalStaysInPlace() {
            Defn a = f.localVar("a", INT, Initializer.of(IrFactory.intConst(3)), null);
            Block block =
                    f.block(
                            Collections.singletonList(a),
                            Collections.<Statement>singletonList(f.ret(f.ref("a", INT))));
            Block flat = (Block) flattener.flattenStatement(block);
            assertEquals(block, flat);
            assertTrue(info.getLocalData().isEmpty());
        }

        @Test
        void staticConstantIsRecordedForHoisting() {
            Defn k = f.staticConst("k", INT, Initializer.of(IrFactory.intConst(42)));
            Block block =
                    f.block(
                            Collections.singletonList(k),
                            Collections.<Statement>singletonList(f.ret(f.ref("k", INT))));
            Block flat = (Block) flattener.flattenStatement(block);
            assertTrue(flat.getDefns().isEmpty());
            assertEquals(Collections.singletonList(k), info.getLocalData());
            assertEquals("{\n    return k;\n}\n", flat.toSource());
        }

        @Test
        void aggregateInitializerOfCapturedVariableBecomesSlotAssignments() {
            Defn a =
                    f.localVar(
                            "a",
                            INT,
                            new Initializer.Array(
                                    Arrays.asList(
                                            Initializer.of(IrFactory.intConst(1)),
                                            Initializer.of(IrFactory.intConst(2)))),
                            null);
            Defn s =
                    f.localVar(
                            "s",
                            INT,
                            new Initializer.Struct(
                                    INT,
                                    Arrays.asList(
                                            Initializer.of(f.ref("a", INT)),
                                            Initializer.NONE,
                                            Initializer.of(IrFactory.intConst(3)))),
                            null);
            Block block =
                    f.block(
                            Arrays.asList(a, s, nestedFunction("a")),
                            Collections.<Statement>singletonList(f.ret(IrFactory.intConst(0))));
            Block flat = (Block) flattener.flattenStatement(block);
            assertEquals(
                    "{\n"
                            + "    int s;\n"
                            + "    MR_hl_field(&env_ptr->a, 0) = 1;\n"
                            + "    MR_hl_field(&env_ptr->a, 1) = 2;\n"
                            + "    MR_hl_field(&s, 0) = env_ptr->a;\n"
                            + "    MR_hl_field(&s, 2) = 3;\n"
                            + "    return 0;\n"
                            + "}\n",
                    flat.toSource());
        }
    }

    @Nested
    class ChainingFrames {

        private ElimInfo info;
        private Flattener flattener;

        @BeforeEach
        void setUp() {
            info = newInfo(ElimStrategy.CHAIN_GC);
            flattener = new Flattener(info);
        }

        @Test
        void tracedLocalIsCapturedAndItsTraceRewritten() {
            Statement trace = f.assign(f.var("seen", INT), f.ref("p", IrType.GENERIC));
            Defn p = f.localVar("p", IrType.GENERIC, Initializer.NONE, trace);
            Block block =
                    f.block(Collections.singletonList(p), Collections.<Statement>emptyList());
            Block flat = (Block) flattener.flattenStatement(block);
            assertTrue(flat.getDefns().isEmpty());
            List<Defn> locals = info.getLocalData();
            assertEquals(1, locals.size());
            assertEquals(
                    "MR_Box p;\n" + "gc_trace p\n" + "    seen = frame_ptr->p;\n",
                    locals.get(0).toSource());
        }

        @Test
        void nestedFunctionStaysInPlace() {
            Block block =
                    f.block(
                            Collections.singletonList(nestedFunction("y")),
                            Collections.<Statement>emptyList());
            Block flat = (Block) flattener.flattenStatement(block);
            assertEquals(1, flat.getDefns().size());
            assertTrue(info.getNestedFuncs().isEmpty());
        }

        @Test
        void commitGetsDistinctSaveVariables() {
            TryCommit tc =
                    f.tryCommit(
                            f.var("ref", IrType.GENERIC),
                            f.block(f.gcCheck()),
                            f.block(f.comment("handler")));
            Block outer = f.block(tc, tc);
            Block flat = (Block) flattener.flattenStatement(outer);
            String source = flat.toSource();
            assertTrue(source.contains("saved_stack_chain_0 = stack_chain;"), source);
            assertTrue(source.contains("stack_chain = saved_stack_chain_1;"), source);
        }
    }
}
