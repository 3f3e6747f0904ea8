/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.tests;

import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.io.UnsupportedEncodingException;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.mozilla.lowir.Action;
import org.mozilla.lowir.ElimNested;
import org.mozilla.lowir.IrEnvirons;
import org.mozilla.lowir.ir.ClassDefn;
import org.mozilla.lowir.ir.DeclFlags;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.FunctionDefn;
import org.mozilla.lowir.ir.IrModule;
import org.mozilla.lowir.ir.IrSearch;
import org.mozilla.lowir.ir.IrType;
import org.mozilla.lowir.ir.QualVar;
import org.mozilla.lowir.ir.VarName;

class HoistNestedFuncsTest {

    private IrEnvirons environs;
    private ElimNested pass;

    @BeforeEach
    void setUp() {
        environs = new IrEnvirons();
        pass = new ElimNested(Action.HOIST_NESTED_FUNCS, environs);
    }

    @Nested
    class Structure {

        @Test
        void noNestedFunctionsRemain() {
            IrModule out = pass.transform(Programs.closure());
            for (Defn defn : out.getDefns()) {
                if (defn.isFunction()) {
                    assertTrue(Programs.nestedFunctions(defn).isEmpty(), defn.getName().toString());
                }
            }
            assertEquals(3, out.getDefns().size());
        }

        @Test
        void hoistedFunctionsComeBeforeTheirParent() {
            IrModule out = pass.transform(Programs.closure());
            assertTrue(out.getDefns().get(0).getBody() instanceof ClassDefn);
            assertEquals(Programs.BAR, out.getDefns().get(1).getName());
            assertEquals(DeclFlags.PRIVATE_ONE_COPY, out.getDefns().get(1).getFlags());
            assertEquals(Programs.FOO, out.getDefns().get(2).getName());
        }

        @Test
        void capturedArgumentIsOnlyReadThroughTheRecord() {
            IrModule out = pass.transform(Programs.closure());
            Defn bar = Programs.find(out, Programs.BAR);
            assertFalse(IrSearch.containsVar(bar, new QualVar(Programs.MODULE, new VarName("x"))));
            String foo = Programs.find(out, Programs.FOO).toSource();
            assertTrue(foo.contains("env_ptr->x = x;"), foo);
        }

        @Test
        void independentNestedFunctionNeedsNoRecord() {
            IrModule in = Programs.independentNested();
            IrModule out = pass.transform(in);
            assertEquals(2, out.getDefns().size());
            assertEquals(Programs.BAR, out.getDefns().get(0).getName());
            Defn foo = out.getDefns().get(1);
            Defn original = in.getDefns().get(0);
            assertEquals(
                    ((FunctionDefn) original.getBody()).getParams(),
                    ((FunctionDefn) foo.getBody()).getParams());
            assertFalse(foo.toSource().contains("env_ptr"));
        }

        @Test
        void identicalHoistedConstantsAreMerged() {
            IrModule out = pass.transform(Programs.sharedConstant());
            assertEquals(3, out.getDefns().size());
            assertTrue(out.getDefns().get(0).isStaticConst());
        }
    }

    @Nested
    class Properties {

        @Test
        void flatModuleIsUnchanged() {
            IrModule in = Programs.flat();
            assertEquals(in, pass.transform(in));
        }

        @Test
        void outputIsDeterministic() {
            String first = pass.transform(Programs.closure()).toSource();
            String second =
                    new ElimNested(Action.HOIST_NESTED_FUNCS, new IrEnvirons())
                            .transform(Programs.closure())
                            .toSource();
            assertEquals(first, second);
        }

        @Test
        void secondRunChangesNothing() {
            IrModule once = pass.transform(Programs.closure());
            assertEquals(once, pass.transform(once));
        }

        @Test
        void deferredInitializersRunInDeclarationOrder() {
            String out = pass.transform(Programs.deferredInitializers()).toSource();
            int first = out.indexOf("env_ptr->a = 1;");
            int second = out.indexOf("b = (env_ptr->a + 1);");
            assertTrue(first >= 0, out);
            assertTrue(second > first, out);
            assertFalse(out.contains("int b = "), out);
        }
    }

    @Nested
    class Configuration {

        @Test
        void heapRecordOnReferenceTarget() {
            environs.setEnvOnHeap(true);
            environs.setTarget(IrEnvirons.Target.JAVA);
            IrModule out = pass.transform(Programs.closure());
            ClassDefn record = (ClassDefn) out.getDefns().get(0).getBody();
            assertEquals(IrType.ClassType.Kind.CLASS, record.getKind());
            String foo = Programs.find(out, Programs.FOO).toSource();
            assertTrue(foo.contains("env = new class foo_1_p_0_env();"), foo);
            assertTrue(foo.contains("env_ptr = env;"), foo);
        }

        @Test
        void printTreesDumpsBeforeAndAfter() {
            environs.setPrintTrees(true);
            PrintStream saved = System.out;
            ByteArrayOutputStream buffer = new ByteArrayOutputStream();
            try {
                System.setOut(new PrintStream(buffer, true, "UTF-8"));
                pass.transform(Programs.closure());
            } catch (UnsupportedEncodingException e) {
                throw new AssertionError(e);
            } finally {
                System.setOut(saved);
            }
            String dump = new String(buffer.toByteArray(), StandardCharsets.UTF_8);
            assertTrue(dump.contains("before HOIST_NESTED_FUNCS:"), dump);
            assertTrue(dump.contains("after HOIST_NESTED_FUNCS:"), dump);
            assertTrue(dump.contains("struct foo_1_p_0_env"), dump);
        }
    }
}
