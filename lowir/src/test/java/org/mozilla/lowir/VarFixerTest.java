/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mozilla.lowir.ir.Initializer;
import org.mozilla.lowir.ir.IrFactory;
import org.mozilla.lowir.ir.IrType;
import org.mozilla.lowir.ir.Lval;
import org.mozilla.lowir.ir.QualVar;
import org.mozilla.lowir.ir.Rval;
import org.mozilla.lowir.ir.Statement;
import org.mozilla.lowir.ir.VarName;

class VarFixerTest {

    private static final IrType INT = IrType.named("int");

    private IrFactory f;
    private ElimInfo info;
    private VarFixer fixer;

    @BeforeEach
    void setUp() {
        f = new IrFactory("m");
        IrEnvirons environs = new IrEnvirons();
        IrType.ClassType envType = EnvBuilder.envType("m", "foo_1_p_0_env", environs);
        info =
                new ElimInfo(
                        ElimStrategy.HOIST,
                        "m",
                        envType,
                        EnvBuilder.envPtrType(envType, environs),
                        StackChainUnlinker.stackChainVar("private_builtin"));
        info.addLocalData(f.localVar("x", INT));
        fixer = new VarFixer(info);
    }

    @Test
    void capturedVariableBecomesField() {
        Lval fixed = fixer.fixLval(f.var("x", INT));
        assertTrue(fixed instanceof Lval.Field);
        Lval.Field field = (Lval.Field) fixed;
        assertEquals(Integer.valueOf(0), field.getTag());
        assertEquals(INT, field.getFieldType());
        assertEquals(info.getEnvPtrType(), field.getPtrType());
        assertEquals("m.foo_1_p_0_env", ((Lval.NamedField) field.getFieldId()).getQualifier());
        assertEquals("env_ptr->x", fixed.toSource());
    }

    @Test
    void otherVariablesAreKept() {
        Lval.Var y = f.var("y", INT);
        assertSame(y, fixer.fixLval(y));
        Lval.Var foreign = new Lval.Var(new QualVar("other", new VarName("x")), INT);
        assertSame(foreign, fixer.fixLval(foreign));
    }

    @Test
    void untypedEnvPtrGetsTheRecordPointerType() {
        Lval fixed = fixer.fixLval(f.var("env_ptr", IrType.UNKNOWN));
        assertEquals(new Lval.Var(f.qualVar("env_ptr"), info.getEnvPtrType()), fixed);
    }

    @Test
    void rewritesNestedExpressions() {
        Rval sum =
                Rval.binop(
                        "+",
                        Rval.cast(INT, f.ref("x", INT)),
                        new Rval.MemAddr(f.var("x", INT)));
        assertEquals("(((int) env_ptr->x) + &env_ptr->x)", fixer.fixRval(sum).toSource());
    }

    @Test
    void rewritesAssignmentsAndInitializers() {
        Statement fixed = fixer.fixAtomic(f.assign(f.var("x", INT), f.ref("y", INT)));
        assertEquals("env_ptr->x = y;\n", fixed.toSource());
        Initializer init =
                fixer.fixInitializer(
                        new Initializer.Array(
                                Collections.<Initializer>singletonList(
                                        Initializer.of(f.ref("x", INT)))));
        assertEquals("{ env_ptr->x }", init.toSource());
    }

    @Test
    void conflictingTypesForOneNameAreABug() {
        info.addLocalData(f.localVar("x", IrType.GENERIC));
        assertThrows(IllegalStateException.class, () -> fixer.fixLval(f.var("x", INT)));
    }
}
