/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Collections;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.mozilla.lowir.ir.DeclFlags;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.Initializer;
import org.mozilla.lowir.ir.IrFactory;
import org.mozilla.lowir.ir.IrType;
import org.mozilla.lowir.ir.PredLabel;
import org.mozilla.lowir.ir.Rval;
import org.mozilla.lowir.ir.Statement;
import org.mozilla.lowir.ir.VarName;

class CaptureOracleTest {

    private static final IrType INT = IrType.named("int");

    private final IrFactory f = new IrFactory("m");

    private Defn functionReading(String var) {
        return f.function(
                IrFactory.functionName(PredLabel.predicate("p", 0), 0, 1),
                DeclFlags.NESTED_FUNCTION,
                Collections.singletonList(f.arg("env_ptr_arg", IrType.GENERIC_ENV_PTR)),
                Collections.singletonList(INT),
                f.block(f.ret(f.ref(var, INT))));
    }

    private boolean referencedLater(
            String var, List<Defn> followingDefns, List<Statement> followingStatements) {
        return CaptureOracle.isReferencedLater(
                "m", new VarName(var), followingDefns, followingStatements);
    }

    @Test
    void laterSiblingFunction() {
        assertTrue(
                referencedLater(
                        "x",
                        Collections.singletonList(functionReading("x")),
                        Collections.<Statement>emptyList()));
        assertFalse(
                referencedLater(
                        "y",
                        Collections.singletonList(functionReading("x")),
                        Collections.<Statement>emptyList()));
    }

    @Test
    void functionInsideLaterStatements() {
        Statement inner =
                f.block(
                        Collections.singletonList(functionReading("x")),
                        Collections.<Statement>emptyList());
        assertTrue(
                referencedLater(
                        "x",
                        Collections.<Defn>emptyList(),
                        Collections.singletonList(f.block(inner))));
    }

    @Test
    void plainStatementsDoNotCount() {
        assertFalse(
                referencedLater(
                        "x",
                        Collections.<Defn>emptyList(),
                        Collections.<Statement>singletonList(f.ret(f.ref("x", INT)))));
    }

    @Test
    void staticConstantInitializer() {
        Defn k =
                f.staticConst(
                        "k",
                        INT,
                        Initializer.of(Rval.binop("+", f.ref("x", INT), IrFactory.intConst(1))));
        assertTrue(
                referencedLater(
                        "x", Collections.singletonList(k), Collections.<Statement>emptyList()));
    }

    @Test
    void otherModuleIsNotTheSameVariable() {
        assertFalse(
                CaptureOracle.isReferencedLater(
                        "other",
                        new VarName("x"),
                        Collections.singletonList(functionReading("x")),
                        Collections.<Statement>emptyList()));
    }

    @Test
    void traceObligation() {
        assertTrue(CaptureOracle.hasTraceObligation(f.comment("trace")));
        assertFalse(CaptureOracle.hasTraceObligation(null));
        assertTrue(
                ElimStrategy.CHAIN_GC.needsCapture(
                        "m",
                        new VarName("x"),
                        f.comment("trace"),
                        Collections.<Defn>emptyList(),
                        Collections.<Statement>emptyList()));
        assertFalse(
                ElimStrategy.HOIST.needsCapture(
                        "m",
                        new VarName("x"),
                        f.comment("trace"),
                        Collections.<Defn>emptyList(),
                        Collections.<Statement>emptyList()));
    }
}
