/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import static org.junit.jupiter.api.Assertions.*;

import java.util.Arrays;
import java.util.Collections;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mozilla.lowir.ir.ClassDefn;
import org.mozilla.lowir.ir.DeclFlags;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.EntityName;
import org.mozilla.lowir.ir.IrFactory;
import org.mozilla.lowir.ir.IrModule;
import org.mozilla.lowir.ir.IrType;
import org.mozilla.lowir.ir.PredLabel;
import org.mozilla.lowir.ir.Statement;

class IrValidatorTest {

    private static final IrType INT = IrType.named("int");
    private static final EntityName.FunctionName FOO =
            IrFactory.functionName(PredLabel.predicate("foo", 1), 0, null);

    private IrFactory f;
    private IrEnvirons environs;

    @BeforeEach
    void setUp() {
        f = new IrFactory("m");
        environs = new IrEnvirons();
    }

    private Defn record(String className, String... fields) {
        Defn[] defns = new Defn[fields.length];
        for (int i = 0; i < fields.length; i++) {
            defns[i] = f.localVar(fields[i], INT);
        }
        return new Defn(
                new EntityName.TypeName(className, 0),
                f.getContext(),
                DeclFlags.PRIVATE_ONE_COPY,
                new ClassDefn(
                        IrType.ClassType.Kind.STRUCT,
                        null,
                        null,
                        null,
                        Arrays.asList(defns)));
    }

    private Defn foo(Statement body) {
        return f.function(
                FOO,
                DeclFlags.EXPORTED_FUNCTION,
                Collections.singletonList(f.arg("x", INT)),
                Collections.singletonList(INT),
                body);
    }

    private void validate(Action action, Defn... defns) {
        IrModule module = f.module(Collections.<String>emptyList(), Arrays.asList(defns));
        new IrValidator(action, environs).validate(module);
    }

    @Test
    void nestedFunctionLeftBehind() {
        Defn nested =
                f.function(
                        IrFactory.functionName(PredLabel.predicate("foo", 1), 0, 1),
                        DeclFlags.NESTED_FUNCTION,
                        Collections.singletonList(f.arg("env_ptr_arg", IrType.GENERIC_ENV_PTR)),
                        Collections.<IrType>emptyList(),
                        f.block(f.gcCheck()));
        Defn fn =
                foo(
                        f.block(
                                Collections.singletonList(nested),
                                Collections.<Statement>singletonList(f.ret(f.ref("x", INT)))));
        assertThrows(IllegalStateException.class, () -> validate(Action.HOIST_NESTED_FUNCS, fn));
        validate(Action.CHAIN_GC_STACK_FRAMES, fn);
    }

    @Test
    void rawReferenceToCapturedLocal() {
        Defn fn = foo(f.block(f.ret(f.ref("y", INT))));
        assertThrows(
                IllegalStateException.class,
                () -> validate(Action.HOIST_NESTED_FUNCS, record("foo_1_p_0_env", "y"), fn));
    }

    @Test
    void parametersMayBeReadDirectly() {
        Defn fn = foo(f.block(f.ret(f.ref("x", INT))));
        validate(Action.HOIST_NESTED_FUNCS, record("foo_1_p_0_env", "x"), fn);
    }

    @Test
    void frameMustBeLinked() {
        Defn fn = foo(f.block(f.ret(f.ref("x", INT))));
        assertThrows(
                IllegalStateException.class,
                () ->
                        validate(
                                Action.CHAIN_GC_STACK_FRAMES,
                                record("foo_1_p_0_frame", "prev", "trace", "x"),
                                fn));
        validate(Action.CHAIN_GC_STACK_FRAMES, fn);
    }
}
