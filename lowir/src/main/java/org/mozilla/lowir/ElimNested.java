/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.IrModule;

/**
 * Eliminates nested functions from a module, or links the frames of its functions into the
 * shadow stack the accurate collector walks, depending on the {@link Action}.
 *
 * <p>Hoisting moves every nested function to the top level. The locals and arguments a nested
 * function uses are moved into an environment record of the enclosing function, and every
 * reference to them goes through a pointer to that record:
 *
 * <pre>
 * int foo(int x) {                 struct foo_env { int x; };
 *     int bar(int y) {             int bar(void *env_ptr_arg, int y) {
 *         return x + y;                struct foo_env *env_ptr = env_ptr_arg;
 *     }                                return env_ptr-&gt;x + y;
 *     return bar(1);               }
 * }                                int foo(int x) {
 *                                      struct foo_env env;
 *                                      struct foo_env *env_ptr = &amp;env;
 *                                      env_ptr-&gt;x = x;
 *                                      return bar(env_ptr, 1);
 *                                  }
 * </pre>
 *
 * <p>Frame chaining puts the locals that hold collectable pointers into a frame record that
 * starts with a link to the previous frame and the address of a function that traces the frame.
 * The frame is pushed onto {@code stack_chain} on entry and popped on every way out.
 *
 * <p>An instance only holds configuration; {@link #transform} can be called any number of times.
 */
public class ElimNested {

    private final Action action;
    private final IrEnvirons environs;
    private final NestedFunctionHoister hoister;

    public ElimNested(Action action, IrEnvirons environs) {
        this.action = Objects.requireNonNull(action);
        this.environs = Objects.requireNonNull(environs);
        this.hoister = new NestedFunctionHoister(ElimStrategy.forAction(action), environs);
    }

    public Action getAction() {
        return action;
    }

    public IrEnvirons getEnvirons() {
        return environs;
    }

    public IrModule transform(IrModule module) {
        if (environs.isPrintTrees()) {
            System.out.println("before " + action + ":");
            System.out.println(module.toSource());
        }

        List<Defn> defns = new ArrayList<>();
        for (Defn defn : module.getDefns()) {
            defns.addAll(hoister.elimNestedDefns(module.getName(), defn));
        }
        // the same constant may be hoisted out of several functions
        Set<Defn> unique = new LinkedHashSet<>(defns);
        IrModule result = module.withDefns(new ArrayList<>(unique));

        if (environs.isPrintTrees()) {
            System.out.println("after " + action + ":");
            System.out.println(result.toSource());
        }
        if (environs.isCheckOutput()) {
            new IrValidator(action, environs).validate(result);
        }
        return result;
    }
}
