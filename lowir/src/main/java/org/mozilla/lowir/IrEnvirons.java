/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import java.util.Locale;
import java.util.Properties;

/**
 * Settings of the back end the transformed IR is meant for.
 *
 * <p>A fresh instance targets C with environments on the stack.
 */
public class IrEnvirons {

    /** Code generation targets. */
    public enum Target {
        C(false, true),
        ASM(false, false),
        IL(true, false),
        JAVA(true, false),
        CSHARP(true, false);

        private final boolean referencePointers;
        private final boolean implicitZeroInit;

        Target(boolean referencePointers, boolean implicitZeroInit) {
            this.referencePointers = referencePointers;
            this.implicitZeroInit = implicitZeroInit;
        }

        /** True if a class type is already an object reference on this target. */
        public boolean hasReferencePointers() {
            return referencePointers;
        }

        /**
         * True if members missing from a struct initializer are zero-filled, as C99 6.7.8 #21
         * guarantees.
         */
        public boolean hasImplicitZeroInit() {
            return implicitZeroInit;
        }
    }

    public static final String DEFAULT_PRIVATE_BUILTIN_MODULE = "private_builtin";

    private Target target;
    private boolean envOnHeap;
    private String privateBuiltinModule;
    private boolean printTrees;
    private boolean checkOutput;

    public IrEnvirons() {
        target = Target.C;
        envOnHeap = false;
        privateBuiltinModule = DEFAULT_PRIVATE_BUILTIN_MODULE;
        printTrees = false;
        checkOutput = true;
    }

    /**
     * Reads settings from properties. Recognized keys are {@code lowir.target},
     * {@code lowir.envOnHeap}, {@code lowir.privateBuiltinModule}, {@code lowir.printTrees} and
     * {@code lowir.checkOutput}; missing keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value cannot be parsed
     */
    public static IrEnvirons fromProperties(Properties props) {
        IrEnvirons env = new IrEnvirons();
        String target = props.getProperty("lowir.target");
        if (target != null) {
            try {
                env.setTarget(Target.valueOf(target.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown target: " + target, e);
            }
        }
        env.setEnvOnHeap(parseBoolean(props, "lowir.envOnHeap", env.isEnvOnHeap()));
        String builtin = props.getProperty("lowir.privateBuiltinModule");
        if (builtin != null) {
            env.setPrivateBuiltinModule(builtin.trim());
        }
        env.setPrintTrees(parseBoolean(props, "lowir.printTrees", env.isPrintTrees()));
        env.setCheckOutput(parseBoolean(props, "lowir.checkOutput", env.isCheckOutput()));
        return env;
    }

    private static boolean parseBoolean(Properties props, String key, boolean defaultValue) {
        String value = props.getProperty(key);
        if (value == null) {
            return defaultValue;
        }
        value = value.trim();
        if ("true".equalsIgnoreCase(value)) {
            return true;
        }
        if ("false".equalsIgnoreCase(value)) {
            return false;
        }
        throw new IllegalArgumentException("Bad boolean value for " + key + ": " + value);
    }

    public Target getTarget() {
        return target;
    }

    public void setTarget(Target target) {
        if (target == null) throw new IllegalArgumentException();
        this.target = target;
    }

    /**
     * Whether environment and frame records are allocated on the heap rather than on the stack.
     * Heap records are classes instead of structs.
     */
    public boolean isEnvOnHeap() {
        return envOnHeap;
    }

    public void setEnvOnHeap(boolean envOnHeap) {
        this.envOnHeap = envOnHeap;
    }

    /** The module that owns {@code stack_chain} and the {@code gc_trace/1} primitive. */
    public String getPrivateBuiltinModule() {
        return privateBuiltinModule;
    }

    public void setPrivateBuiltinModule(String privateBuiltinModule) {
        if (privateBuiltinModule == null || privateBuiltinModule.isEmpty()) {
            throw new IllegalArgumentException("private builtin module name is empty");
        }
        this.privateBuiltinModule = privateBuiltinModule;
    }

    /** Whether to print the module to {@code System.out} before and after transforming it. */
    public boolean isPrintTrees() {
        return printTrees;
    }

    public void setPrintTrees(boolean printTrees) {
        this.printTrees = printTrees;
    }

    /** Whether to run {@link IrValidator} on every transformed module. */
    public boolean isCheckOutput() {
        return checkOutput;
    }

    public void setCheckOutput(boolean checkOutput) {
        this.checkOutput = checkOutput;
    }
}
