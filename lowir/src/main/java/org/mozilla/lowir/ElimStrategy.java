/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import java.util.List;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.Statement;
import org.mozilla.lowir.ir.VarName;

/**
 * The parts of the transformation that differ between the two {@link Action}s. The traversal
 * itself is shared; it asks the strategy whenever the actions disagree.
 */
abstract class ElimStrategy {

    static final ElimStrategy HOIST = new Hoist();
    static final ElimStrategy CHAIN_GC = new ChainGc();

    static ElimStrategy forAction(Action action) {
        switch (action) {
            case HOIST_NESTED_FUNCS:
                return HOIST;
            case CHAIN_GC_STACK_FRAMES:
                return CHAIN_GC;
        }
        throw Kit.codeBug("unknown action " + action);
    }

    abstract Action getAction();

    /** Base name of the record variable; the pointer variable appends {@code _ptr}. */
    abstract String envNameBase();

    final String envPtrName() {
        return envNameBase() + "_ptr";
    }

    /**
     * Decides whether a local or argument must move into the record.
     *
     * @param gcTrace the variable's GC trace statement, or null
     * @param followingDefns the definitions after it in the same block
     * @param followingStatements the statements of the block (or the function body, for
     *     arguments)
     */
    abstract boolean needsCapture(
            String moduleName,
            VarName varName,
            Statement gcTrace,
            List<Defn> followingDefns,
            List<Statement> followingStatements);

    /** True if nested functions are moved to module scope, false if they stay in place. */
    abstract boolean hoistsNestedFunctions();

    abstract boolean chainsStackFrames();

    /** True if a function with these nested functions and captures needs no record at all. */
    abstract boolean needsNoRecord(List<Defn> nestedFuncs, List<Defn> locals);

    @Override
    public String toString() {
        return getAction().toString();
    }

    private static final class Hoist extends ElimStrategy {
        @Override
        Action getAction() {
            return Action.HOIST_NESTED_FUNCS;
        }

        @Override
        String envNameBase() {
            return "env";
        }

        @Override
        boolean needsCapture(
                String moduleName,
                VarName varName,
                Statement gcTrace,
                List<Defn> followingDefns,
                List<Statement> followingStatements) {
            return CaptureOracle.isReferencedLater(
                    moduleName, varName, followingDefns, followingStatements);
        }

        @Override
        boolean hoistsNestedFunctions() {
            return true;
        }

        @Override
        boolean chainsStackFrames() {
            return false;
        }

        @Override
        boolean needsNoRecord(List<Defn> nestedFuncs, List<Defn> locals) {
            return nestedFuncs.isEmpty();
        }
    }

    private static final class ChainGc extends ElimStrategy {
        @Override
        Action getAction() {
            return Action.CHAIN_GC_STACK_FRAMES;
        }

        @Override
        String envNameBase() {
            return "frame";
        }

        @Override
        boolean needsCapture(
                String moduleName,
                VarName varName,
                Statement gcTrace,
                List<Defn> followingDefns,
                List<Statement> followingStatements) {
            return CaptureOracle.hasTraceObligation(gcTrace);
        }

        @Override
        boolean hoistsNestedFunctions() {
            return false;
        }

        @Override
        boolean chainsStackFrames() {
            return true;
        }

        @Override
        boolean needsNoRecord(List<Defn> nestedFuncs, List<Defn> locals) {
            return locals.isEmpty();
        }
    }
}
