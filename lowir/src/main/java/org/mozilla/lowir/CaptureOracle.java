/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir;

import java.util.List;
import org.mozilla.lowir.ir.DataDefn;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.FunctionDefn;
import org.mozilla.lowir.ir.IrSearch;
import org.mozilla.lowir.ir.QualVar;
import org.mozilla.lowir.ir.Statement;
import org.mozilla.lowir.ir.VarName;

/** Decides which locals and arguments have to live in an environment or frame record. */
final class CaptureOracle {

    private CaptureOracle() {}

    /** A variable with a GC trace statement holds heap pointers the collector must see. */
    static boolean hasTraceObligation(Statement gcTrace) {
        return gcTrace != null;
    }

    /**
     * Returns true if a later definition uses the variable: a following sibling, or a definition
     * anywhere inside the following statements, that is either a function whose body mentions the
     * variable or a static constant whose initializer does. Earlier definitions cannot refer to
     * it, so they are not searched.
     *
     * <p>This is conservative: every static constant is hoisted, so a constant that mentions the
     * variable forces capture even if no nested function reads that constant.
     */
    static boolean isReferencedLater(
            String moduleName,
            VarName varName,
            List<Defn> followingDefns,
            List<Statement> followingStatements) {
        QualVar var = new QualVar(moduleName, varName);
        for (Defn defn : followingDefns) {
            if (usesVar(defn, var)) {
                return true;
            }
        }
        for (Defn defn : IrSearch.collectDefns(followingStatements)) {
            if (usesVar(defn, var)) {
                return true;
            }
        }
        return false;
    }

    private static boolean usesVar(Defn defn, QualVar var) {
        if (defn.getBody() instanceof FunctionDefn) {
            return IrSearch.containsVar(defn, var);
        }
        if (defn.isStaticConst()) {
            return IrSearch.containsVar(((DataDefn) defn.getBody()).getInitializer(), var);
        }
        return false;
    }
}
