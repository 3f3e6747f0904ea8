/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.ArrayList;
import java.util.List;

/** Queries over IR trees. */
public final class IrSearch {

    private IrSearch() {}

    /** Returns true if {@code node} contains a reference to {@code var}, whatever its type. */
    public static boolean containsVar(IrNode node, final QualVar var) {
        final boolean[] found = new boolean[1];
        node.visit(
                new IrVisitor() {
                    @Override
                    public boolean visit(IrNode n) {
                        if (found[0]) {
                            return false;
                        }
                        if (n instanceof Lval.Var && ((Lval.Var) n).getVar().equals(var)) {
                            found[0] = true;
                            return false;
                        }
                        return true;
                    }
                });
        return found[0];
    }

    public static boolean containsVar(List<? extends IrNode> nodes, QualVar var) {
        for (IrNode node : nodes) {
            if (containsVar(node, var)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns every definition contained in the statements, at any depth, including those inside
     * nested function bodies and class members. Definitions come in pre-order.
     */
    public static List<Defn> collectDefns(List<? extends IrNode> roots) {
        final List<Defn> result = new ArrayList<>();
        IrVisitor collector =
                new IrVisitor() {
                    @Override
                    public boolean visit(IrNode n) {
                        if (n instanceof Defn) {
                            result.add((Defn) n);
                        }
                        return true;
                    }
                };
        for (IrNode root : roots) {
            root.visit(collector);
        }
        return result;
    }

    /** Counts the nodes that satisfy the filter. */
    public static int count(IrNode root, final NodeFilter filter) {
        final int[] count = new int[1];
        root.visit(
                new IrVisitor() {
                    @Override
                    public boolean visit(IrNode n) {
                        if (filter.accept(n)) {
                            count[0]++;
                        }
                        return true;
                    }
                });
        return count[0];
    }

    public interface NodeFilter {
        boolean accept(IrNode node);
    }
}
