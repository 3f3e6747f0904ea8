/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.List;
import org.mozilla.lowir.Token;

/**
 * Base class for the nodes of the low level IR. Nodes are immutable: transformations build new
 * trees and share the parts they do not change.
 *
 * <p>Subclasses set {@link #type} to one of the {@link Token} constants in an instance
 * initializer.
 */
public abstract class IrNode {

    protected int type = Token.ERROR;

    public int getType() {
        return type;
    }

    /**
     * Emits source code for this node in a C-like syntax. Output is a pure function of the tree,
     * so two structurally equal trees always print the same text.
     *
     * @param depth the current recursion depth, typically the number of levels of enclosing
     *     blocks; used for indentation
     */
    public abstract String toSource(int depth);

    /** Prints the source indented to depth 0. */
    public String toSource() {
        return toSource(0);
    }

    /**
     * Visits this node and its children in an arbitrary order.
     *
     * @param visitor the object to call with this node and its children
     */
    public abstract void visit(IrVisitor visitor);

    /** Returns a short debugging name for the node type. */
    public String shortName() {
        return Token.typeToName(type);
    }

    @Override
    public String toString() {
        return toSource(0);
    }

    protected static String makeIndent(int indent) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < indent; i++) {
            sb.append("    ");
        }
        return sb.toString();
    }

    protected static void visitAll(List<? extends IrNode> nodes, IrVisitor visitor) {
        for (IrNode node : nodes) {
            node.visit(visitor);
        }
    }

    protected static String printList(List<? extends IrNode> items) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0, n = items.size(); i < n; i++) {
            if (i > 0) {
                sb.append(", ");
            }
            sb.append(items.get(i).toSource(0));
        }
        return sb.toString();
    }
}
