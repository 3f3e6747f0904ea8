/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

/**
 * Simple visitor interface for traversing the IR. The nodes are visited in an arbitrary order.
 * The visitor must cast nodes to the appropriate type based on their token-type.
 */
public interface IrVisitor {

    /**
     * Visits an IR node.
     *
     * @param node the IR node. Will never be {@code null}.
     * @return {@code true} if the children should be visited. If {@code false}, the subtree rooted
     *     at this node is skipped.
     */
    boolean visit(IrNode node);
}
