/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.runtime;

import org.mozilla.lowir.Kit;

/**
 * The shadow stack of frame records, one per thread. This is what the generated code does
 * through the {@code stack_chain} global: a function pushes its frame on entry, pops it on every
 * exit, and a commit handler restores the chain saved before the protected code ran.
 *
 * <pre>
 * ChainedFrame frame = new SlotFrame(2);
 * StackChain.push(frame);
 * try {
 *     ...
 * } finally {
 *     StackChain.pop(frame);
 * }
 * </pre>
 */
public final class StackChain {

    private static final ThreadLocal<ChainedFrame> top = new ThreadLocal<ChainedFrame>();

    private StackChain() {}

    /** Returns the most recently pushed frame of the current thread, or {@code null}. */
    public static ChainedFrame top() {
        return top.get();
    }

    /**
     * Links {@code frame} on top of the chain.
     *
     * @param frame a frame that is not already on the current thread's chain
     */
    public static void push(ChainedFrame frame) {
        for (ChainedFrame f = top.get(); f != null; f = f.getPrev()) {
            if (f == frame) {
                throw Kit.codeBug("pushing a frame that is already on the stack chain");
            }
        }
        frame.setPrev(top.get());
        top.set(frame);
    }

    /**
     * Unlinks the top frame.
     *
     * @param frame the frame the caller pushed; it must be the top frame
     */
    public static void pop(ChainedFrame frame) {
        ChainedFrame current = top.get();
        if (current != frame) {
            throw Kit.codeBug("popping a frame that is not on top of the stack chain");
        }
        set(current.getPrev());
    }

    /** Returns the current chain, to be handed to {@link #restore} later. */
    public static ChainedFrame save() {
        return top.get();
    }

    /** Drops every frame pushed since the matching {@link #save}. */
    public static void restore(ChainedFrame saved) {
        set(saved);
    }

    public static int depth() {
        int depth = 0;
        for (ChainedFrame f = top.get(); f != null; f = f.getPrev()) {
            depth++;
        }
        return depth;
    }

    /** Traces every frame of the current thread, from the top of the chain down. */
    public static void traverse(FrameTracer tracer) {
        for (ChainedFrame f = top.get(); f != null; f = f.getPrev()) {
            f.trace(tracer);
        }
    }

    private static void set(ChainedFrame frame) {
        if (frame == null) {
            top.remove();
        } else {
            top.set(frame);
        }
    }
}
