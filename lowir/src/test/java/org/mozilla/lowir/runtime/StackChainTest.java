/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.runtime;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.After;
import org.junit.Test;

public class StackChainTest {

    @After
    public void clearChain() {
        StackChain.restore(null);
    }

    @Test
    public void pushAndPop() {
        SlotFrame outer = new SlotFrame(1);
        SlotFrame inner = new SlotFrame(1);
        StackChain.push(outer);
        StackChain.push(inner);
        assertSame(inner, StackChain.top());
        assertSame(outer, inner.getPrev());
        assertEquals(2, StackChain.depth());
        StackChain.pop(inner);
        StackChain.pop(outer);
        assertNull(StackChain.top());
        assertEquals(0, StackChain.depth());
    }

    @Test(expected = IllegalStateException.class)
    public void popMustMatchTop() {
        SlotFrame outer = new SlotFrame(0);
        StackChain.push(outer);
        StackChain.push(new SlotFrame(0));
        StackChain.pop(outer);
    }

    @Test
    public void pushRejectsFrameAlreadyOnTheChain() {
        SlotFrame outer = new SlotFrame(0);
        SlotFrame inner = new SlotFrame(0);
        StackChain.push(outer);
        StackChain.push(inner);
        try {
            StackChain.push(inner);
            fail("pushing the top frame again must fail");
        } catch (IllegalStateException e) {
            assertEquals(2, StackChain.depth());
        }
        try {
            StackChain.push(outer);
            fail("pushing a frame further down must fail");
        } catch (IllegalStateException e) {
            assertSame(inner, StackChain.top());
        }
    }

    @Test
    public void poppedFrameCanBePushedAgain() {
        SlotFrame frame = new SlotFrame(0);
        StackChain.push(frame);
        StackChain.pop(frame);
        StackChain.push(frame);
        assertNull(frame.getPrev());
        assertEquals(1, StackChain.depth());
    }

    @Test
    public void restoreDropsFramesPushedAfterSave() {
        SlotFrame base = new SlotFrame(0);
        StackChain.push(base);
        ChainedFrame saved = StackChain.save();
        StackChain.push(new SlotFrame(0));
        StackChain.push(new SlotFrame(0));
        StackChain.restore(saved);
        assertSame(base, StackChain.top());
        assertEquals(1, StackChain.depth());
    }

    @Test
    public void traverseVisitsTopFirst() {
        SlotFrame outer = new SlotFrame(1);
        outer.set(0, "outer");
        SlotFrame inner = new SlotFrame(2);
        inner.set(0, "inner");
        StackChain.push(outer);
        StackChain.push(inner);
        final List<Object> seen = new ArrayList<>();
        StackChain.traverse(
                new FrameTracer() {
                    @Override
                    public void traceSlot(ChainedFrame frame, int index, Object value) {
                        seen.add(value);
                    }
                });
        assertEquals(3, seen.size());
        assertEquals("inner", seen.get(0));
        assertNull(seen.get(1));
        assertEquals("outer", seen.get(2));
    }

    @Test
    public void chainsAreThreadLocal() throws InterruptedException {
        StackChain.push(new SlotFrame(0));
        final AtomicInteger otherDepth = new AtomicInteger(-1);
        Thread t =
                new Thread(
                        new Runnable() {
                            @Override
                            public void run() {
                                otherDepth.set(StackChain.depth());
                            }
                        });
        t.start();
        t.join();
        assertEquals(0, otherDepth.get());
        assertEquals(1, StackChain.depth());
    }
}
