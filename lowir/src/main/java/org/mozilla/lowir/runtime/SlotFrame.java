/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.runtime;

/** A frame with a fixed number of untyped slots, all of them traced. */
public class SlotFrame implements ChainedFrame {

    private ChainedFrame prev;
    private final Object[] slots;

    public SlotFrame(int slotCount) {
        slots = new Object[slotCount];
    }

    @Override
    public ChainedFrame getPrev() {
        return prev;
    }

    @Override
    public void setPrev(ChainedFrame prev) {
        this.prev = prev;
    }

    public Object get(int index) {
        return slots[index];
    }

    public void set(int index, Object value) {
        slots[index] = value;
    }

    public int getSlotCount() {
        return slots.length;
    }

    @Override
    public void trace(FrameTracer tracer) {
        for (int i = 0; i < slots.length; i++) {
            tracer.traceSlot(this, i, slots[i]);
        }
    }
}
