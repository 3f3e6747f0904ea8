/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.runtime;

/**
 * A frame record on the shadow stack. Mirrors the header every generated frame struct starts
 * with: the link to the previous frame and the hook that traces the frame's slots.
 */
public interface ChainedFrame {

    ChainedFrame getPrev();

    void setPrev(ChainedFrame prev);

    /** Reports every slot of this frame that may hold a heap reference. */
    void trace(FrameTracer tracer);
}
