/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.runtime;

/** Receives the slots of the frames while {@link StackChain#traverse} walks the chain. */
public interface FrameTracer {

    /**
     * @param frame the frame the slot belongs to
     * @param index position of the slot in the frame, counting from 0
     * @param value current value of the slot, may be {@code null}
     */
    void traceSlot(ChainedFrame frame, int index, Object value);
}
