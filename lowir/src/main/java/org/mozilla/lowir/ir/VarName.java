/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;

/**
 * Name of a variable or field: a base name plus an optional sequence number. Two variables with
 * the same base name but different sequence numbers are distinct.
 */
public final class VarName {

    private final String name;
    private final Integer seqNum;

    public VarName(String name) {
        this(name, null);
    }

    public VarName(String name, Integer seqNum) {
        this.name = Objects.requireNonNull(name);
        this.seqNum = seqNum;
    }

    public String getName() {
        return name;
    }

    /** Returns the sequence number, or {@code null} if the name has none. */
    public Integer getSeqNum() {
        return seqNum;
    }

    /** The name as it appears in generated code, e.g. {@code saved_stack_chain_2}. */
    public String toIdentifier() {
        return seqNum == null ? name : name + "_" + seqNum;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof VarName)) return false;
        VarName other = (VarName) obj;
        return name.equals(other.name) && Objects.equals(seqNum, other.seqNum);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, seqNum);
    }

    @Override
    public String toString() {
        return toIdentifier();
    }
}
