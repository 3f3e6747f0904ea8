/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;

/** Declaration flags of a definition: access, storage and constness. */
public final class DeclFlags {

    public enum Access {
        /** Only visible inside the enclosing function or block. Never valid for fields. */
        LOCAL,
        PRIVATE,
        PUBLIC,
        EXPORTED
    }

    public enum PerInstance {
        /** One copy per activation (locals) or per object (fields). */
        PER_INSTANCE,
        /** A single copy, like a C {@code static}. */
        ONE_COPY
    }

    public enum Constness {
        MODIFIABLE,
        CONST
    }

    /** Flags for an ordinary local variable declaration. */
    public static final DeclFlags LOCAL_VAR =
            new DeclFlags(Access.LOCAL, PerInstance.PER_INSTANCE, Constness.MODIFIABLE);

    /** Flags for a local static constant. */
    public static final DeclFlags LOCAL_CONST =
            new DeclFlags(Access.LOCAL, PerInstance.ONE_COPY, Constness.CONST);

    /** Flags for a nested function before hoisting. */
    public static final DeclFlags NESTED_FUNCTION =
            new DeclFlags(Access.LOCAL, PerInstance.PER_INSTANCE, Constness.MODIFIABLE);

    /** Flags for a module-private function or type. */
    public static final DeclFlags PRIVATE_ONE_COPY =
            new DeclFlags(Access.PRIVATE, PerInstance.ONE_COPY, Constness.MODIFIABLE);

    /** Flags for a public (field) declaration. */
    public static final DeclFlags PUBLIC_FIELD =
            new DeclFlags(Access.PUBLIC, PerInstance.PER_INSTANCE, Constness.MODIFIABLE);

    /** Flags for an exported top level function. */
    public static final DeclFlags EXPORTED_FUNCTION =
            new DeclFlags(Access.EXPORTED, PerInstance.ONE_COPY, Constness.MODIFIABLE);

    private final Access access;
    private final PerInstance perInstance;
    private final Constness constness;

    public DeclFlags(Access access, PerInstance perInstance, Constness constness) {
        this.access = Objects.requireNonNull(access);
        this.perInstance = Objects.requireNonNull(perInstance);
        this.constness = Objects.requireNonNull(constness);
    }

    public Access getAccess() {
        return access;
    }

    public PerInstance getPerInstance() {
        return perInstance;
    }

    public Constness getConstness() {
        return constness;
    }

    public DeclFlags withAccess(Access newAccess) {
        return new DeclFlags(newAccess, perInstance, constness);
    }

    public DeclFlags withPerInstance(PerInstance newPerInstance) {
        return new DeclFlags(access, newPerInstance, constness);
    }

    /** Emits the flags as declaration modifiers, each followed by a space. */
    public String toSource() {
        StringBuilder sb = new StringBuilder();
        switch (access) {
            case PRIVATE:
                sb.append("private ");
                break;
            case PUBLIC:
                sb.append("public ");
                break;
            case EXPORTED:
                sb.append("exported ");
                break;
            case LOCAL:
                break;
        }
        if (perInstance == PerInstance.ONE_COPY) {
            sb.append("static ");
        }
        if (constness == Constness.CONST) {
            sb.append("const ");
        }
        return sb.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof DeclFlags)) return false;
        DeclFlags other = (DeclFlags) obj;
        return access == other.access
                && perInstance == other.perInstance
                && constness == other.constness;
    }

    @Override
    public int hashCode() {
        return Objects.hash(access, perInstance, constness);
    }

    @Override
    public String toString() {
        return access + "/" + perInstance + "/" + constness;
    }
}
