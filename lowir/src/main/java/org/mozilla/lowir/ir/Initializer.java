/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.List;
import java.util.Objects;
import org.mozilla.lowir.Kit;
import org.mozilla.lowir.Token;

/** The initializer of a data definition. */
public abstract class Initializer extends IrNode {

    private Initializer() {}

    public static final Initializer NONE = new None();

    public static Obj of(Rval value) {
        return new Obj(value);
    }

    public boolean isNone() {
        return this == NONE;
    }

    private static final class None extends Initializer {
        {
            type = Token.NO_INIT;
        }

        @Override
        public String toSource(int depth) {
            return "";
        }

        @Override
        public void visit(IrVisitor v) {
            v.visit(this);
        }
    }

    /** A single value. */
    public static final class Obj extends Initializer {
        private final Rval value;

        {
            type = Token.INIT_OBJ;
        }

        public Obj(Rval value) {
            this.value = Objects.requireNonNull(value);
        }

        public Rval getValue() {
            return value;
        }

        @Override
        public String toSource(int depth) {
            return value.toSource(0);
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                value.visit(v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Obj && value.equals(((Obj) obj).value);
        }

        @Override
        public int hashCode() {
            return value.hashCode();
        }
    }

    /**
     * A struct initializer. Fields without a member initializer are zero-initialized on targets
     * that support partial initializer lists.
     */
    public static final class Struct extends Initializer {
        private final IrType structType;
        private final List<Initializer> members;

        {
            type = Token.INIT_STRUCT;
        }

        public Struct(IrType structType, List<Initializer> members) {
            this.structType = Objects.requireNonNull(structType);
            this.members = Kit.immutableList(members);
        }

        public IrType getStructType() {
            return structType;
        }

        public List<Initializer> getMembers() {
            return members;
        }

        @Override
        public String toSource(int depth) {
            return "{ " + printList(members) + " }";
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                visitAll(members, v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            if (!(obj instanceof Struct)) return false;
            Struct other = (Struct) obj;
            return structType.equals(other.structType) && members.equals(other.members);
        }

        @Override
        public int hashCode() {
            return structType.hashCode() * 31 + members.hashCode();
        }
    }

    public static final class Array extends Initializer {
        private final List<Initializer> elements;

        {
            type = Token.INIT_ARRAY;
        }

        public Array(List<Initializer> elements) {
            this.elements = Kit.immutableList(elements);
        }

        public List<Initializer> getElements() {
            return elements;
        }

        @Override
        public String toSource(int depth) {
            return "{ " + printList(elements) + " }";
        }

        @Override
        public void visit(IrVisitor v) {
            if (v.visit(this)) {
                visitAll(elements, v);
            }
        }

        @Override
        public boolean equals(Object obj) {
            return obj instanceof Array && elements.equals(((Array) obj).elements);
        }

        @Override
        public int hashCode() {
            return elements.hashCode() + 3;
        }
    }
}
