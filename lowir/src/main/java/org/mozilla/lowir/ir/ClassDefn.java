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

/** A struct or class type definition. */
public class ClassDefn extends DefnBody {

    private final IrType.ClassType.Kind kind;
    private final List<IrType> baseClasses;
    private final List<IrType> interfaces;
    private final List<Defn> ctors;
    private final List<Defn> fields;

    {
        type = Token.CLASS;
    }

    public ClassDefn(
            IrType.ClassType.Kind kind,
            List<IrType> baseClasses,
            List<IrType> interfaces,
            List<Defn> ctors,
            List<Defn> fields) {
        this.kind = Objects.requireNonNull(kind);
        this.baseClasses = Kit.immutableList(baseClasses);
        this.interfaces = Kit.immutableList(interfaces);
        this.ctors = Kit.immutableList(ctors);
        this.fields = Kit.immutableList(fields);
    }

    public IrType.ClassType.Kind getKind() {
        return kind;
    }

    public List<IrType> getBaseClasses() {
        return baseClasses;
    }

    public List<IrType> getInterfaces() {
        return interfaces;
    }

    public List<Defn> getCtors() {
        return ctors;
    }

    public List<Defn> getFields() {
        return fields;
    }

    @Override
    String declare(String name, DeclFlags flags, int depth) {
        String pad = makeIndent(depth);
        StringBuilder sb = new StringBuilder();
        sb.append(flags.toSource());
        sb.append(kind == IrType.ClassType.Kind.STRUCT ? "struct " : "class ").append(name);
        if (!baseClasses.isEmpty()) {
            sb.append(" extends ").append(IrType.join(baseClasses));
        }
        if (!interfaces.isEmpty()) {
            sb.append(" implements ").append(IrType.join(interfaces));
        }
        sb.append('\n').append(pad).append("{\n");
        for (Defn field : fields) {
            sb.append(field.toSource(depth + 1));
        }
        for (Defn ctor : ctors) {
            sb.append(ctor.toSource(depth + 1));
        }
        sb.append(pad).append("};\n");
        return sb.toString();
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            visitAll(fields, v);
            visitAll(ctors, v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ClassDefn)) return false;
        ClassDefn other = (ClassDefn) obj;
        return kind == other.kind
                && baseClasses.equals(other.baseClasses)
                && interfaces.equals(other.interfaces)
                && ctors.equals(other.ctors)
                && fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, baseClasses, fields);
    }
}
