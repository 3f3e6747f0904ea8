/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;
import org.mozilla.lowir.Token;

/**
 * A definition of a function, a data item or a type, at module scope, in a block, or as a member
 * of a class.
 */
public class Defn extends IrNode {

    private final EntityName name;
    private final Context context;
    private final DeclFlags flags;
    private final DefnBody body;

    {
        type = Token.DEFN;
    }

    public Defn(EntityName name, Context context, DeclFlags flags, DefnBody body) {
        this.name = Objects.requireNonNull(name);
        this.context = Objects.requireNonNull(context);
        this.flags = Objects.requireNonNull(flags);
        this.body = Objects.requireNonNull(body);
    }

    public EntityName getName() {
        return name;
    }

    public Context getContext() {
        return context;
    }

    public DeclFlags getFlags() {
        return flags;
    }

    public DefnBody getBody() {
        return body;
    }

    public Defn withFlags(DeclFlags newFlags) {
        return new Defn(name, context, newFlags, body);
    }

    public Defn withBody(DefnBody newBody) {
        return new Defn(name, context, flags, newBody);
    }

    public boolean isFunction() {
        return body instanceof FunctionDefn;
    }

    public boolean isData() {
        return body instanceof DataDefn;
    }

    /** A static constant is a one-copy, const data definition. */
    public boolean isStaticConst() {
        return body instanceof DataDefn
                && flags.getPerInstance() == DeclFlags.PerInstance.ONE_COPY
                && flags.getConstness() == DeclFlags.Constness.CONST;
    }

    /**
     * Returns the variable name if this defines a variable, otherwise {@code null}.
     */
    public VarName getVarName() {
        if (name instanceof EntityName.DataName) {
            return ((EntityName.DataName) name).getVarName();
        }
        return null;
    }

    @Override
    public String toSource(int depth) {
        return makeIndent(depth) + body.declare(name.toIdentifier(), flags, depth);
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            body.visit(v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Defn)) return false;
        Defn other = (Defn) obj;
        return name.equals(other.name)
                && context.equals(other.context)
                && flags.equals(other.flags)
                && body.equals(other.body);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, flags, body);
    }
}
