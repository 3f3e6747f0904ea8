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

/** A function definition. A function without a body is defined elsewhere. */
public class FunctionDefn extends DefnBody {

    private final FuncParams params;
    private final Statement body;
    private final List<String> attributes;

    {
        type = Token.FUNCTION;
    }

    public FunctionDefn(FuncParams params, Statement body, List<String> attributes) {
        this.params = Objects.requireNonNull(params);
        this.body = body;
        this.attributes = Kit.immutableList(attributes);
    }

    public FuncParams getParams() {
        return params;
    }

    /** Returns the body, or {@code null} for an external function. */
    public Statement getBody() {
        return body;
    }

    public boolean isDefinedHere() {
        return body != null;
    }

    public List<String> getAttributes() {
        return attributes;
    }

    public FunctionDefn withParams(FuncParams newParams) {
        return new FunctionDefn(newParams, body, attributes);
    }

    public FunctionDefn withBody(Statement newBody) {
        return new FunctionDefn(params, newBody, attributes);
    }

    @Override
    String declare(String name, DeclFlags flags, int depth) {
        StringBuilder sb = new StringBuilder();
        for (String attribute : attributes) {
            sb.append('@').append(attribute).append(' ');
        }
        sb.append(flags.toSource());
        sb.append(params.returnTypesSource()).append(' ').append(name);
        sb.append('(').append(printList(params.getArgs())).append(')');
        if (body == null) {
            return sb.append(";\n").toString();
        }
        sb.append('\n');
        if (body instanceof Block) {
            sb.append(body.toSource(depth));
        } else {
            String pad = makeIndent(depth);
            sb.append(pad).append("{\n").append(body.toSource(depth + 1)).append(pad).append("}\n");
        }
        return sb.toString();
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            visitAll(params.getArgs(), v);
            if (body != null) {
                body.visit(v);
            }
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof FunctionDefn)) return false;
        FunctionDefn other = (FunctionDefn) obj;
        return params.equals(other.params)
                && Objects.equals(body, other.body)
                && attributes.equals(other.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(params, body, attributes);
    }
}
