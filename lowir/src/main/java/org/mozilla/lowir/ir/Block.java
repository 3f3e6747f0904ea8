/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.List;
import org.mozilla.lowir.Kit;
import org.mozilla.lowir.Token;

/**
 * A block: local definitions followed by statements. The definitions may include nested
 * functions, local variables and local static constants.
 *
 * <pre><b>{</b> Defn* Statement* <b>}</b></pre>
 */
public class Block extends Statement {

    private final List<Defn> defns;
    private final List<Statement> statements;

    {
        type = Token.BLOCK;
    }

    public Block(List<Defn> defns, List<Statement> statements, Context context) {
        super(context);
        this.defns = Kit.immutableList(defns);
        this.statements = Kit.immutableList(statements);
    }

    public List<Defn> getDefns() {
        return defns;
    }

    public List<Statement> getStatements() {
        return statements;
    }

    @Override
    public String toSource(int depth) {
        StringBuilder sb = new StringBuilder();
        sb.append(makeIndent(depth)).append("{\n");
        for (Defn defn : defns) {
            sb.append(defn.toSource(depth + 1));
        }
        for (Statement statement : statements) {
            sb.append(statement.toSource(depth + 1));
        }
        sb.append(makeIndent(depth)).append("}\n");
        return sb.toString();
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            visitAll(defns, v);
            visitAll(statements, v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Block)) return false;
        Block other = (Block) obj;
        return context.equals(other.context)
                && defns.equals(other.defns)
                && statements.equals(other.statements);
    }

    @Override
    public int hashCode() {
        return defns.hashCode() * 31 + statements.hashCode();
    }
}
