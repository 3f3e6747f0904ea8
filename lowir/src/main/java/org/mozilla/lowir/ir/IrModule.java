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

/** A compilation unit: the module name, its imports and its top level definitions. */
public class IrModule extends IrNode {

    private final String name;
    private final List<String> imports;
    private final List<Defn> defns;

    {
        type = Token.MODULE;
    }

    public IrModule(String name, List<String> imports, List<Defn> defns) {
        this.name = Objects.requireNonNull(name);
        this.imports = Kit.immutableList(imports);
        this.defns = Kit.immutableList(defns);
    }

    public String getName() {
        return name;
    }

    public List<String> getImports() {
        return imports;
    }

    public List<Defn> getDefns() {
        return defns;
    }

    public IrModule withDefns(List<Defn> newDefns) {
        return new IrModule(name, imports, newDefns);
    }

    @Override
    public String toSource(int depth) {
        StringBuilder sb = new StringBuilder();
        sb.append(makeIndent(depth)).append("module ").append(name).append(";\n");
        for (String imp : imports) {
            sb.append(makeIndent(depth)).append("import ").append(imp).append(";\n");
        }
        for (Defn defn : defns) {
            sb.append('\n').append(defn.toSource(depth));
        }
        return sb.toString();
    }

    @Override
    public void visit(IrVisitor v) {
        if (v.visit(this)) {
            visitAll(defns, v);
        }
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof IrModule)) return false;
        IrModule other = (IrModule) obj;
        return name.equals(other.name) && imports.equals(other.imports) && defns.equals(other.defns);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, imports, defns);
    }
}
