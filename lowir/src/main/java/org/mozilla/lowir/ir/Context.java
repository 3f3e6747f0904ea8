/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.ir;

import java.util.Objects;

/** Source position a definition or statement was generated from. */
public final class Context {

    public static final Context NONE = new Context("", 0);

    private final String fileName;
    private final int lineno;

    public Context(String fileName, int lineno) {
        this.fileName = Objects.requireNonNull(fileName);
        this.lineno = lineno;
    }

    public String getFileName() {
        return fileName;
    }

    public int getLineno() {
        return lineno;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Context)) return false;
        Context other = (Context) obj;
        return lineno == other.lineno && fileName.equals(other.fileName);
    }

    @Override
    public int hashCode() {
        return fileName.hashCode() * 31 + lineno;
    }

    @Override
    public String toString() {
        return fileName + ":" + lineno;
    }
}
