/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.tests;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;
import java.io.InputStream;
import java.util.Map;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.mozilla.lowir.Action;
import org.mozilla.lowir.ElimNested;
import org.mozilla.lowir.IrEnvirons;
import org.mozilla.lowir.ir.IrModule;
import org.yaml.snakeyaml.Yaml;

/** Compares the printed output of the pass with the expectations in golden/elim_nested.yaml. */
class GoldenOutputTest {

    private static Map<String, Map<String, String>> golden;

    @BeforeAll
    @SuppressWarnings("unchecked")
    static void loadExpectations() throws IOException {
        try (InputStream in =
                GoldenOutputTest.class.getResourceAsStream("/golden/elim_nested.yaml")) {
            assertNotNull(in, "golden/elim_nested.yaml not on the class path");
            golden = (Map<String, Map<String, String>>) new Yaml().load(in);
        }
    }

    private static void assertGolden(String name, IrModule input) {
        Map<String, String> entry = golden.get(name);
        assertNotNull(entry, "no golden entry " + name);
        Action action = Action.valueOf(entry.get("action"));
        IrModule output = new ElimNested(action, new IrEnvirons()).transform(input);
        assertEquals(entry.get("expected"), output.toSource());
    }

    @Test
    void closure() {
        assertGolden("closure", Programs.closure());
    }

    @Test
    void sharedConstant() {
        assertGolden("sharedConstant", Programs.sharedConstant());
    }

    @Test
    void framed() {
        assertGolden("framed", Programs.framed());
    }
}
