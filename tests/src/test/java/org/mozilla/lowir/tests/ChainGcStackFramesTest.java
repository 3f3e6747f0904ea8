/* -*- Mode: java; tab-width: 8; indent-tabs-mode: nil; c-basic-offset: 4 -*-
 *
 * This Source Code Form is subject to the terms of the Mozilla Public
 * License, v. 2.0. If a copy of the MPL was not distributed with this
 * file, You can obtain one at http://mozilla.org/MPL/2.0/. */

package org.mozilla.lowir.tests;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mozilla.lowir.Action;
import org.mozilla.lowir.ElimNested;
import org.mozilla.lowir.IrEnvirons;
import org.mozilla.lowir.ir.ClassDefn;
import org.mozilla.lowir.ir.Defn;
import org.mozilla.lowir.ir.IrModule;

class ChainGcStackFramesTest {

    private static final String LINK = "stack_chain = frame_ptr;";

    private IrEnvirons environs;
    private ElimNested pass;

    @BeforeEach
    void setUp() {
        environs = new IrEnvirons();
        pass = new ElimNested(Action.CHAIN_GC_STACK_FRAMES, environs);
    }

    @Test
    void frameIsLinkedOnceAndUnlinkedAtTheEnd() {
        IrModule out = pass.transform(Programs.framed());
        assertEquals(3, out.getDefns().size());
        ClassDefn frame = (ClassDefn) out.getDefns().get(0).getBody();
        assertEquals("prev", frame.getFields().get(0).getName().toString());
        assertEquals("trace", frame.getFields().get(1).getName().toString());

        Defn baz = Programs.find(out, Programs.BAZ);
        assertEquals(1, Programs.countStatements(baz, LINK));
        assertEquals(1, Programs.countStatements(baz, Programs.UNCHAIN));
        String source = baz.toSource();
        assertTrue(source.trim().endsWith(Programs.UNCHAIN + "\n}"), source);
    }

    @Test
    void everyExitUnlinks() {
        IrModule out = pass.transform(Programs.framedWithExits());
        Defn baz = Programs.find(out, Programs.BAZ);
        assertEquals(1, Programs.countStatements(baz, LINK));
        // the early return, the tail call, the no-return call and the final return
        assertEquals(4, Programs.countStatements(baz, Programs.UNCHAIN));

        String source = baz.toSource();
        assertFalse(source.trim().endsWith(Programs.UNCHAIN + "\n}"), source);
        int tail = source.indexOf("/* tail call */ &g_1_p_0(frame_ptr->q);");
        assertTrue(tail >= 0, source);
        assertTrue(source.indexOf("return;", tail) > tail, source);
    }

    @Test
    void commitSavesAndRestoresTheChain() {
        String source = pass.transform(Programs.framedWithExits()).toSource();
        assertTrue(source.contains("void * saved_stack_chain_0;"), source);
        assertTrue(source.contains("saved_stack_chain_0 = stack_chain;"), source);
        assertTrue(source.contains("stack_chain = saved_stack_chain_0;"), source);
        assertTrue(
                source.indexOf("saved_stack_chain_0 = stack_chain;")
                        < source.indexOf("stack_chain = saved_stack_chain_0;"),
                source);
    }

    @Test
    void aggregateInitializerOfTracedLocalIsAssignedSlotBySlot() {
        environs.setCheckOutput(true);
        IrModule out = pass.transform(Programs.tracedAggregate());
        String source = Programs.find(out, Programs.BAZ).toSource();
        int link = source.indexOf(LINK);
        int slot = source.indexOf("MR_hl_field(&frame_ptr->q, 0) = 0;");
        assertTrue(link >= 0, source);
        assertTrue(slot > link, source);
        assertTrue(source.indexOf("&g_1_p_0(frame_ptr->q);") > slot, source);
    }

    @Test
    void functionWithoutTracedStateIsUnchanged() {
        IrModule in = Programs.flat();
        assertEquals(in, pass.transform(in));
    }

    @Test
    void runtimeTracePredicateGetsNoFrame() {
        IrModule in = Programs.gcTracePredicate();
        String out = pass.transform(in).toSource();
        assertFalse(out.contains("frame"), out);
        assertFalse(out.contains("stack_chain"), out);
    }

    @Test
    void targetWithoutZeroFillInitializesTheFrameExplicitly() {
        environs.setTarget(IrEnvirons.Target.ASM);
        String source = pass.transform(Programs.framed()).toSource();
        assertFalse(source.contains("{ stack_chain"), source);
        int addr = source.indexOf("frame_ptr = &frame;");
        int prev = source.indexOf("frame_ptr->prev = stack_chain;");
        int trace = source.indexOf("frame_ptr->trace = &baz_1_p_0_100000;");
        int link = source.indexOf(LINK);
        assertTrue(addr >= 0 && addr < prev, source);
        assertTrue(prev < trace, source);
        assertTrue(trace < link, source);
        assertTrue(source.contains("frame_ptr->q = ((MR_Box) 0);"), source);
    }

    @Test
    void outputIsDeterministic() {
        String first = pass.transform(Programs.framedWithExits()).toSource();
        String second =
                new ElimNested(Action.CHAIN_GC_STACK_FRAMES, new IrEnvirons())
                        .transform(Programs.framedWithExits())
                        .toSource();
        assertEquals(first, second);
    }
}
