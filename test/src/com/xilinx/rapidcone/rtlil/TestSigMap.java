/*
 * Copyright (c) 2026, Advanced Micro Devices, Inc.
 * All rights reserved.
 *
 * This file is part of RapidCone.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 */

package com.xilinx.rapidcone.rtlil;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

public class TestSigMap {

    @Test
    public void testUnmappedBitIsItsOwnRepresentative() {
        Module m = new Module("top");
        SigBit a = m.addWire("a").getBit(0);
        SigMap sigMap = new SigMap();
        Assertions.assertEquals(a, sigMap.apply(a));
        Assertions.assertEquals(SigBit.Sx, sigMap.apply(SigBit.Sx));
    }

    @Test
    public void testChainedAliases() {
        Module m = new Module("top");
        SigBit a = m.addWire("a").getBit(0);
        SigBit b = m.addWire("b").getBit(0);
        SigBit c = m.addWire("c").getBit(0);
        SigMap sigMap = new SigMap();
        sigMap.add(a, b);
        sigMap.add(b, c);

        Assertions.assertEquals(c, sigMap.apply(a));
        Assertions.assertEquals(c, sigMap.apply(b));
        Assertions.assertTrue(sigMap.isConnected(a, c));

        // Joining two bits of the same group changes nothing
        sigMap.add(c, a);
        Assertions.assertEquals(c, sigMap.apply(a));
    }

    @Test
    public void testConstantsBecomeRepresentatives() {
        Module m = new Module("top");
        SigBit a = m.addWire("a").getBit(0);
        SigBit b = m.addWire("b").getBit(0);
        SigMap sigMap = new SigMap();
        sigMap.add(a, b);
        sigMap.add(SigBit.S1, a);

        Assertions.assertEquals(SigBit.S1, sigMap.apply(a));
        Assertions.assertEquals(SigBit.S1, sigMap.apply(b));
        Assertions.assertEquals(SigBit.S1, sigMap.apply(SigBit.S1));
    }

    @Test
    public void testConstantsAreNeverMerged() {
        Module m = new Module("top");
        SigBit a = m.addWire("a").getBit(0);
        SigBit b = m.addWire("b").getBit(0);
        SigMap sigMap = new SigMap();
        sigMap.add(a, SigBit.S0);
        sigMap.add(b, SigBit.S1);
        sigMap.add(a, b);

        Assertions.assertEquals(SigBit.S0, sigMap.apply(a));
        Assertions.assertEquals(SigBit.S1, sigMap.apply(b));
        Assertions.assertFalse(sigMap.isConnected(SigBit.S0, SigBit.S1));
    }

    @Test
    public void testModuleConnections() {
        Module m = new Module("top");
        Wire bus = m.addWire("bus", 2);
        Wire lo = m.addWire("lo");
        Wire hi = m.addWire("hi");
        m.connect(new SigSpec(lo.getBit(0), hi.getBit(0)), new SigSpec(bus));

        SigMap sigMap = new SigMap(m);
        Assertions.assertEquals(bus.getBit(0), sigMap.apply(lo.getBit(0)));
        Assertions.assertEquals(bus.getBit(1), sigMap.apply(hi.getBit(0)));
        Assertions.assertEquals(new SigSpec(bus), sigMap.apply(new SigSpec(lo.getBit(0), hi.getBit(0))));

        sigMap.clear();
        Assertions.assertEquals(lo.getBit(0), sigMap.apply(lo.getBit(0)));
        sigMap.set(m);
        Assertions.assertTrue(sigMap.isConnected(hi.getBit(0), bus.getBit(1)));
    }

    @Test
    public void testWidthMismatch() {
        Module m = new Module("top");
        Wire a = m.addWire("a", 2);
        Wire b = m.addWire("b", 3);
        SigMap sigMap = new SigMap();
        Assertions.assertThrows(RuntimeException.class, () -> sigMap.add(new SigSpec(a), new SigSpec(b)));
    }
}
