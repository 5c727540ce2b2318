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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class TestRTLILTools {

    private static Module createModule() {
        Module m = new Module("top");
        m.addWire("clk");
        m.addWire("data", 8);
        Wire shifted = m.addWire("shifted", 4);
        shifted.setStartOffset(4);
        Wire upto = m.addWire("upto", 4);
        upto.setUpto(true);
        m.addWire("odd[name]");
        return m;
    }

    @ParameterizedTest
    @CsvSource({
        "clk, 1, clk",
        "data, 8, { data[7] data[6] data[5] data[4] data[3] data[2] data[1] data[0] }",
        "data[3], 1, data[3]",
        "data[5:2], 4, { data[5] data[4] data[3] data[2] }",
        "data[2:5], 4, { data[5] data[4] data[3] data[2] }",
        "shifted[4], 1, shifted[4]",
        "shifted[7], 1, shifted[7]",
        "upto[0], 1, upto[0]",
        "odd[name], 1, odd[name]",
    })
    public void testGetSigSpecFromName(String name, int width, String expected) {
        SigSpec sig = RTLILTools.getSigSpecFromName(createModule(), name);
        Assertions.assertNotNull(sig);
        Assertions.assertEquals(width, sig.size());
        Assertions.assertEquals(expected, sig.toString());
    }

    @ParameterizedTest
    @CsvSource({
        "missing",
        "data[8]",
        "data[-1]",
        "shifted[3]",
        "missing[0]",
        "data[x]",
        "data[99999999999]",
        "data[0:99999999999]",
        "data[-99999999999:1]",
    })
    public void testGetSigSpecFromNameNotFound(String name) {
        Assertions.assertNull(RTLILTools.getSigSpecFromName(createModule(), name));
    }

    @Test
    public void testRangeOffsets() {
        Module m = createModule();
        Wire upto = m.getWire("upto");
        // For 'upto' wires index 0 is the most significant bit
        Assertions.assertEquals(upto.getBit(3), RTLILTools.getSigBitFromName(m, "upto[0]"));
        Assertions.assertEquals(m.getWire("shifted").getBit(0), RTLILTools.getSigBitFromName(m, "shifted[4]"));
    }

    @Test
    public void testGetSigBitFromName() {
        Module m = createModule();
        Assertions.assertEquals(m.getWire("clk").getBit(0), RTLILTools.getSigBitFromName(m, "clk"));
        Assertions.assertEquals(m.getWire("data").getBit(6), RTLILTools.getSigBitFromName(m, "data[6]"));
        Assertions.assertNull(RTLILTools.getSigBitFromName(m, "data"));
        Assertions.assertNull(RTLILTools.getSigBitFromName(m, "data[1:0]"));
    }

    @Test
    public void testCellBuilders() {
        Module m = createModule();
        Wire a = m.addWire("a");
        Wire b = m.addWire("b");
        Wire y = m.addWire("y");
        Wire q = m.addWire("q");

        Cell and = RTLILTools.addBinaryCell(m, "and0", "$_AND_", new SigSpec(a), new SigSpec(b), new SigSpec(y));
        Assertions.assertEquals("$_AND_", and.getType());
        Assertions.assertEquals(new SigSpec(b), and.getPort("B"));

        Cell mux = RTLILTools.addMuxCell(m, "mux0", "$_MUX_", new SigSpec(a), new SigSpec(b),
                new SigSpec(m.getWire("clk")), new SigSpec(q));
        Assertions.assertEquals(4, mux.getConnections().size());

        Cell ff = RTLILTools.addDffCell(m, "ff0", new SigSpec(m.getWire("clk")), new SigSpec(y), new SigSpec(q));
        Assertions.assertEquals("$_DFF_P_", ff.getType());
        Assertions.assertTrue(ff.hasPort("C"));
        Assertions.assertSame(ff, m.getCell(ff.getIndex()));

        Assertions.assertThrows(RuntimeException.class,
                () -> RTLILTools.addUnaryCell(m, "and0", "$_NOT_", new SigSpec(a), new SigSpec(y)));
    }
}
