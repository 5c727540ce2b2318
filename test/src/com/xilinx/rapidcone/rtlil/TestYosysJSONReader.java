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

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.xilinx.rapidcone.netlist.Netlist;
import com.xilinx.rapidcone.netlist.NetlistTools;
import com.xilinx.rapidcone.support.RapidConeTestData;

public class TestYosysJSONReader {

    private static List<String> coneNames(Netlist net, String signal) {
        List<String> names = new ArrayList<>();
        for (SigBit b : NetlistTools.cone(net, RTLILTools.getSigBitFromName(net.getModule(), signal))) {
            names.add(b.toString());
        }
        return names;
    }

    private static List<String> cellNames(Netlist net, String signal) {
        List<String> names = new ArrayList<>();
        for (Cell c : NetlistTools.cellCone(net, RTLILTools.getSigBitFromName(net.getModule(), signal))) {
            names.add(c.getName());
        }
        return names;
    }

    @Test
    public void testAndChain() {
        Design design = RapidConeTestData.readDesign("and_chain.json");
        Module m = design.getTopModule();
        Assertions.assertEquals("and_chain", m.getName());
        Assertions.assertEquals(4, m.getPorts().size());
        Assertions.assertEquals(PortDirection.OUTPUT, m.getWire("out").getPortDirection());
        Assertions.assertEquals(2, m.getCellCount());

        Cell c1 = m.getCell("c1");
        Assertions.assertEquals("$and", c1.getType());
        Assertions.assertEquals("00000000000000000000000000000001", c1.getParam("Y_WIDTH"));
        Assertions.assertEquals("and_chain.v:5.17-5.26", c1.getAttribute("src"));
        Assertions.assertEquals(PortDirection.INPUT, c1.getPortDirection("A"));
        Assertions.assertEquals(new SigSpec(m.getWire("w1")), c1.getPort("Y"));

        Netlist net = new Netlist(m);
        Assertions.assertEquals(Arrays.asList("in2", "w1", "in0", "in1"), coneNames(net, "out"));
        Assertions.assertEquals(Arrays.asList("c2", "c1"), cellNames(net, "out"));
    }

    @Test
    public void testAliasedNetnames() {
        Design design = RapidConeTestData.readDesign("comb_loop.json");
        Module m = design.getTopModule();
        SigMap sigMap = new SigMap(m);
        // 'x' shares its net with port 'o', which is created first
        Assertions.assertEquals(m.getWire("o").getBit(0), sigMap.apply(m.getWire("x").getBit(0)));

        Netlist net = new Netlist(m);
        Assertions.assertEquals(Arrays.asList("i0", "y", "i1", "o"), coneNames(net, "o"));
        Assertions.assertEquals(coneNames(net, "o"), coneNames(net, "x"));
        Assertions.assertEquals(Arrays.asList("a", "b"), cellNames(net, "x"));
        Assertions.assertEquals(Arrays.asList("b", "a"), cellNames(net, "y"));
    }

    @Test
    public void testMixedDesign() {
        Design design = RapidConeTestData.readDesign("mixed.json");
        Assertions.assertEquals(2, design.getModules().size());
        Module m = design.getTopModule();
        Assertions.assertEquals("mixed", m.getName());

        List<String> wires = new ArrayList<>();
        for (Wire w : m.getWires()) {
            wires.add(w.getName());
        }
        Assertions.assertEquals(Arrays.asList("clk", "d", "sel", "y", "lut_o", "q", "tie", "$auto$inv_y"), wires);
        Assertions.assertEquals(SigBit.S1, new SigMap(m).apply(m.getWire("tie").getBit(0)));
        Assertions.assertEquals(SigBit.S0, m.getCell("mux").getPort("A").get(1));

        Netlist full = new Netlist(m);
        Assertions.assertEquals(Arrays.asList("0", "1", "sel", "q", "clk", "lut_o", "$auto$inv_y", "d[0]"),
                coneNames(full, "y[0]"));
        Assertions.assertEquals(Arrays.asList("mux", "ff", "u_inv"), cellNames(full, "y[1]"));

        Netlist comb = new Netlist(m, CellTypes.combCellsFilter());
        Assertions.assertEquals(Arrays.asList("0", "1", "sel", "q", "$auto$inv_y"), coneNames(comb, "y[0]"));
        Assertions.assertEquals(Arrays.asList("mux"), cellNames(comb, "y[0]"));

        CellTypes ct = CellTypes.forDesign(design);
        Assertions.assertEquals(1, ct.setupBlackboxCells(m));
        Netlist withBlackboxes = new Netlist(m, ct);
        Assertions.assertEquals(
                Arrays.asList("0", "1", "sel", "q", "clk", "lut_o", "d[0]", "d[1]", "$auto$inv_y", "d[0]"),
                coneNames(withBlackboxes, "y[0]"));
        Assertions.assertEquals(Arrays.asList("mux", "ff", "lut", "u_inv"), cellNames(withBlackboxes, "y[0]"));
    }

    @Test
    public void testUnnamedNets() {
        String json = "{\"modules\": {\"m\": {"
                + "\"ports\": {\"a\": {\"direction\": \"input\", \"bits\": [2]}},"
                + "\"cells\": {\"n\": {\"type\": \"$_NOT_\", \"connections\": {\"A\": [2], \"Y\": [3]}}},"
                + "\"netnames\": {}}}}";
        Module m = YosysJSONReader.readJSON(json).getModule("m");
        SigBit y = m.getCell("n").getPort("Y").get(0);
        Assertions.assertTrue(y.getWire().isAutoNamed());
        Assertions.assertSame(m.getCell("n"), new Netlist(m).getDriver(y));
    }

    @Test
    public void testMalformedNetlists(@TempDir Path dir) throws Exception {
        Assertions.assertThrows(RuntimeException.class, () -> YosysJSONReader.readJSON("{}"));
        Assertions.assertThrows(RuntimeException.class, () -> YosysJSONReader.readJSON(
                "{\"modules\": {\"m\": {\"cells\": {\"c\": {\"connections\": {}}}}}}"));
        Assertions.assertThrows(RuntimeException.class, () -> YosysJSONReader.readJSON(
                "{\"modules\": {\"m\": {\"cells\": {\"c\": {\"type\": \"$and\", \"connections\": {\"A\": 2}}}}}}"));
        RuntimeException direction = Assertions.assertThrows(RuntimeException.class, () -> YosysJSONReader.readJSON(
                "{\"modules\": {\"m\": {\"ports\": {\"a\": {\"direction\": \"sideways\", \"bits\": [2]}}}}}"));
        Assertions.assertTrue(direction.getMessage().startsWith("ERROR: Unrecognized port direction"));

        Path broken = dir.resolve("broken.json");
        Files.write(broken, "{\"modules\": ".getBytes());
        RuntimeException e = Assertions.assertThrows(RuntimeException.class,
                () -> YosysJSONReader.readJSONFile(broken));
        Assertions.assertTrue(e.getMessage().startsWith("ERROR: "));
    }
}
