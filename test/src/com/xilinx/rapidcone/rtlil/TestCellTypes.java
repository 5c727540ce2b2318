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
import org.junit.jupiter.params.provider.ValueSource;

public class TestCellTypes {

    @ParameterizedTest
    @ValueSource(strings = {"$and", "$mux", "$pmux", "$alu", "$_AND_", "$_MUX_", "$_TBUF_", "$anyconst"})
    public void testCombinationalTypes(String type) {
        Assertions.assertTrue(CellTypes.combCellsFilter().cellKnown(type));
        Assertions.assertTrue(CellTypes.forDesign(null).cellKnown(type));
    }

    @ParameterizedTest
    @ValueSource(strings = {"$dff", "$adff", "$dlatch", "$mem_v2", "$_DFF_P_", "$_DFFE_PN_", "$_SR_NP_"})
    public void testSequentialTypes(String type) {
        Assertions.assertFalse(CellTypes.combCellsFilter().cellKnown(type));
        Assertions.assertTrue(CellTypes.forDesign(null).cellKnown(type));
    }

    @Test
    public void testPorts() {
        CellTypes ct = CellTypes.combCellsFilter();
        Assertions.assertTrue(ct.cellInput("$and", "A"));
        Assertions.assertTrue(ct.cellInput("$and", "B"));
        Assertions.assertTrue(ct.cellOutput("$and", "Y"));
        Assertions.assertFalse(ct.cellOutput("$and", "A"));
        Assertions.assertTrue(ct.cellOutput("$alu", "CO"));
        Assertions.assertTrue(ct.cellInput("$mux", "S"));
        Assertions.assertTrue(ct.cellEvaluable("$_XOR_"));
        Assertions.assertFalse(ct.cellOutput("LUT2", "O"));
        Assertions.assertNull(ct.getCellType("LUT2"));
    }

    @Test
    public void testDesignModules() {
        Design d = new Design();
        Module sub = d.addModule("sub");
        sub.addPort(sub.addWire("a"), PortDirection.INPUT);
        sub.addPort(sub.addWire("y"), PortDirection.OUTPUT);
        sub.addPort(sub.addWire("io"), PortDirection.INOUT);
        d.addModule("top");

        CellTypes ct = CellTypes.forDesign(d);
        Assertions.assertTrue(ct.cellKnown("sub"));
        Assertions.assertTrue(ct.cellKnown("top"));
        Assertions.assertTrue(ct.cellInput("sub", "a"));
        Assertions.assertTrue(ct.cellOutput("sub", "y"));
        Assertions.assertTrue(ct.cellInput("sub", "io"));
        Assertions.assertTrue(ct.cellOutput("sub", "io"));
        Assertions.assertFalse(ct.cellEvaluable("sub"));

        Assertions.assertFalse(CellTypes.combCellsFilter().cellKnown("sub"));
    }

    @Test
    public void testBlackboxCells() {
        Module m = new Module("top");
        Cell lut = m.addCell("lut", "LUT2");
        lut.setPortDirection("I0", PortDirection.INPUT);
        lut.setPortDirection("I1", PortDirection.INPUT);
        lut.setPortDirection("O", PortDirection.OUTPUT);
        Cell lut2 = m.addCell("lut_b", "LUT2");
        lut2.setPortDirection("I0", PortDirection.INPUT);
        m.addCell("opaque", "OPAQUE");
        m.addCell("and0", "$and").setPortDirection("Y", PortDirection.INPUT);

        CellTypes ct = CellTypes.combCellsFilter();
        int before = ct.size();
        Assertions.assertEquals(1, ct.setupBlackboxCells(m));
        Assertions.assertEquals(before + 1, ct.size());
        Assertions.assertTrue(ct.cellOutput("LUT2", "O"));
        Assertions.assertTrue(ct.cellInput("LUT2", "I1"));
        Assertions.assertFalse(ct.cellKnown("OPAQUE"));
        // Known types keep their registered directions
        Assertions.assertTrue(ct.cellOutput("$and", "Y"));
    }

    @Test
    public void testClear() {
        CellTypes ct = CellTypes.forDesign(null);
        Assertions.assertTrue(ct.size() > 0);
        ct.clear();
        Assertions.assertEquals(0, ct.size());
        Assertions.assertFalse(ct.cellKnown("$and"));
    }
}
