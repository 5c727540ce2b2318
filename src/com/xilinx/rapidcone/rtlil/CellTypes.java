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

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Registry of known cell types and the direction of their ports.  A cell whose
 * type is registered here is "known"; only known cells take part in driver
 * analysis.
 *
 * Word-level internal cells use '$name' types (e.g. '$and', '$mux'), gate-level
 * cells use '$_NAME_' types (e.g. '$_AND_', '$_DFF_P_').  Modules of a design
 * can be registered as cell types as well, using the directions of their port
 * wires.
 */
public class CellTypes {

    /**
     * Port description of a single cell type.
     */
    public static class CellType {

        private final String type;

        private final Set<String> inputs;

        private final Set<String> outputs;

        private final boolean evaluable;

        public CellType(String type, Set<String> inputs, Set<String> outputs, boolean evaluable) {
            this.type = type;
            this.inputs = Collections.unmodifiableSet(new LinkedHashSet<>(inputs));
            this.outputs = Collections.unmodifiableSet(new LinkedHashSet<>(outputs));
            this.evaluable = evaluable;
        }

        public String getType() {
            return type;
        }

        public Set<String> getInputs() {
            return inputs;
        }

        public Set<String> getOutputs() {
            return outputs;
        }

        /**
         * @return True if the cell is a pure combinational function of its inputs.
         */
        public boolean isEvaluable() {
            return evaluable;
        }

        @Override
        public String toString() {
            return type + " " + inputs + " -> " + outputs;
        }
    }

    private final Map<String, CellType> cellTypes;

    public CellTypes() {
        cellTypes = new HashMap<>();
    }

    /**
     * Creates the cell types of a full design: all internal and standard cells
     * (combinational and sequential) plus every module of the design.
     * @param design The design whose modules should be registered, may be null.
     * @return The populated registry
     */
    public static CellTypes forDesign(Design design) {
        CellTypes ct = new CellTypes();
        if (design != null) ct.setupDesign(design);
        ct.setupInternals();
        ct.setupInternalsMem();
        ct.setupStdcells();
        ct.setupStdcellsMem();
        return ct;
    }

    /**
     * Creates a filter of the combinational cell types only: internal cells and
     * standard gate cells, without any flip-flop, latch or memory.
     * @return The populated registry
     */
    public static CellTypes combCellsFilter() {
        CellTypes ct = new CellTypes();
        ct.setupInternals();
        ct.setupStdcells();
        return ct;
    }

    public void setupType(String type, Set<String> inputs, Set<String> outputs, boolean evaluable) {
        cellTypes.put(type, new CellType(type, inputs, outputs, evaluable));
    }

    private void setupType(String type, String[] inputs, String[] outputs, boolean evaluable) {
        setupType(type, new LinkedHashSet<>(Arrays.asList(inputs)),
                new LinkedHashSet<>(Arrays.asList(outputs)), evaluable);
    }

    /**
     * Registers a module as a cell type, using the directions of its ports.
     * Inout ports count as both inputs and outputs.
     * @param module The module to register
     */
    public void setupModule(Module module) {
        Set<String> inputs = new LinkedHashSet<>();
        Set<String> outputs = new LinkedHashSet<>();
        for (Wire port : module.getPorts()) {
            if (port.isPortInput()) inputs.add(port.getName());
            if (port.isPortOutput()) outputs.add(port.getName());
        }
        setupType(module.getName(), inputs, outputs, false);
    }

    public void setupDesign(Design design) {
        for (Module module : design.getModules()) {
            setupModule(module);
        }
    }

    /**
     * Registers the cell types of all cells in the module that are not yet known,
     * taking port directions from the directions declared on the cells themselves.
     * Cells without declared directions are left unknown.  Inout ports count as
     * both inputs and outputs.  The registered types are considered evaluable.
     * @param module The module whose cells should be inspected
     * @return The number of cell types added
     */
    public int setupBlackboxCells(Module module) {
        int added = 0;
        for (Cell cell : module.getCells()) {
            if (cellKnown(cell.getType()) || cell.getPortDirections().isEmpty()) continue;
            Set<String> inputs = new LinkedHashSet<>();
            Set<String> outputs = new LinkedHashSet<>();
            for (Map.Entry<String, PortDirection> e : cell.getPortDirections().entrySet()) {
                if (e.getValue().isInput()) inputs.add(e.getKey());
                if (e.getValue().isOutput()) outputs.add(e.getKey());
            }
            setupType(cell.getType(), inputs, outputs, true);
            added++;
        }
        return added;
    }

    /**
     * Registers the word-level cells that can be evaluated combinationally.
     */
    public void setupInternalsEval() {
        String[] unaryOps = {
            "$not", "$pos", "$buf", "$neg",
            "$reduce_and", "$reduce_or", "$reduce_xor", "$reduce_xnor", "$reduce_bool",
            "$logic_not", "$slice", "$lut", "$sop"
        };
        String[] binaryOps = {
            "$and", "$or", "$xor", "$xnor",
            "$shl", "$shr", "$sshl", "$sshr", "$shift", "$shiftx",
            "$lt", "$le", "$eq", "$ne", "$eqx", "$nex", "$ge", "$gt",
            "$add", "$sub", "$mul", "$div", "$mod", "$divfloor", "$modfloor", "$pow",
            "$logic_and", "$logic_or", "$concat", "$macc", "$bweqx"
        };
        for (String type : unaryOps) {
            setupType(type, new String[] {"A"}, new String[] {"Y"}, true);
        }
        for (String type : binaryOps) {
            setupType(type, new String[] {"A", "B"}, new String[] {"Y"}, true);
        }
        for (String type : new String[] {"$mux", "$pmux", "$bwmux"}) {
            setupType(type, new String[] {"A", "B", "S"}, new String[] {"Y"}, true);
        }
        for (String type : new String[] {"$bmux", "$demux"}) {
            setupType(type, new String[] {"A", "S"}, new String[] {"Y"}, true);
        }
        setupType("$lcu", new String[] {"P", "G", "CI"}, new String[] {"CO"}, true);
        setupType("$alu", new String[] {"A", "B", "CI", "BI"}, new String[] {"X", "Y", "CO"}, true);
        setupType("$fa", new String[] {"A", "B", "C"}, new String[] {"X", "Y"}, true);
    }

    /**
     * Registers all word-level combinational cells, including tristate buffers
     * and the formal verification and auxiliary cells.
     */
    public void setupInternals() {
        setupInternalsEval();

        setupType("$tribuf", new String[] {"A", "EN"}, new String[] {"Y"}, true);

        for (String type : new String[] {"$assert", "$assume", "$live", "$fair", "$cover"}) {
            setupType(type, new String[] {"A", "EN"}, new String[0], true);
        }
        for (String type : new String[] {"$initstate", "$anyconst", "$anyseq", "$allconst", "$allseq"}) {
            setupType(type, new String[0], new String[] {"Y"}, true);
        }
        setupType("$equiv", new String[] {"A", "B"}, new String[] {"Y"}, true);
        setupType("$specify2", new String[] {"EN", "SRC", "DST"}, new String[0], true);
        setupType("$specify3", new String[] {"EN", "SRC", "DST", "DAT"}, new String[0], true);
        setupType("$specrule", new String[] {"EN_SRC", "EN_DST", "SRC", "DST"}, new String[0], true);
        setupType("$print", new String[] {"EN", "ARGS", "TRG"}, new String[0], false);
        setupType("$check", new String[] {"A", "EN", "ARGS", "TRG"}, new String[0], false);
        setupType("$set_tag", new String[] {"A", "SET", "CLR"}, new String[] {"Y"}, true);
        setupType("$get_tag", new String[] {"A"}, new String[] {"Y"}, true);
        setupType("$overwrite_tag", new String[] {"A", "SET", "CLR"}, new String[0], true);
        setupType("$original_tag", new String[] {"A"}, new String[] {"Y"}, true);
        setupType("$future_ff", new String[] {"A"}, new String[] {"Y"}, true);
        setupType("$scopeinfo", new String[0], new String[0], true);
    }

    /**
     * Registers the word-level flip-flops and latches.
     */
    public void setupInternalsFf() {
        setupType("$sr", new String[] {"SET", "CLR"}, new String[] {"Q"}, false);
        setupType("$ff", new String[] {"D"}, new String[] {"Q"}, false);
        setupType("$dff", new String[] {"CLK", "D"}, new String[] {"Q"}, false);
        setupType("$dffe", new String[] {"CLK", "EN", "D"}, new String[] {"Q"}, false);
        setupType("$dffsr", new String[] {"CLK", "SET", "CLR", "D"}, new String[] {"Q"}, false);
        setupType("$dffsre", new String[] {"CLK", "SET", "CLR", "D", "EN"}, new String[] {"Q"}, false);
        setupType("$adff", new String[] {"CLK", "ARST", "D"}, new String[] {"Q"}, false);
        setupType("$adffe", new String[] {"CLK", "ARST", "D", "EN"}, new String[] {"Q"}, false);
        setupType("$aldff", new String[] {"CLK", "ALOAD", "AD", "D"}, new String[] {"Q"}, false);
        setupType("$aldffe", new String[] {"CLK", "ALOAD", "AD", "D", "EN"}, new String[] {"Q"}, false);
        setupType("$sdff", new String[] {"CLK", "SRST", "D"}, new String[] {"Q"}, false);
        setupType("$sdffe", new String[] {"CLK", "SRST", "D", "EN"}, new String[] {"Q"}, false);
        setupType("$sdffce", new String[] {"CLK", "SRST", "D", "EN"}, new String[] {"Q"}, false);
        setupType("$dlatch", new String[] {"EN", "D"}, new String[] {"Q"}, false);
        setupType("$adlatch", new String[] {"EN", "D", "ARST"}, new String[] {"Q"}, false);
        setupType("$dlatchsr", new String[] {"EN", "SET", "CLR", "D"}, new String[] {"Q"}, false);
    }

    /**
     * Registers the word-level flip-flops, latches, memories and FSMs.
     */
    public void setupInternalsMem() {
        setupInternalsFf();

        setupType("$memrd", new String[] {"CLK", "EN", "ADDR"}, new String[] {"DATA"}, false);
        setupType("$memrd_v2", new String[] {"CLK", "EN", "ARST", "SRST", "ADDR"}, new String[] {"DATA"}, false);
        setupType("$memwr", new String[] {"CLK", "EN", "ADDR", "DATA"}, new String[0], false);
        setupType("$memwr_v2", new String[] {"CLK", "EN", "ADDR", "DATA"}, new String[0], false);
        setupType("$meminit", new String[] {"ADDR", "DATA"}, new String[0], false);
        setupType("$meminit_v2", new String[] {"ADDR", "DATA", "EN"}, new String[0], false);
        setupType("$mem", new String[] {"RD_CLK", "RD_EN", "RD_ADDR", "WR_CLK", "WR_EN", "WR_ADDR", "WR_DATA"},
                new String[] {"RD_DATA"}, false);
        setupType("$mem_v2", new String[] {"RD_CLK", "RD_EN", "RD_ARST", "RD_SRST", "RD_ADDR",
                "WR_CLK", "WR_EN", "WR_ADDR", "WR_DATA"}, new String[] {"RD_DATA"}, false);

        setupType("$fsm", new String[] {"CLK", "ARST", "CTRL_IN"}, new String[] {"CTRL_OUT"}, false);
    }

    /**
     * Registers the gate-level cells that can be evaluated combinationally.
     */
    public void setupStdcellsEval() {
        setupType("$_BUF_", new String[] {"A"}, new String[] {"Y"}, true);
        setupType("$_NOT_", new String[] {"A"}, new String[] {"Y"}, true);
        for (String type : new String[] {"$_AND_", "$_NAND_", "$_OR_", "$_NOR_",
                "$_XOR_", "$_XNOR_", "$_ANDNOT_", "$_ORNOT_"}) {
            setupType(type, new String[] {"A", "B"}, new String[] {"Y"}, true);
        }
        setupType("$_MUX_", new String[] {"A", "B", "S"}, new String[] {"Y"}, true);
        setupType("$_NMUX_", new String[] {"A", "B", "S"}, new String[] {"Y"}, true);
        setupType("$_MUX4_", new String[] {"A", "B", "C", "D", "S", "T"}, new String[] {"Y"}, true);
        setupType("$_MUX8_", new String[] {"A", "B", "C", "D", "E", "F", "G", "H", "S", "T", "U"},
                new String[] {"Y"}, true);
        setupType("$_MUX16_", new String[] {"A", "B", "C", "D", "E", "F", "G", "H", "I", "J", "K", "L",
                "M", "N", "O", "P", "S", "T", "U", "V"}, new String[] {"Y"}, true);
        setupType("$_AOI3_", new String[] {"A", "B", "C"}, new String[] {"Y"}, true);
        setupType("$_OAI3_", new String[] {"A", "B", "C"}, new String[] {"Y"}, true);
        setupType("$_AOI4_", new String[] {"A", "B", "C", "D"}, new String[] {"Y"}, true);
        setupType("$_OAI4_", new String[] {"A", "B", "C", "D"}, new String[] {"Y"}, true);
    }

    /**
     * Registers all gate-level combinational cells, including the tristate
     * buffer.
     */
    public void setupStdcells() {
        setupStdcellsEval();
        setupType("$_TBUF_", new String[] {"A", "E"}, new String[] {"Y"}, true);
    }

    /**
     * Registers the gate-level flip-flops and latches in all their clock, enable,
     * set and reset polarity variants.
     */
    public void setupStdcellsMem() {
        String[] np = {"N", "P"};
        String[] zo = {"0", "1"};

        for (String c1 : np)
            for (String c2 : np)
                setupType("$_SR_" + c1 + c2 + "_", new String[] {"S", "R"}, new String[] {"Q"}, false);

        setupType("$_FF_", new String[] {"D"}, new String[] {"Q"}, false);

        for (String c1 : np)
            setupType("$_DFF_" + c1 + "_", new String[] {"C", "D"}, new String[] {"Q"}, false);

        for (String c1 : np)
            for (String c2 : np)
                setupType("$_DFFE_" + c1 + c2 + "_", new String[] {"C", "D", "E"}, new String[] {"Q"}, false);

        for (String c1 : np)
            for (String c2 : np)
                for (String c3 : zo)
                    setupType("$_DFF_" + c1 + c2 + c3 + "_", new String[] {"C", "R", "D"}, new String[] {"Q"}, false);

        for (String c1 : np)
            for (String c2 : np)
                for (String c3 : zo)
                    for (String c4 : np)
                        setupType("$_DFFE_" + c1 + c2 + c3 + c4 + "_", new String[] {"C", "R", "D", "E"},
                                new String[] {"Q"}, false);

        for (String c1 : np)
            for (String c2 : np)
                setupType("$_ALDFF_" + c1 + c2 + "_", new String[] {"C", "L", "AD", "D"}, new String[] {"Q"}, false);

        for (String c1 : np)
            for (String c2 : np)
                for (String c3 : np)
                    setupType("$_ALDFFE_" + c1 + c2 + c3 + "_", new String[] {"C", "L", "AD", "D", "E"},
                            new String[] {"Q"}, false);

        for (String c1 : np)
            for (String c2 : np)
                for (String c3 : np)
                    setupType("$_DFFSR_" + c1 + c2 + c3 + "_", new String[] {"C", "S", "R", "D"},
                            new String[] {"Q"}, false);

        for (String c1 : np)
            for (String c2 : np)
                for (String c3 : np)
                    for (String c4 : np)
                        setupType("$_DFFSRE_" + c1 + c2 + c3 + c4 + "_", new String[] {"C", "S", "R", "D", "E"},
                                new String[] {"Q"}, false);

        for (String c1 : np)
            for (String c2 : np)
                for (String c3 : zo)
                    setupType("$_SDFF_" + c1 + c2 + c3 + "_", new String[] {"C", "R", "D"}, new String[] {"Q"}, false);

        for (String c1 : np)
            for (String c2 : np)
                for (String c3 : zo)
                    for (String c4 : np) {
                        setupType("$_SDFFE_" + c1 + c2 + c3 + c4 + "_", new String[] {"C", "R", "D", "E"},
                                new String[] {"Q"}, false);
                        setupType("$_SDFFCE_" + c1 + c2 + c3 + c4 + "_", new String[] {"C", "R", "D", "E"},
                                new String[] {"Q"}, false);
                    }

        for (String c1 : np)
            setupType("$_DLATCH_" + c1 + "_", new String[] {"E", "D"}, new String[] {"Q"}, false);

        for (String c1 : np)
            for (String c2 : np)
                for (String c3 : zo)
                    setupType("$_DLATCH_" + c1 + c2 + c3 + "_", new String[] {"E", "R", "D"}, new String[] {"Q"}, false);

        for (String c1 : np)
            for (String c2 : np)
                for (String c3 : np)
                    setupType("$_DLATCHSR_" + c1 + c2 + c3 + "_", new String[] {"E", "S", "R", "D"},
                            new String[] {"Q"}, false);
    }

    public void clear() {
        cellTypes.clear();
    }

    /**
     * @param type Cell type name
     * @return True if the type is registered.
     */
    public boolean cellKnown(String type) {
        return cellTypes.containsKey(type);
    }

    /**
     * @param type Cell type name
     * @param port Port name
     * @return True if the type is registered and the port is one of its outputs.
     */
    public boolean cellOutput(String type, String port) {
        CellType ct = cellTypes.get(type);
        return ct != null && ct.getOutputs().contains(port);
    }

    /**
     * @param type Cell type name
     * @param port Port name
     * @return True if the type is registered and the port is one of its inputs.
     */
    public boolean cellInput(String type, String port) {
        CellType ct = cellTypes.get(type);
        return ct != null && ct.getInputs().contains(port);
    }

    public boolean cellEvaluable(String type) {
        CellType ct = cellTypes.get(type);
        return ct != null && ct.isEvaluable();
    }

    public CellType getCellType(String type) {
        return cellTypes.get(type);
    }

    public int size() {
        return cellTypes.size();
    }
}
