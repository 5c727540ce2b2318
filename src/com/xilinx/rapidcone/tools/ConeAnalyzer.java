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

package com.xilinx.rapidcone.tools;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONObject;

import com.xilinx.rapidcone.netlist.Netlist;
import com.xilinx.rapidcone.netlist.NetlistTools;
import com.xilinx.rapidcone.rtlil.Cell;
import com.xilinx.rapidcone.rtlil.CellTypes;
import com.xilinx.rapidcone.rtlil.Design;
import com.xilinx.rapidcone.rtlil.Module;
import com.xilinx.rapidcone.rtlil.RTLILTools;
import com.xilinx.rapidcone.rtlil.SigBit;
import com.xilinx.rapidcone.rtlil.SigSpec;
import com.xilinx.rapidcone.rtlil.YosysJSONReader;
import com.xilinx.rapidcone.rtlil.YosysTools;
import com.xilinx.rapidcone.util.MessageGenerator;

import joptsimple.OptionParser;
import joptsimple.OptionSet;

/**
 * CLI tool that reports the combinational fan-in cone of signals of a netlist.
 *
 * For every bit of every requested signal, a JSON object is printed with the
 * bit's driving cell, the bits of its cone in traversal order, the cells of its
 * cone in discovery order and the distinct undriven bits feeding it.
 */
public final class ConeAnalyzer {

    private static final String INPUT_OPT = "i";
    private static final String MODULE_OPT = "m";
    private static final String SIGNAL_OPT = "s";
    private static final String COMB_ONLY_OPT = "c";
    private static final String BLACKBOXES_OPT = "b";
    private static final String HELP_OPT = "h";

    private static final String DESC_INPUT = "Input Yosys JSON netlist (or Verilog, if yosys is on the PATH)";
    private static final String DESC_MODULE = "Module to analyze (default: the top module)";
    private static final String DESC_SIGNAL = "Signal to analyze, e.g. 'y', 'data[3]' or 'data[7:4]' (repeatable)";

    public static final String DRIVER_KEY = "driver";
    public static final String CONE_KEY = "cone";
    public static final String CELLS_KEY = "cells";
    public static final String INPUTS_KEY = "inputs";

    private ConeAnalyzer() {
    }

    private static OptionParser createOptionParser() {
        OptionParser optParser = new OptionParser();

        optParser.acceptsAll(Arrays.asList(INPUT_OPT, "input"))
                .withRequiredArg()
                .required()
                .describedAs(DESC_INPUT);

        optParser.acceptsAll(Arrays.asList(MODULE_OPT, "module"))
                .withRequiredArg()
                .describedAs(DESC_MODULE);

        optParser.acceptsAll(Arrays.asList(SIGNAL_OPT, "signal"))
                .withRequiredArg()
                .required()
                .describedAs(DESC_SIGNAL);

        optParser.acceptsAll(Arrays.asList(COMB_ONLY_OPT, "comb-only"),
                "Only traverse internal and gate-level combinational cells");

        optParser.acceptsAll(Arrays.asList(BLACKBOXES_OPT, "blackboxes"),
                "Treat cells of unknown type as combinational, using their declared port directions");

        optParser.acceptsAll(Arrays.asList(HELP_OPT, "help", "?"), "Print Help")
                .forHelp();

        return optParser;
    }

    private static void printHelp(OptionParser optParser) {
        MessageGenerator.printHeader("ConeAnalyzer");
        System.out.println("Reports the combinational fan-in cone of netlist signals.\n");
        try {
            optParser.printHelpOn(System.out);
        } catch (IOException ioException) {
            ioException.printStackTrace();
        }
    }

    /**
     * Loads a design from a Yosys JSON netlist, or from HDL sources by running
     * yosys on them.
     * @param input Path to the input file
     * @return The design
     */
    public static Design loadDesign(Path input) {
        if (input.toString().toLowerCase().endsWith(".json")) {
            return YosysJSONReader.readJSONFile(input);
        }
        if (!YosysTools.isYosysOnPath()) {
            throw new RuntimeException("ERROR: Reading " + input + " requires '" + YosysTools.getYosysExec()
                    + "' on the PATH, or provide a Yosys JSON netlist instead.");
        }
        return YosysTools.prep("", input);
    }

    /**
     * Builds the cone report of a single bit.
     * @param net The driver index
     * @param bit Bit to report
     * @return JSON object with the '{@value #DRIVER_KEY}', '{@value #CONE_KEY}',
     *         '{@value #CELLS_KEY}' and '{@value #INPUTS_KEY}' entries
     */
    public static JSONObject getConeReport(Netlist net, SigBit bit) {
        JSONObject report = new JSONObject();
        Cell driver = net.getDriver(net.getSigMap().apply(bit));
        report.put(DRIVER_KEY, driver == null ? JSONObject.NULL : driver.getName());

        List<String> cone = new ArrayList<>();
        for (SigBit b : NetlistTools.cone(net, bit)) {
            cone.add(b.toString());
        }
        report.put(CONE_KEY, new JSONArray(cone));

        List<String> cells = new ArrayList<>();
        for (Cell c : NetlistTools.cellCone(net, bit)) {
            cells.add(c.getName());
        }
        report.put(CELLS_KEY, new JSONArray(cells));

        Set<String> inputs = new LinkedHashSet<>();
        for (SigBit b : NetlistTools.getFaninInputs(net, new SigSpec(bit))) {
            inputs.add(b.toString());
        }
        report.put(INPUTS_KEY, new JSONArray(inputs));
        return report;
    }

    /**
     * Runs the tool.
     * @param args command-line arguments
     * @return The exit status: 0 on success, 1 on error
     */
    public static int run(String[] args) {
        OptionParser optParser = createOptionParser();
        OptionSet opts;

        try {
            opts = optParser.parse(args);
        } catch (Exception parseException) {
            System.err.println("ERROR: " + parseException.getMessage());
            printHelp(optParser);
            return 1;
        }

        if (opts.has(HELP_OPT)) {
            printHelp(optParser);
            return 0;
        }

        Path inputPath = Paths.get((String) opts.valueOf(INPUT_OPT));
        Design design = loadDesign(inputPath);

        Module module;
        if (opts.has(MODULE_OPT)) {
            String moduleName = (String) opts.valueOf(MODULE_OPT);
            module = design.getModule(moduleName);
            if (module == null) {
                MessageGenerator.briefError("ERROR: Module '" + moduleName + "' not found in " + inputPath);
                return 1;
            }
        } else {
            module = design.getTopModule();
            if (module == null) {
                MessageGenerator.briefError("ERROR: Couldn't determine the top module of " + inputPath
                        + ", please select one with -" + MODULE_OPT);
                return 1;
            }
        }

        CellTypes ct = opts.has(COMB_ONLY_OPT) ? CellTypes.combCellsFilter() : CellTypes.forDesign(design);
        if (opts.has(BLACKBOXES_OPT)) {
            ct.setupBlackboxCells(module);
        }
        Netlist net = new Netlist(module, ct);

        JSONObject out = new JSONObject();
        for (Object o : opts.valuesOf(SIGNAL_OPT)) {
            String signalName = (String) o;
            SigSpec sig = RTLILTools.getSigSpecFromName(module, signalName);
            if (sig == null) {
                MessageGenerator.warning("Skipping given signal named " + signalName
                        + " which could not be found in module " + module.getName());
                continue;
            }
            for (SigBit bit : sig) {
                out.put(bit.toString(), getConeReport(net, bit));
            }
        }

        System.out.println(out.toString(4));
        return 0;
    }

    public static void main(String[] args) {
        int status = run(args);
        if (status != 0) {
            System.exit(status);
        }
    }
}
