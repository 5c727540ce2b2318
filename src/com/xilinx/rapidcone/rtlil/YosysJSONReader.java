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

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import com.xilinx.rapidcone.util.FileTools;

/**
 * Reads netlists in the JSON format written by Yosys' 'write_json' command.
 *
 * In that format every bit is either a net number (shared by all wire bits and
 * cell port bits of the same net) or one of the constant strings "0", "1",
 * "x" and "z".  Each entry of 'netnames' becomes a {@link Wire}.  The first wire
 * bit found for a net number becomes that net's home bit; any further wire bit
 * with the same number is connected to it, so aliases end up in the module's
 * connections where {@link SigMap} resolves them.  Wires are created ports
 * first, then named wires, then hidden ($-prefixed) wires, each group in name
 * order, which makes the home bits and the wire order deterministic.  Net
 * numbers not covered by any netname get an auto-named single-bit wire.
 */
public class YosysJSONReader {

    public static final String MODULES = "modules";
    public static final String PORTS = "ports";
    public static final String CELLS = "cells";
    public static final String NETNAMES = "netnames";
    public static final String BITS = "bits";
    public static final String DIRECTION = "direction";
    public static final String TYPE = "type";
    public static final String PARAMETERS = "parameters";
    public static final String ATTRIBUTES = "attributes";
    public static final String PORT_DIRECTIONS = "port_directions";
    public static final String CONNECTIONS = "connections";
    public static final String HIDE_NAME = "hide_name";
    public static final String OFFSET = "offset";
    public static final String UPTO = "upto";

    /**
     * Reads a Yosys JSON netlist file.
     * @param path Path to the .json file
     * @return The design
     */
    public static Design readJSONFile(Path path) {
        try {
            return readJSON(FileTools.readFileToString(path));
        } catch (JSONException e) {
            throw new RuntimeException("ERROR: Couldn't parse JSON netlist " + path + ": " + e.getMessage(), e);
        }
    }

    public static Design readJSON(String jsonText) {
        return readJSON(new JSONObject(jsonText));
    }

    public static Design readJSON(JSONObject root) {
        JSONObject modules = root.optJSONObject(MODULES);
        if (modules == null) {
            throw new RuntimeException("ERROR: JSON netlist has no '" + MODULES + "' object.");
        }
        Design design = new Design();
        for (String name : new TreeSet<>(modules.keySet())) {
            readModule(design, name, modules.getJSONObject(name));
        }
        return design;
    }

    private static final class WireEntry {
        final String name;
        final JSONArray bits;
        final JSONObject netname;
        PortDirection dir;

        WireEntry(String name, JSONArray bits, JSONObject netname) {
            this.name = name;
            this.bits = bits;
            this.netname = netname;
        }
    }

    private static void readModule(Design design, String name, JSONObject jm) {
        Module m = design.addModule(name);
        readAttributes(m, jm.optJSONObject(ATTRIBUTES));

        JSONObject ports = jm.optJSONObject(PORTS);
        JSONObject netnames = jm.optJSONObject(NETNAMES);
        if (ports == null) ports = new JSONObject();
        if (netnames == null) netnames = new JSONObject();

        List<WireEntry> entries = new ArrayList<>();
        for (String portName : new TreeSet<>(ports.keySet())) {
            JSONObject port = ports.getJSONObject(portName);
            JSONObject netname = netnames.optJSONObject(portName);
            JSONArray bits = getBits(netname != null ? netname : port, m, portName);
            WireEntry e = new WireEntry(portName, bits, netname);
            e.dir = PortDirection.getEnum(port.getString(DIRECTION));
            entries.add(e);
        }
        List<WireEntry> hidden = new ArrayList<>();
        for (String netName : new TreeSet<>(netnames.keySet())) {
            if (ports.has(netName)) continue;
            JSONObject netname = netnames.getJSONObject(netName);
            WireEntry e = new WireEntry(netName, getBits(netname, m, netName), netname);
            if (netname.optInt(HIDE_NAME, 0) != 0 || netName.startsWith("$")) {
                hidden.add(e);
            } else {
                entries.add(e);
            }
        }
        entries.addAll(hidden);

        Map<Integer, SigBit> homeBits = new HashMap<>();
        for (WireEntry e : entries) {
            Wire w = m.addWire(e.name, e.bits.length());
            if (e.netname != null) {
                w.setStartOffset(e.netname.optInt(OFFSET, 0));
                w.setUpto(e.netname.optInt(UPTO, 0) != 0);
                readAttributes(w, e.netname.optJSONObject(ATTRIBUTES));
            }
            if (e.dir != null) {
                m.addPort(w, e.dir);
            }
            for (int i = 0; i < e.bits.length(); i++) {
                SigBit bit = w.getBit(i);
                Object o = e.bits.get(i);
                if (o instanceof Number) {
                    int id = ((Number) o).intValue();
                    SigBit home = homeBits.putIfAbsent(id, bit);
                    if (home != null) {
                        m.connect(bit, home);
                    }
                } else {
                    m.connect(bit, getConstBit(o, m, e.name));
                }
            }
        }

        JSONObject cells = jm.optJSONObject(CELLS);
        if (cells == null) return;
        for (String cellName : new TreeSet<>(cells.keySet())) {
            readCell(m, cellName, cells.getJSONObject(cellName), homeBits);
        }
    }

    private static void readCell(Module m, String cellName, JSONObject jc, Map<Integer, SigBit> homeBits) {
        if (!jc.has(TYPE)) {
            throw new RuntimeException("ERROR: Cell " + cellName + " in module " + m.getName() + " has no type.");
        }
        Cell c = m.addCell(cellName, jc.getString(TYPE));
        readAttributes(c, jc.optJSONObject(ATTRIBUTES));
        JSONObject params = jc.optJSONObject(PARAMETERS);
        if (params != null) {
            for (String key : new TreeSet<>(params.keySet())) {
                c.setParam(key, String.valueOf(params.get(key)));
            }
        }
        JSONObject dirs = jc.optJSONObject(PORT_DIRECTIONS);
        if (dirs != null) {
            for (String port : new TreeSet<>(dirs.keySet())) {
                c.setPortDirection(port, PortDirection.getEnum(dirs.getString(port)));
            }
        }
        JSONObject conns = jc.optJSONObject(CONNECTIONS);
        if (conns == null) return;
        for (String port : new TreeSet<>(conns.keySet())) {
            Object value = conns.get(port);
            if (!(value instanceof JSONArray)) {
                throw new RuntimeException("ERROR: Connection " + cellName + "." + port + " in module "
                        + m.getName() + " is not a bit array.");
            }
            JSONArray bits = (JSONArray) value;
            SigSpec sig = new SigSpec();
            for (int i = 0; i < bits.length(); i++) {
                Object o = bits.get(i);
                if (o instanceof Number) {
                    int id = ((Number) o).intValue();
                    SigBit home = homeBits.get(id);
                    if (home == null) {
                        home = m.addWire(m.newAutoName("json_net" + id)).getBit(0);
                        homeBits.put(id, home);
                    }
                    sig.append(home);
                } else {
                    sig.append(getConstBit(o, m, cellName + "." + port));
                }
            }
            c.setPort(port, sig);
        }
    }

    private static JSONArray getBits(JSONObject obj, Module m, String name) {
        Object bits = obj.opt(BITS);
        if (!(bits instanceof JSONArray)) {
            throw new RuntimeException("ERROR: Signal " + name + " in module " + m.getName()
                    + " has no '" + BITS + "' array.");
        }
        return (JSONArray) bits;
    }

    private static SigBit getConstBit(Object o, Module m, String context) {
        if (o instanceof String) {
            return SigBit.of(State.getEnum((String) o));
        }
        throw new RuntimeException("ERROR: Unrecognized bit value '" + o + "' on " + context
                + " in module " + m.getName());
    }

    private static void readAttributes(RTLILObject obj, JSONObject attrs) {
        if (attrs == null) return;
        for (String key : new TreeSet<>(attrs.keySet())) {
            obj.addAttribute(key, String.valueOf(attrs.get(key)));
        }
    }
}
