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
package com.xilinx.rapidcone.netlist;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Map.Entry;
import java.util.SortedSet;
import java.util.TreeSet;

import org.jetbrains.annotations.NotNull;

import com.xilinx.rapidcone.rtlil.Cell;
import com.xilinx.rapidcone.rtlil.CellTypes;
import com.xilinx.rapidcone.rtlil.Module;
import com.xilinx.rapidcone.rtlil.SigBit;
import com.xilinx.rapidcone.rtlil.SigMap;
import com.xilinx.rapidcone.rtlil.SigSpec;
import com.xilinx.rapidcone.util.MessageGenerator;
import com.xilinx.rapidcone.util.Params;

/**
 * Driver index of a module: which known cell drives each canonical signal bit,
 * and which canonical bits each known cell consumes.  Built once from a
 * snapshot of the module and immutable afterwards; any number of cone
 * traversals ({@link NetlistTools#cone(Netlist, SigBit)},
 * {@link NetlistTools#cellCone(Netlist, SigBit)}) may share it, from any
 * thread.
 *
 * Cells whose type is unknown to the {@link CellTypes} used at construction are
 * invisible: they have no input set and drive nothing.  If more than one known
 * cell drives the same canonical bit, the cell enumerated last wins.
 *
 * The module must not be structurally modified while a Netlist (or a traversal
 * over it) is in use; doing so leaves the index stale.
 */
public class Netlist {

    private final Module module;

    private final SigMap sigMap;

    /** Canonical output bit to the arena index of its driving cell */
    private final Map<SigBit, Integer> sigBitDriverMap;

    /** Arena index of each known cell to its canonical input bits */
    private final Map<Integer, SortedSet<SigBit>> cellInputsMap;

    /**
     * Builds the index using the cell types of the module's design (all internal
     * and standard cells, plus the design's modules).
     * @param module The module to index
     */
    public Netlist(Module module) {
        this(module, CellTypes.forDesign(checkModule(module).getDesign()));
    }

    /**
     * Builds the index using the provided cell types.
     * @param module The module to index
     * @param ct Decides which cells are known and which of their ports are outputs
     */
    public Netlist(Module module, @NotNull CellTypes ct) {
        this.module = checkModule(module);
        this.sigMap = new SigMap(module);
        this.sigBitDriverMap = new HashMap<>();
        this.cellInputsMap = new LinkedHashMap<>();
        setupNetlist(ct);
        if (Params.RC_VERBOSE) {
            MessageGenerator.info("Netlist of " + module.getName() + ": " + cellInputsMap.size() + " of "
                    + module.getCellCount() + " cells known, " + sigBitDriverMap.size() + " driven bits");
        }
    }

    private static Module checkModule(Module module) {
        if (module == null) {
            throw new RuntimeException("ERROR: A Netlist can't be built without a module.");
        }
        return module;
    }

    private void setupNetlist(CellTypes ct) {
        for (Cell cell : module.getCells()) {
            if (!ct.cellKnown(cell.getType())) continue;
            SortedSet<SigBit> inputs = new TreeSet<>();
            SortedSet<SigBit> outputs = new TreeSet<>();
            for (Entry<String, SigSpec> port : cell.getConnections().entrySet()) {
                SortedSet<SigBit> dest = ct.cellOutput(cell.getType(), port.getKey()) ? outputs : inputs;
                for (SigBit bit : port.getValue()) {
                    dest.add(sigMap.apply(bit));
                }
            }
            cellInputsMap.put(cell.getIndex(), Collections.unmodifiableSortedSet(inputs));
            for (SigBit bit : outputs) {
                sigBitDriverMap.put(bit, cell.getIndex());
            }
        }
    }

    public Module getModule() {
        return module;
    }

    /**
     * @return The canonicalizer bound to this index.
     */
    public SigMap getSigMap() {
        return sigMap;
    }

    /**
     * @param bit A canonical bit (see {@link #getSigMap()})
     * @return True if a known cell drives the bit.
     */
    public boolean hasDriver(SigBit bit) {
        return sigBitDriverMap.containsKey(bit);
    }

    /**
     * @param bit A canonical bit
     * @return Arena index of the driving cell, or null if the bit has no driver.
     */
    public Integer getDriverIndex(SigBit bit) {
        return sigBitDriverMap.get(bit);
    }

    /**
     * @param bit A canonical bit
     * @return The driving cell, or null if the bit has no driver.
     */
    public Cell getDriver(SigBit bit) {
        Integer idx = sigBitDriverMap.get(bit);
        return idx == null ? null : module.getCell(idx);
    }

    /**
     * @param cellIndex Arena index of a cell
     * @return Canonical input bits of the cell in natural order, or null if the
     *         cell isn't known to this index.
     */
    public SortedSet<SigBit> getCellInputs(int cellIndex) {
        return cellInputsMap.get(cellIndex);
    }

    public SortedSet<SigBit> getCellInputs(Cell cell) {
        if (cell.getModule() != module) return null;
        return getCellInputs(cell.getIndex());
    }

    public boolean isKnownCell(Cell cell) {
        return cell.getModule() == module && cellInputsMap.containsKey(cell.getIndex());
    }

    /**
     * @return Known cells in module enumeration order.
     */
    public List<Cell> getCells() {
        List<Cell> cells = new ArrayList<>(cellInputsMap.size());
        for (Integer idx : cellInputsMap.keySet()) {
            cells.add(module.getCell(idx));
        }
        return cells;
    }

    public Map<SigBit, Integer> getDriverMap() {
        return Collections.unmodifiableMap(sigBitDriverMap);
    }

    public Map<Integer, SortedSet<SigBit>> getCellInputsMap() {
        return Collections.unmodifiableMap(cellInputsMap);
    }
}
