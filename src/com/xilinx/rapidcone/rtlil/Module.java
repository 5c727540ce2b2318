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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A module definition: wires, cells and the connections between them.
 *
 * Cells live in an arena owned by the module.  A cell's position in the arena
 * is its handle ({@link Cell#getIndex()}); removing a cell leaves an empty slot
 * behind so that handles held elsewhere never refer to a different cell.
 */
public class Module extends RTLILObject {

    private Design design;

    private final Map<String, Wire> wires;

    private final List<Cell> cellArena;

    private final Map<String, Cell> cellsByName;

    private final List<SigSig> connections;

    private final List<Wire> ports;

    private int liveCellCount;

    private int autoIdx;

    public Module(String name) {
        super(name);
        wires = new LinkedHashMap<>();
        cellArena = new ArrayList<>();
        cellsByName = new HashMap<>();
        connections = new ArrayList<>();
        ports = new ArrayList<>();
    }

    public Design getDesign() {
        return design;
    }

    protected void setDesign(Design design) {
        this.design = design;
    }

    /**
     * Creates a new wire in this module.
     * @param name Unique name of the wire
     * @param width Number of bits
     * @return The new wire
     */
    public Wire addWire(String name, int width) {
        if (wires.containsKey(name)) {
            throw new RuntimeException("ERROR: Module " + getName() + " already contains a wire named " + name);
        }
        Wire w = new Wire(this, name, width, wires.size());
        wires.put(name, w);
        return w;
    }

    public Wire addWire(String name) {
        return addWire(name, 1);
    }

    public Wire getWire(String name) {
        return wires.get(name);
    }

    public Collection<Wire> getWires() {
        return Collections.unmodifiableCollection(wires.values());
    }

    /**
     * Creates a new cell in this module's arena.
     * @param name Unique name of the cell instance
     * @param type Cell type, e.g. '$and' or the name of another module
     * @return The new cell
     */
    public Cell addCell(String name, String type) {
        if (cellsByName.containsKey(name)) {
            throw new RuntimeException("ERROR: Module " + getName() + " already contains a cell named " + name);
        }
        Cell c = new Cell(this, name, type, cellArena.size());
        cellArena.add(c);
        cellsByName.put(name, c);
        liveCellCount++;
        return c;
    }

    public Cell getCell(String name) {
        return cellsByName.get(name);
    }

    /**
     * Resolves a cell handle.
     * @param index Arena index of the cell ({@link Cell#getIndex()})
     * @return The cell, or null if the handle is out of range or the cell was removed.
     */
    public Cell getCell(int index) {
        if (index < 0 || index >= cellArena.size()) return null;
        return cellArena.get(index);
    }

    /**
     * Removes the cell from this module.  Its arena slot is left empty.
     * @param cell The cell to remove
     * @return True if the cell was part of this module and was removed.
     */
    public boolean removeCell(Cell cell) {
        if (cell.getModule() != this || getCell(cell.getIndex()) != cell) return false;
        cellArena.set(cell.getIndex(), null);
        cellsByName.remove(cell.getName());
        liveCellCount--;
        return true;
    }

    /**
     * Gets all live cells in arena (creation) order.  The order is stable for as
     * long as the module isn't modified.
     * @return A new list of the live cells.
     */
    public List<Cell> getCells() {
        List<Cell> cells = new ArrayList<>(liveCellCount);
        for (Cell c : cellArena) {
            if (c != null) cells.add(c);
        }
        return cells;
    }

    public int getCellCount() {
        return liveCellCount;
    }

    /**
     * @return The number of arena slots, including slots of removed cells.
     */
    public int getCellArenaSize() {
        return cellArena.size();
    }

    /**
     * Adds the connection 'assign lhs = rhs;' to this module.
     */
    public void connect(SigSpec lhs, SigSpec rhs) {
        connections.add(new SigSig(lhs, rhs));
    }

    public void connect(SigBit lhs, SigBit rhs) {
        connect(new SigSpec(lhs), new SigSpec(rhs));
    }

    public List<SigSig> getConnections() {
        return Collections.unmodifiableList(connections);
    }

    /**
     * Declares an existing wire as the next port of this module.
     * @param wire Wire of this module
     * @param dir Direction of the port
     */
    public void addPort(Wire wire, PortDirection dir) {
        if (wire.getModule() != this) {
            throw new RuntimeException("ERROR: Wire " + wire.getName() + " doesn't belong to module " + getName());
        }
        if (wire.isPort()) {
            throw new RuntimeException("ERROR: Wire " + wire.getName() + " is already a port of " + getName());
        }
        ports.add(wire);
        wire.setPort(ports.size(), dir);
    }

    /**
     * @return Port wires in declaration order.
     */
    public List<Wire> getPorts() {
        return Collections.unmodifiableList(ports);
    }

    /**
     * Creates a name of the form '$auto$&lt;prefix&gt;$&lt;n&gt;' that isn't used by
     * any wire or cell of this module.
     * @param prefix Descriptive part of the name
     * @return A fresh name
     */
    public String newAutoName(String prefix) {
        String name;
        do {
            name = "$auto$" + prefix + "$" + (autoIdx++);
        } while (wires.containsKey(name) || cellsByName.containsKey(name));
        return name;
    }
}
