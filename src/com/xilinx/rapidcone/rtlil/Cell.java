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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * An instance of a logic primitive or of another module inside a
 * {@link Module}.  Each named port is connected to a {@link SigSpec}.
 *
 * A cell is owned by its module's cell arena and is identified there by a
 * stable index ({@link #getIndex()}) which is never reused, even after the
 * cell is removed.
 */
public class Cell extends RTLILObject {

    private final Module module;

    private final int index;

    private final String type;

    private final Map<String, SigSpec> connections;

    private Map<String, String> parameters;

    /** Port directions declared by the netlist source, used for unknown cell types */
    private Map<String, PortDirection> portDirections;

    protected Cell(Module module, String name, String type, int index) {
        super(name);
        if (type == null) {
            throw new RuntimeException("ERROR: Cell " + name + " requires a type.");
        }
        this.module = module;
        this.type = type;
        this.index = index;
        this.connections = new LinkedHashMap<>();
    }

    public Module getModule() {
        return module;
    }

    /**
     * @return The stable handle of this cell in its module's cell arena.
     */
    public int getIndex() {
        return index;
    }

    public String getType() {
        return type;
    }

    /**
     * Connects (or re-connects) the named port.
     * @param portName Name of the port on the cell type.
     * @param sig The signal to attach.
     */
    public void setPort(String portName, SigSpec sig) {
        connections.put(portName, sig);
    }

    /**
     * @param portName Name of the port.
     * @return The connected signal, or null if the port is unconnected.
     */
    public SigSpec getPort(String portName) {
        return connections.get(portName);
    }

    public boolean hasPort(String portName) {
        return connections.containsKey(portName);
    }

    public SigSpec unsetPort(String portName) {
        return connections.remove(portName);
    }

    /**
     * @return Port connections in the order they were made.
     */
    public Map<String, SigSpec> getConnections() {
        return Collections.unmodifiableMap(connections);
    }

    public void setParam(String key, String value) {
        if (parameters == null) parameters = new LinkedHashMap<>(2);
        parameters.put(key, value);
    }

    public String getParam(String key) {
        return parameters == null ? null : parameters.get(key);
    }

    public Map<String, String> getParameters() {
        return parameters == null ? Collections.emptyMap() : Collections.unmodifiableMap(parameters);
    }

    public void setPortDirection(String portName, PortDirection dir) {
        if (portDirections == null) portDirections = new LinkedHashMap<>(4);
        portDirections.put(portName, dir);
    }

    /**
     * @param portName Name of the port.
     * @return The declared direction of the port or null if none was declared.
     */
    public PortDirection getPortDirection(String portName) {
        return portDirections == null ? null : portDirections.get(portName);
    }

    public Map<String, PortDirection> getPortDirections() {
        return portDirections == null ? Collections.emptyMap() : Collections.unmodifiableMap(portDirections);
    }

    @Override
    public String toString() {
        return getName() + " (" + type + ")";
    }
}
