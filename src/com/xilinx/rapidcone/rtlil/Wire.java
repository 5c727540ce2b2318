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

/**
 * A named, possibly multi-bit signal inside a {@link Module}.  Individual bits
 * are addressed through {@link SigBit}.
 */
public class Wire extends RTLILObject {

    private final Module module;

    /** Creation order of this wire inside its module */
    private final int index;

    private final int width;

    private int startOffset;

    private boolean upto;

    /** 1-based position in the module's port list, 0 if not a port */
    private int portId;

    private boolean portInput;

    private boolean portOutput;

    protected Wire(Module module, String name, int width, int index) {
        super(name);
        if (width < 0) {
            throw new RuntimeException("ERROR: Wire " + name + " can't have a negative width (" + width + ")");
        }
        this.module = module;
        this.width = width;
        this.index = index;
    }

    public Module getModule() {
        return module;
    }

    public int getIndex() {
        return index;
    }

    public int getWidth() {
        return width;
    }

    public int getStartOffset() {
        return startOffset;
    }

    public void setStartOffset(int startOffset) {
        this.startOffset = startOffset;
    }

    /**
     * @return True if the wire was declared with an ascending range, e.g. [0:7].
     */
    public boolean isUpto() {
        return upto;
    }

    public void setUpto(boolean upto) {
        this.upto = upto;
    }

    public int getPortId() {
        return portId;
    }

    public boolean isPort() {
        return portId > 0;
    }

    public boolean isPortInput() {
        return portInput;
    }

    public boolean isPortOutput() {
        return portOutput;
    }

    /**
     * Marks this wire as a module port.
     * @param portId 1-based position in the module's port list
     * @param dir Direction of the port
     */
    protected void setPort(int portId, PortDirection dir) {
        this.portId = portId;
        this.portInput = dir.isInput();
        this.portOutput = dir.isOutput();
    }

    /**
     * @return Direction of this port, or null if the wire isn't a port.
     */
    public PortDirection getPortDirection() {
        if (!isPort()) return null;
        if (portInput && portOutput) return PortDirection.INOUT;
        return portOutput ? PortDirection.OUTPUT : PortDirection.INPUT;
    }

    /**
     * Translates a bit index as written in HDL (honoring the declared range) into
     * the 0-based offset used by {@link SigBit}.
     * @param hdlIndex The declared index, e.g. 3 in 'data[3]'.
     * @return 0-based offset into this wire, or -1 if out of range.
     */
    public int getOffsetFromIndex(int hdlIndex) {
        int offset = upto ? (width - 1) - (hdlIndex - startOffset) : hdlIndex - startOffset;
        return (offset < 0 || offset >= width) ? -1 : offset;
    }

    /**
     * Inverse of {@link #getOffsetFromIndex(int)}.
     */
    public int getIndexFromOffset(int offset) {
        return upto ? startOffset + (width - 1) - offset : startOffset + offset;
    }

    public SigBit getBit(int offset) {
        return new SigBit(this, offset);
    }
}
