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

import java.util.Objects;

/**
 * A single signal bit: either one bit of a {@link Wire} or a constant
 * {@link State}.  Immutable, value-comparable and usable as a map key.
 *
 * The natural order places constants first (in {@link State} order), then
 * wire bits ordered by the wire's creation index within its module, its name
 * and finally the bit offset.
 */
public final class SigBit implements Comparable<SigBit> {

    public static final SigBit S0 = new SigBit(State.S0);
    public static final SigBit S1 = new SigBit(State.S1);
    public static final SigBit Sx = new SigBit(State.Sx);
    public static final SigBit Sz = new SigBit(State.Sz);

    private final Wire wire;

    private final int offset;

    private final State data;

    public SigBit(Wire wire, int offset) {
        if (wire == null) {
            throw new RuntimeException("ERROR: A wire bit requires a wire, use a constant SigBit instead.");
        }
        if (offset < 0 || offset >= wire.getWidth()) {
            throw new RuntimeException("ERROR: Offset " + offset + " is out of range for wire "
                    + wire.getName() + " of width " + wire.getWidth());
        }
        this.wire = wire;
        this.offset = offset;
        this.data = null;
    }

    private SigBit(State data) {
        this.wire = null;
        this.offset = 0;
        this.data = data;
    }

    public static SigBit of(State state) {
        switch (state) {
            case S0: return S0;
            case S1: return S1;
            case Sx: return Sx;
            default: return Sz;
        }
    }

    /**
     * @return The wire of this bit, or null for a constant bit.
     */
    public Wire getWire() {
        return wire;
    }

    public int getOffset() {
        return offset;
    }

    /**
     * @return The constant value of this bit, or null for a wire bit.
     */
    public State getData() {
        return data;
    }

    public boolean isConstant() {
        return wire == null;
    }

    @Override
    public int hashCode() {
        return wire == null ? data.hashCode() : 31 * System.identityHashCode(wire) + offset;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof SigBit))
            return false;
        SigBit other = (SigBit) obj;
        if (wire == null) {
            return other.wire == null && data == other.data;
        }
        return wire == other.wire && offset == other.offset;
    }

    @Override
    public int compareTo(SigBit o) {
        if (wire == o.wire) {
            return wire == null ? data.compareTo(o.data) : Integer.compare(offset, o.offset);
        }
        if (wire == null) return -1;
        if (o.wire == null) return 1;
        int cmp = Integer.compare(wire.getIndex(), o.wire.getIndex());
        if (cmp != 0) return cmp;
        cmp = wire.getName().compareTo(o.wire.getName());
        if (cmp != 0) return cmp;
        cmp = Objects.compare(wire.getModule().getName(), o.wire.getModule().getName(), String::compareTo);
        if (cmp != 0) return cmp;
        return Integer.compare(offset, o.offset);
    }

    /**
     * Formats the bit the way it would be written in HDL: 'name' for a
     * single-bit wire, 'name[index]' otherwise, and the state character for a
     * constant.
     */
    @Override
    public String toString() {
        if (wire == null) return data.toString();
        if (wire.getWidth() == 1 && wire.getStartOffset() == 0) return wire.getName();
        return wire.getName() + "[" + wire.getIndexFromOffset(offset) + "]";
    }
}
