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
import java.util.Iterator;
import java.util.List;

/**
 * An ordered vector of {@link SigBit}s, least significant bit first.  This is
 * what a cell port or a module connection is attached to.
 */
public class SigSpec implements Iterable<SigBit> {

    private final List<SigBit> bits;

    public SigSpec() {
        bits = new ArrayList<>();
    }

    public SigSpec(Collection<SigBit> bits) {
        this.bits = new ArrayList<>(bits);
    }

    public SigSpec(SigBit... bits) {
        this.bits = new ArrayList<>(bits.length);
        Collections.addAll(this.bits, bits);
    }

    /**
     * Creates a signal covering every bit of the provided wire.
     * @param wire The wire.
     */
    public SigSpec(Wire wire) {
        this(wire, 0, wire.getWidth());
    }

    /**
     * Creates a signal covering a slice of the provided wire.
     * @param wire The wire.
     * @param offset 0-based offset of the first bit.
     * @param width Number of bits.
     */
    public SigSpec(Wire wire, int offset, int width) {
        bits = new ArrayList<>(width);
        for (int i = offset; i < offset + width; i++) {
            bits.add(new SigBit(wire, i));
        }
    }

    /**
     * Creates a constant signal.
     * @param state Value of every bit.
     * @param width Number of bits.
     */
    public SigSpec(State state, int width) {
        bits = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            bits.add(SigBit.of(state));
        }
    }

    public int size() {
        return bits.size();
    }

    public boolean isEmpty() {
        return bits.isEmpty();
    }

    public SigBit get(int i) {
        return bits.get(i);
    }

    /**
     * Appends all bits of another signal (the result is {other, this} in
     * Verilog concatenation order).
     * @param other Signal to append.
     * @return This signal.
     */
    public SigSpec append(SigSpec other) {
        bits.addAll(other.bits);
        return this;
    }

    public SigSpec append(SigBit bit) {
        bits.add(bit);
        return this;
    }

    public SigSpec extract(int offset, int length) {
        return new SigSpec(bits.subList(offset, offset + length));
    }

    public boolean isFullyConst() {
        for (SigBit bit : bits) {
            if (!bit.isConstant()) return false;
        }
        return true;
    }

    public List<SigBit> getBits() {
        return Collections.unmodifiableList(bits);
    }

    @Override
    public Iterator<SigBit> iterator() {
        return getBits().iterator();
    }

    @Override
    public int hashCode() {
        return bits.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj)
            return true;
        if (!(obj instanceof SigSpec))
            return false;
        return bits.equals(((SigSpec) obj).bits);
    }

    /**
     * Formats the bits most significant first, as a Verilog concatenation when
     * there is more than one.
     */
    @Override
    public String toString() {
        if (bits.size() == 1) return bits.get(0).toString();
        StringBuilder sb = new StringBuilder("{");
        for (int i = bits.size() - 1; i >= 0; i--) {
            sb.append(' ');
            sb.append(bits.get(i));
        }
        sb.append(" }");
        return sb.toString();
    }
}
