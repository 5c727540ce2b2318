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

import java.util.HashMap;
import java.util.Map;

/**
 * Maps every signal bit to a single representative of the group of bits it is
 * electrically connected to through the module's connections (a union-find
 * over {@link SigBit}s).
 *
 * For a connection 'assign lhs = rhs;' the group of each lhs bit is joined
 * under the representative of the matching rhs bit.  If a group contains a
 * constant, that constant becomes its representative.  Two different constants
 * are never joined.
 *
 * Once built, {@link #apply(SigBit)} does not modify the map, so a populated
 * SigMap can be shared between readers.
 */
public class SigMap {

    /** Bits that are not roots, mapped towards their representative */
    private final Map<SigBit, SigBit> parents;

    public SigMap() {
        parents = new HashMap<>();
    }

    /**
     * Creates a SigMap populated from all connections of the module.
     * @param module The module to map.
     */
    public SigMap(Module module) {
        this();
        set(module);
    }

    public void clear() {
        parents.clear();
    }

    /**
     * Clears this map and adds all connections of the provided module.
     * @param module The module to map.
     */
    public void set(Module module) {
        clear();
        for (SigSig conn : module.getConnections()) {
            add(conn.getLhs(), conn.getRhs());
        }
    }

    /**
     * Joins each bit of from with the corresponding bit of to.
     * @param from Bits whose groups are re-rooted
     * @param to Bits providing the representatives
     */
    public void add(SigSpec from, SigSpec to) {
        if (from.size() != to.size()) {
            throw new RuntimeException("ERROR: SigMap can't join signals of different widths ("
                    + from.size() + " vs " + to.size() + ")");
        }
        for (int i = 0; i < from.size(); i++) {
            add(from.get(i), to.get(i));
        }
    }

    public void add(SigBit from, SigBit to) {
        SigBit bf = find(from);
        SigBit bt = find(to);
        if (bf.equals(bt)) return;
        if (bf.isConstant() && bt.isConstant()) return;
        parents.put(bf, bt);
        if (bf.isConstant()) {
            promote(bf);
        }
    }

    /**
     * Gets the representative of the bit's group.
     * @param bit Any bit
     * @return The canonical bit; the bit itself if it was never joined.
     */
    public SigBit apply(SigBit bit) {
        SigBit curr = bit;
        SigBit next;
        while ((next = parents.get(curr)) != null) {
            curr = next;
        }
        return curr;
    }

    /**
     * Maps every bit of sig to its representative.
     * @param sig Any signal
     * @return A new signal of the canonical bits
     */
    public SigSpec apply(SigSpec sig) {
        SigSpec mapped = new SigSpec();
        for (SigBit bit : sig) {
            mapped.append(apply(bit));
        }
        return mapped;
    }

    /**
     * @return True if both bits share a representative.
     */
    public boolean isConnected(SigBit a, SigBit b) {
        return apply(a).equals(apply(b));
    }

    private SigBit find(SigBit bit) {
        SigBit root = apply(bit);
        // Path compression
        SigBit curr = bit;
        while (!curr.equals(root)) {
            SigBit next = parents.get(curr);
            parents.put(curr, root);
            curr = next;
        }
        return root;
    }

    /**
     * Makes bit the representative of its group.
     */
    private void promote(SigBit bit) {
        SigBit root = find(bit);
        if (root.equals(bit)) return;
        parents.remove(bit);
        parents.put(root, bit);
    }
}
