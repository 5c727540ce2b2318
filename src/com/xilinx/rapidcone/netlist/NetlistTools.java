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

import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.NoSuchElementException;
import java.util.Set;

import com.xilinx.rapidcone.rtlil.Cell;
import com.xilinx.rapidcone.rtlil.SigBit;
import com.xilinx.rapidcone.rtlil.SigSpec;

/**
 * Fan-in cone queries over a {@link Netlist}.
 *
 * Every query canonicalizes its start bit with the netlist's SigMap and
 * returns an {@link Iterable}; each call to {@link Iterable#iterator()} starts a
 * fresh, independent and lazy walk, so a result can be iterated any number of
 * times and always yields the same sequence.  Nothing is computed until
 * elements are requested.
 */
public class NetlistTools {

    /**
     * Gets the bits in the combinational fan-in of a bit, depth-first, excluding
     * the bit itself.  A bit reachable through two different cells is returned
     * once per cell; each driving cell is expanded only once.
     *
     * @param net The driver index
     * @param bit Any bit of the indexed module
     * @return The lazy bit sequence
     */
    public static Iterable<SigBit> cone(Netlist net, SigBit bit) {
        final SigBit start = net.getSigMap().apply(bit);
        return () -> new ConeBitIterator(net, start);
    }

    /**
     * Gets the distinct known cells in the combinational fan-in of a bit, in
     * discovery order.  The bit's own driver, if it has one, comes first.
     *
     * @param net The driver index
     * @param bit Any bit of the indexed module
     * @return The lazy cell sequence
     */
    public static Iterable<Cell> cellCone(Netlist net, SigBit bit) {
        final SigBit start = net.getSigMap().apply(bit);
        return () -> new ConeCellIterator(net, start);
    }

    /**
     * Gets the bits of {@link #cone(Netlist, SigBit)} that have no driver in the
     * index: primary inputs, constants and outputs of unknown cells.  Same order
     * and the same lack of deduplication as the underlying cone.
     *
     * @param net The driver index
     * @param bit Any bit of the indexed module
     * @return The lazy leaf sequence
     */
    public static Iterable<SigBit> coneInputs(Netlist net, SigBit bit) {
        final Iterable<SigBit> cone = cone(net, bit);
        return () -> new Iterator<SigBit>() {
            private final Iterator<SigBit> it = cone.iterator();
            private SigBit nextBit;

            @Override
            public boolean hasNext() {
                while (nextBit == null && it.hasNext()) {
                    SigBit b = it.next();
                    if (!net.hasDriver(b)) {
                        nextBit = b;
                    }
                }
                return nextBit != null;
            }

            @Override
            public SigBit next() {
                if (!hasNext()) {
                    throw new NoSuchElementException();
                }
                SigBit b = nextBit;
                nextBit = null;
                return b;
            }
        };
    }

    /**
     * Collects the distinct known cells in the fan-in of any bit of a signal.
     * @param net The driver index
     * @param sig Any signal of the indexed module
     * @return The cells, in discovery order, bit 0 first
     */
    public static Set<Cell> getFaninCells(Netlist net, SigSpec sig) {
        Set<Cell> cells = new LinkedHashSet<>();
        for (SigBit bit : sig) {
            for (Cell c : cellCone(net, bit)) {
                cells.add(c);
            }
        }
        return cells;
    }

    /**
     * Collects the distinct undriven bits feeding any bit of a signal.  A bit of
     * the signal that has no driver counts as its own input.
     * @param net The driver index
     * @param sig Any signal of the indexed module
     * @return The leaf bits, in discovery order, bit 0 first
     */
    public static Set<SigBit> getFaninInputs(Netlist net, SigSpec sig) {
        Set<SigBit> inputs = new LinkedHashSet<>();
        for (SigBit bit : sig) {
            SigBit canonical = net.getSigMap().apply(bit);
            if (!net.hasDriver(canonical)) {
                inputs.add(canonical);
                continue;
            }
            for (SigBit b : coneInputs(net, bit)) {
                inputs.add(b);
            }
        }
        return inputs;
    }
}
