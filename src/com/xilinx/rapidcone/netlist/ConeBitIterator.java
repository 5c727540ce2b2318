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

import java.util.ArrayDeque;
import java.util.BitSet;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

import com.xilinx.rapidcone.rtlil.SigBit;

/**
 * Lazy depth-first walk over the combinational fan-in of a canonical bit.
 *
 * Starting from the start bit (which is never returned), each step either
 * descends into the input bits of the current bit's driver, if that driver
 * hasn't been expanded yet, or moves on to the next pending input of the
 * innermost unfinished cell.  A cell is marked visited before its inputs are
 * pushed, which is what keeps combinational loops finite.  Bits are not
 * deduplicated: an undriven bit feeding two cells is returned twice.
 *
 * Single use and not thread-safe; the {@link Netlist} it walks is only read.
 */
public class ConeBitIterator implements Iterator<SigBit> {

    private final Netlist net;

    private SigBit current;

    /** One frame per expanded cell: its remaining input bits */
    private final Deque<Iterator<SigBit>> dfsPathStack;

    private final BitSet cellsVisited;

    private boolean done;

    /** True if current was produced by a step but not yet returned by next() */
    private boolean pending;

    /**
     * @param net The driver index to walk
     * @param start A canonical bit
     */
    public ConeBitIterator(Netlist net, SigBit start) {
        this.net = net;
        this.current = start;
        this.dfsPathStack = new ArrayDeque<>();
        this.cellsVisited = new BitSet();
    }

    @Override
    public boolean hasNext() {
        if (!pending && !done) {
            pending = step();
        }
        return pending;
    }

    @Override
    public SigBit next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        pending = false;
        return current;
    }

    /**
     * Moves current to the next bit of the cone.
     * @return False once the walk is exhausted.
     */
    boolean step() {
        if (done) return false;
        Integer drv = net.getDriverIndex(current);
        if (drv != null && !cellsVisited.get(drv)) {
            cellsVisited.set(drv);
            dfsPathStack.push(net.getCellInputs(drv).iterator());
        }
        while (!dfsPathStack.isEmpty()) {
            Iterator<SigBit> top = dfsPathStack.peek();
            if (top.hasNext()) {
                current = top.next();
                return true;
            }
            dfsPathStack.pop();
        }
        done = true;
        return false;
    }

    /**
     * @return The bit most recently reached (the start bit before the first step).
     */
    SigBit getCurrent() {
        return current;
    }

    boolean isDone() {
        return done;
    }

    /**
     * @param cellIndex Arena index of a cell
     * @return True if the cell's inputs have already been expanded in this walk.
     */
    boolean isVisited(int cellIndex) {
        return cellsVisited.get(cellIndex);
    }
}
