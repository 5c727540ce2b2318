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
import java.util.NoSuchElementException;

import com.xilinx.rapidcone.rtlil.Cell;
import com.xilinx.rapidcone.rtlil.SigBit;

/**
 * Lazy walk over the known cells in the combinational fan-in of a canonical
 * bit, each returned exactly once in the order the underlying
 * {@link ConeBitIterator} discovers them.  The driver of the start bit, if any,
 * comes first.
 *
 * A cell is returned when the bit walk reaches a bit whose driver has not been
 * expanded yet; the bit walk's own visited set is what prevents a second
 * report.
 */
public class ConeCellIterator implements Iterator<Cell> {

    private final Netlist net;

    private final ConeBitIterator sigIter;

    private boolean started;

    private boolean finished;

    private Integer nextCell;

    /**
     * @param net The driver index to walk
     * @param start A canonical bit
     */
    public ConeCellIterator(Netlist net, SigBit start) {
        this.net = net;
        this.sigIter = new ConeBitIterator(net, start);
    }

    private Integer getFreshDriver(SigBit bit) {
        Integer drv = net.getDriverIndex(bit);
        if (drv == null || sigIter.isVisited(drv)) return null;
        return drv;
    }

    private void findNext() {
        if (!started) {
            started = true;
            nextCell = getFreshDriver(sigIter.getCurrent());
            if (nextCell != null) return;
        }
        while (sigIter.step()) {
            nextCell = getFreshDriver(sigIter.getCurrent());
            if (nextCell != null) return;
        }
        finished = true;
    }

    @Override
    public boolean hasNext() {
        if (nextCell == null && !finished) {
            findNext();
        }
        return nextCell != null;
    }

    @Override
    public Cell next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        Cell cell = net.getModule().getCell(nextCell);
        nextCell = null;
        return cell;
    }
}
