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

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Static helpers to build and query netlists.
 */
public class RTLILTools {

    private static final Pattern BUS_PATTERN = Pattern.compile("^(.*)\\[\\s*(-?\\d+)\\s*(?::\\s*(-?\\d+)\\s*)?\\]$");

    /**
     * Resolves a signal name as written in HDL to the bits it refers to.  Accepted
     * forms are 'name' (the whole wire), 'name[i]' (a single bit) and 'name[a:b]'
     * (a range, in either direction).  A wire whose own name contains brackets is
     * found before any bus interpretation is attempted.
     *
     * @param module The module to search
     * @param name The signal name
     * @return The signal, least significant bit first, or null if no such wire or
     *         bit exists.
     */
    public static SigSpec getSigSpecFromName(Module module, String name) {
        Wire w = module.getWire(name);
        if (w != null) {
            return new SigSpec(w);
        }
        Matcher m = BUS_PATTERN.matcher(name);
        if (!m.matches()) {
            return null;
        }
        w = module.getWire(m.group(1));
        if (w == null) {
            return null;
        }
        int first;
        int last;
        try {
            first = Integer.parseInt(m.group(2));
            last = m.group(3) == null ? first : Integer.parseInt(m.group(3));
        } catch (NumberFormatException e) {
            // Index doesn't fit an int, so it can't name a bit of the wire
            return null;
        }
        int offFirst = w.getOffsetFromIndex(first);
        int offLast = w.getOffsetFromIndex(last);
        if (offFirst < 0 || offLast < 0) {
            return null;
        }
        int lo = Math.min(offFirst, offLast);
        int hi = Math.max(offFirst, offLast);
        return new SigSpec(w, lo, hi - lo + 1);
    }

    /**
     * Resolves a signal name that must denote exactly one bit.
     * @param module The module to search
     * @param name The signal name, e.g. 'q' or 'data[3]'
     * @return The bit or null if the name doesn't resolve to a single bit.
     */
    public static SigBit getSigBitFromName(Module module, String name) {
        SigSpec sig = getSigSpecFromName(module, name);
        if (sig == null || sig.size() != 1) {
            return null;
        }
        return sig.get(0);
    }

    /**
     * Adds a cell with ports A and Y, e.g. '$not' or '$_BUF_'.
     */
    public static Cell addUnaryCell(Module module, String name, String type, SigSpec a, SigSpec y) {
        Cell c = module.addCell(name, type);
        c.setPort("A", a);
        c.setPort("Y", y);
        return c;
    }

    /**
     * Adds a cell with ports A, B and Y, e.g. '$and' or '$_XOR_'.
     */
    public static Cell addBinaryCell(Module module, String name, String type, SigSpec a, SigSpec b, SigSpec y) {
        Cell c = module.addCell(name, type);
        c.setPort("A", a);
        c.setPort("B", b);
        c.setPort("Y", y);
        return c;
    }

    /**
     * Adds a multiplexer cell (ports A, B, S and Y), e.g. '$mux' or '$_MUX_'.
     */
    public static Cell addMuxCell(Module module, String name, String type, SigSpec a, SigSpec b, SigSpec s,
                                  SigSpec y) {
        Cell c = module.addCell(name, type);
        c.setPort("A", a);
        c.setPort("B", b);
        c.setPort("S", s);
        c.setPort("Y", y);
        return c;
    }

    /**
     * Adds a positive-edge gate-level flip-flop ('$_DFF_P_', ports C, D and Q).
     */
    public static Cell addDffCell(Module module, String name, SigSpec clk, SigSpec d, SigSpec q) {
        Cell c = module.addCell(name, "$_DFF_P_");
        c.setPort("C", clk);
        c.setPort("D", d);
        c.setPort("Q", q);
        return c;
    }
}
