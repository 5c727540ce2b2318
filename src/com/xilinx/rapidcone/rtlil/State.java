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
 * The value of a constant signal bit.
 */
public enum State {
    S0('0'),
    S1('1'),
    Sx('x'),
    Sz('z');

    private final char c;

    State(char c) {
        this.c = c;
    }

    public char toChar() {
        return c;
    }

    /**
     * Parses a constant bit from its character form ('0', '1', 'x' or 'z',
     * case-insensitive).
     * @param c Character to parse.
     * @return The matching state.
     */
    public static State getEnum(char c) {
        switch (Character.toLowerCase(c)) {
            case '0': return S0;
            case '1': return S1;
            case 'x': return Sx;
            case 'z': return Sz;
            default:
                throw new RuntimeException("ERROR: Unrecognized constant bit value '" + c + "'");
        }
    }

    public static State getEnum(String s) {
        if (s == null || s.length() != 1) {
            throw new RuntimeException("ERROR: Unrecognized constant bit value '" + s + "'");
        }
        return getEnum(s.charAt(0));
    }

    @Override
    public String toString() {
        return String.valueOf(c);
    }
}
