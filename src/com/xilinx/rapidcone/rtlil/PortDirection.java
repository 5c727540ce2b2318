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
 * Provides basic directional options for module and cell ports.
 */
public enum PortDirection {
    INPUT,
    OUTPUT,
    INOUT;

    /**
     * Parses a direction as written by Yosys ('input', 'output', 'inout'),
     * case-insensitive.  'bidir' is accepted for inout.
     * @param s The direction string
     * @return The matching direction
     */
    public static PortDirection getEnum(String s) {
        String upper = s == null ? "" : s.toUpperCase();
        if (upper.equals("BIDIR")) return INOUT;
        try {
            return valueOf(upper);
        } catch (IllegalArgumentException e) {
            throw new RuntimeException("ERROR: Unrecognized port direction '" + s + "'");
        }
    }

    public boolean isInput() {
        return this != OUTPUT;
    }

    public boolean isOutput() {
        return this != INPUT;
    }
}
