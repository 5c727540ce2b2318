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
 * A module-level connection, equivalent to 'assign lhs = rhs;'.
 */
public class SigSig {

    private final SigSpec lhs;

    private final SigSpec rhs;

    public SigSig(SigSpec lhs, SigSpec rhs) {
        if (lhs.size() != rhs.size()) {
            throw new RuntimeException("ERROR: Can't connect " + lhs + " (" + lhs.size() + " bits) to "
                    + rhs + " (" + rhs.size() + " bits)");
        }
        this.lhs = lhs;
        this.rhs = rhs;
    }

    public SigSpec getLhs() {
        return lhs;
    }

    public SigSpec getRhs() {
        return rhs;
    }

    @Override
    public String toString() {
        return "assign " + lhs + " = " + rhs + ";";
    }
}
