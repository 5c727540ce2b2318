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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Common ancestor of named netlist objects ({@link Module}, {@link Wire},
 * {@link Cell}).  Manages the object name and its attribute map.
 * Attribute values are kept in the textual form they were read with.
 *
 * Objects are compared by identity: two wires of the same name living in
 * different modules are different objects.
 */
public abstract class RTLILObject {

    /** Name of the object */
    private final String name;

    private Map<String, String> attributes;

    protected RTLILObject(String name) {
        if (name == null) {
            throw new RuntimeException("ERROR: Netlist objects require a non-null name.");
        }
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * Names created by a tool rather than a designer start with '$'.
     * @return True if this is an auto-generated (hidden) name.
     */
    public boolean isAutoNamed() {
        return name.startsWith("$");
    }

    /**
     * Adds or replaces an attribute on this object.
     * @param key Attribute name
     * @param value Attribute value
     * @return The previous value stored under key, or null if there was none
     */
    public String addAttribute(String key, String value) {
        if (attributes == null) attributes = new LinkedHashMap<>(2);
        return attributes.put(key, value);
    }

    /**
     * @param key Attribute name
     * @return The attribute value or null if it isn't set.
     */
    public String getAttribute(String key) {
        return attributes == null ? null : attributes.get(key);
    }

    public boolean hasAttribute(String key) {
        return attributes != null && attributes.containsKey(key);
    }

    public Map<String, String> getAttributes() {
        return attributes == null ? Collections.emptyMap() : Collections.unmodifiableMap(attributes);
    }

    @Override
    public String toString() {
        return name;
    }
}
