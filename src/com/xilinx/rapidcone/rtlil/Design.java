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

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Container of all modules of a design.
 */
public class Design {

    public static final String TOP_ATTRIBUTE = "top";

    private final Map<String, Module> modules;

    private String topModuleName;

    public Design() {
        modules = new LinkedHashMap<>();
    }

    /**
     * Creates a new empty module in this design.
     * @param name Unique module name
     * @return The new module
     */
    public Module addModule(String name) {
        return addModule(new Module(name));
    }

    public Module addModule(Module module) {
        if (modules.containsKey(module.getName())) {
            throw new RuntimeException("ERROR: Design already contains a module named " + module.getName());
        }
        if (module.getDesign() != null && module.getDesign() != this) {
            throw new RuntimeException("ERROR: Module " + module.getName() + " already belongs to another design");
        }
        module.setDesign(this);
        modules.put(module.getName(), module);
        return module;
    }

    public Module getModule(String name) {
        return modules.get(name);
    }

    public boolean hasModule(String name) {
        return modules.containsKey(name);
    }

    public Collection<Module> getModules() {
        return Collections.unmodifiableCollection(modules.values());
    }

    public void setTopModule(String name) {
        if (!modules.containsKey(name)) {
            throw new RuntimeException("ERROR: Can't set top to unknown module " + name);
        }
        topModuleName = name;
    }

    /**
     * Gets the top module: the one explicitly set with {@link #setTopModule(String)},
     * otherwise a module carrying a non-zero 'top' attribute, otherwise the only
     * module of the design.
     * @return The top module or null if it can't be determined.
     */
    public Module getTopModule() {
        if (topModuleName != null) {
            return modules.get(topModuleName);
        }
        for (Module m : modules.values()) {
            String top = m.getAttribute(TOP_ATTRIBUTE);
            if (top != null && !top.replace("0", "").isEmpty()) {
                return m;
            }
        }
        if (modules.size() == 1) {
            return modules.values().iterator().next();
        }
        return null;
    }
}
