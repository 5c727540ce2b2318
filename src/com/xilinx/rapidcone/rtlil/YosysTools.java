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

import java.nio.file.FileSystems;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import com.xilinx.rapidcone.util.FileTools;
import com.xilinx.rapidcone.util.Params;

/**
 * Runs Yosys to turn HDL sources into a netlist that {@link YosysJSONReader}
 * can load.
 */
public class YosysTools {

    public static final String PREP = "prep";

    public static final String PREP_FLAG_FLATTEN = " -flatten";

    public static final String WRITE_JSON = "write_json";

    public static final String OUTPUT_JSON = "output.json";

    public static String getYosysExec() {
        return Params.RC_YOSYS_EXEC;
    }

    public static boolean isYosysOnPath() {
        return FileTools.isExecutableOnPath(getYosysExec());
    }

    /**
     * Run the given command string in Yosys, on the files given.
     * @param command Yosys command(s), separated by ';'
     * @param workDir Working directory
     * @param paths Path objects of input files
     */
    public static void run(String command, Path workDir, Path... paths) {
        List<String> exec = new ArrayList<>();
        exec.add(getYosysExec());
        exec.add("-p");
        exec.add(command);
        for (Path path : paths) {
            exec.add(path.toAbsolutePath().toString());
        }

        Integer exitCode = FileTools.runCommand(exec.toArray(new String[0]), Params.RC_VERBOSE, workDir.toFile());
        if (exitCode == null || exitCode != 0) {
            throw new RuntimeException("ERROR: Yosys exited with code: " + exitCode);
        }
    }

    /**
     * Call Yosys' 'prep' command with the given flags on the files given and
     * load the result.
     * @param flags String with flags to be provided to 'prep', e.g. ' -top foo'.
     * @param workDir Working directory, receives '{@value #OUTPUT_JSON}'
     * @param paths Path objects of input files
     * @return The design
     */
    public static Design prepWithWorkDir(String flags, Path workDir, Path... paths) {
        final Path json = workDir.resolve(OUTPUT_JSON).toAbsolutePath();
        String command = PREP + flags + "; " + WRITE_JSON + " " + json;
        run(command, workDir, paths);
        return YosysJSONReader.readJSONFile(json);
    }

    /**
     * Call Yosys' 'prep' command (with automatic top detection) on the files given.
     * @param workDir Working directory
     * @param paths Path objects of input files
     * @return The design
     */
    public static Design prepWithWorkDir(Path workDir, Path... paths) {
        return prepWithWorkDir("", workDir, paths);
    }

    /**
     * Same as {@link #prepWithWorkDir(String, Path, Path...)} using a temporary
     * working directory that is removed afterwards.
     */
    public static Design prep(String flags, Path... paths) {
        final Path workDir = FileSystems.getDefault()
                .getPath("yosysToolsWorkdir" + FileTools.getUniqueProcessAndHostID()).toAbsolutePath();
        workDir.toFile().mkdirs();
        try {
            return prepWithWorkDir(flags, workDir, paths);
        } finally {
            FileTools.deleteFolder(workDir.toString());
        }
    }
}
