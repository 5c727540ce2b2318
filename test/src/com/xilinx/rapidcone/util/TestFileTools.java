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

package com.xilinx.rapidcone.util;

import java.io.File;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class TestFileTools {

    @Test
    public void testWriteAndRead(@TempDir Path dir) {
        Path file = dir.resolve("netlist.txt");
        FileTools.writeStringToTextFile("assign y = a;", file.toString());
        Assertions.assertEquals("assign y = a;" + System.lineSeparator(), FileTools.readFileToString(file));
        Assertions.assertThrows(UncheckedIOException.class,
                () -> FileTools.readFileToString(dir.resolve("missing.txt")));
    }

    @Test
    public void testDeleteFolder(@TempDir Path dir) {
        Path work = dir.resolve("work");
        Assertions.assertTrue(work.resolve("nested").toFile().mkdirs());
        FileTools.writeStringToTextFile("{}", work.resolve("nested").resolve("output.json").toString());
        FileTools.writeStringToTextFile("{}", work.resolve("top.json").toString());

        Assertions.assertTrue(FileTools.deleteFolder(work.toString()));
        Assertions.assertFalse(work.toFile().exists());
        Assertions.assertFalse(FileTools.deleteFolder(work.toString()));
    }

    @Test
    public void testIsExecutableOnPath() {
        Assertions.assertFalse(FileTools.isExecutableOnPath("rapidcone-no-such-executable"));
        Assertions.assertFalse(FileTools.isExecutableOnPath(File.separator + "rapidcone" + File.separator + "none"));
    }

    @Test
    public void testRunCommand(@TempDir Path dir) {
        Assumptions.assumeFalse(FileTools.isWindows());
        Assumptions.assumeTrue(FileTools.isExecutableOnPath("sh"));

        Assertions.assertEquals(0, FileTools.runCommand(new String[] {"sh", "-c", "echo ok > out.txt"}, false,
                dir.toFile()));
        Assertions.assertEquals("ok\n", FileTools.readFileToString(dir.resolve("out.txt")));
        Assertions.assertEquals(3, FileTools.runCommand(new String[] {"sh", "-c", "exit 3"}, false, null));
        Assertions.assertNull(FileTools.runCommand(new String[] {"rapidcone-no-such-executable"}, false, null));
    }
}
