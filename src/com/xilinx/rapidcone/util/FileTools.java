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
import java.io.IOException;
import java.io.UncheckedIOException;
import java.lang.ProcessBuilder.Redirect;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;

/**
 * A collection of file and process helpers.
 */
public class FileTools {

    /**
     * Writes the provided text to the named file, followed by a line separator.
     * @param text The text to write.
     * @param fileName Name of the file to create or overwrite.
     */
    public static void writeStringToTextFile(String text, String fileName) {
        try {
            Files.write(Paths.get(fileName), (text + System.lineSeparator()).getBytes(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new UncheckedIOException("Error writing file: " + fileName + " " + e.getMessage(), e);
        }
    }

    /**
     * Reads the entire contents of a UTF-8 text file.
     * @param path The file to read.
     * @return The file contents.
     */
    public static String readFileToString(Path path) {
        try {
            return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("ERROR: Couldn't read file " + path, e);
        }
    }

    /**
     * Recursively deletes a folder and all of its contents.
     * @param folderName Name of the folder to delete.
     * @return True if the folder was removed, false otherwise.
     */
    public static boolean deleteFolder(String folderName) {
        File f = new File(folderName);
        if (!f.exists() || !f.isDirectory()) {
            MessageGenerator.warning("Attempted to delete folder " + folderName + " but it wasn't there.");
            return false;
        }
        File[] children = f.listFiles();
        if (children != null) {
            for (File i : children) {
                if (i.isDirectory()) {
                    deleteFolder(i.getAbsolutePath());
                } else if (!i.delete()) {
                    throw new IllegalArgumentException("Delete: deletion failed: " + i.getAbsolutePath());
                }
            }
        }
        return f.delete();
    }

    public static boolean isWindows() {
        return System.getProperty("os.name", "").startsWith("Windows");
    }

    /**
     * Checks if the named executable can be found in one of the directories of
     * the current PATH.  An absolute or relative path to an executable file is
     * also accepted.
     * @param execName Name of the executable
     * @return True if the executable was found, false otherwise.
     */
    public static boolean isExecutableOnPath(String execName) {
        if (execName.contains(File.separator)) {
            return new File(execName).canExecute();
        }
        String path = System.getenv("PATH");
        if (path == null) return false;
        String[] suffixes = isWindows() ? new String[] {"", ".exe", ".bat"} : new String[] {""};
        for (String dir : path.split(File.pathSeparator)) {
            for (String suffix : suffixes) {
                File candidate = new File(dir, execName + suffix);
                if (candidate.isFile() && candidate.canExecute()) {
                    return true;
                }
            }
        }
        return false;
    }

    /**
     * A generic method to run a command from the system command line.
     *
     * @param command The command and its arguments. This method blocks until the
     *                command finishes.
     * @param verbose When true, it will first print to std.out the command and let
     *                the command write to this process' std.out and std.err.
     *                Otherwise the command's output is discarded.
     * @param runDir  the working directory of the subprocess, or null if the
     *                subprocess should inherit the working directory of the current
     *                process.
     * @return The return value of the process if it terminated, if there was a
     *         problem it returns null.
     */
    public static Integer runCommand(String[] command, boolean verbose, File runDir) {
        if (verbose) System.out.println(String.join(" ", command));
        ProcessBuilder pb = new ProcessBuilder(Arrays.asList(command));
        if (runDir != null) pb.directory(runDir);
        if (verbose) {
            pb.inheritIO();
        } else {
            pb.redirectOutput(Redirect.DISCARD);
            pb.redirectError(Redirect.DISCARD);
        }
        try {
            return pb.start().waitFor();
        } catch (IOException e) {
            e.printStackTrace();
            MessageGenerator.briefError("ERROR: In running the command \"" + String.join(" ", command) + "\"");
            return null;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            MessageGenerator.briefError("ERROR: The command was interrupted: \"" + String.join(" ", command) + "\"");
            return null;
        }
    }

    public static String getUniqueProcessAndHostID() {
        return ManagementFactory.getRuntimeMXBean().getName() + "_" + Thread.currentThread().getId();
    }
}
