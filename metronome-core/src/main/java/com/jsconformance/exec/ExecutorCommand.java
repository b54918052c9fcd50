package com.jsconformance.exec;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds executor command lines.
 */
public final class ExecutorCommand {

    static final List<String> BASE_HARNESS_FILES = List.of("assert.js", "sta.js");
    static final String ASYNC_HARNESS_FILE = "doneprintHandle.js";

    private ExecutorCommand() {
    }

    /**
     * {@code <executor> [-b] [--parse-only] --harness-location <dir> -t <seconds>}; test paths
     * are streamed on stdin.
     */
    public static List<String> batch(ExecutorOptions options) {
        List<String> command = new ArrayList<>();
        command.add(options.executable().toString());
        if (options.useBytecode()) {
            command.add("-b");
        }
        if (options.parseOnly()) {
            command.add("--parse-only");
        }
        command.add("--harness-location");
        command.add(options.harnessDir().toString());
        command.add("-t");
        command.add(Long.toString(Math.max(1, options.timeout().toSeconds())));
        return withMemoryLimit(command, options.memoryLimitMb());
    }

    /**
     * {@code <executor> [-b] <harness files...>}; the test source is written to stdin.
     */
    public static List<String> direct(ExecutorOptions options, List<String> harnessFiles) {
        List<String> command = new ArrayList<>();
        command.add(options.executable().toString());
        if (options.useBytecode()) {
            command.add("-b");
        }
        Path harnessDir = options.harnessDir();
        for (String file : harnessFiles) {
            command.add(harnessDir.resolve(file).toAbsolutePath().normalize().toString());
        }
        return withMemoryLimit(command, options.memoryLimitMb());
    }

    /**
     * Harness scripts a direct-mode run loads before the test, relative to the harness directory.
     */
    public static List<String> harnessFiles(List<String> includes, boolean async, boolean raw) {
        if (raw) {
            return List.of();
        }
        List<String> files = new ArrayList<>(BASE_HARNESS_FILES);
        files.addAll(includes);
        if (async) {
            files.add(ASYNC_HARNESS_FILE);
        }
        return files;
    }

    /**
     * Wraps the command so the ceiling is set by the shell before the executor starts.
     */
    static List<String> withMemoryLimit(List<String> command, int memoryLimitMb) {
        if (memoryLimitMb <= 0) {
            return List.copyOf(command);
        }
        long kib = memoryLimitMb * 1024L;
        List<String> wrapped = new ArrayList<>();
        wrapped.add("/bin/sh");
        wrapped.add("-c");
        wrapped.add("ulimit -v " + kib + " && exec \"$0\" \"$@\"");
        wrapped.addAll(command);
        return List.copyOf(wrapped);
    }
}
