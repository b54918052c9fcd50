package com.jsconformance.exec;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Launches executor processes and keeps track of every one still running, so that a
 * single call can take down all of them together with their descendants.
 */
public class ProcessGroup implements ProcessLauncher, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProcessGroup.class);

    private final Set<Process> processes = ConcurrentHashMap.newKeySet();
    private volatile boolean closed;

    @Override
    public Process launch(List<String> command, boolean redirectErrorStream) throws IOException {
        if (closed) {
            throw new IOException("Process group is shut down");
        }
        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(redirectErrorStream);
        Process process = builder.start();
        processes.add(process);
        // destroyAll() may have run between the check above and the add
        if (closed) {
            terminate(process);
        }
        return process;
    }

    @Override
    public void terminate(Process process) {
        try {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
        } catch (UnsupportedOperationException e) {
            log.debug("Cannot enumerate descendants of {}", process, e);
        }
        process.destroyForcibly();
    }

    @Override
    public void release(Process process) {
        processes.remove(process);
    }

    /**
     * Forcibly kills every tracked process tree. No further processes can be launched.
     */
    @Override
    public void destroyAll() {
        closed = true;
        int count = 0;
        for (Process process : processes) {
            terminate(process);
            count++;
        }
        processes.clear();
        if (count > 0) {
            log.info("Killed {} executor process(es)", count);
        }
    }

    public int liveCount() {
        return processes.size();
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Registers {@link #destroyAll()} to run on JVM shutdown, including SIGINT/SIGTERM.
     */
    public Thread installShutdownHook() {
        Thread hook = new Thread(this::destroyAll, "process-group-cleanup");
        Runtime.getRuntime().addShutdownHook(hook);
        return hook;
    }

    @Override
    public void close() {
        destroyAll();
    }
}
