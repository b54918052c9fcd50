package com.jsconformance.exec;

import java.io.IOException;
import java.util.List;

/**
 * Starts executor processes.
 */
public interface ProcessLauncher {

    Process launch(List<String> command, boolean redirectErrorStream) throws IOException;

    /**
     * Kills a process that is no longer wanted.
     */
    default void terminate(Process process) {
        process.destroyForcibly();
    }

    /**
     * Called once the caller is done with a process, whether it exited or was terminated.
     */
    default void release(Process process) {
    }

    /**
     * Kills every process this launcher started that is still running. Launchers that
     * do not track their processes have nothing to kill.
     */
    default void destroyAll() {
    }
}
