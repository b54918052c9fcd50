package com.jsconformance.exec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledOnOs;
import org.junit.jupiter.api.condition.OS;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

@EnabledOnOs({OS.LINUX, OS.MAC})
class ProcessGroupTest {

    @Test
    void destroyAllKillsTrackedProcessesAndRefusesNewOnes() throws Exception {
        ProcessGroup group = new ProcessGroup();
        Process sleeper = group.launch(List.of("/bin/sh", "-c", "sleep 30"), true);
        assertEquals(1, group.liveCount());

        group.destroyAll();

        assertTrue(sleeper.waitFor(10, TimeUnit.SECONDS), "process should be dead");
        assertTrue(group.isClosed());
        assertEquals(0, group.liveCount());
        assertThrows(IOException.class, () -> group.launch(List.of("/bin/sh", "-c", "true"), true));
    }

    @Test
    void releasedProcessesAreNoLongerTracked() throws Exception {
        try (ProcessGroup group = new ProcessGroup()) {
            Process quick = group.launch(List.of("/bin/sh", "-c", "exit 3"), true);
            assertEquals(3, quick.waitFor());

            group.release(quick);

            assertEquals(0, group.liveCount());
        }
    }

    @Test
    void memoryLimitWrapperStillRunsTheCommand() throws Exception {
        try (ProcessGroup group = new ProcessGroup()) {
            List<String> command = ExecutorCommand.withMemoryLimit(List.of("/bin/sh", "-c", "exit 7"), 512);
            Process process = group.launch(command, true);

            assertEquals(7, process.waitFor());
        }
    }
}
