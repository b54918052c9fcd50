package com.jsconformance.exec;

import com.jsconformance.model.TestFile;
import com.jsconformance.model.TestRun;

import java.util.List;
import java.util.Objects;

/**
 * What one executor invocation produced for a batch.
 *
 * @param runs            runs for a prefix of the batch, in submission order
 * @param stoppedByResult the executor reported a stopping result (timeout, assertion failure)
 * @param processFailure  the last run was synthesized because the executor died or hung
 *                        without reporting on that file
 * @param exitCode        exit status of the executor, {@code null} if it was killed before exiting
 * @param diagnostics     stderr and any unrecognised trailing output
 * @param lastMatched     the last file the executor reported on, {@code null} if none
 */
public record BatchResult(
    List<TestRun> runs,
    boolean stoppedByResult,
    boolean processFailure,
    Integer exitCode,
    String diagnostics,
    TestFile lastMatched
) {

    public BatchResult {
        runs = List.copyOf(Objects.requireNonNull(runs, "runs"));
        diagnostics = diagnostics == null ? "" : diagnostics;
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isBlank();
    }
}
