package com.jsconformance.exec;

import com.jsconformance.model.TestFile;

import java.io.IOException;
import java.util.List;

/**
 * Runs a batch of tests through a single executor invocation.
 */
@FunctionalInterface
public interface BatchExecutor {

    /**
     * @return runs for a non-empty prefix of {@code batch}
     * @throws IOException                 if the executor cannot be started
     * @throws ProtocolViolationException  if the executor's output does not match the batch
     */
    BatchResult execute(List<TestFile> batch) throws IOException, InterruptedException;
}
