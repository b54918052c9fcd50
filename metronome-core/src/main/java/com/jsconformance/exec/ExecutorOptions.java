package com.jsconformance.exec;

import com.jsconformance.model.ConfigurationException;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * How the external executor binary is invoked.
 *
 * @param executable    path of the executor binary
 * @param harnessDir    directory holding the test262 harness scripts
 * @param useBytecode   run tests on the bytecode interpreter instead of the legacy AST interpreter
 * @param parseOnly     only parse the tests (batch mode)
 * @param timeout       time allowed per test
 * @param memoryLimitMb address-space ceiling applied to each child, 0 for none
 */
public record ExecutorOptions(
    Path executable,
    Path harnessDir,
    boolean useBytecode,
    boolean parseOnly,
    Duration timeout,
    int memoryLimitMb
) {

    public ExecutorOptions {
        Objects.requireNonNull(executable, "executable");
        Objects.requireNonNull(harnessDir, "harnessDir");
        Objects.requireNonNull(timeout, "timeout");
        if (timeout.isNegative() || timeout.isZero()) {
            throw new ConfigurationException("timeout must be > 0");
        }
        if (memoryLimitMb < 0) {
            throw new ConfigurationException("memoryLimitMb must be >= 0");
        }
    }

    /**
     * Wall-clock budget for one batch invocation covering {@code batchSize} tests.
     */
    public Duration batchTimeout(int batchSize) {
        return timeout.multipliedBy(Math.max(1, batchSize));
    }

    public boolean hasMemoryLimit() {
        return memoryLimitMb > 0;
    }
}
