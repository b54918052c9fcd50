package com.jsconformance;

import com.jsconformance.classify.NegativePhasePolicy;
import com.jsconformance.exec.BatchRecoveryLoop;
import com.jsconformance.exec.ExecutorOptions;
import com.jsconformance.model.ConfigurationException;

import java.util.Objects;
import java.util.Set;

/**
 * Settings for one conformance run.
 *
 * @param executor            how to invoke the executor
 * @param concurrency         worker thread count
 * @param batchSize           files per executor invocation in batch mode
 * @param maxProtocolRetries  retries of a slice whose output could not be matched
 * @param forwardDiagnostics  log executor stderr after each invocation
 * @param direct              one process per test and mode instead of batches
 * @param trackPerFile        keep the outcome of every file
 * @param unsupportedFeatures features whose tests are skipped
 * @param negativePhasePolicy how negative phases map onto executor error phases
 */
public record RunnerConfig(
    ExecutorOptions executor,
    int concurrency,
    int batchSize,
    int maxProtocolRetries,
    boolean forwardDiagnostics,
    boolean direct,
    boolean trackPerFile,
    Set<String> unsupportedFeatures,
    NegativePhasePolicy negativePhasePolicy
) {

    public static final Set<String> DEFAULT_UNSUPPORTED_FEATURES = Set.of("IsHTMLDDA");

    public RunnerConfig {
        Objects.requireNonNull(executor, "executor");
        if (concurrency <= 0) {
            throw new ConfigurationException("concurrency must be > 0, got " + concurrency);
        }
        if (batchSize <= 0) {
            throw new ConfigurationException("batch size must be > 0, got " + batchSize);
        }
        if (maxProtocolRetries < 0) {
            throw new ConfigurationException("protocol retries must be >= 0, got " + maxProtocolRetries);
        }
        unsupportedFeatures = Set.copyOf(Objects.requireNonNull(unsupportedFeatures, "unsupportedFeatures"));
        Objects.requireNonNull(negativePhasePolicy, "negativePhasePolicy");
    }

    public static RunnerConfig defaults(ExecutorOptions executor) {
        return new RunnerConfig(
            executor,
            Runtime.getRuntime().availableProcessors(),
            BatchRecoveryLoop.DEFAULT_BATCH_SIZE,
            BatchRecoveryLoop.DEFAULT_PROTOCOL_RETRIES,
            false,
            false,
            false,
            DEFAULT_UNSUPPORTED_FEATURES,
            NegativePhasePolicy.DEFAULT);
    }

    public RunnerConfig withConcurrency(int concurrency) {
        return new RunnerConfig(executor, concurrency, batchSize, maxProtocolRetries, forwardDiagnostics,
            direct, trackPerFile, unsupportedFeatures, negativePhasePolicy);
    }

    public RunnerConfig withBatchSize(int batchSize) {
        return new RunnerConfig(executor, concurrency, batchSize, maxProtocolRetries, forwardDiagnostics,
            direct, trackPerFile, unsupportedFeatures, negativePhasePolicy);
    }

    public RunnerConfig withDirect(boolean direct) {
        return new RunnerConfig(executor, concurrency, batchSize, maxProtocolRetries, forwardDiagnostics,
            direct, trackPerFile, unsupportedFeatures, negativePhasePolicy);
    }

    public RunnerConfig withTrackPerFile(boolean trackPerFile) {
        return new RunnerConfig(executor, concurrency, batchSize, maxProtocolRetries, forwardDiagnostics,
            direct, trackPerFile, unsupportedFeatures, negativePhasePolicy);
    }

    public RunnerConfig withForwardDiagnostics(boolean forwardDiagnostics) {
        return new RunnerConfig(executor, concurrency, batchSize, maxProtocolRetries, forwardDiagnostics,
            direct, trackPerFile, unsupportedFeatures, negativePhasePolicy);
    }
}
