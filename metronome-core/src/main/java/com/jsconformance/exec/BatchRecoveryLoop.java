package com.jsconformance.exec;

import com.jsconformance.model.TestFile;
import com.jsconformance.model.TestOutcome;
import com.jsconformance.model.TestRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Drives a whole work-list through a {@link BatchExecutor}, even though a single
 * executor invocation may only get partway through before crashing or hanging.
 *
 * A crash costs exactly one file: the executor reports it as a process error and the
 * loop resumes with the file after it. There is no limit on crash cycles; a corpus that
 * crashes on every file degrades to one invocation per file.
 */
public class BatchRecoveryLoop {

    private static final Logger log = LoggerFactory.getLogger(BatchRecoveryLoop.class);

    public static final int DEFAULT_BATCH_SIZE = 50;
    public static final int DEFAULT_PROTOCOL_RETRIES = 2;

    enum State {
        RUNNING,
        RECOVERING_FROM_CRASH
    }

    /**
     * Counters describing how a work-list was driven.
     */
    public record Stats(int invocations, int crashes, int protocolViolations) {
    }

    private final BatchExecutor executor;
    private final int batchSize;
    private final int maxProtocolRetries;
    private final boolean forwardDiagnostics;

    public BatchRecoveryLoop(BatchExecutor executor, int batchSize, int maxProtocolRetries, boolean forwardDiagnostics) {
        this.executor = Objects.requireNonNull(executor, "executor");
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be > 0");
        }
        if (maxProtocolRetries < 0) {
            throw new IllegalArgumentException("maxProtocolRetries must be >= 0");
        }
        this.batchSize = batchSize;
        this.maxProtocolRetries = maxProtocolRetries;
        this.forwardDiagnostics = forwardDiagnostics;
    }

    /**
     * Runs every file of {@code workList}, handing each run to {@code sink} in order.
     *
     * @throws ProtocolViolationException if the executor keeps desynchronising on the same slice
     * @throws InterruptedException       if the worker is interrupted; runs already handed to
     *                                    the sink stay valid
     */
    public Stats run(List<TestFile> workList, Consumer<TestRun> sink) throws InterruptedException {
        int cursor = 0;
        State state = State.RUNNING;
        int consecutiveViolations = 0;
        int invocations = 0;
        int crashes = 0;
        int violations = 0;

        while (cursor < workList.size()) {
            if (Thread.interrupted()) {
                throw new InterruptedException("Interrupted at " + workList.get(cursor));
            }
            if (state == State.RECOVERING_FROM_CRASH) {
                log.debug("Resuming after crash at {} ({} remaining)", workList.get(cursor),
                    workList.size() - cursor);
                state = State.RUNNING;
            }

            List<TestFile> slice = workList.subList(cursor, Math.min(cursor + batchSize, workList.size()));
            BatchResult result;
            try {
                invocations++;
                result = executor.execute(slice);
                consecutiveViolations = 0;
            } catch (ProtocolViolationException e) {
                violations++;
                consecutiveViolations++;
                log.error("Protocol violation running batch starting at {} (attempt {} of {}): {}",
                    slice.get(0), consecutiveViolations, maxProtocolRetries + 1, e.getMessage());
                if (consecutiveViolations > maxProtocolRetries) {
                    throw e;
                }
                continue;
            } catch (IOException e) {
                log.warn("Could not run executor for batch starting at {}", slice.get(0), e);
                sink.accept(TestRun.of(slice.get(0), TestOutcome.RUNNER_EXCEPTION, stackTrace(e)));
                cursor++;
                crashes++;
                state = State.RECOVERING_FROM_CRASH;
                continue;
            }

            if (result.runs().isEmpty()) {
                throw new IllegalStateException("Executor made no progress on batch starting at " + slice.get(0));
            }

            if (forwardDiagnostics && result.hasDiagnostics()) {
                TestFile tag = result.lastMatched();
                log.warn("Executor diagnostics after {}:\n{}", tag == null ? "<no result>" : tag,
                    result.diagnostics());
            }

            for (TestRun run : result.runs()) {
                sink.accept(run);
                cursor++;
            }

            if (result.processFailure()) {
                crashes++;
                state = State.RECOVERING_FROM_CRASH;
                TestRun sacrificed = result.runs().get(result.runs().size() - 1);
                log.warn("Executor failed on {} ({}), continuing with the next file",
                    sacrificed.file(), sacrificed.outcome());
            }
        }
        return new Stats(invocations, crashes, violations);
    }

    static String stackTrace(Throwable throwable) {
        StringWriter writer = new StringWriter();
        throwable.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
