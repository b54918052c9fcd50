package com.jsconformance.exec;

import com.jsconformance.model.ExecutorRecord;
import com.jsconformance.model.TestFile;
import com.jsconformance.model.TestOutcome;
import com.jsconformance.model.TestRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a batch of tests in one executor process.
 *
 * Test paths go to the executor's stdin one per line; its stdout is a sequence of
 * NUL-terminated {@code RESULT <json>} records, matched positionally against the
 * submitted paths. If the executor dies or hangs before reporting on every path and
 * without a stopping result, the next unreported path gets a synthesized
 * {@link TestOutcome#PROCESS_ERROR} (or {@link TestOutcome#TIMEOUT_ERROR} when the
 * watchdog killed it); the rest are left for the caller to resubmit.
 */
public class BatchProtocolClient implements BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchProtocolClient.class);

    private static final Duration STREAM_GRACE = Duration.ofSeconds(5);

    private final ExecutorOptions options;
    private final ProcessLauncher launcher;
    private final RecordDecoder decoder;

    public BatchProtocolClient(ExecutorOptions options, ProcessLauncher launcher, RecordDecoder decoder) {
        this.options = Objects.requireNonNull(options, "options");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    @Override
    public BatchResult execute(List<TestFile> batch) throws IOException, InterruptedException {
        if (batch.isEmpty()) {
            throw new IllegalArgumentException("batch must not be empty");
        }

        Process process = launcher.launch(ExecutorCommand.batch(options), false);
        AtomicBoolean timedOut = new AtomicBoolean();
        ScheduledFuture<?> watchdog = StreamPumps.schedule(() -> {
            timedOut.set(true);
            launcher.terminate(process);
        }, options.batchTimeout(batch.size()));

        try {
            CompletableFuture<Void> input = StreamPumps.feed(process.getOutputStream(), pathList(batch));
            CompletableFuture<String> stderr = StreamPumps.drain(process.getErrorStream());

            BatchRecordStream records = new BatchRecordStream(process.getInputStream(), batch, decoder);
            List<TestRun> runs = new ArrayList<>();
            BatchRecordStream.MatchedRecord matched;
            while ((matched = records.next()) != null) {
                runs.add(toRun(matched.file(), matched.record()));
            }
            // discard anything after the last record so the child never blocks on a full pipe
            StreamPumps.drain(process.getInputStream());

            int exitCode = process.waitFor();
            watchdog.cancel(false);
            input.cancel(false);

            String diagnostics = diagnostics(StreamPumps.join(stderr, STREAM_GRACE), records.trailingText());
            boolean complete = records.matchedCount() == batch.size();
            if (complete || records.stoppedByResult()) {
                return new BatchResult(runs, records.stoppedByResult(), false, exitCode, diagnostics,
                    records.lastMatched());
            }

            TestFile crashed = batch.get(records.matchedCount());
            boolean killed = timedOut.get();
            TestOutcome outcome = killed ? TestOutcome.TIMEOUT_ERROR : TestOutcome.PROCESS_ERROR;
            Integer reportedExit = killed ? null : exitCode;
            log.debug("Executor stopped at {} ({} of {} reported, exit {})",
                crashed, records.matchedCount(), batch.size(), reportedExit);
            runs.add(new TestRun(crashed, outcome, describeFailure(killed, exitCode, diagnostics),
                reportedExit, null));
            return new BatchResult(runs, false, true, reportedExit, diagnostics, records.lastMatched());
        } catch (IOException | InterruptedException | RuntimeException e) {
            // includes protocol violations and failed reads of stdout
            launcher.terminate(process);
            throw e;
        } finally {
            watchdog.cancel(false);
            launcher.release(process);
        }
    }

    private static TestRun toRun(TestFile file, ExecutorRecord record) {
        return new TestRun(file, record.kind().outcome(), record.output(), null, record.strictMode());
    }

    private static byte[] pathList(List<TestFile> batch) {
        StringBuilder lines = new StringBuilder();
        for (TestFile file : batch) {
            lines.append(file.path()).append('\n');
        }
        return lines.toString().getBytes(StandardCharsets.UTF_8);
    }

    private static String diagnostics(String stderr, String trailing) {
        if (trailing.isBlank()) {
            return stderr;
        }
        if (stderr.isBlank()) {
            return trailing;
        }
        return stderr + "\n" + trailing;
    }

    private String describeFailure(boolean killed, int exitCode, String diagnostics) {
        String headline = killed
            ? "Executor exceeded the batch timeout of " + options.timeout().toSeconds() + "s per test"
            : "Executor exited with code " + exitCode + " before reporting this test";
        return diagnostics.isBlank() ? headline : headline + "\n" + diagnostics;
    }
}
