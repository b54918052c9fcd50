package com.jsconformance.exec;

import com.jsconformance.classify.ExecutionResult;
import com.jsconformance.classify.ExecutionResultDecoder;
import com.jsconformance.classify.OutcomeClassifier;
import com.jsconformance.metadata.MetadataExtractor;
import com.jsconformance.model.ConfigurationException;
import com.jsconformance.model.ExecutionMode;
import com.jsconformance.model.TestFile;
import com.jsconformance.model.TestMetadata;
import com.jsconformance.model.TestOutcome;
import com.jsconformance.model.TestRun;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs one test at a time, one executor process per execution mode.
 *
 * The harness scripts are passed on the command line and the test source on stdin;
 * the executor prints a single JSON document describing the run.
 */
public class DirectTestRunner {

    static final String USE_STRICT = "\"use strict\";\n";

    private static final Duration STREAM_GRACE = Duration.ofSeconds(5);

    private final ExecutorOptions options;
    private final ProcessLauncher launcher;
    private final MetadataExtractor extractor;
    private final OutcomeClassifier classifier;
    private final ExecutionResultDecoder decoder;

    public DirectTestRunner(
            ExecutorOptions options,
            ProcessLauncher launcher,
            MetadataExtractor extractor,
            OutcomeClassifier classifier,
            ExecutionResultDecoder decoder) {
        this.options = Objects.requireNonNull(options, "options");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.decoder = Objects.requireNonNull(decoder, "decoder");
    }

    /**
     * Runs {@code file} in every mode its flags call for. Strict runs first; a strict run
     * that does not pass decides the outcome and the sloppy run is skipped.
     *
     * Unexpected failures become {@link TestOutcome#RUNNER_EXCEPTION}; configuration
     * errors and interruption propagate.
     */
    public TestRun run(TestFile file) throws InterruptedException {
        try {
            Optional<TestMetadata> metadata = extractor.extract(file.path());
            Optional<TestOutcome> preflight = classifier.preflight(metadata.orElse(null));
            if (preflight.isPresent()) {
                return TestRun.of(file, preflight.get());
            }

            String source = new String(Files.readAllBytes(file.path()), StandardCharsets.UTF_8);
            TestRun last = null;
            for (ExecutionMode mode : metadata.get().modeSelection().modes()) {
                last = runMode(file, metadata.get(), source, mode);
                if (!last.outcome().isPassed()) {
                    return last;
                }
            }
            return last;
        } catch (ConfigurationException | InterruptedException e) {
            throw e;
        } catch (Exception e) {
            return TestRun.of(file, TestOutcome.RUNNER_EXCEPTION, BatchRecoveryLoop.stackTrace(e));
        }
    }

    TestRun runMode(TestFile file, TestMetadata metadata, String source, ExecutionMode mode)
            throws IOException, InterruptedException {
        List<String> harness = ExecutorCommand.harnessFiles(metadata.includes(), metadata.isAsync(), metadata.isRaw());
        String script = mode.isStrict() ? USE_STRICT + source : source;

        Process process = launcher.launch(ExecutorCommand.direct(options, harness), true);
        try {
            StreamPumps.feed(process.getOutputStream(), script.getBytes(StandardCharsets.UTF_8));
            CompletableFuture<String> stdout = StreamPumps.drain(process.getInputStream());

            if (!process.waitFor(options.timeout().toMillis(), TimeUnit.MILLISECONDS)) {
                launcher.terminate(process);
                return new TestRun(file, TestOutcome.TIMEOUT_ERROR, null, null, mode.isStrict());
            }

            String output = StreamPumps.join(stdout, STREAM_GRACE).strip();
            int exitCode = process.exitValue();
            if (exitCode != 0) {
                return new TestRun(file, TestOutcome.PROCESS_ERROR, output, exitCode, mode.isStrict());
            }

            ExecutionResult result = decoder.decode(output);
            TestOutcome outcome = classifier.classify(metadata, result);
            return new TestRun(file, outcome, output, exitCode, mode.isStrict());
        } catch (InterruptedException e) {
            launcher.terminate(process);
            throw e;
        } finally {
            launcher.release(process);
        }
    }
}
