package com.jsconformance;

import com.jsconformance.classify.OutcomeClassifier;
import com.jsconformance.exec.BatchProtocolClient;
import com.jsconformance.exec.BatchRecoveryLoop;
import com.jsconformance.exec.DirectTestRunner;
import com.jsconformance.exec.ProcessLauncher;
import com.jsconformance.exec.WorkPartitioner;
import com.jsconformance.metadata.MetadataExtractor;
import com.jsconformance.model.TestFile;
import com.jsconformance.model.TestOutcome;
import com.jsconformance.model.TestRun;
import com.jsconformance.report.ResultAggregator;
import com.jsconformance.report.RunResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Runs a test262 corpus against an executor.
 *
 * The file list is split into one work-list per worker. In batch mode each worker drives
 * its list through a {@link BatchRecoveryLoop}; in direct mode it runs one file at a time
 * with a {@link DirectTestRunner}. Every run goes into a shared {@link ResultAggregator}.
 *
 * Usage:
 * <pre>
 * ConformanceRunner runner = new ConformanceRunner(config, processGroup, codecs, TestRunListener.NONE);
 * List&lt;TestFile&gt; files = ConformanceRunner.discover(test262Root, null);
 * RunResults results = runner.run(files);
 * </pre>
 */
public class ConformanceRunner {

    private static final Logger log = LoggerFactory.getLogger(ConformanceRunner.class);

    public static final String DEFAULT_PATTERN = "test/**/*.js";

    private static final String FIXTURE_SUFFIX = "FIXTURE";

    private final RunnerConfig config;
    private final ProcessLauncher launcher;
    private final ExecutorCodecs codecs;
    private final TestRunListener listener;
    private final MetadataExtractor extractor;
    private final OutcomeClassifier classifier;

    public ConformanceRunner(RunnerConfig config, ProcessLauncher launcher, ExecutorCodecs codecs,
                             TestRunListener listener) {
        this.config = Objects.requireNonNull(config, "config");
        this.launcher = Objects.requireNonNull(launcher, "launcher");
        this.codecs = Objects.requireNonNull(codecs, "codecs");
        this.listener = listener == null ? TestRunListener.NONE : listener;
        this.extractor = new MetadataExtractor(codecs.frontmatter());
        this.classifier = new OutcomeClassifier(config.unsupportedFeatures(), config.negativePhasePolicy());
    }

    // ========== Discovery ==========

    /**
     * Finds the test files under {@code root}.
     *
     * @param pattern a file (absolute or relative to {@code root}) or a glob relative to
     *                {@code root}; {@code null} means {@value #DEFAULT_PATTERN}
     * @return matching files in path order, fixtures excluded
     */
    public static List<TestFile> discover(Path root, String pattern) throws IOException {
        Path corpusRoot = root.toAbsolutePath().normalize();
        String glob = pattern == null || pattern.isBlank() ? DEFAULT_PATTERN : pattern;

        Path single = corpusRoot.resolve(glob);
        if (Files.isRegularFile(single)) {
            return List.of(TestFile.of(corpusRoot, single));
        }

        // "**/" should also match zero directories, which the JDK glob syntax does not do
        PathMatcher matcher = corpusRoot.getFileSystem().getPathMatcher("glob:" + glob);
        PathMatcher shallowMatcher = corpusRoot.getFileSystem().getPathMatcher("glob:" + glob.replace("**/", ""));

        List<TestFile> files = new ArrayList<>();
        try (Stream<Path> paths = Files.walk(corpusRoot)) {
            paths.filter(Files::isRegularFile)
                 .filter(p -> {
                     Path relative = corpusRoot.relativize(p);
                     return matcher.matches(relative) || shallowMatcher.matches(relative);
                 })
                 .filter(p -> !isFixture(p))
                 .forEach(p -> files.add(TestFile.of(corpusRoot, p)));
        }
        Collections.sort(files);
        return files;
    }

    static boolean isFixture(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return stem.endsWith(FIXTURE_SUFFIX);
    }

    // ========== Running ==========

    public RunResults run(List<TestFile> files) throws InterruptedException {
        return run(files, new ResultAggregator(files, config.trackPerFile()));
    }

    /**
     * Runs {@code files}, recording into {@code aggregator} as results arrive so that
     * progress can be polled from another thread.
     *
     * @throws RunAbortedException  if a worker hit a fatal error; all workers are cancelled
     *                              and all child processes killed
     * @throws InterruptedException if the calling thread is interrupted; all workers are
     *                              cancelled, all child processes killed, and the results
     *                              recorded so far stay in {@code aggregator}
     */
    public RunResults run(List<TestFile> files, ResultAggregator aggregator) throws InterruptedException {
        long startNanos = System.nanoTime();
        List<List<TestFile>> workLists = WorkPartitioner.partition(files, config.concurrency());
        listener.onRunStarted(files, workLists.size());
        log.info("Running {} files in {} work-lists on {} workers ({} mode)", files.size(), workLists.size(),
            config.concurrency(), config.direct() ? "direct" : "batch");

        if (workLists.isEmpty()) {
            return results(aggregator, startNanos, true);
        }

        AtomicBoolean stopped = new AtomicBoolean();
        Consumer<TestRun> sink = run -> {
            if (!stopped.get()) {
                aggregator.record(run);
                listener.onTestRun(run);
            }
        };

        ExecutorService pool = Executors.newFixedThreadPool(
            Math.min(config.concurrency(), workLists.size()), workerThreads());
        CompletionService<Void> completion = new ExecutorCompletionService<>(pool);
        for (int i = 0; i < workLists.size(); i++) {
            int index = i;
            List<TestFile> workList = workLists.get(i);
            completion.submit(() -> {
                runWorkList(index, workList, sink);
                return null;
            });
        }

        try {
            for (int done = 0; done < workLists.size(); done++) {
                Future<Void> finished = completion.take();
                try {
                    finished.get();
                } catch (ExecutionException e) {
                    stopped.set(true);
                    cancel(pool);
                    Throwable cause = e.getCause();
                    log.error("Aborting run: {}", cause.toString());
                    throw new RunAbortedException("Run aborted: " + cause.getMessage(), cause,
                        results(aggregator, startNanos, false));
                }
            }
        } catch (InterruptedException e) {
            stopped.set(true);
            cancel(pool);
            log.warn("Run interrupted after {} of {} files", aggregator.snapshot().completed(), files.size());
            throw e;
        } finally {
            pool.shutdownNow();
        }

        RunResults results = results(aggregator, startNanos, true);
        log.info("Finished {} files in {}s", files.size(), String.format("%.2f", results.durationSeconds()));
        return results;
    }

    private void runWorkList(int index, List<TestFile> workList, Consumer<TestRun> sink)
            throws InterruptedException {
        log.debug("Work-list {} started with {} files", index, workList.size());
        if (config.direct()) {
            DirectTestRunner runner = new DirectTestRunner(config.executor(), launcher, extractor, classifier,
                codecs.results());
            for (TestFile file : workList) {
                if (Thread.interrupted()) {
                    throw new InterruptedException("Interrupted at " + file);
                }
                sink.accept(runner.run(file));
            }
            return;
        }

        BatchRecoveryLoop loop = new BatchRecoveryLoop(
            new BatchProtocolClient(config.executor(), launcher, codecs.records()),
            config.batchSize(),
            config.maxProtocolRetries(),
            config.forwardDiagnostics());

        // each run of consecutive executable files is flushed before the next preflight outcome
        List<TestFile> pending = new ArrayList<>();
        int invocations = 0;
        int crashes = 0;
        int violations = 0;
        for (TestFile file : workList) {
            TestRun decided;
            try {
                decided = classifier.preflight(extractor.extract(file.path()).orElse(null))
                    .map(outcome -> TestRun.of(file, outcome))
                    .orElse(null);
            } catch (IOException e) {
                log.warn("Could not read {}", file, e);
                decided = TestRun.of(file, TestOutcome.RUNNER_EXCEPTION, e.toString());
            }
            if (decided == null) {
                pending.add(file);
                continue;
            }
            if (!pending.isEmpty()) {
                BatchRecoveryLoop.Stats stats = loop.run(pending, sink);
                invocations += stats.invocations();
                crashes += stats.crashes();
                violations += stats.protocolViolations();
                pending.clear();
            }
            sink.accept(decided);
        }
        if (!pending.isEmpty()) {
            BatchRecoveryLoop.Stats stats = loop.run(pending, sink);
            invocations += stats.invocations();
            crashes += stats.crashes();
            violations += stats.protocolViolations();
        }
        log.debug("Work-list {} done: {} invocations, {} crashes, {} protocol violations", index,
            invocations, crashes, violations);
    }

    private void cancel(ExecutorService pool) {
        pool.shutdownNow();
        launcher.destroyAll();
    }

    private static RunResults results(ResultAggregator aggregator, long startNanos, boolean completed) {
        return new RunResults(
            Duration.ofNanos(System.nanoTime() - startNanos),
            aggregator.tree(),
            aggregator.perFileResults(),
            aggregator.snapshot(),
            completed);
    }

    private static ThreadFactory workerThreads() {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "metronome-worker-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
