package com.jsconformance;

import com.jsconformance.FakeProcess.Response;
import com.jsconformance.exec.ExecutorOptions;
import com.jsconformance.exec.ProtocolViolationException;
import com.jsconformance.model.TestFile;
import com.jsconformance.model.TestOutcome;
import com.jsconformance.model.TestRun;
import com.jsconformance.report.ResultNode;
import com.jsconformance.report.RunResults;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.*;

class ConformanceRunnerTest {

    private static final String META = "/*---\ndescription: test\n---*/\n";

    @TempDir
    Path root;

    private Path write(String relative, String content) throws IOException {
        Path file = root.resolve(relative);
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
        return file;
    }

    private RunnerConfig config(Duration timeout) {
        ExecutorOptions options = new ExecutorOptions(Path.of("/opt/runner"), root.resolve("harness"), false, false,
            timeout, 0);
        return RunnerConfig.defaults(options).withConcurrency(2).withTrackPerFile(true);
    }

    /**
     * Passes every submitted path, crashing instead on paths containing "crash".
     */
    private static Response batchExecutor(String stdin) {
        StringBuilder out = new StringBuilder();
        for (String path : stdin.split("\n")) {
            if (path.isEmpty()) {
                continue;
            }
            if (path.contains("crash")) {
                return Response.exit(139, out.toString(), "Segmentation fault\n");
            }
            out.append("RESULT {\"test\":\"").append(path).append("\",\"result\":\"passed\"}\0");
        }
        return Response.exit(0, out.toString());
    }

    @Nested
    @DisplayName("discover")
    class Discovery {

        @Test
        void defaultPatternFindsTestsAndSkipsFixtures() throws Exception {
            write("test/language/a.js", META);
            write("test/language/module-code/dep_FIXTURE.js", META);
            write("test/top.js", META);
            write("harness/assert.js", "");
            write("test/language/readme.md", "");

            List<TestFile> files = ConformanceRunner.discover(root, null);

            assertEquals(List.of("test/language/a.js", "test/top.js"),
                files.stream().map(TestFile::relativePath).toList());
        }

        @Test
        void patternNamingAFileSelectsIt() throws Exception {
            write("test/language/a.js", META);
            write("test/language/b.js", META);

            List<TestFile> files = ConformanceRunner.discover(root, "test/language/b.js");

            assertEquals(1, files.size());
            assertEquals("test/language/b.js", files.get(0).relativePath());
        }

        @Test
        void globIsRelativeToTheRoot() throws Exception {
            write("test/built-ins/Array/a.js", META);
            write("test/language/b.js", META);

            List<TestFile> files = ConformanceRunner.discover(root, "test/built-ins/**/*.js");

            assertEquals(List.of("test/built-ins/Array/a.js"), files.stream().map(TestFile::relativePath).toList());
        }
    }

    @Nested
    @DisplayName("batch mode")
    class BatchMode {

        private List<TestFile> files;

        @BeforeEach
        void corpus() throws IOException {
            write("test/a/pass.js", META + "assert(true);\n");
            write("test/a/no-meta.js", "assert(true);\n");
            write("test/b/crash.js", META + "crash();\n");
            files = ConformanceRunner.discover(root, null);
        }

        @Test
        void partialFailuresAreContainedPerFile() throws Exception {
            FakeLauncher launcher = FakeLauncher.scripted(ConformanceRunnerTest::batchExecutor);
            ConformanceRunner runner = new ConformanceRunner(config(Duration.ofSeconds(10)), launcher,
                JacksonTestCodecs.codecs(), TestRunListener.NONE);

            RunResults results = runner.run(files);

            assertTrue(results.completed());
            ResultNode test = results.tree().node(List.of("test"));
            assertEquals(3, test.count());
            assertEquals(1, test.result(TestOutcome.PASSED));
            assertEquals(1, test.result(TestOutcome.METADATA_ERROR));
            assertEquals(1, test.result(TestOutcome.PROCESS_ERROR));
            assertEquals(3, test.reported());
            assertEquals(Map.of(
                    "test/a/no-meta.js", TestOutcome.METADATA_ERROR,
                    "test/a/pass.js", TestOutcome.PASSED,
                    "test/b/crash.js", TestOutcome.PROCESS_ERROR),
                results.perFile());
            assertEquals(3, results.totals().completed());
            // the file without metadata never reaches the executor
            assertEquals(2, launcher.launchCount());
        }

        @Test
        void listenerSeesEveryRun() throws Exception {
            TestRunListener listener = mock(TestRunListener.class);
            FakeLauncher launcher = FakeLauncher.scripted(ConformanceRunnerTest::batchExecutor);

            new ConformanceRunner(config(Duration.ofSeconds(10)), launcher, JacksonTestCodecs.codecs(), listener)
                .run(files);

            verify(listener).onRunStarted(anyList(), anyInt());
            verify(listener, times(3)).onTestRun(any(TestRun.class));
        }

        @Test
        void persistentProtocolViolationAbortsTheRun() throws Exception {
            FakeLauncher launcher = FakeLauncher.scripted(stdin ->
                Response.exit(0, "RESULT {\"test\":\"/somewhere/else.js\",\"result\":\"passed\"}\0"));
            ConformanceRunner runner = new ConformanceRunner(config(Duration.ofSeconds(10)).withConcurrency(1),
                launcher, JacksonTestCodecs.codecs(), TestRunListener.NONE);

            RunAbortedException aborted = assertThrows(RunAbortedException.class, () -> runner.run(files));

            assertInstanceOf(ProtocolViolationException.class, aborted.getCause());
            assertFalse(aborted.getPartialResults().completed());
            assertEquals(1, launcher.destroyAllCalls());
            // first attempt plus two retries
            assertEquals(3, launcher.launchCount());
        }

        @Test
        void launchFailureIsContained() throws Exception {
            FakeLauncher launcher = new FakeLauncher(command -> null);
            ConformanceRunner runner = new ConformanceRunner(config(Duration.ofSeconds(10)), launcher,
                JacksonTestCodecs.codecs(), TestRunListener.NONE);

            RunResults results = runner.run(files);

            assertEquals(TestOutcome.RUNNER_EXCEPTION, results.perFile().get("test/a/pass.js"));
            assertEquals(TestOutcome.METADATA_ERROR, results.perFile().get("test/a/no-meta.js"));
        }

        @Test
        void interruptKillsChildrenAndPropagates() throws Exception {
            FakeLauncher launcher = FakeLauncher.scripted(stdin -> Response.hang(""));
            ConformanceRunner runner = new ConformanceRunner(config(Duration.ofSeconds(60)), launcher,
                JacksonTestCodecs.codecs(), TestRunListener.NONE);
            AtomicReference<Throwable> thrown = new AtomicReference<>();

            Thread caller = new Thread(() -> {
                try {
                    runner.run(files);
                } catch (Throwable t) {
                    thrown.set(t);
                }
            });
            caller.start();
            long deadline = System.currentTimeMillis() + 10_000;
            while (launcher.launchCount() < 2 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
            caller.interrupt();
            caller.join(10_000);

            assertFalse(caller.isAlive());
            assertInstanceOf(InterruptedException.class, thrown.get());
            assertEquals(1, launcher.destroyAllCalls());
            assertTrue(launcher.processes().stream().allMatch(FakeProcess::wasDestroyed));
        }
    }

    @Nested
    @DisplayName("direct mode")
    class DirectMode {

        @Test
        void eachFileIsRunThroughTheDirectRunner() throws Exception {
            write("test/a/pass.js", META + "assert(true);\n");
            write("test/a/strict-only.js", "/*---\nflags: [onlyStrict]\n---*/\nassert(true);\n");
            List<TestFile> files = ConformanceRunner.discover(root, null);
            FakeLauncher launcher = FakeLauncher.scripted(stdin -> Response.exit(0, "{\"output\":\"\"}"));
            ConformanceRunner runner = new ConformanceRunner(config(Duration.ofSeconds(10)).withDirect(true),
                launcher, JacksonTestCodecs.codecs(), TestRunListener.NONE);

            RunResults results = runner.run(files);

            assertEquals(2, results.tree().node(List.of("test", "a")).result(TestOutcome.PASSED));
            assertEquals(3, launcher.launchCount());
        }
    }

    @Test
    void workListOrderIsKeptAroundPreflightOutcomes() throws Exception {
        write("test/a/1.js", META);
        write("test/a/2.js", "no metadata\n");
        write("test/a/3.js", META);
        write("test/a/4.js", META);
        List<TestFile> ordered = ConformanceRunner.discover(root, "test/a/**/*.js");
        List<String> seen = Collections.synchronizedList(new ArrayList<>());
        FakeLauncher launcher = FakeLauncher.scripted(ConformanceRunnerTest::batchExecutor);

        new ConformanceRunner(config(Duration.ofSeconds(10)).withConcurrency(1), launcher,
            JacksonTestCodecs.codecs(), run -> seen.add(run.file().relativePath())).run(ordered);

        assertEquals(List.of("test/a/1.js", "test/a/2.js", "test/a/3.js", "test/a/4.js"), seen);
        // 1.js alone, then 3.js and 4.js together
        assertEquals(2, launcher.launchCount());
    }

    @Test
    @DisplayName("an empty corpus completes without launching anything")
    void emptyCorpusCompletesImmediately() throws Exception {
        ConformanceRunner runner = new ConformanceRunner(config(Duration.ofSeconds(10)),
            FakeLauncher.scripted(stdin -> Response.exit(0, "")), JacksonTestCodecs.codecs(), TestRunListener.NONE);

        RunResults results = runner.run(List.of());

        assertTrue(results.completed());
        assertTrue(results.tree().roots().isEmpty());
    }
}
