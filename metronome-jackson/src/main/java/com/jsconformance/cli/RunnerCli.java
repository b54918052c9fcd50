package com.jsconformance.cli;

import com.jsconformance.ConformanceRunner;
import com.jsconformance.RunAbortedException;
import com.jsconformance.RunnerConfig;
import com.jsconformance.TestRunListener;
import com.jsconformance.classify.NegativePhasePolicy;
import com.jsconformance.exec.BatchRecoveryLoop;
import com.jsconformance.exec.ExecutorOptions;
import com.jsconformance.exec.ProcessGroup;
import com.jsconformance.json.ConformanceJsonProvider;
import com.jsconformance.model.ConfigurationException;
import com.jsconformance.model.TestFile;
import com.jsconformance.model.TestOutcome;
import com.jsconformance.report.ProgressSnapshot;
import com.jsconformance.report.ResultAggregator;
import com.jsconformance.report.RunResults;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Runs the test262 suite against an executor binary and reports the results.
 *
 * Usage:
 *   java -cp ... com.jsconformance.cli.RunnerCli -j PATH -t PATH [options]
 *
 * Options:
 *   -j, --executor PATH     Executor binary (required)
 *   -t, --test262-root PATH test262 checkout (required)
 *   -p, --pattern GLOB      Test file glob relative to the root (default: test/**&#47;*.js)
 *   -c, --concurrency N     Number of workers (default: available processors)
 *   --timeout SECONDS       Time allowed per test (default: 10)
 *   --memory-limit MB       Memory ceiling per executor process (default: 512)
 *   --batch-size N          Tests per executor process in batch mode (default: 50)
 *   --direct                One executor process per test and mode
 *   -b, --use-bytecode      Run on the bytecode interpreter
 *   --parse-only            Only parse the tests
 *   --forward-stderr        Log executor stderr
 *   --json                  Print the result tree as JSON
 *   --per-file PATH         Write per-file results as JSON to PATH
 *   -s, --silent            No progress output
 *   -v, --verbose           Print every run with its output
 *   -f, --fail-only         With --verbose, only print runs that did not pass
 *   --summary               Only print the top-level directories
 */
public class RunnerCli {

    private static final Logger log = LoggerFactory.getLogger(RunnerCli.class);

    private static final long PROGRESS_INTERVAL_MS = 1000;

    private final Config config;

    public static void main(String[] args) {
        Config config = Config.parse(args);
        if (config == null) {
            printUsage();
            System.exit(1);
        }
        if (config.help) {
            printUsage();
            System.exit(0);
        }

        RunnerCli cli = new RunnerCli(config);
        try {
            int exitCode = cli.run();
            System.exit(exitCode);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            System.exit(1);
        } catch (Exception e) {
            System.err.println("Fatal error: " + e.getMessage());
            e.printStackTrace();
            System.exit(1);
        }
    }

    public RunnerCli(Config config) {
        this.config = config;
    }

    public int run() throws IOException, InterruptedException {
        if (!ConformanceJsonProvider.isProviderAvailable()) {
            System.err.println("Error: no ConformanceJsonProvider on the classpath");
            return 1;
        }
        ConformanceJsonProvider provider = ConformanceJsonProvider.getProvider();
        RunnerConfig runnerConfig;
        try {
            runnerConfig = config.toRunnerConfig();
        } catch (ConfigurationException e) {
            System.err.println("Error: " + e.getMessage());
            return 1;
        }

        List<TestFile> files = ConformanceRunner.discover(config.test262Root, config.pattern);
        if (files.isEmpty()) {
            log("No tests to run.");
            return 0;
        }
        log("Found " + files.size() + " tests");

        ProcessGroup processes = new ProcessGroup();
        processes.installShutdownHook();

        TestRunListener listener = config.verbose
            ? new ConsoleRunListener(System.out, config.failOnly)
            : TestRunListener.NONE;
        ConformanceRunner runner = new ConformanceRunner(runnerConfig, processes, provider.getCodecs(), listener);
        ResultAggregator aggregator = new ResultAggregator(files, config.perFileOutput != null);

        Thread progressThread = null;
        if (!config.silent) {
            progressThread = startProgressThread(aggregator);
        }

        RunResults results;
        try {
            results = runner.run(files, aggregator);
        } catch (RunAbortedException e) {
            System.err.println();
            System.err.println("Run aborted: " + e.getMessage());
            log.debug("Abort cause", e.getCause());
            return 1;
        } finally {
            if (progressThread != null) {
                progressThread.interrupt();
                progressThread.join(PROGRESS_INTERVAL_MS);
                printProgress(aggregator.snapshot());
                System.err.println();
            }
            processes.close();
        }

        log("Finished running tests in " + String.format("%.2f", results.durationSeconds()) + "s.");

        if (config.perFileOutput != null) {
            Files.writeString(config.perFileOutput,
                provider.getSerializer().serializePerFile(results) + "\n", StandardCharsets.UTF_8);
            log("Wrote per-file results to " + config.perFileOutput);
        }

        if (config.json) {
            System.out.println(provider.getSerializer().serializeTree(results));
        } else {
            TreeReportPrinter.print(results.tree(), config.summary, System.out);
        }
        return 0;
    }

    private Thread startProgressThread(ResultAggregator aggregator) {
        Thread progressThread = new Thread(() -> {
            while (!Thread.currentThread().isInterrupted()) {
                try {
                    Thread.sleep(PROGRESS_INTERVAL_MS);
                    printProgress(aggregator.snapshot());
                } catch (InterruptedException e) {
                    break;
                }
            }
        }, "progress");
        progressThread.setDaemon(true);
        progressThread.start();
        return progressThread;
    }

    private static void printProgress(ProgressSnapshot snapshot) {
        StringBuilder line = new StringBuilder();
        line.append(String.format("\r[Progress] %d/%d (%.1f%%)",
            snapshot.completed(), snapshot.total(), snapshot.percentComplete()));
        for (TestOutcome outcome : TestOutcome.values()) {
            int count = snapshot.count(outcome);
            if (count > 0) {
                line.append(" | ").append(outcome.symbol()).append(' ').append(count);
            }
        }
        line.append("    ");
        System.err.print(line);
        System.err.flush();
    }

    private void log(String message) {
        if (!config.silent) {
            System.err.println(message);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: RunnerCli -j PATH -t PATH [options]");
        System.out.println();
        System.out.println("Run the test262 ECMAScript test suite against an executor binary.");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  -j, --executor PATH      Path to the executor binary (required)");
        System.out.println("  -t, --test262-root PATH  Path to the test262 directory (required)");
        System.out.println("  -p, --pattern GLOB       Glob used to find test files (default: " + ConformanceRunner.DEFAULT_PATTERN + ")");
        System.out.println("  -c, --concurrency N      Number of concurrent workers (default: number of CPU cores)");
        System.out.println("  --timeout SECONDS        Timeout for each test run (default: 10)");
        System.out.println("  --memory-limit MB        Memory limit for each executor process (default: 512, 0 for none)");
        System.out.println("  --batch-size N           Tests per executor process (default: " + BatchRecoveryLoop.DEFAULT_BATCH_SIZE + ")");
        System.out.println("  --direct                 Run one executor process per test and mode");
        System.out.println("  -b, --use-bytecode       Use the bytecode interpreter");
        System.out.println("  --parse-only             Only parse the tests");
        System.out.println("  --forward-stderr         Log the executor's stderr");
        System.out.println("  --json                   Print the test results as JSON");
        System.out.println("  --per-file PATH          Write per-file results as JSON to PATH");
        System.out.println("  -s, --silent             Don't print any progress information");
        System.out.println("  -v, --verbose            Print output of test runs");
        System.out.println("  -f, --fail-only          With --verbose, only print tests that did not pass");
        System.out.println("  --summary                Only print the top-level result directories");
        System.out.println("  -h, --help               Show this help");
        System.out.println();
        StringBuilder legend = new StringBuilder();
        for (TestOutcome outcome : TestOutcome.values()) {
            if (legend.length() > 0) {
                legend.append(", ");
            }
            legend.append(outcome.symbol()).append(" = ").append(outcome.name());
        }
        System.out.println(legend);
    }

    // ========== Configuration ==========

    public static class Config {
        Path executor;
        Path test262Root;
        String pattern = ConformanceRunner.DEFAULT_PATTERN;
        int concurrency = Runtime.getRuntime().availableProcessors();
        int timeoutSeconds = 10;
        int memoryLimitMb = 512;
        int batchSize = BatchRecoveryLoop.DEFAULT_BATCH_SIZE;
        boolean direct = false;
        boolean useBytecode = false;
        boolean parseOnly = false;
        boolean forwardStderr = false;
        boolean json = false;
        Path perFileOutput;
        boolean silent = false;
        boolean verbose = false;
        boolean failOnly = false;
        boolean summary = false;
        boolean help = false;

        /**
         * @return the parsed configuration, or {@code null} if the arguments are invalid
         */
        public static Config parse(String[] args) {
            Config config = new Config();

            for (int i = 0; i < args.length; i++) {
                String arg = args[i];
                String value = null;
                int eq = arg.indexOf('=');
                if (arg.startsWith("--") && eq > 0) {
                    value = arg.substring(eq + 1);
                    arg = arg.substring(0, eq);
                }

                try {
                    switch (arg) {
                        case "-h", "--help" -> config.help = true;
                        case "-j", "--executor" -> {
                            config.executor = Path.of(value != null ? value : args[++i]);
                        }
                        case "-t", "--test262-root" -> {
                            config.test262Root = Path.of(value != null ? value : args[++i]);
                        }
                        case "-p", "--pattern" -> config.pattern = value != null ? value : args[++i];
                        case "-c", "--concurrency" -> {
                            config.concurrency = Integer.parseInt(value != null ? value : args[++i]);
                        }
                        case "--timeout" -> {
                            config.timeoutSeconds = Integer.parseInt(value != null ? value : args[++i]);
                        }
                        case "--memory-limit" -> {
                            config.memoryLimitMb = Integer.parseInt(value != null ? value : args[++i]);
                        }
                        case "--batch-size" -> {
                            config.batchSize = Integer.parseInt(value != null ? value : args[++i]);
                        }
                        case "--per-file" -> {
                            config.perFileOutput = Path.of(value != null ? value : args[++i]);
                        }
                        case "--direct" -> config.direct = true;
                        case "-b", "--use-bytecode" -> config.useBytecode = true;
                        case "--parse-only" -> config.parseOnly = true;
                        case "--forward-stderr" -> config.forwardStderr = true;
                        case "--json" -> config.json = true;
                        case "-s", "--silent" -> config.silent = true;
                        case "-v", "--verbose" -> config.verbose = true;
                        case "-f", "--fail-only" -> config.failOnly = true;
                        case "--summary" -> config.summary = true;
                        default -> {
                            System.err.println("Unknown option: " + args[i]);
                            return null;
                        }
                    }
                } catch (ArrayIndexOutOfBoundsException e) {
                    System.err.println("Missing value for " + arg);
                    return null;
                } catch (NumberFormatException e) {
                    System.err.println("Invalid number for " + arg + ": " + e.getMessage());
                    return null;
                }
            }

            if (config.help) {
                return config;
            }
            if (config.executor == null || config.test262Root == null) {
                System.err.println("Error: --executor and --test262-root are required");
                return null;
            }
            if (config.silent && config.verbose) {
                System.err.println("Error: --silent and --verbose are mutually exclusive");
                return null;
            }

            config.executor = config.executor.toAbsolutePath().normalize();
            config.test262Root = config.test262Root.toAbsolutePath().normalize();
            return config;
        }

        RunnerConfig toRunnerConfig() {
            ExecutorOptions options = new ExecutorOptions(
                executor,
                test262Root.resolve("harness"),
                useBytecode,
                parseOnly,
                Duration.ofSeconds(timeoutSeconds),
                memoryLimitMb);
            return new RunnerConfig(
                options,
                concurrency,
                batchSize,
                BatchRecoveryLoop.DEFAULT_PROTOCOL_RETRIES,
                forwardStderr,
                direct,
                perFileOutput != null,
                RunnerConfig.DEFAULT_UNSUPPORTED_FEATURES,
                NegativePhasePolicy.DEFAULT);
        }
    }
}
