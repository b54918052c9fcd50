package com.jsconformance.cli;

import com.jsconformance.json.ConformanceJsonException;
import com.jsconformance.json.ConformanceJsonProvider;
import com.jsconformance.json.ResultsDeserializer;
import com.jsconformance.model.TestOutcome;
import com.jsconformance.report.PerFileReport;
import com.jsconformance.report.ResultDiff;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Compares two per-file result documents written with {@code --per-file}.
 *
 * Usage:
 *   java -cp ... com.jsconformance.cli.ResultDiffCli -o old.json -n new.json [-r]
 */
public class ResultDiffCli {

    private final ResultDiff diff;
    private final int pathWidth;

    public ResultDiffCli(ResultDiff diff) {
        this.diff = diff;
        int width = 0;
        for (String path : diff.newTests().keySet()) {
            width = Math.max(width, path.length());
        }
        for (String path : diff.removedTests().keySet()) {
            width = Math.max(width, path.length());
        }
        for (String path : diff.changedTests().keySet()) {
            width = Math.max(width, path.length());
        }
        this.pathWidth = Math.max(width, 1);
    }

    public static void main(String[] args) {
        Path oldPath = null;
        Path newPath = null;
        boolean regressions = false;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if ((arg.equals("-o") || arg.equals("--old")) && i + 1 < args.length) {
                oldPath = Path.of(args[++i]);
            } else if ((arg.equals("-n") || arg.equals("--new")) && i + 1 < args.length) {
                newPath = Path.of(args[++i]);
            } else if (arg.equals("-r") || arg.equals("--regressions")) {
                regressions = true;
            } else {
                System.err.println("Unknown option: " + arg);
                oldPath = null;
                break;
            }
        }
        if (oldPath == null || newPath == null) {
            System.err.println("Usage: ResultDiffCli -o OLD.json -n NEW.json [-r]");
            System.exit(1);
        }

        try {
            ResultsDeserializer deserializer = ConformanceJsonProvider.getProvider().getDeserializer();
            PerFileReport oldReport = deserializer.deserializePerFile(Files.readString(oldPath, StandardCharsets.UTF_8));
            PerFileReport newReport = deserializer.deserializePerFile(Files.readString(newPath, StandardCharsets.UTF_8));
            ResultDiffCli cli = new ResultDiffCli(ResultDiff.compare(oldReport, newReport));
            if (regressions) {
                cli.printRegressions(System.out);
            } else {
                cli.printFull(System.out);
            }
        } catch (IOException | ConformanceJsonException e) {
            System.err.println("Error: " + e.getMessage());
            System.exit(1);
        }
    }

    void printFull(PrintStream out) {
        out.println("Duration:");
        out.printf("     %+.2fs%n", diff.durationDelta());

        if (diff.isEmpty()) {
            return;
        }

        out.println();
        out.println("Summary:");
        if (!diff.newTests().isEmpty()) {
            out.println("    New Tests:");
            out.println("        " + summaryLine(diff.newSummary()));
        }
        if (!diff.removedTests().isEmpty()) {
            out.println("    Removed Tests:");
            out.println("        " + summaryLine(diff.removedSummary()));
        }
        if (!diff.changedTests().isEmpty()) {
            out.println("    Diff Tests:");
            out.println("        " + summaryLine(diff.changedSummary()));
        }
        out.println();

        if (!diff.newTests().isEmpty()) {
            out.println("New Tests:");
            for (Map.Entry<String, TestOutcome> entry : diff.newTests().entrySet()) {
                out.println("    " + pad(entry.getKey()) + " " + entry.getValue().symbol());
            }
            out.println();
        }
        if (!diff.removedTests().isEmpty()) {
            out.println("Removed Tests:");
            for (Map.Entry<String, TestOutcome> entry : diff.removedTests().entrySet()) {
                out.println("    " + pad(entry.getKey()) + " " + entry.getValue().symbol());
            }
            out.println();
        }
        if (!diff.changedTests().isEmpty()) {
            out.println("Diff Tests:");
            for (Map.Entry<String, ResultDiff.Change> entry : diff.changedTests().entrySet()) {
                out.println(changeLine(entry.getKey(), entry.getValue()));
            }
        }
    }

    void printRegressions(PrintStream out) {
        for (Map.Entry<String, ResultDiff.Change> entry : diff.regressions().entrySet()) {
            out.println(changeLine(entry.getKey(), entry.getValue()));
        }
    }

    private String changeLine(String path, ResultDiff.Change change) {
        return "    " + pad(path) + " " + change.oldOutcome().symbol() + " -> " + change.newOutcome().symbol();
    }

    private String pad(String path) {
        return String.format("%-" + pathWidth + "s", path);
    }

    private static String summaryLine(Map<TestOutcome, Integer> summary) {
        StringBuilder line = new StringBuilder();
        for (TestOutcome outcome : TestOutcome.values()) {
            line.append(String.format("%+d", summary.get(outcome))).append(' ').append(outcome.symbol()).append("   ");
        }
        return line.toString().stripTrailing();
    }
}
