package com.jsconformance.report;

import com.jsconformance.model.TestOutcome;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Differences between two per-file result documents.
 */
public final class ResultDiff {

    /**
     * An outcome that changed between the two runs.
     */
    public record Change(TestOutcome oldOutcome, TestOutcome newOutcome) {

        public boolean isRegression() {
            return oldOutcome == TestOutcome.PASSED && newOutcome != TestOutcome.PASSED;
        }
    }

    private final double durationDelta;
    private final Map<String, TestOutcome> newTests = new TreeMap<>();
    private final Map<String, TestOutcome> removedTests = new TreeMap<>();
    private final Map<String, Change> changedTests = new TreeMap<>();

    private ResultDiff(double durationDelta) {
        this.durationDelta = durationDelta;
    }

    public static ResultDiff compare(PerFileReport oldReport, PerFileReport newReport) {
        Objects.requireNonNull(oldReport, "oldReport");
        Objects.requireNonNull(newReport, "newReport");

        ResultDiff diff = new ResultDiff(newReport.durationSeconds() - oldReport.durationSeconds());
        for (Map.Entry<String, TestOutcome> entry : oldReport.results().entrySet()) {
            TestOutcome newOutcome = newReport.results().get(entry.getKey());
            if (newOutcome == null) {
                diff.removedTests.put(entry.getKey(), entry.getValue());
            } else if (newOutcome != entry.getValue()) {
                diff.changedTests.put(entry.getKey(), new Change(entry.getValue(), newOutcome));
            }
        }
        for (Map.Entry<String, TestOutcome> entry : newReport.results().entrySet()) {
            if (!oldReport.results().containsKey(entry.getKey())) {
                diff.newTests.put(entry.getKey(), entry.getValue());
            }
        }
        return diff;
    }

    public double durationDelta() {
        return durationDelta;
    }

    public Map<String, TestOutcome> newTests() {
        return Collections.unmodifiableMap(newTests);
    }

    public Map<String, TestOutcome> removedTests() {
        return Collections.unmodifiableMap(removedTests);
    }

    public Map<String, Change> changedTests() {
        return Collections.unmodifiableMap(changedTests);
    }

    /** Changed tests that used to pass. */
    public Map<String, Change> regressions() {
        Map<String, Change> regressions = new LinkedHashMap<>();
        for (Map.Entry<String, Change> entry : changedTests.entrySet()) {
            if (entry.getValue().isRegression()) {
                regressions.put(entry.getKey(), entry.getValue());
            }
        }
        return regressions;
    }

    public Map<TestOutcome, Integer> newSummary() {
        return summarize(newTests);
    }

    public Map<TestOutcome, Integer> removedSummary() {
        return summarize(removedTests);
    }

    /**
     * Net movement per outcome across changed tests: -1 for the old outcome, +1 for the new.
     */
    public Map<TestOutcome, Integer> changedSummary() {
        Map<TestOutcome, Integer> summary = zeroes();
        for (Change change : changedTests.values()) {
            summary.merge(change.oldOutcome(), -1, Integer::sum);
            summary.merge(change.newOutcome(), 1, Integer::sum);
        }
        return summary;
    }

    public boolean isEmpty() {
        return newTests.isEmpty() && removedTests.isEmpty() && changedTests.isEmpty();
    }

    private static Map<TestOutcome, Integer> summarize(Map<String, TestOutcome> tests) {
        Map<TestOutcome, Integer> summary = zeroes();
        for (TestOutcome outcome : tests.values()) {
            summary.merge(outcome, 1, Integer::sum);
        }
        return summary;
    }

    private static Map<TestOutcome, Integer> zeroes() {
        Map<TestOutcome, Integer> summary = new EnumMap<>(TestOutcome.class);
        for (TestOutcome outcome : TestOutcome.values()) {
            summary.put(outcome, 0);
        }
        return summary;
    }
}
