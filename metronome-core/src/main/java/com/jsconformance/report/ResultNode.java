package com.jsconformance.report;

import com.jsconformance.model.TestOutcome;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * One directory in the {@link ResultTree}: how many tests live below it and how many
 * of those have reported each outcome so far.
 *
 * Children and counts are fixed once the tree is built; only the outcome counters
 * change afterwards, and only through {@link ResultAggregator}.
 */
public final class ResultNode {

    private int count;
    private final EnumMap<TestOutcome, Integer> results = new EnumMap<>(TestOutcome.class);
    private final Map<String, ResultNode> children = new TreeMap<>();

    ResultNode() {
        for (TestOutcome outcome : TestOutcome.values()) {
            results.put(outcome, 0);
        }
    }

    public int count() {
        return count;
    }

    public int result(TestOutcome outcome) {
        return results.get(outcome);
    }

    /** Counter per outcome, in declaration order. */
    public Map<TestOutcome, Integer> results() {
        return Collections.unmodifiableMap(results);
    }

    public Map<String, ResultNode> children() {
        return Collections.unmodifiableMap(children);
    }

    public int reported() {
        int total = 0;
        for (int value : results.values()) {
            total += value;
        }
        return total;
    }

    public int passed() {
        return results.get(TestOutcome.PASSED);
    }

    public double passRate() {
        return count == 0 ? 0.0 : passed() * 100.0 / count;
    }

    // ========== Mutation (package-private) ==========

    void addTest() {
        count++;
    }

    Map<String, ResultNode> childMap() {
        return children;
    }

    void increment(TestOutcome outcome) {
        results.merge(outcome, 1, Integer::sum);
    }
}
