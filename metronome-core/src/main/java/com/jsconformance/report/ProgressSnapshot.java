package com.jsconformance.report;

import com.jsconformance.model.TestOutcome;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Live totals at one instant.
 *
 * @param total     number of tests in the run
 * @param completed number of tests reported so far
 * @param outcomes  reported count per outcome
 */
public record ProgressSnapshot(int total, int completed, Map<TestOutcome, Integer> outcomes) {

    public ProgressSnapshot {
        outcomes = Collections.unmodifiableMap(new EnumMap<>(outcomes));
    }

    public int count(TestOutcome outcome) {
        return outcomes.getOrDefault(outcome, 0);
    }

    public double percentComplete() {
        return total == 0 ? 100.0 : completed * 100.0 / total;
    }
}
