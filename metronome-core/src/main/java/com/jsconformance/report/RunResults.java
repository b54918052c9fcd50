package com.jsconformance.report;

import com.jsconformance.model.TestOutcome;

import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Everything a finished (or interrupted) run produced.
 *
 * @param duration  wall-clock duration of the run
 * @param tree      directory-keyed counts
 * @param perFile   outcome per relative path, empty if per-file tracking was off
 * @param totals    outcome totals across the corpus
 * @param completed whether every work-list ran to its end
 */
public record RunResults(
    Duration duration,
    ResultTree tree,
    Map<String, TestOutcome> perFile,
    ProgressSnapshot totals,
    boolean completed
) {

    public RunResults {
        Objects.requireNonNull(duration, "duration");
        Objects.requireNonNull(tree, "tree");
        perFile = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(perFile, "perFile")));
        Objects.requireNonNull(totals, "totals");
    }

    public double durationSeconds() {
        return duration.toNanos() / 1_000_000_000.0;
    }
}
