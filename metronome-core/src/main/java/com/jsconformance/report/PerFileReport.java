package com.jsconformance.report;

import com.jsconformance.model.TestOutcome;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * A persisted per-file results document.
 *
 * @param durationSeconds duration of the run that produced it
 * @param results         outcome per relative path
 */
public record PerFileReport(double durationSeconds, Map<String, TestOutcome> results) {

    public PerFileReport {
        results = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(results, "results")));
    }

    public static PerFileReport of(RunResults results) {
        return new PerFileReport(results.durationSeconds(), results.perFile());
    }
}
