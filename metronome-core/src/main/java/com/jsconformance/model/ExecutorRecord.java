package com.jsconformance.model;

import java.util.Objects;

/**
 * One decoded {@code RESULT} record from the batch executor.
 *
 * @param test       the test path echoed by the executor
 * @param kind       the reported result
 * @param strictMode whether the reported run was in strict mode, {@code null} if not reported
 * @param output     captured output, already resolved to the most specific field available
 */
public record ExecutorRecord(String test, ResultKind kind, Boolean strictMode, String output) {

    public ExecutorRecord {
        Objects.requireNonNull(test, "test");
        Objects.requireNonNull(kind, "kind");
    }
}
