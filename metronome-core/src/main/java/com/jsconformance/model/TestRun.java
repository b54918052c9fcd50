package com.jsconformance.model;

import java.util.Objects;

/**
 * The result of executing one test file once.
 *
 * @param file       the executed file
 * @param outcome    the classified outcome
 * @param output     diagnostic text, may be {@code null}
 * @param exitCode   exit code of the executor when it is relevant, may be {@code null}
 * @param strictMode whether the deciding run was in strict mode, may be {@code null}
 */
public record TestRun(TestFile file, TestOutcome outcome, String output, Integer exitCode, Boolean strictMode) {

    public TestRun {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(outcome, "outcome");
    }

    public static TestRun of(TestFile file, TestOutcome outcome) {
        return new TestRun(file, outcome, null, null, null);
    }

    public static TestRun of(TestFile file, TestOutcome outcome, String output) {
        return new TestRun(file, outcome, output, null, null);
    }

    public boolean hasOutput() {
        return output != null && !output.isBlank();
    }
}
