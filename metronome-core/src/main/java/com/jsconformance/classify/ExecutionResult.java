package com.jsconformance.classify;

/**
 * What the executor reported for one run of one test in direct mode.
 *
 * @param harnessError whether a harness file failed before the test ran
 * @param errorPhase   phase of the reported error ({@code parse}, {@code runtime}, ...), {@code null} if none
 * @param errorType    type of the reported error, may be {@code null}
 * @param output       captured program output, may be {@code null}
 */
public record ExecutionResult(boolean harnessError, String errorPhase, String errorType, String output) {

    public static ExecutionResult success(String output) {
        return new ExecutionResult(false, null, null, output);
    }

    public static ExecutionResult error(String phase, String type) {
        return new ExecutionResult(false, phase, type, null);
    }

    public static ExecutionResult harnessFailure() {
        return new ExecutionResult(true, null, null, null);
    }

    public boolean hasError() {
        return errorPhase != null || errorType != null;
    }
}
