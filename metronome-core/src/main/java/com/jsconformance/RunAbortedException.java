package com.jsconformance;

import com.jsconformance.report.RunResults;

/**
 * Thrown when a fatal error stops a run before every work-list finished.
 * The results recorded up to that point are attached.
 */
public class RunAbortedException extends RuntimeException {

    private final transient RunResults partialResults;

    public RunAbortedException(String message, Throwable cause, RunResults partialResults) {
        super(message, cause);
        this.partialResults = partialResults;
    }

    public RunResults getPartialResults() {
        return partialResults;
    }
}
