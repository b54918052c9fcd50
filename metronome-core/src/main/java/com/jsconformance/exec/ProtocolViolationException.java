package com.jsconformance.exec;

/**
 * The executor and the runner disagree about the batch protocol: a result for the
 * wrong test, an unparsable record, or more results than submitted tests.
 *
 * This is never a test outcome; the invocation that produced it is aborted.
 */
public class ProtocolViolationException extends RuntimeException {

    public ProtocolViolationException(String message) {
        super(message);
    }

    public ProtocolViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
