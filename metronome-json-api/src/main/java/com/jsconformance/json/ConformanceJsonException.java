package com.jsconformance.json;

/**
 * Exception thrown when result documents cannot be serialized or deserialized.
 */
public class ConformanceJsonException extends RuntimeException {

    public ConformanceJsonException(String message) {
        super(message);
    }

    public ConformanceJsonException(String message, Throwable cause) {
        super(message, cause);
    }

    public ConformanceJsonException(Throwable cause) {
        super(cause);
    }
}
