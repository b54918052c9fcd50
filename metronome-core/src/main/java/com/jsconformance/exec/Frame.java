package com.jsconformance.exec;

/**
 * One chunk of executor output, classified.
 */
record Frame(Type type, String payload) {

    static final String RESULT_PREFIX = "RESULT ";

    enum Type {
        /** {@code RESULT <json>}; payload is the JSON text. */
        RESULT,
        /** Whitespace only. */
        BLANK,
        /** Anything else; the executor stopped producing results. */
        TRAILING
    }

    static Frame of(String chunk) {
        String trimmed = chunk.strip();
        if (trimmed.isEmpty()) {
            return new Frame(Type.BLANK, "");
        }
        if (trimmed.startsWith(RESULT_PREFIX)) {
            return new Frame(Type.RESULT, trimmed.substring(RESULT_PREFIX.length()));
        }
        return new Frame(Type.TRAILING, chunk);
    }
}
