package com.jsconformance.exec;

import com.jsconformance.model.ExecutorRecord;

/**
 * Decodes the JSON payload of a {@code RESULT} frame.
 */
@FunctionalInterface
public interface RecordDecoder {

    /**
     * @throws IllegalArgumentException if the payload is not valid JSON, lacks the
     *         {@code test} or {@code result} field, or names an unknown result kind
     */
    ExecutorRecord decode(String json);
}
