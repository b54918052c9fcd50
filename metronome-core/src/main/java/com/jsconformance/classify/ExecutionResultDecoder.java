package com.jsconformance.classify;

/**
 * Decodes the single JSON document a direct-mode executor run prints.
 */
@FunctionalInterface
public interface ExecutionResultDecoder {

    /**
     * @throws IllegalArgumentException if the text is not a result document
     */
    ExecutionResult decode(String json);
}
