package com.jsconformance.jackson;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsconformance.classify.ExecutionResult;
import com.jsconformance.classify.ExecutionResultDecoder;

import java.util.Objects;

/**
 * Decodes the document a direct-mode executor run prints:
 * {@code {"harness_error": bool, "harness_file": str, "error": {"phase", "type", "details"}, "output": str}}.
 */
public class JacksonExecutionResultDecoder implements ExecutionResultDecoder {

    private final ObjectMapper mapper;

    public JacksonExecutionResultDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public ExecutionResult decode(String json) {
        if (json == null || json.isBlank()) {
            throw new IllegalArgumentException("Executor printed no result");
        }
        ResultDocument document;
        try {
            document = mapper.readValue(json, ResultDocument.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed executor result: " + e.getOriginalMessage(), e);
        }
        if (document == null) {
            throw new IllegalArgumentException("Executor printed null");
        }
        ErrorDocument error = document.error();
        return new ExecutionResult(
            document.harnessError(),
            error == null ? null : error.phase(),
            error == null ? null : error.type(),
            document.output());
    }

    // ==================== Wire documents ====================

    record ResultDocument(
        @JsonProperty("harness_error") boolean harnessError,
        @JsonProperty("harness_file") String harnessFile,
        ErrorDocument error,
        String output
    ) {
    }

    record ErrorDocument(String phase, String type, String details) {
    }
}
