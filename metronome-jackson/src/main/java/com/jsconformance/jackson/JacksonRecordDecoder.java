package com.jsconformance.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsconformance.exec.RecordDecoder;
import com.jsconformance.model.ExecutorRecord;
import com.jsconformance.model.ResultKind;

import java.util.Objects;

/**
 * Decodes {@code RESULT} payloads: {@code test}, {@code result}, and optionally
 * {@code strict_mode}, {@code strict_output} and {@code output}.
 */
public class JacksonRecordDecoder implements RecordDecoder {

    private final ObjectMapper mapper;

    public JacksonRecordDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    @Override
    public ExecutorRecord decode(String json) {
        JsonNode node;
        try {
            node = mapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed RESULT payload: " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new IllegalArgumentException("RESULT payload is not a JSON object");
        }

        String test = text(node, "test");
        if (test == null) {
            throw new IllegalArgumentException("RESULT payload has no 'test' field");
        }
        String result = text(node, "result");
        if (result == null) {
            throw new IllegalArgumentException("RESULT payload for " + test + " has no 'result' field");
        }
        ResultKind kind = ResultKind.fromWireName(result);
        if (kind == null) {
            throw new IllegalArgumentException("Unknown result kind '" + result + "' for " + test);
        }

        Boolean strictMode = node.hasNonNull("strict_mode") ? node.get("strict_mode").asBoolean() : null;

        String output = text(node, "strict_output");
        if (output == null) {
            output = text(node, "output");
        }
        if (output == null) {
            output = node.toString();
        }
        return new ExecutorRecord(test, kind, strictMode, output);
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isTextual() ? value.asText() : null;
    }
}
