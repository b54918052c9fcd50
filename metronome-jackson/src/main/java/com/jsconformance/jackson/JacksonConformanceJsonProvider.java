package com.jsconformance.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsconformance.classify.ExecutionResultDecoder;
import com.jsconformance.exec.RecordDecoder;
import com.jsconformance.json.ConformanceJsonException;
import com.jsconformance.json.ConformanceJsonProvider;
import com.jsconformance.json.ResultsDeserializer;
import com.jsconformance.json.ResultsSerializer;
import com.jsconformance.metadata.FrontmatterParser;
import com.jsconformance.model.TestOutcome;
import com.jsconformance.report.PerFileReport;
import com.jsconformance.report.RunResults;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Jackson-based implementation of ConformanceJsonProvider.
 */
public class JacksonConformanceJsonProvider implements ConformanceJsonProvider {

    private final ObjectMapper mapper;
    private final RecordDecoder recordDecoder;
    private final ExecutionResultDecoder executionResultDecoder;
    private final FrontmatterParser frontmatterParser;
    private final ResultsSerializer serializer;
    private final ResultsDeserializer deserializer;

    public JacksonConformanceJsonProvider() {
        this.mapper = MetronomeJackson.createObjectMapper();
        this.recordDecoder = new JacksonRecordDecoder(mapper);
        this.executionResultDecoder = new JacksonExecutionResultDecoder(mapper);
        this.frontmatterParser = new YamlFrontmatterParser(MetronomeJackson.createYamlMapper());
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public RecordDecoder getRecordDecoder() {
        return recordDecoder;
    }

    @Override
    public ExecutionResultDecoder getExecutionResultDecoder() {
        return executionResultDecoder;
    }

    @Override
    public FrontmatterParser getFrontmatterParser() {
        return frontmatterParser;
    }

    @Override
    public ResultsSerializer getSerializer() {
        return serializer;
    }

    @Override
    public ResultsDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return "Jackson";
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements ResultsSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serializeTree(RunResults results) throws ConformanceJsonException {
            return write(results.durationSeconds(), results.tree());
        }

        @Override
        public String serializePerFile(RunResults results) throws ConformanceJsonException {
            return write(results.durationSeconds(), new TreeMap<>(results.perFile()));
        }

        private String write(double duration, Object body) {
            Map<String, Object> document = new LinkedHashMap<>();
            document.put("duration", duration);
            document.put("results", body);
            try {
                return mapper.writeValueAsString(document);
            } catch (Exception e) {
                throw new ConformanceJsonException("Failed to serialize results", e);
            }
        }
    }

    private static class JacksonDeserializer implements ResultsDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public PerFileReport deserializePerFile(String json) throws ConformanceJsonException {
            JsonNode root;
            try {
                root = mapper.readTree(json);
            } catch (Exception e) {
                throw new ConformanceJsonException("Failed to read results document", e);
            }
            if (root == null || !root.isObject()) {
                throw new ConformanceJsonException("Results document is not a JSON object");
            }
            JsonNode duration = root.get("duration");
            if (duration == null || !duration.isNumber()) {
                throw new ConformanceJsonException("Results document has no numeric 'duration'");
            }
            JsonNode results = root.get("results");
            if (results == null || !results.isObject()) {
                throw new ConformanceJsonException("Results document has no 'results' object");
            }

            Map<String, TestOutcome> outcomes = new TreeMap<>();
            Iterator<Map.Entry<String, JsonNode>> fields = results.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (!field.getValue().isTextual()) {
                    throw new ConformanceJsonException("Outcome of " + field.getKey()
                        + " is not a string; is this a tree document?");
                }
                try {
                    outcomes.put(field.getKey(), TestOutcome.valueOf(field.getValue().asText()));
                } catch (IllegalArgumentException e) {
                    throw new ConformanceJsonException("Unknown outcome '" + field.getValue().asText()
                        + "' for " + field.getKey(), e);
                }
            }
            return new PerFileReport(duration.asDouble(), outcomes);
        }
    }
}
