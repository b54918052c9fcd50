package com.jsconformance.jackson;

import com.fasterxml.jackson.core.json.JsonReadFeature;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for the ObjectMapper instances used to read executor output and test
 * frontmatter, and to write result documents.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = MetronomeJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(runResults.tree());
 * </pre>
 */
public final class MetronomeJackson {

    private MetronomeJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper for executor output and result documents.
     *
     * The returned mapper:
     * - Binds records through their constructor parameter names
     * - Accepts raw control characters inside strings, which executors print verbatim
     * - Ignores unknown properties during deserialization
     * - Serializes result trees in the {@code count/results/children} shape
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        mapper.configure(JsonReadFeature.ALLOW_UNESCAPED_CONTROL_CHARS.mappedFeature(), true);
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new ResultsModule());

        return mapper;
    }

    /**
     * Creates a new ObjectMapper reading YAML, for frontmatter blocks.
     */
    public static ObjectMapper createYamlMapper() {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        mapper.registerModule(new ParameterNamesModule());
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return mapper;
    }
}
