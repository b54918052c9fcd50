package com.jsconformance.jackson;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.jsconformance.model.TestOutcome;
import com.jsconformance.report.ResultNode;
import com.jsconformance.report.ResultTree;

import java.io.IOException;
import java.util.Map;

/**
 * Jackson module that writes {@link ResultTree}s as nested
 * {@code {"count": n, "results": {...}, "children": {...}}} objects keyed by directory name.
 */
public class ResultsModule extends SimpleModule {

    public ResultsModule() {
        super("ResultsModule", new Version(1, 0, 0, null, "com.jsconformance", "metronome-jackson"));
        addSerializer(ResultTree.class, new ResultTreeSerializer());
        addSerializer(ResultNode.class, new ResultNodeSerializer());
    }

    static class ResultTreeSerializer extends JsonSerializer<ResultTree> {
        @Override
        public void serialize(ResultTree tree, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            writeChildren(tree.roots(), gen, serializers);
        }
    }

    static class ResultNodeSerializer extends JsonSerializer<ResultNode> {
        @Override
        public void serialize(ResultNode node, JsonGenerator gen, SerializerProvider serializers) throws IOException {
            gen.writeStartObject();
            gen.writeNumberField("count", node.count());

            // every outcome is written, zero or not
            gen.writeObjectFieldStart("results");
            for (TestOutcome outcome : TestOutcome.values()) {
                gen.writeNumberField(outcome.name(), node.result(outcome));
            }
            gen.writeEndObject();

            gen.writeFieldName("children");
            writeChildren(node.children(), gen, serializers);
            gen.writeEndObject();
        }
    }

    private static void writeChildren(Map<String, ResultNode> children, JsonGenerator gen,
                                      SerializerProvider serializers) throws IOException {
        gen.writeStartObject();
        for (Map.Entry<String, ResultNode> child : children.entrySet()) {
            gen.writeFieldName(child.getKey());
            serializers.defaultSerializeValue(child.getValue(), gen);
        }
        gen.writeEndObject();
    }
}
