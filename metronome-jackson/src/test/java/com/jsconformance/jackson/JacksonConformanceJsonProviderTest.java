package com.jsconformance.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsconformance.json.ConformanceJsonException;
import com.jsconformance.json.ConformanceJsonProvider;
import com.jsconformance.model.TestFile;
import com.jsconformance.model.TestOutcome;
import com.jsconformance.model.TestRun;
import com.jsconformance.report.PerFileReport;
import com.jsconformance.report.ResultAggregator;
import com.jsconformance.report.RunResults;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

public class JacksonConformanceJsonProviderTest {

    private static final Path ROOT = Path.of("/corpus");

    private final JacksonConformanceJsonProvider provider = new JacksonConformanceJsonProvider();
    private final ObjectMapper mapper = MetronomeJackson.createObjectMapper();

    private static RunResults sampleResults() {
        TestFile a = TestFile.of(ROOT, ROOT.resolve("test/language/a.js"));
        TestFile b = TestFile.of(ROOT, ROOT.resolve("test/language/expressions/b.js"));
        TestFile c = TestFile.of(ROOT, ROOT.resolve("test/built-ins/c.js"));
        ResultAggregator aggregator = new ResultAggregator(List.of(a, b, c), true);
        aggregator.record(TestRun.of(a, TestOutcome.PASSED));
        aggregator.record(TestRun.of(b, TestOutcome.FAILED));
        aggregator.record(TestRun.of(c, TestOutcome.TIMEOUT_ERROR));
        return new RunResults(Duration.ofMillis(1500), aggregator.tree(), aggregator.perFileResults(),
            aggregator.snapshot(), true);
    }

    @Test
    void testDiscoveredThroughServiceLoader() {
        assertTrue(ConformanceJsonProvider.isProviderAvailable());
        assertInstanceOf(JacksonConformanceJsonProvider.class, ConformanceJsonProvider.getProvider());
        assertEquals("Jackson", ConformanceJsonProvider.getProvider("jackson").getName());
        assertThrows(IllegalStateException.class, () -> ConformanceJsonProvider.getProvider("gson"));
    }

    @Test
    void testCodecsComeFromTheProvider() {
        var codecs = provider.getCodecs();

        assertSame(provider.getRecordDecoder(), codecs.records());
        assertSame(provider.getExecutionResultDecoder(), codecs.results());
        assertSame(provider.getFrontmatterParser(), codecs.frontmatter());
    }

    @Test
    void testTreeDocumentShape() throws Exception {
        JsonNode document = mapper.readTree(provider.getSerializer().serializeTree(sampleResults()));

        assertEquals(1.5, document.get("duration").asDouble(), 1e-9);
        JsonNode test = document.get("results").get("test");
        assertEquals(3, test.get("count").asInt());
        assertEquals(1, test.get("results").get("PASSED").asInt());
        assertEquals(1, test.get("results").get("FAILED").asInt());
        assertEquals(1, test.get("results").get("TIMEOUT_ERROR").asInt());
        // zero counters are written too
        assertEquals(TestOutcome.values().length, test.get("results").size());
        assertEquals(0, test.get("results").get("SKIPPED").asInt());

        JsonNode language = test.get("children").get("language");
        assertEquals(2, language.get("count").asInt());
        JsonNode expressions = language.get("children").get("expressions");
        assertEquals(1, expressions.get("results").get("FAILED").asInt());
        assertTrue(expressions.get("children").isObject());
        assertEquals(0, expressions.get("children").size());
    }

    @Test
    void testPerFileDocumentRoundTrip() {
        RunResults results = sampleResults();
        String json = provider.getSerializer().serializePerFile(results);

        PerFileReport report = provider.getDeserializer().deserializePerFile(json);

        assertEquals(1.5, report.durationSeconds(), 1e-9);
        assertEquals(Map.of(
                "test/built-ins/c.js", TestOutcome.TIMEOUT_ERROR,
                "test/language/a.js", TestOutcome.PASSED,
                "test/language/expressions/b.js", TestOutcome.FAILED),
            report.results());
    }

    @Test
    void testPerFileDocumentIsSortedByPath() {
        String json = provider.getSerializer().serializePerFile(sampleResults());

        assertTrue(json.indexOf("test/built-ins/c.js") < json.indexOf("test/language/a.js"), json);
        assertTrue(json.startsWith("{\"duration\":"), json);
    }

    @Test
    void testDeserializerRejectsBadDocuments() {
        var deserializer = provider.getDeserializer();

        assertThrows(ConformanceJsonException.class, () -> deserializer.deserializePerFile("not json"));
        assertThrows(ConformanceJsonException.class, () -> deserializer.deserializePerFile("[]"));
        assertThrows(ConformanceJsonException.class,
            () -> deserializer.deserializePerFile("{\"results\": {}}"));
        assertThrows(ConformanceJsonException.class,
            () -> deserializer.deserializePerFile("{\"duration\": 1, \"results\": []}"));
        assertThrows(ConformanceJsonException.class,
            () -> deserializer.deserializePerFile("{\"duration\": 1, \"results\": {\"test\": {\"count\": 1}}}"));
        ConformanceJsonException unknown = assertThrows(ConformanceJsonException.class,
            () -> deserializer.deserializePerFile("{\"duration\": 1, \"results\": {\"a.js\": \"EXPLODED\"}}"));
        assertTrue(unknown.getMessage().contains("EXPLODED"), unknown.getMessage());
    }
}
