package com.jsconformance.jackson;

import com.jsconformance.metadata.FrontmatterDocument;
import com.jsconformance.model.MetadataException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class YamlFrontmatterParserTest {

    private final YamlFrontmatterParser parser = new YamlFrontmatterParser(MetronomeJackson.createYamlMapper());

    @Test
    void testFullFrontmatter() {
        String yaml = """
            esid: sec-array.prototype.at
            description: Property type and descriptor.
            info: |
              Array.prototype.at( index )
            includes: [propertyHelper.js, compareArray.js]
            flags: [onlyStrict, async]
            features:
              - Array.prototype.at
              - Symbol
            locale: [en-US]
            negative:
              phase: parse
              type: SyntaxError
            """;

        FrontmatterDocument document = parser.parse(yaml);

        assertEquals(List.of("propertyHelper.js", "compareArray.js"), document.includes());
        assertEquals(List.of("onlyStrict", "async"), document.flags());
        assertEquals(List.of("Array.prototype.at", "Symbol"), document.features());
        assertEquals(List.of("en-US"), document.locale());
        assertTrue(document.hasNegative());
        assertEquals("parse", document.negativePhase());
        assertEquals("SyntaxError", document.negativeType());
    }

    @Test
    void testMissingKeysAreEmpty() {
        FrontmatterDocument document = parser.parse("description: nothing else\n");

        assertTrue(document.features().isEmpty());
        assertTrue(document.flags().isEmpty());
        assertTrue(document.includes().isEmpty());
        assertFalse(document.hasNegative());
    }

    @Test
    void testNullNegativeIsIgnored() {
        FrontmatterDocument document = parser.parse("negative:\nflags: []\n");

        assertFalse(document.hasNegative());
    }

    @Test
    void testInvalidYaml() {
        assertThrows(MetadataException.class, () -> parser.parse("flags: [onlyStrict\n"));
    }

    @Test
    void testNonMappingDocument() {
        assertThrows(MetadataException.class, () -> parser.parse("- a\n- b\n"));
        assertThrows(MetadataException.class, () -> parser.parse(""));
    }

    @Test
    void testListKeysMustBeLists() {
        MetadataException e = assertThrows(MetadataException.class, () -> parser.parse("flags: onlyStrict\n"));
        assertTrue(e.getMessage().contains("flags"), e.getMessage());
        assertThrows(MetadataException.class, () -> parser.parse("includes:\n  - {a: b}\n"));
    }

    @Test
    void testNegativeNeedsPhase() {
        assertThrows(MetadataException.class, () -> parser.parse("negative:\n  type: SyntaxError\n"));
        assertThrows(MetadataException.class, () -> parser.parse("negative: parse\n"));
    }
}
