package com.jsconformance.metadata;

import com.jsconformance.JacksonTestCodecs;
import com.jsconformance.model.ConfigurationException;
import com.jsconformance.model.ExecutionFlag;
import com.jsconformance.model.NegativePhase;
import com.jsconformance.model.TestMetadata;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class MetadataExtractorTest {

    private final MetadataExtractor extractor = new MetadataExtractor(JacksonTestCodecs::frontmatter);

    @Test
    void readsTheKeysTheRunnerBranchesOn() {
        String source = """
            // Copyright (C) 2017 the contributors. All rights reserved.
            /*---
            esid: sec-array.prototype.flat
            description: a negative async module test
            features: [Array.prototype.flat, Symbol]
            flags: [module, async]
            includes: [compareArray.js, propertyHelper.js]
            negative:
              phase: parse
              type: SyntaxError
            ---*/
            $DONOTEVALUATE();
            """;

        TestMetadata metadata = extractor.extractFromSource(source).orElseThrow();

        assertEquals(List.of("Array.prototype.flat", "Symbol"), metadata.features());
        assertTrue(metadata.hasFlag(ExecutionFlag.MODULE));
        assertTrue(metadata.isAsync());
        assertEquals(List.of("compareArray.js", "propertyHelper.js"), metadata.includes());
        assertEquals(NegativePhase.PARSE, metadata.negative().phase());
        assertEquals("SyntaxError", metadata.negative().type());
    }

    @Test
    void missingBlockYieldsNothing() {
        assertTrue(extractor.extractFromSource("var x = 1;\n").isEmpty());
    }

    @Test
    void unknownFlagYieldsNothing() {
        String source = "/*---\nflags: [sometimesStrict]\n---*/\n";
        assertTrue(extractor.extractFromSource(source).isEmpty());
    }

    @Test
    void contradictoryFlagsYieldNothing() {
        String source = "/*---\nflags: [onlyStrict, noStrict]\n---*/\n";
        assertTrue(extractor.extractFromSource(source).isEmpty());
    }

    @Test
    void unknownNegativePhaseIsAConfigurationError() {
        String source = "/*---\nnegative:\n  phase: link\n  type: SyntaxError\n---*/\n";
        assertThrows(ConfigurationException.class, () -> extractor.extractFromSource(source));
    }

    @Test
    void blockWithCarriageReturnsIsFound() {
        Optional<String> yaml = Frontmatter.find("/*---\r\nflags: [raw]\r\n---*/\r\n");
        assertTrue(yaml.isPresent());
        assertTrue(yaml.get().contains("flags: [raw]"));
    }

    @Test
    void invalidUtf8IsDecodedLeniently(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("bad-utf8.js");
        byte[] header = "/*---\nflags: [noStrict]\n---*/\n// ".getBytes();
        byte[] bytes = new byte[header.length + 2];
        System.arraycopy(header, 0, bytes, 0, header.length);
        bytes[header.length] = (byte) 0xff;
        bytes[header.length + 1] = (byte) 0xfe;
        Files.write(file, bytes);

        TestMetadata metadata = extractor.extract(file).orElseThrow();
        assertTrue(metadata.hasFlag(ExecutionFlag.NO_STRICT));
    }
}
