package com.jsconformance.metadata;

import com.jsconformance.model.ExecutionFlag;
import com.jsconformance.model.MetadataException;
import com.jsconformance.model.NegativeExpectation;
import com.jsconformance.model.NegativePhase;
import com.jsconformance.model.TestMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumSet;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Reads the metadata of a test file.
 *
 * A missing or malformed block yields an empty result (the caller classifies the file
 * as a metadata error). An unknown {@code negative.phase} is a configuration error and
 * is thrown.
 */
public class MetadataExtractor {

    private static final Logger log = LoggerFactory.getLogger(MetadataExtractor.class);

    private final FrontmatterParser parser;

    public MetadataExtractor(FrontmatterParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser");
    }

    public Optional<TestMetadata> extract(Path file) throws IOException {
        // test262 contains deliberately invalid UTF-8; decode leniently
        String source = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        return extractFromSource(source);
    }

    public Optional<TestMetadata> extractFromSource(String source) {
        Optional<String> yaml = Frontmatter.find(source);
        if (yaml.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(toMetadata(parser.parse(yaml.get())));
        } catch (MetadataException e) {
            log.debug("Unusable frontmatter: {}", e.getMessage());
            return Optional.empty();
        }
    }

    static TestMetadata toMetadata(FrontmatterDocument document) {
        Set<ExecutionFlag> flags = EnumSet.noneOf(ExecutionFlag.class);
        for (String name : document.flags()) {
            ExecutionFlag flag = ExecutionFlag.fromFrontmatterName(name);
            if (flag == null) {
                throw new MetadataException("Unknown flag '" + name + "'");
            }
            flags.add(flag);
        }

        NegativeExpectation negative = null;
        if (document.hasNegative()) {
            negative = new NegativeExpectation(
                NegativePhase.fromFrontmatterName(document.negativePhase()),
                document.negativeType());
        }

        return new TestMetadata(document.features(), flags, document.includes(), document.locale(), negative);
    }
}
