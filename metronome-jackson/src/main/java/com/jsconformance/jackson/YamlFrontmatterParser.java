package com.jsconformance.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jsconformance.metadata.FrontmatterDocument;
import com.jsconformance.metadata.FrontmatterParser;
import com.jsconformance.model.MetadataException;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reads frontmatter YAML with Jackson. Only the keys the runner branches on are kept;
 * descriptions, authors and the rest are ignored.
 */
public class YamlFrontmatterParser implements FrontmatterParser {

    private final ObjectMapper yamlMapper;

    public YamlFrontmatterParser(ObjectMapper yamlMapper) {
        this.yamlMapper = Objects.requireNonNull(yamlMapper, "yamlMapper");
    }

    @Override
    public FrontmatterDocument parse(String yaml) throws MetadataException {
        JsonNode root;
        try {
            root = yamlMapper.readTree(yaml);
        } catch (IOException e) {
            throw new MetadataException("Invalid frontmatter YAML: " + e.getMessage(), e);
        }
        if (root == null || !root.isObject()) {
            throw new MetadataException("Frontmatter is not a YAML mapping");
        }

        String negativePhase = null;
        String negativeType = null;
        JsonNode negative = root.get("negative");
        if (negative != null && !negative.isNull()) {
            if (!negative.isObject()) {
                throw new MetadataException("'negative' must be a mapping");
            }
            negativePhase = scalar(negative, "phase");
            if (negativePhase == null) {
                throw new MetadataException("'negative' has no phase");
            }
            negativeType = scalar(negative, "type");
        }

        return new FrontmatterDocument(
            list(root, "features"),
            list(root, "flags"),
            list(root, "includes"),
            list(root, "locale"),
            negativePhase,
            negativeType);
    }

    private static List<String> list(JsonNode root, String key) {
        JsonNode value = root.get(key);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new MetadataException("'" + key + "' must be a list");
        }
        List<String> items = new ArrayList<>(value.size());
        for (JsonNode item : value) {
            if (!item.isValueNode() || item.isNull()) {
                throw new MetadataException("'" + key + "' must only contain scalars");
            }
            items.add(item.asText());
        }
        return items;
    }

    private static String scalar(JsonNode node, String key) {
        JsonNode value = node.get(key);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
