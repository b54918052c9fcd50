package com.jsconformance.metadata;

import java.util.List;
import java.util.Objects;

/**
 * The frontmatter keys the runner branches on, as plain strings.
 *
 * @param negativePhase {@code negative.phase}, {@code null} when there is no negative block
 * @param negativeType  {@code negative.type}, may be {@code null}
 */
public record FrontmatterDocument(
    List<String> features,
    List<String> flags,
    List<String> includes,
    List<String> locale,
    String negativePhase,
    String negativeType
) {

    public FrontmatterDocument {
        features = List.copyOf(Objects.requireNonNull(features, "features"));
        flags = List.copyOf(Objects.requireNonNull(flags, "flags"));
        includes = List.copyOf(Objects.requireNonNull(includes, "includes"));
        locale = List.copyOf(Objects.requireNonNull(locale, "locale"));
    }

    public boolean hasNegative() {
        return negativePhase != null;
    }
}
