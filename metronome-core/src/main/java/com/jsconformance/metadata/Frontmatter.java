package com.jsconformance.metadata;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the test262 YAML frontmatter block in a test source.
 */
public final class Frontmatter {

    private static final Pattern FRONTMATTER_PATTERN = Pattern.compile(
        "/\\*---\\r?\\n([\\s\\S]*?)\\r?\\n---\\*/");

    private Frontmatter() {
    }

    /**
     * @return the YAML between the {@code /*---} and {@code ---*}{@code /} markers, if present
     */
    public static Optional<String> find(String source) {
        Matcher matcher = FRONTMATTER_PATTERN.matcher(source);
        if (!matcher.find()) {
            return Optional.empty();
        }
        return Optional.of(matcher.group(1));
    }
}
