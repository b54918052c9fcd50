package com.jsconformance.model;

import java.util.Collection;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Parsed test262 frontmatter of one test file.
 *
 * Flags are an enumerated set; combinations that cannot be executed (for example
 * {@code onlyStrict} together with {@code noStrict}) are rejected on construction.
 *
 * @param features declared language features
 * @param flags    execution flags
 * @param includes extra harness files to load before the test
 * @param locale   locales the test depends on
 * @param negative the expected failure, or {@code null} for a positive test
 */
public record TestMetadata(
    List<String> features,
    Set<ExecutionFlag> flags,
    List<String> includes,
    List<String> locale,
    NegativeExpectation negative
) {

    public TestMetadata {
        features = List.copyOf(Objects.requireNonNull(features, "features"));
        Objects.requireNonNull(flags, "flags");
        flags = flags.isEmpty() ? Set.of() : Set.copyOf(EnumSet.copyOf(flags));
        includes = List.copyOf(Objects.requireNonNull(includes, "includes"));
        locale = List.copyOf(Objects.requireNonNull(locale, "locale"));
        if (flags.contains(ExecutionFlag.ONLY_STRICT)
                && (flags.contains(ExecutionFlag.NO_STRICT) || flags.contains(ExecutionFlag.RAW))) {
            throw new MetadataException("onlyStrict cannot be combined with noStrict or raw");
        }
        if (flags.contains(ExecutionFlag.MODULE) && flags.contains(ExecutionFlag.NO_STRICT)) {
            throw new MetadataException("module code is always strict, noStrict is not allowed");
        }
    }

    /** Metadata of a plain positive test with no flags. */
    public static TestMetadata empty() {
        return new TestMetadata(List.of(), Set.of(), List.of(), List.of(), null);
    }

    public boolean hasFlag(ExecutionFlag flag) {
        return flags.contains(flag);
    }

    public boolean isNegative() {
        return negative != null;
    }

    public boolean isAsync() {
        return flags.contains(ExecutionFlag.ASYNC);
    }

    public boolean isRaw() {
        return flags.contains(ExecutionFlag.RAW);
    }

    public boolean declaresAnyFeature(Collection<String> candidates) {
        for (String feature : features) {
            if (candidates.contains(feature)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Modules and {@code onlyStrict} tests run strict only, {@code noStrict} and
     * {@code raw} tests sloppy only, everything else strict and then sloppy.
     */
    public ModeSelection modeSelection() {
        if (flags.contains(ExecutionFlag.ONLY_STRICT) || flags.contains(ExecutionFlag.MODULE)) {
            return ModeSelection.STRICT_ONLY;
        }
        if (flags.contains(ExecutionFlag.NO_STRICT) || flags.contains(ExecutionFlag.RAW)) {
            return ModeSelection.SLOPPY_ONLY;
        }
        return ModeSelection.STRICT_THEN_SLOPPY;
    }
}
