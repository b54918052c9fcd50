package com.jsconformance.model;

import java.util.Objects;

/**
 * The {@code negative} frontmatter block: the test passes by failing this way.
 *
 * @param phase the expected failure phase
 * @param type  the expected error type, may be {@code null} when the test does not name one
 */
public record NegativeExpectation(NegativePhase phase, String type) {

    public NegativeExpectation {
        Objects.requireNonNull(phase, "phase");
    }

    public boolean hasType() {
        return type != null && !type.isBlank();
    }
}
