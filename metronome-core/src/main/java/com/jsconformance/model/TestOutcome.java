package com.jsconformance.model;

/**
 * File-level outcome of a conformance test.
 */
public enum TestOutcome {
    PASSED("✅"),
    FAILED("❌"),
    SKIPPED("⚠️"),
    METADATA_ERROR("📄"),
    HARNESS_ERROR("⚙️"),
    TIMEOUT_ERROR("💀"),
    PROCESS_ERROR("💥️"),
    RUNNER_EXCEPTION("🐞"),
    TODO_ERROR("📝");

    private final String symbol;

    TestOutcome(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean isPassed() {
        return this == PASSED;
    }
}
