package com.jsconformance.model;

/**
 * Result vocabulary of the batch executor's {@code RESULT} records.
 */
public enum ResultKind {
    HARNESS_ERROR("harness_error", TestOutcome.HARNESS_ERROR),
    METADATA_ERROR("metadata_error", TestOutcome.METADATA_ERROR),
    TIMEOUT("timeout", TestOutcome.TIMEOUT_ERROR),
    ASSERT_FAIL("assert_fail", TestOutcome.PROCESS_ERROR),
    PASSED("passed", TestOutcome.PASSED),
    SKIPPED("skipped", TestOutcome.SKIPPED),
    TODO_ERROR("todo_error", TestOutcome.TODO_ERROR),
    FAILED("failed", TestOutcome.FAILED);

    private final String wireName;
    private final TestOutcome outcome;

    ResultKind(String wireName, TestOutcome outcome) {
        this.wireName = wireName;
        this.outcome = outcome;
    }

    public String wireName() {
        return wireName;
    }

    public TestOutcome outcome() {
        return outcome;
    }

    /**
     * The executor terminates right after reporting a stopping result; nothing
     * further is expected from that invocation.
     */
    public boolean isStopping() {
        return this == TIMEOUT || this == ASSERT_FAIL;
    }

    /**
     * @return the matching kind, or {@code null} when the name is not part of the protocol
     */
    public static ResultKind fromWireName(String wireName) {
        for (ResultKind kind : values()) {
            if (kind.wireName.equals(wireName)) {
                return kind;
            }
        }
        return null;
    }
}
