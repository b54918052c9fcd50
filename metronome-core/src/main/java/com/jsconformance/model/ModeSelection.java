package com.jsconformance.model;

import java.util.List;

/**
 * Which execution modes a test runs in, derived from its flags.
 */
public enum ModeSelection {
    /** Default: strict first, sloppy only if strict passed. */
    STRICT_THEN_SLOPPY(List.of(ExecutionMode.STRICT, ExecutionMode.SLOPPY)),
    STRICT_ONLY(List.of(ExecutionMode.STRICT)),
    SLOPPY_ONLY(List.of(ExecutionMode.SLOPPY));

    private final List<ExecutionMode> modes;

    ModeSelection(List<ExecutionMode> modes) {
        this.modes = modes;
    }

    /** Modes in the order they run. */
    public List<ExecutionMode> modes() {
        return modes;
    }
}
