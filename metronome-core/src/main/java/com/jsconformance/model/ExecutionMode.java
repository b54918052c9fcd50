package com.jsconformance.model;

public enum ExecutionMode {
    STRICT,
    SLOPPY;

    public boolean isStrict() {
        return this == STRICT;
    }
}
