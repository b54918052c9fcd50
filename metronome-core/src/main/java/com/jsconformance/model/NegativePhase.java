package com.jsconformance.model;

/**
 * Phase in which a negative test is expected to fail.
 */
public enum NegativePhase {
    PARSE("parse"),
    EARLY("early"),
    RESOLUTION("resolution"),
    RUNTIME("runtime");

    private final String frontmatterName;

    NegativePhase(String frontmatterName) {
        this.frontmatterName = frontmatterName;
    }

    public String frontmatterName() {
        return frontmatterName;
    }

    /**
     * @throws ConfigurationException if the phase is not one of the known values
     */
    public static NegativePhase fromFrontmatterName(String name) {
        for (NegativePhase phase : values()) {
            if (phase.frontmatterName.equals(name)) {
                return phase;
            }
        }
        throw new ConfigurationException("Unexpected negative phase '" + name + "'");
    }
}
