package com.jsconformance.model;

/**
 * Flags a test262 test may declare in its frontmatter.
 */
public enum ExecutionFlag {
    ONLY_STRICT("onlyStrict"),
    NO_STRICT("noStrict"),
    MODULE("module"),
    RAW("raw"),
    ASYNC("async"),
    GENERATED("generated"),
    CAN_BLOCK_IS_FALSE("CanBlockIsFalse"),
    CAN_BLOCK_IS_TRUE("CanBlockIsTrue"),
    NON_DETERMINISTIC("non-deterministic");

    private final String frontmatterName;

    ExecutionFlag(String frontmatterName) {
        this.frontmatterName = frontmatterName;
    }

    public String frontmatterName() {
        return frontmatterName;
    }

    /**
     * @return the matching flag, or {@code null} for an unknown name
     */
    public static ExecutionFlag fromFrontmatterName(String name) {
        for (ExecutionFlag flag : values()) {
            if (flag.frontmatterName.equals(name)) {
                return flag;
            }
        }
        return null;
    }
}
