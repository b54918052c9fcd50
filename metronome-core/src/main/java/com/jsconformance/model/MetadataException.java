package com.jsconformance.model;

/**
 * A frontmatter block that exists but cannot be turned into {@link TestMetadata}.
 * Classified as {@link TestOutcome#METADATA_ERROR}, never propagated out of a run.
 */
public class MetadataException extends RuntimeException {

    public MetadataException(String message) {
        super(message);
    }

    public MetadataException(String message, Throwable cause) {
        super(message, cause);
    }
}
