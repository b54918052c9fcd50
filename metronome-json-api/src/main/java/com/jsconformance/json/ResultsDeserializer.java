package com.jsconformance.json;

import com.jsconformance.report.PerFileReport;

/**
 * Interface for reading persisted per-file result documents.
 */
public interface ResultsDeserializer {

    /**
     * @param json a document written by {@link ResultsSerializer#serializePerFile}
     * @return the duration and outcome per path
     * @throws ConformanceJsonException if the document is malformed or names an unknown outcome
     */
    PerFileReport deserializePerFile(String json) throws ConformanceJsonException;
}
