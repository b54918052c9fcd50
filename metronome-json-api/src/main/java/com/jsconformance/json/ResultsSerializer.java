package com.jsconformance.json;

import com.jsconformance.report.RunResults;

/**
 * Interface for writing run results as JSON documents of the form
 * {@code {"duration": <seconds>, "results": ...}}.
 */
public interface ResultsSerializer {

    /**
     * Serializes the directory tree: every node is
     * {@code {"count": n, "results": {<outcome>: n, ...}, "children": {...}}}.
     *
     * @param results the run to serialize
     * @return the JSON document
     * @throws ConformanceJsonException if serialization fails
     */
    String serializeTree(RunResults results) throws ConformanceJsonException;

    /**
     * Serializes the per-file map, {@code {"<relative path>": "<OUTCOME>", ...}}, sorted by path.
     *
     * @param results the run to serialize
     * @return the JSON document
     * @throws ConformanceJsonException if serialization fails
     */
    String serializePerFile(RunResults results) throws ConformanceJsonException;
}
