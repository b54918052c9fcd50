package com.jsconformance;

import com.jsconformance.classify.ExecutionResultDecoder;
import com.jsconformance.exec.RecordDecoder;
import com.jsconformance.metadata.FrontmatterParser;

import java.util.Objects;

/**
 * The decoders a run needs for executor output and test metadata.
 */
public record ExecutorCodecs(
    RecordDecoder records,
    ExecutionResultDecoder results,
    FrontmatterParser frontmatter
) {

    public ExecutorCodecs {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(results, "results");
        Objects.requireNonNull(frontmatter, "frontmatter");
    }
}
