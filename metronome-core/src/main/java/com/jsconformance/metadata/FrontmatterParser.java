package com.jsconformance.metadata;

import com.jsconformance.model.MetadataException;

/**
 * Turns the YAML text of a frontmatter block into a {@link FrontmatterDocument}.
 */
@FunctionalInterface
public interface FrontmatterParser {

    /**
     * @throws MetadataException if the text is not a usable YAML mapping
     */
    FrontmatterDocument parse(String yaml) throws MetadataException;
}
