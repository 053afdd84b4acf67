package com.reviewmerge.domain.consolidation.model;

import java.util.List;
import java.util.Map;

/**
 * Recoverable input problems observed during consolidation.
 *
 * @param unnormalizedValues severity/priority values outside the known vocabulary, with occurrence counts
 * @param incompleteSources  per source, the report sections it left empty or absent
 * @param complete           true iff no source is incomplete
 */
public record DataQualityReport(
        Map<String, Integer> unnormalizedValues,
        Map<String, List<String>> incompleteSources,
        boolean complete
) {}
