package com.reviewmerge.domain.consolidation.model;

import java.util.List;

/**
 * One analysis source's complete report. Absent sections are empty lists; absent metrics are null.
 */
public record SourceReport(
        String source,
        List<Finding> findings,
        List<Recommendation> recommendations,
        List<Risk> risks,
        SourceMetrics metrics,
        List<RankedAction> rankedActions
) {
    public static final String UNKNOWN_SOURCE = "unknown";

    public SourceReport {
        source = source == null || source.isBlank() ? UNKNOWN_SOURCE : source;
        findings = findings == null ? List.of() : List.copyOf(findings);
        recommendations = recommendations == null ? List.of() : List.copyOf(recommendations);
        risks = risks == null ? List.of() : List.copyOf(risks);
        rankedActions = rankedActions == null ? List.of() : List.copyOf(rankedActions);
    }
}
