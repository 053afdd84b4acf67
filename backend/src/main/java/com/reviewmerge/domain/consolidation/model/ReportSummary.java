package com.reviewmerge.domain.consolidation.model;

import java.util.List;

/**
 * Headline counts. Always derived from already-computed sections, never computed on its own.
 */
public record ReportSummary(
        int totalFindings,
        int uniqueInsights,
        int totalRecommendations,
        int totalRisks,
        int conflictsFound,
        Double avgConfidence
) {
    public static ReportSummary from(FindingsResult findings,
                                     RecommendationsResult recommendations,
                                     RisksResult risks,
                                     MetricsResult metrics,
                                     List<Conflict> conflicts) {
        return new ReportSummary(
                findings.totalCount(),
                findings.uniqueInsights().size(),
                recommendations.totalCount(),
                risks.totalCount(),
                conflicts.size(),
                metrics.averageConfidence()
        );
    }
}
