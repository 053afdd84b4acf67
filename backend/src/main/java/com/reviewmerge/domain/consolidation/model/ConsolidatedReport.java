package com.reviewmerge.domain.consolidation.model;

import java.util.List;

/**
 * Result of consolidating a set of source reports. Created fresh per call.
 */
public record ConsolidatedReport(
        ReportMetadata metadata,
        FindingsResult findings,
        RecommendationsResult recommendations,
        RisksResult risks,
        MetricsResult metrics,
        List<ConsolidatedAction> rankedActions,
        List<Conflict> conflicts,
        DataQualityReport dataQuality,
        ReportSummary summary
) {}
