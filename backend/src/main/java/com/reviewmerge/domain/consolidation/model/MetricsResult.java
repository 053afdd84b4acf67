package com.reviewmerge.domain.consolidation.model;

import java.util.List;
import java.util.Map;

/**
 * Cross-source metric aggregation.
 *
 * @param averageConfidence    mean of reported confidences rounded to one decimal, null if none reported
 * @param coverageConsensus    most frequent coverage label (first seen wins ties), null if none reported
 * @param combinedSummaryStats counters summed key by key; the four severity counters are always present
 * @param perSourceMetrics     each source's metrics as received
 * @param allTopPriorities     every source's top priorities, concatenated in source order
 */
public record MetricsResult(
        Double averageConfidence,
        String coverageConsensus,
        Map<String, Long> combinedSummaryStats,
        Map<String, SourceMetrics> perSourceMetrics,
        List<String> allTopPriorities
) {}
