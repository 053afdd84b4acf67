package com.reviewmerge.domain.consolidation.model;

import java.util.List;
import java.util.Map;

/**
 * Self-reported metrics of one source.
 *
 * @param confidence    numeric confidence, null when missing or not a number
 * @param coverage      coverage label, nullable
 * @param summaryStats  named counters (non-numeric values already coerced to 0)
 * @param topPriorities the source's top priorities, in its order
 */
public record SourceMetrics(
        Double confidence,
        String coverage,
        Map<String, Long> summaryStats,
        List<String> topPriorities
) {
    public SourceMetrics {
        summaryStats = summaryStats == null ? Map.of() : Map.copyOf(summaryStats);
        topPriorities = topPriorities == null ? List.of() : List.copyOf(topPriorities);
    }
}
