package com.reviewmerge.domain.consolidation.model;

import java.util.List;
import java.util.Map;

/**
 * Output of finding deduplication.
 *
 * @param allFindings    deduplicated findings with normalized severity, in first-seen key order
 * @param byCategory     allFindings grouped by category
 * @param bySeverity     allFindings grouped by severity ("unknown" when absent)
 * @param uniqueInsights findings only one source reported
 * @param sourceCounts   raw (pre-dedup) findings per source
 * @param totalCount     size of allFindings
 */
public record FindingsResult(
        List<MergedItem<Finding>> allFindings,
        Map<String, List<MergedItem<Finding>>> byCategory,
        Map<String, List<MergedItem<Finding>>> bySeverity,
        List<UniqueInsight<Finding>> uniqueInsights,
        Map<String, Integer> sourceCounts,
        int totalCount
) {
    public static FindingsResult empty() {
        return new FindingsResult(List.of(), Map.of(), Map.of(), List.of(), Map.of(), 0);
    }
}
