package com.reviewmerge.domain.consolidation.model;

import java.util.List;
import java.util.Map;

/**
 * A ranked action after cross-source merging.
 *
 * @param action           action text of the last contributing source
 * @param sources          contributing sources in first-contribution order
 * @param sourceRanks      every contributed rank, in contribution order
 * @param agreementCount   number of distinct contributing sources
 * @param avgRank          mean of sourceRanks
 * @param consolidatedRank 1-based position in the consensus ranking
 * @param extra            opaque fields of the retained payload
 */
public record ConsolidatedAction(
        String action,
        List<String> sources,
        List<Integer> sourceRanks,
        int agreementCount,
        double avgRank,
        int consolidatedRank,
        Map<String, Object> extra
) {
    public ConsolidatedAction withConsolidatedRank(int rank) {
        return new ConsolidatedAction(action, sources, sourceRanks, agreementCount, avgRank, rank, extra);
    }
}
