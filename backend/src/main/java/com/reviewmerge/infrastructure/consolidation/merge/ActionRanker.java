package com.reviewmerge.infrastructure.consolidation.merge;

import com.reviewmerge.domain.consolidation.model.ConsolidatedAction;
import com.reviewmerge.domain.consolidation.model.RankedAction;
import com.reviewmerge.domain.consolidation.model.SourceReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Merges every source's ranked action list into one consensus ranking.
 *
 * Actions are keyed on the first 60 chars of their text. Order: agreement count descending,
 * then mean source rank ascending. Consolidated ranks are 1..N, assigned after sorting.
 */
@Slf4j
@Component
public class ActionRanker {

    private static final Comparator<ConsolidatedAction> CONSENSUS_ORDER =
            Comparator.comparingInt(ConsolidatedAction::agreementCount).reversed()
                    .thenComparingDouble(ConsolidatedAction::avgRank);

    public List<ConsolidatedAction> rank(List<SourceReport> reports) {
        Map<String, ActionVotes> votesByKey = new LinkedHashMap<>();
        for (SourceReport report : reports) {
            for (RankedAction action : report.rankedActions()) {
                ActionVotes votes = votesByKey.computeIfAbsent(
                        DedupKeys.descriptionKey(action.action()), k -> new ActionVotes());
                votes.sources.add(report.source());
                votes.ranks.add(action.rank());
                votes.latest = action;
            }
        }

        List<ConsolidatedAction> merged = new ArrayList<>(votesByKey.size());
        for (ActionVotes votes : votesByKey.values()) {
            double avgRank = votes.ranks.stream().mapToInt(Integer::intValue).average().orElse(RankedAction.DEFAULT_RANK);
            merged.add(new ConsolidatedAction(
                    votes.latest.action(),
                    List.copyOf(votes.sources),
                    List.copyOf(votes.ranks),
                    votes.sources.size(),
                    avgRank,
                    0,
                    votes.latest.extra()));
        }
        merged.sort(CONSENSUS_ORDER);

        List<ConsolidatedAction> ranked = new ArrayList<>(merged.size());
        for (int i = 0; i < merged.size(); i++) {
            ranked.add(merged.get(i).withConsolidatedRank(i + 1));
        }
        verifyContiguous(ranked);

        log.debug("[ActionRanker] {} distinct actions ranked", ranked.size());
        return ranked;
    }

    private static void verifyContiguous(List<ConsolidatedAction> ranked) {
        for (int i = 0; i < ranked.size(); i++) {
            if (ranked.get(i).consolidatedRank() != i + 1) {
                throw new IllegalStateException("Consolidated ranks are not contiguous at position " + i
                        + ": got " + ranked.get(i).consolidatedRank());
            }
        }
    }

    private static final class ActionVotes {
        private final Set<String> sources = new LinkedHashSet<>();
        private final List<Integer> ranks = new ArrayList<>();
        private RankedAction latest;
    }
}
