package com.reviewmerge.infrastructure.consolidation.merge;

import com.reviewmerge.domain.consolidation.model.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Deduplicates recommendations on the first 60 chars of their description (category is ignored).
 *
 * Result order: agreement count descending, then priority string ascending. Priorities are
 * compared lexicographically, not by severity.
 */
@Slf4j
@Component
public class RecommendationMerger {

    private static final Comparator<MergedItem<Recommendation>> CONSENSUS_ORDER =
            Comparator.<MergedItem<Recommendation>>comparingInt(MergedItem::agreementCount).reversed()
                    .thenComparing(m -> m.item().priority());

    public RecommendationsResult merge(List<SourceReport> reports) {
        MergeAccumulator<Recommendation> accumulator = new MergeAccumulator<>();
        for (SourceReport report : reports) {
            for (Recommendation rec : report.recommendations()) {
                accumulator.add(DedupKeys.descriptionKey(rec.description()), report.source(), rec);
            }
        }

        List<MergedItem<Recommendation>> merged = accumulator.toMergedItems();

        // Grouping and unique list follow first-seen order, before the consensus sort
        Map<String, List<MergedItem<Recommendation>>> byPriority = new LinkedHashMap<>();
        List<UniqueInsight<Recommendation>> unique = new ArrayList<>();
        for (MergedItem<Recommendation> item : merged) {
            byPriority.computeIfAbsent(item.item().priority(), k -> new ArrayList<>()).add(item);
            if (item.isUnique()) {
                unique.add(UniqueInsight.from(item));
            }
        }

        List<MergedItem<Recommendation>> sorted = new ArrayList<>(merged);
        sorted.sort(CONSENSUS_ORDER);

        log.debug("[RecommendationMerger] {} merged recommendations, {} unique", sorted.size(), unique.size());

        return new RecommendationsResult(sorted, byPriority, unique, sorted.size());
    }
}
