package com.reviewmerge.infrastructure.consolidation.merge;

import com.reviewmerge.domain.consolidation.model.Conflict;
import com.reviewmerge.domain.consolidation.model.ConflictKind;
import com.reviewmerge.domain.consolidation.model.Recommendation;
import com.reviewmerge.domain.consolidation.model.SourceReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Flags recommendations whose topic (first three words) is shared across sources
 * but whose priorities differ.
 *
 * Works on the raw, pre-dedup recommendations. Coarse on purpose: unrelated recommendations
 * that open with the same three words are flagged too, and resolution is left to the reader.
 */
@Slf4j
@Component
public class ConflictDetector {

    public List<Conflict> detect(List<SourceReport> reports) {
        Map<String, List<Vote>> votesByTopic = new LinkedHashMap<>();
        for (SourceReport report : reports) {
            for (Recommendation rec : report.recommendations()) {
                votesByTopic.computeIfAbsent(DedupKeys.topic(rec.description()), k -> new ArrayList<>())
                        .add(new Vote(report.source(), rec));
            }
        }

        List<Conflict> conflicts = new ArrayList<>();
        votesByTopic.forEach((topic, votes) -> {
            if (votes.size() < 2) {
                return;
            }
            Set<String> sources = new LinkedHashSet<>();
            Set<String> priorities = new HashSet<>();
            for (Vote vote : votes) {
                sources.add(vote.source());
                priorities.add(vote.recommendation().priority());
            }
            if (sources.size() >= 2 && priorities.size() >= 2) {
                conflicts.add(new Conflict(topic, ConflictKind.PRIORITY_DISAGREEMENT,
                        List.copyOf(sources),
                        votes.stream().map(Vote::recommendation).toList()));
            }
        });

        if (!conflicts.isEmpty()) {
            log.debug("[ConflictDetector] {} priority disagreements across {} topics",
                    conflicts.size(), votesByTopic.size());
        }
        return conflicts;
    }

    private record Vote(String source, Recommendation recommendation) {}
}
