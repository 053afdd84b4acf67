package com.reviewmerge.infrastructure.consolidation.merge;

import com.reviewmerge.domain.consolidation.model.MergedItem;
import com.reviewmerge.domain.consolidation.model.Risk;
import com.reviewmerge.domain.consolidation.model.RisksResult;
import com.reviewmerge.domain.consolidation.model.SourceReport;
import com.reviewmerge.infrastructure.consolidation.normalize.SeverityNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Deduplicates risks on the first 60 chars of their description and orders them
 * critical → high → medium → low → anything else, then by agreement count descending.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RiskMerger {

    private final SeverityNormalizer severityNormalizer;

    public RisksResult merge(List<SourceReport> reports) {
        MergeAccumulator<Risk> accumulator = new MergeAccumulator<>();
        for (SourceReport report : reports) {
            for (Risk risk : report.risks()) {
                accumulator.add(DedupKeys.descriptionKey(risk.description()), report.source(), risk);
            }
        }

        List<MergedItem<Risk>> sorted = new ArrayList<>(accumulator.toMergedItems(
                r -> r.withSeverity(severityNormalizer.normalize(r.severity()))));
        sorted.sort(Comparator.<MergedItem<Risk>>comparingInt(m -> severityNormalizer.rank(m.item().severity()))
                .thenComparing(Comparator.<MergedItem<Risk>>comparingInt(MergedItem::agreementCount).reversed()));

        Map<String, List<MergedItem<Risk>>> bySeverity = new LinkedHashMap<>();
        for (MergedItem<Risk> item : sorted) {
            String severity = item.item().severity() != null ? item.item().severity() : FindingMerger.UNKNOWN_SEVERITY;
            bySeverity.computeIfAbsent(severity, k -> new ArrayList<>()).add(item);
        }

        log.debug("[RiskMerger] {} merged risks across {} severities", sorted.size(), bySeverity.size());

        return new RisksResult(sorted, bySeverity, sorted.size());
    }
}
