package com.reviewmerge.infrastructure.consolidation.merge;

import com.reviewmerge.domain.consolidation.model.*;
import com.reviewmerge.infrastructure.consolidation.normalize.SeverityNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Deduplicates findings across sources and groups them by category and severity.
 *
 * Key: {@code lowercase(category) + ":" + first 50 chars of lowercase(trim(description))}.
 * When several sources hit the same key, the finding of the last source in input order is kept.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FindingMerger {

    static final String UNKNOWN_SEVERITY = "unknown";

    private final SeverityNormalizer severityNormalizer;

    public FindingsResult merge(List<SourceReport> reports) {
        MergeAccumulator<Finding> accumulator = new MergeAccumulator<>();
        Map<String, Integer> sourceCounts = new LinkedHashMap<>();
        int rawCount = 0;

        for (SourceReport report : reports) {
            for (Finding finding : report.findings()) {
                accumulator.add(DedupKeys.findingKey(finding.category(), finding.description()),
                        report.source(), finding);
                sourceCounts.merge(report.source(), 1, Integer::sum);
                rawCount++;
            }
        }

        List<MergedItem<Finding>> allFindings = accumulator.toMergedItems(
                f -> f.withSeverity(severityNormalizer.normalize(f.severity())));

        Map<String, List<MergedItem<Finding>>> byCategory = new LinkedHashMap<>();
        Map<String, List<MergedItem<Finding>>> bySeverity = new LinkedHashMap<>();
        List<UniqueInsight<Finding>> uniqueInsights = new ArrayList<>();

        for (MergedItem<Finding> merged : allFindings) {
            Finding finding = merged.item();
            byCategory.computeIfAbsent(finding.category(), k -> new ArrayList<>()).add(merged);
            String severity = finding.severity() != null ? finding.severity() : UNKNOWN_SEVERITY;
            bySeverity.computeIfAbsent(severity, k -> new ArrayList<>()).add(merged);
            if (merged.isUnique()) {
                uniqueInsights.add(UniqueInsight.from(merged));
            }
        }

        log.debug("[FindingMerger] {} raw findings -> {} merged, {} unique",
                rawCount, allFindings.size(), uniqueInsights.size());

        return new FindingsResult(allFindings, byCategory, bySeverity, uniqueInsights,
                sourceCounts, allFindings.size());
    }
}
