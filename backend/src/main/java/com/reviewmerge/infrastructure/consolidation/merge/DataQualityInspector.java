package com.reviewmerge.infrastructure.consolidation.merge;

import com.reviewmerge.domain.consolidation.model.*;
import com.reviewmerge.infrastructure.consolidation.normalize.SeverityNormalizer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Audits recoverable input problems: severity/priority values outside the known vocabulary
 * and report sections a source left empty. Never rejects input.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DataQualityInspector {

    private final SeverityNormalizer severityNormalizer;

    public DataQualityReport inspect(List<SourceReport> reports) {
        Map<String, Integer> unnormalized = new TreeMap<>();
        Map<String, List<String>> incomplete = new LinkedHashMap<>();

        for (SourceReport report : reports) {
            report.findings().forEach(f -> countIfUnknown(unnormalized, f.severity()));
            report.risks().forEach(r -> countIfUnknown(unnormalized, r.severity()));
            report.recommendations().forEach(r -> countIfUnknown(unnormalized, r.priority()));

            List<String> missing = missingSections(report);
            if (!missing.isEmpty()) {
                incomplete.merge(report.source(), missing, (a, b) -> {
                    List<String> both = new ArrayList<>(a);
                    both.retainAll(b);
                    return both;
                });
            }
        }

        if (!unnormalized.isEmpty()) {
            log.warn("[DataQuality] Unnormalized severity/priority values passed through: {}", unnormalized);
        }
        incomplete.values().removeIf(List::isEmpty);
        return new DataQualityReport(unnormalized, incomplete, incomplete.isEmpty());
    }

    private void countIfUnknown(Map<String, Integer> counts, String value) {
        if (value != null && !severityNormalizer.isKnown(value)) {
            counts.merge(value, 1, Integer::sum);
        }
    }

    private static List<String> missingSections(SourceReport report) {
        List<String> missing = new ArrayList<>();
        if (report.findings().isEmpty()) missing.add("findings");
        if (report.recommendations().isEmpty()) missing.add("recommendations");
        if (report.risks().isEmpty()) missing.add("risks");
        if (report.metrics() == null) missing.add("metrics");
        if (report.rankedActions().isEmpty()) missing.add("ranked_actions");
        return missing;
    }
}
