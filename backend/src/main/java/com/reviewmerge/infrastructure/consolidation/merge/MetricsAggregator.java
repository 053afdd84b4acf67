package com.reviewmerge.infrastructure.consolidation.merge;

import com.reviewmerge.domain.consolidation.model.MetricsResult;
import com.reviewmerge.domain.consolidation.model.SourceMetrics;
import com.reviewmerge.domain.consolidation.model.SourceReport;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.*;

/**
 * Aggregates self-reported source metrics: mean confidence, consensus coverage,
 * summed counters and the concatenated top-priority list.
 */
@Slf4j
@Component
public class MetricsAggregator {

    static final List<String> STANDARD_COUNTERS = List.of(
            "critical_count", "high_count", "medium_count", "low_count");

    public MetricsResult aggregate(List<SourceReport> reports) {
        List<Double> confidences = new ArrayList<>();
        Map<String, Integer> coverageCounts = new LinkedHashMap<>();
        Map<String, Long> combinedStats = new LinkedHashMap<>();
        STANDARD_COUNTERS.forEach(counter -> combinedStats.put(counter, 0L));
        Map<String, SourceMetrics> perSource = new LinkedHashMap<>();
        List<String> allPriorities = new ArrayList<>();

        for (SourceReport report : reports) {
            SourceMetrics metrics = report.metrics();
            if (metrics == null) {
                continue;
            }
            if (metrics.confidence() != null) {
                confidences.add(metrics.confidence());
            }
            if (metrics.coverage() != null && !metrics.coverage().isBlank()) {
                coverageCounts.merge(metrics.coverage(), 1, Integer::sum);
            }
            metrics.summaryStats().forEach((key, value) ->
                    combinedStats.merge(key, value, MetricsAggregator::saturatingAdd));
            allPriorities.addAll(metrics.topPriorities());
            perSource.put(report.source(), metrics);
        }

        Double averageConfidence = confidences.isEmpty() ? null : roundToTenth(
                confidences.stream().mapToDouble(Double::doubleValue).average().orElseThrow());

        log.debug("[MetricsAggregator] {} sources with metrics, {} confidences, avg={}",
                perSource.size(), confidences.size(), averageConfidence);

        return new MetricsResult(averageConfidence, mostFrequent(coverageCounts),
                combinedStats, perSource, allPriorities);
    }

    /**
     * Highest count wins; on a tie the key seen first wins.
     */
    private static String mostFrequent(Map<String, Integer> counts) {
        String best = null;
        int bestCount = 0;
        for (Map.Entry<String, Integer> entry : counts.entrySet()) {
            if (entry.getValue() > bestCount) {
                best = entry.getKey();
                bestCount = entry.getValue();
            }
        }
        return best;
    }

    /**
     * Half-even at one decimal, so 85.25 becomes 85.2.
     */
    static double roundToTenth(double value) {
        return BigDecimal.valueOf(value).setScale(1, RoundingMode.HALF_EVEN).doubleValue();
    }

    static long saturatingAdd(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            log.warn("[MetricsAggregator] Counter overflow adding {} + {}, clamping", a, b);
            return b > 0 ? Long.MAX_VALUE : Long.MIN_VALUE;
        }
    }
}
