package com.reviewmerge.infrastructure.consolidation.pipeline;

import com.reviewmerge.domain.consolidation.model.*;
import com.reviewmerge.domain.consolidation.service.ConsolidationService;
import com.reviewmerge.infrastructure.consolidation.ConsolidationException;
import com.reviewmerge.infrastructure.consolidation.InvalidInputException;
import com.reviewmerge.infrastructure.consolidation.merge.*;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Consolidation orchestrator.
 *
 * Pipeline:
 *   validate input → fan out { findings, recommendations, risks, metrics, ranked actions,
 *   conflicts, data quality } → join → assemble report + derived summary
 *
 * The fanned-out stages share no state: each reads the immutable report list and builds its
 * own maps, so no locking is needed. Holds no state between calls.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ConsolidationPipeline implements ConsolidationService {

    public static final String REPORT_VERSION = "1.0.0";

    private final FindingMerger findingMerger;
    private final RecommendationMerger recommendationMerger;
    private final RiskMerger riskMerger;
    private final MetricsAggregator metricsAggregator;
    private final ActionRanker actionRanker;
    private final ConflictDetector conflictDetector;
    private final DataQualityInspector dataQualityInspector;
    private final Executor consolidationExecutor;
    private final Clock consolidationClock;

    @Override
    public ConsolidatedReport consolidate(List<SourceReport> reports) {
        List<SourceReport> input = validate(reports);
        long start = System.currentTimeMillis();

        CompletableFuture<FindingsResult> findingsFuture = stage(() -> findingMerger.merge(input));
        CompletableFuture<RecommendationsResult> recommendationsFuture = stage(() -> recommendationMerger.merge(input));
        CompletableFuture<RisksResult> risksFuture = stage(() -> riskMerger.merge(input));
        CompletableFuture<MetricsResult> metricsFuture = stage(() -> metricsAggregator.aggregate(input));
        CompletableFuture<List<ConsolidatedAction>> actionsFuture = stage(() -> actionRanker.rank(input));
        CompletableFuture<List<Conflict>> conflictsFuture = stage(() -> conflictDetector.detect(input));
        CompletableFuture<DataQualityReport> qualityFuture = stage(() -> dataQualityInspector.inspect(input));

        try {
            CompletableFuture.allOf(findingsFuture, recommendationsFuture, risksFuture, metricsFuture,
                    actionsFuture, conflictsFuture, qualityFuture).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) throw re;
            throw new ConsolidationException("Consolidation stage failed", cause);
        }

        FindingsResult findings = findingsFuture.join();
        RecommendationsResult recommendations = recommendationsFuture.join();
        RisksResult risks = risksFuture.join();
        MetricsResult metrics = metricsFuture.join();
        List<Conflict> conflicts = conflictsFuture.join();

        List<String> sources = input.stream().map(SourceReport::source).toList();
        ReportMetadata metadata = new ReportMetadata(sources, sources.size(),
                Instant.now(consolidationClock), REPORT_VERSION);
        ReportSummary summary = ReportSummary.from(findings, recommendations, risks, metrics, conflicts);

        log.info("[Consolidation] {} sources → {} findings ({} unique), {} recommendations, {} risks, "
                        + "{} conflicts in {}ms",
                sources.size(), summary.totalFindings(), summary.uniqueInsights(),
                summary.totalRecommendations(), summary.totalRisks(), summary.conflictsFound(),
                System.currentTimeMillis() - start);

        return new ConsolidatedReport(metadata, findings, recommendations, risks, metrics,
                actionsFuture.join(), conflicts, qualityFuture.join(), summary);
    }

    private <T> CompletableFuture<T> stage(Supplier<T> work) {
        return CompletableFuture.supplyAsync(work, consolidationExecutor);
    }

    private static List<SourceReport> validate(List<SourceReport> reports) {
        if (reports == null) {
            throw new InvalidInputException("Source report list must not be null");
        }
        for (int i = 0; i < reports.size(); i++) {
            if (reports.get(i) == null) {
                throw new InvalidInputException("Source report at index " + i + " is null");
            }
        }
        return List.copyOf(reports);
    }
}
