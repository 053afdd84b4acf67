package com.reviewmerge.infrastructure.consolidation.pipeline;

import com.reviewmerge.domain.consolidation.model.*;
import com.reviewmerge.infrastructure.consolidation.InvalidInputException;
import com.reviewmerge.infrastructure.consolidation.merge.*;
import com.reviewmerge.infrastructure.consolidation.normalize.SeverityNormalizer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static com.reviewmerge.infrastructure.consolidation.TestReports.*;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConsolidationPipelineTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:15:30Z");

    private ExecutorService executor;
    private ConsolidationPipeline pipeline;

    @BeforeEach
    void setUp() {
        executor = Executors.newFixedThreadPool(4);
        pipeline = pipelineWith(new FindingMerger(new SeverityNormalizer()));
    }

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    private ConsolidationPipeline pipelineWith(FindingMerger findingMerger) {
        SeverityNormalizer normalizer = new SeverityNormalizer();
        return new ConsolidationPipeline(
                findingMerger,
                new RecommendationMerger(),
                new RiskMerger(normalizer),
                new MetricsAggregator(),
                new ActionRanker(),
                new ConflictDetector(),
                new DataQualityInspector(normalizer),
                executor,
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Nested
    @DisplayName("Scenarios")
    class Scenarios {

        @Test
        @DisplayName("Two sources reporting the same finding share one merged item")
        void shared_finding() {
            ConsolidatedReport report = pipeline.consolidate(List.of(
                    withFindings("A", finding("security", "hardcoded API key found in config", "high")),
                    withFindings("B", finding("security", "hardcoded API key found in config", "high"))));

            assertThat(report.findings().allFindings()).hasSize(1);
            MergedItem<Finding> merged = report.findings().allFindings().get(0);
            assertThat(merged.sources()).containsExactly("A", "B");
            assertThat(merged.isUnique()).isFalse();
            assertThat(report.summary().uniqueInsights()).isZero();
        }

        @Test
        @DisplayName("A finding only one source saw is a unique insight")
        void unique_insight() {
            ConsolidatedReport report = pipeline.consolidate(List.of(
                    withFindings("A", finding("style", "inconsistent indentation", "low")),
                    withFindings("B")));

            assertThat(report.findings().uniqueInsights()).singleElement()
                    .satisfies(u -> assertThat(u.source()).isEqualTo("A"));
            assertThat(report.summary().uniqueInsights()).isEqualTo(1);
        }

        @Test
        @DisplayName("Priority disagreement on a shared topic is reported")
        void priority_conflict() {
            ConsolidatedReport report = pipeline.consolidate(List.of(
                    withRecommendations("A", rec("add rate limiting to login endpoint", "high")),
                    withRecommendations("B", rec("add rate limiting for auth", "low"))));

            assertThat(report.conflicts()).singleElement().satisfies(c -> {
                assertThat(c.kind()).isEqualTo(ConflictKind.PRIORITY_DISAGREEMENT);
                assertThat(c.sources()).containsExactly("A", "B");
            });
            assertThat(report.summary().conflictsFound()).isEqualTo(1);
            // Different descriptions beyond the topic are not merged
            assertThat(report.recommendations().totalCount()).isEqualTo(2);
        }

        @Test
        @DisplayName("Empty input gives an empty report, not an error")
        void empty_input() {
            ConsolidatedReport report = pipeline.consolidate(List.of());

            assertThat(report.summary()).isEqualTo(new ReportSummary(0, 0, 0, 0, 0, null));
            assertThat(report.metrics().averageConfidence()).isNull();
            assertThat(report.conflicts()).isEmpty();
            assertThat(report.rankedActions()).isEmpty();
            assertThat(report.metadata().sourceCount()).isZero();
            assertThat(report.dataQuality().complete()).isTrue();
        }

        @Test
        @DisplayName("Action ranked by all three sources gets avg rank 2.0 and leads")
        void ranked_actions() {
            ConsolidatedReport report = pipeline.consolidate(List.of(
                    withActions("A", action("refactor auth module", 1), action("add tracing", 1)),
                    withActions("B", action("refactor auth module", 3)),
                    withActions("C", action("refactor auth module", 2), action("pin dependencies", 1))));

            ConsolidatedAction top = report.rankedActions().get(0);
            assertThat(top.action()).isEqualTo("refactor auth module");
            assertThat(top.avgRank()).isEqualTo(2.0);
            assertThat(top.agreementCount()).isEqualTo(3);
            assertThat(top.consolidatedRank()).isEqualTo(1);
            assertThat(report.rankedActions()).extracting(ConsolidatedAction::consolidatedRank)
                    .containsExactly(1, 2, 3);
        }

        @Test
        @DisplayName("Average confidence skips the source that reported none")
        void confidence_average() {
            ConsolidatedReport report = pipeline.consolidate(List.of(
                    withMetrics("A", metrics(80.0, "full")),
                    withMetrics("B", metrics(90.0, "partial")),
                    withMetrics("C", metrics(null, "full"))));

            assertThat(report.metrics().averageConfidence()).isEqualTo(85.0);
            assertThat(report.summary().avgConfidence()).isEqualTo(85.0);
            assertThat(report.metrics().coverageConsensus()).isEqualTo("full");
        }
    }

    @Test
    @DisplayName("Metadata lists sources in input order with the pinned timestamp")
    void metadata() {
        ConsolidatedReport report = pipeline.consolidate(List.of(withFindings("claude"), withFindings("gemini")));

        assertThat(report.metadata().sources()).containsExactly("claude", "gemini");
        assertThat(report.metadata().sourceCount()).isEqualTo(2);
        assertThat(report.metadata().consolidatedAt()).isEqualTo(NOW);
        assertThat(report.metadata().version()).isEqualTo(ConsolidationPipeline.REPORT_VERSION);
    }

    @Test
    @DisplayName("Summary is derived from the computed sections")
    void summary_matches_sections() {
        SourceReport a = new SourceReport("A",
                List.of(finding("sec", "xss in comments", "high"), finding("perf", "slow startup", "low")),
                List.of(rec("sanitize html output", "high")),
                List.of(risk("data breach", "critical")),
                metrics(70.0, "partial"),
                List.of(action("sanitize html", 1)));
        SourceReport b = new SourceReport("B",
                List.of(finding("sec", "XSS in comments", "hi")),
                List.of(rec("sanitize html output", "high"), rec("cache templates", "low")),
                List.of(risk("Data breach", "crit"), risk("downtime", "medium")),
                metrics(90.0, "partial"),
                List.of(action("sanitize html", 2)));

        ConsolidatedReport report = pipeline.consolidate(List.of(a, b));

        ReportSummary summary = report.summary();
        assertThat(summary.totalFindings()).isEqualTo(report.findings().totalCount()).isEqualTo(2);
        assertThat(summary.uniqueInsights()).isEqualTo(report.findings().uniqueInsights().size()).isEqualTo(1);
        assertThat(summary.totalRecommendations()).isEqualTo(2);
        assertThat(summary.totalRisks()).isEqualTo(2);
        assertThat(summary.conflictsFound()).isZero();
        assertThat(summary.avgConfidence()).isEqualTo(80.0);
        assertThat(report.risks().allRisks().get(0).item().severity()).isEqualTo("critical");
    }

    @Test
    @DisplayName("Repeated calls share no state")
    void stateless_between_calls() {
        List<SourceReport> input = List.of(
                withFindings("A", finding("x", "one", "low")),
                withFindings("B", finding("x", "one", "low")));

        ConsolidatedReport first = pipeline.consolidate(input);
        ConsolidatedReport second = pipeline.consolidate(input);

        assertThat(second.findings()).isEqualTo(first.findings());
        assertThat(second.findings().allFindings().get(0).sources()).containsExactly("A", "B");
    }

    @Test
    @DisplayName("Many sources in parallel keep dedup invariants")
    void many_sources() {
        List<SourceReport> reports = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            reports.add(new SourceReport("s" + i,
                    List.of(finding("shared", "common issue", "high"), finding("own", "issue " + i, "low")),
                    List.of(rec("shared fix", i % 2 == 0 ? "high" : "low")),
                    null, metrics((double) i, null),
                    List.of(action("shared action", i + 1))));
        }

        ConsolidatedReport report = pipeline.consolidate(reports);

        assertThat(report.findings().totalCount()).isEqualTo(51);
        assertThat(report.findings().uniqueInsights()).hasSize(50);
        assertThat(report.findings().allFindings().get(0).agreementCount()).isEqualTo(50);
        assertThat(report.rankedActions()).singleElement()
                .satisfies(a -> assertThat(a.avgRank()).isEqualTo(25.5));
        assertThat(report.metrics().averageConfidence()).isEqualTo(24.5);
        assertThat(report.conflicts()).hasSize(1);
    }

    @Nested
    @DisplayName("Failure semantics")
    class Failures {

        @Test
        void null_list_is_invalid_input() {
            assertThatThrownBy(() -> pipeline.consolidate(null))
                    .isInstanceOf(InvalidInputException.class);
        }

        @Test
        void null_element_is_invalid_input() {
            List<SourceReport> reports = new ArrayList<>();
            reports.add(withFindings("A"));
            reports.add(null);

            assertThatThrownBy(() -> pipeline.consolidate(reports))
                    .isInstanceOf(InvalidInputException.class)
                    .hasMessageContaining("index 1");
        }

        @Test
        void stage_failure_propagates_without_partial_result() {
            FindingMerger failing = mock(FindingMerger.class);
            when(failing.merge(anyList())).thenThrow(new IllegalStateException("boom"));
            ConsolidationPipeline broken = pipelineWith(failing);

            assertThatThrownBy(() -> broken.consolidate(List.of(withFindings("A"))))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessage("boom");
        }
    }

    @Test
    @DisplayName("Runs on the caller thread when given a direct executor")
    void direct_executor() {
        ConsolidationPipeline sequential = new ConsolidationPipeline(
                new FindingMerger(new SeverityNormalizer()), new RecommendationMerger(),
                new RiskMerger(new SeverityNormalizer()), new MetricsAggregator(), new ActionRanker(),
                new ConflictDetector(), new DataQualityInspector(new SeverityNormalizer()),
                Runnable::run, Clock.systemUTC());

        ConsolidatedReport report = sequential.consolidate(List.of(
                new SourceReport("A", null, null, null, null, null)));

        assertThat(report.dataQuality().incompleteSources()).containsOnlyKeys("A");
        assertThat(report.metrics().combinedSummaryStats()).containsAllEntriesOf(Map.of("critical_count", 0L));
    }
}
