package com.reviewmerge.application.consolidation;

import com.fasterxml.jackson.databind.JsonNode;
import com.reviewmerge.application.consolidation.exception.SourceLimitExceededException;
import com.reviewmerge.domain.consolidation.model.ConsolidatedReport;
import com.reviewmerge.domain.consolidation.model.SourceReport;
import com.reviewmerge.domain.consolidation.service.ConsolidationService;
import com.reviewmerge.infrastructure.consolidation.normalize.SourceReportReader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class ConsolidationAppService {

    private final SourceReportReader sourceReportReader;
    private final ConsolidationService consolidationService;

    @Value("${consolidation.max-sources:20}")
    private int maxSources;

    /**
     * Consolidate raw JSON reports (read → limit check → consolidate).
     */
    public ConsolidatedReport consolidate(JsonNode body) {
        return consolidate(sourceReportReader.read(body));
    }

    /**
     * Consolidate already-typed reports.
     */
    public ConsolidatedReport consolidate(List<SourceReport> reports) {
        validateSourceCount(reports);
        return consolidationService.consolidate(reports);
    }

    public void validateSourceCount(List<SourceReport> reports) {
        if (reports != null && reports.size() > maxSources) {
            log.warn("[Consolidation] Rejected request with {} sources (max {})", reports.size(), maxSources);
            throw new SourceLimitExceededException(
                    String.format("At most %d source reports can be consolidated at once, got %d",
                            maxSources, reports.size()));
        }
    }

    public int getMaxSources() {
        return maxSources;
    }
}
