package com.reviewmerge.domain.consolidation.service;

import com.reviewmerge.domain.consolidation.model.ConsolidatedReport;
import com.reviewmerge.domain.consolidation.model.SourceReport;

import java.util.List;

/**
 * Domain service for merging independent analysis reports into one consensus report.
 */
public interface ConsolidationService {

    /**
     * Deduplicates, ranks and conflict-annotates the given reports.
     *
     * @param reports one report per analysis source, in the order their payloads should be
     *                applied (later sources win payload ties); may be empty
     * @return the consolidated report, never partial
     * @throws com.reviewmerge.infrastructure.consolidation.InvalidInputException if {@code reports}
     *         or one of its elements is null
     */
    ConsolidatedReport consolidate(List<SourceReport> reports);
}
