package com.reviewmerge.domain.consolidation.model;

import java.util.List;
import java.util.Map;

public record RisksResult(
        List<MergedItem<Risk>> allRisks,
        Map<String, List<MergedItem<Risk>>> bySeverity,
        int totalCount
) {}
