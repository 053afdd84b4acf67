package com.reviewmerge.domain.consolidation.model;

import java.util.List;
import java.util.Map;

public record RecommendationsResult(
        List<MergedItem<Recommendation>> allRecommendations,
        Map<String, List<MergedItem<Recommendation>>> byPriority,
        List<UniqueInsight<Recommendation>> uniqueRecommendations,
        int totalCount
) {}
