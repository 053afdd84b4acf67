package com.reviewmerge.domain.consolidation.model;

import java.util.Map;

/**
 * A suggested change reported by one analysis source.
 *
 * @param category    grouping category, "uncategorized" when the source gave none
 * @param description free-text description (empty string when missing)
 * @param priority    priority label as given by the source, "medium" when missing
 * @param extra       any other fields the source attached, kept opaque
 */
public record Recommendation(
        String category,
        String description,
        String priority,
        Map<String, Object> extra
) {
    public static final String DEFAULT_PRIORITY = "medium";

    public Recommendation {
        category = category == null || category.isBlank() ? Finding.DEFAULT_CATEGORY : category;
        description = description == null ? "" : description;
        priority = priority == null || priority.isBlank() ? DEFAULT_PRIORITY : priority;
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }
}
