package com.reviewmerge.domain.consolidation.model;

import java.util.Map;

/**
 * A risk reported by one analysis source.
 *
 * @param category    grouping category, "uncategorized" when the source gave none
 * @param description free-text description (empty string when missing)
 * @param severity    raw or normalized severity, nullable
 * @param extra       any other fields the source attached, kept opaque
 */
public record Risk(
        String category,
        String description,
        String severity,
        Map<String, Object> extra
) {
    public Risk {
        category = category == null || category.isBlank() ? Finding.DEFAULT_CATEGORY : category;
        description = description == null ? "" : description;
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public Risk withSeverity(String newSeverity) {
        return new Risk(category, description, newSeverity, extra);
    }
}
