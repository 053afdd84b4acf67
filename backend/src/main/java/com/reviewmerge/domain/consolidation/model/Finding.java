package com.reviewmerge.domain.consolidation.model;

import java.util.Map;

/**
 * A single observation reported by one analysis source.
 *
 * @param category    grouping category, "uncategorized" when the source gave none
 * @param description free-text description (empty string when missing)
 * @param severity    raw or normalized severity, nullable
 * @param extra       any other fields the source attached, kept opaque
 */
public record Finding(
        String category,
        String description,
        String severity,
        Map<String, Object> extra
) {
    public static final String DEFAULT_CATEGORY = "uncategorized";

    public Finding {
        category = category == null || category.isBlank() ? DEFAULT_CATEGORY : category;
        description = description == null ? "" : description;
        extra = extra == null ? Map.of() : Map.copyOf(extra);
    }

    public Finding withSeverity(String newSeverity) {
        return new Finding(category, description, newSeverity, extra);
    }
}
