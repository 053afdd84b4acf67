package com.reviewmerge.domain.consolidation.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * A deduplicated item together with the sources that reported it.
 *
 * @param item     the retained payload (last contributing source wins)
 * @param sources  contributing source identifiers in first-contribution order, never empty
 * @param isUnique true iff exactly one source contributed
 */
public record MergedItem<T>(
        T item,
        Set<String> sources,
        @JsonProperty("isUnique") boolean isUnique
) {
    public MergedItem {
        if (sources == null || sources.isEmpty()) {
            throw new IllegalArgumentException("Merged item must have at least one source");
        }
        if (isUnique != (sources.size() == 1)) {
            throw new IllegalArgumentException(
                    "isUnique=" + isUnique + " contradicts " + sources.size() + " sources");
        }
        sources = Collections.unmodifiableSet(new LinkedHashSet<>(sources));
    }

    public static <T> MergedItem<T> of(T item, Set<String> sources) {
        return new MergedItem<>(item, sources, sources.size() == 1);
    }

    @JsonProperty("agreementCount")
    public int agreementCount() {
        return sources.size();
    }

    /**
     * The sole contributing source of a unique item.
     */
    public String soleSource() {
        if (!isUnique) {
            throw new IllegalStateException("Item has " + sources.size() + " sources");
        }
        return sources.iterator().next();
    }
}
