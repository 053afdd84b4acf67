package com.reviewmerge.domain.consolidation.model;

/**
 * An item reported by exactly one source, paired with that source.
 */
public record UniqueInsight<T>(MergedItem<T> item, String source) {

    public static <T> UniqueInsight<T> from(MergedItem<T> merged) {
        return new UniqueInsight<>(merged, merged.soleSource());
    }
}
