package com.reviewmerge.infrastructure.consolidation.merge;

import com.reviewmerge.domain.consolidation.model.MergedItem;

import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.UnaryOperator;

/**
 * Collapses items by dedup key. Keys keep first-seen order, sources keep first-contribution
 * order, and the payload of the last contribution is retained.
 *
 * Not thread-safe; each merge stage owns one instance per call.
 */
final class MergeAccumulator<T> {

    private final Map<String, Entry<T>> entries = new LinkedHashMap<>();

    void add(String key, String source, T payload) {
        Entry<T> entry = entries.computeIfAbsent(key, k -> new Entry<>());
        entry.sources.add(source);
        entry.payload = payload;
    }

    List<MergedItem<T>> toMergedItems(UnaryOperator<T> finisher) {
        return entries.values().stream()
                .map(e -> MergedItem.of(finisher.apply(e.payload), e.sources))
                .toList();
    }

    List<MergedItem<T>> toMergedItems() {
        return toMergedItems(UnaryOperator.identity());
    }

    private static final class Entry<T> {
        private final Set<String> sources = new LinkedHashSet<>();
        private T payload;
    }
}
