package com.reviewmerge.infrastructure.consolidation.merge;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Literal-prefix deduplication keys shared by the merge stages.
 *
 * Two items collapse iff their keys are equal. Keys are pure functions of the item text;
 * no fuzzy matching is attempted.
 */
final class DedupKeys {

    static final int FINDING_PREFIX_LENGTH = 50;
    static final int DESCRIPTION_PREFIX_LENGTH = 60;
    static final int TOPIC_WORD_COUNT = 3;

    private DedupKeys() {
    }

    /**
     * {@code lowercase(category) + ":" + first 50 chars of lowercase(trim(description))}.
     */
    static String findingKey(String category, String description) {
        return canonical(category) + ":" + prefix(canonical(description), FINDING_PREFIX_LENGTH);
    }

    /**
     * First 60 chars of lowercase(trim(text)). Used for recommendations, risks and ranked actions.
     */
    static String descriptionKey(String text) {
        return prefix(canonical(text), DESCRIPTION_PREFIX_LENGTH);
    }

    /**
     * Lowercase first three whitespace-separated words, joined by single spaces.
     */
    static String topic(String description) {
        if (description == null || description.isBlank()) {
            return "";
        }
        return Arrays.stream(description.trim().split("\\s+"))
                .limit(TOPIC_WORD_COUNT)
                .collect(Collectors.joining(" "))
                .toLowerCase(Locale.ROOT);
    }

    private static String canonical(String text) {
        return text == null ? "" : text.trim().toLowerCase(Locale.ROOT);
    }

    // Counts code points so surrogate pairs are never split
    private static String prefix(String text, int length) {
        if (text.codePointCount(0, text.length()) <= length) {
            return text;
        }
        return text.substring(0, text.offsetByCodePoints(0, length));
    }
}
