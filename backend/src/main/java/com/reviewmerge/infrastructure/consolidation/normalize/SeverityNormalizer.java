package com.reviewmerge.infrastructure.consolidation.normalize;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Canonicalizes severity vocabulary to critical / high / medium / low.
 *
 * Matching is case-insensitive on trimmed input. Unrecognized values are returned
 * unchanged so callers can detect and report them.
 */
@Component
public class SeverityNormalizer {

    public static final String CRITICAL = "critical";
    public static final String HIGH = "high";
    public static final String MEDIUM = "medium";
    public static final String LOW = "low";

    /** Canonical levels, most severe first. */
    public static final List<String> LEVELS = List.of(CRITICAL, HIGH, MEDIUM, LOW);

    private static final Map<String, String> SYNONYMS = Map.ofEntries(
            Map.entry(CRITICAL, CRITICAL),
            Map.entry("crit", CRITICAL),
            Map.entry(HIGH, HIGH),
            Map.entry("hi", HIGH),
            Map.entry(MEDIUM, MEDIUM),
            Map.entry("med", MEDIUM),
            Map.entry("moderate", MEDIUM),
            Map.entry(LOW, LOW),
            Map.entry("lo", LOW),
            Map.entry("minor", LOW)
    );

    /**
     * Normalize a severity label.
     *
     * @param raw severity as reported, nullable
     * @return the canonical level, or {@code raw} itself when it is not a known synonym
     */
    public String normalize(String raw) {
        if (raw == null) {
            return null;
        }
        String canonical = SYNONYMS.get(raw.trim().toLowerCase(Locale.ROOT));
        return canonical != null ? canonical : raw;
    }

    /**
     * Whether the value maps onto one of the four canonical levels.
     */
    public boolean isKnown(String raw) {
        return raw != null && SYNONYMS.containsKey(raw.trim().toLowerCase(Locale.ROOT));
    }

    /**
     * Sort rank of a severity: critical=0 .. low=3, anything else (including null) after low.
     */
    public int rank(String severity) {
        int index = LEVELS.indexOf(normalize(severity));
        return index >= 0 ? index : LEVELS.size();
    }
}
