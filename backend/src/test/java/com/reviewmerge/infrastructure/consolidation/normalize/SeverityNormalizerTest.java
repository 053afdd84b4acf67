package com.reviewmerge.infrastructure.consolidation.normalize;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class SeverityNormalizerTest {

    private SeverityNormalizer normalizer;

    @BeforeEach
    void setUp() {
        normalizer = new SeverityNormalizer();
    }

    @ParameterizedTest
    @CsvSource({
            "critical, critical",
            "CRIT, critical",
            "High, high",
            "hi, high",
            "med, medium",
            "Moderate, medium",
            "lo, low",
            "minor, low"
    })
    @DisplayName("Synonyms map onto the four canonical levels")
    void synonyms_are_canonicalized(String raw, String expected) {
        assertThat(normalizer.normalize(raw)).isEqualTo(expected);
    }

    @Test
    @DisplayName("Surrounding whitespace is ignored when matching")
    void whitespace_is_trimmed() {
        assertThat(normalizer.normalize("  HIGH \t")).isEqualTo("high");
    }

    @Test
    @DisplayName("Unknown values pass through unchanged")
    void unknown_passes_through() {
        assertThat(normalizer.normalize("Blocker")).isEqualTo("Blocker");
        assertThat(normalizer.isKnown("Blocker")).isFalse();
        assertThat(normalizer.normalize(null)).isNull();
    }

    @ParameterizedTest
    @ValueSource(strings = {"crit", "HI", "moderate", "Minor", "blocker", " info ", ""})
    @DisplayName("Normalization is idempotent")
    void idempotent(String raw) {
        String once = normalizer.normalize(raw);
        assertThat(normalizer.normalize(once)).isEqualTo(once);
    }

    @Test
    @DisplayName("Rank orders critical < high < medium < low < unknown")
    void rank_order() {
        assertThat(normalizer.rank("critical")).isEqualTo(0);
        assertThat(normalizer.rank("hi")).isEqualTo(1);
        assertThat(normalizer.rank("medium")).isEqualTo(2);
        assertThat(normalizer.rank("minor")).isEqualTo(3);
        assertThat(normalizer.rank("blocker")).isEqualTo(4);
        assertThat(normalizer.rank(null)).isEqualTo(4);
    }
}
