package com.guildsentinel.core.detection;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link Similarity}.
 */
class SimilarityTest {

    @Test
    @DisplayName("Should compute the classic edit distance")
    void shouldComputeLevenshtein() {
        assertThat(Similarity.levenshtein("kitten", "sitting")).isEqualTo(3);
        assertThat(Similarity.levenshtein("", "abc")).isEqualTo(3);
        assertThat(Similarity.levenshtein("same", "same")).isZero();
    }

    @Test
    @DisplayName("Should normalize distance by the longer string")
    void shouldComputeRatio() {
        assertThat(Similarity.ratio("kitten", "sitting")).isCloseTo(1.0 - 3.0 / 7.0, within(1e-9));
        assertThat(Similarity.ratio("abc", "xyz")).isZero();
    }

    @Test
    @DisplayName("Should treat identical and empty strings as fully similar")
    void shouldHandleIdentity() {
        assertThat(Similarity.ratio("buy gold", "buy gold")).isEqualTo(1.0);
        assertThat(Similarity.ratio("", "")).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should be symmetric")
    void shouldBeSymmetric() {
        assertThat(Similarity.ratio("free nitro here", "free nitro there"))
                .isEqualTo(Similarity.ratio("free nitro there", "free nitro here"));
    }
}
