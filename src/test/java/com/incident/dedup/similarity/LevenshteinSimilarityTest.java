package com.incident.dedup.similarity;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.*;

class LevenshteinSimilarityTest {

    private final LevenshteinSimilarity similarity = new LevenshteinSimilarity();

    @ParameterizedTest
    @CsvSource({
            "kitten, sitting, 3",
            "OCEANSTAR, OCEANSTARR, 1",
            "flaw, lawn, 2",
            "'', abc, 3",
            "same, same, 0"
    })
    @DisplayName("Should compute edit distance")
    void testDistance(String a, String b, int expected) {
        assertEquals(expected, LevenshteinSimilarity.distance(a, b));
    }

    @Test
    @DisplayName("Similarity is 1 - distance / max length")
    void testSimilarity() {
        assertEquals(1.0 - 3.0 / 7.0, similarity.compute("kitten", "sitting"), 1e-9);
        assertEquals(0.9, similarity.compute("OCEANSTAR", "OCEANSTARR"), 1e-9);
    }

    @Test
    @DisplayName("Edge cases")
    void testEdgeCases() {
        assertEquals(1.0, similarity.compute("", ""));
        assertEquals(0.0, similarity.compute("abc", ""));
        assertEquals(0.0, similarity.compute(null, "abc"));
        assertEquals(0.0, similarity.compute("abc", "xyz"));
    }
}
