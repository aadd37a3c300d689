package com.templatebinder.matching;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MatchConfidenceTest {

    @Test
    void bucketBoundariesAreInclusiveUpward() {
        assertEquals(MatchConfidence.EXACT, MatchConfidence.forScore(1.0));
        assertEquals(MatchConfidence.HIGH, MatchConfidence.forScore(0.9));
        assertEquals(MatchConfidence.GOOD, MatchConfidence.forScore(0.89999));
        assertEquals(MatchConfidence.GOOD, MatchConfidence.forScore(0.75));
        assertEquals(MatchConfidence.MEDIUM, MatchConfidence.forScore(0.6));
        assertEquals(MatchConfidence.LOW, MatchConfidence.forScore(0.59999));
        assertEquals(MatchConfidence.LOW, MatchConfidence.forScore(0.0));
    }

    @Test
    void fuzzySimilarityMapsToBuckets() {
        assertEquals(MatchConfidence.HIGH, LayerMatcher.fuzzyConfidence(0.95));
        assertEquals(MatchConfidence.GOOD, LayerMatcher.fuzzyConfidence(0.85));
        assertEquals(MatchConfidence.MEDIUM, LayerMatcher.fuzzyConfidence(0.75));
        assertEquals(MatchConfidence.LOW, LayerMatcher.fuzzyConfidence(0.71));
    }

    @Test
    void labelsAreLowercase() {
        assertEquals("exact", MatchConfidence.EXACT.getLabel());
        assertEquals("medium", MatchConfidence.MEDIUM.getLabel());
    }
}
