package com.dcruver.notegraph.similarity;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SimilarityScorerTest {

    private static final double EPSILON = 1e-9;

    @Test
    void testJaroWinklerKnownValues() {
        assertEquals(0.9611, SimilarityScorer.jaroWinklerSimilarity("MARTHA", "MARHTA"), 1e-4);
        assertEquals(0.8133, SimilarityScorer.jaroWinklerSimilarity("DIXON", "DICKSONX"), 1e-4);
        assertEquals(1.0, SimilarityScorer.jaroWinklerSimilarity("same", "same"), EPSILON);
        assertEquals(0.0, SimilarityScorer.jaroWinklerSimilarity("", "abc"), EPSILON);
        assertEquals(0.0, SimilarityScorer.jaroWinklerSimilarity("abc", "xyz"), EPSILON);
    }

    @Test
    void testNgramSimilarity() {
        // "night" {ni, ig, gh, ht} vs "nacht" {na, ac, ch, ht}: one shared bigram
        assertEquals(0.25, SimilarityScorer.ngramSimilarity("night", "nacht"), EPSILON);
        assertEquals(1.0, SimilarityScorer.ngramSimilarity("a", "A"), EPSILON);
        assertEquals(0.0, SimilarityScorer.ngramSimilarity("", "abc"), EPSILON);
    }

    @Test
    void testTokenOverlapStripsKoreanParticles() {
        assertEquals(List.of("서울", "회의"), SimilarityScorer.tokenize("서울에서 회의를"));
        assertEquals(List.of("학교"), SimilarityScorer.tokenize("학교로"));
        assertEquals(List.of("집"), SimilarityScorer.tokenize("집에"));

        // Compound particles are only stripped from tokens longer than two characters
        assertEquals(List.of("에서"), SimilarityScorer.tokenize("에서"));

        assertEquals(1.0, SimilarityScorer.tokenOverlapSimilarity("서울에서 여행", "서울 여행을"), EPSILON);
    }

    @Test
    void testTokenOverlapSplitsOnPunctuation() {
        assertEquals(List.of("machine", "learning", "notes"), SimilarityScorer.tokenize("Machine-Learning_notes"));
        assertEquals(1.0 / 3, SimilarityScorer.tokenOverlapSimilarity("alpha beta", "beta gamma"), EPSILON);
    }

    @Test
    void testContainmentSimilarity() {
        assertEquals(5.0 / 12, SimilarityScorer.containmentSimilarity("Waymo", "Google Waymo"), EPSILON);
        assertEquals(1.0, SimilarityScorer.containmentSimilarity(" Note ", "note"), EPSILON);
        assertEquals(0.0, SimilarityScorer.containmentSimilarity("abc", "xyz"), EPSILON);
    }

    @Test
    void testIdenticalStringsScoreExactlyOne() {
        SimilarityScore score = SimilarityScorer.calculateSimilarity("Project Plan", "Project Plan");

        assertEquals(1.0, score.getScore(), EPSILON);
        assertEquals(1.0, score.getContainment(), EPSILON);
    }

    @Test
    void testUnrelatedStringsScoreNearZero() {
        SimilarityScore score = SimilarityScorer.calculateSimilarity("abc", "xyz");

        assertEquals(0.0, score.getScore(), EPSILON);
    }

    @Test
    void testCompositeScoreStaysWithinBounds() {
        String[] samples = {"", "a", "Note", "note", "notes", "Machine Learning", "machine-learning",
            "회의록", "회의록을", "Google Waymo", "Waymo", "x y z"};

        for (String first : samples) {
            for (String second : samples) {
                double score = SimilarityScorer.calculateSimilarity(first, second).getScore();
                assertTrue(score >= 0 && score <= 1, first + " / " + second + " -> " + score);
            }
        }
    }

    @Test
    void testContainmentWeightAppliesAboveHalf() {
        SimilarityScore score = SimilarityScorer.calculateSimilarity("machine learning", "machine learning notes");

        assertTrue(score.getContainment() > 0.5);
        double expected = 0.3 * score.getJaroWinkler() + 0.2 * score.getNgram()
            + 0.2 * score.getTokenOverlap() + 0.3 * score.getContainment();
        assertEquals(expected, score.getScore(), EPSILON);
    }

    @Test
    void testIsSimilar() {
        assertTrue(SimilarityScorer.isSimilar("Machine Learning", "machine learning"));
        assertFalse(SimilarityScorer.isSimilar("Machine Learning", "Cooking"));
        assertTrue(SimilarityScorer.isSimilar("abc", "abd", 0.0));
    }

    @Test
    void testFindSimilarPairsSortedDescending() {
        List<String> targets = List.of("Machine Learning", "Cooking", "machine learning", "Machine Learnin");

        List<SimilarPair> pairs = SimilarityScorer.findSimilarPairs(targets);

        assertFalse(pairs.isEmpty());
        for (int i = 1; i < pairs.size(); i++) {
            assertTrue(pairs.get(i - 1).getSimilarity().getScore() >= pairs.get(i).getSimilarity().getScore());
        }
        for (SimilarPair pair : pairs) {
            assertTrue(pair.getFirstIndex() < pair.getSecondIndex());
            assertNotEquals(1, pair.getFirstIndex());
            assertNotEquals(1, pair.getSecondIndex());
        }
    }
}
