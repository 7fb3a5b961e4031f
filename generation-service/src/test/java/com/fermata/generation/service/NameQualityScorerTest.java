package com.fermata.generation.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Heuristic name ranking. Absolute values matter less than the ordering they induce.
 */
class NameQualityScorerTest {

    @Test
    @DisplayName("scores stay within [0, 1]")
    void score_bounded() {
        for (String name : new String[]{"X", "Velvet Harbor", "Strength Strength Strength Strength",
                "A Very Long Name That Keeps Going Well Past Any Reasonable Band Name Length"}) {
            double score = NameQualityScorer.score(name, "rock", "energetic");
            assertTrue(score >= 0.0 && score <= 1.0, name + " " + score);
        }
        assertEquals(0.0, NameQualityScorer.score("   ", null, null));
    }

    @Test
    @DisplayName("cliché phrase scores below a fresh one of the same shape")
    void cliche_penalised() {
        assertTrue(NameQualityScorer.score("Golden Hour", null, null)
            < NameQualityScorer.score("Copper Hour", null, null));
    }

    @Test
    @DisplayName("repeated words score below distinct ones")
    void repeatedWords_penalised() {
        assertTrue(NameQualityScorer.score("Velvet Velvet", null, null)
            < NameQualityScorer.score("Velvet Harbor", null, null));
    }

    @Test
    @DisplayName("overlong names are penalised")
    void overlong_penalised() {
        String longName = "Lanterns Drifting Slowly Across The Quiet Harbor Tonight Again";
        assertTrue(NameQualityScorer.score(longName, null, null)
            < NameQualityScorer.score("Quiet Harbor", null, null));
    }

    @Test
    @DisplayName("three words sharing an initial are penalised as forced alliteration")
    void alliteration_penalised() {
        assertTrue(NameQualityScorer.score("Silver Silent Stones", null, null)
            < NameQualityScorer.score("Silver Quiet Stones", null, null));
    }
}
