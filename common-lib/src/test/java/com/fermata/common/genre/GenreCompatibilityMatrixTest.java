package com.fermata.common.genre;

import com.fermata.common.exception.IncompatibleGenresException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Pair scoring in {@link GenreCompatibilityMatrix} and vocabulary blending in {@link VocabularyFusion}.
 */
class GenreCompatibilityMatrixTest {

    private final GenreCompatibilityMatrix matrix = GenreCompatibilityMatrix.standard();

    // ── matrix ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("GenreCompatibilityMatrix")
    class MatrixTests {

        @Test
        @DisplayName("every pair is stored under both orders with a score in [0, 1]")
        void everyPair_symmetricAndBounded() {
            for (String a : matrix.genres()) {
                for (String b : matrix.genres()) {
                    if (a.equals(b)) continue;
                    CompatibilityEntry ab = matrix.find(a, b);
                    CompatibilityEntry ba = matrix.find(b, a);
                    assertNotNull(ab, a + "+" + b);
                    assertEquals(ab.score(), ba.score(), 1e-12);
                    assertTrue(ab.score() >= 0.0 && ab.score() <= 1.0);
                    assertEquals(a, ab.primary());
                    assertEquals(1.0, ab.primaryWeight() + ab.secondaryWeight(), 1e-9);
                }
            }
        }

        @Test
        @DisplayName("lookups ignore case and surrounding whitespace")
        void lookup_normalised() {
            assertNotNull(matrix.find(" Electronic ", "JAZZ"));
        }

        @Test
        @DisplayName("unknown genre → find() null, require() throws")
        void unknownGenre() {
            assertNull(matrix.find("polka", "jazz"));
            IncompatibleGenresException e = assertThrows(IncompatibleGenresException.class,
                () -> matrix.require("polka", "jazz"));
            assertEquals("jazz", e.getSecondaryGenre());
        }

        @Test
        @DisplayName("curated pair bonus lifts electronic + jazz above its uncurated score")
        void curatedPair_bonus() {
            CompatibilityEntry entry = matrix.require("electronic", "jazz");
            assertTrue(entry.synergies().stream().anyMatch(s -> s.contains("Electronic-jazz")));
        }

        @Test
        @DisplayName("mostCompatible() is sorted, bounded and excludes the genre itself")
        void mostCompatible_sorted() {
            List<CompatibilityEntry> top = matrix.mostCompatible("rock", 3);
            assertEquals(3, top.size());
            for (int i = 0; i < top.size(); i++) {
                assertEquals("rock", top.get(i).primary());
                assertNotEquals("rock", top.get(i).secondary());
                if (i > 0) assertTrue(top.get(i - 1).score() >= top.get(i).score());
            }
        }

        @Test
        @DisplayName("fusion rules are found in either order")
        void fusionRule_orderInsensitive() {
            assertNotNull(matrix.fusionRule("jazz", "electronic"));
            assertSame(matrix.fusionRule("jazz", "electronic"), matrix.fusionRule("electronic", "jazz"));
            assertNull(matrix.fusionRule("metal", "country"));
        }

        @Test
        @DisplayName("isFusionWorthy() compares against the threshold")
        void fusionWorthy_threshold() {
            double score = matrix.require("rock", "classical").score();
            assertTrue(matrix.isFusionWorthy("rock", "classical", score));
            assertFalse(matrix.isFusionWorthy("rock", "classical", score + 0.01));
            assertFalse(matrix.isFusionWorthy("rock", "polka", 0.0));
        }
    }

    // ── vocabulary fusion ───────────────────────────────────────────────────

    @Nested
    @DisplayName("VocabularyFusion")
    class VocabularyTests {

        private final VocabularyFusion fusion = VocabularyFusion.standard();

        private CompatibilityEntry entry(double score, FusionStyle style) {
            return new CompatibilityEntry("a", "b", score, style, List.of(), List.of(), 0.5, 0.5, List.of());
        }

        @Test
        @DisplayName("curated blend rule picks the strategy")
        void blendRule_wins() {
            FusedVocabulary v = fusion.fuse("electronic", "jazz", 0.5, null, new Random(1L));
            assertEquals(VocabularyStrategy.SYNTHESIZE, v.strategy());
        }

        @Test
        @DisplayName("explicit strategy overrides the automatic choice")
        void explicitStrategy_honoured() {
            FusedVocabulary v = fusion.fuse("electronic", "jazz", 0.5, VocabularyStrategy.LAYER, new Random(1L));
            assertEquals(VocabularyStrategy.LAYER, v.strategy());
            assertTrue(v.creativityLevel() >= 0.0 && v.creativityLevel() <= 1.0);
        }

        @Test
        @DisplayName("automatic choice: low score dominant, high score and creativity synthesize, else by style")
        void chooseStrategy_rules() {
            assertEquals(VocabularyStrategy.DOMINANT,
                VocabularyFusion.chooseStrategy(entry(0.4, FusionStyle.HYBRID), null, 0.9));
            assertEquals(VocabularyStrategy.SYNTHESIZE,
                VocabularyFusion.chooseStrategy(entry(0.8, FusionStyle.HYBRID), null, 0.8));
            assertEquals(VocabularyStrategy.MERGE,
                VocabularyFusion.chooseStrategy(entry(0.6, FusionStyle.HYBRID), null, 0.5));
            assertEquals(VocabularyStrategy.LAYER,
                VocabularyFusion.chooseStrategy(entry(0.65, FusionStyle.CONTRAST), null, 0.5));
            assertEquals(VocabularyStrategy.ALTERNATE,
                VocabularyFusion.chooseStrategy(entry(0.6, FusionStyle.COMPLEMENT), null, 0.5));
        }

        @Test
        @DisplayName("single words hold no spaces and no duplicates")
        void singleWords_tokens() {
            FusedVocabulary v = fusion.fuse("rock", "classical", 0.5, null, new Random(2L));
            List<String> words = v.singleWords();
            assertFalse(words.isEmpty());
            assertTrue(words.stream().noneMatch(w -> w.contains(" ")));
            assertEquals(words.size(), words.stream().distinct().count());
        }

        @Test
        @DisplayName("unknown pair → IncompatibleGenresException")
        void unknownPair_throws() {
            assertThrows(IncompatibleGenresException.class,
                () -> fusion.fuse("polka", "jazz", 0.5, null, new Random(1L)));
        }

        @Test
        @DisplayName("strategy ids parse leniently; unknown → null")
        void strategyIds() {
            assertEquals(VocabularyStrategy.LAYER, VocabularyStrategy.fromId(" Layer "));
            assertNull(VocabularyStrategy.fromId("blend"));
        }
    }
}
