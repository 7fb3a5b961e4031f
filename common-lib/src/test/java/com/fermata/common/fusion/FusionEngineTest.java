package com.fermata.common.fusion;

import com.fermata.common.exception.FusionExhaustedException;
import com.fermata.common.exception.IncompatibleGenresException;
import com.fermata.common.genre.CompatibilityEntry;
import com.fermata.common.genre.FusionStyle;
import com.fermata.common.genre.GenreCompatibilityMatrix;
import com.fermata.common.selection.SelectionEngine;
import com.fermata.common.selection.SelectionSession;
import com.fermata.common.template.PhraseText;
import com.fermata.common.template.TemplateLibrary;
import com.fermata.common.wordsource.WordSource;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end behaviour of {@link FusionEngine}: result counts, pair metadata, validation
 * and the failure paths when a pair is unknown or every strategy comes up empty.
 */
class FusionEngineTest {

    private static final GenreCompatibilityMatrix MATRIX = GenreCompatibilityMatrix.standard();

    private static FusionEngine engine() {
        return new FusionEngine(new SelectionEngine(TemplateLibrary.standard()));
    }

    // ── fuse() ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("fuse()")
    class FuseTests {

        @Test
        @DisplayName("electronic + jazz, 2 words, count 3 → three distinct names carrying the pair score")
        void electronicJazz_threeResults() {
            List<FusionResult> results = engine().fuse(FusionRequest.of("electronic", "jazz", 2, 3),
                WordSource.empty(), SelectionSession.isolated(42L));

            assertEquals(3, results.size());
            double expected = MATRIX.find("electronic", "jazz").score();
            for (FusionResult result : results) {
                assertEquals(expected, result.metadata().compatibilityScore(), 1e-9);
                assertEquals("electronic", result.metadata().primaryGenre());
                assertEquals("jazz", result.metadata().secondaryGenre());
                int words = PhraseText.wordCount(result.name());
                assertTrue(words >= 1 && words <= 3, result.name());
            }
            Set<String> distinct = results.stream().map(r -> r.name().toLowerCase()).collect(Collectors.toSet());
            assertEquals(3, distinct.size());
        }

        @Test
        @DisplayName("results are ranked by quality, best first")
        void results_rankedByQuality() {
            List<FusionResult> results = engine().fuse(FusionRequest.of("rock", "classical", 2, 4),
                WordSource.empty(), SelectionSession.isolated(7L));
            for (int i = 1; i < results.size(); i++) {
                assertTrue(results.get(i - 1).qualityScore() >= results.get(i).qualityScore());
            }
        }

        @Test
        @DisplayName("reversed pair resolves with the same compatibility score")
        void reversedPair_sameScore() {
            FusionRequest request = FusionRequest.of("electronic", "jazz", 2, 2);
            List<FusionResult> forward = engine().fuse(request, WordSource.empty(), SelectionSession.isolated(1L));
            List<FusionResult> backward = engine().fuse(request.reversed(), WordSource.empty(), SelectionSession.isolated(1L));

            assertFalse(backward.isEmpty());
            assertEquals("jazz", backward.get(0).metadata().primaryGenre());
            assertEquals(forward.get(0).metadata().compatibilityScore(),
                backward.get(0).metadata().compatibilityScore(), 1e-9);
        }

        @Test
        @DisplayName("every result carries explanations and authenticity ≥ 0.5 when preserving authenticity")
        void results_explainedAndAuthentic() {
            List<FusionResult> results = engine().fuse(FusionRequest.of("folk", "electronic", 2, 3),
                WordSource.empty(), SelectionSession.isolated(5L));
            for (FusionResult result : results) {
                assertNotNull(result.explanations());
                assertFalse(result.explanations().rationale().isBlank());
                assertTrue(result.metadata().authenticity() >= FusionEngine.MIN_AUTHENTICITY);
            }
        }

        @Test
        @DisplayName("unknown genre → IncompatibleGenresException")
        void unknownGenre_throws() {
            IncompatibleGenresException e = assertThrows(IncompatibleGenresException.class,
                () -> engine().fuse(FusionRequest.of("polka", "jazz", 2, 3), WordSource.empty(),
                    SelectionSession.isolated(1L)));
            assertEquals("polka", e.getPrimaryGenre());
        }

        @Test
        @DisplayName("every strategy empty → FusionExhaustedException after the attempt budget")
        void allStrategiesEmpty_exhausted() {
            FusionEngine engine = engine();
            for (FusionMethod method : FusionMethod.values()) {
                engine.withStrategy(method, ctx -> Optional.empty());
            }
            FusionExhaustedException e = assertThrows(FusionExhaustedException.class,
                () -> engine.fuse(FusionRequest.of("electronic", "jazz", 2, 3), WordSource.empty(),
                    SelectionSession.isolated(1L)));
            assertEquals(FusionEngine.MIN_ATTEMPTS, e.getAttempts());
        }

        @Test
        @DisplayName("candidates with the wrong word count never survive validation")
        void wrongWordCount_rejected() {
            FusionEngine engine = engine();
            for (FusionMethod method : FusionMethod.values()) {
                engine.withStrategy(method, ctx -> Optional.of(new FusionCandidate(
                    "Far Too Many Words In This One", method, List.of(), List.of())));
            }
            assertThrows(FusionExhaustedException.class,
                () -> engine.fuse(FusionRequest.of("electronic", "jazz", 2, 1), WordSource.empty(),
                    SelectionSession.isolated(1L)));
        }
    }

    // ── metrics ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("metrics and history")
    class MetricsTests {

        @Test
        @DisplayName("each call records the pair and every emitted name")
        void fuse_recordsMetrics() {
            FusionEngine engine = engine();
            List<FusionResult> first = engine.fuse(FusionRequest.of("hip-hop", "jazz", 2, 2),
                WordSource.empty(), SelectionSession.isolated(3L));
            engine.fuse(FusionRequest.of("hip-hop", "jazz", 2, 2), WordSource.empty(), SelectionSession.isolated(4L));

            FusionEngine.PairMetrics metrics = engine.metrics().get("hip-hop+jazz");
            assertNotNull(metrics);
            assertEquals(2, metrics.calls());
            assertTrue(metrics.results() >= 2);
            assertTrue(engine.timesProduced(first.get(0).name()) >= 1);
            assertEquals(0, engine.timesProduced("Never Emitted"));
        }
    }

    // ── validation and helpers ──────────────────────────────────────────────

    @Nested
    @DisplayName("isValid() and helpers")
    class HelperTests {

        private FusionResult result(String name, double quality, double authenticity) {
            FusionMetadata metadata = new FusionMetadata("electronic", "jazz", 0.9, FusionStyle.HYBRID,
                null, FusionMethod.DEFAULT, List.of(), List.of(), 0.5, authenticity, 0.5);
            return new FusionResult(name, metadata, quality,
                new FusionExplanations("r", List.of(), List.of(), "m"));
        }

        @Test
        @DisplayName("word count within ±1 and quality ≥ 0.3 → valid")
        void withinTolerance_valid() {
            FusionRequest request = FusionRequest.of("electronic", "jazz", 2, 1);
            assertTrue(FusionEngine.isValid(result("Neon Bebop", 0.6, 0.7), request));
            assertTrue(FusionEngine.isValid(result("Neon Bebop Engine", 0.6, 0.7), request));
            assertFalse(FusionEngine.isValid(result("Neon Bebop Engine Room", 0.6, 0.7), request));
        }

        @Test
        @DisplayName("low quality or low authenticity → invalid")
        void lowScores_invalid() {
            FusionRequest request = FusionRequest.of("electronic", "jazz", 2, 1);
            assertFalse(FusionEngine.isValid(result("Neon Bebop", 0.2, 0.7), request));
            assertFalse(FusionEngine.isValid(result("Neon Bebop", 0.6, 0.4), request));
        }

        @Test
        @DisplayName("cultural sensitivity rejects synthetic affixes")
        void culturalSensitivity_rejectsAffixes() {
            FusionRequest request = new FusionRequest("electronic", "jazz", null, 2, 1,
                FusionIntensity.MODERATE, 0.5, null, false, true);
            assertFalse(FusionEngine.isValid(result("Cyber Bebop", 0.6, 0.6), request));
            assertTrue(FusionEngine.isValid(result("Velvet Bebop", 0.6, 0.7), request));
        }

        @Test
        @DisplayName("complement pairs lead with complementary fusion and default always closes")
        void methodsFor_orders() {
            List<FusionMethod> methods = FusionIntensity.BOLD.methodsFor(FusionStyle.COMPLEMENT);
            assertEquals(FusionMethod.COMPLEMENTARY_FUSION, methods.get(0));
            assertEquals(FusionMethod.DEFAULT, methods.get(methods.size() - 1));
            assertEquals(FusionMethod.CONTRASTING_FUSION,
                FusionIntensity.SUBTLE.methodsFor(FusionStyle.CONTRAST).get(0));
        }

        @Test
        @DisplayName("unknown intensity id → moderate")
        void intensity_lenientParse() {
            assertEquals(FusionIntensity.MODERATE, FusionIntensity.fromId("wild"));
            assertEquals(FusionIntensity.BOLD, FusionIntensity.fromId(" Bold "));
        }

        @Test
        @DisplayName("curated pair templates are found in either order")
        void pairTemplates_orderInsensitive() {
            assertEquals(PairFusionTemplates.forPair("electronic", "jazz"),
                PairFusionTemplates.forPair("jazz", "electronic"));
            assertEquals(2, PairFusionTemplates.forPair("jazz", "electronic").size());
            assertTrue(PairFusionTemplates.forPair("metal", "country").isEmpty());
        }

        @Test
        @DisplayName("authenticity: synthetic affixes cost 0.1 each, musical terms add 0.1")
        void authenticity_scoring() {
            assertEquals(0.7, FusionQualityScorer.authenticity("Velvet Garden"), 1e-9);
            assertEquals(0.6, FusionQualityScorer.authenticity("Cyber Garden"), 1e-9);
        }

        @Test
        @DisplayName("request rejects creativity outside [0, 1]")
        void request_validatesCreativity() {
            assertThrows(IllegalArgumentException.class,
                () -> FusionRequest.of("rock", "jazz", 2, 1).withCreativity(1.5));
        }

        @Test
        @DisplayName("matrix stores each pair under both orders")
        void matrix_symmetric() {
            CompatibilityEntry forward = MATRIX.require("rock", "classical");
            CompatibilityEntry backward = MATRIX.require("classical", "rock");
            assertEquals(forward.score(), backward.score(), 1e-9);
            assertEquals(forward.primaryWeight(), backward.secondaryWeight(), 1e-9);
        }
    }
}
