package com.fermata.generation.service;

import com.fermata.common.atmosphere.BlendWeights;
import com.fermata.common.fusion.FusionEngine;
import com.fermata.common.fusion.FusionIntensity;
import com.fermata.common.genre.GenreCompatibilityMatrix;
import com.fermata.common.guard.RepetitionGuard;
import com.fermata.common.memory.GlobalNameMemory;
import com.fermata.common.selection.SelectionEngine;
import com.fermata.common.template.DynamicPhraseAssembler;
import com.fermata.common.template.NameType;
import com.fermata.common.template.PhraseText;
import com.fermata.common.template.TemplateLibrary;
import com.fermata.generation.client.DatamuseWordClient;
import com.fermata.generation.logger.GenerationFlowLogger;
import com.fermata.generation.model.GeneratedName;
import com.fermata.generation.model.GenerationRequest;
import com.fermata.generation.model.NameSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Drives {@link GenerationDriver} end to end with the Datamuse lookup disabled and a seeded
 * random source, so every request is reproducible and offline.
 */
class GenerationDriverTest {

    private SelectionEngine selection;
    private GlobalNameMemory memory;

    @BeforeEach
    void setUp() {
        selection = new SelectionEngine(TemplateLibrary.standard());
        memory = new GlobalNameMemory(GlobalNameMemory.DEFAULT_MAX_ENTRIES, Clock.systemUTC());
    }

    private GenerationDriver driver(RepetitionGuard guard, long seed) {
        DatamuseWordClient offline = new DatamuseWordClient(WebClient.create(), false, 40, Duration.ofSeconds(1));
        Random random = new Random(seed);
        return new GenerationDriver(selection, new FusionEngine(selection), guard, memory,
            new WordSourceService(offline), new FallbackNamePool(), new GenerationFlowLogger(),
            BlendWeights.defaults(), () -> random, 4, 20);
    }

    private GenerationDriver driver() {
        return driver(new RepetitionGuard(), 42L);
    }

    private static void assertWellFormed(GeneratedName name) {
        assertFalse(name.name().isBlank());
        assertNotNull(name.source());
        assertTrue(name.qualityScore() >= 0.0 && name.qualityScore() <= 1.0, name.name());
    }

    private static Set<String> lowerNames(List<GeneratedName> names) {
        return names.stream().map(n -> n.name().toLowerCase()).collect(Collectors.toSet());
    }

    // ── template path ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("template path")
    class TemplatePathTests {

        @Test
        @DisplayName("no count → default of four two-word names")
        void defaults_fourTwoWordNames() {
            StepVerifier.create(driver().generate(GenerationRequest.builder().genre("rock").build()))
                .assertNext(names -> {
                    assertEquals(4, names.size());
                    names.forEach(GenerationDriverTest::assertWellFormed);
                    names.forEach(n -> assertEquals(2, PhraseText.wordCount(n.name()), n.name()));
                    assertEquals(4, lowerNames(names).size());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("three words, count five → five distinct three-word names with template metadata")
        void threeWords_exactAndDistinct() {
            GenerationRequest request = GenerationRequest.builder()
                .genre("jazz").mood("peaceful").wordCount("3").count(5).build();

            StepVerifier.create(driver().generate(request))
                .assertNext(names -> {
                    assertEquals(5, names.size());
                    assertEquals(5, lowerNames(names).size());
                    for (GeneratedName name : names) {
                        assertWellFormed(name);
                        if (NameSource.FALLBACK.id().equals(name.source())) continue;
                        assertEquals(3, PhraseText.wordCount(name.name()), name.name());
                        if (NameSource.TEMPLATE.id().equals(name.source())) {
                            assertNotNull(name.metadata().get(GeneratedName.TEMPLATE_ID));
                            assertNotNull(name.metadata().get("template_category"));
                        }
                    }
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("only templates behind returned names are counted in the guard")
        void guard_countsReturnedTemplatesOnly() {
            RepetitionGuard guard = new RepetitionGuard();
            GenerationRequest request = GenerationRequest.builder().genre("rock").count(6).build();

            StepVerifier.create(driver(guard, 11L).generate(request))
                .assertNext(names -> {
                    long fromTemplates = names.stream()
                        .filter(n -> NameSource.TEMPLATE.id().equals(n.source()))
                        .count();
                    int recorded = guard.categoryCounts().values().stream().mapToInt(Integer::intValue).sum();
                    assertEquals(fromTemplates, recorded);
                    assertTrue(guard.recentTemplates().size() <= fromTemplates);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("results are ranked by quality, best first")
        void results_rankedByQuality() {
            StepVerifier.create(driver().generate(GenerationRequest.builder().genre("pop").count(6).build()))
                .assertNext(names -> {
                    for (int i = 1; i < names.size(); i++) {
                        assertTrue(names.get(i - 1).qualityScore() >= names.get(i).qualityScore());
                    }
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("\"4+\" → one length in [4, 6] shared by every generated name")
        void openRange_sharedLength() {
            GenerationRequest request = GenerationRequest.builder().genre("indie").wordCount("4+").count(3).build();

            StepVerifier.create(driver().generate(request))
                .assertNext(names -> {
                    List<Integer> lengths = names.stream()
                        .filter(n -> !NameSource.FALLBACK.id().equals(n.source()))
                        .map(n -> PhraseText.wordCount(n.name()))
                        .distinct()
                        .collect(Collectors.toList());
                    assertEquals(1, lengths.size(), "lengths: " + lengths);
                    assertTrue(lengths.get(0) >= 4 && lengths.get(0) <= 6);
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("count above the cap is clamped to twenty")
        void count_clamped() {
            assertEquals(20, driver().normalizeCount(25));
            assertEquals(4, driver().normalizeCount(null));
            StepVerifier.create(driver().generate(GenerationRequest.builder().count(25).build()))
                .assertNext(names -> {
                    assertTrue(names.size() <= 20);
                    assertTrue(names.size() >= FallbackNamePool.NAMES.size());
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("returned names are remembered and not repeated by the next request")
        void consecutiveRequests_noRepeats() {
            GenerationDriver driver = driver();
            GenerationRequest request = GenerationRequest.builder().genre("rock").count(5).build();

            List<GeneratedName> first = driver.generate(request).block();
            List<GeneratedName> second = driver.generate(request).block();

            assertNotNull(first);
            assertNotNull(second);
            first.forEach(n -> assertNotNull(memory.get(n.name())));
            Set<String> firstGenerated = first.stream()
                .filter(n -> !NameSource.FALLBACK.id().equals(n.source()))
                .map(n -> n.name().toLowerCase())
                .collect(Collectors.toSet());
            for (GeneratedName name : second) {
                if (NameSource.FALLBACK.id().equals(name.source())) continue;
                assertFalse(firstGenerated.contains(name.name().toLowerCase()), name.name());
            }
        }
    }

    // ── degradation ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("degradation")
    class DegradationTests {

        @Test
        @DisplayName("no template eligible → dynamic assembly fills the request at the exact length")
        void noTemplate_dynamicAssembly() {
            // conditional_narrative is the only ten-word template and excludes aggressive
            GenerationRequest request = GenerationRequest.builder()
                .mood("aggressive").wordCount("10").count(3).build();

            StepVerifier.create(driver().generate(request))
                .assertNext(names -> {
                    assertEquals(3, names.size());
                    assertTrue(names.stream().anyMatch(n -> NameSource.DYNAMIC.id().equals(n.source())));
                    for (GeneratedName name : names) {
                        if (NameSource.FALLBACK.id().equals(name.source())) continue;
                        assertEquals(NameSource.DYNAMIC.id(), name.source());
                        assertEquals(DynamicPhraseAssembler.DYNAMIC_ID, name.metadata().get(GeneratedName.TEMPLATE_ID));
                        assertEquals(10, PhraseText.wordCount(name.name()), name.name());
                    }
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("guard rejecting everything → curated fallback names")
        void guardRejectsAll_fallbackPool() {
            RepetitionGuard rejectAll = new RepetitionGuard() {
                @Override
                public synchronized boolean shouldReject(String candidate) {
                    return true;
                }
            };

            StepVerifier.create(driver(rejectAll, 7L).generate(GenerationRequest.builder().count(4).build()))
                .assertNext(names -> {
                    assertEquals(4, names.size());
                    assertEquals(4, lowerNames(names).size());
                    for (GeneratedName name : names) {
                        assertEquals(NameSource.FALLBACK.id(), name.source());
                        assertTrue(FallbackNamePool.NAMES.contains(name.name()));
                        assertWellFormed(name);
                    }
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("fallback alone can return at most the pool size")
        void fallback_boundedByPool() {
            RepetitionGuard rejectAll = new RepetitionGuard() {
                @Override
                public synchronized boolean shouldReject(String candidate) {
                    return true;
                }
            };

            StepVerifier.create(driver(rejectAll, 7L).generate(GenerationRequest.builder().count(15).build()))
                .assertNext(names -> assertEquals(FallbackNamePool.NAMES.size(), names.size()))
                .verifyComplete();
        }
    }

    // ── fusion path ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("fusion path")
    class FusionPathTests {

        @Test
        @DisplayName("secondary genre → fused names carrying the pair's compatibility score")
        void secondaryGenre_fusion() {
            GenerationRequest request = GenerationRequest.builder()
                .genre("electronic").secondaryGenre("jazz").wordCount("2").count(3).build();
            double expected = GenreCompatibilityMatrix.standard().find("electronic", "jazz").score();

            StepVerifier.create(driver().generate(request))
                .assertNext(names -> {
                    assertEquals(3, names.size());
                    List<GeneratedName> fused = names.stream()
                        .filter(n -> NameSource.FUSION.id().equals(n.source()))
                        .collect(Collectors.toList());
                    assertFalse(fused.isEmpty());
                    for (GeneratedName name : fused) {
                        @SuppressWarnings("unchecked")
                        Map<String, Object> meta = (Map<String, Object>) name.metadata().get("fusion_metadata");
                        assertEquals("electronic", meta.get("primary_genre"));
                        assertEquals("jazz", meta.get("secondary_genre"));
                        assertEquals(expected, (Double) meta.get("compatibility_score"), 1e-9);
                        assertNotNull(name.metadata().get("explanations"));
                    }
                })
                .verifyComplete();
        }

        @Test
        @DisplayName("unknown genre pair degrades instead of failing the request")
        void unknownPair_degrades() {
            GenerationRequest request = GenerationRequest.builder()
                .genre("polka").secondaryGenre("jazz").count(2).build();

            StepVerifier.create(driver().generate(request))
                .assertNext(names -> {
                    assertEquals(2, names.size());
                    names.forEach(n -> assertNotEquals(NameSource.FUSION.id(), n.source()));
                })
                .verifyComplete();
        }
    }

    // ── validation ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("validation")
    class ValidationTests {

        @Test
        @DisplayName("non-numeric word count → IllegalArgumentException")
        void badWordCount_error() {
            StepVerifier.create(driver().generate(GenerationRequest.builder().wordCount("abc").build()))
                .expectError(IllegalArgumentException.class)
                .verify();
        }

        @Test
        @DisplayName("word count outside [1, 10] → IllegalArgumentException")
        void wordCountOutOfRange_error() {
            Random rng = new Random(1L);
            assertThrows(IllegalArgumentException.class, () -> GenerationDriver.parseWordCount("0", rng));
            assertThrows(IllegalArgumentException.class, () -> GenerationDriver.parseWordCount("11", rng));
            assertEquals(10, GenerationDriver.parseWordCount(" 10 ", rng));
            assertEquals(GenerationDriver.DEFAULT_WORD_COUNT, GenerationDriver.parseWordCount(null, rng));
        }

        @Test
        @DisplayName("\"4+\" draws within [4, 6]")
        void openRange_drawsWithinRange() {
            Random rng = new Random(3L);
            for (int i = 0; i < 50; i++) {
                int wc = GenerationDriver.parseWordCount("4+", rng);
                assertTrue(wc >= 4 && wc <= 6);
            }
        }

        @Test
        @DisplayName("count below one → IllegalArgumentException")
        void zeroCount_error() {
            StepVerifier.create(driver().generate(GenerationRequest.builder().count(0).build()))
                .expectError(IllegalArgumentException.class)
                .verify();
        }

        @Test
        @DisplayName("secondary genre without a genre → IllegalArgumentException")
        void secondaryWithoutGenre_error() {
            StepVerifier.create(driver().generate(GenerationRequest.builder().secondaryGenre("jazz").build()))
                .expectError(IllegalArgumentException.class)
                .verify();
        }

        @Test
        @DisplayName("creativity outside [0, 1] → IllegalArgumentException")
        void badCreativity_error() {
            GenerationRequest request = GenerationRequest.builder()
                .genre("rock").secondaryGenre("metal").creativityLevel(1.2).build();
            StepVerifier.create(driver().generate(request))
                .expectError(IllegalArgumentException.class)
                .verify();
        }

        @Test
        @DisplayName("null request → IllegalArgumentException")
        void nullRequest_error() {
            StepVerifier.create(driver().generate(null))
                .expectError(IllegalArgumentException.class)
                .verify();
        }

        @Test
        @DisplayName("normalisation lower-cases inputs and parses the optional fields")
        void normalize_parsesFields() {
            GenerationRequest request = GenerationRequest.builder()
                .type("Song").genre(" Rock ").mood("MELANCHOLIC")
                .moodModifiers(List.of("vintage_filter", "bogus"))
                .avoidCategories(List.of("Narrative"))
                .atmosphere("midnight_solitude")
                .intensity("bold")
                .build();

            GenerationPlan plan = driver().normalize(request, new Random(1L));

            assertEquals(NameType.SONG, plan.type());
            assertEquals("rock", plan.genre());
            assertEquals("melancholic", plan.mood());
            assertEquals(1, plan.modifiers().size());
            assertEquals(Set.of("narrative"), plan.avoidCategories());
            assertFalse(plan.atmosphere().isEmpty());
            assertEquals(FusionIntensity.BOLD, plan.intensity());
            assertEquals(4, plan.count());
            assertTrue(plan.preserveAuthenticity());
            assertFalse(plan.isFusion());
        }
    }
}
