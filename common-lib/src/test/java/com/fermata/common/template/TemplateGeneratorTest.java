package com.fermata.common.template;

import com.fermata.common.wordsource.WordCategory;
import com.fermata.common.wordsource.WordSource;
import com.fermata.common.wordsource.WordSourceNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Output length and determinism of {@link TemplateGenerator} and {@link DynamicPhraseAssembler}.
 */
class TemplateGeneratorTest {

    private static final TemplateLibrary LIBRARY = TemplateLibrary.standard();

    private static final WordSource RICH = WordSourceNormalizer.fromCategories("rich", Map.of(
        WordCategory.ADJECTIVES, List.of("luminous", "restless", "hollow", "golden"),
        WordCategory.NOUNS, List.of("harbors", "lantern", "stories", "meadow"),
        WordCategory.VERBS, List.of("wander", "gather", "fly"),
        WordCategory.CONTEXTUAL_WORDS, List.of("twilight", "ember")));

    // ── TemplateGenerator ───────────────────────────────────────────────────

    @Nested
    @DisplayName("TemplateGenerator.generate()")
    class GenerateTests {

        @Test
        @DisplayName("every template emits exactly the requested length across its range")
        void everyTemplate_exactWordCount() {
            for (WordSource source : List.of(WordSource.empty(), RICH)) {
                for (Template template : LIBRARY.all()) {
                    for (int wc = template.minWordCount(); wc <= template.maxWordCount(); wc++) {
                        for (long seed = 0; seed < 10; seed++) {
                            GenerationContext ctx = new GenerationContext("rock", "romantic", NameType.BAND, wc);
                            String name = TemplateGenerator.generate(template, source, ctx, new Random(seed));
                            assertFalse(name.isBlank(), template.id());
                            assertEquals(wc, PhraseText.wordCount(name), template.id() + " → '" + name + "'");
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("length outside a template's range → its minimum length")
        void outOfRange_usesMinimum() {
            Template template = LIBRARY.byId("poetic_sequence");
            String name = TemplateGenerator.generate(template, WordSource.empty(),
                GenerationContext.ofWordCount(9), new Random(1L));
            assertEquals(4, PhraseText.wordCount(name));
        }

        @Test
        @DisplayName("same seed → same phrase")
        void sameSeed_samePhrase() {
            Template template = LIBRARY.byId("complete_narrative");
            GenerationContext ctx = GenerationContext.ofWordCount(7);
            assertEquals(TemplateGenerator.generate(template, RICH, ctx, new Random(13L)),
                TemplateGenerator.generate(template, RICH, ctx, new Random(13L)));
        }

        @Test
        @DisplayName("classic template starts with 'The'")
        void classicTemplate_startsWithThe() {
            String name = TemplateGenerator.generate(LIBRARY.byId("classic_the_adjective_noun"), RICH,
                GenerationContext.ofWordCount(3), new Random(2L));
            assertTrue(name.startsWith("The "), name);
        }

        @Test
        @DisplayName("context rejects a non-positive word count")
        void context_rejectsZero() {
            assertThrows(IllegalArgumentException.class, () -> GenerationContext.ofWordCount(0));
        }
    }

    // ── DynamicPhraseAssembler ──────────────────────────────────────────────

    @Nested
    @DisplayName("DynamicPhraseAssembler.assemble()")
    class AssembleTests {

        @Test
        @DisplayName("assembled phrases have exactly the requested length, up to twelve words")
        void assemble_exactLength() {
            for (int wc = 1; wc <= 12; wc++) {
                for (long seed = 0; seed < 5; seed++) {
                    String name = DynamicPhraseAssembler.assemble(wc, RICH, "jazz", new Random(seed));
                    assertEquals(wc, PhraseText.wordCount(name), "'" + name + "'");
                }
            }
        }

        @Test
        @DisplayName("empty source still assembles from the default pools")
        void emptySource_defaults() {
            String name = DynamicPhraseAssembler.assemble(2, WordSource.empty(), null, new Random(4L));
            assertEquals(2, PhraseText.wordCount(name));
        }

        @Test
        @DisplayName("zero words → IllegalArgumentException")
        void zeroWords_rejected() {
            assertThrows(IllegalArgumentException.class,
                () -> DynamicPhraseAssembler.assemble(0, RICH, null, new Random(1L)));
        }
    }

    // ── PhraseText ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("PhraseText")
    class PhraseTextTests {

        @Test
        @DisplayName("singularize, gerund and third person follow simple English rules")
        void inflections() {
            assertEquals("story", PhraseText.singularize("stories"));
            assertEquals("glass", PhraseText.singularize("glass"));
            assertEquals("rising", PhraseText.gerund("rise"));
            assertEquals("dying", PhraseText.gerund("die"));
            assertEquals("flies", PhraseText.thirdPerson("fly"));
            assertEquals("crashes", PhraseText.thirdPerson("crash"));
        }

        @Test
        @DisplayName("titleCase capitalises each word and collapses whitespace")
        void titleCase() {
            assertEquals("Velvet Thunder Road", PhraseText.titleCase("  velvet   THUNDER road "));
            assertEquals(0, PhraseText.wordCount("   "));
        }
    }
}
