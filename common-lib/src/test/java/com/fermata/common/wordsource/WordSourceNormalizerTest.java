package com.fermata.common.wordsource;

import com.fermata.common.exception.MalformedWordSourceException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Normalisation, filtering and fallback behaviour of word sources.
 */
class WordSourceNormalizerTest {

    // ── normalize() ─────────────────────────────────────────────────────────

    @Nested
    @DisplayName("normalize()")
    class NormalizeTests {

        @Test
        @DisplayName("entries are trimmed, lower-cased and de-duplicated")
        void entries_caseNormalised() {
            WordSource source = WordSourceNormalizer.normalize("t",
                Map.of("adjectives", List.of(" Velvet ", "velvet", "CRIMSON", "  ")));
            assertEquals(List.of("velvet", "crimson"), source.raw(WordCategory.ADJECTIVES));
        }

        @Test
        @DisplayName("filtered list drops jargon, blocklisted and out-of-range words")
        void filtered_dropsUnfitWords() {
            WordSource source = WordSourceNormalizer.normalize("t",
                Map.of("nouns", List.of("harbor", "algorithm", "data", "ox", "twelve-bar", "12345", "lantern")));
            assertEquals(List.of("harbor", "lantern"), source.filtered(WordCategory.NOUNS));
            assertEquals(7, source.raw(WordCategory.NOUNS).size());
        }

        @Test
        @DisplayName("filtered list is capped at 100 entries")
        void filtered_capped() {
            List<String> many = new ArrayList<>();
            for (int i = 0; i < 150; i++) many.add("word" + (char) ('a' + i % 26) + (char) ('a' + i / 26));
            WordSource source = WordSourceNormalizer.normalize("t", Map.of("verbs", many));
            assertEquals(WordSourceNormalizer.MAX_FILTERED_PER_CATEGORY, source.filteredCount(WordCategory.VERBS));
        }

        @Test
        @DisplayName("keys resolve leniently and unknown keys are ignored")
        void keys_lenient() {
            WordSource source = WordSourceNormalizer.normalize("t", Map.of(
                "musical_terms", List.of("chorus"),
                "GENRE-TERMS", List.of("riff"),
                "colours", List.of("teal")));
            assertEquals(List.of("chorus"), source.filtered(WordCategory.MUSICAL_TERMS));
            assertEquals(List.of("riff"), source.filtered(WordCategory.GENRE_TERMS));
            assertFalse(source.allFiltered().contains("teal"));
        }

        @Test
        @DisplayName("null value is an absent category")
        void nullValue_absent() {
            Map<String, Object> input = new HashMap<>();
            input.put("nouns", null);
            WordSource source = WordSourceNormalizer.normalize("t", input);
            assertFalse(source.hasFiltered(WordCategory.NOUNS));
        }

        @Test
        @DisplayName("non-list value → MalformedWordSourceException naming the category")
        void nonList_rejected() {
            MalformedWordSourceException e = assertThrows(MalformedWordSourceException.class,
                () -> WordSourceNormalizer.normalize("t", Map.of("nouns", "harbor")));
            assertEquals("nouns", e.getCategory());
        }

        @Test
        @DisplayName("list holding a non-string → MalformedWordSourceException")
        void nonStringElement_rejected() {
            assertThrows(MalformedWordSourceException.class,
                () -> WordSourceNormalizer.normalize("t", Map.of("nouns", List.of("harbor", 7))));
        }
    }

    // ── WordSource fallbacks ────────────────────────────────────────────────

    @Nested
    @DisplayName("WordSource")
    class SourceTests {

        @Test
        @DisplayName("empty filtered list → words() falls back to the default pool")
        void emptyCategory_defaultPool() {
            WordSource source = WordSource.empty();
            assertEquals(DefaultWordPools.pool(WordCategory.NOUNS), source.words(WordCategory.NOUNS));
            assertFalse(source.words(WordCategory.NOUNS).isEmpty());
        }

        @Test
        @DisplayName("merge() appends to the raw lists and re-filters")
        void merge_appends() {
            WordSource base = WordSourceNormalizer.fromCategories("base",
                Map.of(WordCategory.NOUNS, List.of("harbor")));
            WordSource merged = WordSourceNormalizer.merge(base,
                Map.of(WordCategory.NOUNS, List.of("Lantern", "harbor")));
            assertEquals(List.of("harbor", "lantern"), merged.filtered(WordCategory.NOUNS));
            assertEquals("base", merged.name());
        }

        @Test
        @DisplayName("longWords() keeps words of seven letters or more")
        void longWords_threshold() {
            WordSource source = WordSourceNormalizer.fromCategories("t",
                Map.of(WordCategory.NOUNS, List.of("harbor", "lanterns", "cathedral")));
            assertEquals(List.of("lanterns", "cathedral"), source.longWords());
        }
    }

    // ── WordFilter ──────────────────────────────────────────────────────────

    @Nested
    @DisplayName("WordFilter")
    class FilterTests {

        @Test
        @DisplayName("poetic words are 3 to 15 letters, one token, not numeric")
        void poeticWord_rules() {
            assertTrue(WordFilter.isPoeticWord("ember"));
            assertFalse(WordFilter.isPoeticWord("ox"));
            assertFalse(WordFilter.isPoeticWord("extraordinarily-long"));
            assertFalse(WordFilter.isPoeticWord("two words"));
            assertFalse(WordFilter.isPoeticWord("2024"));
            assertFalse(WordFilter.isPoeticWord("config"));
        }

        @Test
        @DisplayName("scientific and software jargon is problematic")
        void jargon_problematic() {
            assertTrue(WordFilter.isProblematicWord("Quantum"));
            assertFalse(WordFilter.isProblematicWord("meadow"));
        }

        @Test
        @DisplayName("verb list and affixes mark action words")
        void actionWords() {
            assertTrue(WordFilter.isActionWord("dance"));
            assertTrue(WordFilter.isActionWord("shattering"));
            assertFalse(WordFilter.isActionWord("moon"));
        }

        @Test
        @DisplayName("adjective suffixes mark adjectives")
        void adjectives() {
            assertTrue(WordFilter.looksLikeAdjective("luminous"));
            assertTrue(WordFilter.looksLikeAdjective("restless"));
            assertFalse(WordFilter.looksLikeAdjective("stone"));
        }
    }
}
