package com.fermata.common.mood;

import com.fermata.common.template.Template;
import com.fermata.common.template.TemplateLibrary;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Mood resolution, modifiers and template alignment scoring.
 */
class MoodLibraryTest {

    // ── resolve ─────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("MoodLibrary.resolve()")
    class ResolveTests {

        @Test
        @DisplayName("unknown mood → neutral 50 on every axis")
        void unknownMood_neutral() {
            assertEquals(EmotionalVector.NEUTRAL, MoodLibrary.resolve("zesty"));
            assertEquals(EmotionalVector.NEUTRAL, MoodLibrary.resolve(null));
            assertFalse(MoodLibrary.isKnown("zesty"));
        }

        @Test
        @DisplayName("simple mood → its profile vector")
        void simpleMood_profileVector() {
            EmotionalVector v = MoodLibrary.resolve("melancholic");
            assertEquals(25, v.energy(), 1e-9);
            assertEquals(75, v.darkness(), 1e-9);
        }

        @Test
        @DisplayName("complex mood → weighted blend of its components")
        void complexMood_blended() {
            // bittersweet = 0.5 nostalgic + 0.3 melancholic + 0.2 uplifting
            EmotionalVector v = MoodLibrary.resolve("bittersweet");
            assertEquals(0.5 * 40 + 0.3 * 25 + 0.2 * 75, v.energy(), 1e-9);
            assertEquals(0.5 * 60 + 0.3 * 20 + 0.2 * 90, v.valence(), 1e-9);
            assertTrue(MoodLibrary.isKnown("bittersweet"));
        }

        @Test
        @DisplayName("complex mood is represented by its primary component's profile")
        void complexMood_representative() {
            assertSame(MoodLibrary.profile("euphoric"), MoodLibrary.representativeProfile("dark_euphoria"));
            assertNull(MoodLibrary.representativeProfile("zesty"));
        }

        @Test
        @DisplayName("genre affinity reads the mood profile; unknown sides give 0")
        void genreAffinity() {
            assertEquals(1.0, MoodLibrary.genreAffinity("aggressive", "metal"), 1e-9);
            assertEquals(0.0, MoodLibrary.genreAffinity("aggressive", "polka"), 1e-9);
            assertEquals(0.0, MoodLibrary.genreAffinity("zesty", "metal"), 1e-9);
        }
    }

    // ── modifiers ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("MoodModifier")
    class ModifierTests {

        @Test
        @DisplayName("applicable modifier shifts axes by effect × strength")
        void applicable_shifts() {
            EmotionalVector v = MoodLibrary.resolve("nostalgic", List.of(MoodModifier.VINTAGE_FILTER));
            assertEquals(75 + 10 * 0.3, v.complexity(), 1e-9);
            assertEquals(60 + 15 * 0.3, v.mystery(), 1e-9);
            assertEquals(40, v.energy(), 1e-9);
        }

        @Test
        @DisplayName("inapplicable modifier leaves the vector unchanged")
        void inapplicable_noop() {
            assertEquals(MoodLibrary.resolve("aggressive"),
                MoodLibrary.resolve("aggressive", List.of(MoodModifier.VINTAGE_FILTER)));
        }

        @Test
        @DisplayName("shifted axes stay clamped to [0, 100]")
        void shift_clamped() {
            EmotionalVector v = MoodLibrary.resolve("dark", List.of(MoodModifier.MIDNIGHT_AMPLIFIER));
            assertEquals(EmotionalVector.MAX, v.darkness(), 1e-9);
        }

        @Test
        @DisplayName("complex moods take modifiers through their primary component")
        void complexMood_primaryTarget() {
            EmotionalVector plain = MoodLibrary.resolve("bittersweet");
            EmotionalVector modified = MoodLibrary.resolve("bittersweet", List.of(MoodModifier.SEASONAL_AUTUMN));
            assertTrue(modified.darkness() > plain.darkness());
        }

        @Test
        @DisplayName("fromId() is lenient about case and dashes; unknown → null")
        void fromId_lenient() {
            assertEquals(MoodModifier.VINTAGE_FILTER, MoodModifier.fromId("vintage-filter"));
            assertEquals(MoodModifier.URBAN_INTENSITY, MoodModifier.fromId(" urban_intensity "));
            assertNull(MoodModifier.fromId("bogus"));
        }
    }

    // ── alignment ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("PatternMoodScorer")
    class AlignmentTests {

        @Test
        @DisplayName("every template × mood pair scores within [0, 1]")
        void scores_bounded() {
            List<String> moods = new ArrayList<>(MoodLibrary.moodIds());
            moods.addAll(MoodLibrary.complexMoodIds());
            for (Template template : TemplateLibrary.standard().all()) {
                for (String mood : moods) {
                    MoodAlignment alignment = PatternMoodScorer.score(template, mood);
                    assertTrue(alignment.score() >= 0.0 && alignment.score() <= 1.0, template.id() + "/" + mood);
                    assertTrue(alignment.confidence() >= 0.0 && alignment.confidence() <= 1.0);
                    assertEquals(6, alignment.dimensionScores().size());
                }
            }
        }

        @Test
        @DisplayName("unknown mood → neutral score with zero confidence")
        void unknownMood_unknownAlignment() {
            MoodAlignment alignment = PatternMoodScorer.score(TemplateLibrary.standard().byId("action_object"), "zesty");
            assertEquals(0.5, alignment.score(), 1e-9);
            assertFalse(alignment.isConfident(0.01));
        }

        @Test
        @DisplayName("vector similarity is 1 with itself and symmetric")
        void similarity_properties() {
            EmotionalVector a = MoodLibrary.resolve("romantic");
            EmotionalVector b = MoodLibrary.resolve("dark");
            assertEquals(1.0, a.similarity(a), 1e-9);
            assertEquals(a.similarity(b), b.similarity(a), 1e-9);
        }
    }
}
