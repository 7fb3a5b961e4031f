package com.fermata.common.selection;

import com.fermata.common.guard.RepetitionGuard;
import com.fermata.common.template.NameType;
import com.fermata.common.template.Template;
import com.fermata.common.template.TemplateLibrary;
import com.fermata.common.wordsource.WordCategory;
import com.fermata.common.wordsource.WordSource;
import com.fermata.common.wordsource.WordSourceNormalizer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Context-match, quality and freshness scorers in isolation.
 */
class TemplateScorersTest {

    private static final TemplateLibrary LIBRARY = TemplateLibrary.standard();

    private static Template template(String id) {
        return LIBRARY.byId(id);
    }

    // ── ContextMatchScorer ──────────────────────────────────────────────────

    @Nested
    @DisplayName("ContextMatchScorer")
    class ContextMatchTests {

        @Test
        @DisplayName("no axes matching → base 0.5")
        void noAxes_base() {
            SelectionCriteria criteria = SelectionCriteria.of(3, null, null).withType(NameType.SONG);
            assertEquals(0.5, ContextMatchScorer.score(template("question_format"), criteria), 1e-9);
        }

        @Test
        @DisplayName("rock genre + band type on a traditional template → 0.9")
        void genreAndType_addUp() {
            SelectionCriteria criteria = SelectionCriteria.of(3, "rock", null);
            assertEquals(0.9, ContextMatchScorer.score(template("classic_the_adjective_noun"), criteria), 1e-9);
        }

        @Test
        @DisplayName("every axis matching is capped at 1.0")
        void allAxes_capped() {
            SelectionCriteria criteria = SelectionCriteria.of(3, "rock", "nostalgic")
                .withIntensity(SelectionCriteria.Intensity.MEDIUM)
                .withCreativity(SelectionCriteria.Creativity.CONSERVATIVE);
            assertEquals(1.0, ContextMatchScorer.score(template("classic_the_adjective_noun"), criteria), 1e-9);
        }

        @Test
        @DisplayName("unknown genre contributes nothing")
        void unknownGenre_noBonus() {
            assertTrue(CategoryMappings.forGenre("polka").isEmpty());
        }
    }

    // ── QualityScorer ───────────────────────────────────────────────────────

    @Nested
    @DisplayName("QualityScorer")
    class QualityTests {

        @Test
        @DisplayName("three examples + balanced weight → 0.8")
        void examplesAndWeight() {
            assertEquals(0.8, QualityScorer.score(template("classic_the_adjective_noun"), WordSource.empty()), 1e-9);
        }

        @Test
        @DisplayName("weight outside [0.1, 0.3] loses the balance bonus")
        void lowWeight_noBonus() {
            // sensory_experience has weight 0.05
            assertEquals(0.7, QualityScorer.score(template("sensory_experience"), WordSource.empty()), 1e-9);
        }

        @Test
        @DisplayName("narrative template over a rich verb pool gains the source bonus")
        void richVerbs_bonus() {
            List<String> verbs = List.of("wander", "gather", "shatter", "whisper", "linger", "tremble",
                "murmur", "flicker", "scatter", "wither", "hover", "glimmer", "shimmer", "quiver", "falter",
                "ripple", "kindle", "tumble", "crumble", "stumble");
            WordSource source = WordSourceNormalizer.fromCategories("verbs", Map.of(WordCategory.VERBS, verbs));
            assertTrue(source.filteredCount(WordCategory.VERBS) > 15);

            double rich = QualityScorer.score(template("narrative_sequence"), source);
            double plain = QualityScorer.score(template("narrative_sequence"), WordSource.empty());
            assertEquals(plain + QualityScorer.RICH_SOURCE_BONUS, rich, 1e-9);
        }
    }

    // ── FreshnessScorer ─────────────────────────────────────────────────────

    @Nested
    @DisplayName("FreshnessScorer")
    class FreshnessTests {

        @Test
        @DisplayName("no guard → fully fresh")
        void nullGuard_fresh() {
            assertEquals(1.0, FreshnessScorer.score(template("narrative_sequence"), null), 1e-9);
        }

        @Test
        @DisplayName("recently used template → penalised by 0.6")
        void recentTemplate_penalised() {
            RepetitionGuard guard = new RepetitionGuard();
            guard.recordTemplate(template("narrative_sequence"));
            assertEquals(0.4, FreshnessScorer.score(template("narrative_sequence"), guard), 1e-9);
        }

        @Test
        @DisplayName("overused category and subcategory penalise other templates too; floor 0")
        void overusedCategory_penalised() {
            RepetitionGuard guard = new RepetitionGuard();
            for (int i = 0; i < 4; i++) guard.recordTemplate(template("action_object"));
            // complete_narrative shares category "narrative" only
            assertEquals(0.6, FreshnessScorer.score(template("complete_narrative"), guard), 1e-9);
            // action_object: recent + category + subcategory
            assertEquals(0.0, FreshnessScorer.score(template("action_object"), guard), 1e-9);
        }
    }
}
