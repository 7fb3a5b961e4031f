package com.fermata.common.guard;

import com.fermata.common.MutableClock;
import com.fermata.common.selection.SelectionSession;
import com.fermata.common.template.Template;
import com.fermata.common.template.TemplateKind;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.CyclicBarrier;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Deterministic verification of {@link RepetitionGuard}: duplicate and shared-word rejection,
 * bounded queues, usage counts and time-based decay under a controllable clock.
 */
class RepetitionGuardTest {

    private MutableClock clock;
    private RepetitionGuard guard;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        guard = new RepetitionGuard(GuardSettings.defaults(), clock);
    }

    private static Template template(String id, String category, String subcategory) {
        return new Template(id, TemplateKind.DYNAMIC_ADJECTIVE_NOUN, category, subcategory, 0.2, 2, 2,
            Set.of(), Set.of(), "{a} {b}", List.of("One Two", "Three Four", "Five Six"));
    }

    // ── shouldReject ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("shouldReject()")
    class ShouldRejectTests {

        @Test
        @DisplayName("null or blank candidate → rejected")
        void blankCandidate_rejected() {
            assertTrue(guard.shouldReject(null));
            assertTrue(guard.shouldReject("   "));
        }

        @Test
        @DisplayName("fresh guard accepts anything non-blank")
        void freshGuard_accepts() {
            assertFalse(guard.shouldReject("Velvet Harbor"));
        }

        @Test
        @DisplayName("accepting the same string twice → second check rejects")
        void acceptedName_rejectedAfterwards() {
            assertFalse(guard.shouldReject("Midnight Lanterns"));
            guard.accept("Midnight Lanterns", null);
            assertTrue(guard.shouldReject("Midnight Lanterns"));
        }

        @Test
        @DisplayName("duplicate check ignores case and extra whitespace")
        void duplicate_caseAndWhitespaceInsensitive() {
            guard.accept("Midnight Lanterns", null);
            assertTrue(guard.shouldReject("  midnight   LANTERNS "));
        }

        @Test
        @DisplayName("shared-word rule is inactive below two recent names")
        void sharedWords_needHistory() {
            guard.accept("Crimson Harbor", null);
            assertFalse(guard.shouldReject("Harbor Lights"));
        }

        @Test
        @DisplayName("candidate sharing a word with more than half the history → rejected")
        void sharedWords_majorityRejected() {
            guard.accept("Crimson Harbor", null);
            guard.accept("Silent Harbor", null);
            guard.accept("Golden Meadow", null);
            // 2 of 3 recent names contain "harbor"
            assertTrue(guard.shouldReject("Harbor Lights"));
        }

        @Test
        @DisplayName("candidate sharing a word with exactly half the history → accepted")
        void sharedWords_halfAccepted() {
            guard.accept("Crimson Harbor", null);
            guard.accept("Golden Meadow", null);
            assertFalse(guard.shouldReject("Harbor Lights"));
        }

        @Test
        @DisplayName("short words (< 4 letters) never count as shared")
        void shortWords_ignored() {
            guard.accept("The Red Sea", null);
            guard.accept("The Red Sky", null);
            assertFalse(guard.shouldReject("The Red Fox"));
        }
    }

    // ── queues ──────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("recent queues")
    class QueueTests {

        @Test
        @DisplayName("recent names are capped at recentWordCapacity, oldest evicted first")
        void recentNames_bounded() {
            RepetitionGuard small = new RepetitionGuard(
                new GuardSettings(3, 2, 0.5, Duration.ofMinutes(5), 3, 2), clock);
            small.accept("alpha one", null);
            small.accept("beta two", null);
            small.accept("gamma three", null);
            small.accept("delta four", null);

            assertEquals(List.of("beta two", "gamma three", "delta four"), small.recentNames());
            assertFalse(small.shouldReject("alpha one"));
        }

        @Test
        @DisplayName("significant words are recorded, most recent last, without duplicates")
        void recentWords_recorded() {
            guard.accept("Velvet Thunder", null);
            guard.accept("Thunder Road", null);
            assertEquals(List.of("velvet", "thunder", "road"), guard.recentWords());
        }

        @Test
        @DisplayName("hyphenated and underscored names split into words")
        void significantWords_splitOnSeparators() {
            assertEquals(Set.of("neon", "forest", "pulse"),
                RepetitionGuard.significantWords("neon-forest_pulse"));
        }

        @Test
        @DisplayName("recent templates are capped at recentTemplateCapacity")
        void recentTemplates_bounded() {
            RepetitionGuard small = new RepetitionGuard(
                new GuardSettings(3, 2, 0.5, Duration.ofMinutes(5), 3, 2), clock);
            small.recordTemplate(template("a", "x", "x1"));
            small.recordTemplate(template("b", "x", "x1"));
            small.recordTemplate(template("c", "y", "y1"));

            assertEquals(List.of("b", "c"), small.recentTemplates());
            assertFalse(small.isRecentTemplate("a"));
            assertTrue(small.isRecentTemplate("c"));
        }

        @Test
        @DisplayName("accept() with a template records it")
        void acceptWithTemplate_recordsTemplate() {
            guard.accept("Neon Garden", template("techno_organic", "fusion", "tech_nature"));
            assertTrue(guard.isRecentTemplate("techno_organic"));
            assertEquals(1, guard.categoryCount("fusion"));
            assertEquals(1, guard.subcategoryCount("tech_nature"));
        }

        @Test
        @DisplayName("clear() empties every structure")
        void clear_resets() {
            guard.accept("Neon Garden", template("techno_organic", "fusion", "tech_nature"));
            guard.clear();
            assertTrue(guard.recentNames().isEmpty());
            assertTrue(guard.recentWords().isEmpty());
            assertTrue(guard.recentTemplates().isEmpty());
            assertTrue(guard.categoryCounts().isEmpty());
        }
    }

    // ── decay ───────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("decayIfDue()")
    class DecayTests {

        @BeforeEach
        void fillCounts() {
            Template t = template("narrative_sequence", "narrative", "story");
            for (int i = 0; i < 9; i++) guard.recordTemplate(t);
        }

        @Test
        @DisplayName("within the interval → no decay")
        void withinInterval_noDecay() {
            clock.advance(Duration.ofMinutes(5));
            assertEquals(0, guard.decayIfDue());
            assertEquals(9, guard.categoryCount("narrative"));
        }

        @Test
        @DisplayName("one interval elapsed → counts halved with floor")
        void oneInterval_halves() {
            clock.advance(Duration.ofMinutes(6));
            assertEquals(1, guard.decayIfDue());
            assertEquals(4, guard.categoryCount("narrative"));
            assertEquals(4, guard.subcategoryCount("story"));
        }

        @Test
        @DisplayName("several intervals elapsed → one pass per interval, zero counts removed")
        void manyIntervals_removesZeros() {
            clock.advance(Duration.ofMinutes(20));
            guard.decayIfDue();
            // 9 → 4 → 2 → 1 → 0
            assertEquals(0, guard.categoryCount("narrative"));
            assertFalse(guard.categoryCounts().containsKey("narrative"));
        }

        @Test
        @DisplayName("counts are non-increasing across passes and never negative")
        void decay_monotone() {
            Map<String, Integer> previous = guard.categoryCounts();
            for (int step = 0; step < 6; step++) {
                clock.advance(Duration.ofMinutes(6));
                guard.decayIfDue();
                Map<String, Integer> current = guard.categoryCounts();
                for (Map.Entry<String, Integer> entry : current.entrySet()) {
                    assertTrue(entry.getValue() >= 0);
                    assertTrue(entry.getValue() <= previous.getOrDefault(entry.getKey(), 0));
                }
                previous = current;
            }
        }

        @Test
        @DisplayName("decay leaves recent names untouched")
        void decay_keepsNames() {
            guard.accept("Velvet Thunder", null);
            clock.advance(Duration.ofHours(1));
            guard.decayIfDue();
            assertTrue(guard.shouldReject("Velvet Thunder"));
        }
    }

    // ── tryAccept ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("tryAccept()")
    class TryAcceptTests {

        @Test
        @DisplayName("first call admits the name, repeat call is rejected")
        void tryAccept_onceOnly() {
            assertTrue(guard.tryAccept("Velvet Thunder", null));
            assertFalse(guard.tryAccept("velvet  THUNDER", null));
            assertEquals(List.of("velvet thunder"), guard.recentNames());
        }

        @Test
        @DisplayName("rejected name leaves the template counts untouched")
        void rejected_templateNotRecorded() {
            Template t = template("t1", "nature", "weather");
            guard.accept("Velvet Thunder", null);
            assertFalse(guard.tryAccept("Velvet Thunder", t));
            assertEquals(0, guard.categoryCount("nature"));
        }

        @Test
        @DisplayName("8 sessions racing on one shared guard → exactly one admission per name")
        void concurrentSessions_singleAdmission() throws Exception {
            int threads = 8;
            ExecutorService pool = Executors.newFixedThreadPool(threads);
            try {
                for (int round = 0; round < 300; round++) {
                    RepetitionGuard shared = new RepetitionGuard(GuardSettings.defaults(), clock);
                    CyclicBarrier gate = new CyclicBarrier(threads);
                    List<Future<Boolean>> results = new ArrayList<>();
                    for (int i = 0; i < threads; i++) {
                        SelectionSession session = new SelectionSession(shared, new Random(i));
                        results.add(pool.submit(() -> {
                            gate.await(5, TimeUnit.SECONDS);
                            return session.tryAccept("Velvet Thunder");
                        }));
                    }
                    int admitted = 0;
                    for (Future<Boolean> result : results) {
                        if (result.get(5, TimeUnit.SECONDS)) admitted++;
                    }
                    assertEquals(1, admitted, "round " + round);
                    assertEquals(1, shared.recentNames().size(), "round " + round);
                }
            } finally {
                pool.shutdownNow();
            }
        }
    }

    // ── settings ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("GuardSettings validation")
    class SettingsTests {

        @Test
        @DisplayName("non-positive capacity → IllegalArgumentException")
        void zeroCapacity_throws() {
            assertThrows(IllegalArgumentException.class,
                () -> new GuardSettings(0, 20, 0.5, Duration.ofMinutes(5), 3, 2));
        }

        @Test
        @DisplayName("fraction outside [0, 1] → IllegalArgumentException")
        void badFraction_throws() {
            assertThrows(IllegalArgumentException.class,
                () -> new GuardSettings(30, 20, 1.5, Duration.ofMinutes(5), 3, 2));
        }

        @Test
        @DisplayName("zero decay interval → IllegalArgumentException")
        void zeroInterval_throws() {
            assertThrows(IllegalArgumentException.class,
                () -> new GuardSettings(30, 20, 0.5, Duration.ZERO, 3, 2));
        }
    }
}
