package com.fermata.common.memory;

import com.fermata.common.MutableClock;
import com.fermata.common.template.NameType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Verifies {@link GlobalNameMemory} rejection windows, expiry and cleanup.
 * Probabilistic branches are pinned with a {@link Random} stub returning a fixed draw.
 */
class GlobalNameMemoryTest {

    private MutableClock clock;
    private GlobalNameMemory memory;

    @BeforeEach
    void setUp() {
        clock = MutableClock.atEpoch();
        memory = new GlobalNameMemory(10, clock);
    }

    /** A {@link Random} whose nextDouble() always returns {@code value}. */
    private static Random fixedDraw(double value) {
        return new Random() {
            @Override
            public double nextDouble() {
                return value;
            }
        };
    }

    // ── shouldReject ────────────────────────────────────────────────────────

    @Nested
    @DisplayName("shouldReject()")
    class ShouldRejectTests {

        @Test
        @DisplayName("unknown name → never rejected")
        void unknownName_accepted() {
            assertFalse(memory.shouldReject("Velvet Harbor", "rock", fixedDraw(0.0)));
        }

        @Test
        @DisplayName("same genre within one hour → always rejected")
        void sameGenreWithinHour_rejected() {
            memory.add("Velvet Harbor", "rock", NameType.BAND, 0.8);
            clock.advance(Duration.ofMinutes(59));
            assertTrue(memory.shouldReject("velvet harbor", "rock", fixedDraw(0.99)));
        }

        @Test
        @DisplayName("related genre within twelve hours → rejected below 0.3")
        void relatedGenre_probabilistic() {
            memory.add("Velvet Harbor", "rock", NameType.BAND, 0.8);
            clock.advance(Duration.ofMinutes(30));
            assertTrue(memory.shouldReject("Velvet Harbor", "metal", fixedDraw(0.29)));
            assertFalse(memory.shouldReject("Velvet Harbor", "metal", fixedDraw(0.31)));
        }

        @Test
        @DisplayName("same genre after the hour falls back to the related/unrelated odds")
        void sameGenreAfterHour_probabilistic() {
            memory.add("Velvet Harbor", "rock", NameType.BAND, 0.8);
            clock.advance(Duration.ofHours(2));
            assertFalse(memory.shouldReject("Velvet Harbor", "rock", fixedDraw(0.2)));
        }

        @Test
        @DisplayName("unrelated genre → rejected below 0.1")
        void unrelatedGenre_probabilistic() {
            memory.add("Velvet Harbor", "rock", NameType.BAND, 0.8);
            assertTrue(memory.shouldReject("Velvet Harbor", "jazz", fixedDraw(0.05)));
            assertFalse(memory.shouldReject("Velvet Harbor", "jazz", fixedDraw(0.15)));
        }

        @Test
        @DisplayName("entries older than 24 hours expire")
        void expiredEntry_forgotten() {
            memory.add("Velvet Harbor", "rock", NameType.BAND, 0.8);
            clock.advance(Duration.ofHours(25));
            assertNull(memory.get("Velvet Harbor"));
            assertFalse(memory.shouldReject("Velvet Harbor", "rock", fixedDraw(0.0)));
            assertEquals(0, memory.size());
        }
    }

    // ── genre relationships ─────────────────────────────────────────────────

    @Nested
    @DisplayName("areRelated()")
    class RelatedTests {

        @Test
        @DisplayName("relationship is symmetric")
        void related_symmetric() {
            assertTrue(GlobalNameMemory.areRelated("rock", "metal"));
            assertTrue(GlobalNameMemory.areRelated("metal", "rock"));
        }

        @Test
        @DisplayName("hip hop spellings normalise to hip-hop")
        void hipHopSpellings_normalised() {
            assertEquals("hip-hop", GlobalNameMemory.normalizeGenre("Hip Hop"));
            assertEquals("hip-hop", GlobalNameMemory.normalizeGenre("hiphop"));
        }

        @Test
        @DisplayName("rock and jazz are not related")
        void rockJazz_unrelated() {
            assertFalse(GlobalNameMemory.areRelated("rock", "jazz"));
        }
    }

    // ── capacity ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("cleanup")
    class CleanupTests {

        @Test
        @DisplayName("exceeding capacity keeps the newest 80%")
        void overCapacity_keepsNewest() {
            for (int i = 0; i < 11; i++) {
                memory.add("Name " + i, "pop", NameType.SONG, 0.5);
                clock.advance(Duration.ofSeconds(1));
            }
            assertEquals(8, memory.size());
            assertNull(memory.get("Name 0"));
            assertNotNull(memory.get("Name 10"));
        }

        @Test
        @DisplayName("recentNames() returns newest first and honours the genre filter")
        void recentNames_newestFirst() {
            memory.add("Older Song", "pop", NameType.SONG, 0.5);
            clock.advance(Duration.ofSeconds(1));
            memory.add("Newer Song", "pop", NameType.SONG, 0.5);
            clock.advance(Duration.ofSeconds(1));
            memory.add("Jazz Song", "jazz", NameType.SONG, 0.5);

            assertEquals(List.of("Jazz Song", "Newer Song", "Older Song"), memory.recentNames(5, null));
            assertEquals(List.of("Newer Song", "Older Song"), memory.recentNames(5, "pop"));
        }

        @Test
        @DisplayName("recentWords() collects distinct lower-case words")
        void recentWords_distinct() {
            memory.add("Blue Song", "jazz", NameType.SONG, 0.5);
            clock.advance(Duration.ofSeconds(1));
            memory.add("Blue Night", "jazz", NameType.SONG, 0.5);
            List<String> words = memory.recentWords(5);
            assertEquals(3, words.size());
            assertTrue(words.containsAll(List.of("blue", "song", "night")));
        }
    }
}
