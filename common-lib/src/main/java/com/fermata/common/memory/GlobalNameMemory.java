package com.fermata.common.memory;

import com.fermata.common.template.NameType;
import com.fermata.common.template.PhraseText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Process-wide memory of recently generated names, shared by every request.
 *
 * <p>Re-emitting a remembered name is judged against the genre it was first produced for:
 * <ol>
 *   <li>same genre within {@link #SAME_GENRE_WINDOW}: always rejected</li>
 *   <li>related genre within {@link #RELATED_GENRE_WINDOW}: rejected with probability {@value #RELATED_REJECT_PROBABILITY}</li>
 *   <li>any genre within {@link #ENTRY_TTL}: rejected with probability {@value #OTHER_REJECT_PROBABILITY}</li>
 * </ol>
 * Entries older than {@link #ENTRY_TTL} are evicted on lookup. When the memory exceeds its
 * capacity, the newest {@value #KEEP_FRACTION} share is kept.
 *
 * <p>Thread-safe via {@link ConcurrentHashMap}. Cleanup is best-effort under concurrent adds.
 */
public class GlobalNameMemory {

    private static final Logger log = LoggerFactory.getLogger(GlobalNameMemory.class);

    public static final int DEFAULT_MAX_ENTRIES = 500;
    public static final double KEEP_FRACTION = 0.8;
    public static final Duration SAME_GENRE_WINDOW = Duration.ofHours(1);
    public static final Duration RELATED_GENRE_WINDOW = Duration.ofHours(12);
    public static final Duration ENTRY_TTL = Duration.ofHours(24);
    public static final double RELATED_REJECT_PROBABILITY = 0.3;
    public static final double OTHER_REJECT_PROBABILITY = 0.1;

    private static final Map<String, Set<String>> RELATED_GENRES = Map.of(
        "rock",       Set.of("metal", "punk", "indie", "alternative", "blues"),
        "pop",        Set.of("indie", "electronic", "dance", "r&b"),
        "electronic", Set.of("techno", "house", "ambient", "pop", "dance"),
        "metal",      Set.of("rock", "punk", "hardcore"),
        "indie",      Set.of("rock", "pop", "alternative", "folk"),
        "hip-hop",    Set.of("rap", "r&b", "trap", "jazz"),
        "folk",       Set.of("country", "indie", "acoustic", "bluegrass"),
        "jazz",       Set.of("blues", "soul", "funk", "hip-hop"),
        "country",    Set.of("folk", "bluegrass", "americana", "rock")
    );

    private final ConcurrentHashMap<String, RememberedName> store = new ConcurrentHashMap<>();
    private final int maxEntries;
    private final Clock clock;

    public GlobalNameMemory() {
        this(DEFAULT_MAX_ENTRIES, Clock.systemUTC());
    }

    public GlobalNameMemory(int maxEntries, Clock clock) {
        if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be positive: " + maxEntries);
        this.maxEntries = maxEntries;
        this.clock = clock;
    }

    /**
     * Returns the remembered entry for the name, or {@code null} if absent or older than
     * {@link #ENTRY_TTL}. Expired entries are evicted.
     */
    public RememberedName get(String name) {
        String key = key(name);
        RememberedName entry = store.get(key);
        if (entry == null) {
            return null;
        }
        if (isExpired(entry)) {
            store.remove(key);
            return null;
        }
        return entry;
    }

    public boolean shouldReject(String name, String genre, Random rng) {
        RememberedName entry = get(name);
        if (entry == null) return false;

        Duration age = Duration.between(entry.createdAt(), clock.instant());
        String requested = normalizeGenre(genre);
        String original = normalizeGenre(entry.genre());

        if (age.compareTo(SAME_GENRE_WINDOW) < 0 && requested.equals(original)) {
            log.debug("[NameMemory] reject same-genre name='{}' genre={} ageMinutes={}", name, requested, age.toMinutes());
            return true;
        }
        if (age.compareTo(RELATED_GENRE_WINDOW) < 0 && areRelated(requested, original)) {
            return rng.nextDouble() < RELATED_REJECT_PROBABILITY;
        }
        return rng.nextDouble() < OTHER_REJECT_PROBABILITY;
    }

    public void add(String name, String genre, NameType type, double qualityScore) {
        RememberedName entry = new RememberedName(name, normalizeGenre(genre), type, qualityScore, clock.instant());
        store.put(key(name), entry);
        if (store.size() > maxEntries) {
            cleanup();
        }
    }

    public int size() {
        return store.size();
    }

    /** Most recent names first, optionally restricted to one genre. */
    public List<String> recentNames(int limit, String genre) {
        String wanted = genre == null ? null : normalizeGenre(genre);
        return store.values().stream()
            .filter(e -> wanted == null || wanted.equals(e.genre()))
            .sorted(Comparator.comparing(RememberedName::createdAt).reversed())
            .limit(limit)
            .map(RememberedName::name)
            .collect(Collectors.toList());
    }

    /** Distinct lower-case words of the most recent names. */
    public List<String> recentWords(int limit) {
        Set<String> words = new LinkedHashSet<>();
        for (String name : recentNames(limit, null)) {
            for (String word : PhraseText.words(name)) {
                words.add(word.toLowerCase(Locale.ROOT));
            }
        }
        return List.copyOf(words);
    }

    public static boolean areRelated(String first, String second) {
        String a = normalizeGenre(first);
        String b = normalizeGenre(second);
        return RELATED_GENRES.getOrDefault(a, Set.of()).contains(b)
            || RELATED_GENRES.getOrDefault(b, Set.of()).contains(a);
    }

    void cleanup() {
        int keep = (int) Math.floor(maxEntries * KEEP_FRACTION);
        List<Map.Entry<String, RememberedName>> oldest = store.entrySet().stream()
            .sorted(Comparator.comparing(e -> e.getValue().createdAt()))
            .collect(Collectors.toList());
        int toRemove = oldest.size() - keep;
        for (int i = 0; i < toRemove; i++) {
            store.remove(oldest.get(i).getKey());
        }
        log.info("[NameMemory] MEMORY_CLEANUP removed={} remaining={}", Math.max(0, toRemove), store.size());
    }

    private boolean isExpired(RememberedName entry) {
        Instant now = clock.instant();
        return now.isAfter(entry.createdAt().plus(ENTRY_TTL));
    }

    private static String key(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    static String normalizeGenre(String genre) {
        if (genre == null || genre.isBlank()) return "";
        String g = genre.trim().toLowerCase(Locale.ROOT);
        return "hiphop".equals(g) || "hip hop".equals(g) ? "hip-hop" : g;
    }
}
