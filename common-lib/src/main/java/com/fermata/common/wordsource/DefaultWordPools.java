package com.fermata.common.wordsource;

import java.util.List;
import java.util.Map;

/**
 * Built-in vocabulary used whenever a {@link WordSource} category arrives empty.
 *
 * <p>Every pool is lowercase, unique and passes {@link WordFilter#isAcceptable(String)},
 * so a source that falls back to these lists still honours the filtered-list contract.
 */
public final class DefaultWordPools {

    private static final Map<WordCategory, List<String>> POOLS = Map.of(
        WordCategory.ADJECTIVES, List.of(
            "electric", "silent", "golden", "broken", "wild", "velvet", "hollow", "crimson",
            "distant", "burning", "frozen", "restless", "silver", "radiant", "savage", "gentle",
            "midnight", "lunar", "faded", "endless"),
        WordCategory.NOUNS, List.of(
            "storm", "echo", "river", "heart", "shadow", "ember", "horizon", "mirror",
            "thunder", "tide", "lantern", "raven", "canyon", "signal", "garden", "harbor",
            "flame", "comet", "forest", "dream"),
        WordCategory.VERBS, List.of(
            "rise", "fall", "burn", "drift", "shine", "break", "chase", "wander",
            "echo", "glow", "roar", "whisper", "dance", "fade", "ignite", "flow"),
        WordCategory.MUSICAL_TERMS, List.of(
            "melody", "rhythm", "chord", "harmony", "tempo", "cadence", "refrain", "chorus",
            "ballad", "anthem", "overture", "groove", "tremolo", "crescendo"),
        WordCategory.GENRE_TERMS, List.of("music", "sound", "rhythm", "melody"),
        WordCategory.CONTEXTUAL_WORDS, List.of(
            "city", "ocean", "desert", "valley", "skyline", "meadow", "coast", "highway",
            "harbor", "mountain", "island", "prairie"),
        WordCategory.ASSOCIATED_WORDS, List.of(
            "neon", "dust", "smoke", "glass", "velvet", "static", "honey", "amber",
            "iron", "ash", "mist", "salt")
    );

    private static final Map<String, List<String>> GENRE_TERMS = Map.ofEntries(
        Map.entry("rock", List.of("guitar", "electric", "power", "thunder")),
        Map.entry("metal", List.of("steel", "iron", "heavy", "brutal")),
        Map.entry("jazz", List.of("blue", "smooth", "swing", "groove")),
        Map.entry("electronic", List.of("digital", "cyber", "neon", "pulse")),
        Map.entry("folk", List.of("acoustic", "wooden", "earth", "roots")),
        Map.entry("classical", List.of("symphony", "orchestra", "grand", "elegant")),
        Map.entry("hip-hop", List.of("beat", "flow", "street", "rhythm")),
        Map.entry("country", List.of("dust", "road", "truck", "barn")),
        Map.entry("blues", List.of("soul", "pain", "night", "deep")),
        Map.entry("punk", List.of("riot", "anarchy", "rebel", "chaos")),
        Map.entry("indie", List.of("bedroom", "vinyl", "coffee", "analog")),
        Map.entry("pop", List.of("sugar", "candy", "bubble", "sparkle"))
    );

    private static final List<String> DEFAULT_GENRE_TERMS = List.of("music", "sound", "rhythm", "melody");

    private DefaultWordPools() {}

    /** The built-in pool for a category; never empty. */
    public static List<String> pool(WordCategory category) {
        return POOLS.getOrDefault(category, List.of());
    }

    /** Genre vocabulary used when no external genre terms arrived. */
    public static List<String> genreTerms(String genre) {
        if (genre == null) return DEFAULT_GENRE_TERMS;
        return GENRE_TERMS.getOrDefault(genre.toLowerCase(), DEFAULT_GENRE_TERMS);
    }
}
