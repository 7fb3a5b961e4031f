package com.fermata.common.wordsource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Seed words used to query external lexical sources for a mood and genre.
 *
 * <p>Mood seeds win over genre seeds for the per-part-of-speech lookups. Emotional and
 * sensory seeds accumulate: mood first, then genre.
 */
public final class WordSeeds {

    /** Emotional and sensory seed pair for one mood or genre. */
    public record SeedPair(List<String> emotional, List<String> sensory) {}

    private static final Map<String, SeedPair> MOOD_SEEDS = Map.ofEntries(
        Map.entry("dark", new SeedPair(List.of("shadow", "mystery", "void"), List.of("black", "cold", "heavy"))),
        Map.entry("bright", new SeedPair(List.of("joy", "light", "hope"), List.of("shine", "warm", "glow"))),
        Map.entry("mysterious", new SeedPair(List.of("secret", "unknown", "enigma"), List.of("mist", "veil", "hidden"))),
        Map.entry("energetic", new SeedPair(List.of("power", "force", "surge"), List.of("electric", "rush", "blast"))),
        Map.entry("melancholic", new SeedPair(List.of("sorrow", "longing", "wistful"), List.of("rain", "grey", "fade"))),
        Map.entry("aggressive", new SeedPair(List.of("rage", "fierce", "fury"), List.of("sharp", "loud", "hard"))),
        Map.entry("peaceful", new SeedPair(List.of("calm", "serene", "gentle"), List.of("soft", "quiet", "smooth"))),
        Map.entry("nostalgic", new SeedPair(List.of("memory", "past", "yearning"), List.of("old", "warm", "faded"))),
        Map.entry("romantic", new SeedPair(List.of("love", "passion", "desire"), List.of("rose", "silk", "velvet"))),
        Map.entry("uplifting", new SeedPair(List.of("glory", "triumph", "hope"), List.of("vast", "grand", "bright"))),
        Map.entry("euphoric", new SeedPair(List.of("bliss", "rapture", "joy"), List.of("glow", "shimmer", "rush")))
    );

    private static final Map<String, SeedPair> GENRE_SEEDS = Map.ofEntries(
        Map.entry("rock", new SeedPair(List.of("rebel", "freedom", "raw"), List.of("loud", "rough", "electric"))),
        Map.entry("metal", new SeedPair(List.of("power", "darkness", "intensity"), List.of("heavy", "sharp", "iron"))),
        Map.entry("jazz", new SeedPair(List.of("soul", "groove", "cool"), List.of("smooth", "warm", "blue"))),
        Map.entry("electronic", new SeedPair(List.of("future", "pulse", "synthetic"), List.of("digital", "bright", "pulse"))),
        Map.entry("folk", new SeedPair(List.of("story", "roots", "simple"), List.of("wood", "earth", "natural"))),
        Map.entry("classical", new SeedPair(List.of("elegance", "tradition", "beauty"), List.of("grand", "refined", "timeless"))),
        Map.entry("hip-hop", new SeedPair(List.of("street", "flow", "real"), List.of("urban", "beat", "bass"))),
        Map.entry("country", new SeedPair(List.of("home", "heart", "simple"), List.of("dust", "road", "barn"))),
        Map.entry("blues", new SeedPair(List.of("pain", "soul", "truth"), List.of("deep", "raw", "night"))),
        Map.entry("punk", new SeedPair(List.of("rebel", "anger", "chaos"), List.of("fast", "loud", "raw"))),
        Map.entry("indie", new SeedPair(List.of("unique", "authentic", "intimate"), List.of("soft", "quirky", "warm"))),
        Map.entry("pop", new SeedPair(List.of("fun", "bright", "catchy"), List.of("color", "shine", "bubble")))
    );

    private WordSeeds() {}

    public static SeedPair poeticSeeds(String mood, String genre) {
        List<String> emotional = new ArrayList<>();
        List<String> sensory = new ArrayList<>();
        SeedPair moodSeeds = mood == null ? null : MOOD_SEEDS.get(mood);
        if (moodSeeds != null) {
            emotional.addAll(moodSeeds.emotional());
            sensory.addAll(moodSeeds.sensory());
        }
        SeedPair genreSeeds = genre == null ? null : GENRE_SEEDS.get(genre);
        if (genreSeeds != null) {
            emotional.addAll(genreSeeds.emotional());
            sensory.addAll(genreSeeds.sensory());
        }
        if (emotional.isEmpty()) {
            return new SeedPair(List.of("soul", "heart", "dream"), List.of("light", "sound", "color"));
        }
        return new SeedPair(List.copyOf(emotional), List.copyOf(sensory));
    }

    public static List<String> adjectiveSeeds(String mood, String genre) {
        if ("dark".equals(mood)) return List.of("shadow", "grim", "haunting");
        if ("energetic".equals(mood)) return List.of("electric", "fierce", "dynamic");
        if ("metal".equals(genre)) return List.of("heavy", "brutal", "savage");
        if ("jazz".equals(genre)) return List.of("smooth", "cool", "sophisticated");
        if ("electronic".equals(genre)) return List.of("digital", "synthetic", "cyber");
        return List.of("bright", "dark", "wild");
    }

    public static List<String> nounSeeds(String mood, String genre) {
        if ("dark".equals(mood)) return List.of("shadow", "void", "abyss");
        if ("mysterious".equals(mood)) return List.of("enigma", "mystery", "secret");
        if ("rock".equals(genre)) return List.of("thunder", "storm", "power");
        if ("folk".equals(genre)) return List.of("river", "mountain", "tree");
        if ("electronic".equals(genre)) return List.of("pulse", "wave", "circuit");
        return List.of("soul", "heart", "spirit");
    }

    public static List<String> verbSeeds(String mood, String genre) {
        if ("aggressive".equals(mood)) return List.of("strike", "crush", "explode");
        if ("peaceful".equals(mood)) return List.of("drift", "float", "breathe");
        if ("energetic".equals(mood)) return List.of("surge", "pulse", "ignite");
        if ("rock".equals(genre)) return List.of("rock", "roll", "thunder");
        if ("jazz".equals(genre)) return List.of("swing", "groove", "improvise");
        return List.of("rise", "fall", "flow");
    }
}
