package com.fermata.common.atmosphere;

import com.fermata.common.mood.EmotionalVector;

import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Seasonal contributor. Each season has three phases with their own moods and intensity.
 *
 * <p>A phase's vector uses its intensity for complexity and intensity, {@code 100 − intensity}
 * for darkness, and energy/valence/mystery averaged from the phase's characteristic words.
 */
public enum Season {
    SPRING,
    SUMMER,
    AUTUMN,
    WINTER;

    public record Phase(List<String> moods, int intensity, EmotionalVector dimensions) {}

    private static final Map<Season, Map<SeasonPhase, Phase>> PHASES = new EnumMap<>(Season.class);

    static {
        define(SPRING, SeasonPhase.EARLY, 40, 36.25, 63.75, 55.0, "hopeful", "gentle", "awakening");
        define(SPRING, SeasonPhase.PEAK,  70, 71.25, 76.25, 35.0, "uplifting", "energetic", "romantic");
        define(SPRING, SeasonPhase.LATE,  65, 53.75, 68.75, 41.25, "abundant", "warm", "fulfilled");

        define(SUMMER, SeasonPhase.EARLY, 75, 65.0, 67.5, 40.0, "energetic", "bright", "celebratory");
        define(SUMMER, SeasonPhase.PEAK,  90, 50.0, 50.0, 50.0, "euphoric", "intense", "passionate");
        define(SUMMER, SeasonPhase.LATE,  60, 55.0, 65.0, 50.0, "nostalgic", "bittersweet", "reflective");

        define(AUTUMN, SeasonPhase.EARLY, 55, 51.25, 58.75, 61.25, "nostalgic", "contemplative", "bittersweet");
        define(AUTUMN, SeasonPhase.PEAK,  70, 51.25, 55.0, 67.5, "melancholic", "deep", "transformative");
        define(AUTUMN, SeasonPhase.LATE,  45, 42.5, 45.0, 55.0, "stark", "accepting", "preparing");

        define(WINTER, SeasonPhase.EARLY, 50, 51.25, 51.25, 53.75, "introspective", "quiet", "crystalline");
        define(WINTER, SeasonPhase.PEAK,  40, 35.0, 53.75, 73.75, "deep", "meditative", "stark");
        define(WINTER, SeasonPhase.LATE,  45, 47.5, 57.5, 57.5, "anticipatory", "restless", "emerging");
    }

    private static void define(Season season, SeasonPhase phase, int intensity,
                               double energy, double valence, double mystery, String... moods) {
        EmotionalVector vector = new EmotionalVector(energy, valence, intensity, intensity, 100 - intensity, mystery);
        PHASES.computeIfAbsent(season, s -> new EnumMap<>(SeasonPhase.class))
              .put(phase, new Phase(List.of(moods), intensity, vector));
    }

    /** Phase data; a {@code null} phase means the peak. */
    public Phase phase(SeasonPhase phase) {
        return PHASES.get(this).get(phase == null ? SeasonPhase.PEAK : phase);
    }

    public static Season fromId(String id) {
        if (id == null || id.isBlank()) return null;
        String normalized = id.trim().toUpperCase(Locale.ROOT);
        if (normalized.equals("FALL")) return AUTUMN;
        for (Season season : values()) {
            if (season.name().equals(normalized)) return season;
        }
        return null;
    }
}
