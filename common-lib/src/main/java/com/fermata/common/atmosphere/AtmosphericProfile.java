package com.fermata.common.atmosphere;

import com.fermata.common.mood.EmotionalVector;

import java.util.List;
import java.util.Locale;

/**
 * Named atmospheres with a resonance vector and curated compatible / conflicting moods.
 */
public enum AtmosphericProfile {
    STORM_PASSAGE("storm_passage",
        new EmotionalVector(85, 40, 75, 90, 70, 60),
        List.of("aggressive", "energetic", "mysterious", "dark"),
        List.of("peaceful", "gentle", "serene"),
        List.of("weather", "power", "change", "nature", "thunder", "storm", "lightning")),
    MIDNIGHT_SOLITUDE("midnight_solitude",
        new EmotionalVector(30, 35, 80, 60, 85, 90),
        List.of("melancholic", "mysterious", "contemplative", "dark"),
        List.of("euphoric", "energetic", "uplifting"),
        List.of("darkness", "solitude", "time", "thought", "midnight", "shadow")),
    SPRING_AWAKENING("spring_awakening",
        new EmotionalVector(70, 85, 60, 65, 15, 40),
        List.of("uplifting", "peaceful", "romantic", "hopeful"),
        List.of("dark", "aggressive", "melancholic"),
        List.of("growth", "renewal", "hope", "nature", "bloom", "rising")),
    URBAN_NIGHTSCAPE("urban_nightscape",
        new EmotionalVector(75, 50, 85, 80, 60, 70),
        List.of("energetic", "mysterious", "aggressive", "electric"),
        List.of("peaceful", "rural", "natural"),
        List.of("technology", "people", "energy", "movement", "neon", "city", "electric")),
    SACRED_GROVE("sacred_grove",
        new EmotionalVector(40, 75, 70, 45, 25, 80),
        List.of("peaceful", "mysterious", "contemplative", "spiritual"),
        List.of("aggressive", "urban", "technological"),
        List.of("nature", "spirit", "ancient", "sacred", "forest", "grove"));

    private final String id;
    private final EmotionalVector resonance;
    private final List<String> compatibleMoods;
    private final List<String> conflictingMoods;
    private final List<String> semanticFields;

    AtmosphericProfile(String id, EmotionalVector resonance, List<String> compatibleMoods,
                       List<String> conflictingMoods, List<String> semanticFields) {
        this.id = id;
        this.resonance = resonance;
        this.compatibleMoods = compatibleMoods;
        this.conflictingMoods = conflictingMoods;
        this.semanticFields = semanticFields;
    }

    public String id() {
        return id;
    }

    public EmotionalVector resonance() {
        return resonance;
    }

    public List<String> compatibleMoods() {
        return compatibleMoods;
    }

    public List<String> conflictingMoods() {
        return conflictingMoods;
    }

    public List<String> semanticFields() {
        return semanticFields;
    }

    public boolean isCompatibleWith(String moodId) {
        return moodId != null && compatibleMoods.contains(moodId);
    }

    public boolean conflictsWith(String moodId) {
        return moodId != null && conflictingMoods.contains(moodId);
    }

    public static AtmosphericProfile fromId(String id) {
        if (id == null || id.isBlank()) return null;
        String normalized = id.trim().toLowerCase(Locale.ROOT).replace('-', '_').replace(' ', '_');
        for (AtmosphericProfile profile : values()) {
            if (profile.id.equals(normalized)) return profile;
        }
        return null;
    }
}
