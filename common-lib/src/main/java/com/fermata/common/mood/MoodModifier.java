package com.fermata.common.mood;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Contextual adjustments layered on top of a base mood.
 *
 * <p>A modifier only acts on the moods it lists as applicable; each axis moves by
 * {@code effect × strength}.
 */
public enum MoodModifier {
    VINTAGE_FILTER(0.3,
        Map.of(EmotionalDimension.COMPLEXITY, 10.0, EmotionalDimension.DARKNESS, 5.0, EmotionalDimension.MYSTERY, 15.0),
        Set.of("nostalgic", "romantic", "melancholic")),
    URBAN_INTENSITY(0.4,
        Map.of(EmotionalDimension.ENERGY, 15.0, EmotionalDimension.INTENSITY, 20.0, EmotionalDimension.DARKNESS, 10.0),
        Set.of("aggressive", "energetic", "dark")),
    SEASONAL_AUTUMN(0.25,
        Map.of(EmotionalDimension.ENERGY, -10.0, EmotionalDimension.VALENCE, -5.0,
               EmotionalDimension.COMPLEXITY, 10.0, EmotionalDimension.DARKNESS, 15.0),
        Set.of("nostalgic", "melancholic", "peaceful")),
    MIDNIGHT_AMPLIFIER(0.5,
        Map.of(EmotionalDimension.DARKNESS, 20.0, EmotionalDimension.MYSTERY, 25.0, EmotionalDimension.INTENSITY, 10.0),
        Set.of("mysterious", "dark", "romantic"));

    private final double strength;
    private final Map<EmotionalDimension, Double> effect;
    private final Set<String> applicableMoods;

    MoodModifier(double strength, Map<EmotionalDimension, Double> effect, Set<String> applicableMoods) {
        this.strength = strength;
        this.effect = effect;
        this.applicableMoods = applicableMoods;
    }

    public double strength() {
        return strength;
    }

    public boolean appliesTo(String moodId) {
        return moodId != null && applicableMoods.contains(moodId);
    }

    /** Applies the modifier when it is applicable to {@code moodId}; otherwise returns {@code base}. */
    public EmotionalVector apply(EmotionalVector base, String moodId) {
        if (!appliesTo(moodId)) return base;
        EmotionalVector result = base;
        for (Map.Entry<EmotionalDimension, Double> change : effect.entrySet()) {
            result = result.shift(change.getKey(), change.getValue() * strength);
        }
        return result;
    }

    /** Parses {@code "vintage_filter"} / {@code "VINTAGE-FILTER"}; {@code null} when unknown. */
    public static MoodModifier fromId(String id) {
        if (id == null) return null;
        String normalized = id.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (MoodModifier modifier : values()) {
            if (modifier.name().equals(normalized)) return modifier;
        }
        return null;
    }
}
