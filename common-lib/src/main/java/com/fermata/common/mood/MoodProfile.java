package com.fermata.common.mood;

import java.util.List;
import java.util.Map;

/**
 * Curated description of a named mood.
 *
 * @param id                 lower-case mood name
 * @param category           coarse grouping, e.g. {@code high_energy}
 * @param dimensions         emotional position
 * @param keywords           descriptive words used for semantic matching
 * @param opposites          mood names (or descriptors) that conflict with this mood
 * @param genreAffinity      genre → affinity in [0, 1]
 * @param patternPreferences template ids (and idea tags) that suit this mood
 * @param preferredSyllables typical syllable count of fitting words
 */
public record MoodProfile(
    String id,
    String category,
    EmotionalVector dimensions,
    List<String> keywords,
    List<String> opposites,
    Map<String, Double> genreAffinity,
    List<String> patternPreferences,
    int preferredSyllables
) {

    public MoodProfile {
        keywords = List.copyOf(keywords);
        opposites = List.copyOf(opposites);
        genreAffinity = Map.copyOf(genreAffinity);
        patternPreferences = List.copyOf(patternPreferences);
    }

    public double affinityFor(String genre) {
        return genre == null ? 0.0 : genreAffinity.getOrDefault(genre, 0.0);
    }

    public double maxAffinity() {
        double max = 0.0;
        for (double value : genreAffinity.values()) max = Math.max(max, value);
        return max;
    }
}
