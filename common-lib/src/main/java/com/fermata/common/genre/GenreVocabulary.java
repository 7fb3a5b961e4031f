package com.fermata.common.genre;

import java.util.List;

/**
 * Term lists characteristic of one genre. Terms are lowercase and may contain spaces.
 */
public record GenreVocabulary(
    String genre,
    List<String> coreTerms,
    List<String> instrumentalTerms,
    List<String> culturalTerms,
    List<String> emotionalTerms,
    List<String> technicalTerms,
    List<String> metaphoricalTerms,
    List<String> intensityModifiers,
    List<String> adjectives
) {

    public GenreVocabulary {
        coreTerms = List.copyOf(coreTerms);
        instrumentalTerms = List.copyOf(instrumentalTerms);
        culturalTerms = List.copyOf(culturalTerms);
        emotionalTerms = List.copyOf(emotionalTerms);
        technicalTerms = List.copyOf(technicalTerms);
        metaphoricalTerms = List.copyOf(metaphoricalTerms);
        intensityModifiers = List.copyOf(intensityModifiers);
        adjectives = List.copyOf(adjectives);
    }
}
