package com.fermata.common.fusion;

import com.fermata.common.genre.FusionStyle;
import com.fermata.common.genre.VocabularyStrategy;

import java.util.List;

public record FusionMetadata(
    String primaryGenre,
    String secondaryGenre,
    double compatibilityScore,
    FusionStyle fusionStyle,
    VocabularyStrategy vocabularyStrategy,
    FusionMethod method,
    List<String> patternSources,
    List<String> fusionElements,
    double creativityLevel,
    double authenticity,
    double innovation
) {

    public FusionMetadata {
        patternSources = List.copyOf(patternSources);
        fusionElements = List.copyOf(fusionElements);
    }
}
