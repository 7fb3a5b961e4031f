package com.fermata.common.genre;

import java.util.List;

/** Curated fusion guidance for a specific genre pair. */
public record FusionRule(
    String name,
    String firstGenre,
    String secondGenre,
    VocabularyStrategy vocabularyStrategy,
    PatternStrategy patternStrategy,
    List<String> examples
) {

    public enum PatternStrategy { BLEND, LAYER, INTERWEAVE, TRANSFORM }

    public FusionRule {
        examples = List.copyOf(examples);
    }

    public boolean covers(String a, String b) {
        return (firstGenre.equals(a) && secondGenre.equals(b)) || (firstGenre.equals(b) && secondGenre.equals(a));
    }
}
