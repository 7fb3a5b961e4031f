package com.fermata.common.genre;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Vocabulary produced by blending two genres.
 *
 * @param hybridTerms      constructs that belong to both genres (portmanteaus, prefixed cores, ...)
 * @param conceptualBlends multi-word phrases bridging the genres' concepts
 * @param culturalFusions  phrases combining the genres' cultural terms
 * @param creativityLevel  how adventurous the blend is, in [0, 1]
 */
public record FusedVocabulary(
    List<String> primaryWords,
    List<String> secondaryWords,
    List<String> hybridTerms,
    List<String> conceptualBlends,
    List<String> culturalFusions,
    VocabularyStrategy strategy,
    String dominantGenre,
    double primaryWeight,
    double secondaryWeight,
    double compatibilityScore,
    double creativityLevel
) {

    public FusedVocabulary {
        primaryWords = List.copyOf(primaryWords);
        secondaryWords = List.copyOf(secondaryWords);
        hybridTerms = List.copyOf(hybridTerms);
        conceptualBlends = List.copyOf(conceptualBlends);
        culturalFusions = List.copyOf(culturalFusions);
    }

    /** Every single-token term, primary first, without duplicates. */
    public List<String> singleWords() {
        Set<String> words = new LinkedHashSet<>();
        for (List<String> list : List.of(primaryWords, secondaryWords, hybridTerms)) {
            for (String term : list) {
                if (!term.isBlank() && !term.contains(" ")) words.add(term);
            }
        }
        return new ArrayList<>(words);
    }

    /** Whether {@code phrase} contains one of the hybrid or blend constructs (case-insensitive). */
    public boolean usesFusionElement(String phrase) {
        String lower = phrase.toLowerCase();
        for (List<String> list : List.of(hybridTerms, conceptualBlends, culturalFusions)) {
            for (String term : list) {
                if (!term.isBlank() && lower.contains(term.toLowerCase())) return true;
            }
        }
        return false;
    }
}
