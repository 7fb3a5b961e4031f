package com.fermata.common.genre;

import java.util.List;

/**
 * Curated vocabulary blending for a genre pair.
 *
 * <p>{@code fusionPatterns} use placeholders resolved against the rule's own genre order:
 * {@code {genre1_term}}, {@code {genre2_concept}}, {@code {genre1_technique}},
 * {@code {genre2_instrument}}, {@code {hybrid_prefix}}, {@code {hybrid_suffix}}, {@code {bridge}}.
 */
public record BlendRule(
    String name,
    String firstGenre,
    String secondGenre,
    VocabularyStrategy strategy,
    double firstWeight,
    double secondWeight,
    List<String> conceptualBridges,
    List<String> hybridPrefixes,
    List<String> hybridSuffixes,
    List<String> fusionPatterns,
    List<String> examples
) {

    public BlendRule {
        conceptualBridges = List.copyOf(conceptualBridges);
        hybridPrefixes = List.copyOf(hybridPrefixes);
        hybridSuffixes = List.copyOf(hybridSuffixes);
        fusionPatterns = List.copyOf(fusionPatterns);
        examples = List.copyOf(examples);
    }

    public boolean covers(String a, String b) {
        return (firstGenre.equals(a) && secondGenre.equals(b)) || (firstGenre.equals(b) && secondGenre.equals(a));
    }
}
