package com.fermata.common.genre;

import java.util.List;

/**
 * Fusion potential of an ordered genre pair. The matrix stores each pair under both orders;
 * {@link #reversed()} swaps the genres and the recommended ratio.
 *
 * @param score           compatibility in [0, 1]
 * @param synergies       what works well together
 * @param challenges      what needs care
 * @param primaryWeight   recommended share of the primary genre
 * @param secondaryWeight recommended share of the secondary genre
 * @param bestAspects     which aspects to emphasise
 */
public record CompatibilityEntry(
    String primary,
    String secondary,
    double score,
    FusionStyle fusionStyle,
    List<String> synergies,
    List<String> challenges,
    double primaryWeight,
    double secondaryWeight,
    List<String> bestAspects
) {

    public CompatibilityEntry {
        synergies = List.copyOf(synergies);
        challenges = List.copyOf(challenges);
        bestAspects = List.copyOf(bestAspects);
    }

    public CompatibilityEntry reversed() {
        return new CompatibilityEntry(secondary, primary, score, fusionStyle, synergies, challenges,
            secondaryWeight, primaryWeight, bestAspects);
    }

    /** Genre with the larger recommended share; the primary on ties. */
    public String dominantGenre() {
        return secondaryWeight > primaryWeight ? secondary : primary;
    }
}
