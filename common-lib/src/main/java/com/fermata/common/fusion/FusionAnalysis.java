package com.fermata.common.fusion;

/**
 * Pair-level fusion outlook, computed once per call from the two genre profiles.
 *
 * @param vocabularyPotential   how much the two vocabularies have to offer each other
 * @param culturalSynergy       shared roots and emotional colours
 * @param innovationOpportunity room for novel constructs
 * @param marketViability       broad-audience appeal of the pair
 * @param artisticMerit         0.4 compatibility + 0.3 vocabulary potential + 0.3 cultural synergy
 */
public record FusionAnalysis(
    double vocabularyPotential,
    double culturalSynergy,
    double innovationOpportunity,
    double marketViability,
    double artisticMerit
) {
}
