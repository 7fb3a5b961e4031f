package com.fermata.common.fusion;

import com.fermata.common.genre.CompatibilityEntry;
import com.fermata.common.genre.FusedVocabulary;
import com.fermata.common.genre.FusionStyle;
import com.fermata.common.genre.GenreProfile;
import com.fermata.common.template.PhraseText;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Heuristic scores for fused names and genre pairs.
 *
 * <h3>Quality</h3>
 * <ol>
 *   <li>base 0.5</li>
 *   <li>+0.1 when the name has exactly the requested word count</li>
 *   <li>+0.2 × compatibility, +0.15 × artistic merit, +0.1 × innovation opportunity</li>
 *   <li>−{@value #REPEAT_PENALTY} when the engine has produced the name before</li>
 * </ol>
 *
 * <h3>Authenticity</h3>
 * Starts at {@value #AUTHENTICITY_BASE}; each overused synthetic affix present costs 0.1, any
 * recognised musical term adds 0.1.
 */
public final class FusionQualityScorer {

    private FusionQualityScorer() {}

    public static final double AUTHENTICITY_BASE = 0.7;
    public static final double REPEAT_PENALTY = 0.1;

    public static final List<String> SYNTHETIC_AFFIXES = List.of("cyber", "neo", "meta", "hyper", "ultra", "proto", "techno");
    public static final List<String> MUSICAL_TERMS = List.of(
        "harmony", "harmonic", "rhythm", "melody", "melodic", "beat", "chord", "scale", "groove",
        "tempo", "symphon", "sonata", "ballad", "swing", "bebop", "blues", "riff", "jazz", "folk");

    private static final Set<String> POPULAR_GENRES = Set.of("pop", "rock", "electronic", "hip-hop", "indie");

    // ── pair analysis ────────────────────────────────────────────────────────

    public static FusionAnalysis analyze(CompatibilityEntry entry, GenreProfile first, GenreProfile second,
                                         double creativityLevel) {
        double vocabulary = vocabularyPotential(first, second);
        double synergy = culturalSynergy(first, second);
        double innovation = innovationOpportunity(entry, creativityLevel);
        double market = marketViability(entry);
        double merit = entry.score() * 0.4 + vocabulary * 0.3 + synergy * 0.3;
        return new FusionAnalysis(vocabulary, synergy, innovation, market, merit);
    }

    static double vocabularyPotential(GenreProfile a, GenreProfile b) {
        if (a == null || b == null) return 0.5;
        double potential = 0.5;
        long sharedRoots = a.culturalRoots().stream().filter(b.culturalRoots()::contains).count();
        potential += sharedRoots * 0.1;
        if (a.instrumentation() != b.instrumentation()) potential += 0.15;
        double complexityGap = Math.abs(a.complexity() - b.complexity());
        if (complexityGap > 0.3 && complexityGap < 0.7) potential += 0.1;
        return Math.min(potential, 1.0);
    }

    static double culturalSynergy(GenreProfile a, GenreProfile b) {
        if (a == null || b == null) return 0.5;
        double synergy = 0.6;
        long sharedRoots = a.culturalRoots().stream().filter(b.culturalRoots()::contains).count();
        synergy += sharedRoots * 0.1;
        long sharedColors = a.emotionalRange().stream().filter(b.emotionalRange()::contains).count();
        synergy += sharedColors * 0.05;
        return Math.min(synergy, 1.0);
    }

    static double innovationOpportunity(CompatibilityEntry entry, double creativityLevel) {
        double innovation = entry.score() * 0.5 + creativityLevel * 0.3;
        if (entry.fusionStyle() == FusionStyle.CONTRAST) innovation += 0.15;
        else if (entry.fusionStyle() == FusionStyle.HYBRID) innovation += 0.1;
        return Math.min(innovation, 1.0);
    }

    static double marketViability(CompatibilityEntry entry) {
        double viability = 0.5;
        if (POPULAR_GENRES.contains(entry.primary())) viability += 0.1;
        if (POPULAR_GENRES.contains(entry.secondary())) viability += 0.1;
        return Math.min(viability, 1.0);
    }

    // ── per-name scores ──────────────────────────────────────────────────────

    public static double quality(String name, int targetWordCount, CompatibilityEntry entry,
                                 FusionAnalysis analysis, boolean seenBefore) {
        double quality = 0.5;
        if (PhraseText.wordCount(name) == targetWordCount) quality += 0.1;
        quality += entry.score() * 0.2;
        quality += analysis.artisticMerit() * 0.15;
        quality += analysis.innovationOpportunity() * 0.1;
        if (seenBefore) quality -= REPEAT_PENALTY;
        return clamp(quality);
    }

    /** Rewards hybrid terms (+0.1 each) and conceptual blends (+0.15 each) used in the name. */
    public static double innovation(String name, FusedVocabulary vocabulary, double creativityLevel) {
        String lower = name.toLowerCase(Locale.ROOT);
        double innovation = 0.5;
        innovation += vocabulary.hybridTerms().stream()
            .filter(t -> !t.isBlank() && lower.contains(t.toLowerCase(Locale.ROOT))).count() * 0.1;
        innovation += vocabulary.conceptualBlends().stream()
            .filter(t -> !t.isBlank() && lower.contains(t.toLowerCase(Locale.ROOT))).count() * 0.15;
        if (creativityLevel >= 0.9) innovation += 0.2;
        else if (creativityLevel >= 0.7) innovation += 0.1;
        return clamp(innovation);
    }

    public static double authenticity(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        double authenticity = AUTHENTICITY_BASE;
        authenticity -= SYNTHETIC_AFFIXES.stream().filter(lower::contains).count() * 0.1;
        if (MUSICAL_TERMS.stream().anyMatch(lower::contains)) authenticity += 0.1;
        return clamp(authenticity);
    }

    /** Whether the name leans on any overused synthetic affix. */
    public static boolean usesSyntheticAffix(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        return SYNTHETIC_AFFIXES.stream().anyMatch(lower::contains);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
