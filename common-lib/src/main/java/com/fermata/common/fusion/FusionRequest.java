package com.fermata.common.fusion;

import com.fermata.common.genre.VocabularyStrategy;

import java.util.Locale;

/**
 * Parameters of one fusion call.
 *
 * @param mood                  optional mood steering template selection, or {@code null}
 * @param creativityLevel       0–1; higher values favour synthesis and reward hybrid terms
 * @param vocabularyStrategy    forced strategy, or {@code null} to choose from compatibility
 * @param preserveAuthenticity  reject candidates whose authenticity falls below 0.5
 * @param culturalSensitivity   drop candidates that lean on overused synthetic affixes
 */
public record FusionRequest(
    String primaryGenre,
    String secondaryGenre,
    String mood,
    int wordCount,
    int count,
    FusionIntensity intensity,
    double creativityLevel,
    VocabularyStrategy vocabularyStrategy,
    boolean preserveAuthenticity,
    boolean culturalSensitivity
) {

    public static final int DEFAULT_WORD_COUNT = 2;
    public static final int DEFAULT_COUNT = 3;
    public static final double DEFAULT_CREATIVITY = 0.5;

    public FusionRequest {
        if (primaryGenre == null || primaryGenre.isBlank() || secondaryGenre == null || secondaryGenre.isBlank()) {
            throw new IllegalArgumentException("fusion needs two genres");
        }
        if (wordCount < 1) throw new IllegalArgumentException("wordCount must be >= 1, got " + wordCount);
        if (count < 1) throw new IllegalArgumentException("count must be >= 1, got " + count);
        if (creativityLevel < 0.0 || creativityLevel > 1.0) {
            throw new IllegalArgumentException("creativityLevel must be within [0, 1]: " + creativityLevel);
        }
        primaryGenre = primaryGenre.trim().toLowerCase(Locale.ROOT);
        secondaryGenre = secondaryGenre.trim().toLowerCase(Locale.ROOT);
        mood = mood == null || mood.isBlank() ? null : mood.trim().toLowerCase(Locale.ROOT);
        if (intensity == null) intensity = FusionIntensity.MODERATE;
    }

    public static FusionRequest of(String primaryGenre, String secondaryGenre, int wordCount, int count) {
        return new FusionRequest(primaryGenre, secondaryGenre, null, wordCount, count,
            FusionIntensity.MODERATE, DEFAULT_CREATIVITY, null, true, false);
    }

    public FusionRequest withIntensity(FusionIntensity newIntensity) {
        return new FusionRequest(primaryGenre, secondaryGenre, mood, wordCount, count, newIntensity,
            creativityLevel, vocabularyStrategy, preserveAuthenticity, culturalSensitivity);
    }

    public FusionRequest withCreativity(double newCreativity) {
        return new FusionRequest(primaryGenre, secondaryGenre, mood, wordCount, count, intensity,
            newCreativity, vocabularyStrategy, preserveAuthenticity, culturalSensitivity);
    }

    public FusionRequest withMood(String newMood) {
        return new FusionRequest(primaryGenre, secondaryGenre, newMood, wordCount, count, intensity,
            creativityLevel, vocabularyStrategy, preserveAuthenticity, culturalSensitivity);
    }

    public FusionRequest reversed() {
        return new FusionRequest(secondaryGenre, primaryGenre, mood, wordCount, count, intensity,
            creativityLevel, vocabularyStrategy, preserveAuthenticity, culturalSensitivity);
    }
}
