package com.fermata.common.selection;

import com.fermata.common.atmosphere.AtmosphericContext;
import com.fermata.common.mood.MoodModifier;
import com.fermata.common.template.NameType;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * What a caller wants from one template selection.
 *
 * <p>{@code moodDriven} forces mood-aware scoring even without a mood; it is otherwise enabled
 * whenever a mood or a non-empty atmosphere is present. Scoring still falls back to the
 * traditional path when the mood model is not confident about the eligible templates.
 *
 * @param wordCount        exact output length
 * @param type             band or song
 * @param genre            lower-case genre, or {@code null}
 * @param mood             lower-case mood id (simple or complex), or {@code null}
 * @param atmosphere       atmospheric context, or {@code null}
 * @param modifiers        mood modifiers applied before atmospheric blending
 * @param intensity        requested intensity, or {@code null}
 * @param creativity       requested creativity, or {@code null}
 * @param avoidCategories  categories that are never eligible
 * @param preferCategories when non-empty, the only eligible categories
 * @param moodDriven       force mood-aware scoring
 */
public record SelectionCriteria(
    int wordCount,
    NameType type,
    String genre,
    String mood,
    AtmosphericContext atmosphere,
    List<MoodModifier> modifiers,
    Intensity intensity,
    Creativity creativity,
    Set<String> avoidCategories,
    Set<String> preferCategories,
    boolean moodDriven
) {

    public enum Intensity { LOW, MEDIUM, HIGH }

    public enum Creativity { CONSERVATIVE, BALANCED, EXPERIMENTAL }

    public SelectionCriteria {
        if (wordCount < 1) throw new IllegalArgumentException("wordCount must be >= 1, got " + wordCount);
        if (type == null) type = NameType.BAND;
        genre = lower(genre);
        mood = lower(mood);
        modifiers = modifiers == null ? List.of() : List.copyOf(modifiers);
        avoidCategories = avoidCategories == null ? Set.of() : Set.copyOf(avoidCategories);
        preferCategories = preferCategories == null ? Set.of() : Set.copyOf(preferCategories);
    }

    public static SelectionCriteria of(int wordCount, String genre, String mood) {
        return new SelectionCriteria(wordCount, NameType.BAND, genre, mood, null, List.of(),
            null, null, Set.of(), Set.of(), false);
    }

    public boolean hasAtmosphere() {
        return atmosphere != null && !atmosphere.isEmpty();
    }

    /** Whether mood-aware scoring should be attempted. */
    public boolean wantsMoodScoring() {
        return moodDriven || mood != null || hasAtmosphere();
    }

    // ── withers ──────────────────────────────────────────────────────────────

    public SelectionCriteria withWordCount(int newWordCount) {
        return new SelectionCriteria(newWordCount, type, genre, mood, atmosphere, modifiers,
            intensity, creativity, avoidCategories, preferCategories, moodDriven);
    }

    public SelectionCriteria withType(NameType newType) {
        return new SelectionCriteria(wordCount, newType, genre, mood, atmosphere, modifiers,
            intensity, creativity, avoidCategories, preferCategories, moodDriven);
    }

    public SelectionCriteria withGenre(String newGenre) {
        return new SelectionCriteria(wordCount, type, newGenre, mood, atmosphere, modifiers,
            intensity, creativity, avoidCategories, preferCategories, moodDriven);
    }

    public SelectionCriteria withMood(String newMood) {
        return new SelectionCriteria(wordCount, type, genre, newMood, atmosphere, modifiers,
            intensity, creativity, avoidCategories, preferCategories, moodDriven);
    }

    public SelectionCriteria withAtmosphere(AtmosphericContext newAtmosphere) {
        return new SelectionCriteria(wordCount, type, genre, mood, newAtmosphere, modifiers,
            intensity, creativity, avoidCategories, preferCategories, moodDriven);
    }

    public SelectionCriteria withModifiers(List<MoodModifier> newModifiers) {
        return new SelectionCriteria(wordCount, type, genre, mood, atmosphere, newModifiers,
            intensity, creativity, avoidCategories, preferCategories, moodDriven);
    }

    public SelectionCriteria withIntensity(Intensity newIntensity) {
        return new SelectionCriteria(wordCount, type, genre, mood, atmosphere, modifiers,
            newIntensity, creativity, avoidCategories, preferCategories, moodDriven);
    }

    public SelectionCriteria withCreativity(Creativity newCreativity) {
        return new SelectionCriteria(wordCount, type, genre, mood, atmosphere, modifiers,
            intensity, newCreativity, avoidCategories, preferCategories, moodDriven);
    }

    public SelectionCriteria withAvoidCategories(Set<String> categories) {
        return new SelectionCriteria(wordCount, type, genre, mood, atmosphere, modifiers,
            intensity, creativity, categories, preferCategories, moodDriven);
    }

    public SelectionCriteria withPreferCategories(Set<String> categories) {
        return new SelectionCriteria(wordCount, type, genre, mood, atmosphere, modifiers,
            intensity, creativity, avoidCategories, categories, moodDriven);
    }

    public SelectionCriteria withMoodDriven(boolean enabled) {
        return new SelectionCriteria(wordCount, type, genre, mood, atmosphere, modifiers,
            intensity, creativity, avoidCategories, preferCategories, enabled);
    }

    private static String lower(String value) {
        if (value == null || value.isBlank()) return null;
        return value.trim().toLowerCase(Locale.ROOT);
    }
}
