package com.fermata.common.wordsource;

import java.util.Locale;

/**
 * Categories a {@link WordSource} is organised by.
 *
 * <p>Raw input maps are keyed by the category's {@link #key()}. Lookup through
 * {@link #fromKey(String)} is lenient about case and separators, so {@code "musicalTerms"},
 * {@code "musical_terms"} and {@code "MUSICAL-TERMS"} all resolve to {@link #MUSICAL_TERMS}.
 */
public enum WordCategory {
    ADJECTIVES("adjectives"),
    NOUNS("nouns"),
    VERBS("verbs"),
    MUSICAL_TERMS("musicalTerms"),
    GENRE_TERMS("genreTerms"),
    CONTEXTUAL_WORDS("contextualWords"),
    ASSOCIATED_WORDS("associatedWords");

    private final String key;

    WordCategory(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * Resolves a raw map key to a category.
     *
     * @return the matching category, or {@code null} when the key names none
     */
    public static WordCategory fromKey(String rawKey) {
        if (rawKey == null) return null;
        String folded = rawKey.replace("_", "").replace("-", "").toLowerCase(Locale.ROOT);
        for (WordCategory category : values()) {
            if (category.key.toLowerCase(Locale.ROOT).equals(folded)) {
                return category;
            }
        }
        return null;
    }
}
