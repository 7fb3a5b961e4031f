package com.fermata.common.genre;

import java.util.Locale;

/** How two genre vocabularies are combined. */
public enum VocabularyStrategy {
    MERGE,
    ALTERNATE,
    DOMINANT,
    SYNTHESIZE,
    LAYER;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static VocabularyStrategy fromId(String id) {
        if (id == null || id.isBlank()) return null;
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
