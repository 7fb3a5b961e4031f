package com.fermata.common.atmosphere;

import java.util.Locale;

public enum SeasonPhase {
    EARLY,
    PEAK,
    LATE;

    /**
     * Maps a phase name or a descriptive phase word to a phase. Unrecognised words fall back to
     * {@link #PEAK}; {@code null} stays {@code null}.
     */
    public static SeasonPhase fromWord(String word) {
        if (word == null || word.isBlank()) return null;
        return switch (word.trim().toLowerCase(Locale.ROOT)) {
            case "early", "awakening", "beginning" -> EARLY;
            case "late", "reflection", "introspection", "end" -> LATE;
            default -> PEAK;
        };
    }
}
