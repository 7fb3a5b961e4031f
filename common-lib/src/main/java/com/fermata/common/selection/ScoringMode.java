package com.fermata.common.selection;

public enum ScoringMode {
    /** Context match, quality, freshness and prior weight. */
    TRADITIONAL,
    /** Mood alignment and atmospheric coherence take over part of the context weight. */
    MOOD_DRIVEN
}
