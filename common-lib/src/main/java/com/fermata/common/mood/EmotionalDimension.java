package com.fermata.common.mood;

public enum EmotionalDimension {
    ENERGY,
    VALENCE,
    COMPLEXITY,
    INTENSITY,
    DARKNESS,
    MYSTERY
}
