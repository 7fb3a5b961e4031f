package com.fermata.common.mood;

import java.util.EnumMap;
import java.util.Map;

/**
 * Six-axis emotional position, each axis on a 0–100 scale.
 *
 * <p>The canonical constructor clamps every component into range, so no operation on this type
 * can produce an out-of-range vector.
 */
public record EmotionalVector(
    double energy,
    double valence,
    double complexity,
    double intensity,
    double darkness,
    double mystery
) {

    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    /** 50 on every axis; used for unknown moods. */
    public static final EmotionalVector NEUTRAL = new EmotionalVector(50, 50, 50, 50, 50, 50);

    public EmotionalVector {
        energy     = clamp(energy);
        valence    = clamp(valence);
        complexity = clamp(complexity);
        intensity  = clamp(intensity);
        darkness   = clamp(darkness);
        mystery    = clamp(mystery);
    }

    public double get(EmotionalDimension dimension) {
        return switch (dimension) {
            case ENERGY     -> energy;
            case VALENCE    -> valence;
            case COMPLEXITY -> complexity;
            case INTENSITY  -> intensity;
            case DARKNESS   -> darkness;
            case MYSTERY    -> mystery;
        };
    }

    public EmotionalVector with(EmotionalDimension dimension, double value) {
        return switch (dimension) {
            case ENERGY     -> new EmotionalVector(value, valence, complexity, intensity, darkness, mystery);
            case VALENCE    -> new EmotionalVector(energy, value, complexity, intensity, darkness, mystery);
            case COMPLEXITY -> new EmotionalVector(energy, valence, value, intensity, darkness, mystery);
            case INTENSITY  -> new EmotionalVector(energy, valence, complexity, value, darkness, mystery);
            case DARKNESS   -> new EmotionalVector(energy, valence, complexity, intensity, value, mystery);
            case MYSTERY    -> new EmotionalVector(energy, valence, complexity, intensity, darkness, value);
        };
    }

    /** Adds {@code delta} to one axis (clamped). */
    public EmotionalVector shift(EmotionalDimension dimension, double delta) {
        return with(dimension, get(dimension) + delta);
    }

    /**
     * Weighted average toward {@code other}: {@code this × (1 − weight) + other × weight}.
     *
     * @param weight contribution of {@code other}, clamped to [0, 1]
     */
    public EmotionalVector blend(EmotionalVector other, double weight) {
        double w = Math.max(0.0, Math.min(1.0, weight));
        return new EmotionalVector(
            energy * (1 - w) + other.energy * w,
            valence * (1 - w) + other.valence * w,
            complexity * (1 - w) + other.complexity * w,
            intensity * (1 - w) + other.intensity * w,
            darkness * (1 - w) + other.darkness * w,
            mystery * (1 - w) + other.mystery * w);
    }

    /** Blends only the listed axes; the others keep this vector's values. */
    public EmotionalVector blendAxes(EmotionalVector other, double weight, EmotionalDimension... axes) {
        double w = Math.max(0.0, Math.min(1.0, weight));
        EmotionalVector result = this;
        for (EmotionalDimension axis : axes) {
            result = result.with(axis, get(axis) * (1 - w) + other.get(axis) * w);
        }
        return result;
    }

    /** Mean per-axis similarity, {@code 1 − |Δ|/100} averaged over the six axes. */
    public double similarity(EmotionalVector other) {
        double sum = 0;
        for (EmotionalDimension dimension : EmotionalDimension.values()) {
            sum += axisSimilarity(get(dimension), other.get(dimension));
        }
        return sum / EmotionalDimension.values().length;
    }

    public Map<EmotionalDimension, Double> asMap() {
        Map<EmotionalDimension, Double> map = new EnumMap<>(EmotionalDimension.class);
        for (EmotionalDimension dimension : EmotionalDimension.values()) {
            map.put(dimension, get(dimension));
        }
        return map;
    }

    public static double axisSimilarity(double a, double b) {
        return Math.max(0.0, 1.0 - Math.abs(a - b) / 100.0);
    }

    private static double clamp(double value) {
        if (Double.isNaN(value)) return 50.0;
        return Math.max(MIN, Math.min(MAX, value));
    }
}
