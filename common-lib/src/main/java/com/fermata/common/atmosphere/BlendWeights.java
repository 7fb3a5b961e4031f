package com.fermata.common.atmosphere;

/**
 * Weight of each atmospheric contributor in the weighted-average blend, each in [0, 1].
 * A weight of 0 leaves the vector untouched; 1 replaces the blended axes outright.
 */
public record BlendWeights(double timeOfDay, double season, double weather, double culture) {

    public static final double DEFAULT_WEIGHT = 0.5;

    private static final BlendWeights DEFAULTS =
        new BlendWeights(DEFAULT_WEIGHT, DEFAULT_WEIGHT, DEFAULT_WEIGHT, DEFAULT_WEIGHT);

    public BlendWeights {
        check("timeOfDay", timeOfDay);
        check("season", season);
        check("weather", weather);
        check("culture", culture);
    }

    public static BlendWeights defaults() {
        return DEFAULTS;
    }

    public static BlendWeights uniform(double weight) {
        return new BlendWeights(weight, weight, weight, weight);
    }

    public BlendWeights withTimeOfDay(double weight) {
        return new BlendWeights(weight, season, weather, culture);
    }

    public BlendWeights withSeason(double weight) {
        return new BlendWeights(timeOfDay, weight, weather, culture);
    }

    public BlendWeights withWeather(double weight) {
        return new BlendWeights(timeOfDay, season, weight, culture);
    }

    public BlendWeights withCulture(double weight) {
        return new BlendWeights(timeOfDay, season, weather, weight);
    }

    private static void check(String contributor, double weight) {
        if (Double.isNaN(weight) || weight < 0.0 || weight > 1.0) {
            throw new IllegalArgumentException(contributor + " blend weight must be within [0, 1]: " + weight);
        }
    }
}
