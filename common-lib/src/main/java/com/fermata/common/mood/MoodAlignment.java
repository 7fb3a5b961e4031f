package com.fermata.common.mood;

import java.util.Map;

/**
 * How well one template fits one mood.
 *
 * @param score           overall fit in [0, 1]
 * @param confidence      how decisive the score is, in [0, 1]
 * @param dimensionScores per-axis similarity between template and mood
 * @param factors         the four reasoning factors behind the score
 */
public record MoodAlignment(
    double score,
    double confidence,
    Map<EmotionalDimension, Double> dimensionScores,
    ReasoningFactors factors
) {

    public MoodAlignment {
        dimensionScores = Map.copyOf(dimensionScores);
    }

    /** Result for a mood the library does not know: neutral score, zero confidence. */
    public static MoodAlignment unknown() {
        return new MoodAlignment(0.5, 0.0, Map.of(), new ReasoningFactors(0.5, 0.5, 0.5, 0.5));
    }

    public boolean isConfident(double threshold) {
        return confidence >= threshold;
    }

    public record ReasoningFactors(double structural, double vocabulary, double cultural, double semantic) {

        public static final double STRUCTURAL_WEIGHT = 0.30;
        public static final double VOCABULARY_WEIGHT = 0.25;
        public static final double CULTURAL_WEIGHT   = 0.20;
        public static final double SEMANTIC_WEIGHT   = 0.25;

        public double weighted() {
            return structural * STRUCTURAL_WEIGHT
                + vocabulary * VOCABULARY_WEIGHT
                + cultural * CULTURAL_WEIGHT
                + semantic * SEMANTIC_WEIGHT;
        }

        /** {@code 1 − stddev} of the four factors; agreeing factors give high values. */
        public double agreement() {
            double mean = (structural + vocabulary + cultural + semantic) / 4.0;
            double variance = (sq(structural - mean) + sq(vocabulary - mean)
                + sq(cultural - mean) + sq(semantic - mean)) / 4.0;
            return 1.0 - Math.sqrt(variance);
        }

        private static double sq(double v) {
            return v * v;
        }
    }
}
