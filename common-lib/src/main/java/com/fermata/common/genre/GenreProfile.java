package com.fermata.common.genre;

import java.util.List;
import java.util.Set;

/**
 * Musical characteristics of a genre. Scalar traits are on a 0–1 scale.
 */
public record GenreProfile(
    String genre,
    double energy,
    double complexity,
    double traditionalism,
    Instrumentation instrumentation,
    Rhythm rhythm,
    double improvisation,
    double commerciality,
    Set<EmotionalColor> emotionalRange,
    List<String> culturalRoots,
    List<String> keyElements
) {

    public enum Instrumentation { ACOUSTIC, ELECTRIC, ELECTRONIC, MIXED }

    public enum EmotionalColor { DARK, BRIGHT, NEUTRAL, VARIED }

    public enum Rhythm {
        STEADY, SYNCOPATED, COMPLEX, VARIABLE;

        private static final double[][] FIT = {
            //            steady syncop complex variable
            /* steady */ {1.0,   0.7,   0.6,    0.8},
            /* syncop */ {0.7,   1.0,   0.8,    0.9},
            /* complex*/ {0.6,   0.8,   1.0,    0.7},
            /* variab */ {0.8,   0.9,   0.7,    1.0}
        };

        public double compatibilityWith(Rhythm other) {
            return FIT[ordinal()][other.ordinal()];
        }
    }

    public GenreProfile {
        emotionalRange = Set.copyOf(emotionalRange);
        culturalRoots = List.copyOf(culturalRoots);
        keyElements = List.copyOf(keyElements);
    }
}
