package com.fermata.common.fusion;

import java.util.Locale;

/** Name-building methods the fusion engine can try, in the order an intensity lists them. */
public enum FusionMethod {
    PATTERN_SYNTHESIS,
    PATTERN_INTERWEAVING,
    PATTERN_BLENDING,
    VOCABULARY_FUSION,
    VOCABULARY_ALTERNATION,
    VOCABULARY_MUTATION,
    COMPLEMENTARY_FUSION,
    CONTRASTING_FUSION,
    HYBRID_CONSTRUCTION,
    CONCEPTUAL_BRIDGING,
    STRUCTURAL_LAYERING,
    GENTLE_INFUSION,
    ACCENT_INTEGRATION,
    THEMATIC_SUGGESTION,
    DEFAULT;

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }
}
