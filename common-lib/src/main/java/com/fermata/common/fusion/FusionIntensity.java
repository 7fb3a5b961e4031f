package com.fermata.common.fusion;

import com.fermata.common.genre.FusionStyle;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * How far a fusion may stray from either source genre. Each level fixes the ordered list of
 * methods the engine tries.
 */
public enum FusionIntensity {
    SUBTLE(List.of(FusionMethod.GENTLE_INFUSION, FusionMethod.ACCENT_INTEGRATION, FusionMethod.THEMATIC_SUGGESTION)),
    MODERATE(List.of(FusionMethod.PATTERN_BLENDING, FusionMethod.VOCABULARY_ALTERNATION, FusionMethod.STRUCTURAL_LAYERING)),
    BOLD(List.of(FusionMethod.PATTERN_INTERWEAVING, FusionMethod.VOCABULARY_FUSION, FusionMethod.HYBRID_CONSTRUCTION)),
    EXPERIMENTAL(List.of(FusionMethod.PATTERN_SYNTHESIS, FusionMethod.VOCABULARY_MUTATION, FusionMethod.CONCEPTUAL_BRIDGING));

    private final List<FusionMethod> methods;

    FusionIntensity(List<FusionMethod> methods) {
        this.methods = methods;
    }

    public List<FusionMethod> methods() {
        return methods;
    }

    /**
     * Methods to try for a pair of the given style: complement pairs lead with complementary
     * fusion, contrast pairs with contrasting fusion, and {@link FusionMethod#DEFAULT} always
     * closes the list.
     */
    public List<FusionMethod> methodsFor(FusionStyle style) {
        List<FusionMethod> ordered = new ArrayList<>();
        if (style == FusionStyle.COMPLEMENT) ordered.add(FusionMethod.COMPLEMENTARY_FUSION);
        else if (style == FusionStyle.CONTRAST) ordered.add(FusionMethod.CONTRASTING_FUSION);
        ordered.addAll(methods);
        ordered.add(FusionMethod.DEFAULT);
        return ordered;
    }

    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Lenient parse; {@code null} or unknown values give {@link #MODERATE}. */
    public static FusionIntensity fromId(String id) {
        if (id == null) return MODERATE;
        for (FusionIntensity intensity : values()) {
            if (intensity.id().equals(id.trim().toLowerCase(Locale.ROOT))) return intensity;
        }
        return MODERATE;
    }
}
