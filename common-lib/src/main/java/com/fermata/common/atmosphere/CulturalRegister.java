package com.fermata.common.atmosphere;

import com.fermata.common.mood.EmotionalVector;

import java.util.List;
import java.util.Locale;

/**
 * Cultural contributor: an emotional tendency plus the moods and metaphors the culture favours.
 */
public enum CulturalRegister {
    MEDITERRANEAN(new EmotionalVector(70, 80, 60, 65, 20, 45), 80, CommunicationStyle.EXPRESSIVE,
        List.of("romantic", "passionate", "warm", "celebratory"),
        List.of("sun", "sea", "vine", "olive", "stone", "harbor")),
    NORDIC(new EmotionalVector(45, 55, 75, 40, 50, 70), 45, CommunicationStyle.UNDERSTATED,
        List.of("contemplative", "melancholic", "peaceful", "minimalist"),
        List.of("forest", "snow", "fjord", "aurora", "ice")),
    EASTERN(new EmotionalVector(50, 60, 85, 55, 40, 80), 55, CommunicationStyle.CONTEXTUAL,
        List.of("harmonious", "balanced", "wise", "flowing"),
        List.of("mountain", "river", "bamboo", "lotus", "dragon", "tea")),
    URBAN_MODERN(new EmotionalVector(80, 55, 90, 75, 45, 60), 70, CommunicationStyle.DIRECT,
        List.of("energetic", "complex", "diverse", "electric"),
        List.of("network", "pulse", "stream", "fusion", "node", "flow"));

    public enum CommunicationStyle { DIRECT, CONTEXTUAL, EXPRESSIVE, UNDERSTATED }

    private final EmotionalVector tendencies;
    private final int expressiveness;
    private final CommunicationStyle communicationStyle;
    private final List<String> preferredMoods;
    private final List<String> metaphors;

    CulturalRegister(EmotionalVector tendencies, int expressiveness, CommunicationStyle communicationStyle,
                     List<String> preferredMoods, List<String> metaphors) {
        this.tendencies = tendencies;
        this.expressiveness = expressiveness;
        this.communicationStyle = communicationStyle;
        this.preferredMoods = preferredMoods;
        this.metaphors = metaphors;
    }

    public EmotionalVector tendencies() {
        return tendencies;
    }

    /** Expressiveness on a 0–100 scale. */
    public int expressiveness() {
        return expressiveness;
    }

    public CommunicationStyle communicationStyle() {
        return communicationStyle;
    }

    public List<String> preferredMoods() {
        return preferredMoods;
    }

    public List<String> metaphors() {
        return metaphors;
    }

    /** Accepts {@code "urban_modern"}, {@code "urban-modern"} and {@code "urban"}. */
    public static CulturalRegister fromId(String id) {
        if (id == null || id.isBlank()) return null;
        String normalized = id.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        if (normalized.equals("URBAN")) return URBAN_MODERN;
        for (CulturalRegister register : values()) {
            if (register.name().equals(normalized)) return register;
        }
        return null;
    }
}
