package com.fermata.common.atmosphere;

import com.fermata.common.mood.EmotionalVector;

import java.util.List;
import java.util.Locale;

public enum Weather {
    SUNNY(new EmotionalVector(80, 90, 40, 60, 10, 20), List.of("uplifting", "energetic", "optimistic")),
    CLOUDY(new EmotionalVector(45, 50, 60, 40, 55, 60), List.of("contemplative", "subdued", "introspective")),
    RAINY(new EmotionalVector(35, 40, 70, 55, 60, 65), List.of("melancholic", "peaceful", "nostalgic")),
    STORMY(new EmotionalVector(90, 35, 80, 95, 75, 70), List.of("dramatic", "intense", "powerful")),
    FOGGY(new EmotionalVector(30, 45, 85, 50, 70, 95), List.of("mysterious", "ethereal", "uncertain")),
    SNOWY(new EmotionalVector(25, 65, 55, 40, 30, 50), List.of("peaceful", "pure", "crystalline"));

    private final EmotionalVector dimensions;
    private final List<String> moods;

    Weather(EmotionalVector dimensions, List<String> moods) {
        this.dimensions = dimensions;
        this.moods = moods;
    }

    public EmotionalVector dimensions() {
        return dimensions;
    }

    public List<String> moods() {
        return moods;
    }

    public static Weather fromId(String id) {
        if (id == null || id.isBlank()) return null;
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
