package com.fermata.common.atmosphere;

import java.util.List;
import java.util.Locale;

/**
 * Time-of-day contributor. Only energy and mystery are nudged by the clock.
 */
public enum TimeOfDay {
    DAWN(40, 60, List.of("peaceful", "hopeful", "awakening")),
    MORNING(75, 20, List.of("energetic", "optimistic", "active")),
    AFTERNOON(65, 25, List.of("balanced", "steady", "focused")),
    EVENING(55, 45, List.of("relaxing", "reflective", "social")),
    NIGHT(35, 80, List.of("mysterious", "intimate", "contemplative")),
    MIDNIGHT(25, 95, List.of("dark", "profound", "solitary"));

    private final double energyLevel;
    private final double mysteryLevel;
    private final List<String> primaryMoods;

    TimeOfDay(double energyLevel, double mysteryLevel, List<String> primaryMoods) {
        this.energyLevel = energyLevel;
        this.mysteryLevel = mysteryLevel;
        this.primaryMoods = primaryMoods;
    }

    public double energyLevel() {
        return energyLevel;
    }

    public double mysteryLevel() {
        return mysteryLevel;
    }

    public List<String> primaryMoods() {
        return primaryMoods;
    }

    public static TimeOfDay fromId(String id) {
        if (id == null || id.isBlank()) return null;
        try {
            return valueOf(id.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
