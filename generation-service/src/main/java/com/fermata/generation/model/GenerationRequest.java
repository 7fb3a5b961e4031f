package com.fermata.generation.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Inbound body of {@code POST /api/v1/names}. Field names travel as snake_case on the wire.
 *
 * <p>{@code wordCount} accepts an integer or {@code "4+"}; {@code secondaryGenre} switches the
 * request to genre fusion, and only then are the fusion fields read.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GenerationRequest {

    private String type;

    private String genre;

    private String secondaryGenre;

    private String mood;

    private String wordCount;

    private Integer count;

    private List<String> moodModifiers;

    private List<String> avoidCategories;

    // ── Atmosphere ──
    private String atmosphere;

    private String timeOfDay;

    private String seasonalMood;

    private String weather;

    private String culture;

    // ── Fusion only ──
    private String intensity;

    private Double creativityLevel;

    private Boolean preserveAuthenticity;

    private Boolean culturalSensitivity;
}
