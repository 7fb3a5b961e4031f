package com.fermata.generation.service;

import com.fermata.common.atmosphere.AtmosphericContext;
import com.fermata.common.fusion.FusionIntensity;
import com.fermata.common.fusion.FusionRequest;
import com.fermata.common.mood.MoodModifier;
import com.fermata.common.selection.SelectionCriteria;
import com.fermata.common.template.NameType;

import java.util.List;
import java.util.Random;
import java.util.Set;

/** A validated, normalised request plus the random source that serves it. */
record GenerationPlan(
    NameType type,
    String genre,
    String secondaryGenre,
    String mood,
    int wordCount,
    int count,
    List<MoodModifier> modifiers,
    Set<String> avoidCategories,
    AtmosphericContext atmosphere,
    FusionIntensity intensity,
    double creativityLevel,
    boolean preserveAuthenticity,
    boolean culturalSensitivity,
    Random random
) {

    boolean isFusion() {
        return genre != null && secondaryGenre != null;
    }

    SelectionCriteria criteria() {
        return SelectionCriteria.of(wordCount, genre, mood)
            .withType(type)
            .withModifiers(modifiers)
            .withAtmosphere(atmosphere)
            .withAvoidCategories(avoidCategories);
    }

    FusionRequest fusionRequest() {
        return new FusionRequest(genre, secondaryGenre, mood, wordCount, count, intensity,
            creativityLevel, null, preserveAuthenticity, culturalSensitivity);
    }

    String describe() {
        return "type=" + type + " genre=" + genre + " secondaryGenre=" + secondaryGenre
            + " mood=" + mood + " wordCount=" + wordCount + " count=" + count;
    }
}
