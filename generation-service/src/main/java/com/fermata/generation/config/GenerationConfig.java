package com.fermata.generation.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.fermata.common.atmosphere.BlendWeights;
import com.fermata.common.fusion.FusionEngine;
import com.fermata.common.genre.GenreCompatibilityMatrix;
import com.fermata.common.genre.VocabularyFusion;
import com.fermata.common.guard.GuardSettings;
import com.fermata.common.guard.RepetitionGuard;
import com.fermata.common.memory.GlobalNameMemory;
import com.fermata.common.selection.SelectionEngine;
import com.fermata.common.template.TemplateLibrary;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.Random;
import java.util.function.Supplier;

/**
 * Wires the generative core. Core classes never read configuration; every tunable is
 * resolved here and passed in through constructors.
 */
@Configuration
public class GenerationConfig {

    @Value("${fermata.generation.fusion-attempt-multiplier:3}")
    private int fusionAttemptMultiplier;

    @Value("${fermata.generation.mood-confidence-threshold:0.35}")
    private double moodConfidenceThreshold;

    @Value("${fermata.guard.recent-word-capacity:30}")
    private int recentWordCapacity;

    @Value("${fermata.guard.recent-template-capacity:20}")
    private int recentTemplateCapacity;

    @Value("${fermata.guard.shared-word-fraction:0.5}")
    private double sharedWordFraction;

    @Value("${fermata.guard.decay-interval:5m}")
    private Duration decayInterval;

    @Value("${fermata.memory.max-entries:500}")
    private int memoryMaxEntries;

    @Value("${fermata.atmosphere.weights.time-of-day:0.5}")
    private double timeOfDayWeight;

    @Value("${fermata.atmosphere.weights.season:0.5}")
    private double seasonWeight;

    @Value("${fermata.atmosphere.weights.weather:0.5}")
    private double weatherWeight;

    @Value("${fermata.atmosphere.weights.culture:0.5}")
    private double cultureWeight;

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /** Fresh unseeded generator per request; tests replace this bean with a seeded one. */
    @Bean
    public Supplier<Random> randomSource() {
        return Random::new;
    }

    @Bean
    public TemplateLibrary templateLibrary() {
        return TemplateLibrary.standard();
    }

    @Bean
    public SelectionEngine selectionEngine(TemplateLibrary templateLibrary) {
        return new SelectionEngine(templateLibrary, moodConfidenceThreshold);
    }

    @Bean
    public FusionEngine fusionEngine(SelectionEngine selectionEngine) {
        return new FusionEngine(GenreCompatibilityMatrix.standard(), VocabularyFusion.standard(),
            selectionEngine, fusionAttemptMultiplier);
    }

    @Bean
    public RepetitionGuard repetitionGuard(Clock clock) {
        GuardSettings settings = new GuardSettings(recentWordCapacity, recentTemplateCapacity,
            sharedWordFraction, decayInterval, GuardSettings.defaults().categoryThreshold(),
            GuardSettings.defaults().subcategoryThreshold());
        return new RepetitionGuard(settings, clock);
    }

    @Bean
    public GlobalNameMemory globalNameMemory(Clock clock) {
        return new GlobalNameMemory(memoryMaxEntries, clock);
    }

    @Bean
    public BlendWeights atmosphereBlendWeights() {
        return new BlendWeights(timeOfDayWeight, seasonWeight, weatherWeight, cultureWeight);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
