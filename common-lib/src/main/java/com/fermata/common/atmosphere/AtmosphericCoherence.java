package com.fermata.common.atmosphere;

import com.fermata.common.mood.EmotionalVector;
import com.fermata.common.mood.PatternMoodScorer;
import com.fermata.common.template.Template;

import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * How well a template sits inside an atmospheric context.
 *
 * <p>{@code coherence = 0.30 × alignment + 0.25 × culturalFit + 0.25 × temporalConsistency
 * + 0.20 × sensoryHarmony}. Every part starts from a neutral 0.5 when its contributor is absent.
 */
public final class AtmosphericCoherence {

    private AtmosphericCoherence() {}

    public static final double ALIGNMENT_WEIGHT = 0.30;
    public static final double CULTURAL_WEIGHT  = 0.25;
    public static final double TEMPORAL_WEIGHT  = 0.25;
    public static final double SENSORY_WEIGHT   = 0.20;

    private static final Map<TimeOfDay, Map<Season, Double>> TIME_SEASON_FIT = Map.of(
        TimeOfDay.DAWN,     Map.of(Season.SPRING, 0.9, Season.SUMMER, 0.6, Season.AUTUMN, 0.7, Season.WINTER, 0.5),
        TimeOfDay.NIGHT,    Map.of(Season.SPRING, 0.4, Season.SUMMER, 0.7, Season.AUTUMN, 0.8, Season.WINTER, 0.9),
        TimeOfDay.MIDNIGHT, Map.of(Season.SPRING, 0.3, Season.SUMMER, 0.5, Season.AUTUMN, 0.9, Season.WINTER, 1.0)
    );

    public record Score(double coherence, double alignment, double culturalFit,
                        double temporalConsistency, double sensoryHarmony) {

        static Score of(double alignment, double culturalFit, double temporal, double sensory) {
            double coherence = alignment * ALIGNMENT_WEIGHT + culturalFit * CULTURAL_WEIGHT
                + temporal * TEMPORAL_WEIGHT + sensory * SENSORY_WEIGHT;
            return new Score(coherence, alignment, culturalFit, temporal, sensory);
        }
    }

    public static Score evaluate(Template template, AtmosphericContext context) {
        if (context == null || context.isEmpty()) {
            return Score.of(0.5, 0.5, 0.5, 0.5);
        }
        Set<String> moods = AtmosphereBlender.atmosphericMoods(context);
        EmotionalVector environment = AtmosphereBlender.environment(context);
        return Score.of(
            alignment(template, moods, environment),
            culturalFit(template, context),
            temporalConsistency(template, context),
            sensoryHarmony(template, context));
    }

    static double alignment(Template template, Set<String> atmosphericMoods, EmotionalVector environment) {
        double alignment = 0;
        for (String mood : template.applicableMoods()) {
            if (atmosphericMoods.contains(mood)) alignment += 0.3;
        }
        double categoryFit = 0;
        Set<String> descriptors = PatternMoodScorer.categoryDescriptors(template.category());
        for (String mood : atmosphericMoods) {
            if (descriptors.stream().anyMatch(mood::contains)) categoryFit += 0.2;
        }
        alignment += Math.min(1.0, categoryFit) * 0.4;
        alignment += (1 - Math.abs(template.weight() - environment.intensity() / 100)) * 0.3;
        return clamp(alignment);
    }

    static double culturalFit(Template template, AtmosphericContext context) {
        CulturalRegister culture = context.culture();
        if (culture == null) return 0.5;
        double fit = 0.5;
        if (culture.communicationStyle() == CulturalRegister.CommunicationStyle.DIRECT && template.maxWordCount() <= 2) {
            fit += 0.2;
        }
        if (culture.communicationStyle() == CulturalRegister.CommunicationStyle.CONTEXTUAL
            && "conceptual".equals(template.category())) {
            fit += 0.2;
        }
        for (String mood : template.applicableMoods()) {
            if (culture.preferredMoods().contains(mood)) fit += 0.15;
        }
        return clamp(fit);
    }

    static double temporalConsistency(Template template, AtmosphericContext context) {
        double consistency = 0.5;
        TimeOfDay time = context.timeOfDay();
        if (time != null) {
            for (String mood : template.applicableMoods()) {
                if (time.primaryMoods().contains(mood)) consistency += 0.2;
            }
            if (context.season() != null) {
                double fit = TIME_SEASON_FIT.getOrDefault(time, Map.of()).getOrDefault(context.season(), 0.5);
                consistency += (fit - 0.5) * 0.3;
            }
        }
        return clamp(consistency);
    }

    /** Rewards templates whose examples touch the profile's semantic fields or the culture's metaphors. */
    static double sensoryHarmony(Template template, AtmosphericContext context) {
        String text = String.join(" ", template.examples()).toLowerCase(Locale.ROOT);
        double harmony = 0.5;
        if (context.profile() != null) {
            for (String field : context.profile().semanticFields()) {
                if (text.contains(field)) harmony += 0.1;
            }
        }
        if (context.culture() != null) {
            for (String metaphor : context.culture().metaphors()) {
                if (text.contains(metaphor)) harmony += 0.1;
            }
        }
        return clamp(harmony);
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
