package com.fermata.common.atmosphere;

import com.fermata.common.mood.EmotionalDimension;
import com.fermata.common.mood.EmotionalVector;
import com.fermata.common.mood.MoodLibrary;
import com.fermata.common.mood.MoodModifier;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves a mood name plus atmospheric context into one emotional vector.
 *
 * <h3>Blend order</h3>
 * <ol>
 *   <li>Base mood vector ({@link MoodLibrary#resolve(String, Collection)}), modifiers applied.</li>
 *   <li>Time of day: weighted average on energy and mystery only.</li>
 *   <li>Season phase, then weather, then culture: weighted average on every axis.</li>
 * </ol>
 * Each step is {@code current × (1 − w) + contributor × w}, where {@code w} is that contributor's
 * entry in {@link AtmosphericContext#weights()}.
 */
public final class AtmosphereBlender {

    private AtmosphereBlender() {}

    /** Mood-score bonus when the atmosphere lists the mood as compatible. */
    public static final double COMPATIBLE_BONUS = 0.10;

    /** Mood-score penalty when the atmosphere lists the mood as conflicting. */
    public static final double CONFLICT_PENALTY = 0.15;

    public static EmotionalVector resolve(String moodId, AtmosphericContext context) {
        return resolve(moodId, List.of(), context);
    }

    public static EmotionalVector resolve(String moodId, Collection<MoodModifier> modifiers,
                                          AtmosphericContext context) {
        EmotionalVector base = MoodLibrary.resolve(moodId, modifiers);
        return context == null ? base : blendContext(base, context);
    }

    /** Applies the context's contributors to an arbitrary starting vector. */
    public static EmotionalVector blendContext(EmotionalVector base, AtmosphericContext context) {
        BlendWeights w = context.weights();
        EmotionalVector vector = base;
        if (context.timeOfDay() != null) {
            EmotionalVector clock = EmotionalVector.NEUTRAL
                .with(EmotionalDimension.ENERGY, context.timeOfDay().energyLevel())
                .with(EmotionalDimension.MYSTERY, context.timeOfDay().mysteryLevel());
            vector = vector.blendAxes(clock, w.timeOfDay(), EmotionalDimension.ENERGY, EmotionalDimension.MYSTERY);
        }
        if (context.season() != null) {
            vector = vector.blend(context.season().phase(context.phase()).dimensions(), w.season());
        }
        if (context.weather() != null) {
            vector = vector.blend(context.weather().dimensions(), w.weather());
        }
        if (context.culture() != null) {
            vector = vector.blend(context.culture().tendencies(), w.culture());
        }
        return vector;
    }

    /** The environment alone, blended from neutral. */
    public static EmotionalVector environment(AtmosphericContext context) {
        return context == null ? EmotionalVector.NEUTRAL : blendContext(EmotionalVector.NEUTRAL, context);
    }

    /** Moods suggested by every contributor present, without duplicates, in contributor order. */
    public static Set<String> atmosphericMoods(AtmosphericContext context) {
        Set<String> moods = new LinkedHashSet<>();
        if (context == null) return moods;
        if (context.profile() != null) moods.addAll(context.profile().compatibleMoods());
        if (context.timeOfDay() != null) moods.addAll(context.timeOfDay().primaryMoods());
        if (context.season() != null) moods.addAll(context.season().phase(context.phase()).moods());
        if (context.weather() != null) moods.addAll(context.weather().moods());
        if (context.culture() != null) moods.addAll(context.culture().preferredMoods());
        return moods;
    }

    /**
     * Score adjustment from the named profile: {@code +}{@link #COMPATIBLE_BONUS} when it lists
     * the mood as compatible, {@code −}{@link #CONFLICT_PENALTY} when conflicting, else 0.
     */
    public static double profileAdjustment(String moodId, AtmosphericContext context) {
        if (context == null || context.profile() == null || moodId == null) return 0.0;
        if (context.profile().isCompatibleWith(moodId)) return COMPATIBLE_BONUS;
        if (context.profile().conflictsWith(moodId)) return -CONFLICT_PENALTY;
        return 0.0;
    }
}
