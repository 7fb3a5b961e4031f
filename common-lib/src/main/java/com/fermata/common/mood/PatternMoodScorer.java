package com.fermata.common.mood;

import com.fermata.common.template.Template;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores how well a template's emotional character fits a target mood.
 *
 * <h3>Template profile</h3>
 * <ol>
 *   <li>Start at 50 on every axis.</li>
 *   <li>Move halfway toward the category's tendency targets.</li>
 *   <li>Add the subcategory's deltas.</li>
 *   <li>Prior weight: {@code (w − 0.5) × 20} to intensity, half of that to complexity.</li>
 *   <li>Length: {@code (maxWordCount − 1) × 10} to complexity.</li>
 * </ol>
 *
 * <h3>Score</h3>
 * {@code 0.6 × mean(axis similarity) + 0.4 × weighted(structural, vocabulary, cultural, semantic)}.
 * Confidence is the mean of the score's distance from 0.5 (doubled) and the agreement of the
 * four factors.
 *
 * <p>Stateless and thread-safe.
 */
public final class PatternMoodScorer {

    private PatternMoodScorer() {}

    public static final double DIMENSION_SHARE = 0.6;
    public static final double REASONING_SHARE = 0.4;

    /** Fraction of the distance from neutral toward a category target that a template inherits. */
    public static final double CATEGORY_PULL = 0.5;

    private static final Map<String, Map<EmotionalDimension, Double>> CATEGORY_TENDENCIES = Map.ofEntries(
        Map.entry("conceptual",  dims(EmotionalDimension.COMPLEXITY, 80, EmotionalDimension.MYSTERY, 70, EmotionalDimension.ENERGY, 40)),
        Map.entry("descriptive", dims(EmotionalDimension.VALENCE, 70, EmotionalDimension.ENERGY, 60, EmotionalDimension.COMPLEXITY, 50)),
        Map.entry("narrative",   dims(EmotionalDimension.COMPLEXITY, 70, EmotionalDimension.ENERGY, 55, EmotionalDimension.VALENCE, 60)),
        Map.entry("fusion",      dims(EmotionalDimension.ENERGY, 75, EmotionalDimension.COMPLEXITY, 85, EmotionalDimension.MYSTERY, 60)),
        Map.entry("temporal",    dims(EmotionalDimension.COMPLEXITY, 75, EmotionalDimension.MYSTERY, 65, EmotionalDimension.VALENCE, 45)),
        Map.entry("symbolic",    dims(EmotionalDimension.MYSTERY, 90, EmotionalDimension.COMPLEXITY, 85, EmotionalDimension.DARKNESS, 60)),
        Map.entry("linguistic",  dims(EmotionalDimension.COMPLEXITY, 80, EmotionalDimension.ENERGY, 65, EmotionalDimension.MYSTERY, 50)),
        Map.entry("atmospheric", dims(EmotionalDimension.MYSTERY, 85, EmotionalDimension.DARKNESS, 70, EmotionalDimension.COMPLEXITY, 80)),
        Map.entry("emotional",   dims(EmotionalDimension.INTENSITY, 75, EmotionalDimension.VALENCE, 70, EmotionalDimension.ENERGY, 60)),
        Map.entry("positive",    dims(EmotionalDimension.VALENCE, 90, EmotionalDimension.ENERGY, 75, EmotionalDimension.DARKNESS, 10)),
        Map.entry("vocabulary",  dims(EmotionalDimension.COMPLEXITY, 60, EmotionalDimension.MYSTERY, 40, EmotionalDimension.VALENCE, 60))
    );

    private static final Map<String, Map<EmotionalDimension, Double>> SUBCATEGORY_MODIFIERS = Map.ofEntries(
        Map.entry("abstract",      dims(EmotionalDimension.MYSTERY, 20, EmotionalDimension.COMPLEXITY, 15)),
        Map.entry("compound",      dims(EmotionalDimension.ENERGY, 15, EmotionalDimension.COMPLEXITY, 10)),
        Map.entry("morphology",    dims(EmotionalDimension.COMPLEXITY, 20, EmotionalDimension.MYSTERY, 10)),
        Map.entry("numeric",       dims(EmotionalDimension.MYSTERY, 15, EmotionalDimension.DARKNESS, 10)),
        Map.entry("rare",          dims(EmotionalDimension.COMPLEXITY, 10, EmotionalDimension.MYSTERY, 15)),
        Map.entry("quality",       dims(EmotionalDimension.ENERGY, 10, EmotionalDimension.VALENCE, 15)),
        Map.entry("contrast",      dims(EmotionalDimension.INTENSITY, 20, EmotionalDimension.COMPLEXITY, 15)),
        Map.entry("action",        dims(EmotionalDimension.ENERGY, 25, EmotionalDimension.INTENSITY, 15)),
        Map.entry("tech_nature",   dims(EmotionalDimension.MYSTERY, 15, EmotionalDimension.COMPLEXITY, 20)),
        Map.entry("perception",    dims(EmotionalDimension.INTENSITY, 15, EmotionalDimension.VALENCE, 10)),
        Map.entry("wisdom",        dims(EmotionalDimension.COMPLEXITY, 25, EmotionalDimension.MYSTERY, 20)),
        Map.entry("journey",       dims(EmotionalDimension.ENERGY, 15, EmotionalDimension.VALENCE, 10)),
        Map.entry("progression",   dims(EmotionalDimension.ENERGY, 15, EmotionalDimension.VALENCE, 10)),
        Map.entry("question",      dims(EmotionalDimension.MYSTERY, 20, EmotionalDimension.COMPLEXITY, 15)),
        Map.entry("time",          dims(EmotionalDimension.MYSTERY, 15, EmotionalDimension.COMPLEXITY, 10)),
        Map.entry("landscape",     dims(EmotionalDimension.VALENCE, 20, EmotionalDimension.DARKNESS, -15)),
        Map.entry("place_action",  dims(EmotionalDimension.ENERGY, 20, EmotionalDimension.INTENSITY, 15)),
        Map.entry("enumerated",    dims(EmotionalDimension.MYSTERY, 25, EmotionalDimension.COMPLEXITY, 20)),
        Map.entry("story",         dims(EmotionalDimension.VALENCE, 15, EmotionalDimension.DARKNESS, -10))
    );

    /** Template category → mood descriptors the category resonates with. */
    private static final Map<String, Set<String>> CATEGORY_MOOD_DESCRIPTORS = Map.ofEntries(
        Map.entry("conceptual",    Set.of("mysterious", "contemplative", "abstract")),
        Map.entry("descriptive",   Set.of("energetic", "uplifting", "bright")),
        Map.entry("narrative",     Set.of("nostalgic", "romantic", "engaging")),
        Map.entry("fusion",        Set.of("energetic", "mysterious", "electric")),
        Map.entry("temporal",      Set.of("nostalgic", "melancholic", "contemplative")),
        Map.entry("symbolic",      Set.of("mysterious", "dark")),
        Map.entry("linguistic",    Set.of("energetic", "playful")),
        Map.entry("emotional",     Set.of("melancholic", "romantic", "passionate")),
        Map.entry("vocabulary",    Set.of("mysterious", "contemplative")),
        Map.entry("traditional",   Set.of("nostalgic", "energetic")),
        Map.entry("interrogative", Set.of("mysterious", "contemplative")),
        Map.entry("spatial",       Set.of("peaceful", "uplifting")),
        Map.entry("sensory",       Set.of("romantic", "passionate")),
        Map.entry("poetic",        Set.of("melancholic", "romantic")),
        Map.entry("philosophical", Set.of("contemplative", "mysterious")),
        Map.entry("conditional",   Set.of("romantic", "nostalgic"))
    );

    // ── template profile ───────────────────────────────────────────────────

    /** Inherent emotional position of a template. */
    public static EmotionalVector templateProfile(Template template) {
        EmotionalVector vector = EmotionalVector.NEUTRAL;

        Map<EmotionalDimension, Double> tendency = CATEGORY_TENDENCIES.get(template.category());
        if (tendency != null) {
            for (Map.Entry<EmotionalDimension, Double> e : tendency.entrySet()) {
                double current = vector.get(e.getKey());
                vector = vector.with(e.getKey(), current + (e.getValue() - current) * CATEGORY_PULL);
            }
        }
        Map<EmotionalDimension, Double> modifier = SUBCATEGORY_MODIFIERS.get(template.subcategory());
        if (modifier != null) {
            for (Map.Entry<EmotionalDimension, Double> e : modifier.entrySet()) {
                vector = vector.shift(e.getKey(), e.getValue());
            }
        }

        double weightInfluence = (template.weight() - 0.5) * 20;
        vector = vector.shift(EmotionalDimension.INTENSITY, weightInfluence)
                       .shift(EmotionalDimension.COMPLEXITY, weightInfluence * 0.5);
        return vector.shift(EmotionalDimension.COMPLEXITY, (template.maxWordCount() - 1) * 10.0);
    }

    // ── scoring ────────────────────────────────────────────────────────────

    public static MoodAlignment score(Template template, String moodId) {
        return score(template, moodId, MoodLibrary.resolve(moodId), false);
    }

    /**
     * @param target          the mood's vector after any atmospheric blending
     * @param seasonalContext whether the request carries a season, which adds a small cultural bonus
     */
    public static MoodAlignment score(Template template, String moodId, EmotionalVector target,
                                      boolean seasonalContext) {
        MoodProfile profile = MoodLibrary.representativeProfile(moodId);
        if (profile == null) return MoodAlignment.unknown();

        EmotionalVector inherent = templateProfile(template);
        Map<EmotionalDimension, Double> dimensionScores = new EnumMap<>(EmotionalDimension.class);
        double dimensionSum = 0;
        for (EmotionalDimension dimension : EmotionalDimension.values()) {
            double s = EmotionalVector.axisSimilarity(inherent.get(dimension), target.get(dimension));
            dimensionScores.put(dimension, s);
            dimensionSum += s;
        }
        double dimensionAverage = dimensionSum / EmotionalDimension.values().length;

        MoodAlignment.ReasoningFactors factors = new MoodAlignment.ReasoningFactors(
            structural(template, target),
            vocabulary(template, profile),
            cultural(template, profile, seasonalContext),
            semantic(template, profile));

        double overall = clamp(dimensionAverage * DIMENSION_SHARE + factors.weighted() * REASONING_SHARE);
        double confidence = clamp((Math.abs(overall - 0.5) * 2 + factors.agreement()) / 2);
        return new MoodAlignment(overall, confidence, dimensionScores, factors);
    }

    /**
     * How strongly the template's category resonates with the mood: the share of the category's
     * descriptors found among the mood id and the vector's dominant traits, on a 0.3 floor.
     */
    public static double categoryResonance(Template template, String moodId, EmotionalVector target) {
        Set<String> descriptors = categoryDescriptors(template.category());
        if (descriptors.isEmpty()) return 0.5;
        Set<String> traits = dominantTraits(target);
        if (moodId != null) traits.add(moodId);
        long hits = descriptors.stream().filter(traits::contains).count();
        return clamp(0.3 + 0.7 * hits / descriptors.size());
    }

    /** Mood descriptors a template category resonates with; empty for unmapped categories. */
    public static Set<String> categoryDescriptors(String category) {
        return category == null ? Set.of() : CATEGORY_MOOD_DESCRIPTORS.getOrDefault(category, Set.of());
    }

    /** Mood descriptors implied by the strong axes of a vector. */
    public static Set<String> dominantTraits(EmotionalVector v) {
        Set<String> traits = new HashSet<>();
        if (v.energy() >= 70) traits.add("energetic");
        if (v.energy() <= 35) traits.add("peaceful");
        if (v.valence() >= 70) { traits.add("uplifting"); traits.add("bright"); }
        if (v.valence() <= 35) traits.add("melancholic");
        if (v.darkness() >= 70) traits.add("dark");
        if (v.mystery() >= 70) traits.add("mysterious");
        if (v.complexity() >= 70) traits.add("contemplative");
        if (v.intensity() >= 70) traits.add("passionate");
        return traits;
    }

    // ── reasoning factors ──────────────────────────────────────────────────

    static double structural(Template template, EmotionalVector mood) {
        double score = 0.5;
        score += (1 - Math.abs(mood.complexity() - template.maxWordCount() * 25.0) / 100) * 0.3;
        if (mood.mystery() > 70 && template.hasSlot("concept")) score += 0.2;
        if (mood.energy() > 70 && template.hasSlot("action")) score += 0.2;
        return clamp(score);
    }

    static double vocabulary(Template template, MoodProfile profile) {
        double score = 0.5;
        List<String> preferences = profile.patternPreferences();
        if (preferences.contains(template.id())) {
            score += 0.3;
        } else if (preferenceTokens(preferences).contains(template.category())
            || preferenceTokens(preferences).contains(template.subcategory())) {
            score += 0.2;
        }
        double syllableAlignment = 1 - Math.abs(template.maxWordCount() - profile.preferredSyllables()) / 3.0;
        score += syllableAlignment * 0.2;
        return clamp(score);
    }

    static double cultural(Template template, MoodProfile profile, boolean seasonalContext) {
        double maxAffinity = 0;
        for (String genre : template.applicableGenres()) {
            maxAffinity = Math.max(maxAffinity, profile.affinityFor(genre));
        }
        double score = template.applicableGenres().isEmpty()
            ? 0.5 + profile.maxAffinity() * 0.4 * 0.5
            : 0.5 + maxAffinity * 0.4;
        if (seasonalContext) score += 0.1;
        return clamp(score);
    }

    static double semantic(Template template, MoodProfile profile) {
        String text = descriptionOf(template);
        double score = 0.5;
        if (!profile.keywords().isEmpty()) {
            long matches = profile.keywords().stream().filter(text::contains).count();
            score += (double) matches / profile.keywords().size() * 0.3;
        }
        for (String opposite : profile.opposites()) {
            MoodProfile oppositeProfile = MoodLibrary.profile(opposite);
            if (oppositeProfile == null) continue;
            for (String keyword : oppositeProfile.keywords()) {
                if (text.contains(keyword)) score -= 0.1;
            }
        }
        return clamp(score);
    }

    private static String descriptionOf(Template template) {
        StringBuilder sb = new StringBuilder()
            .append(template.id()).append(' ')
            .append(template.category()).append(' ')
            .append(template.subcategory());
        for (String example : template.examples()) sb.append(' ').append(example);
        return sb.toString().toLowerCase(Locale.ROOT);
    }

    private static Set<String> preferenceTokens(List<String> preferences) {
        Set<String> tokens = new HashSet<>();
        for (String preference : preferences) {
            tokens.add(preference);
            tokens.addAll(List.of(preference.split("_")));
        }
        return tokens;
    }

    private static Map<EmotionalDimension, Double> dims(EmotionalDimension a, double av, EmotionalDimension b, double bv) {
        Map<EmotionalDimension, Double> map = new EnumMap<>(EmotionalDimension.class);
        map.put(a, av);
        map.put(b, bv);
        return map;
    }

    private static Map<EmotionalDimension, Double> dims(EmotionalDimension a, double av, EmotionalDimension b, double bv,
                                                         EmotionalDimension c, double cv) {
        Map<EmotionalDimension, Double> map = dims(a, av, b, bv);
        map.put(c, cv);
        return map;
    }

    private static double clamp(double v) {
        return Math.max(0.0, Math.min(1.0, v));
    }
}
