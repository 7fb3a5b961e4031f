package com.fermata.common.mood;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Read-only catalog of named moods and complex mood blends.
 *
 * <p>Resolution order for a mood name: simple profile, then complex blend, then
 * {@link EmotionalVector#NEUTRAL}. All lookups are case-sensitive on lower-case ids.
 */
public final class MoodLibrary {

    private static final Map<String, MoodProfile> PROFILES = new LinkedHashMap<>();
    private static final Map<String, ComplexMood> COMPLEX = new LinkedHashMap<>();

    static {
        register(new MoodProfile("euphoric", "high_energy",
            new EmotionalVector(95, 90, 60, 85, 10, 30),
            List.of("ecstatic", "blissful", "elated", "rapturous", "transcendent"),
            List.of("melancholic", "depressed", "somber"),
            Map.of("electronic", 0.9, "pop", 0.8, "rock", 0.7, "classical", 0.6),
            List.of("dynamic_adjective_noun", "action_object", "celestial_journey"), 2));
        register(new MoodProfile("aggressive", "high_energy",
            new EmotionalVector(90, 30, 70, 95, 70, 40),
            List.of("fierce", "violent", "forceful", "confrontational", "intense"),
            List.of("peaceful", "gentle", "serene"),
            Map.of("metal", 1.0, "punk", 0.95, "rock", 0.8, "industrial", 0.9),
            List.of("contrasting_elements", "power_statement", "raw_energy"), 1));
        register(new MoodProfile("energetic", "high_energy",
            new EmotionalVector(85, 75, 50, 70, 20, 25),
            List.of("vibrant", "dynamic", "lively", "spirited", "kinetic"),
            List.of("lethargic", "static", "calm"),
            Map.of("electronic", 0.9, "pop", 0.85, "rock", 0.8, "dance", 0.95),
            List.of("action_object", "dynamic_adjective_noun", "movement_metaphor"), 2));
        register(new MoodProfile("melancholic", "low_energy",
            new EmotionalVector(25, 20, 80, 60, 75, 70),
            List.of("sad", "wistful", "sorrowful", "pensive", "mournful"),
            List.of("euphoric", "joyful", "uplifting"),
            Map.of("classical", 0.9, "folk", 0.85, "indie", 0.8, "blues", 0.9),
            List.of("emotional_journey", "temporal_concept", "introspective_statement"), 2));
        register(new MoodProfile("peaceful", "low_energy",
            new EmotionalVector(30, 80, 40, 25, 15, 30),
            List.of("serene", "tranquil", "calm", "harmonious", "gentle"),
            List.of("aggressive", "chaotic", "turbulent"),
            Map.of("ambient", 1.0, "classical", 0.8, "folk", 0.7, "new_age", 0.95),
            List.of("nature_metaphor", "gentle_imagery", "flowing_concept"), 2));
        register(new MoodProfile("mysterious", "atmospheric",
            new EmotionalVector(45, 50, 90, 65, 80, 95),
            List.of("enigmatic", "cryptic", "secretive", "occult", "hidden"),
            List.of("obvious", "clear", "transparent"),
            Map.of("ambient", 0.9, "experimental", 0.95, "darkwave", 1.0, "progressive", 0.8),
            List.of("abstract_concept", "symbolic_imagery", "hidden_meaning"), 2));
        register(new MoodProfile("romantic", "emotional",
            new EmotionalVector(55, 85, 70, 60, 25, 50),
            List.of("passionate", "tender", "intimate", "loving", "affectionate"),
            List.of("cold", "detached", "hostile"),
            Map.of("classical", 0.9, "jazz", 0.8, "folk", 0.75, "pop", 0.7),
            List.of("emotional_journey", "intimate_imagery", "warm_metaphor"), 2));
        register(new MoodProfile("nostalgic", "temporal",
            new EmotionalVector(40, 60, 75, 55, 45, 60),
            List.of("reminiscent", "wistful", "sentimental", "retrospective", "yearning"),
            List.of("futuristic", "progressive", "modern"),
            Map.of("folk", 0.9, "country", 0.85, "indie", 0.8, "classic_rock", 0.9),
            List.of("temporal_concept", "memory_metaphor", "vintage_imagery"), 2));
        register(new MoodProfile("uplifting", "positive",
            new EmotionalVector(75, 90, 55, 70, 10, 25),
            List.of("inspiring", "hopeful", "encouraging", "elevating", "empowering"),
            List.of("depressing", "discouraging", "defeating"),
            Map.of("pop", 0.9, "gospel", 1.0, "rock", 0.8, "electronic", 0.75),
            List.of("ascending_journey", "light_metaphor", "growth_concept"), 2));
        register(new MoodProfile("dark", "atmospheric",
            new EmotionalVector(60, 25, 80, 75, 95, 80),
            List.of("brooding", "ominous", "sinister", "foreboding", "grim"),
            List.of("bright", "cheerful", "optimistic"),
            Map.of("metal", 0.95, "gothic", 1.0, "darkwave", 0.95, "industrial", 0.9),
            List.of("shadow_imagery", "power_statement", "dark_metaphor"), 1));

        registerComplex(new ComplexMood("bittersweet", "nostalgic", List.of("melancholic", "uplifting"),
            List.of(0.5, 0.3, 0.2), List.of("Sweet Sorrow", "Fading Light", "Last Dance")));
        registerComplex(new ComplexMood("triumphant_melancholy", "uplifting", List.of("melancholic", "nostalgic"),
            List.of(0.4, 0.35, 0.25), List.of("Hollow Victory", "Broken Crown", "Wounded Glory")));
        registerComplex(new ComplexMood("gentle_power", "peaceful", List.of("uplifting", "mysterious"),
            List.of(0.5, 0.3, 0.2), List.of("Quiet Thunder", "Gentle Storm", "Silent Force")));
        registerComplex(new ComplexMood("dark_euphoria", "euphoric", List.of("dark", "mysterious"),
            List.of(0.5, 0.3, 0.2), List.of("Midnight High", "Shadow Dance", "Dark Ecstasy")));
    }

    private MoodLibrary() {}

    private static void register(MoodProfile profile) {
        PROFILES.put(profile.id(), profile);
    }

    private static void registerComplex(ComplexMood mood) {
        COMPLEX.put(mood.id(), mood);
    }

    /** @return the simple profile, or {@code null} */
    public static MoodProfile profile(String moodId) {
        return moodId == null ? null : PROFILES.get(moodId);
    }

    /** @return the complex blend, or {@code null} */
    public static ComplexMood complexMood(String moodId) {
        return moodId == null ? null : COMPLEX.get(moodId);
    }

    /**
     * Profile that speaks for {@code moodId}: the simple profile itself, or the primary
     * component's profile for a complex mood. {@code null} for unknown moods.
     */
    public static MoodProfile representativeProfile(String moodId) {
        MoodProfile simple = profile(moodId);
        if (simple != null) return simple;
        ComplexMood complex = complexMood(moodId);
        return complex == null ? null : profile(complex.primaryMood());
    }

    public static boolean isKnown(String moodId) {
        return profile(moodId) != null || complexMood(moodId) != null;
    }

    public static Set<String> moodIds() {
        return PROFILES.keySet();
    }

    public static Set<String> complexMoodIds() {
        return COMPLEX.keySet();
    }

    /**
     * Emotional vector for a mood name: simple profile, complex blend, or neutral.
     */
    public static EmotionalVector resolve(String moodId) {
        MoodProfile simple = profile(moodId);
        if (simple != null) return simple.dimensions();
        ComplexMood complex = complexMood(moodId);
        if (complex != null) return blend(complex.components(), complex.blendRatio());
        return EmotionalVector.NEUTRAL;
    }

    /** Resolves the mood, then applies each applicable modifier in order. */
    public static EmotionalVector resolve(String moodId, Collection<MoodModifier> modifiers) {
        EmotionalVector vector = resolve(moodId);
        if (modifiers == null) return vector;
        String modifierTarget = profile(moodId) != null ? moodId : primaryOf(moodId);
        for (MoodModifier modifier : modifiers) {
            vector = modifier.apply(vector, modifierTarget);
        }
        return vector;
    }

    /**
     * Weighted sum of simple mood vectors. Unknown ids contribute nothing; with no ids the
     * result is neutral. {@code weights == null} means equal weights.
     */
    public static EmotionalVector blend(List<String> moodIds, List<Double> weights) {
        if (moodIds == null || moodIds.isEmpty()) return EmotionalVector.NEUTRAL;
        double[] sums = new double[EmotionalDimension.values().length];
        for (int i = 0; i < moodIds.size(); i++) {
            MoodProfile profile = profile(moodIds.get(i));
            if (profile == null) continue;
            double weight = weights != null && i < weights.size() ? weights.get(i) : 1.0 / moodIds.size();
            for (EmotionalDimension dimension : EmotionalDimension.values()) {
                sums[dimension.ordinal()] += profile.dimensions().get(dimension) * weight;
            }
        }
        return new EmotionalVector(sums[0], sums[1], sums[2], sums[3], sums[4], sums[5]);
    }

    /** Genre affinity of a mood (0 when either side is unknown). */
    public static double genreAffinity(String moodId, String genre) {
        MoodProfile profile = representativeProfile(moodId);
        return profile == null ? 0.0 : profile.affinityFor(genre);
    }

    private static String primaryOf(String moodId) {
        ComplexMood complex = complexMood(moodId);
        return complex == null ? moodId : complex.primaryMood();
    }
}
