package com.fermata.common.atmosphere;

/**
 * Optional descriptors that colour a mood. Every field may be {@code null}.
 *
 * @param profile     named atmosphere whose compatible/conflicting moods adjust mood scores
 * @param timeOfDay   nudges energy and mystery
 * @param season      nudges all axes through the given phase
 * @param phase       season phase; {@code null} means the peak
 * @param weather     nudges all axes
 * @param culture     nudges all axes
 * @param weights     per-contributor weights of the weighted average; {@code null} means 0.5 each
 */
public record AtmosphericContext(
    AtmosphericProfile profile,
    TimeOfDay timeOfDay,
    Season season,
    SeasonPhase phase,
    Weather weather,
    CulturalRegister culture,
    BlendWeights weights
) {

    private static final AtmosphericContext EMPTY =
        new AtmosphericContext(null, null, null, null, null, null, BlendWeights.defaults());

    public AtmosphericContext {
        if (weights == null) weights = BlendWeights.defaults();
    }

    public static AtmosphericContext empty() {
        return EMPTY;
    }

    /**
     * Parses loose string descriptors. Unknown values are ignored. {@code seasonalMood} may be a
     * bare season ({@code "autumn"}) or season plus phase word ({@code "autumn_reflection"}).
     */
    public static AtmosphericContext parse(String profile, String timeOfDay, String seasonalMood,
                                           String weather, String culture) {
        Season season = null;
        SeasonPhase phase = null;
        if (seasonalMood != null && !seasonalMood.isBlank()) {
            String[] parts = seasonalMood.trim().split("[_\\-\\s]", 2);
            season = Season.fromId(parts[0]);
            phase = parts.length > 1 ? SeasonPhase.fromWord(parts[1]) : null;
        }
        return new AtmosphericContext(
            AtmosphericProfile.fromId(profile),
            TimeOfDay.fromId(timeOfDay),
            season,
            phase,
            Weather.fromId(weather),
            CulturalRegister.fromId(culture),
            BlendWeights.defaults());
    }

    public boolean isEmpty() {
        return profile == null && timeOfDay == null && season == null && weather == null && culture == null;
    }

    public AtmosphericContext withProfile(AtmosphericProfile newProfile) {
        return new AtmosphericContext(newProfile, timeOfDay, season, phase, weather, culture, weights);
    }

    public AtmosphericContext withTimeOfDay(TimeOfDay newTime) {
        return new AtmosphericContext(profile, newTime, season, phase, weather, culture, weights);
    }

    public AtmosphericContext withSeason(Season newSeason, SeasonPhase newPhase) {
        return new AtmosphericContext(profile, timeOfDay, newSeason, newPhase, weather, culture, weights);
    }

    public AtmosphericContext withWeather(Weather newWeather) {
        return new AtmosphericContext(profile, timeOfDay, season, phase, newWeather, culture, weights);
    }

    public AtmosphericContext withCulture(CulturalRegister newCulture) {
        return new AtmosphericContext(profile, timeOfDay, season, phase, weather, newCulture, weights);
    }

    public AtmosphericContext withWeights(BlendWeights newWeights) {
        return new AtmosphericContext(profile, timeOfDay, season, phase, weather, culture, newWeights);
    }
}
