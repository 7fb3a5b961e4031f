package com.fermata.common.selection;

import com.fermata.common.selection.SelectionCriteria.Creativity;
import com.fermata.common.selection.SelectionCriteria.Intensity;
import com.fermata.common.template.NameType;

import java.util.Map;
import java.util.Set;

/**
 * Curated lookup tables from request axes to the template categories that suit them.
 * Unknown keys map to the empty set.
 */
public final class CategoryMappings {

    private CategoryMappings() {}

    private static final Map<String, Set<String>> BY_GENRE = Map.ofEntries(
        Map.entry("rock",       Set.of("traditional", "narrative", "emotional", "fusion")),
        Map.entry("jazz",       Set.of("poetic", "temporal", "sensory", "philosophical")),
        Map.entry("electronic", Set.of("symbolic", "linguistic", "fusion", "conceptual")),
        Map.entry("folk",       Set.of("traditional", "narrative", "temporal", "spatial")),
        Map.entry("pop",        Set.of("emotional", "descriptive", "interrogative")),
        Map.entry("indie",      Set.of("poetic", "conceptual", "vocabulary", "interrogative")),
        Map.entry("classical",  Set.of("temporal", "philosophical", "poetic")),
        Map.entry("punk",       Set.of("descriptive", "narrative", "interrogative")),
        Map.entry("blues",      Set.of("emotional", "narrative", "traditional")),
        Map.entry("country",    Set.of("narrative", "traditional", "emotional", "spatial")),
        Map.entry("metal",      Set.of("symbolic", "conceptual", "emotional")),
        Map.entry("hip-hop",    Set.of("narrative", "linguistic", "spatial", "descriptive"))
    );

    private static final Map<String, Set<String>> BY_MOOD = Map.ofEntries(
        Map.entry("energetic",   Set.of("narrative", "descriptive")),
        Map.entry("melancholic", Set.of("emotional", "temporal", "poetic")),
        Map.entry("peaceful",    Set.of("sensory", "spatial", "poetic")),
        Map.entry("aggressive",  Set.of("descriptive", "narrative", "symbolic")),
        Map.entry("mysterious",  Set.of("conceptual", "symbolic", "interrogative")),
        Map.entry("uplifting",   Set.of("emotional", "philosophical", "descriptive")),
        Map.entry("romantic",    Set.of("emotional", "poetic", "sensory")),
        Map.entry("nostalgic",   Set.of("temporal", "traditional", "narrative")),
        Map.entry("euphoric",    Set.of("emotional", "sensory", "descriptive")),
        Map.entry("dark",        Set.of("conceptual", "symbolic", "conditional"))
    );

    private static final Map<Intensity, Set<String>> BY_INTENSITY = Map.of(
        Intensity.LOW,    Set.of("sensory", "poetic", "vocabulary"),
        Intensity.MEDIUM, Set.of("descriptive", "traditional", "emotional"),
        Intensity.HIGH,   Set.of("narrative", "symbolic", "conditional")
    );

    private static final Map<Creativity, Set<String>> BY_CREATIVITY = Map.of(
        Creativity.CONSERVATIVE, Set.of("traditional", "descriptive", "narrative"),
        Creativity.BALANCED,     Set.of("emotional", "temporal", "poetic", "spatial"),
        Creativity.EXPERIMENTAL, Set.of("conceptual", "linguistic", "fusion", "interrogative",
                                        "philosophical", "conditional")
    );

    private static final Map<NameType, Set<String>> BY_TYPE = Map.of(
        NameType.BAND, Set.of("traditional"),
        NameType.SONG, Set.of("narrative", "poetic", "emotional")
    );

    public static Set<String> forGenre(String genre) {
        return genre == null ? Set.of() : BY_GENRE.getOrDefault(genre, Set.of());
    }

    public static Set<String> forMood(String mood) {
        return mood == null ? Set.of() : BY_MOOD.getOrDefault(mood, Set.of());
    }

    public static Set<String> forIntensity(Intensity intensity) {
        return intensity == null ? Set.of() : BY_INTENSITY.get(intensity);
    }

    public static Set<String> forCreativity(Creativity creativity) {
        return creativity == null ? Set.of() : BY_CREATIVITY.get(creativity);
    }

    public static Set<String> forType(NameType type) {
        return type == null ? Set.of() : BY_TYPE.get(type);
    }
}
