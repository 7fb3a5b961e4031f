package com.fermata.common.genre;

import com.fermata.common.wordsource.DefaultWordPools;
import com.fermata.common.wordsource.WordCategory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Curated genre vocabularies and pair blend rules.
 *
 * <p>Genres without a curated vocabulary get one derived from their profile's key elements,
 * cultural roots and the default genre terms, so {@link #forGenre(String)} never returns null.
 */
public final class GenreVocabularyLibrary {

    private static final Map<String, GenreVocabulary> CURATED = Map.of(
        "electronic", new GenreVocabulary("electronic",
            List.of("synth", "digital", "electronic", "cyber", "techno", "pulse", "wave", "circuit", "voltage", "frequency"),
            List.of("synthesizer", "sequencer", "sampler", "drum machine", "vocoder", "filters", "oscillators"),
            List.of("futuristic", "technological", "artificial", "virtual", "synthetic", "automated", "programmed"),
            List.of("hypnotic", "transcendent", "euphoric", "robotic", "cold", "ethereal", "psychedelic"),
            List.of("waveform", "modulation", "distortion", "compression", "reverb", "delay"),
            List.of("machine", "robot", "android", "digital soul", "electronic dreams", "cyber heart"),
            List.of("hard", "soft", "deep", "minimal", "maximal", "progressive", "ambient"),
            List.of("pulsing", "rhythmic", "synthetic", "processed", "filtered", "compressed", "layered")),
        "rock", new GenreVocabulary("rock",
            List.of("rock", "stone", "thunder", "electric", "power", "energy", "storm", "fire", "steel", "iron"),
            List.of("guitar", "drums", "bass", "amplifier", "distortion", "feedback", "power chord"),
            List.of("rebellion", "freedom", "youth", "revolution", "anthem", "legend", "hero", "outlaw"),
            List.of("passionate", "aggressive", "energetic", "raw", "intense", "powerful", "explosive"),
            List.of("riff", "solo", "chord", "progression", "tempo", "rhythm", "beat"),
            List.of("highway", "machine", "engine", "locomotive", "thunder storm", "wildfire"),
            List.of("hard", "soft", "heavy", "light", "classic", "modern", "progressive"),
            List.of("driving", "pounding", "soaring", "crushing", "blazing", "thunderous", "electrifying")),
        "jazz", new GenreVocabulary("jazz",
            List.of("jazz", "swing", "bebop", "fusion", "improvisation", "sophistication", "harmony", "rhythm"),
            List.of("saxophone", "trumpet", "piano", "bass", "drums", "vibes", "muted", "brass"),
            List.of("sophisticated", "artistic", "intellectual", "cultured", "refined", "elegant", "classy"),
            List.of("smooth", "cool", "hot", "mellow", "complex", "nuanced", "expressive", "soulful"),
            List.of("improvisation", "chord changes", "modulation", "syncopation", "polyrhythm", "blue notes"),
            List.of("conversation", "dialogue", "story", "journey", "exploration", "adventure"),
            List.of("smooth", "hard", "soft", "free", "straight ahead", "fusion", "contemporary"),
            List.of("swinging", "flowing", "sophisticated", "complex", "improvised", "harmonic", "melodic")),
        "hip-hop", new GenreVocabulary("hip-hop",
            List.of("rap", "flow", "beats", "rhythm", "groove", "cipher", "culture", "movement"),
            List.of("turntables", "sampler", "mic", "beats", "bass", "drums", "scratch", "loop"),
            List.of("street", "urban", "real", "authentic", "underground", "conscious", "message", "truth"),
            List.of("raw", "honest", "passionate", "aggressive", "smooth", "chill", "hard", "soft"),
            List.of("sampling", "loops", "breaks", "scratching", "mixing", "beatboxing", "freestyle"),
            List.of("battle", "cypher", "kingdom", "empire", "nation", "tribe", "collective", "crew"),
            List.of("hard", "soft", "smooth", "rough", "clean", "dirty", "conscious"),
            List.of("flowing", "rhythmic", "percussive", "lyrical", "melodic", "harmonic", "dynamic")),
        "folk", new GenreVocabulary("folk",
            List.of("folk", "traditional", "acoustic", "storytelling", "heritage", "roots", "culture", "community"),
            List.of("acoustic guitar", "banjo", "fiddle", "harmonica", "mandolin", "dulcimer"),
            List.of("traditional", "heritage", "ancestral", "cultural", "community", "family", "generational"),
            List.of("nostalgic", "melancholy", "peaceful", "reflective", "intimate", "personal", "heartfelt"),
            List.of("fingerpicking", "strumming", "modal", "pentatonic", "ballad", "narrative"),
            List.of("river", "mountain", "valley", "forest", "meadow", "cottage", "campfire", "journey"),
            List.of("gentle", "soft", "quiet", "intimate", "personal", "traditional", "contemporary"),
            List.of("acoustic", "organic", "natural", "intimate", "storytelling", "melodic", "harmonic")),
        "classical", new GenreVocabulary("classical",
            List.of("classical", "orchestral", "symphonic", "chamber", "opera", "concerto", "sonata", "composition"),
            List.of("orchestra", "symphony", "piano", "violin", "cello", "flute", "oboe", "french horn"),
            List.of("refined", "sophisticated", "elegant", "formal", "traditional", "academic", "artistic"),
            List.of("dramatic", "romantic", "passionate", "melancholy", "joyful", "triumphant", "peaceful"),
            List.of("composition", "orchestration", "harmony", "counterpoint", "fugue", "sonata form"),
            List.of("cathedral", "palace", "garden", "landscape", "journey", "story", "conversation"),
            List.of("grand", "intimate", "dramatic", "lyrical", "virtuosic", "contemplative", "majestic"),
            List.of("orchestrated", "harmonic", "melodic", "structured", "formal", "elegant", "sophisticated"))
    );

    private static final List<BlendRule> BLEND_RULES = List.of(
        new BlendRule("ElectroJazz Vocabulary Fusion", "electronic", "jazz", VocabularyStrategy.SYNTHESIZE, 0.6, 0.4,
            List.of("improvisation", "complexity", "sophistication", "modulation", "harmony"),
            List.of("electro", "cyber", "digital", "neo", "synthetic"),
            List.of("jazz", "swing", "bebop", "fusion", "flow"),
            List.of("{genre1_term} {genre2_concept}", "{hybrid_prefix}{genre2_term}", "Digital {genre2_technique}"),
            List.of("Digital Bebop", "Cyber Swing", "Electronic Improvisation", "Synthetic Jazz")),
        new BlendRule("TechnoFolk Vocabulary Fusion", "folk", "electronic", VocabularyStrategy.ALTERNATE, 0.5, 0.5,
            List.of("storytelling", "tradition", "culture", "community", "heritage", "roots"),
            List.of("digital", "cyber", "electronic", "synthetic", "virtual"),
            List.of("folk", "tales", "stories", "roots", "heritage", "tradition"),
            List.of("{genre2_term} {genre1_concept}", "{genre1_term} {hybrid_suffix}", "Digital {genre1_instrument}"),
            List.of("Digital Folk", "Electronic Heritage", "Cyber Ballad", "Virtual Storytelling")),
        new BlendRule("Symphonic Rock Vocabulary Fusion", "rock", "classical", VocabularyStrategy.MERGE, 0.55, 0.45,
            List.of("power", "drama", "intensity", "composition", "orchestration", "dynamics"),
            List.of("symphonic", "orchestral", "classical", "neo", "progressive"),
            List.of("rock", "symphony", "concerto", "opera", "suite", "movement"),
            List.of("{genre2_term} {genre1_term}", "Symphonic {genre1_concept}", "{genre2_instrument} {genre1_term}"),
            List.of("Symphonic Thunder", "Orchestral Storm", "Classical Power", "Rock Symphony")),
        new BlendRule("Jazz Hop Vocabulary Fusion", "hip-hop", "jazz", VocabularyStrategy.MERGE, 0.5, 0.5,
            List.of("improvisation", "rhythm", "flow", "expression", "culture", "artistry"),
            List.of("jazz", "smooth", "neo", "contemporary", "fusion"),
            List.of("hop", "flow", "beats", "rhythm", "groove", "cipher"),
            List.of("{genre2_technique} {genre1_term}", "Jazz {genre1_term}", "{bridge} {genre1_term}"),
            List.of("Jazz Flow", "Smooth Cipher", "Bebop Beats", "Fusion Hop"))
    );

    private final GenreCompatibilityMatrix matrix;

    public GenreVocabularyLibrary(GenreCompatibilityMatrix matrix) {
        this.matrix = matrix;
    }

    public static GenreVocabularyLibrary standard() {
        return new GenreVocabularyLibrary(GenreCompatibilityMatrix.standard());
    }

    public boolean isCurated(String genre) {
        return genre != null && CURATED.containsKey(genre.toLowerCase(Locale.ROOT));
    }

    public GenreVocabulary forGenre(String genre) {
        String g = genre == null ? "" : genre.trim().toLowerCase(Locale.ROOT);
        GenreVocabulary curated = CURATED.get(g);
        return curated != null ? curated : derive(g);
    }

    /** Rule for the pair in either order, or {@code null}. */
    public BlendRule blendRule(String a, String b) {
        if (a == null || b == null) return null;
        String na = a.toLowerCase(Locale.ROOT);
        String nb = b.toLowerCase(Locale.ROOT);
        return BLEND_RULES.stream().filter(r -> r.covers(na, nb)).findFirst().orElse(null);
    }

    public List<BlendRule> blendRules() {
        return BLEND_RULES;
    }

    private GenreVocabulary derive(String genre) {
        GenreProfile profile = matrix.profile(genre);
        Set<String> core = new LinkedHashSet<>(DefaultWordPools.genreTerms(genre));
        if (!genre.isEmpty() && !genre.contains(" ")) core.add(genre);
        List<String> cultural = new ArrayList<>(DefaultWordPools.pool(WordCategory.CONTEXTUAL_WORDS).subList(0, 6));
        if (profile != null) {
            core.addAll(profile.keyElements());
            cultural = new ArrayList<>(profile.culturalRoots());
        }
        List<String> adjectives = DefaultWordPools.pool(WordCategory.ADJECTIVES);
        List<String> nouns = DefaultWordPools.pool(WordCategory.NOUNS);
        return new GenreVocabulary(genre,
            new ArrayList<>(core),
            DefaultWordPools.pool(WordCategory.MUSICAL_TERMS).subList(0, 7),
            cultural,
            adjectives.subList(7, 14),
            DefaultWordPools.pool(WordCategory.MUSICAL_TERMS).subList(7, 13),
            nouns.subList(0, 8),
            List.of("hard", "soft", "deep", "raw", "pure", "wild"),
            adjectives.subList(0, 7));
    }
}
