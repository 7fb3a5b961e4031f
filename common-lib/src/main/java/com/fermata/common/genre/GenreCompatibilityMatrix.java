package com.fermata.common.genre;

import com.fermata.common.exception.IncompatibleGenresException;
import com.fermata.common.genre.GenreProfile.EmotionalColor;
import com.fermata.common.genre.GenreProfile.Instrumentation;
import com.fermata.common.genre.GenreProfile.Rhythm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Pairwise fusion potential between genres, computed once from {@link GenreProfile}s.
 *
 * <h3>Pair score</h3>
 * Starts at 0.5 and accumulates:
 * <ol>
 *   <li>Energy: {@code +0.20} when |Δ| &lt; 0.3, {@code +0.10} (contrast) when |Δ| &gt; 0.6.</li>
 *   <li>Complexity: {@code +0.15} when |Δ| &lt; 0.4, else {@code +0.05} and the more complex
 *       genre gets a 0.6 share.</li>
 *   <li>Instrumentation: {@code +0.15} shared, {@code +0.10} complementary, else {@code +0.05}.</li>
 *   <li>Rhythm fit × 0.1; {@code +0.10} when improvisation |Δ| &lt; 0.3.</li>
 *   <li>{@code +0.10} for shared cultural roots (evolution); {@code +0.05} for overlapping
 *       emotional range.</li>
 *   <li>Curated bonuses for electronic+jazz, folk+electronic, hip-hop+jazz, rock+classical.</li>
 * </ol>
 * Every pair is stored under both orders, so lookups are order-insensitive.
 *
 * <p>Immutable after construction and safe to share.
 */
public class GenreCompatibilityMatrix {

    private static final Logger log = LoggerFactory.getLogger(GenreCompatibilityMatrix.class);

    private static final GenreCompatibilityMatrix STANDARD = new GenreCompatibilityMatrix(standardProfiles());

    private final Map<String, GenreProfile> profiles = new LinkedHashMap<>();
    private final Map<String, CompatibilityEntry> entries = new HashMap<>();
    private final List<FusionRule> fusionRules = new ArrayList<>();

    public GenreCompatibilityMatrix(Collection<GenreProfile> genreProfiles) {
        for (GenreProfile profile : genreProfiles) {
            profiles.put(profile.genre(), profile);
        }
        List<String> genres = new ArrayList<>(profiles.keySet());
        for (int i = 0; i < genres.size(); i++) {
            for (int j = i + 1; j < genres.size(); j++) {
                CompatibilityEntry entry = computePair(profiles.get(genres.get(i)), profiles.get(genres.get(j)));
                entries.put(key(entry.primary(), entry.secondary()), entry);
                entries.put(key(entry.secondary(), entry.primary()), entry.reversed());
            }
        }
        defineFusionRules();
        log.debug("[GenreMatrix] genres={} pairs={} rules={}", profiles.size(), entries.size(), fusionRules.size());
    }

    public static GenreCompatibilityMatrix standard() {
        return STANDARD;
    }

    // ── lookups ──────────────────────────────────────────────────────────────

    /** Entry oriented as {@code (primary, secondary)}, or {@code null} when the pair is unknown. */
    public CompatibilityEntry find(String primary, String secondary) {
        if (primary == null || secondary == null) return null;
        return entries.get(key(normalize(primary), normalize(secondary)));
    }

    /** Like {@link #find} but fails fast for unknown pairs. */
    public CompatibilityEntry require(String primary, String secondary) {
        CompatibilityEntry entry = find(primary, secondary);
        if (entry == null) throw new IncompatibleGenresException(primary, secondary);
        return entry;
    }

    public GenreProfile profile(String genre) {
        return genre == null ? null : profiles.get(normalize(genre));
    }

    public Set<String> genres() {
        return profiles.keySet();
    }

    public FusionRule fusionRule(String a, String b) {
        if (a == null || b == null) return null;
        String na = normalize(a);
        String nb = normalize(b);
        return fusionRules.stream().filter(r -> r.covers(na, nb)).findFirst().orElse(null);
    }

    public List<FusionRule> fusionRules() {
        return List.copyOf(fusionRules);
    }

    /** Other genres ordered by descending compatibility with {@code genre}. */
    public List<CompatibilityEntry> mostCompatible(String genre, int limit) {
        String g = normalize(genre);
        return profiles.keySet().stream()
            .filter(other -> !other.equals(g))
            .map(other -> entries.get(key(g, other)))
            .filter(e -> e != null)
            .sorted(Comparator.comparingDouble(CompatibilityEntry::score).reversed())
            .limit(limit)
            .collect(Collectors.toList());
    }

    public boolean isFusionWorthy(String a, String b, double threshold) {
        CompatibilityEntry entry = find(a, b);
        return entry != null && entry.score() >= threshold;
    }

    static String normalize(String genre) {
        return genre.trim().toLowerCase(Locale.ROOT);
    }

    private static String key(String a, String b) {
        return a + "|" + b;
    }

    // ── scoring ──────────────────────────────────────────────────────────────

    private static CompatibilityEntry computePair(GenreProfile p1, GenreProfile p2) {
        double score = 0.5;
        List<String> synergies = new ArrayList<>();
        List<String> challenges = new ArrayList<>();
        List<String> bestAspects = new ArrayList<>();
        FusionStyle style = FusionStyle.HYBRID;
        double w1 = 0.5;
        double w2 = 0.5;

        double energyDiff = Math.abs(p1.energy() - p2.energy());
        if (energyDiff < 0.3) {
            score += 0.2;
            synergies.add("Similar energy levels create natural flow");
        } else if (energyDiff > 0.6) {
            score += 0.1;
            synergies.add("Contrasting energy levels create dynamic tension");
            style = FusionStyle.CONTRAST;
        } else {
            challenges.add("Moderate energy differences may create balance issues");
        }

        double complexityDiff = Math.abs(p1.complexity() - p2.complexity());
        if (complexityDiff < 0.4) {
            score += 0.15;
            synergies.add("Compatible complexity levels facilitate fusion");
        } else {
            score += 0.05;
            challenges.add("Different complexity levels require careful balancing");
            boolean firstMoreComplex = p1.complexity() > p2.complexity();
            w1 = firstMoreComplex ? 0.6 : 0.4;
            w2 = firstMoreComplex ? 0.4 : 0.6;
        }

        Instrumentation i1 = p1.instrumentation();
        Instrumentation i2 = p2.instrumentation();
        if (i1 == i2) {
            score += 0.15;
            synergies.add("Shared instrumentation creates natural cohesion");
        } else if (i1 == Instrumentation.MIXED || i2 == Instrumentation.MIXED
            || (i1 == Instrumentation.ACOUSTIC && i2 == Instrumentation.ELECTRIC)
            || (i1 == Instrumentation.ELECTRIC && i2 == Instrumentation.ACOUSTIC)) {
            score += 0.1;
            synergies.add("Complementary instrumentation adds textural richness");
            style = FusionStyle.COMPLEMENT;
        } else {
            score += 0.05;
            challenges.add("Contrasting instrumentation requires creative integration");
        }

        double rhythmFit = p1.rhythm().compatibilityWith(p2.rhythm());
        score += rhythmFit * 0.1;
        if (rhythmFit > 0.7) synergies.add("Rhythmic elements blend naturally");

        if (Math.abs(p1.improvisation() - p2.improvisation()) < 0.3) {
            score += 0.1;
            bestAspects.add("Balanced improvisational elements");
        }

        List<String> sharedRoots = p1.culturalRoots().stream()
            .filter(p2.culturalRoots()::contains)
            .collect(Collectors.toList());
        if (!sharedRoots.isEmpty()) {
            score += 0.1;
            synergies.add("Shared cultural roots: " + String.join(", ", sharedRoots));
            style = FusionStyle.EVOLUTION;
        }

        if (p1.emotionalRange().stream().anyMatch(p2.emotionalRange()::contains)) {
            score += 0.05;
            synergies.add("Overlapping emotional territories");
        }

        score += specialBonus(p1.genre(), p2.genre(), synergies, bestAspects);

        return new CompatibilityEntry(p1.genre(), p2.genre(), Math.max(0, Math.min(1, score)), style,
            synergies, challenges, w1, w2, bestAspects);
    }

    private static double specialBonus(String g1, String g2, List<String> synergies, List<String> bestAspects) {
        if (pair(g1, g2, "electronic", "jazz")) {
            synergies.add("Electronic-jazz fusion creates sophisticated innovation");
            bestAspects.add("Improvisation meets technology");
            bestAspects.add("Complex harmonies with electronic textures");
            return 0.15;
        }
        if (pair(g1, g2, "folk", "electronic")) {
            synergies.add("Traditional meets futuristic, a compelling dichotomy");
            bestAspects.add("Organic storytelling with digital soundscapes");
            return 0.12;
        }
        if (pair(g1, g2, "hip-hop", "jazz")) {
            synergies.add("Hip-hop jazz fusion has strong historical precedent");
            bestAspects.add("Improvisational flow");
            bestAspects.add("Complex rhythmic interplay");
            return 0.1;
        }
        if (pair(g1, g2, "rock", "classical")) {
            synergies.add("Rock power meets classical sophistication");
            bestAspects.add("Dynamic range");
            bestAspects.add("Compositional complexity with raw energy");
            return 0.1;
        }
        return 0.0;
    }

    private static boolean pair(String g1, String g2, String a, String b) {
        return (g1.equals(a) && g2.equals(b)) || (g1.equals(b) && g2.equals(a));
    }

    private void defineFusionRules() {
        fusionRules.add(new FusionRule("ElectroJazz Fusion", "electronic", "jazz",
            VocabularyStrategy.SYNTHESIZE, FusionRule.PatternStrategy.INTERWEAVE,
            List.of("Digital Saxophone", "Quantum Bebop", "Synthesized Improvisation")));
        fusionRules.add(new FusionRule("TechnoFolk Fusion", "folk", "electronic",
            VocabularyStrategy.ALTERNATE, FusionRule.PatternStrategy.LAYER,
            List.of("Digital Folklore", "Electronic Ballad", "Cyber Folk Tales")));
        fusionRules.add(new FusionRule("Symphonic Rock Fusion", "rock", "classical",
            VocabularyStrategy.MERGE, FusionRule.PatternStrategy.BLEND,
            List.of("Electric Symphony", "Orchestral Thunder", "Classical Storm")));
        fusionRules.add(new FusionRule("Jazz Hop Fusion", "hip-hop", "jazz",
            VocabularyStrategy.MERGE, FusionRule.PatternStrategy.INTERWEAVE,
            List.of("Jazz Flow Collective", "Bebop Beats", "Improvisational Cipher")));
    }

    // ── catalog ──────────────────────────────────────────────────────────────

    static List<GenreProfile> standardProfiles() {
        List<GenreProfile> list = new ArrayList<>();
        list.add(new GenreProfile("rock", 0.8, 0.6, 0.7, Instrumentation.ELECTRIC, Rhythm.STEADY, 0.4, 0.7,
            colors(EmotionalColor.DARK, EmotionalColor.BRIGHT, EmotionalColor.VARIED),
            List.of("blues", "folk", "country"),
            List.of("guitar", "drums", "bass", "vocals", "power", "rebellion")));
        list.add(new GenreProfile("electronic", 0.7, 0.8, 0.2, Instrumentation.ELECTRONIC, Rhythm.COMPLEX, 0.6, 0.6,
            colors(EmotionalColor.BRIGHT, EmotionalColor.DARK, EmotionalColor.NEUTRAL),
            List.of("experimental", "dance", "ambient"),
            List.of("synthesizer", "sampling", "beats", "digital", "futuristic", "technology")));
        list.add(new GenreProfile("jazz", 0.6, 0.9, 0.8, Instrumentation.ACOUSTIC, Rhythm.SYNCOPATED, 0.9, 0.4,
            colors(EmotionalColor.NEUTRAL, EmotionalColor.DARK, EmotionalColor.BRIGHT),
            List.of("blues", "ragtime", "swing"),
            List.of("improvisation", "harmony", "swing", "sophistication", "artistic", "complex")));
        list.add(new GenreProfile("hip-hop", 0.7, 0.7, 0.3, Instrumentation.ELECTRONIC, Rhythm.STEADY, 0.8, 0.8,
            colors(EmotionalColor.DARK, EmotionalColor.BRIGHT, EmotionalColor.VARIED),
            List.of("funk", "soul", "disco"),
            List.of("rhythm", "lyrics", "culture", "beats", "sampling", "expression")));
        list.add(new GenreProfile("folk", 0.4, 0.3, 0.9, Instrumentation.ACOUSTIC, Rhythm.STEADY, 0.5, 0.3,
            colors(EmotionalColor.NEUTRAL, EmotionalColor.DARK),
            List.of("traditional", "storytelling", "cultural"),
            List.of("storytelling", "acoustic", "tradition", "simplicity", "heritage", "community")));
        list.add(new GenreProfile("classical", 0.5, 1.0, 1.0, Instrumentation.ACOUSTIC, Rhythm.COMPLEX, 0.2, 0.2,
            colors(EmotionalColor.VARIED, EmotionalColor.NEUTRAL),
            List.of("european", "formal", "academic"),
            List.of("orchestration", "composition", "technique", "sophistication", "formal", "artistic")));
        list.add(new GenreProfile("indie", 0.6, 0.6, 0.4, Instrumentation.MIXED, Rhythm.VARIABLE, 0.6, 0.4,
            colors(EmotionalColor.DARK, EmotionalColor.BRIGHT, EmotionalColor.NEUTRAL),
            List.of("alternative", "underground", "diy"),
            List.of("creativity", "independence", "artistic", "alternative", "experimental", "authentic")));
        list.add(new GenreProfile("blues", 0.5, 0.4, 0.9, Instrumentation.ACOUSTIC, Rhythm.STEADY, 0.7, 0.5,
            colors(EmotionalColor.DARK, EmotionalColor.NEUTRAL),
            List.of("african-american", "work songs", "spirituals"),
            List.of("emotion", "storytelling", "guitar", "vocals", "expression", "soul")));
        list.add(new GenreProfile("country", 0.6, 0.4, 0.8, Instrumentation.ACOUSTIC, Rhythm.STEADY, 0.5, 0.7,
            colors(EmotionalColor.BRIGHT, EmotionalColor.NEUTRAL, EmotionalColor.DARK),
            List.of("folk", "western", "rural"),
            List.of("storytelling", "rural", "guitar", "vocals", "tradition", "americana")));
        list.add(new GenreProfile("metal", 0.9, 0.7, 0.6, Instrumentation.ELECTRIC, Rhythm.COMPLEX, 0.4, 0.5,
            colors(EmotionalColor.DARK, EmotionalColor.BRIGHT),
            List.of("rock", "blues", "classical"),
            List.of("intensity", "power", "technical", "heavy", "guitar", "aggression")));
        list.add(new GenreProfile("pop", 0.7, 0.4, 0.3, Instrumentation.MIXED, Rhythm.STEADY, 0.2, 1.0,
            colors(EmotionalColor.BRIGHT, EmotionalColor.NEUTRAL),
            List.of("various", "mainstream", "commercial"),
            List.of("catchy", "accessible", "commercial", "melody", "mainstream", "popular")));
        return list;
    }

    private static Set<EmotionalColor> colors(EmotionalColor first, EmotionalColor... rest) {
        return EnumSet.of(first, rest);
    }
}
