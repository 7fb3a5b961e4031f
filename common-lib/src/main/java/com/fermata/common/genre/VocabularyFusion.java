package com.fermata.common.genre;

import com.fermata.common.template.PhraseText;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.regex.Pattern;

/**
 * Blends two genre vocabularies under one of the {@link VocabularyStrategy strategies}.
 *
 * <h3>Strategy choice</h3>
 * <ol>
 *   <li>A curated {@link BlendRule} for the pair wins.</li>
 *   <li>Compatibility below {@link #DOMINANT_BELOW}: {@code DOMINANT}, primary genre favoured.</li>
 *   <li>Compatibility and creativity both high: {@code SYNTHESIZE}.</li>
 *   <li>Otherwise by fusion style: complement → synthesize/alternate, contrast → layer/dominant,
 *       hybrid → merge, evolution → synthesize.</li>
 * </ol>
 */
public class VocabularyFusion {

    private static final Logger log = LoggerFactory.getLogger(VocabularyFusion.class);

    public static final double DOMINANT_BELOW = 0.5;
    public static final double SYNTHESIZE_COMPATIBILITY = 0.75;
    public static final double SYNTHESIZE_CREATIVITY = 0.7;

    private static final List<String> HYBRID_PREFIXES = List.of("neo", "meta", "proto", "ultra", "hyper");
    private static final List<String> BRIDGE_WORDS = List.of("meets", "fusion", "synthesis", "blend", "hybrid", "crossing", "bridge");
    private static final Pattern UNFILLED = Pattern.compile("\\{\\w+}");

    private final GenreCompatibilityMatrix matrix;
    private final GenreVocabularyLibrary library;

    public VocabularyFusion(GenreCompatibilityMatrix matrix, GenreVocabularyLibrary library) {
        this.matrix = matrix;
        this.library = library;
    }

    public static VocabularyFusion standard() {
        return new VocabularyFusion(GenreCompatibilityMatrix.standard(), GenreVocabularyLibrary.standard());
    }

    public GenreVocabularyLibrary library() {
        return library;
    }

    /**
     * @param strategy {@code null} to choose automatically
     * @throws com.fermata.common.exception.IncompatibleGenresException when the pair is unknown
     */
    public FusedVocabulary fuse(String primary, String secondary, double creativityLevel,
                                VocabularyStrategy strategy, Random rng) {
        CompatibilityEntry entry = matrix.require(primary, secondary);
        GenreVocabulary v1 = library.forGenre(entry.primary());
        GenreVocabulary v2 = library.forGenre(entry.secondary());
        BlendRule rule = library.blendRule(entry.primary(), entry.secondary());
        VocabularyStrategy chosen = strategy != null ? strategy : chooseStrategy(entry, rule, creativityLevel);

        Parts parts = switch (chosen) {
            case MERGE -> merge(v1, v2, rng);
            case ALTERNATE -> alternate(v1, v2, rng);
            case DOMINANT -> dominant(v1, v2, rng);
            case SYNTHESIZE -> synthesize(v1, v2, rule, rng);
            case LAYER -> layer(v1, v2, rng);
        };

        String dominantGenre = chosen == VocabularyStrategy.DOMINANT ? entry.primary() : entry.dominantGenre();
        double creativity = creativityFor(entry, chosen);
        log.debug("[VocabularyFusion] pair={}+{} strategy={} creativity={}",
            entry.primary(), entry.secondary(), chosen.id(), String.format("%.2f", creativity));
        return new FusedVocabulary(parts.primary(), parts.secondary(), parts.hybrids(), parts.blends(), parts.cultural(),
            chosen, dominantGenre, entry.primaryWeight(), entry.secondaryWeight(), entry.score(), creativity);
    }

    static VocabularyStrategy chooseStrategy(CompatibilityEntry entry, BlendRule rule, double creativityLevel) {
        if (rule != null) return rule.strategy();
        double score = entry.score();
        if (score < DOMINANT_BELOW) return VocabularyStrategy.DOMINANT;
        if (score >= SYNTHESIZE_COMPATIBILITY && creativityLevel >= SYNTHESIZE_CREATIVITY) {
            return VocabularyStrategy.SYNTHESIZE;
        }
        return switch (entry.fusionStyle()) {
            case COMPLEMENT -> score > 0.7 ? VocabularyStrategy.SYNTHESIZE : VocabularyStrategy.ALTERNATE;
            case CONTRAST -> score > 0.6 ? VocabularyStrategy.LAYER : VocabularyStrategy.DOMINANT;
            case HYBRID -> VocabularyStrategy.MERGE;
            case EVOLUTION -> VocabularyStrategy.SYNTHESIZE;
        };
    }

    static double creativityFor(CompatibilityEntry entry, VocabularyStrategy strategy) {
        double creativity = 0.5;
        creativity += switch (strategy) {
            case SYNTHESIZE -> 0.3;
            case LAYER -> 0.2;
            case ALTERNATE -> 0.1;
            default -> 0.0;
        };
        creativity += entry.score() * 0.2;
        if (entry.fusionStyle() == FusionStyle.CONTRAST) creativity += 0.1;
        else if (entry.fusionStyle() == FusionStyle.HYBRID) creativity += 0.2;
        return Math.max(0, Math.min(1, creativity));
    }

    // ── strategies ───────────────────────────────────────────────────────────

    private record Parts(List<String> primary, List<String> secondary, List<String> hybrids,
                         List<String> blends, List<String> cultural) {}

    private Parts merge(GenreVocabulary v1, GenreVocabulary v2, Random rng) {
        LinkedHashSet<String> primary = new LinkedHashSet<>();
        primary.addAll(v1.coreTerms());
        primary.addAll(v2.coreTerms());
        primary.addAll(head(v1.adjectives(), 5));
        primary.addAll(head(v2.adjectives(), 5));
        LinkedHashSet<String> secondary = new LinkedHashSet<>();
        for (GenreVocabulary v : List.of(v1, v2)) secondary.addAll(v.instrumentalTerms());
        for (GenreVocabulary v : List.of(v1, v2)) secondary.addAll(v.culturalTerms());
        for (GenreVocabulary v : List.of(v1, v2)) secondary.addAll(v.emotionalTerms());
        return new Parts(new ArrayList<>(primary), new ArrayList<>(secondary),
            hybridTerms(v1, v2, rng), conceptualBlends(v1, v2, rng), culturalFusions(v1, v2, rng));
    }

    private Parts alternate(GenreVocabulary v1, GenreVocabulary v2, Random rng) {
        LinkedHashSet<String> primary = new LinkedHashSet<>();
        int max = Math.max(v1.coreTerms().size(), v2.coreTerms().size());
        for (int i = 0; i < max; i++) {
            if (i < v1.coreTerms().size()) primary.add(v1.coreTerms().get(i));
            if (i < v2.coreTerms().size()) primary.add(v2.coreTerms().get(i));
        }
        LinkedHashSet<String> secondary = new LinkedHashSet<>();
        for (int i = 0; i < 10; i++) {
            if (i < v1.instrumentalTerms().size()) secondary.add(v1.instrumentalTerms().get(i));
            if (i < v2.instrumentalTerms().size()) secondary.add(v2.instrumentalTerms().get(i));
        }
        return new Parts(new ArrayList<>(primary), new ArrayList<>(secondary),
            hybridTerms(v1, v2, rng), conceptualBlends(v1, v2, rng), culturalFusions(v1, v2, rng));
    }

    /** The primary genre dominates; the secondary contributes accents. */
    private Parts dominant(GenreVocabulary dominant, GenreVocabulary accent, Random rng) {
        LinkedHashSet<String> primary = new LinkedHashSet<>(dominant.coreTerms());
        primary.addAll(head(dominant.adjectives(), 6));
        primary.addAll(head(accent.coreTerms(), 3));
        LinkedHashSet<String> secondary = new LinkedHashSet<>(dominant.instrumentalTerms());
        secondary.addAll(dominant.culturalTerms());
        secondary.addAll(head(accent.adjectives(), 3));
        secondary.addAll(head(accent.emotionalTerms(), 3));
        return new Parts(new ArrayList<>(primary), new ArrayList<>(secondary),
            hybridTerms(dominant, accent, rng), conceptualBlends(dominant, accent, rng),
            culturalFusions(dominant, accent, rng));
    }

    private Parts synthesize(GenreVocabulary v1, GenreVocabulary v2, BlendRule rule, Random rng) {
        List<String> synthesized = new ArrayList<>();
        if (rule != null) {
            boolean aligned = rule.firstGenre().equals(v1.genre());
            GenreVocabulary r1 = aligned ? v1 : v2;
            GenreVocabulary r2 = aligned ? v2 : v1;
            for (String pattern : rule.fusionPatterns()) {
                for (int i = 0; i < 3; i++) {
                    String term = applyPattern(pattern, r1, r2, rule, rng);
                    if (term != null) synthesized.add(term);
                }
            }
        }
        List<String> compounds = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            String w1 = pick(concat(v1.coreTerms(), v1.adjectives()), rng);
            String w2 = pick(concat(v2.coreTerms(), v2.instrumentalTerms()), rng);
            if (!w1.isEmpty() && !w2.isEmpty()) {
                compounds.add(PhraseText.capitalize(squash(w1) + squash(w2)));
            }
        }
        List<String> prefixes = rule != null ? rule.hybridPrefixes() : List.of("neo", "proto", "meta", "ultra");
        for (int i = 0; i < 4; i++) {
            String core = pick(concat(v1.coreTerms(), v2.coreTerms()), rng);
            if (!core.isEmpty()) compounds.add(PhraseText.capitalize(pick(prefixes, rng) + squash(core)));
        }

        List<String> concepts1 = concat(v1.metaphoricalTerms(), v1.culturalTerms());
        List<String> concepts2 = concat(v2.metaphoricalTerms(), v2.culturalTerms());
        List<String> synthesis = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            String c1 = pick(concepts1, rng);
            String c2 = pick(concepts2, rng);
            if (c1.isEmpty() || c2.isEmpty()) continue;
            synthesis.add("The " + PhraseText.titleCase(c1) + " of " + PhraseText.titleCase(c2));
            synthesis.add(PhraseText.titleCase(c1) + "-" + PhraseText.titleCase(c2) + " Synthesis");
        }

        List<String> hybrids = new ArrayList<>(synthesized);
        hybrids.addAll(compounds);
        return new Parts(head(synthesized.isEmpty() ? compounds : synthesized, 8), head(compounds, 10),
            hybrids, synthesis, culturalFusions(v1, v2, rng));
    }

    private Parts layer(GenreVocabulary v1, GenreVocabulary v2, Random rng) {
        LinkedHashSet<String> primary = new LinkedHashSet<>();
        primary.addAll(head(v1.coreTerms(), 4));
        primary.addAll(head(v2.coreTerms(), 4));
        primary.addAll(head(v1.adjectives(), 4));
        primary.addAll(head(v2.adjectives(), 4));
        LinkedHashSet<String> secondary = new LinkedHashSet<>();
        secondary.addAll(head(v1.culturalTerms(), 3));
        secondary.addAll(head(v2.culturalTerms(), 3));
        secondary.addAll(head(v1.emotionalTerms(), 3));
        secondary.addAll(head(v2.emotionalTerms(), 3));
        secondary.addAll(head(v1.technicalTerms(), 3));
        secondary.addAll(head(v2.technicalTerms(), 3));

        List<String> layered = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            String modifier = pick(v1.intensityModifiers(), rng);
            String core = pick(v2.coreTerms(), rng);
            String adjective = pick(v1.adjectives(), rng);
            if (!modifier.isEmpty() && !core.isEmpty() && !adjective.isEmpty()) {
                layered.add(PhraseText.titleCase(modifier + " " + core + " " + adjective));
            }
        }
        return new Parts(new ArrayList<>(primary), new ArrayList<>(secondary), layered,
            conceptualBlends(v1, v2, rng), culturalFusions(v1, v2, rng));
    }

    // ── construct generators ─────────────────────────────────────────────────

    List<String> hybridTerms(GenreVocabulary v1, GenreVocabulary v2, Random rng) {
        List<String> hybrids = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            String t1 = squash(pick(v1.coreTerms(), rng));
            String t2 = squash(pick(v2.coreTerms(), rng));
            if (t1.length() > 3 && t2.length() > 3) {
                String portmanteau = t1.substring(0, (t1.length() + 1) / 2) + t2.substring(t2.length() / 2);
                hybrids.add(PhraseText.capitalize(portmanteau));
            }
        }
        for (int i = 0; i < 4; i++) {
            String adjective = pick(v1.adjectives(), rng);
            String noun = pick(v2.coreTerms(), rng);
            if (!adjective.isEmpty() && !noun.isEmpty()) hybrids.add(PhraseText.titleCase(adjective + " " + noun));
        }
        for (int i = 0; i < 3; i++) {
            String core = squash(pick(concat(v1.coreTerms(), v2.coreTerms()), rng));
            if (!core.isEmpty()) hybrids.add(PhraseText.capitalize(pick(HYBRID_PREFIXES, rng) + core));
        }
        return hybrids;
    }

    private List<String> conceptualBlends(GenreVocabulary v1, GenreVocabulary v2, Random rng) {
        List<String> blends = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            String c1 = v1.metaphoricalTerms().isEmpty() ? pick(v1.coreTerms(), rng) : pick(v1.metaphoricalTerms(), rng);
            String c2 = v2.metaphoricalTerms().isEmpty() ? pick(v2.coreTerms(), rng) : pick(v2.metaphoricalTerms(), rng);
            if (!c1.isEmpty() && !c2.isEmpty()) {
                blends.add(PhraseText.titleCase(c1) + " " + pick(BRIDGE_WORDS, rng) + " " + PhraseText.titleCase(c2));
            }
        }
        return blends;
    }

    private List<String> culturalFusions(GenreVocabulary v1, GenreVocabulary v2, Random rng) {
        List<String> fusions = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            String c1 = pick(v1.culturalTerms(), rng);
            String c2 = pick(v2.culturalTerms(), rng);
            if (c1.isEmpty() || c2.isEmpty()) continue;
            fusions.add(PhraseText.titleCase(c1) + " " + PhraseText.titleCase(c2) + " Collective");
            fusions.add("Cross-" + PhraseText.titleCase(c1) + " " + PhraseText.titleCase(c2));
        }
        return fusions;
    }

    private String applyPattern(String pattern, GenreVocabulary g1, GenreVocabulary g2, BlendRule rule, Random rng) {
        String result = pattern
            .replace("{genre1_term}", pick(g1.coreTerms(), rng))
            .replace("{genre2_term}", pick(g2.coreTerms(), rng))
            .replace("{genre1_concept}", pick(g1.metaphoricalTerms(), rng))
            .replace("{genre2_concept}", pick(g2.metaphoricalTerms(), rng))
            .replace("{genre1_technique}", pick(g1.technicalTerms(), rng))
            .replace("{genre2_technique}", pick(g2.technicalTerms(), rng))
            .replace("{genre1_instrument}", pick(g1.instrumentalTerms(), rng))
            .replace("{genre2_instrument}", pick(g2.instrumentalTerms(), rng))
            .replace("{hybrid_prefix}", pick(rule.hybridPrefixes(), rng))
            .replace("{hybrid_suffix}", pick(rule.hybridSuffixes(), rng))
            .replace("{bridge}", pick(rule.conceptualBridges(), rng));
        result = UNFILLED.matcher(result).replaceAll("").replaceAll("\\s+", " ").trim();
        return result.length() > 3 ? PhraseText.titleCase(result) : null;
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static String pick(List<String> options, Random rng) {
        return options.isEmpty() ? "" : options.get(rng.nextInt(options.size()));
    }

    private static List<String> head(List<String> list, int n) {
        return list.subList(0, Math.min(n, list.size()));
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> all = new ArrayList<>(a);
        all.addAll(b);
        return all;
    }

    /** Drops spaces and hyphens so a multi-word term can join a compound. */
    private static String squash(String term) {
        return term.replace(" ", "").replace("-", "").toLowerCase();
    }
}
