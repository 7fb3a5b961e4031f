package com.fermata.common.fusion;

import com.fermata.common.genre.FusedVocabulary;
import com.fermata.common.selection.SelectionCriteria;
import com.fermata.common.template.GenerationContext;
import com.fermata.common.template.NameType;
import com.fermata.common.template.PhraseText;
import com.fermata.common.template.Template;
import com.fermata.common.template.TemplateGenerator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The built-in {@link FusionStrategy} for every {@link FusionMethod}.
 *
 * <p>All strategies title-case their output and report the fusion constructs the name contains.
 * None of them validates length; the engine does.
 */
public final class FusionStrategies {

    private FusionStrategies() {}

    static final List<List<String>> CONTRAST_PAIRS = List.of(
        List.of("organic", "synthetic"),
        List.of("traditional", "futuristic"),
        List.of("acoustic", "electronic"),
        List.of("simple", "complex"),
        List.of("raw", "refined")
    );

    static final Map<String, List<String>> SYNERGY_KEYWORDS = Map.of(
        "energy",     List.of("power", "electric", "dynamic", "vibrant", "drive"),
        "rhythm",     List.of("beat", "pulse", "flow", "groove", "rhythm"),
        "harmony",    List.of("chord", "melody", "harmonic", "tonal", "harmony"),
        "innovation", List.of("new", "modern", "creative", "fresh", "experimental"),
        "tradition",  List.of("classic", "heritage", "authentic", "roots", "story"),
        "improvis",   List.of("improv", "swing", "freestyle", "jam", "spontaneous")
    );

    private static final Map<FusionMethod, FusionStrategy> STANDARD = buildStandard();

    /** Strategy for the method; never {@code null}. */
    public static FusionStrategy forMethod(FusionMethod method) {
        return STANDARD.getOrDefault(method, FusionStrategies::defaultFusion);
    }

    private static Map<FusionMethod, FusionStrategy> buildStandard() {
        Map<FusionMethod, FusionStrategy> map = new EnumMap<>(FusionMethod.class);
        map.put(FusionMethod.PATTERN_SYNTHESIS, FusionStrategies::patternSynthesis);
        map.put(FusionMethod.PATTERN_INTERWEAVING, FusionStrategies::patternInterweaving);
        map.put(FusionMethod.PATTERN_BLENDING, FusionStrategies::patternBlending);
        map.put(FusionMethod.VOCABULARY_FUSION, FusionStrategies::vocabularyFusion);
        map.put(FusionMethod.VOCABULARY_ALTERNATION, FusionStrategies::vocabularyAlternation);
        map.put(FusionMethod.VOCABULARY_MUTATION, FusionStrategies::vocabularyMutation);
        map.put(FusionMethod.COMPLEMENTARY_FUSION, FusionStrategies::complementaryFusion);
        map.put(FusionMethod.CONTRASTING_FUSION, FusionStrategies::contrastingFusion);
        map.put(FusionMethod.HYBRID_CONSTRUCTION, FusionStrategies::hybridConstruction);
        map.put(FusionMethod.CONCEPTUAL_BRIDGING, FusionStrategies::conceptualBridging);
        map.put(FusionMethod.STRUCTURAL_LAYERING, FusionStrategies::structuralLayering);
        map.put(FusionMethod.GENTLE_INFUSION, FusionStrategies::gentleInfusion);
        map.put(FusionMethod.ACCENT_INTEGRATION, FusionStrategies::accentIntegration);
        map.put(FusionMethod.THEMATIC_SUGGESTION, FusionStrategies::thematicSuggestion);
        map.put(FusionMethod.DEFAULT, FusionStrategies::defaultFusion);
        return Collections.unmodifiableMap(map);
    }

    // ── pattern-based ────────────────────────────────────────────────────────

    /** A pre-authored template for the genre pair, when one exists. */
    static Optional<FusionCandidate> patternSynthesis(FusionContext ctx) {
        List<PairFusionTemplate> templates = PairFusionTemplates.forPair(
            ctx.request().primaryGenre(), ctx.request().secondaryGenre());
        if (templates.isEmpty()) return Optional.empty();
        PairFusionTemplate template = templates.get(ctx.random().nextInt(templates.size()));
        String name = template.generate(ctx.wordCount(), ctx.vocabulary(), ctx.random());
        return candidate(name, FusionMethod.PATTERN_SYNTHESIS, List.of(template.id()), ctx.vocabulary());
    }

    /** One template per genre, generated independently and interleaved word by word. */
    static Optional<FusionCandidate> patternInterweaving(FusionContext ctx) {
        int partLength = Math.max(1, ctx.wordCount() - 1);
        Template first = selectFor(ctx, ctx.request().primaryGenre(), partLength);
        Template second = selectFor(ctx, ctx.request().secondaryGenre(), partLength);
        if (first == null || second == null) return Optional.empty();

        List<String> words1 = PhraseText.words(generate(ctx, first, ctx.request().primaryGenre(), partLength));
        List<String> words2 = PhraseText.words(generate(ctx, second, ctx.request().secondaryGenre(), partLength));
        List<String> woven = new ArrayList<>();
        int longest = Math.max(words1.size(), words2.size());
        for (int i = 0; i < longest && woven.size() < ctx.wordCount(); i++) {
            if (i < words1.size()) woven.add(words1.get(i));
            if (i < words2.size() && woven.size() < ctx.wordCount()) woven.add(words2.get(i));
        }
        return candidate(String.join(" ", woven), FusionMethod.PATTERN_INTERWEAVING,
            List.of(first.id(), second.id()), ctx.vocabulary());
    }

    /** A primary-genre template with one position swapped for a secondary-genre word. */
    static Optional<FusionCandidate> patternBlending(FusionContext ctx) {
        Template template = selectFor(ctx, ctx.request().primaryGenre(), ctx.wordCount());
        if (template == null) return Optional.empty();
        List<String> words = new ArrayList<>(PhraseText.words(
            generate(ctx, template, ctx.request().primaryGenre(), ctx.wordCount())));
        List<String> accents = singles(ctx.vocabulary().secondaryWords());
        if (words.isEmpty() || accents.isEmpty()) return Optional.empty();
        int position = ctx.random().nextInt(words.size());
        if (words.size() > 1 && "the".equalsIgnoreCase(words.get(position))) position = words.size() - 1;
        words.set(position, PhraseText.pick(accents, ctx.random(), words.get(position)));
        return candidate(String.join(" ", words), FusionMethod.PATTERN_BLENDING, List.of(template.id()), ctx.vocabulary());
    }

    // ── vocabulary-based ─────────────────────────────────────────────────────

    /** Optionally seeded with a hybrid term, then filled from the fused word lists. */
    static Optional<FusionCandidate> vocabularyFusion(FusionContext ctx) {
        FusedVocabulary v = ctx.vocabulary();
        Random rng = ctx.random();
        List<String> words = new ArrayList<>();
        if (!v.hybridTerms().isEmpty() && rng.nextDouble() > 0.4) {
            String hybrid = PhraseText.pick(v.hybridTerms(), rng, "");
            if (PhraseText.wordCount(hybrid) <= ctx.wordCount()) words.addAll(PhraseText.words(hybrid));
        }
        fill(words, ctx.wordCount(), rng, singles(v.primaryWords()), singles(v.secondaryWords()));
        return candidate(String.join(" ", words), FusionMethod.VOCABULARY_FUSION, List.of("vocabulary_fusion"), v);
    }

    /** Primary and secondary words taking turns. */
    static Optional<FusionCandidate> vocabularyAlternation(FusionContext ctx) {
        FusedVocabulary v = ctx.vocabulary();
        List<String> primary = singles(v.primaryWords());
        List<String> secondary = singles(v.secondaryWords());
        if (primary.isEmpty() || secondary.isEmpty()) return Optional.empty();
        List<String> words = new ArrayList<>();
        for (int i = 0; i < ctx.wordCount() * 3 && words.size() < ctx.wordCount(); i++) {
            String word = PhraseText.pick(i % 2 == 0 ? primary : secondary, ctx.random(), "");
            if (!words.contains(word)) words.add(word);
        }
        return candidate(String.join(" ", words), FusionMethod.VOCABULARY_ALTERNATION,
            List.of("vocabulary_alternation"), v);
    }

    /** Single-word hybrids (portmanteaus, prefixed cores) as the name's anchor. */
    static Optional<FusionCandidate> vocabularyMutation(FusionContext ctx) {
        FusedVocabulary v = ctx.vocabulary();
        List<String> mutations = singles(v.hybridTerms());
        if (mutations.isEmpty()) return Optional.empty();
        List<String> words = new ArrayList<>();
        words.add(PhraseText.pick(mutations, ctx.random(), ""));
        fill(words, ctx.wordCount(), ctx.random(), singles(v.primaryWords()), singles(v.secondaryWords()));
        return candidate(String.join(" ", words), FusionMethod.VOCABULARY_MUTATION, List.of("vocabulary_mutation"), v);
    }

    // ── relationship-based ───────────────────────────────────────────────────

    /** Words tied to the pair's synergies, e.g. "rhythm" synergies pull in pulse or groove terms. */
    static Optional<FusionCandidate> complementaryFusion(FusionContext ctx) {
        List<String> pool = singles(concat(ctx.vocabulary().primaryWords(), ctx.vocabulary().secondaryWords()));
        Set<String> synergistic = new LinkedHashSet<>();
        for (String synergy : ctx.entry().synergies()) {
            String lower = synergy.toLowerCase(Locale.ROOT);
            SYNERGY_KEYWORDS.forEach((concept, keywords) -> {
                if (!lower.contains(concept)) return;
                pool.stream()
                    .filter(term -> keywords.stream().anyMatch(k -> term.toLowerCase(Locale.ROOT).contains(k)))
                    .forEach(synergistic::add);
            });
        }
        if (synergistic.isEmpty()) return Optional.empty();

        List<String> shuffled = new ArrayList<>(synergistic);
        Collections.shuffle(shuffled, ctx.random());
        List<String> words = new ArrayList<>(shuffled.subList(0, Math.min(ctx.wordCount(), shuffled.size())));
        fill(words, ctx.wordCount(), ctx.random(), singles(ctx.vocabulary().primaryWords()));
        return candidate(String.join(" ", words), FusionMethod.COMPLEMENTARY_FUSION,
            List.of("complementary_fusion"), ctx.vocabulary());
    }

    /** Two opposing concepts, organic/synthetic and the like, set side by side. */
    static Optional<FusionCandidate> contrastingFusion(FusionContext ctx) {
        List<String> pair = CONTRAST_PAIRS.get(ctx.random().nextInt(CONTRAST_PAIRS.size()));
        List<String> pool = singles(concat(ctx.vocabulary().primaryWords(), ctx.vocabulary().secondaryWords()));
        List<String> words = new ArrayList<>();
        for (String concept : pair) {
            if (words.size() >= ctx.wordCount()) break;
            List<String> matches = pool.stream()
                .filter(w -> w.toLowerCase(Locale.ROOT).contains(concept))
                .collect(Collectors.toList());
            words.add(PhraseText.pick(matches, ctx.random(), concept));
        }
        fill(words, ctx.wordCount(), ctx.random(), singles(ctx.vocabulary().primaryWords()));
        return candidate(String.join(" ", words), FusionMethod.CONTRASTING_FUSION,
            List.of("contrasting_fusion"), ctx.vocabulary());
    }

    /** A conceptual blend as the whole name, or a cultural fusion when there is none. */
    static Optional<FusionCandidate> hybridConstruction(FusionContext ctx) {
        FusedVocabulary v = ctx.vocabulary();
        if (!v.conceptualBlends().isEmpty()) {
            String blend = PhraseText.pick(v.conceptualBlends(), ctx.random(), "");
            return candidate(blend, FusionMethod.HYBRID_CONSTRUCTION, List.of("conceptual_construction"), v);
        }
        if (!v.culturalFusions().isEmpty()) {
            String fusion = PhraseText.pick(v.culturalFusions(), ctx.random(), "");
            return candidate(fusion, FusionMethod.HYBRID_CONSTRUCTION, List.of("cultural_construction"), v);
        }
        return Optional.empty();
    }

    /** The conceptual blend closest to the requested length. */
    static Optional<FusionCandidate> conceptualBridging(FusionContext ctx) {
        return closest(ctx.vocabulary().conceptualBlends(), ctx)
            .flatMap(blend -> candidate(blend, FusionMethod.CONCEPTUAL_BRIDGING, List.of("conceptual_bridging"), ctx.vocabulary()));
    }

    /** A secondary-genre word framing primary-genre words. */
    static Optional<FusionCandidate> structuralLayering(FusionContext ctx) {
        List<String> outer = singles(ctx.vocabulary().secondaryWords());
        List<String> inner = singles(ctx.vocabulary().primaryWords());
        if (outer.isEmpty() || inner.isEmpty()) return Optional.empty();
        List<String> words = new ArrayList<>();
        words.add(PhraseText.pick(outer, ctx.random(), ""));
        fill(words, ctx.wordCount(), ctx.random(), inner);
        return candidate(String.join(" ", words), FusionMethod.STRUCTURAL_LAYERING, List.of("structural_layering"), ctx.vocabulary());
    }

    // ── subtle ───────────────────────────────────────────────────────────────

    /** Primary-genre words with a single secondary accent closing the name. */
    static Optional<FusionCandidate> gentleInfusion(FusionContext ctx) {
        List<String> primary = singles(ctx.vocabulary().primaryWords());
        List<String> accents = singles(ctx.vocabulary().secondaryWords());
        if (primary.isEmpty()) return Optional.empty();
        List<String> words = new ArrayList<>();
        fill(words, Math.max(1, ctx.wordCount() - 1), ctx.random(), primary);
        if (ctx.wordCount() > 1 && !accents.isEmpty()) {
            fill(words, ctx.wordCount(), ctx.random(), accents);
        }
        return candidate(String.join(" ", words), FusionMethod.GENTLE_INFUSION, List.of("gentle_infusion"), ctx.vocabulary());
    }

    /** Primary-genre words with one position replaced by a single-word hybrid. */
    static Optional<FusionCandidate> accentIntegration(FusionContext ctx) {
        List<String> primary = singles(ctx.vocabulary().primaryWords());
        List<String> hybrids = singles(ctx.vocabulary().hybridTerms());
        if (primary.isEmpty() || hybrids.isEmpty()) return Optional.empty();
        List<String> words = new ArrayList<>();
        fill(words, ctx.wordCount(), ctx.random(), primary);
        if (words.isEmpty()) return Optional.empty();
        words.set(ctx.random().nextInt(words.size()), PhraseText.pick(hybrids, ctx.random(), ""));
        return candidate(String.join(" ", words), FusionMethod.ACCENT_INTEGRATION, List.of("accent_integration"), ctx.vocabulary());
    }

    /** The cultural fusion closest to the requested length. */
    static Optional<FusionCandidate> thematicSuggestion(FusionContext ctx) {
        return closest(ctx.vocabulary().culturalFusions(), ctx)
            .flatMap(fusion -> candidate(fusion, FusionMethod.THEMATIC_SUGGESTION, List.of("thematic_suggestion"), ctx.vocabulary()));
    }

    /** Plain concatenation from the fused lists; always produces something. */
    static Optional<FusionCandidate> defaultFusion(FusionContext ctx) {
        FusedVocabulary v = ctx.vocabulary();
        List<String> words = new ArrayList<>();
        fill(words, ctx.wordCount(), ctx.random(), singles(v.primaryWords()), singles(v.secondaryWords()));
        if (words.isEmpty()) words.add("Fusion");
        if (words.size() < ctx.wordCount()) words.add("Blend");
        return candidate(String.join(" ", words), FusionMethod.DEFAULT, List.of("default_fusion"), v);
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static Template selectFor(FusionContext ctx, String genre, int wordCount) {
        SelectionCriteria criteria = SelectionCriteria.of(wordCount, genre, ctx.request().mood())
            .withCreativity(SelectionCriteria.Creativity.BALANCED);
        return ctx.selection().select(criteria, ctx.source(), ctx.session());
    }

    private static String generate(FusionContext ctx, Template template, String genre, int wordCount) {
        GenerationContext generation = new GenerationContext(genre, ctx.request().mood(), NameType.BAND, wordCount);
        return TemplateGenerator.generate(template, ctx.source(), generation, ctx.random());
    }

    /**
     * Adds unique words until the phrase has {@code target} words. The n-th word is drawn from
     * the n-th pool; the last pool serves every later position, and an empty pool defers to the
     * first non-empty one.
     */
    @SafeVarargs
    static void fill(List<String> words, int target, Random rng, List<String>... pools) {
        int budget = target * 6;
        while (PhraseText.wordCount(String.join(" ", words)) < target && budget-- > 0) {
            int filled = words.size();
            List<String> pool = pools.length == 0 ? List.of() : pools[Math.min(filled, pools.length - 1)];
            if (pool.isEmpty()) pool = firstNonEmpty(pools);
            if (pool.isEmpty()) return;
            String word = PhraseText.pick(pool, rng, "");
            if (!word.isEmpty() && words.stream().noneMatch(word::equalsIgnoreCase)) words.add(word);
        }
    }

    @SafeVarargs
    private static List<String> firstNonEmpty(List<String>... pools) {
        for (List<String> pool : pools) {
            if (!pool.isEmpty()) return pool;
        }
        return List.of();
    }

    private static Optional<String> closest(List<String> phrases, FusionContext ctx) {
        if (phrases.isEmpty()) return Optional.empty();
        int best = phrases.stream()
            .mapToInt(p -> Math.abs(PhraseText.wordCount(p) - ctx.wordCount()))
            .min()
            .orElse(Integer.MAX_VALUE);
        List<String> closest = phrases.stream()
            .filter(p -> Math.abs(PhraseText.wordCount(p) - ctx.wordCount()) == best)
            .collect(Collectors.toList());
        return Optional.of(PhraseText.pick(closest, ctx.random(), closest.get(0)));
    }

    static List<String> singles(List<String> terms) {
        return terms.stream().filter(t -> !t.isBlank() && !t.contains(" ")).collect(Collectors.toList());
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> all = new ArrayList<>(a);
        all.addAll(b);
        return all;
    }

    private static Optional<FusionCandidate> candidate(String rawName, FusionMethod method, List<String> sources,
                                                      FusedVocabulary vocabulary) {
        if (rawName == null || rawName.isBlank()) return Optional.empty();
        String name = PhraseText.titleCase(rawName);
        return Optional.of(new FusionCandidate(name, method, sources, fusionElements(name, vocabulary)));
    }

    /** Hybrid and blend constructs that occur in {@code name}, case-insensitive. */
    static List<String> fusionElements(String name, FusedVocabulary vocabulary) {
        String lower = name.toLowerCase(Locale.ROOT);
        List<String> found = new ArrayList<>();
        for (List<String> list : List.of(vocabulary.hybridTerms(), vocabulary.conceptualBlends(), vocabulary.culturalFusions())) {
            for (String term : list) {
                if (!term.isBlank() && lower.contains(term.toLowerCase(Locale.ROOT)) && !found.contains(term)) {
                    found.add(term);
                }
            }
        }
        return found;
    }
}
