package com.fermata.generation.service;

import com.fermata.common.atmosphere.AtmosphericContext;
import com.fermata.common.atmosphere.BlendWeights;
import com.fermata.common.exception.GenerationException;
import com.fermata.common.fusion.FusionEngine;
import com.fermata.common.fusion.FusionExplanations;
import com.fermata.common.fusion.FusionIntensity;
import com.fermata.common.fusion.FusionMetadata;
import com.fermata.common.fusion.FusionResult;
import com.fermata.common.guard.RepetitionGuard;
import com.fermata.common.memory.GlobalNameMemory;
import com.fermata.common.mood.MoodModifier;
import com.fermata.common.selection.SelectionEngine;
import com.fermata.common.selection.SelectionSession;
import com.fermata.common.template.DynamicPhraseAssembler;
import com.fermata.common.template.GenerationContext;
import com.fermata.common.template.NameType;
import com.fermata.common.template.PhraseText;
import com.fermata.common.template.Template;
import com.fermata.common.template.TemplateGenerator;
import com.fermata.common.trace.TraceContextUtil;
import com.fermata.common.wordsource.WordSource;
import com.fermata.generation.logger.GenerationFlowLogger;
import com.fermata.generation.model.GeneratedName;
import com.fermata.generation.model.GenerationRequest;
import com.fermata.generation.model.NameSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.context.ContextView;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Runs one generation request end to end.
 *
 * <p><strong>Flow:</strong>
 * <ol>
 *   <li>Normalise the request into a {@link GenerationPlan}; invalid input fails with
 *       {@link IllegalArgumentException}.</li>
 *   <li>Build the {@link WordSource} through {@link WordSourceService}.</li>
 *   <li>Generate through template selection, or genre fusion when a secondary genre is set.</li>
 *   <li>Admit each candidate only if the {@link GlobalNameMemory} and the shared
 *       {@link RepetitionGuard} both let it through.</li>
 *   <li>Fill any shortfall with {@link DynamicPhraseAssembler}, then the {@link FallbackNamePool}.</li>
 *   <li>Rank by quality, keep the top {@code count}, remember them. Only the templates behind
 *       returned names are recorded in the guard.</li>
 * </ol>
 *
 * <p>Any {@link GenerationException} from the core degrades to the next step instead of failing
 * the request, so the response always holds at least {@code min(count, fallback pool size)} names.
 */
@Service
public class GenerationDriver {

    private static final Logger log = LoggerFactory.getLogger(GenerationDriver.class);

    static final String OPEN_RANGE = "4+";
    static final int OPEN_RANGE_MIN = 4;
    static final int OPEN_RANGE_MAX = 6;
    static final int MAX_WORD_COUNT = 10;
    static final int DEFAULT_WORD_COUNT = 2;
    static final int SELECTION_ROUNDS = 3;
    static final int DYNAMIC_ATTEMPTS_PER_NAME = 5;

    private final SelectionEngine selection;
    private final FusionEngine fusion;
    private final RepetitionGuard guard;
    private final GlobalNameMemory memory;
    private final WordSourceService wordSources;
    private final FallbackNamePool fallbackPool;
    private final GenerationFlowLogger flowLogger;
    private final BlendWeights atmosphereWeights;
    private final Supplier<Random> randomSource;
    private final int defaultCount;
    private final int maxCount;

    public GenerationDriver(SelectionEngine selection,
                            FusionEngine fusion,
                            RepetitionGuard guard,
                            GlobalNameMemory memory,
                            WordSourceService wordSources,
                            FallbackNamePool fallbackPool,
                            GenerationFlowLogger flowLogger,
                            BlendWeights atmosphereWeights,
                            Supplier<Random> randomSource,
                            @Value("${fermata.generation.default-count:4}") int defaultCount,
                            @Value("${fermata.generation.max-count:20}") int maxCount) {
        this.selection    = selection;
        this.fusion       = fusion;
        this.guard        = guard;
        this.memory       = memory;
        this.wordSources  = wordSources;
        this.fallbackPool = fallbackPool;
        this.flowLogger   = flowLogger;
        this.atmosphereWeights = atmosphereWeights;
        this.randomSource = randomSource;
        this.defaultCount = defaultCount;
        this.maxCount     = maxCount;
    }

    public Mono<List<GeneratedName>> generate(GenerationRequest request) {
        Mono<List<GeneratedName>> pipeline = Mono.fromCallable(() -> normalize(request, randomSource.get()))
            .flatMap(plan -> Mono.deferContextual(ctx -> {
                flowLogger.log(ctx, GenerationFlowLogger.REQUEST_RECEIVED, plan.describe());
                return wordSources.build(plan.genre(), plan.mood())
                    .doOnEach(flowLogger.stage(GenerationFlowLogger.WORD_SOURCE_BUILT))
                    .map(source -> assemble(plan, source, ctx));
            }))
            .doOnEach(flowLogger.stage(GenerationFlowLogger.RESPONSE_ASSEMBLED));

        return Mono.deferContextual(ctx -> ctx.hasKey(TraceContextUtil.TRACE_ID_KEY)
            ? pipeline
            : TraceContextUtil.withTraceId(pipeline, TraceContextUtil.newTraceId()));
    }

    // ── normalisation ────────────────────────────────────────────────────────

    GenerationPlan normalize(GenerationRequest request, Random rng) {
        if (request == null) throw new IllegalArgumentException("request body is required");

        String genre = lower(request.getGenre());
        String secondary = lower(request.getSecondaryGenre());
        if (secondary != null && genre == null) {
            throw new IllegalArgumentException("secondary_genre requires genre");
        }

        double creativity = request.getCreativityLevel() == null ? 0.5 : request.getCreativityLevel();
        if (creativity < 0.0 || creativity > 1.0) {
            throw new IllegalArgumentException("creativity_level must be within [0, 1]: " + creativity);
        }

        List<MoodModifier> modifiers = request.getMoodModifiers() == null ? List.of()
            : request.getMoodModifiers().stream()
                .map(MoodModifier::fromId)
                .filter(Objects::nonNull)
                .collect(Collectors.toList());

        Set<String> avoid = request.getAvoidCategories() == null ? Set.of()
            : request.getAvoidCategories().stream()
                .map(GenerationDriver::lower)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        AtmosphericContext atmosphere = AtmosphericContext.parse(request.getAtmosphere(), request.getTimeOfDay(),
            request.getSeasonalMood(), request.getWeather(), request.getCulture())
            .withWeights(atmosphereWeights);

        return new GenerationPlan(
            NameType.fromString(request.getType()),
            genre,
            secondary,
            lower(request.getMood()),
            parseWordCount(request.getWordCount(), rng),
            normalizeCount(request.getCount()),
            modifiers,
            avoid,
            atmosphere,
            FusionIntensity.fromId(request.getIntensity()),
            creativity,
            request.getPreserveAuthenticity() == null || request.getPreserveAuthenticity(),
            Boolean.TRUE.equals(request.getCulturalSensitivity()),
            rng);
    }

    /** An integer in [1, 10], or {@code "4+"} for a random length in [4, 6]. */
    static int parseWordCount(String raw, Random rng) {
        if (raw == null || raw.isBlank()) return DEFAULT_WORD_COUNT;
        String value = raw.trim();
        if (OPEN_RANGE.equals(value)) {
            return OPEN_RANGE_MIN + rng.nextInt(OPEN_RANGE_MAX - OPEN_RANGE_MIN + 1);
        }
        int wordCount;
        try {
            wordCount = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("word_count must be an integer or \"4+\": " + raw, e);
        }
        if (wordCount < 1 || wordCount > MAX_WORD_COUNT) {
            throw new IllegalArgumentException("word_count must be within [1, " + MAX_WORD_COUNT + "]: " + wordCount);
        }
        return wordCount;
    }

    int normalizeCount(Integer count) {
        if (count == null) return defaultCount;
        if (count < 1) throw new IllegalArgumentException("count must be >= 1: " + count);
        return Math.min(count, maxCount);
    }

    // ── generation ───────────────────────────────────────────────────────────

    List<GeneratedName> assemble(GenerationPlan plan, WordSource source, ContextView ctx) {
        int decayed = guard.decayIfDue();
        if (decayed > 0) log.debug("[Driver] guard decay passes={}", decayed);

        SelectionSession session = new SelectionSession(guard, plan.random());
        List<GeneratedName> names = new ArrayList<>();
        Map<String, Template> producedBy = new HashMap<>();

        try {
            names.addAll(plan.isFusion()
                ? fusionCandidates(plan, source, session)
                : templateCandidates(plan, source, session, producedBy));
        } catch (GenerationException e) {
            log.warn("[Driver] Generation path failed, degrading. component={} reason={}",
                     e.getComponent(), e.getMessage());
        }
        flowLogger.log(ctx, GenerationFlowLogger.CANDIDATES_GENERATED,
            "path=" + (plan.isFusion() ? NameSource.FUSION.id() : NameSource.TEMPLATE.id()) + " wordCount=" + plan.wordCount());
        flowLogger.log(ctx, GenerationFlowLogger.GUARD_FILTERED,
            "admitted=" + names.size() + " requested=" + plan.count());

        if (names.size() < plan.count()) {
            List<GeneratedName> dynamic = dynamicCandidates(plan, source, session, plan.count() - names.size());
            names.addAll(dynamic);
            flowLogger.log(ctx, GenerationFlowLogger.FALLBACK_USED, "source=dynamic added=" + dynamic.size());
        }

        if (names.size() < plan.count()) {
            List<String> taken = names.stream().map(GeneratedName::name).collect(Collectors.toList());
            List<String> curated = fallbackPool.draw(plan.count() - names.size(), taken, plan.random());
            for (String name : curated) {
                names.add(new GeneratedName(name, baseMetadata(NameSource.FALLBACK,
                    NameQualityScorer.score(name, plan.genre(), plan.mood()))));
            }
            flowLogger.log(ctx, GenerationFlowLogger.FALLBACK_USED, "source=fallback added=" + curated.size());
        }

        List<GeneratedName> ranked = names.stream()
            .sorted(Comparator.comparingDouble(GeneratedName::qualityScore).reversed())
            .limit(plan.count())
            .collect(Collectors.toList());

        for (GeneratedName name : ranked) {
            Template template = producedBy.get(name.name());
            if (template != null) guard.recordTemplate(template);
            memory.add(name.name(), plan.genre(), plan.type(), name.qualityScore());
        }
        log.info("[Driver] Generated. requested={} returned={} sources={}",
                 plan.count(), ranked.size(), ranked.stream().map(GeneratedName::source).collect(Collectors.toList()));
        return ranked;
    }

    private List<GeneratedName> templateCandidates(GenerationPlan plan, WordSource source, SelectionSession session,
                                                   Map<String, Template> producedBy) {
        GenerationContext context = new GenerationContext(plan.genre(), plan.mood(), plan.type(), plan.wordCount());
        List<GeneratedName> names = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        int target = plan.count() + Math.max(2, plan.count() / 2);

        for (int round = 0; round < SELECTION_ROUNDS && names.size() < target; round++) {
            List<Template> templates = selection.selectMany(plan.criteria(), source, session, target - names.size());
            for (Template template : templates) {
                String name = TemplateGenerator.generate(template, source, context, plan.random());
                if (PhraseText.wordCount(name) != plan.wordCount()) {
                    log.debug("[Driver] shape mismatch template={} name='{}'", template.id(), name);
                    continue;
                }
                if (!seen.add(name.toLowerCase(Locale.ROOT)) || !admit(name, plan, session)) continue;

                Map<String, Object> metadata = baseMetadata(NameSource.TEMPLATE,
                    NameQualityScorer.score(name, plan.genre(), plan.mood()));
                metadata.put(GeneratedName.TEMPLATE_ID, template.id());
                metadata.put("template_category", template.category());
                names.add(new GeneratedName(name, metadata));
                producedBy.put(name, template);
            }
        }
        return names;
    }

    private List<GeneratedName> fusionCandidates(GenerationPlan plan, WordSource source, SelectionSession session) {
        List<FusionResult> results = fusion.fuse(plan.fusionRequest(), source, session);
        List<GeneratedName> names = new ArrayList<>();
        for (FusionResult result : results) {
            if (!admit(result.name(), plan, session)) continue;
            Map<String, Object> metadata = baseMetadata(NameSource.FUSION, result.qualityScore());
            metadata.put("fusion_metadata", fusionMetadata(result.metadata()));
            metadata.put("explanations", explanations(result.explanations()));
            names.add(new GeneratedName(result.name(), metadata));
        }
        return names;
    }

    private List<GeneratedName> dynamicCandidates(GenerationPlan plan, WordSource source,
                                                  SelectionSession session, int needed) {
        List<GeneratedName> names = new ArrayList<>();
        int attempts = needed * DYNAMIC_ATTEMPTS_PER_NAME;
        for (int i = 0; i < attempts && names.size() < needed; i++) {
            String name = DynamicPhraseAssembler.assemble(plan.wordCount(), source, plan.genre(), plan.random());
            if (!admit(name, plan, session)) continue;
            Map<String, Object> metadata = baseMetadata(NameSource.DYNAMIC,
                NameQualityScorer.score(name, plan.genre(), plan.mood()));
            metadata.put(GeneratedName.TEMPLATE_ID, DynamicPhraseAssembler.DYNAMIC_ID);
            names.add(new GeneratedName(name, metadata));
        }
        return names;
    }

    /** Memory first: a memory rejection must not leave the name in the guard's history. */
    private boolean admit(String name, GenerationPlan plan, SelectionSession session) {
        if (memory.shouldReject(name, plan.genre(), plan.random())) {
            log.debug("[Driver] memory rejected name='{}'", name);
            return false;
        }
        return session.tryAccept(name);
    }

    // ── metadata ─────────────────────────────────────────────────────────────

    private static Map<String, Object> baseMetadata(NameSource source, double quality) {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put(GeneratedName.SOURCE, source.id());
        metadata.put(GeneratedName.QUALITY_SCORE, round(quality));
        return metadata;
    }

    private static Map<String, Object> fusionMetadata(FusionMetadata m) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("primary_genre", m.primaryGenre());
        map.put("secondary_genre", m.secondaryGenre());
        map.put("compatibility_score", m.compatibilityScore());
        map.put("fusion_style", m.fusionStyle().id());
        map.put("vocabulary_strategy", m.vocabularyStrategy().id());
        map.put("method", m.method().id());
        map.put("pattern_sources", m.patternSources());
        map.put("fusion_elements", m.fusionElements());
        map.put("creativity_level", m.creativityLevel());
        map.put("authenticity", round(m.authenticity()));
        map.put("innovation", round(m.innovation()));
        return map;
    }

    private static Map<String, Object> explanations(FusionExplanations e) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("rationale", e.rationale());
        map.put("genre_influences", e.genreInfluences());
        map.put("creative_elements", e.creativeElements());
        map.put("market_appeal", e.marketAppeal());
        return map;
    }

    private static String lower(String value) {
        return value == null || value.isBlank() ? null : value.trim().toLowerCase(Locale.ROOT);
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }
}
