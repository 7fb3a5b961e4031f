package com.fermata.common.selection;

import com.fermata.common.atmosphere.AtmosphereBlender;
import com.fermata.common.atmosphere.AtmosphericCoherence;
import com.fermata.common.exception.NoEligibleTemplatesException;
import com.fermata.common.guard.RepetitionGuard;
import com.fermata.common.mood.EmotionalVector;
import com.fermata.common.mood.MoodAlignment;
import com.fermata.common.mood.PatternMoodScorer;
import com.fermata.common.template.Template;
import com.fermata.common.template.TemplateLibrary;
import com.fermata.common.wordsource.WordSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Picks templates for a request by weighted random sampling over multi-factor scores.
 *
 * <h3>Scoring</h3>
 * Traditional path:
 * <pre>
 *   {@value #CONTEXT_WEIGHT} × context + {@value #QUALITY_WEIGHT} × quality
 *   + {@value #FRESHNESS_WEIGHT} × freshness + {@value #PRIOR_WEIGHT} × template weight
 * </pre>
 * Mood-driven path, used when mood scoring is wanted and the mean mood confidence over the
 * eligible templates reaches the configured threshold:
 * <pre>
 *   {@value #MOOD_CONTEXT_WEIGHT} × context + {@value #MOOD_WEIGHT} × mood
 *   + {@value #COHERENCE_WEIGHT} × coherence + {@value #MOOD_QUALITY_WEIGHT} × quality
 *   + {@value #MOOD_FRESHNESS_WEIGHT} × freshness
 * </pre>
 * Without an atmosphere the coherence weight moves onto the mood weight.
 *
 * <h3>Sampling</h3>
 * Every score is floored at {@value #EPSILON} before the draw. In batches, templates of unused
 * categories gain {@value #UNUSED_CATEGORY_BOOST} and of unused subcategories
 * {@value #UNUSED_SUBCATEGORY_BOOST}; a picked template leaves the pool until the pool is empty.
 *
 * <p>Stateless apart from the guard held by the caller's {@link SelectionSession}.
 */
public class SelectionEngine {

    private static final Logger log = LoggerFactory.getLogger(SelectionEngine.class);

    public static final double DEFAULT_MOOD_CONFIDENCE_THRESHOLD = 0.35;
    public static final double EPSILON = 0.1;

    public static final double CONTEXT_WEIGHT   = 0.40;
    public static final double QUALITY_WEIGHT   = 0.25;
    public static final double FRESHNESS_WEIGHT = 0.20;
    public static final double PRIOR_WEIGHT     = 0.15;

    public static final double MOOD_CONTEXT_WEIGHT   = 0.25;
    public static final double MOOD_WEIGHT           = 0.30;
    public static final double COHERENCE_WEIGHT      = 0.20;
    public static final double MOOD_QUALITY_WEIGHT   = 0.15;
    public static final double MOOD_FRESHNESS_WEIGHT = 0.10;

    public static final double UNUSED_CATEGORY_BOOST    = 0.3;
    public static final double UNUSED_SUBCATEGORY_BOOST = 0.2;

    private final TemplateLibrary library;
    private final double moodConfidenceThreshold;

    public SelectionEngine(TemplateLibrary library) {
        this(library, DEFAULT_MOOD_CONFIDENCE_THRESHOLD);
    }

    public SelectionEngine(TemplateLibrary library, double moodConfidenceThreshold) {
        this.library = library;
        this.moodConfidenceThreshold = moodConfidenceThreshold;
    }

    public TemplateLibrary library() {
        return library;
    }

    // ── eligibility ──────────────────────────────────────────────────────────

    public List<Template> eligible(SelectionCriteria criteria) {
        return library.getTemplates(criteria.wordCount()).stream()
            .filter(t -> t.allowsGenre(criteria.genre()))
            .filter(t -> t.allowsMood(criteria.mood()))
            .filter(t -> !criteria.avoidCategories().contains(t.category()))
            .filter(t -> criteria.preferCategories().isEmpty() || criteria.preferCategories().contains(t.category()))
            .collect(Collectors.toList());
    }

    // ── selection ────────────────────────────────────────────────────────────

    /** One template, or {@code null} when nothing is eligible. */
    public Template select(SelectionCriteria criteria, WordSource source, SelectionSession session) {
        List<ScoredTemplate> scored = rank(criteria, source, session.guard());
        if (scored.isEmpty()) {
            log.warn("[Selection] no eligible templates wordCount={} genre={} mood={}",
                criteria.wordCount(), criteria.genre(), criteria.mood());
            return null;
        }
        ScoredTemplate picked = draw(scored, session.random());
        session.guard().recordTemplate(picked.template());
        log.debug("[Selection] template={} mode={} score={} reasons={}",
            picked.template().id(), picked.mode(), round(picked.score()), picked.reasons());
        return picked.template();
    }

    /**
     * {@code n} templates drawn for diversity. Raw templates may repeat once every eligible
     * template has been drawn.
     *
     * <p>Unlike {@link #select}, picks are not recorded in the session guard. A batch is usually
     * over-drawn, so the caller records only the templates whose output it keeps
     * ({@link RepetitionGuard#recordTemplate}).
     *
     * @throws NoEligibleTemplatesException when nothing is eligible
     */
    public List<Template> selectMany(SelectionCriteria criteria, WordSource source,
                                     SelectionSession session, int n) {
        List<ScoredTemplate> ranked = rank(criteria, source, session.guard());
        if (ranked.isEmpty()) {
            throw new NoEligibleTemplatesException(criteria.wordCount(),
                "genre=" + criteria.genre() + " mood=" + criteria.mood());
        }

        List<Template> picked = new ArrayList<>();
        Set<String> usedCategories = new HashSet<>();
        Set<String> usedSubcategories = new HashSet<>();
        List<ScoredTemplate> pool = new ArrayList<>(ranked);

        for (int i = 0; i < n; i++) {
            if (pool.isEmpty()) pool.addAll(ranked);
            List<ScoredTemplate> boosted = pool.stream()
                .map(st -> st.withScore(st.score() + diversityBoost(st.template(), usedCategories, usedSubcategories)))
                .collect(Collectors.toList());
            ScoredTemplate choice = draw(boosted, session.random());
            picked.add(choice.template());
            usedCategories.add(choice.template().category());
            usedSubcategories.add(choice.template().subcategory());
            pool.removeIf(st -> st.template().id().equals(choice.template().id()));
        }

        log.info("[Selection] batch n={} wordCount={} mode={} categories={}",
            n, criteria.wordCount(), ranked.get(0).mode(), usedCategories);
        return picked;
    }

    // ── scoring ──────────────────────────────────────────────────────────────

    /** Every eligible template with its scores, best first. */
    public List<ScoredTemplate> rank(SelectionCriteria criteria, WordSource source, RepetitionGuard guard) {
        List<Template> eligible = eligible(criteria);
        if (eligible.isEmpty()) return List.of();

        MoodTarget target = moodTarget(criteria);
        ScoringMode mode = scoringMode(target, eligible);

        return eligible.stream()
            .map(t -> mode == ScoringMode.MOOD_DRIVEN
                ? scoreMoodDriven(t, criteria, source, guard, target)
                : scoreTraditional(t, criteria, source, guard))
            .sorted(Comparator.comparingDouble(ScoredTemplate::score).reversed())
            .collect(Collectors.toList());
    }

    /** Which path {@link #rank} takes for these criteria. */
    public ScoringMode scoringMode(SelectionCriteria criteria) {
        List<Template> eligible = eligible(criteria);
        return eligible.isEmpty() ? ScoringMode.TRADITIONAL : scoringMode(moodTarget(criteria), eligible);
    }

    private ScoringMode scoringMode(MoodTarget target, List<Template> eligible) {
        if (target == null) return ScoringMode.TRADITIONAL;
        double confidence = eligible.stream()
            .mapToDouble(t -> target.alignment(t).confidence())
            .average()
            .orElse(0.0);
        if (confidence < moodConfidenceThreshold) {
            log.debug("[Selection] mood confidence {} below {} for mood={}, using traditional scoring",
                round(confidence), moodConfidenceThreshold, target.moodId);
            return ScoringMode.TRADITIONAL;
        }
        return ScoringMode.MOOD_DRIVEN;
    }

    private static ScoredTemplate scoreTraditional(Template template, SelectionCriteria criteria,
                                                   WordSource source, RepetitionGuard guard) {
        double context = ContextMatchScorer.score(template, criteria);
        double quality = QualityScorer.score(template, source);
        double freshness = FreshnessScorer.score(template, guard);
        double total = context * CONTEXT_WEIGHT
            + quality * QUALITY_WEIGHT
            + freshness * FRESHNESS_WEIGHT
            + template.weight() * PRIOR_WEIGHT;
        return new ScoredTemplate(template, total, ScoringMode.TRADITIONAL, context, quality, freshness, 0.5, 0.5);
    }

    private static ScoredTemplate scoreMoodDriven(Template template, SelectionCriteria criteria,
                                                  WordSource source, RepetitionGuard guard, MoodTarget target) {
        double context = ContextMatchScorer.score(template, criteria);
        double quality = QualityScorer.score(template, source);
        double freshness = FreshnessScorer.score(template, guard);
        double mood = moodScore(template, criteria, target);

        double total;
        double coherence = 0.5;
        if (criteria.hasAtmosphere()) {
            coherence = AtmosphericCoherence.evaluate(template, criteria.atmosphere()).coherence();
            total = context * MOOD_CONTEXT_WEIGHT
                + mood * MOOD_WEIGHT
                + coherence * COHERENCE_WEIGHT
                + quality * MOOD_QUALITY_WEIGHT
                + freshness * MOOD_FRESHNESS_WEIGHT;
        } else {
            total = context * MOOD_CONTEXT_WEIGHT
                + mood * (MOOD_WEIGHT + COHERENCE_WEIGHT)
                + quality * MOOD_QUALITY_WEIGHT
                + freshness * MOOD_FRESHNESS_WEIGHT;
        }
        return new ScoredTemplate(template, total, ScoringMode.MOOD_DRIVEN, context, quality, freshness, mood, coherence);
    }

    /**
     * Mood fit of one template: half the pattern-mood score, half the category resonance,
     * adjusted by the atmospheric profile's compatible or conflicting mood lists.
     */
    static double moodScore(Template template, SelectionCriteria criteria, MoodTarget target) {
        MoodAlignment alignment = target.alignment(template);
        double resonance = PatternMoodScorer.categoryResonance(template, target.moodId, target.vector);
        double adjusted = 0.5 * alignment.score() + 0.5 * resonance
            + AtmosphereBlender.profileAdjustment(target.moodId, criteria.atmosphere());
        return Math.max(0.0, Math.min(1.0, adjusted));
    }

    private static MoodTarget moodTarget(SelectionCriteria criteria) {
        if (!criteria.wantsMoodScoring()) return null;
        String moodId = criteria.mood();
        if (moodId == null && criteria.hasAtmosphere()) {
            moodId = AtmosphereBlender.atmosphericMoods(criteria.atmosphere()).stream().findFirst().orElse(null);
        }
        if (moodId == null) return null;
        EmotionalVector vector = AtmosphereBlender.resolve(moodId, criteria.modifiers(),
            criteria.hasAtmosphere() ? criteria.atmosphere() : null);
        boolean seasonal = criteria.hasAtmosphere() && criteria.atmosphere().season() != null;
        return new MoodTarget(moodId, vector, seasonal);
    }

    // ── sampling ─────────────────────────────────────────────────────────────

    static ScoredTemplate draw(List<ScoredTemplate> scored, Random random) {
        boolean anyPositive = scored.stream().anyMatch(st -> st.score() > 0);
        if (!anyPositive) {
            return scored.get(random.nextInt(scored.size()));
        }
        double total = scored.stream().mapToDouble(st -> Math.max(st.score(), EPSILON)).sum();
        double roll = random.nextDouble() * total;
        for (ScoredTemplate st : scored) {
            roll -= Math.max(st.score(), EPSILON);
            if (roll <= 0) return st;
        }
        return scored.get(scored.size() - 1);
    }

    private static double diversityBoost(Template template, Set<String> usedCategories, Set<String> usedSubcategories) {
        double boost = 0;
        if (!usedCategories.contains(template.category())) boost += UNUSED_CATEGORY_BOOST;
        if (!usedSubcategories.contains(template.subcategory())) boost += UNUSED_SUBCATEGORY_BOOST;
        return boost;
    }

    private static double round(double value) {
        return Math.round(value * 1000.0) / 1000.0;
    }

    private record MoodTarget(String moodId, EmotionalVector vector, boolean seasonal) {

        MoodAlignment alignment(Template template) {
            return PatternMoodScorer.score(template, moodId, vector, seasonal);
        }
    }
}
