package com.fermata.common.fusion;

import com.fermata.common.exception.FusionExhaustedException;
import com.fermata.common.genre.CompatibilityEntry;
import com.fermata.common.genre.FusedVocabulary;
import com.fermata.common.genre.GenreCompatibilityMatrix;
import com.fermata.common.genre.VocabularyFusion;
import com.fermata.common.guard.RepetitionGuard;
import com.fermata.common.selection.SelectionEngine;
import com.fermata.common.selection.SelectionSession;
import com.fermata.common.template.PhraseText;
import com.fermata.common.wordsource.WordCategory;
import com.fermata.common.wordsource.WordSource;
import com.fermata.common.wordsource.WordSourceNormalizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Blends two genres into names.
 *
 * <h3>Flow</h3>
 * <ol>
 *   <li>Look up the pair's compatibility; unknown pairs fail fast.</li>
 *   <li>Fuse the two vocabularies and merge them into the caller's word source.</li>
 *   <li>Run up to {@code max(count × multiplier, 10)} attempts. Each attempt walks the method
 *       list for the requested intensity and keeps the first candidate that passes
 *       validation and is not rejected by the call's own repetition guard.</li>
 *   <li>Rank the survivors by quality and return the best {@code count}.</li>
 * </ol>
 *
 * <h3>Validation</h3>
 * At least {@value #MIN_NAME_LENGTH} characters, word count within ±1 of the target, quality at
 * least {@value #MIN_QUALITY} and, when authenticity is preserved, authenticity at least
 * {@value #MIN_AUTHENTICITY}.
 *
 * <p>Thread-safe; the only shared state is the fusion history and per-pair metrics.
 */
public class FusionEngine {

    private static final Logger log = LoggerFactory.getLogger(FusionEngine.class);

    public static final int DEFAULT_ATTEMPT_MULTIPLIER = 3;
    public static final int MIN_ATTEMPTS = 10;
    public static final int MIN_NAME_LENGTH = 3;
    public static final double MIN_QUALITY = 0.3;
    public static final double MIN_AUTHENTICITY = 0.5;

    private final GenreCompatibilityMatrix matrix;
    private final VocabularyFusion vocabularyFusion;
    private final SelectionEngine selection;
    private final int attemptMultiplier;
    private final Map<FusionMethod, FusionStrategy> overrides = new EnumMap<>(FusionMethod.class);

    private final ConcurrentHashMap<String, Integer> history = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, PairMetrics> metrics = new ConcurrentHashMap<>();

    public FusionEngine(GenreCompatibilityMatrix matrix, VocabularyFusion vocabularyFusion,
                        SelectionEngine selection, int attemptMultiplier) {
        this.matrix = matrix;
        this.vocabularyFusion = vocabularyFusion;
        this.selection = selection;
        this.attemptMultiplier = Math.max(1, attemptMultiplier);
    }

    public FusionEngine(SelectionEngine selection) {
        this(GenreCompatibilityMatrix.standard(), VocabularyFusion.standard(), selection, DEFAULT_ATTEMPT_MULTIPLIER);
    }

    /** Replaces the built-in strategy for one method. */
    public FusionEngine withStrategy(FusionMethod method, FusionStrategy strategy) {
        overrides.put(method, strategy);
        return this;
    }

    public GenreCompatibilityMatrix matrix() {
        return matrix;
    }

    /**
     * @throws com.fermata.common.exception.IncompatibleGenresException when the pair is unknown
     * @throws FusionExhaustedException when no candidate survives the attempt budget
     */
    public List<FusionResult> fuse(FusionRequest request, WordSource source, SelectionSession session) {
        CompatibilityEntry entry = matrix.require(request.primaryGenre(), request.secondaryGenre());
        FusedVocabulary vocabulary = vocabularyFusion.fuse(request.primaryGenre(), request.secondaryGenre(),
            request.creativityLevel(), request.vocabularyStrategy(), session.random());
        FusionAnalysis analysis = FusionQualityScorer.analyze(entry,
            matrix.profile(entry.primary()), matrix.profile(entry.secondary()), request.creativityLevel());

        RepetitionGuard callGuard = new RepetitionGuard();
        SelectionSession callSession = new SelectionSession(callGuard, session.random());
        FusionContext context = new FusionContext(request, entry, vocabulary,
            fusedSource(source, vocabulary), selection, callSession);

        List<FusionMethod> methods = request.intensity().methodsFor(entry.fusionStyle());
        int attempts = Math.max(request.count() * attemptMultiplier, MIN_ATTEMPTS);
        List<FusionResult> results = new ArrayList<>();

        int used = 0;
        while (used < attempts && results.size() < request.count()) {
            used++;
            FusionResult result = attempt(context, methods, analysis, callSession);
            if (result != null) results.add(result);
        }

        if (results.isEmpty()) {
            recordMetrics(entry, List.of());
            log.warn("[Fusion] exhausted pair={}+{} attempts={}", entry.primary(), entry.secondary(), used);
            throw new FusionExhaustedException(entry.primary(), entry.secondary(), used);
        }

        List<FusionResult> ranked = results.stream()
            .sorted(Comparator.comparingDouble(FusionResult::qualityScore).reversed())
            .limit(request.count())
            .collect(Collectors.toList());
        recordMetrics(entry, ranked);
        log.info("[Fusion] pair={}+{} style={} strategy={} results={} attempts={}",
            entry.primary(), entry.secondary(), entry.fusionStyle().id(), vocabulary.strategy().id(),
            ranked.size(), used);
        return ranked;
    }

    private FusionResult attempt(FusionContext context, List<FusionMethod> methods, FusionAnalysis analysis,
                                 SelectionSession callSession) {
        for (FusionMethod method : methods) {
            Optional<FusionCandidate> candidate = strategy(method).attempt(context);
            if (candidate.isEmpty()) continue;

            FusionResult result = toResult(candidate.get(), context, analysis);
            if (!isValid(result, context.request())) {
                log.debug("[Fusion] invalid method={} name='{}' quality={}",
                    method.id(), result.name(), result.qualityScore());
                continue;
            }
            if (!callSession.tryAccept(result.name())) continue;
            return result;
        }
        return null;
    }

    private FusionStrategy strategy(FusionMethod method) {
        FusionStrategy override = overrides.get(method);
        return override != null ? override : FusionStrategies.forMethod(method);
    }

    private FusionResult toResult(FusionCandidate candidate, FusionContext context, FusionAnalysis analysis) {
        FusionRequest request = context.request();
        CompatibilityEntry entry = context.entry();
        FusedVocabulary vocabulary = context.vocabulary();
        String name = candidate.name();

        double quality = FusionQualityScorer.quality(name, request.wordCount(), entry, analysis, history.containsKey(name));
        double innovation = FusionQualityScorer.innovation(name, vocabulary, request.creativityLevel());
        double authenticity = FusionQualityScorer.authenticity(name);

        FusionMetadata metadata = new FusionMetadata(entry.primary(), entry.secondary(), entry.score(),
            entry.fusionStyle(), vocabulary.strategy(), candidate.method(), candidate.patternSources(),
            candidate.fusionElements(), vocabulary.creativityLevel(), authenticity, innovation);
        return new FusionResult(name, metadata, quality, FusionExplainer.explain(name, entry, vocabulary, analysis));
    }

    static boolean isValid(FusionResult result, FusionRequest request) {
        String name = result.name();
        if (name == null || name.trim().length() < MIN_NAME_LENGTH) return false;
        int words = PhraseText.wordCount(name);
        if (words < request.wordCount() - 1 || words > request.wordCount() + 1) return false;
        if (result.qualityScore() < MIN_QUALITY) return false;
        if (request.preserveAuthenticity() && result.metadata().authenticity() < MIN_AUTHENTICITY) return false;
        return !request.culturalSensitivity() || !FusionQualityScorer.usesSyntheticAffix(name);
    }

    /** Caller's source with the fused vocabulary's single words merged into the genre terms. */
    private static WordSource fusedSource(WordSource source, FusedVocabulary vocabulary) {
        WordSource base = source == null ? WordSource.empty() : source;
        return WordSourceNormalizer.merge(base, Map.of(
            WordCategory.GENRE_TERMS, vocabulary.singleWords(),
            WordCategory.ASSOCIATED_WORDS, FusionStrategies.singles(vocabulary.secondaryWords())));
    }

    // ── history and metrics ──────────────────────────────────────────────────

    private void recordMetrics(CompatibilityEntry entry, List<FusionResult> results) {
        String key = entry.primary() + "+" + entry.secondary();
        double average = results.stream().mapToDouble(FusionResult::qualityScore).average().orElse(0.0);
        metrics.merge(key, new PairMetrics(1, results.size(), average), PairMetrics::combine);
        results.forEach(r -> history.merge(r.name(), 1, Integer::sum));
    }

    /** How often the engine has emitted the name. */
    public int timesProduced(String name) {
        return history.getOrDefault(name, 0);
    }

    public Map<String, PairMetrics> metrics() {
        return Map.copyOf(metrics);
    }

    /**
     * Running totals for one ordered genre pair.
     *
     * @param averageQuality mean quality of the pair's results so far
     */
    public record PairMetrics(int calls, int results, double averageQuality) {

        PairMetrics combine(PairMetrics next) {
            int total = results + next.results;
            double average = total == 0 ? 0.0
                : (averageQuality * results + next.averageQuality * next.results) / total;
            return new PairMetrics(calls + next.calls, total, average);
        }
    }
}
