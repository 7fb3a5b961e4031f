package com.fermata.common.guard;

import com.fermata.common.template.Template;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Tracks recently emitted names, words and templates so later output avoids visible repetition.
 *
 * <h3>Rejection</h3>
 * A candidate is rejected when it equals a recent name (case-insensitive), or when the share of
 * recent names that contain one of its significant words (length ≥ {@value #SIGNIFICANT_LENGTH})
 * exceeds {@link GuardSettings#sharedWordFraction()}. The share rule needs at least
 * {@value #MIN_HISTORY_FOR_SHARED_WORDS} recent names.
 *
 * <h3>Decay</h3>
 * When more than {@link GuardSettings#decayInterval()} has passed since the last decay pass,
 * every category and subcategory count is halved (floor) once per elapsed interval; counts that
 * reach zero are removed.
 *
 * <p>All methods are {@code synchronized}; one instance may be shared across request threads.
 */
public class RepetitionGuard {

    private static final Logger log = LoggerFactory.getLogger(RepetitionGuard.class);

    public static final int SIGNIFICANT_LENGTH = 4;
    public static final int MIN_HISTORY_FOR_SHARED_WORDS = 2;

    private final GuardSettings settings;
    private final Clock clock;

    private final Deque<String> recentNames = new ArrayDeque<>();
    private final Deque<String> recentWords = new ArrayDeque<>();
    private final Deque<String> recentTemplates = new ArrayDeque<>();
    private final Map<String, Integer> categoryCounts = new HashMap<>();
    private final Map<String, Integer> subcategoryCounts = new HashMap<>();
    private Instant lastDecay;

    public RepetitionGuard() {
        this(GuardSettings.defaults(), Clock.systemUTC());
    }

    public RepetitionGuard(GuardSettings settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
        this.lastDecay = clock.instant();
    }

    public GuardSettings settings() {
        return settings;
    }

    // ── names ────────────────────────────────────────────────────────────────

    public synchronized boolean shouldReject(String candidate) {
        if (candidate == null || candidate.isBlank()) return true;
        decayIfDue();
        String normalized = normalize(candidate);
        if (recentNames.contains(normalized)) {
            log.debug("[Guard] reject duplicate name='{}'", candidate);
            return true;
        }
        if (recentNames.size() < MIN_HISTORY_FOR_SHARED_WORDS) return false;

        Set<String> words = significantWords(normalized);
        if (words.isEmpty()) return false;
        long sharing = recentNames.stream()
            .filter(name -> significantWords(name).stream().anyMatch(words::contains))
            .count();
        boolean reject = (double) sharing / recentNames.size() > settings.sharedWordFraction();
        if (reject) {
            log.debug("[Guard] reject shared words name='{}' sharing={}/{}", candidate, sharing, recentNames.size());
        }
        return reject;
    }

    /**
     * Rejection check and acceptance under one lock, so concurrent callers sharing this guard
     * cannot both admit the same name.
     *
     * @return whether the name was accepted
     */
    public synchronized boolean tryAccept(String name, Template template) {
        if (shouldReject(name)) return false;
        accept(name, template);
        return true;
    }

    /** Records an accepted name and, when present, the template that produced it. */
    public synchronized void accept(String name, Template template) {
        decayIfDue();
        String normalized = normalize(name);
        push(recentNames, normalized, settings.recentWordCapacity());
        for (String word : significantWords(normalized)) {
            recentWords.remove(word);
            push(recentWords, word, settings.recentWordCapacity());
        }
        if (template != null) recordTemplate(template);
    }

    // ── templates ────────────────────────────────────────────────────────────

    /** Pushes the template id and bumps its category and subcategory counts. */
    public synchronized void recordTemplate(Template template) {
        decayIfDue();
        push(recentTemplates, template.id(), settings.recentTemplateCapacity());
        categoryCounts.merge(template.category(), 1, Integer::sum);
        subcategoryCounts.merge(template.subcategory(), 1, Integer::sum);
    }

    public synchronized boolean isRecentTemplate(String templateId) {
        return recentTemplates.contains(templateId);
    }

    public synchronized int categoryCount(String category) {
        decayIfDue();
        return categoryCounts.getOrDefault(category, 0);
    }

    public synchronized int subcategoryCount(String subcategory) {
        decayIfDue();
        return subcategoryCounts.getOrDefault(subcategory, 0);
    }

    // ── views ────────────────────────────────────────────────────────────────

    public synchronized List<String> recentNames() {
        return new ArrayList<>(recentNames);
    }

    public synchronized List<String> recentWords() {
        return new ArrayList<>(recentWords);
    }

    public synchronized List<String> recentTemplates() {
        return new ArrayList<>(recentTemplates);
    }

    public synchronized Map<String, Integer> categoryCounts() {
        return Map.copyOf(categoryCounts);
    }

    public synchronized Map<String, Integer> subcategoryCounts() {
        return Map.copyOf(subcategoryCounts);
    }

    public synchronized void clear() {
        recentNames.clear();
        recentWords.clear();
        recentTemplates.clear();
        categoryCounts.clear();
        subcategoryCounts.clear();
        lastDecay = clock.instant();
    }

    // ── decay ────────────────────────────────────────────────────────────────

    /** Runs the due decay passes; returns how many were applied. */
    public synchronized int decayIfDue() {
        Instant now = clock.instant();
        Duration elapsed = Duration.between(lastDecay, now);
        Duration interval = settings.decayInterval();
        if (elapsed.compareTo(interval) <= 0) return 0;

        long passes = Math.max(1, elapsed.toMillis() / Math.max(1, interval.toMillis()));
        int applied = 0;
        while (applied < passes && !(categoryCounts.isEmpty() && subcategoryCounts.isEmpty())) {
            halve(categoryCounts);
            halve(subcategoryCounts);
            applied++;
        }
        lastDecay = now;
        if (applied > 0) {
            log.debug("[Guard] decay passes={} categories={} subcategories={}",
                applied, categoryCounts.size(), subcategoryCounts.size());
        }
        return applied;
    }

    private static void halve(Map<String, Integer> counts) {
        Iterator<Map.Entry<String, Integer>> it = counts.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<String, Integer> entry = it.next();
            int halved = entry.getValue() / 2;
            if (halved <= 0) it.remove();
            else entry.setValue(halved);
        }
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    private static void push(Deque<String> queue, String value, int capacity) {
        queue.addLast(value);
        while (queue.size() > capacity) queue.removeFirst();
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    static Set<String> significantWords(String normalizedName) {
        Set<String> words = new LinkedHashSet<>();
        for (String token : normalizedName.split("[\\s\\-_]+")) {
            String word = token.replaceAll("[^\\p{L}\\p{N}']", "");
            if (word.length() >= SIGNIFICANT_LENGTH) words.add(word);
        }
        return words;
    }
}
