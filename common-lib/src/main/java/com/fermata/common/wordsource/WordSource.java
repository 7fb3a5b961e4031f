package com.fermata.common.wordsource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Named, categorised vocabulary available to templates at generation time.
 *
 * <p>Each category keeps a <em>raw</em> list (case-normalised and de-duplicated input) and a
 * <em>filtered</em> list (the raw entries that pass {@link WordFilter}, capped at
 * {@link WordSourceNormalizer#MAX_FILTERED_PER_CATEGORY}). Filtered lists are always subsets
 * of raw lists. Absent categories read as empty lists, never {@code null}.
 *
 * <p>Instances are immutable and safe to share between concurrent generation sessions.
 * Build them through {@link WordSourceNormalizer}.
 */
public final class WordSource {

    private final String name;
    private final Map<WordCategory, List<String>> raw;
    private final Map<WordCategory, List<String>> filtered;

    WordSource(String name, Map<WordCategory, List<String>> raw, Map<WordCategory, List<String>> filtered) {
        this.name = name;
        this.raw = Collections.unmodifiableMap(new EnumMap<>(raw));
        this.filtered = Collections.unmodifiableMap(new EnumMap<>(filtered));
    }

    /** A source with every category empty; templates then draw from {@link DefaultWordPools}. */
    public static WordSource empty() {
        return new WordSource("empty", new EnumMap<>(WordCategory.class), new EnumMap<>(WordCategory.class));
    }

    public String name() {
        return name;
    }

    public List<String> raw(WordCategory category) {
        return raw.getOrDefault(category, List.of());
    }

    public List<String> filtered(WordCategory category) {
        return filtered.getOrDefault(category, List.of());
    }

    /**
     * Words a template should draw from: the filtered list when it has entries,
     * otherwise the built-in default pool for the category.
     */
    public List<String> words(WordCategory category) {
        List<String> list = filtered(category);
        return list.isEmpty() ? DefaultWordPools.pool(category) : list;
    }

    public boolean hasFiltered(WordCategory category) {
        return !filtered(category).isEmpty();
    }

    public int filteredCount(WordCategory category) {
        return filtered(category).size();
    }

    /** Every filtered entry across categories, first occurrence order. */
    public List<String> allFiltered() {
        Set<String> all = new LinkedHashSet<>();
        for (WordCategory category : WordCategory.values()) {
            all.addAll(filtered(category));
        }
        return List.copyOf(all);
    }

    /** Filtered words of seven letters or more, used by templates that want rarer vocabulary. */
    public List<String> longWords() {
        List<String> result = new ArrayList<>();
        for (String word : allFiltered()) {
            if (word.length() >= 7) result.add(word);
        }
        return result;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("WordSource[").append(name);
        for (WordCategory category : WordCategory.values()) {
            sb.append(' ').append(category.key()).append('=')
              .append(filtered(category).size()).append('/').append(raw(category).size());
        }
        return sb.append(']').toString();
    }
}
