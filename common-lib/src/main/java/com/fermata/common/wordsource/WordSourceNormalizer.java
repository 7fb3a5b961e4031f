package com.fermata.common.wordsource;

import com.fermata.common.exception.MalformedWordSourceException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns raw, loosely typed word lists into a {@link WordSource}.
 *
 * <h3>Normalisation</h3>
 * <ol>
 *   <li>Every entry is trimmed and lower-cased; blanks are dropped.</li>
 *   <li>Duplicates collapse to their first occurrence (raw list).</li>
 *   <li>Entries passing {@link WordFilter#isAcceptable(String)} form the filtered list,
 *       capped at {@value #MAX_FILTERED_PER_CATEGORY} entries.</li>
 * </ol>
 *
 * <p>Keys that name no {@link WordCategory} are ignored. A {@code null} value is treated as an
 * absent category. Any other non-list value, or a list holding a non-string, is rejected with
 * {@link MalformedWordSourceException}.
 */
public final class WordSourceNormalizer {

    public static final int MAX_FILTERED_PER_CATEGORY = 100;

    private WordSourceNormalizer() {}

    /**
     * Normalises an untyped input map such as a decoded JSON object.
     *
     * @throws MalformedWordSourceException when a known category's value is not a list of strings
     */
    public static WordSource normalize(String name, Map<String, ?> rawInput) {
        Map<WordCategory, List<String>> typed = new EnumMap<>(WordCategory.class);
        if (rawInput != null) {
            for (Map.Entry<String, ?> entry : rawInput.entrySet()) {
                WordCategory category = WordCategory.fromKey(entry.getKey());
                if (category == null) continue;
                typed.merge(category, asStringList(entry.getKey(), entry.getValue()), WordSourceNormalizer::concat);
            }
        }
        return fromCategories(name, typed);
    }

    /** Normalises already-typed category lists. */
    public static WordSource fromCategories(String name, Map<WordCategory, ? extends Collection<String>> input) {
        Map<WordCategory, List<String>> raw = new EnumMap<>(WordCategory.class);
        Map<WordCategory, List<String>> filtered = new EnumMap<>(WordCategory.class);
        for (WordCategory category : WordCategory.values()) {
            Collection<String> words = input == null ? null : input.get(category);
            List<String> rawList = caseNormalize(words);
            raw.put(category, rawList);
            filtered.put(category, filter(rawList));
        }
        return new WordSource(name, raw, filtered);
    }

    /**
     * Returns a new source whose raw lists are {@code base}'s raw lists followed by
     * {@code extra}; filtering is re-applied to the combined lists.
     */
    public static WordSource merge(WordSource base, Map<WordCategory, ? extends Collection<String>> extra) {
        Map<WordCategory, List<String>> combined = new EnumMap<>(WordCategory.class);
        for (WordCategory category : WordCategory.values()) {
            List<String> words = new ArrayList<>(base.raw(category));
            Collection<String> more = extra == null ? null : extra.get(category);
            if (more != null) words.addAll(more);
            combined.put(category, words);
        }
        return fromCategories(base.name(), combined);
    }

    /** Trim, lower-case, drop blanks and collapse duplicates. */
    public static List<String> caseNormalize(Collection<String> words) {
        if (words == null || words.isEmpty()) return List.of();
        Set<String> unique = new LinkedHashSet<>();
        for (String word : words) {
            if (word == null) continue;
            String normalized = word.trim().toLowerCase(Locale.ROOT);
            if (!normalized.isEmpty()) unique.add(normalized);
        }
        return List.copyOf(unique);
    }

    /** Quality filter over an already case-normalised list. */
    public static List<String> filter(List<String> rawList) {
        List<String> result = new ArrayList<>();
        for (String word : rawList) {
            if (result.size() >= MAX_FILTERED_PER_CATEGORY) break;
            if (WordFilter.isAcceptable(word)) result.add(word);
        }
        return List.copyOf(result);
    }

    private static List<String> asStringList(String key, Object value) {
        if (value == null) return List.of();
        if (!(value instanceof Collection<?> collection)) {
            throw new MalformedWordSourceException(key,
                "expected a list of strings but got " + value.getClass().getSimpleName());
        }
        List<String> words = new ArrayList<>(collection.size());
        for (Object element : collection) {
            if (!(element instanceof String word)) {
                throw new MalformedWordSourceException(key,
                    "contains a non-string entry: " + (element == null ? "null" : element.getClass().getSimpleName()));
            }
            words.add(word);
        }
        return words;
    }

    private static List<String> concat(List<String> a, List<String> b) {
        List<String> joined = new ArrayList<>(a);
        joined.addAll(b);
        return joined;
    }
}
