package com.fermata.generation.service;

import com.fermata.common.mood.MoodLibrary;
import com.fermata.common.mood.MoodProfile;
import com.fermata.common.template.PhraseText;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Heuristic 0–1 score used to rank template and dynamic candidates before the top N are
 * returned. Fusion results carry their own quality and are not rescored.
 */
final class NameQualityScorer {

    static final List<String> CLICHES =
        List.of("dark shadow", "neon dream", "electric storm", "crystal heart", "golden hour");

    private static final Pattern CONSONANT_RUN = Pattern.compile("[^aeiou\\s]{4,}", Pattern.CASE_INSENSITIVE);

    private NameQualityScorer() {}

    static double score(String name, String genre, String mood) {
        List<String> words = PhraseText.words(name.toLowerCase(Locale.ROOT));
        if (words.isEmpty()) return 0.0;
        double score = 0.5;

        int count = words.size();
        if (count >= 2 && count <= 4) score += 0.10;
        else if (count >= 5 && count <= 7) score += 0.05;

        if (new HashSet<>(words).size() == count) score += 0.10;

        String lower = name.toLowerCase(Locale.ROOT);
        if (CLICHES.stream().anyMatch(lower::contains)) score -= 0.15;

        if (genre != null && words.stream().anyMatch(w -> w.length() >= 4)) score += 0.05;

        if (mood != null && MoodLibrary.isKnown(mood)) {
            MoodProfile profile = MoodLibrary.representativeProfile(mood);
            boolean aligned = profile != null && words.stream()
                .anyMatch(w -> profile.keywords().stream().anyMatch(k -> w.contains(k.toLowerCase(Locale.ROOT))));
            if (aligned) score += 0.05;
        }

        if (!CONSONANT_RUN.matcher(name).find()) score += 0.05;

        if (count >= 3 && maxInitialRepeat(words) >= 3) score -= 0.10;

        if (name.length() > 50) score -= 0.20;
        else if (name.length() > 40) score -= 0.10;

        return Math.max(0.0, Math.min(1.0, score));
    }

    private static int maxInitialRepeat(List<String> words) {
        Map<Character, Integer> initials = new HashMap<>();
        int max = 0;
        for (String word : words) {
            max = Math.max(max, initials.merge(word.charAt(0), 1, Integer::sum));
        }
        return max;
    }
}
