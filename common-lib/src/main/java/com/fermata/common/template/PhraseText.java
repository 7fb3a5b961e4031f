package com.fermata.common.template;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Random;

/**
 * String helpers shared by the template generator, the dynamic assembler and the fusion engine.
 */
public final class PhraseText {

    private PhraseText() {}

    /** Upper-cases the first letter and lower-cases the rest: {@code "sTORM" -> "Storm"}. */
    public static String capitalize(String word) {
        if (word == null || word.isEmpty()) return "";
        return word.substring(0, 1).toUpperCase(Locale.ROOT) + word.substring(1).toLowerCase(Locale.ROOT);
    }

    /** Capitalises every whitespace-separated word. */
    public static String titleCase(String phrase) {
        List<String> out = new ArrayList<>();
        for (String word : words(phrase)) {
            out.add(capitalize(word));
        }
        return String.join(" ", out);
    }

    /** Crude plural stripping: {@code stories -> story}, {@code shadows -> shadow}, {@code glass -> glass}. */
    public static String singularize(String word) {
        if (word == null) return "";
        String lower = word.toLowerCase(Locale.ROOT);
        if (lower.length() > 4 && lower.endsWith("ies")) return word.substring(0, word.length() - 3) + "y";
        if (lower.endsWith("ss") || lower.endsWith("us") || lower.endsWith("is")) return word;
        if (lower.length() > 3 && lower.endsWith("s")) return word.substring(0, word.length() - 1);
        return word;
    }

    /** Present participle: {@code rise -> rising}, {@code die -> dying}, {@code burn -> burning}. */
    public static String gerund(String verb) {
        if (verb == null || verb.isEmpty()) return "";
        String lower = verb.toLowerCase(Locale.ROOT);
        if (lower.endsWith("ing")) return verb;
        if (lower.endsWith("ie")) return verb.substring(0, verb.length() - 2) + "ying";
        if (lower.endsWith("e") && !lower.endsWith("ee") && lower.length() > 2) {
            return verb.substring(0, verb.length() - 1) + "ing";
        }
        return verb + "ing";
    }

    /** Third person singular: {@code burn -> burns}, {@code crash -> crashes}, {@code fly -> flies}. */
    public static String thirdPerson(String verb) {
        if (verb == null || verb.isEmpty()) return "";
        String lower = verb.toLowerCase(Locale.ROOT);
        if (lower.endsWith("s") || lower.endsWith("sh") || lower.endsWith("ch")
                || lower.endsWith("x") || lower.endsWith("z")) {
            return verb + "es";
        }
        if (lower.length() > 2 && lower.endsWith("y") && !isVowel(lower.charAt(lower.length() - 2))) {
            return verb.substring(0, verb.length() - 1) + "ies";
        }
        return verb + "s";
    }

    public static List<String> words(String phrase) {
        if (phrase == null || phrase.isBlank()) return List.of();
        return Arrays.asList(phrase.trim().split("\\s+"));
    }

    public static int wordCount(String phrase) {
        return words(phrase).size();
    }

    /**
     * Uniform pick from {@code options}, or {@code fallback} when the list is empty.
     */
    public static String pick(List<String> options, Random rng, String fallback) {
        if (options == null || options.isEmpty()) return fallback;
        return options.get(rng.nextInt(options.size()));
    }

    /** Uniform pick across several lists treated as one concatenated pool. */
    @SafeVarargs
    public static String pickAny(Random rng, String fallback, List<String>... pools) {
        int total = 0;
        for (List<String> pool : pools) total += pool.size();
        if (total == 0) return fallback;
        int index = rng.nextInt(total);
        for (List<String> pool : pools) {
            if (index < pool.size()) return pool.get(index);
            index -= pool.size();
        }
        return fallback;
    }

    private static boolean isVowel(char c) {
        return "aeiou".indexOf(c) >= 0;
    }
}
