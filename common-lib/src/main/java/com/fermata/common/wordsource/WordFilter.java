package com.fermata.common.wordsource;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Heuristic word-quality and part-of-speech checks.
 *
 * <p>No grammatical parsing happens here: every check is a length, blocklist,
 * suffix or prefix test. All methods are null-safe and treat {@code null} as
 * "not acceptable".
 */
public final class WordFilter {

    public static final int MIN_LENGTH = 3;
    public static final int MAX_LENGTH = 15;

    private static final Set<String> UNPOETIC = Set.of(
        "data", "system", "user", "file", "test", "admin", "config",
        "error", "null", "undefined", "function", "object", "array",
        "string", "number", "boolean", "default", "example", "sample",
        "temp", "tmp", "var", "const", "let", "this", "that", "which",
        "mgmt", "misc", "util", "src", "dst", "ref", "ptr", "idx"
    );

    private static final Set<String> JARGON = Set.of(
        "electron", "proton", "neutron", "molecule", "atom", "particle",
        "quantum", "radiation", "isotope", "enzyme", "protein", "bacteria",
        "coefficient", "algorithm", "database", "interface", "protocol",
        "bandwidth", "megabyte", "kilobyte", "binary", "decimal", "hexadecimal",
        "configure", "initialize", "parameter", "variable", "constant",
        "compile", "execute", "debug", "optimize", "validate", "authenticate",
        "telescope", "magnitude", "dwarf", "gown", "channel", "ships",
        "state", "brick", "ridges", "fairies", "reaver", "cortex",
        "matrix", "vector", "scalar", "tensor", "gradient", "derivative",
        "integral", "polynomial", "exponential", "logarithm", "factorial",
        "permutation", "combination", "probability", "statistics"
    );

    private static final Set<String> COMMON_VERBS = Set.of(
        "run", "walk", "fly", "dance", "sing", "play", "fight", "love", "hate", "burn",
        "break", "fall", "rise", "shine", "glow", "flow", "crash", "roar", "scream", "whisper",
        "chase", "hunt", "climb", "dive", "spin", "shake", "drift", "wander", "bleed", "heal",
        "dream", "wake", "sleep", "call", "cry", "laugh", "move", "stand", "hold", "fade"
    );

    private static final List<String> ACTION_SUFFIXES = List.of("ing", "ed", "er", "es");
    private static final List<String> ACTION_PREFIXES = List.of("re", "un", "dis", "over", "under", "out");
    private static final List<String> ADJECTIVE_SUFFIXES = List.of(
        "ous", "ful", "less", "ive", "al", "ic", "ish", "able", "ible", "ant", "ent", "ary", "y"
    );

    private WordFilter() {}

    /**
     * Returns {@code true} when the word is fit for a name: 3 to 15 letters, a single token,
     * not numeric and not on the technical blocklist.
     */
    public static boolean isPoeticWord(String word) {
        if (word == null || word.length() < MIN_LENGTH || word.length() > MAX_LENGTH) return false;
        if (word.contains("_") || word.contains("-")) return false;
        if (word.chars().anyMatch(Character::isWhitespace)) return false;
        if (word.chars().allMatch(Character::isDigit)) return false;
        return !UNPOETIC.contains(word.toLowerCase(Locale.ROOT));
    }

    /** Scientific and software jargon that reads badly in a band or song name. */
    public static boolean isProblematicWord(String word) {
        if (word == null || word.isBlank()) return true;
        return JARGON.contains(word.toLowerCase(Locale.ROOT));
    }

    /** Combined acceptance test used by the normalizer. */
    public static boolean isAcceptable(String word) {
        return isPoeticWord(word) && !isProblematicWord(word);
    }

    /** Approximates "is a verb or verb form" from a small verb list plus affix rules. */
    public static boolean isActionWord(String word) {
        if (word == null || word.isBlank()) return false;
        String lower = word.toLowerCase(Locale.ROOT);
        if (COMMON_VERBS.contains(lower)) return true;
        for (String suffix : ACTION_SUFFIXES) {
            if (lower.length() > suffix.length() + 2 && lower.endsWith(suffix)) return true;
        }
        for (String prefix : ACTION_PREFIXES) {
            if (lower.length() > prefix.length() + 2 && lower.startsWith(prefix)) return true;
        }
        return false;
    }

    /** Approximates "is an adjective" from common English adjective suffixes. */
    public static boolean looksLikeAdjective(String word) {
        if (word == null || word.length() < MIN_LENGTH) return false;
        String lower = word.toLowerCase(Locale.ROOT);
        for (String suffix : ADJECTIVE_SUFFIXES) {
            if (lower.length() > suffix.length() + 2 && lower.endsWith(suffix)) return true;
        }
        return false;
    }
}
