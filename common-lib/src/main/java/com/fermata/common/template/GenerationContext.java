package com.fermata.common.template;

/**
 * Per-invocation inputs a template may read while building a phrase.
 *
 * @param genre     lower-case genre name, or {@code null}
 * @param mood      lower-case mood name, or {@code null}
 * @param type      band or song
 * @param wordCount exact number of words the phrase must have
 */
public record GenerationContext(String genre, String mood, NameType type, int wordCount) {

    public GenerationContext {
        if (wordCount < 1) throw new IllegalArgumentException("wordCount must be >= 1, got " + wordCount);
        if (type == null) type = NameType.BAND;
    }

    public static GenerationContext ofWordCount(int wordCount) {
        return new GenerationContext(null, null, NameType.BAND, wordCount);
    }

    public GenerationContext withWordCount(int newWordCount) {
        return new GenerationContext(genre, mood, type, newWordCount);
    }
}
