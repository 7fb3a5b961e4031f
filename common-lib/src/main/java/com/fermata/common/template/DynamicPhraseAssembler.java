package com.fermata.common.template;

import com.fermata.common.wordsource.WordSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Template-free fallback that assembles a phrase of exactly the requested length straight
 * from the word source.
 *
 * <p>Used when eligibility filtering leaves no template for a shape (for example an 11-word
 * request, or a mood that excludes every long template). Shapes:
 * <ul>
 *   <li>1 word: noun</li>
 *   <li>2 words: adjective noun</li>
 *   <li>3 words: The adjective noun</li>
 *   <li>4+ words: adjective noun verb, then a prepositional tail</li>
 * </ul>
 */
public final class DynamicPhraseAssembler {

    /** Template id reported in metadata for assembled phrases. */
    public static final String DYNAMIC_ID = "dynamic_assembly";

    private DynamicPhraseAssembler() {}

    public static String assemble(int wordCount, WordSource source, String genre, Random rng) {
        if (wordCount < 1) throw new IllegalArgumentException("wordCount must be >= 1, got " + wordCount);
        TemplateGenerator.Slots s = new TemplateGenerator.Slots(source, TemplateLibrary.genreModifiers(genre), rng);

        List<String> words = new ArrayList<>();
        switch (wordCount) {
            case 1 -> words.add(s.noun());
            case 2 -> {
                words.add(s.adjective());
                words.add(PhraseText.singularize(s.noun()));
            }
            case 3 -> {
                words.add("the");
                words.add(s.adjective());
                words.add(PhraseText.singularize(s.noun()));
            }
            default -> {
                words.add(s.adjective());
                words.add(PhraseText.singularize(s.noun()));
                words.add(TemplateGenerator.finiteVerb(s.verb()));
                words.addAll(TemplateGenerator.tail(wordCount - 3, s));
            }
        }
        List<String> out = new ArrayList<>(words.size());
        for (String word : words) out.add(PhraseText.capitalize(word));
        return String.join(" ", out);
    }
}
