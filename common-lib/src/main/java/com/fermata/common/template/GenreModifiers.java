package com.fermata.common.template;

import java.util.List;

/** Genre-flavoured vocabulary mixed into template slots when the request names that genre. */
public record GenreModifiers(List<String> adjectives, List<String> nouns, List<String> verbs, List<String> themes) {

    public GenreModifiers {
        adjectives = List.copyOf(adjectives);
        nouns = List.copyOf(nouns);
        verbs = List.copyOf(verbs);
        themes = List.copyOf(themes);
    }

    public static GenreModifiers none() {
        return new GenreModifiers(List.of(), List.of(), List.of(), List.of());
    }
}
