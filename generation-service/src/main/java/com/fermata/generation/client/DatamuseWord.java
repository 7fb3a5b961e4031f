package com.fermata.generation.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/** One entry of a Datamuse {@code /words} response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record DatamuseWord(String word, int score, List<String> tags) {

    public DatamuseWord {
        tags = tags == null ? List.of() : List.copyOf(tags);
    }
}
