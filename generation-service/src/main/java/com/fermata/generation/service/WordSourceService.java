package com.fermata.generation.service;

import com.fermata.common.wordsource.DefaultWordPools;
import com.fermata.common.wordsource.WordCategory;
import com.fermata.common.wordsource.WordFilter;
import com.fermata.common.wordsource.WordSeeds;
import com.fermata.common.wordsource.WordSource;
import com.fermata.common.wordsource.WordSourceNormalizer;
import com.fermata.generation.client.DatamuseWordClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Builds the {@link WordSource} for one request.
 *
 * <p>Seed vocabulary for the genre and mood is always present. When the Datamuse client is
 * enabled, related words are fetched concurrently and appended to the raw lists before the
 * core normalizer filters them. A failed or slow lookup contributes nothing.
 */
@Service
public class WordSourceService {

    private static final Logger log = LoggerFactory.getLogger(WordSourceService.class);

    static final int EMOTIONAL_SEEDS = 2;
    static final int SENSORY_SEEDS = 2;
    static final int PART_OF_SPEECH_SEEDS = 3;
    static final List<String> MUSICAL_SEEDS = List.of("melody", "rhythm");

    private final DatamuseWordClient datamuse;

    public WordSourceService(DatamuseWordClient datamuse) {
        this.datamuse = datamuse;
    }

    public Mono<WordSource> build(String genre, String mood) {
        Map<WordCategory, List<String>> seeds = seedCategories(genre, mood);
        String name = sourceName(genre, mood);

        if (!datamuse.isEnabled()) {
            return Mono.fromCallable(() -> WordSourceNormalizer.fromCategories(name, seeds));
        }

        return Flux.merge(lookups(genre, mood))
            .collectList()
            .map(contributions -> {
                Map<WordCategory, List<String>> combined = new EnumMap<>(WordCategory.class);
                seeds.forEach((category, words) -> combined.put(category, new ArrayList<>(words)));
                for (Contribution contribution : contributions) {
                    combined.computeIfAbsent(contribution.category(), c -> new ArrayList<>())
                        .addAll(contribution.words());
                }
                WordSource source = WordSourceNormalizer.fromCategories(name, combined);
                log.info("[WordSource] Built. name={} fetchedWords={} filtered={}",
                         name, contributions.stream().mapToInt(c -> c.words().size()).sum(),
                         source.allFiltered().size());
                return source;
            });
    }

    static Map<WordCategory, List<String>> seedCategories(String genre, String mood) {
        Map<WordCategory, List<String>> seeds = new EnumMap<>(WordCategory.class);
        WordSeeds.SeedPair poetic = WordSeeds.poeticSeeds(mood, genre);
        seeds.put(WordCategory.ADJECTIVES, WordSeeds.adjectiveSeeds(mood, genre));
        seeds.put(WordCategory.NOUNS, WordSeeds.nounSeeds(mood, genre));
        seeds.put(WordCategory.VERBS, WordSeeds.verbSeeds(mood, genre));
        seeds.put(WordCategory.GENRE_TERMS, DefaultWordPools.genreTerms(genre));
        seeds.put(WordCategory.CONTEXTUAL_WORDS, poetic.emotional());
        seeds.put(WordCategory.ASSOCIATED_WORDS, poetic.sensory());
        return seeds;
    }

    private List<Mono<Contribution>> lookups(String genre, String mood) {
        WordSeeds.SeedPair poetic = WordSeeds.poeticSeeds(mood, genre);
        List<Mono<Contribution>> lookups = new ArrayList<>();

        for (String seed : head(poetic.emotional(), EMOTIONAL_SEEDS)) {
            lookups.add(contribution(WordCategory.CONTEXTUAL_WORDS,
                datamuse.meansLike(seed, "music poetry emotion"), 8, WordSourceService::midLength));
        }
        for (String seed : head(poetic.sensory(), SENSORY_SEEDS)) {
            lookups.add(contribution(WordCategory.ASSOCIATED_WORDS,
                datamuse.meansLike(seed, "nature poetry music"), 10, word -> true));
        }
        for (String seed : MUSICAL_SEEDS) {
            lookups.add(contribution(WordCategory.MUSICAL_TERMS,
                datamuse.meansLike(seed, "music sound poetry"), 5, WordSourceService::midLength));
        }
        for (String seed : head(WordSeeds.adjectiveSeeds(mood, genre), PART_OF_SPEECH_SEEDS)) {
            lookups.add(contribution(WordCategory.ADJECTIVES,
                datamuse.adjectivesFor(seed), 10, WordSourceService::midLength));
        }
        for (String seed : head(WordSeeds.nounSeeds(mood, genre), PART_OF_SPEECH_SEEDS)) {
            lookups.add(contribution(WordCategory.NOUNS,
                datamuse.meansLike(seed, "music poetry nature emotion"), 10, WordSourceService::midLength));
        }
        for (String seed : head(WordSeeds.verbSeeds(mood, genre), 2)) {
            lookups.add(contribution(WordCategory.VERBS,
                datamuse.meansLike(seed, "music poetry action emotion"), 8, WordFilter::isActionWord));
        }
        return lookups;
    }

    private static Mono<Contribution> contribution(WordCategory category, Mono<List<String>> words,
                                                   int limit, Predicate<String> extra) {
        return words.map(list -> new Contribution(category, list.stream()
            .filter(WordFilter::isAcceptable)
            .filter(extra)
            .limit(limit)
            .collect(Collectors.toList())));
    }

    private static boolean midLength(String word) {
        return word.length() >= 4 && word.length() <= 10;
    }

    private static List<String> head(List<String> list, int n) {
        return list.subList(0, Math.min(n, list.size()));
    }

    private static String sourceName(String genre, String mood) {
        return (genre == null ? "any" : genre) + "/" + (mood == null ? "any" : mood);
    }

    private record Contribution(WordCategory category, List<String> words) {}
}
