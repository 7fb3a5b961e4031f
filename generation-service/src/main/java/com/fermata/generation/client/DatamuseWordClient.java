package com.fermata.generation.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Fetches related words from the Datamuse {@code /words} endpoint.
 *
 * <p>Every call degrades to an empty list: transport errors, 5xx responses and the overall
 * timeout are logged and swallowed into {@code Mono.just(List.of())} so a slow or absent
 * lexical service never fails a generation request. When disabled through
 * {@code fermata.datamuse.enabled=false} no request is made at all.
 */
public class DatamuseWordClient {

    private static final Logger log = LoggerFactory.getLogger(DatamuseWordClient.class);

    private final WebClient webClient;
    private final boolean enabled;
    private final int maxResults;
    private final Duration timeout;

    public DatamuseWordClient(WebClient datamuseWebClient, boolean enabled, int maxResults, Duration timeout) {
        this.webClient  = datamuseWebClient;
        this.enabled    = enabled;
        this.maxResults = maxResults;
        this.timeout    = timeout;
    }

    public boolean isEnabled() {
        return enabled;
    }

    /** Words whose meaning is close to {@code seed}, optionally nudged towards {@code topics}. */
    public Mono<List<String>> meansLike(String seed, String topics) {
        return fetch("ml=" + seed, uri -> {
            uri.path("/words").queryParam("ml", seed).queryParam("max", maxResults);
            if (topics != null && !topics.isBlank()) uri.queryParam("topics", topics);
            return uri.build();
        });
    }

    /** Adjectives commonly used to modify {@code noun}. */
    public Mono<List<String>> adjectivesFor(String noun) {
        return fetch("rel_jja=" + noun, uri -> uri
            .path("/words")
            .queryParam("rel_jja", noun)
            .queryParam("max", maxResults)
            .build());
    }

    private Mono<List<String>> fetch(String query, Function<UriBuilder, URI> uri) {
        if (!enabled) return Mono.just(List.of());

        return webClient.get()
            .uri(uri)
            .retrieve()
            .bodyToFlux(DatamuseWord.class)
            .map(DatamuseWord::word)
            .filter(word -> word != null && !word.isBlank())
            .map(word -> word.trim().toLowerCase(Locale.ROOT))
            .collect(Collectors.toList())
            .timeout(timeout)
            .doOnSuccess(words -> log.debug("[Datamuse] query={} words={}", query, words.size()))
            .onErrorResume(e -> {
                log.warn("[Datamuse] Lookup failed, continuing without it. query={} err={}", query, e.getMessage());
                return Mono.just(List.of());
            });
    }
}
