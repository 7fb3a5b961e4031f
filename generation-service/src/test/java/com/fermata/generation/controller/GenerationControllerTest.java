package com.fermata.generation.controller;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;

/**
 * HTTP surface of the generation service with the Datamuse lookup switched off.
 * Bodies travel as snake_case.
 */
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT,
                properties = "fermata.datamuse.enabled=false")
class GenerationControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @Test
    @DisplayName("POST with snake_case body → 200 and the requested number of names")
    void generate_ok() {
        webTestClient.post().uri("/api/v1/names")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"genre\":\"jazz\",\"mood\":\"peaceful\",\"word_count\":\"2\",\"count\":3}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(3)
            .jsonPath("$[0].name").isNotEmpty()
            .jsonPath("$[0].metadata.source").isNotEmpty()
            .jsonPath("$[0].metadata.quality_score").isNumber();
    }

    @Test
    @DisplayName("POST fusion request → names carry fusion metadata or degrade gracefully")
    void generate_fusion() {
        webTestClient.post().uri("/api/v1/names")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"genre\":\"electronic\",\"secondary_genre\":\"jazz\",\"count\":2,\"intensity\":\"bold\"}")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.length()").isEqualTo(2);
    }

    @Test
    @DisplayName("non-numeric word_count → 400")
    void badWordCount_badRequest() {
        webTestClient.post().uri("/api/v1/names")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"word_count\":\"abc\"}")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("secondary_genre without genre → 400")
    void secondaryWithoutGenre_badRequest() {
        webTestClient.post().uri("/api/v1/names")
            .contentType(MediaType.APPLICATION_JSON)
            .bodyValue("{\"secondary_genre\":\"jazz\"}")
            .exchange()
            .expectStatus().isBadRequest();
    }

    @Test
    @DisplayName("GET /templates/stats → library totals")
    void templateStats() {
        webTestClient.get().uri("/api/v1/names/templates/stats")
            .exchange()
            .expectStatus().isOk()
            .expectBody()
            .jsonPath("$.total_templates").isEqualTo(24)
            .jsonPath("$.by_word_count['2']").isEqualTo(7);
    }

    @Test
    @DisplayName("GET /health → OK")
    void health() {
        webTestClient.get().uri("/api/v1/names/health")
            .exchange()
            .expectStatus().isOk()
            .expectBody(String.class).isEqualTo("OK");
    }
}
