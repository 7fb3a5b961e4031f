package com.fermata.generation.controller;

import com.fermata.common.template.TemplateLibrary;
import com.fermata.generation.model.GeneratedName;
import com.fermata.generation.model.GenerationRequest;
import com.fermata.generation.service.GenerationDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/names")
public class GenerationController {

    private static final Logger log = LoggerFactory.getLogger(GenerationController.class);

    private final GenerationDriver driver;
    private final TemplateLibrary templateLibrary;

    public GenerationController(GenerationDriver driver, TemplateLibrary templateLibrary) {
        this.driver = driver;
        this.templateLibrary = templateLibrary;
    }

    @PostMapping
    public Mono<ResponseEntity<List<GeneratedName>>> generate(@RequestBody GenerationRequest request) {
        return driver.generate(request)
            .map(ResponseEntity::ok)
            .onErrorResume(IllegalArgumentException.class, e -> {
                log.warn("Rejected generation request: {}", e.getMessage());
                return Mono.just(ResponseEntity.badRequest().build());
            });
    }

    @GetMapping("/templates/stats")
    public ResponseEntity<TemplateLibrary.LibraryStatistics> templateStats() {
        return ResponseEntity.ok(templateLibrary.statistics());
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
