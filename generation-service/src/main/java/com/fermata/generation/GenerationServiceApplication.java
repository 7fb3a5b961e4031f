package com.fermata.generation;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class GenerationServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(GenerationServiceApplication.class, args);
    }
}
