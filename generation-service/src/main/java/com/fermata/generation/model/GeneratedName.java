package com.fermata.generation.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One generated name with path-dependent metadata. Every entry carries {@code source} and a
 * {@code quality_score} within [0, 1].
 */
public record GeneratedName(String name, Map<String, Object> metadata) {

    public static final String SOURCE = "source";
    public static final String QUALITY_SCORE = "quality_score";
    public static final String TEMPLATE_ID = "template_id";

    public GeneratedName {
        metadata = Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public String source() {
        return (String) metadata.get(SOURCE);
    }

    public double qualityScore() {
        Object score = metadata.get(QUALITY_SCORE);
        return score instanceof Number n ? n.doubleValue() : 0.0;
    }
}
