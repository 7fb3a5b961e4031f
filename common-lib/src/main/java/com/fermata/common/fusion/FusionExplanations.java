package com.fermata.common.fusion;

import java.util.List;

/** Human-readable account of why a fused name looks the way it does. */
public record FusionExplanations(String rationale, List<String> genreInfluences, List<String> creativeElements,
                                 String marketAppeal) {

    public FusionExplanations {
        genreInfluences = List.copyOf(genreInfluences);
        creativeElements = List.copyOf(creativeElements);
    }
}
