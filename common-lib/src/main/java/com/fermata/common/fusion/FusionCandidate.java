package com.fermata.common.fusion;

import java.util.List;

/**
 * Raw output of one fusion method before scoring.
 *
 * @param patternSources ids of the templates or constructs the name came from
 * @param fusionElements hybrid or blend constructs the name contains
 */
public record FusionCandidate(String name, FusionMethod method, List<String> patternSources, List<String> fusionElements) {

    public FusionCandidate {
        patternSources = List.copyOf(patternSources);
        fusionElements = List.copyOf(fusionElements);
    }
}
