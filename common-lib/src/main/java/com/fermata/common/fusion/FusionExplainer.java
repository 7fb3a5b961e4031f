package com.fermata.common.fusion;

import com.fermata.common.genre.CompatibilityEntry;
import com.fermata.common.genre.FusedVocabulary;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/** Builds the human-readable {@link FusionExplanations} attached to each result. */
final class FusionExplainer {

    private FusionExplainer() {}

    private static final Map<String, List<String>> GENRE_MARKERS = Map.of(
        "electronic", List.of("digital", "cyber", "synth", "electric", "circuit", "pulse"),
        "jazz",       List.of("jazz", "swing", "bebop", "harmon", "improvis", "blue"),
        "rock",       List.of("rock", "thunder", "electric", "power", "steel", "storm"),
        "folk",       List.of("folk", "acoustic", "heritage", "organic", "ballad", "roots"),
        "hip-hop",    List.of("flow", "beat", "cipher", "rhythm", "street", "urban"),
        "classical",  List.of("symphon", "orchestr", "sonata", "concerto", "harmon", "chamber")
    );

    static FusionExplanations explain(String name, CompatibilityEntry entry, FusedVocabulary vocabulary,
                                      FusionAnalysis analysis) {
        String strength = entry.score() > 0.7 ? "strong" : "moderate";
        String synergies = entry.synergies().stream().limit(2).collect(Collectors.joining(". "));
        String rationale = "Blends " + entry.primary() + " and " + entry.secondary() + " with a "
            + entry.fusionStyle().id() + " approach on their " + strength + " compatibility."
            + (synergies.isEmpty() ? "" : " " + synergies + ".");

        List<String> influences = List.of(
            entry.primary() + ": " + influence(name, entry.primary()),
            entry.secondary() + ": " + influence(name, entry.secondary()));

        List<String> creative = new ArrayList<>();
        String lower = name.toLowerCase(Locale.ROOT);
        if (vocabulary.hybridTerms().stream().anyMatch(t -> lower.contains(t.toLowerCase(Locale.ROOT)))) {
            creative.add("hybrid terminology");
        }
        if (vocabulary.conceptualBlends().stream().anyMatch(t -> lower.contains(t.toLowerCase(Locale.ROOT)))) {
            creative.add("conceptual bridge");
        }
        creative.add("cross-genre vocabulary synthesis");

        String appeal;
        if (analysis.marketViability() > 0.7) appeal = "broad audience potential";
        else if (analysis.marketViability() > 0.4) appeal = "niche audience strength";
        else appeal = "experimental audience appeal";

        return new FusionExplanations(rationale, influences, creative, appeal);
    }

    static String influence(String name, String genre) {
        String lower = name.toLowerCase(Locale.ROOT);
        List<String> found = GENRE_MARKERS.getOrDefault(genre, List.of()).stream()
            .filter(lower::contains)
            .collect(Collectors.toList());
        return found.isEmpty() ? "structural and tonal foundation" : "contributes " + String.join(", ", found);
    }
}
