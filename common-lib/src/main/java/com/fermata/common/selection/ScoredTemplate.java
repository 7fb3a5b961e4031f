package com.fermata.common.selection;

import com.fermata.common.template.Template;

import java.util.ArrayList;
import java.util.List;

/**
 * One eligible template with its factor scores.
 *
 * <p>{@code moodAlignment} and {@code coherence} are 0.5 on the traditional path.
 */
public record ScoredTemplate(
    Template template,
    double score,
    ScoringMode mode,
    double contextMatch,
    double quality,
    double freshness,
    double moodAlignment,
    double coherence
) {

    public ScoredTemplate withScore(double newScore) {
        return new ScoredTemplate(template, newScore, mode, contextMatch, quality, freshness, moodAlignment, coherence);
    }

    /** Short human-readable reasons, mainly for debug logs and stats. */
    public List<String> reasons() {
        List<String> reasons = new ArrayList<>();
        if (contextMatch > 0.7) reasons.add("excellent context match");
        else if (contextMatch > 0.5) reasons.add("good context match");
        if (quality > 0.7) reasons.add("high quality");
        if (freshness > 0.8) reasons.add("fresh");
        if (template.weight() > 0.2) reasons.add("reliable");
        if (mode == ScoringMode.MOOD_DRIVEN) {
            if (moodAlignment > 0.8) reasons.add("excellent mood alignment");
            else if (moodAlignment > 0.6) reasons.add("good mood alignment");
            else if (moodAlignment < 0.4) reasons.add("poor mood alignment");
        }
        return reasons;
    }
}
