package com.fermata.common.mood;

import java.util.ArrayList;
import java.util.List;

/**
 * A mood defined as a weighted blend of simpler moods.
 *
 * @param id             lower-case name, e.g. {@code bittersweet}
 * @param primaryMood    dominant component; its profile stands in for keywords and affinities
 * @param secondaryMoods remaining components
 * @param blendRatio     one weight per component, primary first; sums to 1
 * @param examples       sample names in this mood
 */
public record ComplexMood(
    String id,
    String primaryMood,
    List<String> secondaryMoods,
    List<Double> blendRatio,
    List<String> examples
) {

    public ComplexMood {
        secondaryMoods = List.copyOf(secondaryMoods);
        blendRatio = List.copyOf(blendRatio);
        examples = List.copyOf(examples);
        if (blendRatio.size() != secondaryMoods.size() + 1) {
            throw new IllegalArgumentException("blendRatio must have one weight per component mood: " + id);
        }
    }

    /** Primary first, then the secondaries in declaration order. */
    public List<String> components() {
        List<String> all = new ArrayList<>();
        all.add(primaryMood);
        all.addAll(secondaryMoods);
        return all;
    }
}
