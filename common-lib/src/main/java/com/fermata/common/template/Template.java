package com.fermata.common.template;

import java.util.List;
import java.util.Set;

/**
 * Immutable phrase-generation rule.
 *
 * <p>{@code applicableGenres} / {@code applicableMoods} are restriction sets: an empty set means
 * the template is universal for that axis. The word-count range is inclusive. Generation is
 * performed by {@link TemplateGenerator} from {@link #kind()}; the record itself holds only data.
 *
 * @param id               unique identifier, e.g. {@code "action_object"}
 * @param kind             generation rule discriminator
 * @param category         free-form tag used for context matching
 * @param subcategory      finer tag used for diversity tracking
 * @param weight           prior probability mass
 * @param minWordCount     smallest output length (inclusive)
 * @param maxWordCount     largest output length (inclusive)
 * @param applicableGenres genre restriction; empty = universal
 * @param applicableMoods  mood restriction; empty = universal
 * @param shape            human-readable slot layout, e.g. {@code "{action_verb} {target_noun}"}
 * @param examples         documented sample outputs
 */
public record Template(
    String id,
    TemplateKind kind,
    String category,
    String subcategory,
    double weight,
    int minWordCount,
    int maxWordCount,
    Set<String> applicableGenres,
    Set<String> applicableMoods,
    String shape,
    List<String> examples
) {

    public Template {
        if (minWordCount < 1 || maxWordCount < minWordCount) {
            throw new IllegalArgumentException("invalid word-count range for " + id
                + ": [" + minWordCount + "," + maxWordCount + "]");
        }
        applicableGenres = applicableGenres == null ? Set.of() : Set.copyOf(applicableGenres);
        applicableMoods  = applicableMoods == null ? Set.of() : Set.copyOf(applicableMoods);
        examples         = examples == null ? List.of() : List.copyOf(examples);
    }

    public boolean covers(int wordCount) {
        return wordCount >= minWordCount && wordCount <= maxWordCount;
    }

    /** True when the template produces exactly one length. */
    public boolean isFixedLength() {
        return minWordCount == maxWordCount;
    }

    public boolean allowsGenre(String genre) {
        return genre == null || applicableGenres.isEmpty() || applicableGenres.contains(genre);
    }

    public boolean allowsMood(String mood) {
        return mood == null || applicableMoods.isEmpty() || applicableMoods.contains(mood);
    }

    /** Whether {@code shape} contains the given slot name, e.g. {@code "concept"}. */
    public boolean hasSlot(String slot) {
        return shape != null && shape.contains("{" + slot);
    }
}
