package com.fermata.common.fusion;

import com.fermata.common.genre.FusedVocabulary;
import com.fermata.common.genre.FusionStyle;
import com.fermata.common.template.PhraseText;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Pre-authored name shape for one genre pair, filled slot by slot.
 *
 * <p>To shorten, optional slots are dropped first, then trailing slots. To lengthen, single
 * hybrid words from the fused vocabulary are appended.
 */
public record PairFusionTemplate(
    String id,
    String firstGenre,
    String secondGenre,
    FusionStyle style,
    int minWordCount,
    int maxWordCount,
    List<Slot> slots,
    List<String> examples
) {

    /** One word position and its candidates; optional slots go first when shortening. */
    public record Slot(List<String> options, boolean optional) {

        public Slot {
            options = List.copyOf(options);
        }

        public static Slot of(String... options) {
            return new Slot(List.of(options), false);
        }

        public static Slot optional(String... options) {
            return new Slot(List.of(options), true);
        }
    }

    public PairFusionTemplate {
        slots = List.copyOf(slots);
        examples = List.copyOf(examples);
    }

    public boolean covers(String a, String b) {
        return (firstGenre.equals(a) && secondGenre.equals(b)) || (firstGenre.equals(b) && secondGenre.equals(a));
    }

    public String generate(int wordCount, FusedVocabulary vocabulary, Random rng) {
        List<Slot> used = new ArrayList<>(slots);
        for (int i = used.size() - 1; i >= 0 && used.size() > wordCount; i--) {
            if (used.get(i).optional()) used.remove(i);
        }
        while (used.size() > Math.max(1, wordCount)) used.remove(used.size() - 1);

        List<String> words = new ArrayList<>();
        for (Slot slot : used) {
            words.add(PhraseText.pick(slot.options(), rng, ""));
        }
        List<String> extras = vocabulary.singleWords();
        while (words.size() < wordCount && !extras.isEmpty()) {
            String extra = PhraseText.pick(extras, rng, "");
            if (words.contains(extra)) break;
            words.add(extra);
        }
        return PhraseText.titleCase(String.join(" ", words));
    }
}
