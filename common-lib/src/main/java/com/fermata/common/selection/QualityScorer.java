package com.fermata.common.selection;

import com.fermata.common.template.Template;
import com.fermata.common.wordsource.WordCategory;
import com.fermata.common.wordsource.WordSource;

/**
 * Intrinsic template quality, independent of the request.
 *
 * <ol>
 *   <li>base {@value #BASE}</li>
 *   <li>+{@value #EXAMPLES_BONUS} with at least {@value #MIN_EXAMPLES} documented examples</li>
 *   <li>+{@value #RICH_SOURCE_BONUS} for descriptive templates over a rich adjective pool, and for
 *       narrative templates over a rich verb pool</li>
 *   <li>+{@value #BALANCED_WEIGHT_BONUS} when the prior weight sits in [0.1, 0.3]</li>
 * </ol>
 */
public final class QualityScorer {

    private QualityScorer() {}

    public static final double BASE                  = 0.5;
    public static final double EXAMPLES_BONUS        = 0.2;
    public static final double RICH_SOURCE_BONUS     = 0.15;
    public static final double BALANCED_WEIGHT_BONUS = 0.1;
    public static final int    MIN_EXAMPLES          = 3;

    static final int RICH_ADJECTIVES = 20;
    static final int RICH_VERBS = 15;

    public static double score(Template template, WordSource source) {
        double score = BASE;
        if (template.examples().size() >= MIN_EXAMPLES) score += EXAMPLES_BONUS;

        if (source != null) {
            if ("descriptive".equals(template.category())
                && source.filteredCount(WordCategory.ADJECTIVES) > RICH_ADJECTIVES) {
                score += RICH_SOURCE_BONUS;
            }
            if ("narrative".equals(template.category())
                && source.filteredCount(WordCategory.VERBS) > RICH_VERBS) {
                score += RICH_SOURCE_BONUS;
            }
        }

        if (template.weight() >= 0.1 && template.weight() <= 0.3) score += BALANCED_WEIGHT_BONUS;
        return Math.min(score, 1.0);
    }
}
