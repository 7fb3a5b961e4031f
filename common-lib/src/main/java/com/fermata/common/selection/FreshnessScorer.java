package com.fermata.common.selection;

import com.fermata.common.guard.RepetitionGuard;
import com.fermata.common.template.Template;

/**
 * Penalises templates the guard has seen recently.
 *
 * <p>Starts at 1.0; subtracts {@value #RECENT_PENALTY} when the template is in the recent queue,
 * {@value #CATEGORY_PENALTY} when its category count exceeds the guard's category threshold and
 * {@value #SUBCATEGORY_PENALTY} when its subcategory count exceeds the subcategory threshold.
 * Floored at 0.
 */
public final class FreshnessScorer {

    private FreshnessScorer() {}

    public static final double RECENT_PENALTY      = 0.6;
    public static final double CATEGORY_PENALTY    = 0.4;
    public static final double SUBCATEGORY_PENALTY = 0.3;

    public static double score(Template template, RepetitionGuard guard) {
        if (guard == null) return 1.0;
        double score = 1.0;
        if (guard.isRecentTemplate(template.id())) score -= RECENT_PENALTY;
        if (guard.categoryCount(template.category()) > guard.settings().categoryThreshold()) {
            score -= CATEGORY_PENALTY;
        }
        if (guard.subcategoryCount(template.subcategory()) > guard.settings().subcategoryThreshold()) {
            score -= SUBCATEGORY_PENALTY;
        }
        return Math.max(score, 0.0);
    }
}
