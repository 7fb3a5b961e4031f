package com.fermata.common.selection;

import com.fermata.common.template.Template;

/**
 * Rewards templates whose category suits the request axes.
 *
 * <h3>Score</h3>
 * Starts at {@value #BASE} and adds, for each axis whose mapped categories contain the template's
 * category: genre {@value #GENRE_BONUS}, mood {@value #MOOD_BONUS}, intensity and creativity
 * {@value #LEVEL_BONUS} each, name type {@value #TYPE_BONUS}. Capped at 1.0.
 */
public final class ContextMatchScorer {

    private ContextMatchScorer() {}

    public static final double BASE        = 0.5;
    public static final double GENRE_BONUS = 0.3;
    public static final double MOOD_BONUS  = 0.2;
    public static final double LEVEL_BONUS = 0.15;
    public static final double TYPE_BONUS  = 0.1;

    public static double score(Template template, SelectionCriteria criteria) {
        String category = template.category();
        double score = BASE;
        if (CategoryMappings.forGenre(criteria.genre()).contains(category))             score += GENRE_BONUS;
        if (CategoryMappings.forMood(criteria.mood()).contains(category))               score += MOOD_BONUS;
        if (CategoryMappings.forIntensity(criteria.intensity()).contains(category))     score += LEVEL_BONUS;
        if (CategoryMappings.forCreativity(criteria.creativity()).contains(category))   score += LEVEL_BONUS;
        if (CategoryMappings.forType(criteria.type()).contains(category))               score += TYPE_BONUS;
        return Math.min(score, 1.0);
    }
}
