package com.fermata.common.fusion;

import com.fermata.common.genre.CompatibilityEntry;
import com.fermata.common.genre.FusedVocabulary;
import com.fermata.common.selection.SelectionEngine;
import com.fermata.common.selection.SelectionSession;
import com.fermata.common.wordsource.WordSource;

import java.util.Random;

/**
 * Everything a {@link FusionStrategy} may read for one call.
 *
 * @param entry  compatibility entry oriented as (primary, secondary)
 * @param source word source with the fused vocabulary merged in
 */
public record FusionContext(
    FusionRequest request,
    CompatibilityEntry entry,
    FusedVocabulary vocabulary,
    WordSource source,
    SelectionEngine selection,
    SelectionSession session
) {

    public Random random() {
        return session.random();
    }

    public int wordCount() {
        return request.wordCount();
    }
}
