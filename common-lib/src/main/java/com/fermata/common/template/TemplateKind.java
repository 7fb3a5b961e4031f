package com.fermata.common.template;

/**
 * Discriminator for the phrase-building rule behind a {@link Template}.
 *
 * <p>{@link TemplateGenerator} dispatches on this value; a template carries no behaviour of its own.
 */
public enum TemplateKind {
    // single word
    ABSTRACT_CONCEPT,
    COMPOUND_CREATION,
    SUFFIX_EVOLUTION,
    NUMERIC_MYSTIQUE,
    RARE_SINGULAR,
    // two words
    DYNAMIC_ADJECTIVE_NOUN,
    CONTRASTING_ELEMENTS,
    ACTION_OBJECT,
    TECHNO_ORGANIC,
    EMOTIONAL_LANDSCAPE,
    TEMPORAL_CONCEPT,
    NUMBERED_CONCEPT,
    // three words
    CLASSIC_THE_ADJECTIVE_NOUN,
    NARRATIVE_SEQUENCE,
    QUESTION_FORMAT,
    LOCATION_ACTION,
    EMOTIONAL_JOURNEY,
    COMPOUND_MODIFIER,
    SENSORY_EXPERIENCE,
    // four or more words
    COMPLETE_NARRATIVE,
    POETIC_SEQUENCE,
    PHILOSOPHICAL_STATEMENT,
    TEMPORAL_JOURNEY,
    CONDITIONAL_NARRATIVE
}
