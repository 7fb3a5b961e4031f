package com.fermata.common.exception;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class GenerationExceptionTest {

    @Test
    @DisplayName("message is prefixed with the component")
    void message_prefixed() {
        GenerationException e = new GenerationException("Selection", "nothing eligible");
        assertEquals("[Selection] nothing eligible", e.getMessage());
        assertEquals("Selection", e.getComponent());
    }

    @Test
    @DisplayName("subtypes keep their context fields")
    void subtypes_carryContext() {
        FusionExhaustedException exhausted = new FusionExhaustedException("rock", "jazz", 12);
        assertEquals(12, exhausted.getAttempts());
        assertTrue(exhausted.getMessage().startsWith("["));

        NoEligibleTemplatesException none = new NoEligibleTemplatesException(11, "no template covers 11 words");
        assertEquals(11, none.getWordCount());
        assertInstanceOf(GenerationException.class, none);
    }
}
