package com.fermata.common.exception;

/** Raised when no template covers the requested shape after eligibility filtering. */
public class NoEligibleTemplatesException extends GenerationException {
    private final int wordCount;

    public NoEligibleTemplatesException(int wordCount, String detail) {
        super("Selection", "no eligible templates for wordCount=" + wordCount + " (" + detail + ")");
        this.wordCount = wordCount;
    }

    public int getWordCount() {
        return wordCount;
    }
}
