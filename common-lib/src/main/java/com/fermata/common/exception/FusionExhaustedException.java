package com.fermata.common.exception;

/** Raised when every fusion method failed validation for the whole attempt budget. */
public class FusionExhaustedException extends GenerationException {
    private final String primaryGenre;
    private final String secondaryGenre;
    private final int attempts;

    public FusionExhaustedException(String primaryGenre, String secondaryGenre, int attempts) {
        super("Fusion", "no valid candidate for " + primaryGenre + " + " + secondaryGenre
            + " after " + attempts + " attempts");
        this.primaryGenre = primaryGenre;
        this.secondaryGenre = secondaryGenre;
        this.attempts = attempts;
    }

    public String getPrimaryGenre() {
        return primaryGenre;
    }

    public String getSecondaryGenre() {
        return secondaryGenre;
    }

    public int getAttempts() {
        return attempts;
    }
}
