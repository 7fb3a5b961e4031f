package com.fermata.common.exception;

/** Raised when a fusion is requested for a genre pair the compatibility model does not know. */
public class IncompatibleGenresException extends GenerationException {
    private final String primaryGenre;
    private final String secondaryGenre;

    public IncompatibleGenresException(String primaryGenre, String secondaryGenre) {
        super("Fusion", "no compatibility entry for " + primaryGenre + " + " + secondaryGenre);
        this.primaryGenre = primaryGenre;
        this.secondaryGenre = secondaryGenre;
    }

    public String getPrimaryGenre() {
        return primaryGenre;
    }

    public String getSecondaryGenre() {
        return secondaryGenre;
    }
}
