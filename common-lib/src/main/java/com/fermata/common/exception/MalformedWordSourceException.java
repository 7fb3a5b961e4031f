package com.fermata.common.exception;

/** Raised when a raw word-source category is not a list of strings. */
public class MalformedWordSourceException extends GenerationException {
    private final String category;

    public MalformedWordSourceException(String category, String message) {
        super("WordSource", "category=" + category + " " + message);
        this.category = category;
    }

    public String getCategory() {
        return category;
    }
}
