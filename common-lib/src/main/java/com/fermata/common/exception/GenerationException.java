package com.fermata.common.exception;

/**
 * Base type for every recoverable failure raised by the generative core.
 *
 * <p>Messages are rendered as {@code "[component] message"} so log lines identify
 * the stage that gave up without a stack trace.
 */
public class GenerationException extends RuntimeException {
    private final String component;

    public GenerationException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public GenerationException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
