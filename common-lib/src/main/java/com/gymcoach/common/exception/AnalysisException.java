package com.gymcoach.common.exception;

/**
 * Raised only for programming-contract violations (for example a {@code null} profile
 * where one is required). Bad or missing training data never raises this; it is
 * reported through {@link com.gymcoach.common.result.Result} instead.
 */
public class AnalysisException extends RuntimeException {
    private final String component;

    public AnalysisException(String component, String message) {
        super("[" + component + "] " + message);
        this.component = component;
    }

    public AnalysisException(String component, String message, Throwable cause) {
        super("[" + component + "] " + message, cause);
        this.component = component;
    }

    public String getComponent() {
        return component;
    }
}
