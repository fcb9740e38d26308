package com.example.indexingtelemetry.analysis;

import java.util.Optional;

/**
 * Outcome of a read-side query: either a value or the reason nothing was found.
 */
public final class AnalysisResult<T> {

    private final T value;
    private final String message;

    private AnalysisResult(T value, String message) {
        this.value = value;
        this.message = message;
    }

    public static <T> AnalysisResult<T> found(T value) {
        return new AnalysisResult<>(value, null);
    }

    public static <T> AnalysisResult<T> notFound(String message) {
        return new AnalysisResult<>(null, message);
    }

    public boolean isFound() {
        return value != null;
    }

    public Optional<T> getValue() {
        return Optional.ofNullable(value);
    }

    public T orElseThrow() {
        if (value == null) {
            throw new IllegalStateException(message);
        }
        return value;
    }

    public String getMessage() {
        return message;
    }

    @Override
    public String toString() {
        return isFound() ? "AnalysisResult{found=" + value + "}" : "AnalysisResult{notFound=" + message + "}";
    }
}
