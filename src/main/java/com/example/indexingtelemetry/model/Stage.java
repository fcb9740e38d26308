package com.example.indexingtelemetry.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Steps of the external indexing pipeline, in their semantic order.
 * {@link #BATCH_START} and {@link #SUMMARY} are markers that carry no item state.
 */
public enum Stage {
    BATCH_START(0, false),
    RETRIEVAL(1, false),
    FILTERING(2, false),
    GENERATION(3, false),
    SANITIZATION(4, false),
    SUBMISSION(5, true),
    DELETION(6, true),
    SUMMARY(0, false);

    private final int order;
    private final boolean terminal;

    Stage(int order, boolean terminal) {
        this.order = order;
        this.terminal = terminal;
    }

    public int getOrder() {
        return order;
    }

    public boolean isTerminal() {
        return terminal;
    }

    public boolean isPipelineStage() {
        return order > 0;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Stage> fromWireName(String value) {
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Stage.valueOf(value.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
