package com.example.indexingtelemetry.model;

import java.util.Locale;

/**
 * Outcome of an item's latest attempt within one session.
 */
public enum FinalStatus {
    INDEXED,
    SKIPPED,
    FAILED,
    UNKNOWN;

    public boolean isTerminal() {
        return this != UNKNOWN;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
