package com.example.indexingtelemetry.model;

import lombok.Getter;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Identity of one indexing run. Owned by whoever drives the run and passed
 * explicitly to the buffer and race detector.
 */
@Getter
public final class IngestionSession {

    private final String sessionId;
    private final String indexId;
    private final Instant startedAt;
    @Getter(lombok.AccessLevel.NONE)
    private final AtomicLong sequence = new AtomicLong();

    public IngestionSession(String sessionId, String indexId, Instant startedAt) {
        this.sessionId = sessionId;
        this.indexId = indexId;
        this.startedAt = startedAt;
    }

    public static IngestionSession start(String indexId, Clock clock) {
        String id = "idx_" + UUID.randomUUID().toString().replace("-", "");
        return new IngestionSession(id, indexId, clock.instant());
    }

    public long nextSequence() {
        return sequence.incrementAndGet();
    }

    @Override
    public String toString() {
        return "IngestionSession{" + sessionId + ", index=" + indexId + "}";
    }
}
