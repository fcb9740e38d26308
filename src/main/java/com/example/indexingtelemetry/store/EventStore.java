package com.example.indexingtelemetry.store;

import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.SessionOverview;
import com.example.indexingtelemetry.model.SessionRecord;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable, append-only sink for indexing events.
 *
 * <p>Reads return events in write order: ascending timestamp, then ascending
 * per-session sequence. Backends that cannot be read back report
 * {@link #isReadable()} {@code false} and return empty results.
 */
public interface EventStore {

    String backend();

    /**
     * Prepares indexes/schema and checks connectivity.
     *
     * @throws com.example.indexingtelemetry.exception.StoreUnavailableException if the store cannot be used
     */
    void verify();

    /**
     * Writes all events as one batch.
     *
     * @throws com.example.indexingtelemetry.exception.WriteFailedException on any driver failure
     */
    void appendBatch(List<IndexingEvent> events);

    boolean isReadable();

    List<IndexingEvent> findBySession(String sessionId);

    List<IndexingEvent> findBySessionAndItem(String sessionId, long itemId);

    List<SessionOverview> recentSessions(int limit);

    void saveSessionRecord(SessionRecord record);

    Optional<SessionRecord> findSessionRecord(String sessionId);

    /** Deletes events and session records older than the cutoff; returns the number removed. */
    long purgeOlderThan(Instant cutoff);
}
