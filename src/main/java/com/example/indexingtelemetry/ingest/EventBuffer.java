package com.example.indexingtelemetry.ingest;

import com.example.indexingtelemetry.exception.WriteFailedException;
import com.example.indexingtelemetry.model.EventLevel;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.IngestionSession;
import com.example.indexingtelemetry.model.Stage;
import com.example.indexingtelemetry.race.RaceDetector;
import com.example.indexingtelemetry.race.RaceRecord;
import com.example.indexingtelemetry.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * In-memory queue of one session's events, written to the store in batches.
 *
 * <p>Delivery is at most once: a batch that fails to write is dropped and reported on
 * the {@code indexing.telemetry.fallback} logger.
 */
public class EventBuffer implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(EventBuffer.class);
    private static final Logger fallback = LoggerFactory.getLogger("indexing.telemetry.fallback");

    private final IngestionSession session;
    private final EventStore store;
    private final RaceDetector raceDetector;
    private final Clock clock;
    private final int threshold;
    private final boolean enabled;

    private final Object lock = new Object();
    private final List<IndexingEvent> queue = new ArrayList<>();

    public EventBuffer(IngestionSession session, EventStore store, RaceDetector raceDetector,
                       Clock clock, int threshold, boolean enabled) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Flush threshold must be at least 1: " + threshold);
        }
        this.session = session;
        this.store = store;
        this.raceDetector = raceDetector;
        this.clock = clock;
        this.threshold = threshold;
        this.enabled = enabled;
    }

    public IngestionSession getSession() {
        return session;
    }

    public int getThreshold() {
        return threshold;
    }

    public void track(long itemId, String itemType, Stage stage, EventLevel level,
                      String message, Map<String, Object> payload) {
        if (!enabled) {
            return;
        }
        Instant now = clock.instant();
        Optional<RaceRecord> race = checkRace(itemId, stage, now);

        boolean full;
        synchronized (lock) {
            queue.add(IndexingEvent.builder()
                    .sessionId(session.getSessionId())
                    .itemId(itemId)
                    .itemType(itemType)
                    .stage(stage)
                    .level(level)
                    .timestamp(now)
                    .sequence(session.nextSequence())
                    .message(message)
                    .payload(payload == null ? new LinkedHashMap<>() : new LinkedHashMap<>(payload))
                    .build());
            race.ifPresent(r -> queue.add(raceWarning(r, itemType, stage, now)));
            full = queue.size() >= threshold;
        }
        if (full) {
            flush();
        }
    }

    /**
     * Writes everything queued so far as one batch.
     *
     * @return the number of events written, 0 when the queue was empty or the batch was dropped
     */
    public int flush() {
        List<IndexingEvent> batch;
        synchronized (lock) {
            if (queue.isEmpty()) {
                return 0;
            }
            batch = new ArrayList<>(queue);
            queue.clear();
        }
        try {
            store.appendBatch(batch);
            logger.debug("Flushed {} events for {}", batch.size(), session.getSessionId());
            return batch.size();
        } catch (WriteFailedException e) {
            fallback.warn("Dropped {} events for session {} ({} backend): {}",
                    e.getBatchSize(), session.getSessionId(), store.backend(), e.getMessage());
            return 0;
        } catch (RuntimeException e) {
            fallback.warn("Dropped {} events for session {} ({} backend): {}",
                    batch.size(), session.getSessionId(), store.backend(), e.toString());
            return 0;
        }
    }

    public int size() {
        synchronized (lock) {
            return queue.size();
        }
    }

    @Override
    public void close() {
        flush();
    }

    private Optional<RaceRecord> checkRace(long itemId, Stage stage, Instant now) {
        try {
            return raceDetector.check(session, itemId, stage, now);
        } catch (RuntimeException e) {
            logger.warn("Race check failed for item {}: {}", itemId, e.getMessage());
            return Optional.empty();
        }
    }

    private IndexingEvent raceWarning(RaceRecord race, String itemType, Stage stage, Instant now) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("race_condition", true);
        payload.put("concurrent_sessions", new ArrayList<>(race.getSessions()));
        payload.put("stages", race.getStages().stream().map(Stage::wireName).collect(Collectors.toList()));
        payload.put("first_seen", race.getFirstSeen().toString());
        payload.put("occurrence_count", race.getOccurrenceCount());
        return IndexingEvent.builder()
                .sessionId(session.getSessionId())
                .itemId(race.getItemId())
                .itemType(itemType)
                .stage(stage)
                .level(EventLevel.WARNING)
                .timestamp(now)
                .sequence(session.nextSequence())
                .message("Race condition detected: item " + race.getItemId() + " touched by " + race.getSessions())
                .payload(payload)
                .build();
    }
}
