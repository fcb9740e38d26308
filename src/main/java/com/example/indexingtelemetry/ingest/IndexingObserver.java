package com.example.indexingtelemetry.ingest;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Callbacks an indexing pipeline invokes as items move through it.
 *
 * <p>Implementations never throw back into the pipeline. {@link #NOOP} is handed out
 * when telemetry is disabled or its store is unavailable. Closing an observer releases it;
 * a run that aborts before {@link #onSessionEnd} should still close it.
 */
public interface IndexingObserver extends AutoCloseable {

    IndexingObserver NOOP = new IndexingObserver() {
    };

    /** Session the observer records into, empty for {@link #NOOP}. */
    default Optional<String> sessionId() {
        return Optional.empty();
    }

    default void onBatchStart(int page, int batchSize, long totalItems) {
    }

    /**
     * @param stageData free-form retrieval details; an {@code item_type} entry sets the event's item type
     */
    default void onItemRetrieved(long itemId, Map<String, Object> stageData) {
    }

    default void onItemFiltered(long itemId, boolean shouldIndex, String reason) {
    }

    /** A non-null {@code error} marks generation as failed. */
    default void onRecordsGenerated(long itemId, int recordCount, String error) {
    }

    default void onRecordsSanitized(int initialCount, int finalCount, List<String> droppedIds) {
    }

    /** Batch-level submission result. */
    default void onRecordsSubmitted(int recordCount, boolean success, String taskId, String error) {
    }

    /** Submission result attributed to each of the given items. */
    default void onRecordsSubmitted(List<Long> itemIds, int recordCount, boolean success, String taskId, String error) {
    }

    default void onItemDeleted(long itemId, String reason) {
    }

    /** Flushes pending events and writes the session's closing record. */
    default void onSessionEnd(String sessionId, Duration duration, long memoryPeak) {
    }

    /** Writes pending events and releases the observer. The session stays open unless it was ended. */
    @Override
    default void close() {
    }
}
