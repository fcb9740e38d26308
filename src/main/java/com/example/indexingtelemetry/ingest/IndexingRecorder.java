package com.example.indexingtelemetry.ingest;

import com.example.indexingtelemetry.analysis.SessionAggregator;
import com.example.indexingtelemetry.model.EventLevel;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.IngestionSession;
import com.example.indexingtelemetry.model.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * Turns pipeline callbacks into indexing events for one session.
 * Safe to share between the worker threads of a single run.
 */
public class IndexingRecorder implements IndexingObserver {

    private static final Logger logger = LoggerFactory.getLogger(IndexingRecorder.class);

    private final IngestionSession session;
    private final EventBuffer buffer;
    private final SessionAggregator aggregator;
    private final Consumer<IndexingRecorder> onClosed;
    private final AtomicBoolean released = new AtomicBoolean();
    private volatile boolean ended;

    public IndexingRecorder(EventBuffer buffer, SessionAggregator aggregator, Consumer<IndexingRecorder> onClosed) {
        this.session = buffer.getSession();
        this.buffer = buffer;
        this.aggregator = aggregator;
        this.onClosed = onClosed;
    }

    public IngestionSession getSession() {
        return session;
    }

    public boolean isEnded() {
        return ended;
    }

    @Override
    public Optional<String> sessionId() {
        return Optional.of(session.getSessionId());
    }

    @Override
    public void onBatchStart(int page, int batchSize, long totalItems) {
        guard("batch start", () -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("index_id", session.getIndexId());
            payload.put("page", page);
            payload.put("batch_size", batchSize);
            payload.put("total_items", totalItems);
            buffer.track(IndexingEvent.BATCH_ITEM, null, Stage.BATCH_START, EventLevel.INFO,
                    "Batch " + page + " started (" + batchSize + " of " + totalItems + " items)", payload);
        });
    }

    @Override
    public void onItemRetrieved(long itemId, Map<String, Object> stageData) {
        guard("retrieval", () -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            if (stageData != null) {
                payload.putAll(stageData);
            }
            payload.put("index_id", session.getIndexId());
            String itemType = Payloads.getString(stageData, "item_type", null);
            if (itemId == IndexingEvent.BATCH_ITEM) {
                int count = Payloads.getLongList(stageData, "item_ids").size();
                buffer.track(itemId, itemType, Stage.RETRIEVAL, EventLevel.INFO, "Retrieved " + count + " items for batch", payload);
            } else {
                buffer.track(itemId, itemType, Stage.RETRIEVAL, EventLevel.INFO, "Item retrieved", payload);
            }
        });
    }

    @Override
    public void onItemFiltered(long itemId, boolean shouldIndex, String reason) {
        guard("filtering", () -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("index_id", session.getIndexId());
            payload.put("should_index", shouldIndex);
            payload.put("reason", reason == null ? "" : reason);
            buffer.track(itemId, null, Stage.FILTERING, EventLevel.DEBUG,
                    shouldIndex ? "Item will be indexed" : "Item skipped: " + reason, payload);
        });
    }

    @Override
    public void onRecordsGenerated(long itemId, int recordCount, String error) {
        guard("generation", () -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("index_id", session.getIndexId());
            if (error != null) {
                payload.put("error", error);
                buffer.track(itemId, null, Stage.GENERATION, EventLevel.ERROR, "Failed to generate records: " + error, payload);
            } else {
                payload.put("records_count", recordCount);
                buffer.track(itemId, null, Stage.GENERATION, EventLevel.DEBUG, "Generated " + recordCount + " records", payload);
            }
        });
    }

    @Override
    public void onRecordsSanitized(int initialCount, int finalCount, List<String> droppedIds) {
        guard("sanitization", () -> {
            int dropped = initialCount - finalCount;
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("index_id", session.getIndexId());
            payload.put("initial_count", initialCount);
            payload.put("sanitized_count", finalCount);
            payload.put("dropped_count", dropped);
            payload.put("dropped_ids", droppedIds == null ? List.of() : droppedIds);
            String message = "Sanitization: " + initialCount + " -> " + finalCount + " records"
                    + (dropped > 0 ? " (" + dropped + " dropped)" : "");
            buffer.track(IndexingEvent.BATCH_ITEM, null, Stage.SANITIZATION,
                    dropped > 0 ? EventLevel.ERROR : EventLevel.INFO, message, payload);
        });
    }

    @Override
    public void onRecordsSubmitted(int recordCount, boolean success, String taskId, String error) {
        guard("submission", () -> trackSubmission(IndexingEvent.BATCH_ITEM, recordCount, success, taskId, error));
    }

    @Override
    public void onRecordsSubmitted(List<Long> itemIds, int recordCount, boolean success, String taskId, String error) {
        guard("submission", () -> {
            if (itemIds == null || itemIds.isEmpty()) {
                trackSubmission(IndexingEvent.BATCH_ITEM, recordCount, success, taskId, error);
                return;
            }
            for (Long itemId : itemIds) {
                if (itemId != null) {
                    trackSubmission(itemId, recordCount, success, taskId, error);
                }
            }
        });
    }

    @Override
    public void onItemDeleted(long itemId, String reason) {
        guard("deletion", () -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("index_id", session.getIndexId());
            payload.put("reason", reason == null ? "" : reason);
            buffer.track(itemId, null, Stage.DELETION, EventLevel.INFO, "Item deleted from index", payload);
        });
    }

    @Override
    public void onSessionEnd(String sessionId, Duration duration, long memoryPeak) {
        if (!session.getSessionId().equals(sessionId)) {
            logger.warn("Ignoring session end for {}, recorder belongs to {}", sessionId, session.getSessionId());
            return;
        }
        guard("session end", () -> {
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("index_id", session.getIndexId());
            payload.put("duration_seconds", duration == null ? 0L : duration.getSeconds());
            payload.put("memory_peak", memoryPeak);
            buffer.track(IndexingEvent.BATCH_ITEM, null, Stage.SUMMARY, EventLevel.STATS, "Indexing session complete", payload);
            buffer.flush();
            aggregator.closeSession(session, duration, memoryPeak);
        });
        ended = true;
        release();
    }

    /** Writes pending events without ending the session. */
    public int flush() {
        try {
            return buffer.flush();
        } catch (RuntimeException e) {
            logger.warn("Flush failed for session {}: {}", session.getSessionId(), e.getMessage());
            return 0;
        }
    }

    @Override
    public void close() {
        flush();
        release();
    }

    private void release() {
        if (released.compareAndSet(false, true)) {
            onClosed.accept(this);
        }
    }

    private void trackSubmission(long itemId, int recordCount, boolean success, String taskId, String error) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("index_id", session.getIndexId());
        payload.put("records_count", recordCount);
        payload.put("success", success);
        payload.put("task_id", taskId == null ? "unknown" : taskId);
        if (error != null) {
            payload.put("error", error);
        }
        if (success) {
            buffer.track(itemId, null, Stage.SUBMISSION, EventLevel.INFO, "Successfully submitted " + recordCount + " records", payload);
        } else {
            buffer.track(itemId, null, Stage.SUBMISSION, EventLevel.ERROR, "API submission failed: " + error, payload);
        }
    }

    private void guard(String operation, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            logger.warn("Telemetry {} failed for session {}: {}", operation, session.getSessionId(), e.getMessage());
        }
    }
}
