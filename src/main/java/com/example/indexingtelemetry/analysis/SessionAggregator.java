package com.example.indexingtelemetry.analysis;

import com.example.indexingtelemetry.ingest.Payloads;
import com.example.indexingtelemetry.model.EventLevel;
import com.example.indexingtelemetry.model.FinalStatus;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.IngestionSession;
import com.example.indexingtelemetry.model.SessionRecord;
import com.example.indexingtelemetry.model.Stage;
import com.example.indexingtelemetry.store.EventStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Builds per-session summaries from stored events and writes the closing record of a session.
 */
@Service
public class SessionAggregator {

    private static final Logger logger = LoggerFactory.getLogger(SessionAggregator.class);

    static final int ERROR_DETAIL_LIMIT = 100;

    private final EventStore eventStore;
    private final Clock clock;
    private final ItemStatusResolver resolver = new ItemStatusResolver();

    public SessionAggregator(EventStore eventStore, Clock clock) {
        this.eventStore = eventStore;
        this.clock = clock;
    }

    /**
     * Summarizes a session. Unknown sessions yield an empty, open summary.
     */
    public SessionSummary summarize(String sessionId) {
        List<IndexingEvent> events = SessionEvents.sorted(eventStore.findBySession(sessionId));
        Optional<SessionRecord> record = eventStore.findSessionRecord(sessionId);
        return summarize(sessionId, events, record.orElse(null));
    }

    SessionSummary summarize(String sessionId, List<IndexingEvent> sortedEvents, SessionRecord record) {
        Map<Long, FinalStatus> statuses = resolveStatuses(sortedEvents);

        Map<FinalStatus, Long> statusCounts = new EnumMap<>(FinalStatus.class);
        for (FinalStatus s : FinalStatus.values()) {
            statusCounts.put(s, 0L);
        }
        statuses.values().forEach(s -> statusCounts.merge(s, 1L, Long::sum));

        Map<String, Long> skipReasons = new TreeMap<>();
        SessionEvents.byItem(sortedEvents).forEach((itemId, itemEvents) -> {
            if (statuses.get(itemId) == FinalStatus.SKIPPED) {
                skipReasons.merge(resolver.skipReason(itemEvents).orElse("Unknown"), 1L, Long::sum);
            }
        });

        Map<Stage, Long> byStage = new EnumMap<>(Stage.class);
        Map<Stage, Long> errorStages = new EnumMap<>(Stage.class);
        List<ErrorDetail> errorDetails = new ArrayList<>();
        long errors = 0;
        long generated = 0;
        long dropped = 0;
        for (IndexingEvent e : sortedEvents) {
            if (e.getStage() != null && !SessionEvents.isRaceWarning(e)) {
                byStage.merge(e.getStage(), 1L, Long::sum);
            }
            if (e.getLevel() == EventLevel.ERROR) {
                errors++;
                if (e.getStage() != null) {
                    errorStages.merge(e.getStage(), 1L, Long::sum);
                }
                // earliest errors are kept, the totals still count every one
                if (errorDetails.size() < ERROR_DETAIL_LIMIT) {
                    errorDetails.add(ErrorDetail.of(e));
                }
            }
            if (e.getStage() == Stage.GENERATION) {
                generated += Payloads.getLong(e.getPayload(), "records_count", 0L);
            } else if (e.getStage() == Stage.SANITIZATION) {
                dropped += Payloads.getLong(e.getPayload(), "dropped_count", 0L);
            }
        }
        Map<String, Long> eventsByStage = new LinkedHashMap<>();
        byStage.forEach((stage, count) -> eventsByStage.put(stage.wireName(), count));
        Map<String, Long> errorsByStage = new LinkedHashMap<>();
        errorStages.forEach((stage, count) -> errorsByStage.put(stage.wireName(), count));

        Instant start = sortedEvents.isEmpty() ? null : sortedEvents.get(0).getTimestamp();
        Instant end = sortedEvents.isEmpty() ? null : sortedEvents.get(sortedEvents.size() - 1).getTimestamp();
        if (record != null && record.getTimestamp() != null && (end == null || record.getTimestamp().isAfter(end))) {
            end = record.getTimestamp();
        }
        Duration duration = start != null && end != null ? Duration.between(start, end) : Duration.ZERO;

        return SessionSummary.builder()
                .sessionId(sessionId)
                .totalItems(statuses.size())
                .eventCount(sortedEvents.size())
                .statusCounts(statusCounts)
                .errorCount(errors)
                .errorsByStage(errorsByStage)
                .errorDetails(errorDetails)
                .startTime(start)
                .endTime(end)
                .duration(duration)
                .open(record == null)
                .eventsByStage(eventsByStage)
                .skipReasons(skipReasons)
                .recordsGenerated(generated)
                .recordsDropped(dropped)
                .build();
    }

    /** Final status of every item in the session, keyed by item id in ascending order. */
    public SortedMap<Long, FinalStatus> resolveStatuses(List<IndexingEvent> sortedEvents) {
        SortedMap<Long, FinalStatus> statuses = new TreeMap<>();
        SessionEvents.byItem(sortedEvents).forEach((itemId, itemEvents) -> statuses.put(itemId, resolver.resolve(itemEvents)));
        return statuses;
    }

    ItemStatusResolver getResolver() {
        return resolver;
    }

    /**
     * Writes the closing record for a session. Backends that cannot be read back get a record
     * without item statistics.
     */
    public SessionRecord closeSession(IngestionSession session, Duration duration, long memoryPeakBytes) {
        SessionRecord.SessionRecordBuilder record = SessionRecord.builder()
                .sessionId(session.getSessionId())
                .indexId(session.getIndexId())
                .timestamp(clock.instant())
                .durationSeconds(duration == null ? 0L : duration.getSeconds())
                .memoryPeakBytes(memoryPeakBytes);

        if (eventStore.isReadable()) {
            List<IndexingEvent> events = SessionEvents.sorted(eventStore.findBySession(session.getSessionId()));
            SessionSummary summary = summarize(session.getSessionId(), events, null);
            Map<String, Long> breakdown = new LinkedHashMap<>();
            summary.getStatusCounts().forEach((k, v) -> breakdown.put(k.wireName(), v));
            record.totalItems(summary.getTotalItems())
                    .errorCount(summary.getErrorCount())
                    .statusBreakdown(breakdown);
        } else {
            record.statusBreakdown(new LinkedHashMap<>());
        }

        SessionRecord saved = record.build();
        eventStore.saveSessionRecord(saved);
        logger.info("Closed session {} ({} items, {} errors)", saved.getSessionId(), saved.getTotalItems(), saved.getErrorCount());
        return saved;
    }
}
