package com.example.indexingtelemetry.store;

import com.example.indexingtelemetry.exception.WriteFailedException;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.SessionOverview;
import com.example.indexingtelemetry.model.SessionRecord;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.*;

/**
 * Write-only sink for hosted log services: each event becomes one JSON line on the
 * {@code indexing.telemetry.events} logger, and shipping is left to the logging backend's appender.
 */
public class LogChannelEventStore implements EventStore {

    static final String CHANNEL = "indexing.telemetry.events";

    private static final Logger channel = LoggerFactory.getLogger(CHANNEL);

    private final ObjectMapper objectMapper;
    private final String source;

    public LogChannelEventStore(ObjectMapper objectMapper, String source) {
        this.objectMapper = objectMapper;
        this.source = source;
    }

    @Override
    public String backend() {
        return "log";
    }

    @Override
    public void verify() {
        if (!channel.isInfoEnabled()) {
            channel.warn("Logger {} is below INFO, telemetry events will not be emitted", CHANNEL);
        }
    }

    @Override
    public void appendBatch(List<IndexingEvent> events) {
        if (events == null || events.isEmpty()) {
            return;
        }
        List<String> lines = new ArrayList<>(events.size());
        try {
            for (IndexingEvent e : events) {
                lines.add(objectMapper.writeValueAsString(toEntry(e)));
            }
        } catch (JsonProcessingException e) {
            throw new WriteFailedException("Event serialization failed", events.size(), e);
        }
        lines.forEach(channel::info);
    }

    Map<String, Object> toEntry(IndexingEvent e) {
        Map<String, Object> context = new LinkedHashMap<>();
        if (e.getPayload() != null) {
            context.putAll(e.getPayload());
        }
        context.put("session_id", e.getSessionId());
        context.put("item_id", e.getItemId());
        context.put("stage", e.getStage().wireName());
        context.put("sequence", e.getSequence());
        context.put("site", source);

        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("timestamp", e.getTimestamp().toString());
        entry.put("level", e.getLevel().name().toLowerCase(Locale.ROOT));
        entry.put("message", e.getMessage());
        entry.put("context", context);
        return entry;
    }

    @Override
    public boolean isReadable() {
        return false;
    }

    @Override
    public List<IndexingEvent> findBySession(String sessionId) {
        return List.of();
    }

    @Override
    public List<IndexingEvent> findBySessionAndItem(String sessionId, long itemId) {
        return List.of();
    }

    @Override
    public List<SessionOverview> recentSessions(int limit) {
        return List.of();
    }

    @Override
    public void saveSessionRecord(SessionRecord record) {
        try {
            channel.info(objectMapper.writeValueAsString(Map.of("session_summary", record)));
        } catch (JsonProcessingException e) {
            throw new WriteFailedException("Session summary serialization failed", 1, e);
        }
    }

    @Override
    public Optional<SessionRecord> findSessionRecord(String sessionId) {
        return Optional.empty();
    }

    @Override
    public long purgeOlderThan(Instant cutoff) {
        // retention is owned by the log service
        return 0L;
    }
}
