package com.example.indexingtelemetry.race;

import com.example.indexingtelemetry.kv.KvClient;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.IngestionSession;
import com.example.indexingtelemetry.model.RaceObservation;
import com.example.indexingtelemetry.model.Stage;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Race detection through a short-lived "last access" entry per item in the KV cache.
 * Only the latest access is remembered, so at most two sessions appear in a correlation.
 */
public class KvRaceDetector implements RaceDetector {

    private static final Logger logger = LoggerFactory.getLogger(KvRaceDetector.class);

    static final String KEY_PREFIX = "indexing:race:item:";

    private final KvClient kvClient;
    private final ObjectMapper objectMapper;
    private final RaceCorrelator correlator;
    private final Duration entryTtl;

    public KvRaceDetector(KvClient kvClient, ObjectMapper objectMapper, Duration window, Duration entryTtl) {
        this.kvClient = kvClient;
        this.objectMapper = objectMapper;
        this.correlator = new RaceCorrelator(window);
        this.entryTtl = entryTtl;
    }

    @Override
    public Optional<RaceRecord> check(IngestionSession session, long itemId, Stage stage, Instant now) {
        if (itemId == IndexingEvent.BATCH_ITEM) {
            return Optional.empty();
        }
        String key = KEY_PREFIX + itemId;
        Optional<RaceRecord> race = kvClient.get(key)
                .flatMap(json -> parse(itemId, json))
                .flatMap(previous -> correlator.correlate(itemId, stage, session.getSessionId(), now, List.of(previous)));
        race.ifPresent(r -> logger.warn("Item {} accessed by multiple sessions {}", itemId, r.getSessions()));

        try {
            String value = objectMapper.writeValueAsString(Map.of(
                    "session_id", session.getSessionId(),
                    "stage", stage.name(),
                    "timestamp", now.toEpochMilli()));
            kvClient.set(key, value, entryTtl);
        } catch (JsonProcessingException e) {
            logger.debug("Could not record access for item {}: {}", itemId, e.getMessage());
        }
        return race;
    }

    private Optional<RaceObservation> parse(long itemId, String json) {
        try {
            JsonNode node = objectMapper.readTree(json);
            if (!node.hasNonNull("session_id") || !node.hasNonNull("timestamp")) {
                return Optional.empty();
            }
            return Optional.of(RaceObservation.builder()
                    .itemId(itemId)
                    .sessionId(node.get("session_id").asText())
                    .stage(Stage.fromWireName(node.path("stage").asText(null)).orElse(null))
                    .timestamp(Instant.ofEpochMilli(node.get("timestamp").asLong()))
                    .type(RaceObservation.OPERATION)
                    .build());
        } catch (JsonProcessingException e) {
            logger.debug("Ignoring unreadable access entry for item {}", itemId);
            return Optional.empty();
        }
    }
}
