package com.example.indexingtelemetry.race;

import com.example.indexingtelemetry.model.Stage;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.stream.Collectors;

/**
 * Heuristic evidence that several sessions touched the same item close together in time.
 * Built from timestamp proximity only, not a proof of concurrent execution.
 */
@Value
@Builder
public class RaceRecord {
    long itemId;
    SortedSet<String> sessions;
    Set<Stage> stages;
    Instant firstSeen;
    Instant lastSeen;
    int occurrenceCount;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("itemId", itemId);
        map.put("sessions", sessions);
        map.put("stages", stages.stream().map(Stage::wireName).collect(Collectors.toList()));
        map.put("firstSeen", firstSeen);
        map.put("lastSeen", lastSeen);
        map.put("occurrenceCount", occurrenceCount);
        return map;
    }
}
