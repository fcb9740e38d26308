package com.example.indexingtelemetry.analysis;

import lombok.Builder;
import lombok.Value;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.SortedSet;

@Value
@Builder
public class MissingItemsReport {
    String sessionId;
    int expectedCount;
    int retrievedCount;
    int processedCount;
    /** Expected but never retrieved. */
    SortedSet<Long> neverSeen;
    /** Retrieved but never submitted nor deleted. */
    SortedSet<Long> retrievedNotProcessed;
    /** Every observed item keyed by the stage of its last event. */
    Map<String, SortedSet<Long>> byStage;
    Map<String, Long> statusBreakdown;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sessionId", sessionId);
        map.put("expectedCount", expectedCount);
        map.put("retrievedCount", retrievedCount);
        map.put("processedCount", processedCount);
        map.put("neverSeen", neverSeen);
        map.put("retrievedNotProcessed", retrievedNotProcessed);
        map.put("byStage", byStage);
        map.put("statusBreakdown", statusBreakdown);
        return map;
    }
}
