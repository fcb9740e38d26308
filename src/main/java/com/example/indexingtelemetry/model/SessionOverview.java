package com.example.indexingtelemetry.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Value
@Builder
public class SessionOverview {
    String sessionId;
    Instant startTime;
    Instant endTime;
    long eventCount;
    long errorCount;

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sessionId", sessionId);
        map.put("startTime", startTime);
        map.put("endTime", endTime);
        map.put("eventCount", eventCount);
        map.put("errorCount", errorCount);
        return map;
    }
}
