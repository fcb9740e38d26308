package com.example.indexingtelemetry.analysis;

import com.example.indexingtelemetry.model.FinalStatus;
import lombok.Builder;
import lombok.Value;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

@Value
@Builder
public class SessionSummary {
    String sessionId;
    int totalItems;
    long eventCount;
    /** Always holds every status, zero when no item reached it. */
    Map<FinalStatus, Long> statusCounts;
    long errorCount;
    Map<String, Long> errorsByStage;
    /** ERROR-level events in write order, capped; {@link #errorCount} is the full total. */
    List<ErrorDetail> errorDetails;
    Instant startTime;
    Instant endTime;
    Duration duration;
    /** No closing record has been written for the session. */
    boolean open;
    Map<String, Long> eventsByStage;
    Map<String, Long> skipReasons;
    long recordsGenerated;
    long recordsDropped;

    public long count(FinalStatus status) {
        return statusCounts.getOrDefault(status, 0L);
    }

    public Map<String, Object> toMap() {
        Map<String, Long> statuses = new LinkedHashMap<>();
        statusCounts.forEach((k, v) -> statuses.put(k.wireName(), v));

        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sessionId", sessionId);
        map.put("totalItems", totalItems);
        map.put("eventCount", eventCount);
        map.put("statusCounts", statuses);
        map.put("errorCount", errorCount);
        map.put("errorsByStage", errorsByStage);
        map.put("errorDetails", errorDetails.stream().map(ErrorDetail::toMap).collect(Collectors.toList()));
        map.put("startTime", startTime);
        map.put("endTime", endTime);
        map.put("durationSeconds", duration.getSeconds());
        map.put("open", open);
        map.put("eventsByStage", eventsByStage);
        map.put("skipReasons", skipReasons);
        map.put("recordsGenerated", recordsGenerated);
        map.put("recordsDropped", recordsDropped);
        return map;
    }
}
