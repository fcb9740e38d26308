package com.example.indexingtelemetry.analysis;

import com.example.indexingtelemetry.model.IndexingEvent;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One ERROR-level event as listed in a session summary.
 */
@Value
public class ErrorDetail {
    String stage;
    String message;
    /** {@code null} for batch-level errors. */
    Long itemId;
    Instant timestamp;

    static ErrorDetail of(IndexingEvent e) {
        return new ErrorDetail(
                e.getStage() != null ? e.getStage().wireName() : null,
                e.getMessage(),
                e.getItemId() == IndexingEvent.BATCH_ITEM ? null : e.getItemId(),
                e.getTimestamp());
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("stage", stage);
        map.put("message", message);
        map.put("itemId", itemId);
        map.put("timestamp", timestamp);
        return map;
    }
}
