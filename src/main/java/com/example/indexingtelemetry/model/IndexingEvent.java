package com.example.indexingtelemetry.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("indexing_events")
public class IndexingEvent {
    /** Item id used for batch-level events. */
    public static final long BATCH_ITEM = 0L;

    @Id
    private String id;
    private String sessionId;
    private long itemId;
    private String itemType;
    private Stage stage;
    private EventLevel level;
    private Instant timestamp;
    // per-session write order, timestamps may tie
    private long sequence;
    private String message;
    private Map<String, Object> payload;
}
