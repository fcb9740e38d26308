package com.example.indexingtelemetry.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

/**
 * Closing summary of an indexing run. Sessions without one are still open.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("indexing_sessions")
public class SessionRecord {
    @Id
    private String sessionId;
    private String indexId;
    private Instant timestamp;
    private long durationSeconds;
    private long memoryPeakBytes;
    private int totalItems;
    private long errorCount;
    private Map<String, Long> statusBreakdown;
}
