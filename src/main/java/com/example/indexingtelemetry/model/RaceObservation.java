package com.example.indexingtelemetry.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Set;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("race_observations")
public class RaceObservation {
    public static final String OPERATION = "operation";
    public static final String CONCURRENT_ACCESS = "concurrent_access";

    @Id
    private String id;
    private long itemId;
    private Stage stage;
    private String sessionId;
    private Instant timestamp;
    private String type; // operation | concurrent_access

    // Only set on concurrent_access records
    private Set<String> concurrentSessions;
    private Set<Stage> stages;
    private Instant firstSeen;
    private Instant lastSeen;
    private int operationCount;
    private long spreadMillis;
}
