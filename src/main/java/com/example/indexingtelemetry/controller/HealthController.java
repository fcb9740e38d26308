package com.example.indexingtelemetry.controller;

import com.example.indexingtelemetry.ingest.IndexingRecorderFactory;
import com.example.indexingtelemetry.kv.KvClient;
import com.example.indexingtelemetry.store.EventStore;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final KvClient kvClient;
    private final EventStore eventStore;
    private final IndexingRecorderFactory recorderFactory;

    public HealthController(KvClient kvClient, EventStore eventStore, IndexingRecorderFactory recorderFactory) {
        this.kvClient = kvClient;
        this.eventStore = eventStore;
        this.recorderFactory = recorderFactory;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "indexing-telemetry-mcp");
        health.put("version", "0.1.0");
        health.put("backend", eventStore.backend());
        health.put("telemetry", recorderFactory.isAvailable() ? "ENABLED" : "DISABLED");
        health.put("activeSessions", recorderFactory.activeSessions());

        try {
            kvClient.get("health-check");
            health.put("redis", "UP");
        } catch (Exception e) {
            health.put("redis", "DOWN");
            health.put("redisError", e.getMessage());
        }

        if (eventStore.isReadable()) {
            try {
                eventStore.recentSessions(1);
                health.put("store", "UP");
            } catch (Exception e) {
                health.put("store", "DOWN");
                health.put("storeError", e.getMessage());
            }
        } else {
            health.put("store", "WRITE_ONLY");
        }

        return ResponseEntity.ok(health);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}
