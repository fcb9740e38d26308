package com.example.indexingtelemetry.service;

import com.example.indexingtelemetry.store.EventStore;
import com.example.indexingtelemetry.store.RaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Removes events, session records and race observations past the retention period.
 * Mongo also expires them through TTL indexes; this covers the other backends.
 */
@Service
public class RetentionService {

    private static final Logger logger = LoggerFactory.getLogger(RetentionService.class);

    private final EventStore eventStore;
    private final ObjectProvider<RaceStore> raceStore;
    private final Clock clock;

    @Value("${indexing.telemetry.retention.ttl:7d}")
    private Duration ttl;

    public RetentionService(EventStore eventStore, ObjectProvider<RaceStore> raceStore, Clock clock) {
        this.eventStore = eventStore;
        this.raceStore = raceStore;
        this.clock = clock;
    }

    @Scheduled(cron = "${indexing.telemetry.retention.purge-cron:0 0 * * * *}")
    public void scheduledPurge() {
        try {
            purgeExpired();
        } catch (Exception e) {
            logger.error("Scheduled telemetry purge failed: {}", e.getMessage(), e);
        }
    }

    /**
     * @return counts of removed entries and the cutoff used
     */
    public Map<String, Object> purgeExpired() {
        Instant cutoff = clock.instant().minus(ttl);
        long events = eventStore.purgeOlderThan(cutoff);
        RaceStore races = raceStore.getIfAvailable();
        long observations = races == null ? 0L : races.purgeOlderThan(cutoff);
        if (events > 0 || observations > 0) {
            logger.info("Purged {} events/session records and {} race observations older than {}", events, observations, cutoff);
        } else {
            logger.debug("Nothing to purge before {}", cutoff);
        }

        Map<String, Object> result = new LinkedHashMap<>();
        result.put("cutoff", cutoff.toString());
        result.put("eventsRemoved", events);
        result.put("raceObservationsRemoved", observations);
        result.put("backend", eventStore.backend());
        return result;
    }
}
