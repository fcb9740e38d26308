package com.example.indexingtelemetry.config;

import com.example.indexingtelemetry.repo.IndexingEventRepo;
import com.example.indexingtelemetry.repo.RaceObservationRepo;
import com.example.indexingtelemetry.repo.SessionRecordRepo;
import com.example.indexingtelemetry.store.EventStore;
import com.example.indexingtelemetry.store.JdbcEventStore;
import com.example.indexingtelemetry.store.JdbcRaceStore;
import com.example.indexingtelemetry.store.LogChannelEventStore;
import com.example.indexingtelemetry.store.MongoEventStore;
import com.example.indexingtelemetry.store.MongoRaceStore;
import com.example.indexingtelemetry.store.RaceStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.Clock;
import java.time.Duration;

/**
 * Selects the event and race stores from {@code indexing.telemetry.store.backend}.
 * The log backend has no race store.
 */
@Configuration
public class TelemetryStoreConfig {

    static final String BACKEND = "indexing.telemetry.store.backend";

    @Bean
    public Clock telemetryClock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND, havingValue = "mongo", matchIfMissing = true)
    public EventStore mongoEventStore(MongoTemplate mongoTemplate, IndexingEventRepo eventRepo, SessionRecordRepo sessionRepo,
                                      @Value("${indexing.telemetry.retention.ttl:7d}") Duration ttl) {
        return new MongoEventStore(mongoTemplate, eventRepo, sessionRepo, ttl);
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND, havingValue = "mongo", matchIfMissing = true)
    public RaceStore mongoRaceStore(RaceObservationRepo raceRepo) {
        return new MongoRaceStore(raceRepo);
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND, havingValue = "jdbc")
    public EventStore jdbcEventStore(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        return new JdbcEventStore(jdbcTemplate, objectMapper);
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND, havingValue = "jdbc")
    public RaceStore jdbcRaceStore(JdbcTemplate jdbcTemplate) {
        return new JdbcRaceStore(jdbcTemplate);
    }

    @Bean
    @ConditionalOnProperty(name = BACKEND, havingValue = "log")
    public EventStore logChannelEventStore(ObjectMapper objectMapper,
                                           @Value("${indexing.telemetry.store.source:${spring.application.name:indexing-telemetry}}") String source) {
        return new LogChannelEventStore(objectMapper, source);
    }
}
