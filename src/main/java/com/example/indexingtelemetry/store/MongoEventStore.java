package com.example.indexingtelemetry.store;

import com.example.indexingtelemetry.exception.StoreUnavailableException;
import com.example.indexingtelemetry.exception.WriteFailedException;
import com.example.indexingtelemetry.model.EventLevel;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.RaceObservation;
import com.example.indexingtelemetry.model.SessionOverview;
import com.example.indexingtelemetry.model.SessionRecord;
import com.example.indexingtelemetry.repo.IndexingEventRepo;
import com.example.indexingtelemetry.repo.SessionRecordRepo;
import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.aggregation.ConditionalOperators;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Criteria;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

public class MongoEventStore implements EventStore {

    private static final Logger logger = LoggerFactory.getLogger(MongoEventStore.class);

    static final String EVENTS = "indexing_events";

    private final MongoTemplate mongo;
    private final IndexingEventRepo eventRepo;
    private final SessionRecordRepo sessionRepo;
    private final Duration ttl;

    public MongoEventStore(MongoTemplate mongo, IndexingEventRepo eventRepo, SessionRecordRepo sessionRepo, Duration ttl) {
        this.mongo = mongo;
        this.eventRepo = eventRepo;
        this.sessionRepo = sessionRepo;
        this.ttl = ttl;
    }

    @Override
    public String backend() {
        return "mongo";
    }

    @Override
    public void verify() {
        try {
            IndexOperations events = mongo.indexOps(IndexingEvent.class);
            events.ensureIndex(new Index().on("sessionId", Sort.Direction.ASC).on("sequence", Sort.Direction.ASC));
            events.ensureIndex(new Index().on("itemId", Sort.Direction.ASC).on("sessionId", Sort.Direction.ASC));
            events.ensureIndex(new Index().on("timestamp", Sort.Direction.ASC).expire(ttl).named("ttl_timestamp"));

            IndexOperations races = mongo.indexOps(RaceObservation.class);
            races.ensureIndex(new Index().on("itemId", Sort.Direction.ASC).on("timestamp", Sort.Direction.DESC));
            races.ensureIndex(new Index().on("timestamp", Sort.Direction.ASC).expire(ttl).named("ttl_timestamp"));

            mongo.indexOps(SessionRecord.class)
                    .ensureIndex(new Index().on("timestamp", Sort.Direction.ASC).expire(ttl).named("ttl_timestamp"));
            logger.info("MongoDB telemetry indexes ensured (ttl={})", ttl);
        } catch (Exception e) {
            throw new StoreUnavailableException("MongoDB telemetry store unavailable: " + e.getMessage(), e);
        }
    }

    @Override
    public void appendBatch(List<IndexingEvent> events) {
        if (events == null || events.isEmpty()) {
            return;
        }
        try {
            eventRepo.insert(events);
            logger.debug("Inserted {} events into {}", events.size(), EVENTS);
        } catch (DataAccessException e) {
            throw new WriteFailedException("MongoDB batch insert failed", events.size(), e);
        }
    }

    @Override
    public boolean isReadable() {
        return true;
    }

    @Override
    public List<IndexingEvent> findBySession(String sessionId) {
        return eventRepo.findBySessionIdOrderByTimestampAscSequenceAsc(sessionId);
    }

    @Override
    public List<IndexingEvent> findBySessionAndItem(String sessionId, long itemId) {
        return eventRepo.findBySessionIdAndItemIdOrderByTimestampAscSequenceAsc(sessionId, itemId);
    }

    @Override
    public List<SessionOverview> recentSessions(int limit) {
        Aggregation agg = Aggregation.newAggregation(
                Aggregation.group("sessionId")
                        .min("timestamp").as("startTime")
                        .max("timestamp").as("endTime")
                        .count().as("eventCount")
                        .sum(ConditionalOperators.when(Criteria.where("level").is(EventLevel.ERROR.name()))
                                .then(1).otherwise(0)).as("errorCount"),
                Aggregation.sort(Sort.Direction.DESC, "startTime"),
                Aggregation.limit(limit)
        );
        AggregationResults<Document> results = mongo.aggregate(agg, EVENTS, Document.class);
        List<SessionOverview> out = new ArrayList<>();
        for (Document d : results) {
            out.add(SessionOverview.builder()
                    .sessionId(d.getString("_id"))
                    .startTime(toInstant(d.get("startTime")))
                    .endTime(toInstant(d.get("endTime")))
                    .eventCount(toLong(d.get("eventCount")))
                    .errorCount(toLong(d.get("errorCount")))
                    .build());
        }
        return out;
    }

    @Override
    public void saveSessionRecord(SessionRecord record) {
        sessionRepo.save(record);
    }

    @Override
    public Optional<SessionRecord> findSessionRecord(String sessionId) {
        return sessionRepo.findById(sessionId);
    }

    @Override
    public long purgeOlderThan(Instant cutoff) {
        return eventRepo.deleteByTimestampBefore(cutoff) + sessionRepo.deleteByTimestampBefore(cutoff);
    }

    private static Instant toInstant(Object value) {
        if (value instanceof Date) {
            return ((Date) value).toInstant();
        }
        if (value instanceof Instant) {
            return (Instant) value;
        }
        return null;
    }

    private static long toLong(Object value) {
        return value instanceof Number ? ((Number) value).longValue() : 0L;
    }
}
