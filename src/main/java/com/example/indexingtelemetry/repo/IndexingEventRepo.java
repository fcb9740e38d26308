package com.example.indexingtelemetry.repo;

import com.example.indexingtelemetry.model.IndexingEvent;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface IndexingEventRepo extends MongoRepository<IndexingEvent, String> {
    List<IndexingEvent> findBySessionIdOrderByTimestampAscSequenceAsc(String sessionId);
    List<IndexingEvent> findBySessionIdAndItemIdOrderByTimestampAscSequenceAsc(String sessionId, long itemId);
    long deleteByTimestampBefore(Instant cutoff);
}
