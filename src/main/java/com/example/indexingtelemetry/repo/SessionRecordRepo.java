package com.example.indexingtelemetry.repo;

import com.example.indexingtelemetry.model.SessionRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;

public interface SessionRecordRepo extends MongoRepository<SessionRecord, String> {
    long deleteByTimestampBefore(Instant cutoff);
}
