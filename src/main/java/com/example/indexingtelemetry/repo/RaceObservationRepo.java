package com.example.indexingtelemetry.repo;

import com.example.indexingtelemetry.model.RaceObservation;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.time.Instant;
import java.util.List;

public interface RaceObservationRepo extends MongoRepository<RaceObservation, String> {
    List<RaceObservation> findTop5ByItemIdAndTypeAndTimestampGreaterThanEqualOrderByTimestampDesc(long itemId, String type, Instant since);
    List<RaceObservation> findByTypeOrderByTimestampAsc(String type);
    long deleteByTimestampBefore(Instant cutoff);
}
