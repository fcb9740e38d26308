package com.example.indexingtelemetry.store;

import com.example.indexingtelemetry.model.RaceObservation;
import com.example.indexingtelemetry.repo.RaceObservationRepo;

import java.time.Instant;
import java.util.List;

public class MongoRaceStore implements RaceStore {

    private final RaceObservationRepo repo;

    public MongoRaceStore(RaceObservationRepo repo) {
        this.repo = repo;
    }

    @Override
    public List<RaceObservation> recentOperations(long itemId, Instant since, int limit) {
        List<RaceObservation> recent = repo.findTop5ByItemIdAndTypeAndTimestampGreaterThanEqualOrderByTimestampDesc(
                itemId, RaceObservation.OPERATION, since);
        return recent.size() > limit ? recent.subList(0, limit) : recent;
    }

    @Override
    public void record(RaceObservation observation) {
        repo.insert(observation);
    }

    @Override
    public List<RaceObservation> findCorrelations() {
        return repo.findByTypeOrderByTimestampAsc(RaceObservation.CONCURRENT_ACCESS);
    }

    @Override
    public long purgeOlderThan(Instant cutoff) {
        return repo.deleteByTimestampBefore(cutoff);
    }
}
