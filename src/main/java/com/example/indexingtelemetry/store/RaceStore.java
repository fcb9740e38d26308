package com.example.indexingtelemetry.store;

import com.example.indexingtelemetry.model.RaceObservation;

import java.time.Instant;
import java.util.List;

public interface RaceStore {
    /** Most recent plain operations on the item since the given instant, newest first. */
    List<RaceObservation> recentOperations(long itemId, Instant since, int limit);
    void record(RaceObservation observation);
    List<RaceObservation> findCorrelations();
    long purgeOlderThan(Instant cutoff);
}
