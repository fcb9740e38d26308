package com.example.indexingtelemetry.race;

import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.IngestionSession;
import com.example.indexingtelemetry.model.RaceObservation;
import com.example.indexingtelemetry.model.Stage;
import com.example.indexingtelemetry.store.RaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Race detection against the shared race store, visible to every process writing to it.
 */
public class StoreRaceDetector implements RaceDetector {

    private static final Logger logger = LoggerFactory.getLogger(StoreRaceDetector.class);

    static final int LOOKBACK_LIMIT = 5;

    private final RaceStore raceStore;
    private final RaceCorrelator correlator;

    public StoreRaceDetector(RaceStore raceStore, Duration window) {
        this.raceStore = raceStore;
        this.correlator = new RaceCorrelator(window);
    }

    @Override
    public Optional<RaceRecord> check(IngestionSession session, long itemId, Stage stage, Instant now) {
        if (itemId == IndexingEvent.BATCH_ITEM) {
            return Optional.empty();
        }
        List<RaceObservation> recent = raceStore.recentOperations(itemId, now.minus(correlator.getWindow()), LOOKBACK_LIMIT);
        Optional<RaceRecord> race = correlator.correlate(itemId, stage, session.getSessionId(), now, recent);

        race.ifPresent(r -> {
            logger.warn("Concurrent access on item {} by sessions {}", itemId, r.getSessions());
            raceStore.record(RaceObservation.builder()
                    .itemId(itemId)
                    .stage(stage)
                    .sessionId(session.getSessionId())
                    .timestamp(now)
                    .type(RaceObservation.CONCURRENT_ACCESS)
                    .concurrentSessions(new LinkedHashSet<>(r.getSessions()))
                    .stages(EnumSet.copyOf(r.getStages()))
                    .firstSeen(r.getFirstSeen())
                    .lastSeen(r.getLastSeen())
                    .operationCount(r.getOccurrenceCount() - 1)
                    .spreadMillis(Duration.between(r.getFirstSeen(), now).toMillis())
                    .build());
        });

        raceStore.record(RaceObservation.builder()
                .itemId(itemId)
                .stage(stage)
                .sessionId(session.getSessionId())
                .timestamp(now)
                .type(RaceObservation.OPERATION)
                .build());
        return race;
    }
}
