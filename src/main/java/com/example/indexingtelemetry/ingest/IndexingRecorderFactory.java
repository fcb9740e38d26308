package com.example.indexingtelemetry.ingest;

import com.example.indexingtelemetry.analysis.SessionAggregator;
import com.example.indexingtelemetry.exception.StoreUnavailableException;
import com.example.indexingtelemetry.model.IngestionSession;
import com.example.indexingtelemetry.race.RaceDetector;
import com.example.indexingtelemetry.store.EventStore;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Opens recording sessions for indexing runs.
 *
 * <p>The store is verified once at startup. If it cannot be used, every run gets
 * {@link IndexingObserver#NOOP} and indexing proceeds without telemetry.
 */
@Service
public class IndexingRecorderFactory {

    private static final Logger logger = LoggerFactory.getLogger(IndexingRecorderFactory.class);

    private final EventStore eventStore;
    private final RaceDetector raceDetector;
    private final SessionAggregator aggregator;
    private final Clock clock;

    private final Map<String, IndexingRecorder> active = new ConcurrentHashMap<>();
    private volatile boolean available;

    @Value("${indexing.telemetry.enabled:true}")
    private boolean enabled;

    @Value("${indexing.telemetry.buffer.size:50}")
    private int bufferSize;

    @Value("${indexing.telemetry.buffer.cloud-size:25}")
    private int cloudBufferSize;

    public IndexingRecorderFactory(EventStore eventStore, RaceDetector raceDetector,
                                   SessionAggregator aggregator, Clock clock) {
        this.eventStore = eventStore;
        this.raceDetector = raceDetector;
        this.aggregator = aggregator;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        if (!enabled) {
            logger.info("Indexing telemetry disabled by configuration");
            available = false;
            return;
        }
        try {
            eventStore.verify();
            available = true;
            logger.info("Indexing telemetry enabled: backend={}, flush threshold={}", eventStore.backend(), flushThreshold());
        } catch (StoreUnavailableException e) {
            available = false;
            logger.error("Indexing telemetry disabled, {} store unavailable: {}", eventStore.backend(), e.getMessage());
        }
    }

    /**
     * Starts a recording session for one indexing run.
     *
     * @param indexId name of the target index, may be null
     */
    public IndexingObserver open(String indexId) {
        if (!available) {
            return IndexingObserver.NOOP;
        }
        IngestionSession session = IngestionSession.start(indexId, clock);
        EventBuffer buffer = new EventBuffer(session, eventStore, raceDetector, clock, flushThreshold(), true);
        IndexingRecorder recorder = new IndexingRecorder(buffer, aggregator, r -> active.remove(r.getSession().getSessionId()));
        active.put(session.getSessionId(), recorder);
        logger.debug("Opened indexing session {} for index {}", session.getSessionId(), indexId);
        return recorder;
    }

    public boolean isAvailable() {
        return available;
    }

    public int activeSessions() {
        return active.size();
    }

    int flushThreshold() {
        return "log".equals(eventStore.backend()) ? cloudBufferSize : bufferSize;
    }

    @PreDestroy
    public void flushAll() {
        if (active.isEmpty()) {
            return;
        }
        logger.info("Flushing {} open indexing sessions", active.size());
        active.values().forEach(IndexingRecorder::flush);
    }
}
