package com.example.indexingtelemetry.race;

import com.example.indexingtelemetry.model.IngestionSession;
import com.example.indexingtelemetry.model.Stage;

import java.time.Instant;
import java.util.Optional;

/**
 * Checks an incoming operation against recent operations on the same item.
 * Called synchronously on every tracked event.
 */
public interface RaceDetector {

    RaceDetector NONE = (session, itemId, stage, now) -> Optional.empty();

    /**
     * Returns a correlation when another session touched the item within the window,
     * and records the current operation as a candidate for later checks.
     */
    Optional<RaceRecord> check(IngestionSession session, long itemId, Stage stage, Instant now);
}
