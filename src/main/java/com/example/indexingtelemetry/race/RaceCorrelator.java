package com.example.indexingtelemetry.race;

import com.example.indexingtelemetry.model.RaceObservation;
import com.example.indexingtelemetry.model.Stage;

import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * Decides whether recent operations on an item amount to a race with the current one.
 *
 * <p>A short window misses slow races; a long one flags independent runs that
 * happen to touch the same item.
 */
public final class RaceCorrelator {

    private final Duration window;

    public RaceCorrelator(Duration window) {
        if (window == null || window.isNegative() || window.isZero()) {
            throw new IllegalArgumentException("Race window must be positive: " + window);
        }
        this.window = window;
    }

    public Duration getWindow() {
        return window;
    }

    public Optional<RaceRecord> correlate(long itemId, Stage stage, String sessionId, Instant now,
                                          Collection<RaceObservation> recent) {
        if (recent == null || recent.isEmpty()) {
            return Optional.empty();
        }
        Instant since = now.minus(window);
        List<RaceObservation> inWindow = new ArrayList<>();
        for (RaceObservation op : recent) {
            if (op.getItemId() == itemId && op.getTimestamp() != null && !op.getTimestamp().isBefore(since)) {
                inWindow.add(op);
            }
        }
        boolean otherSession = inWindow.stream().anyMatch(op -> !Objects.equals(op.getSessionId(), sessionId));
        if (!otherSession) {
            return Optional.empty();
        }

        SortedSet<String> sessions = new TreeSet<>();
        Set<Stage> stages = EnumSet.of(stage);
        Instant firstSeen = now;
        for (RaceObservation op : inWindow) {
            if (op.getSessionId() != null) {
                sessions.add(op.getSessionId());
            }
            if (op.getStage() != null) {
                stages.add(op.getStage());
            }
            if (op.getTimestamp().isBefore(firstSeen)) {
                firstSeen = op.getTimestamp();
            }
        }
        sessions.add(sessionId);

        return Optional.of(RaceRecord.builder()
                .itemId(itemId)
                .sessions(Collections.unmodifiableSortedSet(sessions))
                .stages(Collections.unmodifiableSet(stages))
                .firstSeen(firstSeen)
                .lastSeen(now)
                .occurrenceCount(inWindow.size() + 1)
                .build());
    }
}
