package com.example.indexingtelemetry.analysis;

import com.example.indexingtelemetry.ingest.Payloads;
import com.example.indexingtelemetry.model.EventLevel;
import com.example.indexingtelemetry.model.FinalStatus;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.Stage;

import java.util.List;
import java.util.Optional;

/**
 * Derives an item's final status from its events in one session.
 *
 * <p>Only the latest attempt counts: it starts at the last retrieval event. Within it,
 * each event may carry a status signal; the signal from the latest pipeline stage wins
 * and, at equal stages, the later event wins. An attempt without signals is {@code UNKNOWN}.
 */
public class ItemStatusResolver {

    /**
     * @param itemEvents events of a single item, in write order
     */
    public FinalStatus resolve(List<IndexingEvent> itemEvents) {
        FinalStatus status = FinalStatus.UNKNOWN;
        int bestOrder = -1;
        for (IndexingEvent e : latestAttempt(itemEvents)) {
            Optional<FinalStatus> signal = signal(e);
            if (signal.isPresent() && e.getStage().getOrder() >= bestOrder) {
                status = signal.get();
                bestOrder = e.getStage().getOrder();
            }
        }
        return status;
    }

    /** Reason given by the latest attempt's skip decision, if there was one. */
    public Optional<String> skipReason(List<IndexingEvent> itemEvents) {
        String reason = null;
        for (IndexingEvent e : latestAttempt(itemEvents)) {
            if (isSkip(e)) {
                reason = Payloads.getString(e.getPayload(), "reason", "Unknown");
            }
        }
        return Optional.ofNullable(reason);
    }

    static List<IndexingEvent> latestAttempt(List<IndexingEvent> itemEvents) {
        for (int i = itemEvents.size() - 1; i >= 0; i--) {
            IndexingEvent e = itemEvents.get(i);
            if (e.getStage() == Stage.RETRIEVAL && !SessionEvents.isRaceWarning(e)) {
                return itemEvents.subList(i, itemEvents.size());
            }
        }
        return itemEvents;
    }

    private static Optional<FinalStatus> signal(IndexingEvent e) {
        if (e.getStage() == null) {
            return Optional.empty();
        }
        if (e.getLevel() == EventLevel.ERROR) {
            return Optional.of(FinalStatus.FAILED);
        }
        if (isSkip(e)) {
            return Optional.of(FinalStatus.SKIPPED);
        }
        if (e.getStage() == Stage.SUBMISSION && e.getPayload() != null && e.getPayload().containsKey("success")) {
            return Optional.of(Payloads.getBoolean(e.getPayload(), "success", false)
                    ? FinalStatus.INDEXED : FinalStatus.FAILED);
        }
        return Optional.empty();
    }

    private static boolean isSkip(IndexingEvent e) {
        return e.getStage() == Stage.FILTERING
                && e.getPayload() != null
                && e.getPayload().containsKey("should_index")
                && !Payloads.getBoolean(e.getPayload(), "should_index", true);
    }
}
