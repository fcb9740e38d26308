package com.example.indexingtelemetry.analysis;

import com.example.indexingtelemetry.ingest.Payloads;
import com.example.indexingtelemetry.model.EventLevel;
import com.example.indexingtelemetry.model.IndexingEvent;

import java.time.Instant;
import java.util.*;

/**
 * Ordering and grouping helpers shared by the aggregator and analyzer.
 */
final class SessionEvents {

    static final Comparator<IndexingEvent> WRITE_ORDER = Comparator
            .comparing(IndexingEvent::getTimestamp, Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparingLong(IndexingEvent::getSequence);

    private SessionEvents() {
    }

    static List<IndexingEvent> sorted(Collection<IndexingEvent> events) {
        List<IndexingEvent> copy = new ArrayList<>(events);
        copy.sort(WRITE_ORDER);
        return copy;
    }

    /** Item-level events grouped by item id, in ascending id order; batch events are left out. */
    static SortedMap<Long, List<IndexingEvent>> byItem(List<IndexingEvent> sortedEvents) {
        SortedMap<Long, List<IndexingEvent>> items = new TreeMap<>();
        for (IndexingEvent e : sortedEvents) {
            if (e.getItemId() != IndexingEvent.BATCH_ITEM) {
                items.computeIfAbsent(e.getItemId(), k -> new ArrayList<>()).add(e);
            }
        }
        return items;
    }

    static SortedSet<Long> itemIds(List<IndexingEvent> events) {
        SortedSet<Long> ids = new TreeSet<>();
        for (IndexingEvent e : events) {
            if (e.getItemId() != IndexingEvent.BATCH_ITEM) {
                ids.add(e.getItemId());
            }
        }
        return ids;
    }

    /** Race warnings repeat the stage being observed; they are not pipeline traffic of their own. */
    static boolean isRaceWarning(IndexingEvent e) {
        return e.getLevel() == EventLevel.WARNING && Payloads.getBoolean(e.getPayload(), "race_condition", false);
    }
}
