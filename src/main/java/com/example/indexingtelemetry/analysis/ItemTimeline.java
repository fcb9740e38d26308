package com.example.indexingtelemetry.analysis;

import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.store.EventStore;

import java.util.Iterator;

/**
 * Events of one item in one session, in write order. Each iteration reads the store
 * again, so events written between iterations are included.
 */
public class ItemTimeline implements Iterable<IndexingEvent> {

    private final EventStore eventStore;
    private final String sessionId;
    private final long itemId;

    ItemTimeline(EventStore eventStore, String sessionId, long itemId) {
        this.eventStore = eventStore;
        this.sessionId = sessionId;
        this.itemId = itemId;
    }

    public String getSessionId() {
        return sessionId;
    }

    public long getItemId() {
        return itemId;
    }

    @Override
    public Iterator<IndexingEvent> iterator() {
        return SessionEvents.sorted(eventStore.findBySessionAndItem(sessionId, itemId)).iterator();
    }
}
