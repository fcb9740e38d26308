package com.example.indexingtelemetry.store;

import com.example.indexingtelemetry.TestEvents;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class LogChannelEventStoreTest {

    private final LogChannelEventStore store = new LogChannelEventStore(new ObjectMapper(), "blog.example.com");

    @Test
    void testEntry_CarriesContextAndLowercaseLevel() {
        IndexingEvent event = new TestEvents("idx_a").filtered(5, false, "draft");

        Map<String, Object> entry = store.toEntry(event);

        assertEquals("debug", entry.get("level"));
        assertEquals(event.getTimestamp().toString(), entry.get("timestamp"));
        @SuppressWarnings("unchecked")
        Map<String, Object> context = (Map<String, Object>) entry.get("context");
        assertEquals("idx_a", context.get("session_id"));
        assertEquals(5L, context.get("item_id"));
        assertEquals("filtering", context.get("stage"));
        assertEquals("draft", context.get("reason"));
        assertEquals("blog.example.com", context.get("site"));
    }

    @Test
    void testStoreIsWriteOnly() {
        TestEvents s = new TestEvents("idx_a");
        assertDoesNotThrow(() -> store.appendBatch(List.of(s.retrieval(1), s.submitted(1, true))));

        assertFalse(store.isReadable());
        assertEquals("log", store.backend());
        assertTrue(store.findBySession("idx_a").isEmpty());
        assertTrue(store.findSessionRecord("idx_a").isEmpty());
        assertEquals(0L, store.purgeOlderThan(Instant.now()));
    }
}
