package com.example.indexingtelemetry.ingest;

import com.example.indexingtelemetry.exception.WriteFailedException;
import com.example.indexingtelemetry.model.EventLevel;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.IngestionSession;
import com.example.indexingtelemetry.model.Stage;
import com.example.indexingtelemetry.race.RaceDetector;
import com.example.indexingtelemetry.race.RaceRecord;
import com.example.indexingtelemetry.store.EventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeSet;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class EventBufferTest {

    private static final Instant NOW = Instant.parse("2025-03-01T10:00:00Z");

    @Mock
    private EventStore eventStore;

    @Mock
    private RaceDetector raceDetector;

    private final Clock clock = Clock.fixed(NOW, ZoneOffset.UTC);
    private IngestionSession session;

    @BeforeEach
    void setUp() {
        session = new IngestionSession("idx_test", "posts", NOW);
    }

    private EventBuffer buffer(int threshold) {
        return new EventBuffer(session, eventStore, RaceDetector.NONE, clock, threshold, true);
    }

    @Test
    void testFlush_WritesBufferedEventsInOrder() {
        // Given
        EventBuffer buffer = buffer(50);
        buffer.track(1L, "post", Stage.RETRIEVAL, EventLevel.INFO, "retrieved", Map.of());
        buffer.track(1L, "post", Stage.FILTERING, EventLevel.DEBUG, "filtered", Map.of("should_index", true));
        buffer.track(2L, "page", Stage.RETRIEVAL, EventLevel.INFO, "retrieved", null);

        // When
        int written = buffer.flush();

        // Then
        assertEquals(3, written);
        assertEquals(0, buffer.size());
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<IndexingEvent>> captor = ArgumentCaptor.forClass(List.class);
        verify(eventStore, times(1)).appendBatch(captor.capture());
        List<IndexingEvent> batch = captor.getValue();
        assertEquals(List.of(1L, 1L, 2L), batch.stream().map(IndexingEvent::getItemId).toList());
        assertEquals(List.of(1L, 2L, 3L), batch.stream().map(IndexingEvent::getSequence).toList());
        assertEquals(Stage.FILTERING, batch.get(1).getStage());
        assertEquals("idx_test", batch.get(0).getSessionId());
        assertEquals(NOW, batch.get(0).getTimestamp());
        assertTrue(batch.get(2).getPayload().isEmpty());
    }

    @Test
    void testFlush_EmptyQueueWritesNothing() {
        assertEquals(0, buffer(50).flush());
        verify(eventStore, never()).appendBatch(anyList());
    }

    @Test
    void testThresholdReached_FlushesAutomatically() {
        EventBuffer buffer = buffer(3);

        buffer.track(1L, null, Stage.RETRIEVAL, EventLevel.INFO, "a", Map.of());
        buffer.track(2L, null, Stage.RETRIEVAL, EventLevel.INFO, "b", Map.of());
        verify(eventStore, never()).appendBatch(anyList());

        buffer.track(3L, null, Stage.RETRIEVAL, EventLevel.INFO, "c", Map.of());
        verify(eventStore, times(1)).appendBatch(argThat(l -> l.size() == 3));
        assertEquals(0, buffer.size());
    }

    @Test
    void testWriteFailure_DropsBatchWithoutRetry() {
        // Given
        EventBuffer buffer = buffer(50);
        when(eventStore.backend()).thenReturn("mongo");
        doThrow(new WriteFailedException("down", 2, new RuntimeException("connection refused")))
                .when(eventStore).appendBatch(anyList());
        buffer.track(1L, null, Stage.RETRIEVAL, EventLevel.INFO, "a", Map.of());
        buffer.track(2L, null, Stage.RETRIEVAL, EventLevel.INFO, "b", Map.of());

        // When
        int written = buffer.flush();

        // Then
        assertEquals(0, written);
        assertEquals(0, buffer.size());
        assertEquals(0, buffer.flush());
        verify(eventStore, times(1)).appendBatch(anyList());
    }

    @Test
    void testUnexpectedStoreError_DoesNotPropagate() {
        EventBuffer buffer = buffer(50);
        when(eventStore.backend()).thenReturn("jdbc");
        doThrow(new IllegalStateException("pool closed")).when(eventStore).appendBatch(anyList());
        buffer.track(1L, null, Stage.RETRIEVAL, EventLevel.INFO, "a", Map.of());

        assertDoesNotThrow(buffer::close);
        assertEquals(0, buffer.size());
    }

    @Test
    void testDetectedRace_AddsWarningEvent() {
        // Given
        RaceRecord race = RaceRecord.builder()
                .itemId(42L)
                .sessions(new TreeSet<>(List.of("idx_other", "idx_test")))
                .stages(EnumSet.of(Stage.RETRIEVAL))
                .firstSeen(NOW.minusSeconds(3))
                .lastSeen(NOW)
                .occurrenceCount(2)
                .build();
        when(raceDetector.check(session, 42L, Stage.RETRIEVAL, NOW)).thenReturn(Optional.of(race));
        EventBuffer buffer = new EventBuffer(session, eventStore, raceDetector, clock, 50, true);

        // When
        buffer.track(42L, "post", Stage.RETRIEVAL, EventLevel.INFO, "retrieved", Map.of());
        buffer.flush();

        // Then
        @SuppressWarnings("unchecked")
        ArgumentCaptor<List<IndexingEvent>> captor = ArgumentCaptor.forClass(List.class);
        verify(eventStore).appendBatch(captor.capture());
        List<IndexingEvent> batch = captor.getValue();
        assertEquals(2, batch.size());
        IndexingEvent warning = batch.get(1);
        assertEquals(EventLevel.WARNING, warning.getLevel());
        assertEquals(42L, warning.getItemId());
        assertEquals(Boolean.TRUE, warning.getPayload().get("race_condition"));
        assertEquals(List.of("idx_other", "idx_test"), warning.getPayload().get("concurrent_sessions"));
    }

    @Test
    void testDetectorFailure_StillQueuesEvent() {
        when(raceDetector.check(any(), anyLong(), any(), any())).thenThrow(new RuntimeException("redis down"));
        EventBuffer buffer = new EventBuffer(session, eventStore, raceDetector, clock, 50, true);

        buffer.track(7L, null, Stage.RETRIEVAL, EventLevel.INFO, "retrieved", Map.of());

        assertEquals(1, buffer.size());
    }

    @Test
    void testDisabledBuffer_DiscardsEvents() {
        EventBuffer buffer = new EventBuffer(session, eventStore, raceDetector, clock, 1, false);

        buffer.track(1L, null, Stage.RETRIEVAL, EventLevel.INFO, "a", Map.of());

        assertEquals(0, buffer.size());
        verifyNoInteractions(eventStore, raceDetector);
    }

    @Test
    void testInvalidThreshold_IsRejected() {
        assertThrows(IllegalArgumentException.class, () -> buffer(0));
    }
}
