package com.example.indexingtelemetry.analysis;

import com.example.indexingtelemetry.TestEvents;
import com.example.indexingtelemetry.model.EventLevel;
import com.example.indexingtelemetry.model.FinalStatus;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.IngestionSession;
import com.example.indexingtelemetry.model.SessionRecord;
import com.example.indexingtelemetry.model.Stage;
import com.example.indexingtelemetry.store.EventStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionAggregatorTest {

    private static final Instant CLOSED_AT = TestEvents.T0.plusSeconds(3600);

    @Mock
    private EventStore eventStore;

    private SessionAggregator aggregator;
    private List<IndexingEvent> events;

    @BeforeEach
    void setUp() {
        aggregator = new SessionAggregator(eventStore, Clock.fixed(CLOSED_AT, ZoneOffset.UTC));
        TestEvents s = new TestEvents("idx_a");
        events = List.of(
                s.event(0, Stage.RETRIEVAL, EventLevel.INFO, "item_ids", List.of(1, 2, 3)),
                s.retrieval(1), s.filtered(1, true, ""), s.generated(1, 4), s.submitted(1, true),
                s.retrieval(2), s.filtered(2, false, "draft"),
                s.retrieval(3), s.generationFailed(3, "bad template"),
                s.event(0, Stage.SANITIZATION, EventLevel.ERROR, "dropped_count", 2),
                s.retrieval(4));
    }

    @Test
    void testSummarize_CountsStatusesAndStages() {
        // Given
        when(eventStore.findBySession("idx_a")).thenReturn(events);
        when(eventStore.findSessionRecord("idx_a")).thenReturn(Optional.empty());

        // When
        SessionSummary summary = aggregator.summarize("idx_a");

        // Then
        assertEquals(4, summary.getTotalItems());
        assertEquals(1, summary.count(FinalStatus.INDEXED));
        assertEquals(1, summary.count(FinalStatus.SKIPPED));
        assertEquals(1, summary.count(FinalStatus.FAILED));
        assertEquals(1, summary.count(FinalStatus.UNKNOWN));
        assertEquals(2, summary.getErrorCount());
        assertEquals(4, summary.getRecordsGenerated());
        assertEquals(2, summary.getRecordsDropped());
        assertEquals(Map.of("draft", 1L), summary.getSkipReasons());
        assertEquals(5L, summary.getEventsByStage().get("retrieval"));
        assertTrue(summary.isOpen());
        assertEquals(TestEvents.T0.plusSeconds(1), summary.getStartTime());
        assertEquals(Duration.ofSeconds(10), summary.getDuration());
    }

    @Test
    void testSummarize_BreaksErrorsDownByStage() {
        // Given
        when(eventStore.findBySession("idx_a")).thenReturn(events);
        when(eventStore.findSessionRecord("idx_a")).thenReturn(Optional.empty());

        // When
        SessionSummary summary = aggregator.summarize("idx_a");

        // Then
        assertEquals(Map.of("generation", 1L, "sanitization", 1L), summary.getErrorsByStage());
        List<ErrorDetail> details = summary.getErrorDetails();
        assertEquals(2, details.size());
        assertEquals("generation", details.get(0).getStage());
        assertEquals(3L, details.get(0).getItemId());
        assertEquals(TestEvents.T0.plusSeconds(9), details.get(0).getTimestamp());
        assertNull(details.get(1).getItemId());
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> rendered = (List<Map<String, Object>>) summary.toMap().get("errorDetails");
        assertEquals("sanitization", rendered.get(1).get("stage"));
    }

    @Test
    void testSummarize_CapsErrorDetails() {
        TestEvents s = new TestEvents("idx_a");
        List<IndexingEvent> failures = new ArrayList<>();
        for (long id = 1; id <= SessionAggregator.ERROR_DETAIL_LIMIT + 20; id++) {
            failures.add(s.generationFailed(id, "bad template"));
        }

        SessionSummary summary = aggregator.summarize("idx_a", failures, null);

        assertEquals(SessionAggregator.ERROR_DETAIL_LIMIT + 20, summary.getErrorCount());
        assertEquals(SessionAggregator.ERROR_DETAIL_LIMIT, summary.getErrorDetails().size());
        assertEquals(1L, summary.getErrorDetails().get(0).getItemId());
    }

    @Test
    void testSummarize_RaceWarningsAreNotStageTraffic() {
        TestEvents s = new TestEvents("idx_a");
        List<IndexingEvent> withRace = List.of(
                s.retrieval(1),
                s.event(1, Stage.RETRIEVAL, EventLevel.WARNING, "race_condition", true),
                s.submitted(1, true));

        SessionSummary summary = aggregator.summarize("idx_a", withRace, null);

        assertEquals(1L, summary.getEventsByStage().get("retrieval"));
        assertEquals(3L, summary.getEventCount());
        assertEquals(1, summary.count(FinalStatus.INDEXED));
    }

    @Test
    void testSummarize_IsIdempotent() {
        when(eventStore.findBySession("idx_a")).thenReturn(events);
        when(eventStore.findSessionRecord("idx_a")).thenReturn(Optional.empty());

        assertEquals(aggregator.summarize("idx_a"), aggregator.summarize("idx_a"));
    }

    @Test
    void testUnknownSession_IsEmptyAndOpen() {
        when(eventStore.findBySession("idx_missing")).thenReturn(List.of());
        when(eventStore.findSessionRecord("idx_missing")).thenReturn(Optional.empty());

        SessionSummary summary = aggregator.summarize("idx_missing");

        assertEquals(0, summary.getTotalItems());
        assertTrue(summary.isOpen());
        assertNull(summary.getStartTime());
        assertEquals(Duration.ZERO, summary.getDuration());
        assertEquals(4, summary.getStatusCounts().size());
        assertTrue(summary.getStatusCounts().values().stream().allMatch(v -> v == 0L));
    }

    @Test
    void testClosedSession_EndsAtRecordTimestamp() {
        SessionRecord record = SessionRecord.builder().sessionId("idx_a").timestamp(CLOSED_AT).build();
        when(eventStore.findBySession("idx_a")).thenReturn(events);
        when(eventStore.findSessionRecord("idx_a")).thenReturn(Optional.of(record));

        SessionSummary summary = aggregator.summarize("idx_a");

        assertFalse(summary.isOpen());
        assertEquals(CLOSED_AT, summary.getEndTime());
    }

    @Test
    void testCloseSession_SavesRecordWithBreakdown() {
        // Given
        IngestionSession session = new IngestionSession("idx_a", "posts", TestEvents.T0);
        when(eventStore.isReadable()).thenReturn(true);
        when(eventStore.findBySession("idx_a")).thenReturn(events);

        // When
        aggregator.closeSession(session, Duration.ofSeconds(90), 2048L);

        // Then
        ArgumentCaptor<SessionRecord> captor = ArgumentCaptor.forClass(SessionRecord.class);
        verify(eventStore).saveSessionRecord(captor.capture());
        SessionRecord saved = captor.getValue();
        assertEquals("idx_a", saved.getSessionId());
        assertEquals("posts", saved.getIndexId());
        assertEquals(CLOSED_AT, saved.getTimestamp());
        assertEquals(90L, saved.getDurationSeconds());
        assertEquals(2048L, saved.getMemoryPeakBytes());
        assertEquals(4, saved.getTotalItems());
        assertEquals(2L, saved.getErrorCount());
        assertEquals(1L, saved.getStatusBreakdown().get("indexed"));
    }

    @Test
    void testCloseSession_WriteOnlyBackendSkipsStatistics() {
        IngestionSession session = new IngestionSession("idx_a", "posts", TestEvents.T0);
        when(eventStore.isReadable()).thenReturn(false);

        SessionRecord saved = aggregator.closeSession(session, Duration.ofSeconds(5), 0L);

        assertEquals(0, saved.getTotalItems());
        assertTrue(saved.getStatusBreakdown().isEmpty());
        verify(eventStore, never()).findBySession(anyString());
        verify(eventStore).saveSessionRecord(saved);
    }
}
