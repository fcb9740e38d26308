package com.example.indexingtelemetry.analysis;

import com.example.indexingtelemetry.TestEvents;
import com.example.indexingtelemetry.model.EventLevel;
import com.example.indexingtelemetry.model.FinalStatus;
import com.example.indexingtelemetry.model.Stage;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ItemStatusResolverTest {

    private final ItemStatusResolver resolver = new ItemStatusResolver();
    private final TestEvents s = new TestEvents("idx_a");

    @Test
    void testFilteredOut_IsSkipped() {
        var events = List.of(s.retrieval(1), s.filtered(1, false, "draft"));

        assertEquals(FinalStatus.SKIPPED, resolver.resolve(events));
        assertEquals(Optional.of("draft"), resolver.skipReason(events));
    }

    @Test
    void testSuccessfulSubmission_IsIndexed() {
        var events = List.of(s.retrieval(1), s.filtered(1, true, ""), s.generated(1, 3), s.submitted(1, true));

        assertEquals(FinalStatus.INDEXED, resolver.resolve(events));
        assertTrue(resolver.skipReason(events).isEmpty());
    }

    @Test
    void testGenerationError_IsFailed() {
        var events = List.of(s.retrieval(1), s.generationFailed(1, "boom"));

        assertEquals(FinalStatus.FAILED, resolver.resolve(events));
    }

    @Test
    void testLaterStageSignal_Wins() {
        var events = List.of(s.retrieval(1), s.generationFailed(1, "retrying"), s.submitted(1, true));

        assertEquals(FinalStatus.INDEXED, resolver.resolve(events));
    }

    @Test
    void testSameStage_LaterSignalWins() {
        var events = List.of(s.retrieval(1), s.submitted(1, true), s.submitted(1, false));

        assertEquals(FinalStatus.FAILED, resolver.resolve(events));
    }

    @Test
    void testRetrievalOnly_IsUnknown() {
        assertEquals(FinalStatus.UNKNOWN, resolver.resolve(List.of(s.retrieval(1))));
        assertEquals(FinalStatus.UNKNOWN, resolver.resolve(List.of()));
    }

    @Test
    void testTerminalState_SurvivesLaterEventsWithoutRetrieval() {
        var events = List.of(s.retrieval(1), s.submitted(1, true), s.deleted(1),
                s.event(1, Stage.FILTERING, EventLevel.WARNING, "race_condition", true));

        assertEquals(FinalStatus.INDEXED, resolver.resolve(events));
    }

    @Test
    void testNewRetrieval_StartsNewAttempt() {
        var events = List.of(s.retrieval(1), s.filtered(1, false, "draft"), s.retrieval(1));

        assertEquals(FinalStatus.UNKNOWN, resolver.resolve(events));
        assertTrue(resolver.skipReason(events).isEmpty());
    }

    @Test
    void testRaceWarning_DoesNotStartNewAttempt() {
        var events = List.of(s.retrieval(1), s.generationFailed(1, "boom"),
                s.event(1, Stage.RETRIEVAL, EventLevel.WARNING, "race_condition", true));

        assertEquals(FinalStatus.FAILED, resolver.resolve(events));
    }

    @Test
    void testMalformedShouldIndex_IsReadLeniently() {
        var events = List.of(s.retrieval(1), s.event(1, Stage.FILTERING, EventLevel.DEBUG, "should_index", "0", "reason", "private"));

        assertEquals(FinalStatus.SKIPPED, resolver.resolve(events));
    }
}
