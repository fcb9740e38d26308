package com.example.indexingtelemetry.service;

import com.example.indexingtelemetry.store.EventStore;
import com.example.indexingtelemetry.store.RaceStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.test.util.ReflectionTestUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetentionServiceTest {

    private static final Instant NOW = Instant.parse("2025-03-08T00:00:00Z");
    private static final Instant CUTOFF = Instant.parse("2025-03-01T00:00:00Z");

    @Mock
    private EventStore eventStore;

    @Mock
    private RaceStore raceStore;

    @Mock
    private ObjectProvider<RaceStore> raceStoreProvider;

    private RetentionService retentionService;

    @BeforeEach
    void setUp() {
        retentionService = new RetentionService(eventStore, raceStoreProvider, Clock.fixed(NOW, ZoneOffset.UTC));
        ReflectionTestUtils.setField(retentionService, "ttl", Duration.ofDays(7));
    }

    @Test
    void testPurgeExpired_UsesRetentionCutoff() {
        // Given
        when(eventStore.purgeOlderThan(CUTOFF)).thenReturn(120L);
        when(eventStore.backend()).thenReturn("jdbc");
        when(raceStoreProvider.getIfAvailable()).thenReturn(raceStore);
        when(raceStore.purgeOlderThan(CUTOFF)).thenReturn(4L);

        // When
        Map<String, Object> result = retentionService.purgeExpired();

        // Then
        assertEquals(CUTOFF.toString(), result.get("cutoff"));
        assertEquals(120L, result.get("eventsRemoved"));
        assertEquals(4L, result.get("raceObservationsRemoved"));
    }

    @Test
    void testPurgeExpired_WithoutRaceStore() {
        when(eventStore.purgeOlderThan(CUTOFF)).thenReturn(0L);
        when(eventStore.backend()).thenReturn("log");
        when(raceStoreProvider.getIfAvailable()).thenReturn(null);

        Map<String, Object> result = retentionService.purgeExpired();

        assertEquals(0L, result.get("raceObservationsRemoved"));
        verifyNoInteractions(raceStore);
    }

    @Test
    void testScheduledPurge_SwallowsStoreFailure() {
        when(eventStore.purgeOlderThan(any())).thenThrow(new IllegalStateException("db locked"));

        assertDoesNotThrow(() -> retentionService.scheduledPurge());
    }
}
