package com.example.indexingtelemetry.analysis;

import com.example.indexingtelemetry.ingest.Payloads;
import com.example.indexingtelemetry.model.EventLevel;
import com.example.indexingtelemetry.model.FinalStatus;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.RaceObservation;
import com.example.indexingtelemetry.model.SessionOverview;
import com.example.indexingtelemetry.model.Stage;
import com.example.indexingtelemetry.race.RaceRecord;
import com.example.indexingtelemetry.store.EventStore;
import com.example.indexingtelemetry.store.RaceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Read-side queries over stored indexing events: missing items, item timelines,
 * session comparison, race reports and problem exports.
 */
@Service
public class IndexingAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(IndexingAnalyzer.class);

    static final String CSV_HEADER = "item_id,type,final_status,skip_reason,error_count,last_stage";

    private final EventStore eventStore;
    private final ObjectProvider<RaceStore> raceStore;
    private final SessionAggregator aggregator;

    public IndexingAnalyzer(EventStore eventStore, ObjectProvider<RaceStore> raceStore, SessionAggregator aggregator) {
        this.eventStore = eventStore;
        this.raceStore = raceStore;
        this.aggregator = aggregator;
    }

    public AnalysisResult<SessionSummary> summarize(String sessionId) {
        if (!eventStore.isReadable()) {
            return unreadable();
        }
        SessionSummary summary = aggregator.summarize(sessionId);
        if (summary.getEventCount() == 0) {
            return AnalysisResult.notFound(noEvents(sessionId));
        }
        return AnalysisResult.found(summary);
    }

    public AnalysisResult<MissingItemsReport> findMissing(String sessionId, Collection<Long> expectedIds) {
        if (!eventStore.isReadable()) {
            return unreadable();
        }
        List<IndexingEvent> events = SessionEvents.sorted(eventStore.findBySession(sessionId));
        if (events.isEmpty()) {
            return AnalysisResult.notFound(noEvents(sessionId));
        }

        SortedSet<Long> retrieved = new TreeSet<>();
        SortedSet<Long> processed = new TreeSet<>();
        for (IndexingEvent e : events) {
            if (e.getStage() == Stage.RETRIEVAL) {
                if (e.getItemId() == IndexingEvent.BATCH_ITEM) {
                    retrieved.addAll(Payloads.getLongList(e.getPayload(), "item_ids"));
                } else {
                    retrieved.add(e.getItemId());
                }
            } else if (e.getStage() != null && e.getStage().isTerminal() && e.getItemId() != IndexingEvent.BATCH_ITEM) {
                processed.add(e.getItemId());
            }
        }
        retrieved.remove(IndexingEvent.BATCH_ITEM);

        SortedSet<Long> expected = expectedIds == null ? new TreeSet<>() : new TreeSet<>(expectedIds);
        SortedSet<Long> neverSeen = new TreeSet<>(expected);
        neverSeen.removeAll(retrieved);
        SortedSet<Long> retrievedNotProcessed = new TreeSet<>(retrieved);
        retrievedNotProcessed.removeAll(processed);

        Map<Stage, SortedSet<Long>> lastStages = new EnumMap<>(Stage.class);
        SessionEvents.byItem(events).forEach((itemId, itemEvents) ->
                lastStage(itemEvents).ifPresent(stage ->
                        lastStages.computeIfAbsent(stage, k -> new TreeSet<>()).add(itemId)));
        Map<String, SortedSet<Long>> byStage = new LinkedHashMap<>();
        lastStages.forEach((stage, ids) -> byStage.put(stage.wireName(), ids));

        return AnalysisResult.found(MissingItemsReport.builder()
                .sessionId(sessionId)
                .expectedCount(expected.size())
                .retrievedCount(retrieved.size())
                .processedCount(processed.size())
                .neverSeen(neverSeen)
                .retrievedNotProcessed(retrievedNotProcessed)
                .byStage(byStage)
                .statusBreakdown(statusBreakdown(aggregator.resolveStatuses(events)))
                .build());
    }

    public AnalysisResult<ItemTimeline> itemTimeline(String sessionId, long itemId) {
        if (!eventStore.isReadable()) {
            return unreadable();
        }
        return AnalysisResult.found(new ItemTimeline(eventStore, sessionId, itemId));
    }

    public AnalysisResult<SessionComparison> compare(String sessionA, String sessionB) {
        if (!eventStore.isReadable()) {
            return unreadable();
        }
        List<IndexingEvent> eventsA = eventStore.findBySession(sessionA);
        if (eventsA.isEmpty()) {
            return AnalysisResult.notFound(noEvents(sessionA));
        }
        List<IndexingEvent> eventsB = eventStore.findBySession(sessionB);
        if (eventsB.isEmpty()) {
            return AnalysisResult.notFound(noEvents(sessionB));
        }

        SortedSet<Long> itemsA = SessionEvents.itemIds(eventsA);
        SortedSet<Long> itemsB = SessionEvents.itemIds(eventsB);
        SortedSet<Long> onlyInA = new TreeSet<>(itemsA);
        onlyInA.removeAll(itemsB);
        SortedSet<Long> onlyInB = new TreeSet<>(itemsB);
        onlyInB.removeAll(itemsA);
        SortedSet<Long> inBoth = new TreeSet<>(itemsA);
        inBoth.retainAll(itemsB);

        Map<Stage, Long> stagesA = countByStage(eventsA);
        Map<Stage, Long> stagesB = countByStage(eventsB);
        Map<String, StageDelta> deltas = new LinkedHashMap<>();
        for (Stage stage : Stage.values()) {
            if (stage.isPipelineStage() && (stagesA.containsKey(stage) || stagesB.containsKey(stage))) {
                deltas.put(stage.wireName(), new StageDelta(stagesA.getOrDefault(stage, 0L), stagesB.getOrDefault(stage, 0L)));
            }
        }

        return AnalysisResult.found(SessionComparison.builder()
                .sessionA(sessionA)
                .sessionB(sessionB)
                .onlyInA(onlyInA)
                .onlyInB(onlyInB)
                .inBoth(inBoth)
                .stageDeltas(deltas)
                .errorsA(countErrors(eventsA))
                .errorsB(countErrors(eventsB))
                .build());
    }

    /**
     * Items touched by several sessions close together.
     *
     * @param minConcurrent minimum number of distinct sessions involved with an item
     * @param timeWindow    correlations spanning more than this are ignored
     * @param limit         maximum number of items returned
     */
    public AnalysisResult<RaceReport> detectRaces(int minConcurrent, Duration timeWindow, int limit) {
        RaceStore races = raceStore.getIfAvailable();
        if (races == null) {
            return AnalysisResult.notFound("Race observations are not stored by the " + eventStore.backend() + " backend");
        }
        long windowMillis = timeWindow.toMillis();

        Map<Long, List<RaceObservation>> perItem = new TreeMap<>();
        Map<Stage, Long> stageCounts = new EnumMap<>(Stage.class);
        for (RaceObservation o : races.findCorrelations()) {
            if (o.getSpreadMillis() <= windowMillis) {
                perItem.computeIfAbsent(o.getItemId(), k -> new ArrayList<>()).add(o);
                if (o.getStage() != null) {
                    stageCounts.merge(o.getStage(), 1L, Long::sum);
                }
            }
        }

        List<RaceRecord> affected = new ArrayList<>();
        perItem.forEach((itemId, observations) -> {
            RaceRecord record = merge(itemId, observations);
            if (record.getSessions().size() >= minConcurrent) {
                affected.add(record);
            }
        });
        affected.sort(Comparator.comparingInt(RaceRecord::getOccurrenceCount).reversed()
                .thenComparingLong(RaceRecord::getItemId));

        Map<String, Long> stagePatterns = new LinkedHashMap<>();
        stageCounts.entrySet().stream()
                .sorted(Map.Entry.<Stage, Long>comparingByValue().reversed())
                .forEach(e -> stagePatterns.put(e.getKey().wireName(), e.getValue()));

        return AnalysisResult.found(RaceReport.builder()
                .totalItemsAffected(affected.size())
                .items(affected.stream().limit(Math.max(limit, 0)).collect(Collectors.toList()))
                .stagePatterns(stagePatterns)
                .build());
    }

    /**
     * CSV of items that failed, were skipped or logged errors in the session.
     */
    public AnalysisResult<String> exportCsv(String sessionId) {
        if (!eventStore.isReadable()) {
            return unreadable();
        }
        List<IndexingEvent> events = SessionEvents.sorted(eventStore.findBySession(sessionId));
        if (events.isEmpty()) {
            return AnalysisResult.notFound(noEvents(sessionId));
        }
        ItemStatusResolver resolver = aggregator.getResolver();
        StringBuilder csv = new StringBuilder(CSV_HEADER).append('\n');
        int rows = 0;
        for (Map.Entry<Long, List<IndexingEvent>> entry : SessionEvents.byItem(events).entrySet()) {
            List<IndexingEvent> itemEvents = entry.getValue();
            FinalStatus status = resolver.resolve(itemEvents);
            long errors = countErrors(itemEvents);
            if (status != FinalStatus.FAILED && status != FinalStatus.SKIPPED && errors == 0) {
                continue;
            }
            String itemType = itemEvents.stream().map(IndexingEvent::getItemType)
                    .filter(Objects::nonNull).findFirst().orElse("");
            csv.append(entry.getKey()).append(',')
                    .append(quote(itemType)).append(',')
                    .append(quote(status.wireName())).append(',')
                    .append(quote(resolver.skipReason(itemEvents).orElse(""))).append(',')
                    .append(errors).append(',')
                    .append(quote(lastStage(itemEvents).map(Stage::wireName).orElse("unknown")))
                    .append('\n');
            rows++;
        }
        logger.debug("Exported {} problematic items for {}", rows, sessionId);
        return AnalysisResult.found(csv.toString());
    }

    public List<SessionOverview> recentSessions(int limit) {
        if (!eventStore.isReadable() || limit < 1) {
            return List.of();
        }
        return eventStore.recentSessions(limit);
    }

    private static Optional<Stage> lastStage(List<IndexingEvent> itemEvents) {
        for (int i = itemEvents.size() - 1; i >= 0; i--) {
            IndexingEvent e = itemEvents.get(i);
            Stage stage = e.getStage();
            if (stage != null && stage.isPipelineStage() && !SessionEvents.isRaceWarning(e)) {
                return Optional.of(stage);
            }
        }
        return Optional.empty();
    }

    private static RaceRecord merge(long itemId, List<RaceObservation> observations) {
        SortedSet<String> sessions = new TreeSet<>();
        Set<Stage> stages = EnumSet.noneOf(Stage.class);
        Instant first = null;
        Instant last = null;
        for (RaceObservation o : observations) {
            if (o.getConcurrentSessions() != null) {
                sessions.addAll(o.getConcurrentSessions());
            }
            if (o.getSessionId() != null) {
                sessions.add(o.getSessionId());
            }
            if (o.getStages() != null) {
                stages.addAll(o.getStages());
            }
            if (o.getStage() != null) {
                stages.add(o.getStage());
            }
            Instant from = o.getFirstSeen() != null ? o.getFirstSeen() : o.getTimestamp();
            Instant to = o.getLastSeen() != null ? o.getLastSeen() : o.getTimestamp();
            if (from != null && (first == null || from.isBefore(first))) {
                first = from;
            }
            if (to != null && (last == null || to.isAfter(last))) {
                last = to;
            }
        }
        return RaceRecord.builder()
                .itemId(itemId)
                .sessions(sessions)
                .stages(stages)
                .firstSeen(first)
                .lastSeen(last)
                .occurrenceCount(observations.size())
                .build();
    }

    private static Map<String, Long> statusBreakdown(Map<Long, FinalStatus> statuses) {
        Map<String, Long> breakdown = new LinkedHashMap<>();
        for (FinalStatus s : FinalStatus.values()) {
            breakdown.put(s.wireName(), 0L);
        }
        statuses.values().forEach(s -> breakdown.merge(s.wireName(), 1L, Long::sum));
        return breakdown;
    }

    private static Map<Stage, Long> countByStage(List<IndexingEvent> events) {
        Map<Stage, Long> counts = new EnumMap<>(Stage.class);
        for (IndexingEvent e : events) {
            if (e.getStage() != null && !SessionEvents.isRaceWarning(e)) {
                counts.merge(e.getStage(), 1L, Long::sum);
            }
        }
        return counts;
    }

    private static long countErrors(List<IndexingEvent> events) {
        return events.stream().filter(e -> e.getLevel() == EventLevel.ERROR).count();
    }

    private static String quote(String value) {
        return '"' + value.replace("\"", "\"\"") + '"';
    }

    private static String noEvents(String sessionId) {
        return "No events found for session " + sessionId;
    }

    private <T> AnalysisResult<T> unreadable() {
        return AnalysisResult.notFound("The " + eventStore.backend() + " backend does not support queries");
    }
}
