package com.example.indexingtelemetry.mcp;

import com.example.indexingtelemetry.analysis.AnalysisResult;
import com.example.indexingtelemetry.analysis.IndexingAnalyzer;
import com.example.indexingtelemetry.analysis.ItemTimeline;
import com.example.indexingtelemetry.model.IndexingEvent;
import com.example.indexingtelemetry.model.SessionOverview;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
public class AnalysisTools {

    private final IndexingAnalyzer analyzer;

    @Value("${indexing.telemetry.race.window:10s}")
    private Duration defaultRaceWindow;

    public AnalysisTools(IndexingAnalyzer analyzer) {
        this.analyzer = analyzer;
    }

    @Tool(description = "Summarize an indexing session: item statuses, errors, stage counts, skip reasons")
    public Map<String,Object> session_summary(String sessionId) {
        requireSession(sessionId);
        return toResponse(analyzer.summarize(sessionId), s -> s.toMap());
    }

    @Tool(description = "Find expected items that were never retrieved or never reached submission/deletion")
    public Map<String,Object> find_missing(String sessionId, List<Long> expectedIds) {
        requireSession(sessionId);
        return toResponse(analyzer.findMissing(sessionId, expectedIds == null ? List.of() : expectedIds), r -> r.toMap());
    }

    @Tool(description = "Ordered events of one item within a session")
    public Map<String,Object> item_timeline(String sessionId, Long itemId) {
        requireSession(sessionId);
        if (itemId == null) {
            throw new IllegalArgumentException("itemId is required");
        }
        return toResponse(analyzer.itemTimeline(sessionId, itemId), timeline -> {
            List<Map<String,Object>> events = new ArrayList<>();
            for (IndexingEvent e : timeline) {
                events.add(toMap(e));
            }
            Map<String,Object> map = new LinkedHashMap<>();
            map.put("sessionId", timeline.getSessionId());
            map.put("itemId", timeline.getItemId());
            map.put("events", events);
            return map;
        });
    }

    @Tool(description = "Compare two indexing sessions: items only in one, items in both, per-stage deltas")
    public Map<String,Object> compare_sessions(String sessionA, String sessionB) {
        requireSession(sessionA);
        requireSession(sessionB);
        return toResponse(analyzer.compare(sessionA, sessionB), c -> c.toMap());
    }

    @Tool(description = "Items accessed by several sessions close together (heuristic race detection)")
    public Map<String,Object> detect_races(Integer minConcurrent, Integer timeWindowSeconds, Integer limit) {
        Duration window = timeWindowSeconds != null ? Duration.ofSeconds(timeWindowSeconds) : defaultRaceWindow;
        return toResponse(analyzer.detectRaces(
                minConcurrent != null ? minConcurrent : 2,
                window,
                limit != null ? limit : 100), r -> r.toMap());
    }

    @Tool(description = "CSV export of failed, skipped or erroring items of a session")
    public Map<String,Object> export_csv(String sessionId) {
        requireSession(sessionId);
        return toResponse(analyzer.exportCsv(sessionId), csv -> Map.of("csv", csv));
    }

    @Tool(description = "Most recent indexing sessions with event and error counts")
    public Map<String,Object> recent_sessions(Integer limit) {
        List<SessionOverview> sessions = analyzer.recentSessions(limit != null ? limit : 10);
        return Map.of(
                "count", sessions.size(),
                "sessions", sessions.stream().map(SessionOverview::toMap).collect(Collectors.toList()));
    }

    private static void requireSession(String sessionId) {
        if (sessionId == null || sessionId.isBlank()) {
            throw new IllegalArgumentException("sessionId is required");
        }
    }

    private static <T> Map<String,Object> toResponse(AnalysisResult<T> result, Function<T, Map<String,Object>> mapper) {
        Map<String,Object> response = new LinkedHashMap<>();
        response.put("found", result.isFound());
        if (result.isFound()) {
            response.put("result", mapper.apply(result.orElseThrow()));
        } else {
            response.put("message", result.getMessage());
        }
        return response;
    }

    static Map<String,Object> toMap(IndexingEvent e) {
        Map<String,Object> map = new LinkedHashMap<>();
        map.put("timestamp", e.getTimestamp());
        map.put("sequence", e.getSequence());
        map.put("stage", e.getStage() != null ? e.getStage().wireName() : null);
        map.put("level", e.getLevel());
        map.put("itemType", e.getItemType());
        map.put("message", e.getMessage());
        map.put("payload", e.getPayload());
        return map;
    }
}
