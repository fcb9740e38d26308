package com.example.indexingtelemetry.controller;

import com.example.indexingtelemetry.mcp.AnalysisTools;
import com.example.indexingtelemetry.mcp.CapabilitiesTools;
import com.example.indexingtelemetry.mcp.RetentionTools;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

@RestController
public class McpServerController {

    private static final Logger logger = LoggerFactory.getLogger(McpServerController.class);

    private static final Set<String> OPTIONAL_ARGS = Set.of("expectedIds", "minConcurrent", "timeWindowSeconds", "limit");

    private final AnalysisTools analysisTools;
    private final RetentionTools retentionTools;
    private final CapabilitiesTools capabilitiesTools;
    private final ObjectMapper objectMapper;
    private final Map<String, Sinks.Many<ServerSentEvent<String>>> sseConnections = new ConcurrentHashMap<>();

    public McpServerController(AnalysisTools analysisTools, RetentionTools retentionTools,
                               CapabilitiesTools capabilitiesTools, ObjectMapper objectMapper) {
        this.analysisTools = analysisTools;
        this.retentionTools = retentionTools;
        this.capabilitiesTools = capabilitiesTools;
        this.objectMapper = objectMapper;
    }

    @GetMapping(value = "/sse", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> sse(@RequestParam(required = false) String sessionId) {
        String connectionId = sessionId != null ? sessionId : "default";

        Sinks.Many<ServerSentEvent<String>> sink = Sinks.many().multicast().onBackpressureBuffer();
        sseConnections.put(connectionId, sink);

        sink.tryEmitNext(ServerSentEvent.<String>builder()
                .event("connected")
                .data("{\"status\":\"connected\",\"server\":\"indexing-telemetry\",\"version\":\"0.1.0\"}")
                .build());

        return sink.asFlux()
                .doOnCancel(() -> sseConnections.remove(connectionId))
                .doOnTerminate(() -> sseConnections.remove(connectionId))
                .onErrorResume(throwable -> {
                    sseConnections.remove(connectionId);
                    return Flux.empty();
                });
    }

    @PostMapping(value = "/mcp/message", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Mono<Map<String, Object>> handleMcpMessage(@RequestBody Map<String, Object> request) {
        return Mono.fromCallable(() -> {
            try {
                String method = (String) request.get("method");
                if (method == null) {
                    return createErrorResponse("Missing method field", -32600);
                }

                switch (method) {
                    case "initialize":
                        return handleInitialize();
                    case "tools/list":
                        return handleToolsList();
                    case "tools/call":
                        return handleToolCall(request);
                    default:
                        return createErrorResponse("Method not found: " + method, -32601);
                }
            } catch (Exception e) {
                logger.error("MCP request failed", e);
                return createErrorResponse("Internal error: " + e.getMessage(), -32603);
            }
        });
    }

    private Map<String, Object> handleInitialize() {
        return Map.of(
                "protocolVersion", "2024-11-05",
                "capabilities", Map.of(
                        "tools", Map.of("listChanged", false),
                        "resources", Map.of(),
                        "prompts", Map.of(),
                        "completion", Map.of()
                ),
                "serverInfo", Map.of(
                        "name", "indexing-telemetry",
                        "version", "0.1.0"
                )
        );
    }

    Map<String, Object> handleToolsList() {
        List<Map<String, Object>> tools = new ArrayList<>();
        Map<String, Object> sessionArg = Map.of("type", "string", "description", "Indexing session id (idx_...)");

        tools.add(createToolInfo("session_summary", "Summarize an indexing session: item statuses, errors, stage counts, skip reasons",
                Map.of("sessionId", sessionArg)));
        tools.add(createToolInfo("find_missing", "Find expected items that were never retrieved or never reached submission/deletion",
                Map.of(
                        "sessionId", sessionArg,
                        "expectedIds", Map.of("type", "array", "items", Map.of("type", "integer"), "description", "Item ids the run should have covered")
                )));
        tools.add(createToolInfo("item_timeline", "Ordered events of one item within a session",
                Map.of(
                        "sessionId", sessionArg,
                        "itemId", Map.of("type", "integer", "description", "Item id")
                )));
        tools.add(createToolInfo("compare_sessions", "Compare two indexing sessions: items only in one, items in both, per-stage deltas",
                Map.of(
                        "sessionA", sessionArg,
                        "sessionB", sessionArg
                )));
        tools.add(createToolInfo("detect_races", "Items accessed by several sessions close together (heuristic race detection)",
                Map.of(
                        "minConcurrent", Map.of("type", "integer", "description", "Minimum distinct sessions per item (default 2)"),
                        "timeWindowSeconds", Map.of("type", "integer", "description", "Maximum spread of a correlation in seconds (optional)"),
                        "limit", Map.of("type", "integer", "description", "Maximum number of items (default 100)")
                )));
        tools.add(createToolInfo("export_csv", "CSV export of failed, skipped or erroring items of a session",
                Map.of("sessionId", sessionArg)));
        tools.add(createToolInfo("recent_sessions", "Most recent indexing sessions with event and error counts",
                Map.of("limit", Map.of("type", "integer", "description", "Maximum number of sessions (default 10)"))));
        tools.add(createToolInfo("purge_expired", "Delete telemetry older than the configured retention period", Map.of()));
        tools.add(createToolInfo("capabilities_list", "List server identity and supported MCP capabilities", Map.of()));

        return Map.of("tools", tools);
    }

    private Map<String, Object> createToolInfo(String name, String description, Map<String, Object> properties) {
        return Map.of(
                "name", name,
                "description", description,
                "inputSchema", Map.of(
                        "type", "object",
                        "properties", properties,
                        "required", properties.keySet().stream()
                                .filter(key -> !OPTIONAL_ARGS.contains(key))
                                .sorted()
                                .toList()
                )
        );
    }

    private Map<String, Object> handleToolCall(Map<String, Object> request) {
        try {
            @SuppressWarnings("unchecked")
            Map<String, Object> params = (Map<String, Object>) request.get("params");
            if (params == null) {
                return createErrorResponse("Missing params", -32602);
            }
            String toolName = (String) params.get("name");
            @SuppressWarnings("unchecked")
            Map<String, Object> arguments = (Map<String, Object>) params.get("arguments");

            if (toolName == null) {
                return createErrorResponse("Missing tool name", -32602);
            }

            Object result = callTool(toolName, arguments != null ? arguments : Map.of());

            return Map.of(
                    "content", Map.of(
                            "type", "text",
                            "text", objectMapper.writeValueAsString(result)
                    ),
                    "isError", false
            );
        } catch (Exception e) {
            logger.warn("Tool call failed: {}", e.getMessage());
            return createErrorResponse("Tool execution failed: " + e.getMessage(), -32603);
        }
    }

    Object callTool(String toolName, Map<String, Object> arguments) {
        switch (toolName) {
            case "session_summary":
                return analysisTools.session_summary((String) arguments.get("sessionId"));
            case "find_missing":
                return analysisTools.find_missing((String) arguments.get("sessionId"), asLongList(arguments.get("expectedIds")));
            case "item_timeline":
                return analysisTools.item_timeline((String) arguments.get("sessionId"), asLong(arguments.get("itemId")));
            case "compare_sessions":
                return analysisTools.compare_sessions((String) arguments.get("sessionA"), (String) arguments.get("sessionB"));
            case "detect_races":
                return analysisTools.detect_races(
                        asInteger(arguments.get("minConcurrent")),
                        asInteger(arguments.get("timeWindowSeconds")),
                        asInteger(arguments.get("limit"))
                );
            case "export_csv":
                return analysisTools.export_csv((String) arguments.get("sessionId"));
            case "recent_sessions":
                return analysisTools.recent_sessions(asInteger(arguments.get("limit")));
            case "purge_expired":
                return retentionTools.purge_expired();
            case "capabilities_list":
                return capabilitiesTools.capabilities_list();
            default:
                throw new IllegalArgumentException("Unknown tool: " + toolName);
        }
    }

    private static Long asLong(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return Long.parseLong(value.toString().trim());
    }

    private static Integer asInteger(Object value) {
        Long l = asLong(value);
        return l == null ? null : Math.toIntExact(l);
    }

    private static List<Long> asLongList(Object value) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof Collection)) {
            throw new IllegalArgumentException("expectedIds must be an array");
        }
        List<Long> ids = new ArrayList<>();
        for (Object o : (Collection<?>) value) {
            ids.add(asLong(o));
        }
        return ids;
    }

    private Map<String, Object> createErrorResponse(String message, int code) {
        return Map.of(
                "error", Map.of(
                        "code", code,
                        "message", message
                ),
                "isError", true
        );
    }

    @GetMapping("/mcp/capabilities")
    public Map<String, Object> getCapabilities() {
        Map<String, Object> toolsList = handleToolsList();
        @SuppressWarnings("unchecked")
        List<Map<String, Object>> tools = (List<Map<String, Object>>) toolsList.get("tools");

        return Map.of(
                "server", Map.of(
                        "name", "indexing-telemetry",
                        "version", "0.1.0"
                ),
                "capabilities", Map.of(
                        "tools", true,
                        "resources", false,
                        "prompts", false,
                        "completion", false
                ),
                "tools", tools.stream()
                        .map(tool -> Map.of(
                                "name", tool.get("name"),
                                "description", tool.get("description")
                        ))
                        .toList()
        );
    }
}
