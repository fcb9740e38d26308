package com.example.indexingtelemetry.controller;

import com.example.indexingtelemetry.mcp.AnalysisTools;
import com.example.indexingtelemetry.mcp.CapabilitiesTools;
import com.example.indexingtelemetry.mcp.RetentionTools;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class McpServerControllerTest {

    @Mock
    private AnalysisTools analysisTools;

    @Mock
    private RetentionTools retentionTools;

    private McpServerController controller;

    @BeforeEach
    void setUp() {
        controller = new McpServerController(analysisTools, retentionTools, new CapabilitiesTools(), new ObjectMapper());
    }

    @Test
    void testToolsList_ListsEveryTool() {
        Map<String, Object> response = controller.handleMcpMessage(Map.of("method", "tools/list")).block();

        @SuppressWarnings("unchecked")
        List<Map<String, Object>> tools = (List<Map<String, Object>>) response.get("tools");
        assertEquals(List.of("session_summary", "find_missing", "item_timeline", "compare_sessions", "detect_races",
                        "export_csv", "recent_sessions", "purge_expired", "capabilities_list"),
                tools.stream().map(t -> t.get("name")).toList());
    }

    @Test
    void testToolCall_CoercesNumericArguments() {
        // Given
        when(analysisTools.find_missing("idx_a", List.of(1L, 2L))).thenReturn(Map.of("found", true));
        Map<String, Object> request = Map.of(
                "method", "tools/call",
                "params", Map.of(
                        "name", "find_missing",
                        "arguments", Map.of("sessionId", "idx_a", "expectedIds", List.of(1, 2))));

        // When
        Map<String, Object> response = controller.handleMcpMessage(request).block();

        // Then
        assertEquals(false, response.get("isError"));
        verify(analysisTools).find_missing("idx_a", List.of(1L, 2L));
    }

    @Test
    void testToolCall_UnknownToolIsError() {
        Map<String, Object> request = Map.of(
                "method", "tools/call",
                "params", Map.of("name", "drop_everything"));

        Map<String, Object> response = controller.handleMcpMessage(request).block();

        assertEquals(true, response.get("isError"));
        @SuppressWarnings("unchecked")
        Map<String, Object> error = (Map<String, Object>) response.get("error");
        assertEquals(-32603, error.get("code"));
    }

    @Test
    void testUnknownMethod() {
        Map<String, Object> response = controller.handleMcpMessage(Map.of("method", "resources/list")).block();

        @SuppressWarnings("unchecked")
        Map<String, Object> error = (Map<String, Object>) response.get("error");
        assertEquals(-32601, error.get("code"));
    }

    @Test
    void testCapabilities_NameTheServer() {
        Map<String, Object> capabilities = controller.getCapabilities();

        @SuppressWarnings("unchecked")
        Map<String, Object> server = (Map<String, Object>) capabilities.get("server");
        assertEquals("indexing-telemetry", server.get("name"));
    }
}
