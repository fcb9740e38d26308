package com.example.indexingtelemetry.mcp;

import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class CapabilitiesTools {

    static final String SERVER_NAME = "indexing-telemetry";
    static final String SERVER_VERSION = "0.1.0";

    @Tool(description = "List server identity and supported MCP capabilities")
    public Map<String,Object> capabilities_list() {
        return Map.of(
                "server", Map.of("name", SERVER_NAME, "version", SERVER_VERSION),
                "capabilities", Map.of(
                    "tools", true,
                    "resources", false,
                    "prompts", false,
                    "completion", false
                )
        );
    }
}
