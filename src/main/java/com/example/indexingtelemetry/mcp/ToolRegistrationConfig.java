package com.example.indexingtelemetry.mcp;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.ai.tool.ToolCallbackProvider;
import org.springframework.ai.tool.method.MethodToolCallbackProvider;

@Configuration
public class ToolRegistrationConfig {

    private final AnalysisTools analysisTools;
    private final RetentionTools retentionTools;
    private final CapabilitiesTools capTools;

    public ToolRegistrationConfig(AnalysisTools analysisTools, RetentionTools retentionTools, CapabilitiesTools capTools) {
        this.analysisTools = analysisTools;
        this.retentionTools = retentionTools;
        this.capTools = capTools;
    }

    @Bean
    public ToolCallbackProvider toolCallbacks() {
        return MethodToolCallbackProvider.builder()
                .toolObjects(analysisTools, retentionTools, capTools)
                .build();
    }
}
