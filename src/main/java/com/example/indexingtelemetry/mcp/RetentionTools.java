package com.example.indexingtelemetry.mcp;

import com.example.indexingtelemetry.service.RetentionService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.Map;

@Service
public class RetentionTools {

    private final RetentionService retentionService;

    public RetentionTools(RetentionService retentionService) {
        this.retentionService = retentionService;
    }

    @Tool(description = "Delete telemetry older than the configured retention period")
    public Map<String,Object> purge_expired() {
        return retentionService.purgeExpired();
    }
}
