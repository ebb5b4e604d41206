package com.linlay.mcpgateway.model.api;

import java.util.List;
import java.util.Map;

public record ToolListResponse(
        String sessionId,
        String providerName,
        int toolsCount,
        List<ToolSummary> tools
) {
    public record ToolSummary(
            String name,
            String description,
            Map<String, Object> inputSchema
    ) {
    }
}
