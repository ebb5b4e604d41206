package com.linlay.mcpgateway.model.api;

public record HealthResponse(
        String status,
        int activeSessions,
        int activeStreams
) {
}
