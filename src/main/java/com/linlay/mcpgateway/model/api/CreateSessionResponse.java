package com.linlay.mcpgateway.model.api;

public record CreateSessionResponse(
        String sessionId,
        String providerName,
        int toolCount,
        String message
) {
}
