package com.linlay.mcpgateway.model.api;

public record DeleteSessionResponse(
        String sessionId,
        boolean removed,
        String message
) {
}
