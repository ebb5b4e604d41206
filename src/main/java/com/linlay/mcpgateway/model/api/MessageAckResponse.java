package com.linlay.mcpgateway.model.api;

public record MessageAckResponse(
        String sessionId,
        int historyLength,
        String message
) {
}
