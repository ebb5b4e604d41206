package com.linlay.mcpgateway.model.api;

import java.time.Instant;

public record SessionStatusResponse(
        String sessionId,
        String providerName,
        Instant createdAt,
        Instant lastActivity,
        int historyLength,
        int transcriptLength,
        boolean streamActive
) {
}
