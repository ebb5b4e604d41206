package com.linlay.mcpgateway.model.api;

public record PostMessageRequest(
        String message
) {
}
