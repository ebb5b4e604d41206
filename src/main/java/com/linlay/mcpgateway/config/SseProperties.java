package com.linlay.mcpgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "gateway.sse")
public record SseProperties(
        Duration streamTimeout,
        Duration heartbeatInterval
) {

    public SseProperties {
        if (streamTimeout == null) {
            streamTimeout = Duration.ofMinutes(30);
        }
        if (heartbeatInterval == null) {
            heartbeatInterval = Duration.ofSeconds(15);
        }
    }
}
