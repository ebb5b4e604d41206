package com.linlay.mcpgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@ConfigurationProperties(prefix = "gateway.session")
public class SessionProperties {

    private Duration timeout = Duration.ofMinutes(30);
    private long cleanupIntervalMs = 300_000L;
    /** 为 true 时空闲清理也会回收正在推流的会话。 */
    private boolean reapActiveStreams = false;
    private int retiredIdLimit = 10_000;

    public Duration getTimeout() {
        return timeout;
    }

    public void setTimeout(Duration timeout) {
        this.timeout = timeout;
    }

    public long getCleanupIntervalMs() {
        return cleanupIntervalMs;
    }

    public void setCleanupIntervalMs(long cleanupIntervalMs) {
        this.cleanupIntervalMs = cleanupIntervalMs;
    }

    public boolean isReapActiveStreams() {
        return reapActiveStreams;
    }

    public void setReapActiveStreams(boolean reapActiveStreams) {
        this.reapActiveStreams = reapActiveStreams;
    }

    public int getRetiredIdLimit() {
        return retiredIdLimit;
    }

    public void setRetiredIdLimit(int retiredIdLimit) {
        this.retiredIdLimit = retiredIdLimit;
    }
}
