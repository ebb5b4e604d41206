package com.linlay.mcpgateway.session;

import com.linlay.mcpgateway.config.SessionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;

/**
 * 定时回收空闲会话。
 */
@Component
public class IdleSessionReaper {

    private static final Logger log = LoggerFactory.getLogger(IdleSessionReaper.class);

    private final SessionRegistry registry;
    private final SessionProperties properties;

    public IdleSessionReaper(SessionRegistry registry, SessionProperties properties) {
        this.registry = registry;
        this.properties = properties;
    }

    @Scheduled(
            initialDelayString = "${gateway.session.cleanup-interval-ms:300000}",
            fixedDelayString = "${gateway.session.cleanup-interval-ms:300000}"
    )
    public void scheduledSweep() {
        try {
            sweep();
        } catch (RuntimeException ex) {
            log.error("Idle session sweep failed", ex);
        }
    }

    /**
     * 执行一轮清理，返回被回收的会话数。
     */
    public int sweep() {
        Duration timeout = properties.getTimeout();
        Instant now = registry.now();
        int removed = 0;
        for (String sessionId : registry.snapshotIds()) {
            Session session = registry.find(sessionId).orElse(null);
            if (session == null) {
                continue;
            }
            Duration idle = Duration.between(session.lastActivity(), now);
            if (idle.compareTo(timeout) <= 0) {
                continue;
            }
            if (session.isStreamActive() && !properties.isReapActiveStreams()) {
                log.debug("Skip idle session {} with active stream, idle={}s", sessionId, idle.toSeconds());
                continue;
            }
            if (registry.removeIfIdle(sessionId, now, timeout, properties.isReapActiveStreams())) {
                removed++;
                log.info("Reaped idle session {}, idle={}s", sessionId, idle.toSeconds());
            }
        }
        if (removed > 0) {
            log.info("Idle sweep removed {} session(s), remaining={}", removed, registry.size());
        }
        return removed;
    }
}
