package com.linlay.mcpgateway.session;

import com.linlay.mcpgateway.config.ConversationProperties;
import com.linlay.mcpgateway.config.SessionProperties;
import com.linlay.mcpgateway.tool.ToolDescriptor;
import com.linlay.mcpgateway.tool.ToolProviderAttachmentException;
import com.linlay.mcpgateway.tool.ToolProviderConnection;
import com.linlay.mcpgateway.tool.ToolProviderConnector;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 会话注册表，进程内唯一持有会话状态的组件。
 * <p>
 * 读写都走 {@link ConcurrentHashMap}，不持有跨操作的锁；空闲清理只读取 id 快照后逐个 remove。
 */
@Component
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final ToolProviderConnector connector;
    private final ConversationProperties conversationProperties;
    private final Clock clock;
    private final Map<String, Session> sessions = new ConcurrentHashMap<>();
    private final Set<String> retiredIds;

    public SessionRegistry(
            ToolProviderConnector connector,
            ConversationProperties conversationProperties,
            SessionProperties sessionProperties,
            Clock clock
    ) {
        this.connector = connector;
        this.conversationProperties = conversationProperties;
        this.clock = clock;
        int retiredLimit = Math.max(0, sessionProperties.getRetiredIdLimit());
        this.retiredIds = Collections.synchronizedSet(Collections.newSetFromMap(
                new LinkedHashMap<>(16, 0.75f, false) {
                    @Override
                    protected boolean removeEldestEntry(Map.Entry<String, Boolean> eldest) {
                        return size() > retiredLimit;
                    }
                }
        ));
    }

    /**
     * 创建会话：建立工具服务连接并拉取工具目录，全部成功才登记。任一步失败都会释放已建立的连接。
     */
    public Session create(List<TranscriptEntry> seedHistory) {
        String sessionId = UUID.randomUUID().toString();
        ToolProviderConnection connection = connector.attach(sessionId);
        List<ToolDescriptor> tools;
        try {
            tools = connection.listTools();
        } catch (RuntimeException ex) {
            closeConnection(sessionId, connection);
            throw new ToolProviderAttachmentException("Failed to list tools from tool provider: " + ex.getMessage(), ex);
        }

        List<TranscriptEntry> seed = new ArrayList<>();
        if (seedHistory != null) {
            for (TranscriptEntry entry : seedHistory) {
                if (entry != null && entry.isConversational()) {
                    seed.add(entry);
                }
            }
        }
        Session session = new Session(
                sessionId,
                clock.instant(),
                connection,
                tools,
                initialConversation(seed),
                seed
        );
        sessions.put(sessionId, session);
        log.info("Created session {} provider={}, tools={}, seedMessages={}",
                sessionId, connection.providerName(), tools.size(), seed.size());
        return session;
    }

    public Session get(String sessionId) {
        return find(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public Optional<Session> find(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /**
     * 在 map 的桶锁内更新活跃时间，与 {@link #removeIfIdle} 互斥。
     */
    public Session touch(String sessionId) {
        return touchInternal(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    public boolean touchIfPresent(String sessionId) {
        return touchInternal(sessionId).isPresent();
    }

    private Optional<Session> touchInternal(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessions.computeIfPresent(sessionId, (id, session) -> {
            session.touch(clock.instant());
            return session;
        }));
    }

    /**
     * 幂等删除。返回 false 表示会话当前不存在（从未存在或已被删除）。
     */
    public boolean remove(String sessionId) {
        if (!StringUtils.hasText(sessionId)) {
            return false;
        }
        Session session = sessions.remove(sessionId);
        if (session == null) {
            return false;
        }
        retire(session);
        log.info("Removed session {}", sessionId);
        return true;
    }

    /**
     * 仅当会话在 {@code now} 时刻仍空闲超过 {@code timeout} 时删除。判断与删除在同一次
     * computeIfPresent 内完成，期间到达的 touch 会让本次删除放弃。
     *
     * @param includeActiveStreams 为 false 时跳过有活动流的会话
     */
    public boolean removeIfIdle(String sessionId, Instant now, Duration timeout, boolean includeActiveStreams) {
        if (!StringUtils.hasText(sessionId)) {
            return false;
        }
        AtomicReference<Session> removed = new AtomicReference<>();
        sessions.computeIfPresent(sessionId, (id, session) -> {
            if (Duration.between(session.lastActivity(), now).compareTo(timeout) <= 0) {
                return session;
            }
            if (session.isStreamActive() && !includeActiveStreams) {
                return session;
            }
            removed.set(session);
            return null;
        });
        Session session = removed.get();
        if (session == null) {
            return false;
        }
        retire(session);
        return true;
    }

    public boolean wasRemoved(String sessionId) {
        return sessionId != null && retiredIds.contains(sessionId);
    }

    public List<String> snapshotIds() {
        return List.copyOf(sessions.keySet());
    }

    public int size() {
        return sessions.size();
    }

    public int activeStreamCount() {
        int count = 0;
        for (Session session : sessions.values()) {
            if (session.isStreamActive()) {
                count++;
            }
        }
        return count;
    }

    public Instant now() {
        return clock.instant();
    }

    @PreDestroy
    public void closeAll() {
        for (String sessionId : snapshotIds()) {
            remove(sessionId);
        }
    }

    private List<Message> initialConversation(List<TranscriptEntry> seed) {
        List<Message> messages = new ArrayList<>();
        String systemPrompt = conversationProperties.getSystemPrompt();
        if (StringUtils.hasText(systemPrompt)) {
            messages.add(new SystemMessage(systemPrompt));
        }
        for (TranscriptEntry entry : seed) {
            if (TranscriptEntry.ROLE_USER.equals(entry.role())) {
                messages.add(new UserMessage(entry.content()));
            } else {
                messages.add(new AssistantMessage(entry.content()));
            }
        }
        return messages;
    }

    private void retire(Session session) {
        session.markClosed();
        retiredIds.add(session.id());
        closeConnection(session.id(), session.connection());
    }

    private void closeConnection(String sessionId, ToolProviderConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException ex) {
            log.warn("Failed to close tool provider connection for session {}", sessionId, ex);
        }
    }
}
