package com.linlay.mcpgateway.session;

import com.linlay.mcpgateway.tool.ToolDescriptor;
import com.linlay.mcpgateway.tool.ToolProviderConnection;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 单个会话的状态。会话由 {@link SessionRegistry} 持有，消息历史只追加不改写。
 */
public class Session {

    private final String id;
    private final Instant createdAt;
    private final ToolProviderConnection connection;
    private final List<ToolDescriptor> toolCatalog;
    private final List<Message> conversation = new ArrayList<>();
    private final List<TranscriptEntry> transcript = new ArrayList<>();
    private final AtomicBoolean streamActive = new AtomicBoolean(false);
    private volatile Instant lastActivity;
    private volatile boolean closed;

    public Session(
            String id,
            Instant createdAt,
            ToolProviderConnection connection,
            List<ToolDescriptor> toolCatalog,
            List<Message> initialConversation,
            List<TranscriptEntry> initialTranscript
    ) {
        this.id = Objects.requireNonNull(id, "id cannot be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt cannot be null");
        this.connection = Objects.requireNonNull(connection, "connection cannot be null");
        this.toolCatalog = toolCatalog == null ? List.of() : List.copyOf(toolCatalog);
        this.lastActivity = createdAt;
        if (initialConversation != null) {
            conversation.addAll(initialConversation);
        }
        if (initialTranscript != null) {
            transcript.addAll(initialTranscript);
        }
    }

    public String id() {
        return id;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant lastActivity() {
        return lastActivity;
    }

    void touch(Instant now) {
        this.lastActivity = now;
    }

    public ToolProviderConnection connection() {
        return connection;
    }

    public List<ToolDescriptor> toolCatalog() {
        return toolCatalog;
    }

    public synchronized void appendMessage(Message message) {
        conversation.add(Objects.requireNonNull(message, "message cannot be null"));
    }

    public synchronized List<Message> conversationSnapshot() {
        return List.copyOf(conversation);
    }

    public synchronized int historyLength() {
        return conversation.size();
    }

    /**
     * 最后一条消息是用户消息时才有待处理的输入。
     */
    public synchronized boolean hasPendingUserMessage() {
        if (conversation.isEmpty()) {
            return false;
        }
        Message last = conversation.get(conversation.size() - 1);
        return last.getMessageType() == MessageType.USER;
    }

    public synchronized void appendTranscript(TranscriptEntry entry) {
        transcript.add(Objects.requireNonNull(entry, "entry cannot be null"));
    }

    public synchronized List<TranscriptEntry> transcriptSnapshot() {
        return List.copyOf(transcript);
    }

    public boolean tryAcquireStream() {
        return streamActive.compareAndSet(false, true);
    }

    public void releaseStream() {
        streamActive.set(false);
    }

    public boolean isStreamActive() {
        return streamActive.get();
    }

    void markClosed() {
        this.closed = true;
    }

    public boolean isClosed() {
        return closed;
    }
}
