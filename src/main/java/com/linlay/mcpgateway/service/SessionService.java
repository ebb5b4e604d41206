package com.linlay.mcpgateway.service;

import com.linlay.mcpgateway.model.api.CreateSessionRequest;
import com.linlay.mcpgateway.model.api.CreateSessionResponse;
import com.linlay.mcpgateway.model.api.DeleteSessionResponse;
import com.linlay.mcpgateway.model.api.HealthResponse;
import com.linlay.mcpgateway.model.api.MessageAckResponse;
import com.linlay.mcpgateway.model.api.SessionStatusResponse;
import com.linlay.mcpgateway.model.api.ToolListResponse;
import com.linlay.mcpgateway.session.Session;
import com.linlay.mcpgateway.session.SessionNotFoundException;
import com.linlay.mcpgateway.session.SessionRegistry;
import com.linlay.mcpgateway.session.TranscriptEntry;
import com.linlay.mcpgateway.tool.ToolDescriptor;
import com.linlay.mcpgateway.tool.ToolProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * 会话相关的非流式请求。每个针对已有会话的请求都会刷新其活跃时间。
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionRegistry registry;

    public SessionService(SessionRegistry registry) {
        this.registry = registry;
    }

    public CreateSessionResponse create(CreateSessionRequest request) {
        List<TranscriptEntry> seed = new ArrayList<>();
        if (request != null) {
            for (CreateSessionRequest.HistoryMessage message : request.chatHistory()) {
                if (message != null) {
                    seed.add(new TranscriptEntry(message.role(), message.content()));
                }
            }
        }
        Session session = registry.create(seed);
        return new CreateSessionResponse(
                session.id(),
                session.connection().providerName(),
                session.toolCatalog().size(),
                "Connected to tool provider"
        );
    }

    public MessageAckResponse postMessage(String sessionId, String message) {
        Session session = registry.touch(sessionId);
        if (!StringUtils.hasText(message)) {
            throw new IllegalArgumentException("Message cannot be empty");
        }
        String text = message.trim();
        session.appendMessage(new UserMessage(text));
        session.appendTranscript(new TranscriptEntry(TranscriptEntry.ROLE_USER, text));
        log.debug("Session {} received user message, historyLength={}", sessionId, session.historyLength());
        return new MessageAckResponse(sessionId, session.historyLength(), "Message received");
    }

    public DeleteSessionResponse delete(String sessionId) {
        if (registry.remove(sessionId)) {
            return new DeleteSessionResponse(sessionId, true, "Session deleted");
        }
        if (registry.wasRemoved(sessionId)) {
            return new DeleteSessionResponse(sessionId, false, "Session already deleted");
        }
        throw new SessionNotFoundException(sessionId);
    }

    public SessionStatusResponse status(String sessionId) {
        Session session = registry.touch(sessionId);
        return new SessionStatusResponse(
                session.id(),
                session.connection().providerName(),
                session.createdAt(),
                session.lastActivity(),
                session.historyLength(),
                session.transcriptSnapshot().size(),
                session.isStreamActive()
        );
    }

    public ToolListResponse listTools(String sessionId) {
        Session session = registry.touch(sessionId);
        List<ToolDescriptor> tools;
        try {
            tools = session.connection().listTools();
        } catch (ToolProviderException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new ToolProviderException("Failed to list tools: " + ex.getMessage(), ex);
        }
        List<ToolListResponse.ToolSummary> summaries = tools.stream()
                .map(tool -> new ToolListResponse.ToolSummary(tool.name(), tool.description(), tool.inputSchema()))
                .toList();
        return new ToolListResponse(sessionId, session.connection().providerName(), summaries.size(), summaries);
    }

    public HealthResponse health() {
        return new HealthResponse("healthy", registry.size(), registry.activeStreamCount());
    }
}
