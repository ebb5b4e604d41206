package com.linlay.mcpgateway.stream.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.mcpgateway.config.ConversationProperties;
import com.linlay.mcpgateway.session.Session;
import com.linlay.mcpgateway.stream.model.GatewayEvent;
import com.linlay.mcpgateway.stream.model.RawStreamEvent;
import com.linlay.mcpgateway.tool.ToolDescriptor;
import com.linlay.mcpgateway.tool.ToolInvocationBridge;
import com.linlay.mcpgateway.tool.ToolTextResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.FluxSink;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.stream.Stream;

/**
 * 把上游流式响应重组为 {@link GatewayEvent} 序列，并在一轮结束时串行执行工具调用、
 * 把结果写回会话历史后发起续写，直到某一轮不再包含工具调用。
 * <p>
 * 编排循环运行在独立线程上，阻塞读取上游流与工具调用。取消是协作式的：
 * 每读一个上游事件前、每次工具调用前、每次续写前检查订阅是否已取消、会话是否已关闭；
 * 已发出的工具调用不会被中断，其结果照常写入历史。
 */
@Component
public class StreamEventReassembler {

    private static final Logger log = LoggerFactory.getLogger(StreamEventReassembler.class);

    static final String NO_PENDING_MESSAGE = "No user message to process";
    static final String SKIPPED_TOOL_RESULT = "Error: tool call skipped because the stream was cancelled";
    static final String SESSION_CLOSED_MESSAGE = "Session was closed";

    private final CompletionSource completionSource;
    private final ToolInvocationBridge toolInvocationBridge;
    private final ConversationProperties conversationProperties;
    private final ObjectMapper objectMapper;
    private final Executor streamExecutor;

    public StreamEventReassembler(
            CompletionSource completionSource,
            ToolInvocationBridge toolInvocationBridge,
            ConversationProperties conversationProperties,
            ObjectMapper objectMapper,
            @Qualifier("streamExecutor") Executor streamExecutor
    ) {
        this.completionSource = completionSource;
        this.toolInvocationBridge = toolInvocationBridge;
        this.conversationProperties = conversationProperties;
        this.objectMapper = objectMapper;
        this.streamExecutor = streamExecutor;
    }

    public Flux<GatewayEvent> run(Session session) {
        return Flux.create(sink -> {
            try {
                streamExecutor.execute(() -> runLoop(session, sink));
            } catch (RejectedExecutionException ex) {
                log.error("Stream executor rejected session {}", session.id(), ex);
                sink.next(new GatewayEvent.Error("Server is busy, please retry"));
                sink.complete();
            }
        }, FluxSink.OverflowStrategy.BUFFER);
    }

    private void runLoop(Session session, FluxSink<GatewayEvent> sink) {
        long startNanos = System.nanoTime();
        int toolRounds = 0;
        try {
            if (!session.hasPendingUserMessage()) {
                emit(sink, new GatewayEvent.Error(NO_PENDING_MESSAGE));
                return;
            }
            List<ToolDescriptor> tools = session.toolCatalog();
            while (true) {
                if (stopRequested(session, sink)) {
                    log.info("Session {} stream stopped before completion request", session.id());
                    reportClosed(session, sink);
                    return;
                }
                TurnOutcome turn = streamTurn(session, sink, tools);
                if (turn == null) {
                    log.info("Session {} stream stopped while reading completion", session.id());
                    reportClosed(session, sink);
                    return;
                }
                if (turn.toolCalls().isEmpty()) {
                    session.appendMessage(new AssistantMessage(turn.text()));
                    emit(sink, new GatewayEvent.Completion());
                    log.info("Session {} turn completed in {} ms, toolRounds={}",
                            session.id(), elapsedMs(startNanos), toolRounds);
                    return;
                }
                if (toolRounds >= conversationProperties.getMaxToolRounds()) {
                    log.warn("Session {} exceeded max tool rounds {}", session.id(), toolRounds);
                    emit(sink, new GatewayEvent.Error(
                            "Exceeded maximum tool rounds (" + conversationProperties.getMaxToolRounds() + ")"));
                    return;
                }
                toolRounds++;
                if (!executeToolCalls(session, sink, turn)) {
                    log.info("Session {} stream stopped during tool execution", session.id());
                    reportClosed(session, sink);
                    return;
                }
                if (!conversationProperties.isContinueWithTools()) {
                    tools = List.of();
                }
            }
        } catch (CompletionSourceException ex) {
            log.warn("Session {} completion source failed: {}", session.id(), ex.getMessage());
            emit(sink, new GatewayEvent.Error(ex.getMessage()));
        } catch (RuntimeException ex) {
            log.error("Session {} stream failed", session.id(), ex);
            emit(sink, new GatewayEvent.Error(StringUtils.hasText(ex.getMessage())
                    ? ex.getMessage()
                    : "Stream failed: " + ex.getClass().getSimpleName()));
        } finally {
            sink.complete();
        }
    }

    /**
     * 读取一轮上游响应。返回 null 表示读取途中检测到取消。
     */
    private TurnOutcome streamTurn(Session session, FluxSink<GatewayEvent> sink, List<ToolDescriptor> tools) {
        CompletionRequest request = new CompletionRequest(requestMessages(session), tools, null);
        TurnAccumulator accumulator = new TurnAccumulator(objectMapper);
        try (Stream<RawStreamEvent> events = completionSource.stream(request).toStream()) {
            Iterator<RawStreamEvent> iterator = events.iterator();
            while (true) {
                if (stopRequested(session, sink)) {
                    return null;
                }
                if (!iterator.hasNext()) {
                    break;
                }
                RawStreamEvent event = iterator.next();
                accumulator.apply(event);
                if (event instanceof RawStreamEvent.TextDelta textDelta) {
                    emit(sink, new GatewayEvent.Token(textDelta.text()));
                } else if (event instanceof RawStreamEvent.TurnCompleted completed) {
                    log.debug("Session {} upstream turn completed, finishReason={}", session.id(), completed.finishReason());
                    break;
                }
            }
        } catch (CompletionSourceException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new CompletionSourceException(StringUtils.hasText(ex.getMessage())
                    ? ex.getMessage()
                    : "Completion stream failed: " + ex.getClass().getSimpleName(), ex);
        }
        return new TurnOutcome(accumulator.text(), accumulator.finish());
    }

    /**
     * assistant 消息（正文 + 全部工具调用描述）先于各工具消息写入历史，保证 tool_call_id 始终指向已存在的调用。
     * 返回 false 表示执行中途检测到取消。
     */
    private boolean executeToolCalls(Session session, FluxSink<GatewayEvent> sink, TurnOutcome turn) {
        List<AssistantMessage.ToolCall> descriptors = new ArrayList<>();
        for (ResolvedToolCall call : turn.toolCalls()) {
            descriptors.add(new AssistantMessage.ToolCall(
                    call.callId(),
                    "function",
                    call.name(),
                    StringUtils.hasText(call.rawArguments()) ? call.rawArguments() : "{}"
            ));
        }
        session.appendMessage(new AssistantMessage(turn.text(), Map.of(), descriptors));

        List<ResolvedToolCall> calls = turn.toolCalls();
        for (int i = 0; i < calls.size(); i++) {
            if (stopRequested(session, sink)) {
                appendSkipped(session, calls.subList(i, calls.size()));
                return false;
            }
            ResolvedToolCall call = calls.get(i);
            emit(sink, new GatewayEvent.ToolCallStarted(call.name(), call.callId()));
            emit(sink, new GatewayEvent.ToolCall(call.name(), call.callId(), call.arguments()));

            ToolTextResult result = toolInvocationBridge.invoke(call.name(), call.arguments(), session);
            session.appendMessage(toolResponseMessage(call, result.text()));

            emit(sink, new GatewayEvent.ToolResponse(call.name(), call.callId(), result.text(), result.error()));
            emit(sink, new GatewayEvent.ToolCallFinished(call.name(), call.callId()));
        }
        return true;
    }

    private void appendSkipped(Session session, List<ResolvedToolCall> skipped) {
        for (ResolvedToolCall call : skipped) {
            session.appendMessage(toolResponseMessage(call, SKIPPED_TOOL_RESULT));
        }
        log.info("Session {} skipped {} undispatched tool call(s)", session.id(), skipped.size());
    }

    private ToolResponseMessage toolResponseMessage(ResolvedToolCall call, String text) {
        return new ToolResponseMessage(List.of(
                new ToolResponseMessage.ToolResponse(call.callId(), call.name(), text)
        ));
    }

    /**
     * 按配置截取最近的消息。system 消息始终保留，窗口不会以 tool 消息开头。
     */
    List<Message> requestMessages(Session session) {
        List<Message> history = session.conversationSnapshot();
        int window = conversationProperties.getHistoryWindow();
        if (window <= 0) {
            return history;
        }
        List<Message> system = new ArrayList<>();
        List<Message> rest = new ArrayList<>();
        for (Message message : history) {
            if (message.getMessageType() == MessageType.SYSTEM) {
                system.add(message);
            } else {
                rest.add(message);
            }
        }
        if (rest.size() <= window) {
            return history;
        }
        int start = rest.size() - window;
        while (start < rest.size() && rest.get(start).getMessageType() == MessageType.TOOL) {
            start++;
        }
        List<Message> windowed = new ArrayList<>(system);
        windowed.addAll(rest.subList(start, rest.size()));
        return windowed;
    }

    private boolean stopRequested(Session session, FluxSink<GatewayEvent> sink) {
        return sink.isCancelled() || session.isClosed();
    }

    /**
     * 客户端仍在线而会话被删除或回收时，以 error 事件收尾。
     */
    private void reportClosed(Session session, FluxSink<GatewayEvent> sink) {
        if (session.isClosed() && !sink.isCancelled()) {
            emit(sink, new GatewayEvent.Error(SESSION_CLOSED_MESSAGE));
        }
    }

    private void emit(FluxSink<GatewayEvent> sink, GatewayEvent event) {
        if (!sink.isCancelled()) {
            sink.next(event);
        }
    }

    private long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    private record TurnOutcome(String text, List<ResolvedToolCall> toolCalls) {
    }
}
