package com.linlay.mcpgateway.service;

import com.linlay.mcpgateway.config.CompletionLogProperties;
import com.linlay.mcpgateway.stream.model.RawStreamEvent;
import org.slf4j.Logger;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * 补全调用日志：traceId、历史消息摘要、增量事件累积与耗时。
 */
@Component
public class CompletionCallLogger {

    private final boolean enabled;
    private final boolean maskSensitive;

    public CompletionCallLogger(CompletionLogProperties properties) {
        this.enabled = properties == null || properties.isEnabled();
        this.maskSensitive = properties == null || properties.isMaskSensitive();
    }

    public String generateTraceId() {
        return "llm-" + UUID.randomUUID().toString().replace("-", "");
    }

    long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }

    String sanitizeText(String text) {
        return LlmLogSanitizer.maskText(text, maskSensitive);
    }

    void info(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.info(pattern, arguments);
        }
    }

    void debug(Logger logger, String pattern, Object... arguments) {
        if (enabled) {
            logger.debug(pattern, arguments);
        }
    }

    void logHistoryMessages(Logger logger, String traceId, List<Message> messages) {
        if (!enabled || !logger.isDebugEnabled() || messages == null || messages.isEmpty()) {
            return;
        }
        StringBuilder builder = new StringBuilder();
        for (int i = 0; i < messages.size(); i++) {
            Message message = messages.get(i);
            builder.append('[').append(i).append("] role=")
                    .append(message.getMessageType() == null
                            ? "unknown"
                            : message.getMessageType().name().toLowerCase(Locale.ROOT))
                    .append(", text=")
                    .append(sanitizeText(message.getText()));
            if (message instanceof AssistantMessage assistantMessage
                    && assistantMessage.getToolCalls() != null
                    && !assistantMessage.getToolCalls().isEmpty()) {
                builder.append(", toolCalls=").append(assistantMessage.getToolCalls().size());
            }
            if (message instanceof ToolResponseMessage toolResponseMessage
                    && toolResponseMessage.getResponses() != null) {
                builder.append(", toolResponses=").append(toolResponseMessage.getResponses().size());
            }
            builder.append('\n');
        }
        logger.debug("[{}] completion request messages:\n{}", traceId, builder);
    }

    void appendEventLog(StringBuilder buffer, RawStreamEvent event) {
        if (!enabled || event == null) {
            return;
        }
        if (event instanceof RawStreamEvent.TextDelta textDelta) {
            buffer.append(sanitizeText(textDelta.text()));
        } else if (event instanceof RawStreamEvent.ToolCallItemDone itemDone) {
            buffer.append("\n[tool_call] slot=").append(itemDone.slot())
                    .append(", id=").append(itemDone.callId())
                    .append(", name=").append(itemDone.name());
        } else if (event instanceof RawStreamEvent.TurnCompleted completed && completed.finishReason() != null) {
            buffer.append("\n[finish_reason] ").append(completed.finishReason());
        }
    }
}
