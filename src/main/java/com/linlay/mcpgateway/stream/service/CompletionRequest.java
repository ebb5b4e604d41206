package com.linlay.mcpgateway.stream.service;

import com.linlay.mcpgateway.tool.ToolDescriptor;
import org.springframework.ai.chat.messages.Message;

import java.util.List;

/**
 * 一次补全调用的输入。tools 为空表示纯续写，上游不会再发起工具调用。
 */
public record CompletionRequest(
        List<Message> messages,
        List<ToolDescriptor> tools,
        String traceId
) {

    public CompletionRequest {
        messages = messages == null ? List.of() : List.copyOf(messages);
        tools = tools == null ? List.of() : List.copyOf(tools);
    }

    public boolean hasTools() {
        return !tools.isEmpty();
    }
}
