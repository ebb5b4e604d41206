package com.linlay.mcpgateway.stream.model;

import java.util.List;
import java.util.Map;

public record LlmDelta(
        String content,
        List<ToolCallDelta> toolCalls,
        String finishReason,
        Map<String, Object> usage
) {

    public LlmDelta(String content, List<ToolCallDelta> toolCalls, String finishReason) {
        this(content, toolCalls, finishReason, null);
    }
}
