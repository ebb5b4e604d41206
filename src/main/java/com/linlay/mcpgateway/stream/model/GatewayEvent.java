package com.linlay.mcpgateway.stream.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 推送给浏览器端的事件词表，与上游协议无关。工具相关事件一律以 call_id 关联。
 */
public sealed interface GatewayEvent permits
        GatewayEvent.Token,
        GatewayEvent.ToolCallStarted,
        GatewayEvent.ToolCall,
        GatewayEvent.ToolResponse,
        GatewayEvent.ToolCallFinished,
        GatewayEvent.Completion,
        GatewayEvent.Error {

    String type();

    Map<String, Object> payload();

    default Map<String, Object> toData(long seq, long timestamp) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", type());
        data.put("seq", seq);
        data.put("timestamp", timestamp);
        data.putAll(payload());
        return data;
    }

    record Token(String content) implements GatewayEvent {
        public Token {
            if (content == null) {
                throw new IllegalArgumentException("content must not be null");
            }
        }

        @Override
        public String type() {
            return "token";
        }

        @Override
        public Map<String, Object> payload() {
            return Map.of("content", content);
        }
    }

    record ToolCallStarted(String name, String callId) implements GatewayEvent {
        public ToolCallStarted {
            requireNonBlank(name, "name");
            requireNonBlank(callId, "callId");
        }

        @Override
        public String type() {
            return "tool_call_started";
        }

        @Override
        public Map<String, Object> payload() {
            return toolPayload(name, callId);
        }
    }

    /**
     * arguments 为解析后的 JSON 结构；解析失败时为原始文本。
     */
    record ToolCall(String name, String callId, Object arguments) implements GatewayEvent {
        public ToolCall {
            requireNonBlank(name, "name");
            requireNonBlank(callId, "callId");
        }

        @Override
        public String type() {
            return "tool_call";
        }

        @Override
        public Map<String, Object> payload() {
            Map<String, Object> payload = toolPayload(name, callId);
            payload.put("arguments", arguments == null ? Map.of() : arguments);
            return payload;
        }
    }

    record ToolResponse(String name, String callId, String output, boolean error) implements GatewayEvent {
        public ToolResponse {
            requireNonBlank(name, "name");
            requireNonBlank(callId, "callId");
            if (output == null) {
                output = "";
            }
        }

        @Override
        public String type() {
            return "tool_response";
        }

        @Override
        public Map<String, Object> payload() {
            Map<String, Object> payload = toolPayload(name, callId);
            payload.put("output", output);
            payload.put("is_error", error);
            return payload;
        }
    }

    record ToolCallFinished(String name, String callId) implements GatewayEvent {
        public ToolCallFinished {
            requireNonBlank(name, "name");
            requireNonBlank(callId, "callId");
        }

        @Override
        public String type() {
            return "tool_call_finished";
        }

        @Override
        public Map<String, Object> payload() {
            return toolPayload(name, callId);
        }
    }

    record Completion() implements GatewayEvent {
        @Override
        public String type() {
            return "completion";
        }

        @Override
        public Map<String, Object> payload() {
            return Map.of();
        }
    }

    record Error(String message) implements GatewayEvent {
        public Error {
            if (message == null || message.isBlank()) {
                message = "Unknown error";
            }
        }

        @Override
        public String type() {
            return "error";
        }

        @Override
        public Map<String, Object> payload() {
            return Map.of("message", message);
        }
    }

    private static Map<String, Object> toolPayload(String name, String callId) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("name", name);
        payload.put("call_id", callId);
        return payload;
    }

    private static void requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be null or blank");
        }
    }
}
