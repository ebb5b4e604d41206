package com.linlay.mcpgateway.stream.adapter.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.mcpgateway.stream.model.LlmDelta;
import com.linlay.mcpgateway.stream.model.ToolCallDelta;
import com.linlay.mcpgateway.stream.service.CompletionSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 解析 chat completions 的 SSE chunk。空 chunk、{@code [DONE]} 与无法解析的 chunk 返回 null。
 */
public class OpenAiSseDeltaParser {

    private static final Logger log = LoggerFactory.getLogger(OpenAiSseDeltaParser.class);

    private final ObjectMapper objectMapper;

    public OpenAiSseDeltaParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public LlmDelta parseOrNull(String rawChunk) {
        JsonNode root = readOrNull(rawChunk);
        if (root == null) {
            return null;
        }
        JsonNode errorNode = root.get("error");
        if (errorNode != null && !errorNode.isNull()) {
            String message = optionalText(errorNode.get("message"));
            throw new CompletionSourceException("Completion stream error: "
                    + (hasText(message) ? message : errorNode.toString()));
        }

        Map<String, Object> usage = parseUsage(root.get("usage"));
        JsonNode choices = root.path("choices");
        if (!choices.isArray() || choices.isEmpty()) {
            return usage == null ? null : new LlmDelta(null, null, null, usage);
        }

        JsonNode firstChoice = choices.get(0);
        JsonNode deltaNode = firstChoice.path("delta");
        String content = optionalText(deltaNode.get("content"));
        String finishReason = optionalText(firstChoice.get("finish_reason"));

        List<ToolCallDelta> toolCalls = new ArrayList<>();
        JsonNode toolCallsNode = deltaNode.path("tool_calls");
        if (toolCallsNode.isArray()) {
            for (JsonNode toolCallNode : toolCallsNode) {
                String id = optionalText(toolCallNode.get("id"));
                Integer index = optionalInt(toolCallNode.get("index"));
                JsonNode functionNode = toolCallNode.path("function");
                String name = optionalText(functionNode.get("name"));
                String arguments = optionalText(functionNode.get("arguments"));
                if (!hasText(id) && index == null && !hasText(name) && (arguments == null || arguments.isEmpty())) {
                    continue;
                }
                toolCalls.add(new ToolCallDelta(id, index, name, arguments));
            }
        }

        boolean empty = (content == null || content.isEmpty())
                && toolCalls.isEmpty()
                && !hasText(finishReason)
                && usage == null;
        if (empty) {
            return null;
        }
        return new LlmDelta(content, toolCalls.isEmpty() ? null : toolCalls, finishReason, usage);
    }

    private JsonNode readOrNull(String rawChunk) {
        String payload = normalizePayload(rawChunk);
        if (payload == null) {
            return null;
        }
        try {
            return objectMapper.readTree(payload);
        } catch (Exception ex) {
            log.warn("Failed to parse completion SSE chunk: {}", rawChunk, ex);
            return null;
        }
    }

    private Map<String, Object> parseUsage(JsonNode usageNode) {
        if (usageNode == null || !usageNode.isObject()) {
            return null;
        }
        Map<String, Object> usage = new LinkedHashMap<>();
        usageNode.fields().forEachRemaining(entry -> {
            JsonNode valueNode = entry.getValue();
            if (valueNode.isIntegralNumber()) {
                usage.put(entry.getKey(), valueNode.asLong());
            } else if (valueNode.isNumber()) {
                usage.put(entry.getKey(), valueNode.doubleValue());
            } else if (!valueNode.isNull()) {
                usage.put(entry.getKey(), objectMapper.convertValue(valueNode, Object.class));
            }
        });
        return usage.isEmpty() ? null : usage;
    }

    static String normalizePayload(String rawChunk) {
        if (!hasText(rawChunk)) {
            return null;
        }
        String payload = rawChunk.trim();
        if (payload.startsWith("data:")) {
            payload = payload.substring(5).trim();
        }
        if (!hasText(payload) || "[DONE]".equals(payload)) {
            return null;
        }
        return payload;
    }

    static String optionalText(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return node.toString();
    }

    static Integer optionalInt(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isInt() || node.isLong()) {
            return node.asInt();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException ignored) {
                return null;
            }
        }
        return null;
    }

    static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }
}
