package com.linlay.mcpgateway.stream.adapter.openai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.mcpgateway.stream.model.RawStreamEvent;
import com.linlay.mcpgateway.stream.service.CompletionSourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

import static com.linlay.mcpgateway.stream.adapter.openai.OpenAiSseDeltaParser.hasText;
import static com.linlay.mcpgateway.stream.adapter.openai.OpenAiSseDeltaParser.normalizePayload;
import static com.linlay.mcpgateway.stream.adapter.openai.OpenAiSseDeltaParser.optionalInt;
import static com.linlay.mcpgateway.stream.adapter.openai.OpenAiSseDeltaParser.optionalText;

/**
 * 解析 responses 接口的结构化事件流。slot 取 {@code output_index}；参数增量只携带 item_id，
 * 不携带 call_id，归属完全依赖 slot。
 */
public class ResponsesSseEventParser {

    private static final Logger log = LoggerFactory.getLogger(ResponsesSseEventParser.class);

    private static final String FUNCTION_CALL = "function_call";

    private final ObjectMapper objectMapper;

    public ResponsesSseEventParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    public List<RawStreamEvent> parse(String rawChunk) {
        String payload = normalizePayload(rawChunk);
        if (payload == null) {
            return List.of();
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(payload);
        } catch (Exception ex) {
            log.warn("Failed to parse responses SSE chunk: {}", rawChunk, ex);
            return List.of();
        }

        String type = optionalText(root.get("type"));
        if (type == null) {
            return List.of();
        }
        Integer slot = optionalInt(root.get("output_index"));
        return switch (type) {
            case "response.output_text.delta" -> {
                String delta = optionalText(root.get("delta"));
                yield delta == null || delta.isEmpty() ? List.of() : List.of(new RawStreamEvent.TextDelta(delta));
            }
            case "response.output_item.added" -> {
                JsonNode item = root.path("item");
                if (!isFunctionCall(item) || !hasSlot(slot, type)) {
                    yield List.of();
                }
                yield List.of(new RawStreamEvent.ToolCallAdded(
                        slot,
                        optionalText(item.get("call_id")),
                        optionalText(item.get("name"))
                ));
            }
            case "response.function_call_arguments.delta" -> {
                String delta = optionalText(root.get("delta"));
                if (delta == null || delta.isEmpty() || !hasSlot(slot, type)) {
                    yield List.of();
                }
                yield List.of(new RawStreamEvent.ToolCallArgumentsDelta(slot, null, delta));
            }
            case "response.function_call_arguments.done" -> {
                if (!hasSlot(slot, type)) {
                    yield List.of();
                }
                yield List.of(new RawStreamEvent.ToolCallArgumentsDone(
                        slot,
                        null,
                        optionalText(root.get("arguments"))
                ));
            }
            case "response.output_item.done" -> {
                JsonNode item = root.path("item");
                if (!isFunctionCall(item) || !hasSlot(slot, type)) {
                    yield List.of();
                }
                yield List.of(new RawStreamEvent.ToolCallItemDone(
                        slot,
                        optionalText(item.get("call_id")),
                        optionalText(item.get("name")),
                        optionalText(item.get("arguments"))
                ));
            }
            case "response.completed" -> List.of(new RawStreamEvent.TurnCompleted(
                    optionalText(root.path("response").get("status"))
            ));
            case "response.incomplete" -> List.of(new RawStreamEvent.TurnCompleted(
                    optionalText(root.path("response").path("incomplete_details").get("reason"))
            ));
            case "response.failed" -> throw new CompletionSourceException("Completion stream failed: "
                    + errorMessage(root.path("response").path("error")));
            case "error" -> throw new CompletionSourceException("Completion stream error: " + errorMessage(root));
            default -> List.of();
        };
    }

    private boolean isFunctionCall(JsonNode item) {
        return FUNCTION_CALL.equals(optionalText(item.get("type")));
    }

    private boolean hasSlot(Integer slot, String type) {
        if (slot == null || slot < 0) {
            log.warn("Dropping {} event without output_index", type);
            return false;
        }
        return true;
    }

    private String errorMessage(JsonNode errorNode) {
        String message = optionalText(errorNode.get("message"));
        if (hasText(message)) {
            return message;
        }
        return errorNode.isMissingNode() ? "unknown error" : errorNode.toString();
    }
}
