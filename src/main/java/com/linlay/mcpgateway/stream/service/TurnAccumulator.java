package com.linlay.mcpgateway.stream.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.mcpgateway.stream.model.RawStreamEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * 一轮流式响应的累积状态：正文、按 slot 缓冲的工具参数，以及 slot/callId/name 之间的映射。
 * <p>
 * 映射在任一事件首次携带对应信息时立即登记，增量只按 slot（或已登记的 callId）归属。
 */
final class TurnAccumulator {

    private static final Logger log = LoggerFactory.getLogger(TurnAccumulator.class);

    private final ObjectMapper objectMapper;
    private final StringBuilder text = new StringBuilder();
    private final Map<Integer, ToolCallBuffer> buffers = new LinkedHashMap<>();
    private final Map<Integer, String> callIdBySlot = new HashMap<>();
    private final Map<String, Integer> slotByCallId = new HashMap<>();
    private final Map<Integer, String> nameBySlot = new HashMap<>();
    private final Map<String, String> nameByCallId = new HashMap<>();
    private final Map<Integer, ParsedArguments> resolved = new LinkedHashMap<>();
    private final Set<Integer> itemDoneOrder = new LinkedHashSet<>();

    TurnAccumulator(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    void apply(RawStreamEvent event) {
        if (event instanceof RawStreamEvent.TextDelta textDelta) {
            text.append(textDelta.text());
        } else if (event instanceof RawStreamEvent.ToolCallAdded added) {
            register(added.slot(), added.callId(), added.name());
            if (!resolved.containsKey(added.slot())) {
                buffers.computeIfAbsent(added.slot(), ToolCallBuffer::new);
            }
        } else if (event instanceof RawStreamEvent.ToolCallArgumentsDelta delta) {
            appendFragment(delta);
        } else if (event instanceof RawStreamEvent.ToolCallArgumentsDone done) {
            register(done.slot(), done.callId(), null);
            resolve(done.slot(), done.arguments());
        } else if (event instanceof RawStreamEvent.ToolCallItemDone itemDone) {
            register(itemDone.slot(), itemDone.callId(), itemDone.name());
            if (!resolved.containsKey(itemDone.slot())) {
                resolve(itemDone.slot(), itemDone.arguments());
            }
            itemDoneOrder.add(itemDone.slot());
        }
    }

    String text() {
        return text.toString();
    }

    boolean hasOpenBuffers() {
        return !buffers.isEmpty();
    }

    /**
     * 按 item done 的顺序给出本轮工具调用，未收到 item done 的调用按参数完成顺序排在后面。
     * 流提前结束时仍在缓冲中的 slot 在这里按已收到的参数收尾。
     */
    List<ResolvedToolCall> finish() {
        for (Integer slot : new ArrayList<>(buffers.keySet())) {
            log.debug("Closing tool call slot {} without arguments-done event", slot);
            resolve(slot, null);
        }
        Set<Integer> order = new LinkedHashSet<>();
        for (Integer slot : itemDoneOrder) {
            if (resolved.containsKey(slot)) {
                order.add(slot);
            }
        }
        order.addAll(resolved.keySet());

        List<ResolvedToolCall> calls = new ArrayList<>();
        for (Integer slot : order) {
            String callId = callIdBySlot.get(slot);
            String name = nameBySlot.get(slot);
            if (name == null && callId != null) {
                name = nameByCallId.get(callId);
            }
            if (!StringUtils.hasText(name)) {
                log.warn("Discarding tool call at slot {} without a tool name, callId={}", slot, callId);
                continue;
            }
            if (!StringUtils.hasText(callId)) {
                callId = "call_" + UUID.randomUUID().toString().replace("-", "").substring(0, 24);
                log.debug("Assigned call id {} to slot {}", callId, slot);
            }
            ParsedArguments parsed = resolved.get(slot);
            calls.add(new ResolvedToolCall(slot, callId, name, parsed.raw(), parsed.value()));
        }
        return calls;
    }

    private void register(int slot, String callId, String name) {
        if (StringUtils.hasText(callId)) {
            String existing = callIdBySlot.putIfAbsent(slot, callId);
            if (existing != null && !existing.equals(callId)) {
                log.warn("Slot {} already bound to call id {}, ignoring {}", slot, existing, callId);
            } else {
                slotByCallId.putIfAbsent(callId, slot);
            }
        }
        if (StringUtils.hasText(name)) {
            nameBySlot.putIfAbsent(slot, name);
            String boundId = callIdBySlot.get(slot);
            if (boundId != null) {
                nameByCallId.putIfAbsent(boundId, name);
            }
        }
    }

    private void appendFragment(RawStreamEvent.ToolCallArgumentsDelta delta) {
        Integer slot = delta.slot() >= 0 ? Integer.valueOf(delta.slot()) : slotByCallId.get(delta.callId());
        if (slot == null) {
            log.warn("Dropping argument fragment for unknown call id {}", delta.callId());
            return;
        }
        register(slot, delta.callId(), null);
        if (resolved.containsKey(slot)) {
            log.warn("Dropping late argument fragment for completed slot {}", slot);
            return;
        }
        buffers.computeIfAbsent(slot, ToolCallBuffer::new).append(delta.fragment());
    }

    private void resolve(int slot, String completeArguments) {
        ToolCallBuffer buffer = buffers.remove(slot);
        String raw;
        if (buffer != null && buffer.hasFragments()) {
            raw = buffer.text();
        } else {
            raw = completeArguments == null ? "" : completeArguments;
        }
        resolved.put(slot, new ParsedArguments(raw, parseArguments(raw)));
    }

    private Object parseArguments(String raw) {
        if (!StringUtils.hasText(raw)) {
            return new LinkedHashMap<String, Object>();
        }
        try {
            return objectMapper.readValue(raw, Object.class);
        } catch (Exception ex) {
            log.debug("Tool call arguments are not valid JSON, keeping raw text: {}", ex.getMessage());
            return raw;
        }
    }

    private record ParsedArguments(String raw, Object value) {
    }
}
