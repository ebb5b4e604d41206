package com.linlay.mcpgateway.stream.adapter.openai;

import com.linlay.mcpgateway.stream.model.LlmDelta;
import com.linlay.mcpgateway.stream.model.RawStreamEvent;
import com.linlay.mcpgateway.stream.model.ToolCallDelta;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * 把 chat completions 的 delta 流转换为 {@link RawStreamEvent}。
 * <p>
 * 工具调用以 {@code index} 作为 slot；chat completions 没有单独的“参数完成”事件，
 * 因此在 finish_reason 到达（或流结束）时按 slot 顺序补发 ArgumentsDone 与 ItemDone。
 */
public class ChatCompletionDeltaNormalizer {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionDeltaNormalizer.class);

    public Flux<RawStreamEvent> normalize(Flux<LlmDelta> deltas) {
        return Flux.defer(() -> {
            TurnState state = new TurnState();
            return deltas.concatMapIterable(state::consume)
                    .concatWith(Flux.defer(() -> Flux.fromIterable(state.finish(null))));
        });
    }

    private static final class SlotState {
        private String callId;
        private String name;
    }

    static final class TurnState {

        private final TreeMap<Integer, SlotState> openSlots = new TreeMap<>();
        private final Map<String, Integer> slotByCallId = new HashMap<>();
        private int nextImplicitSlot;
        private boolean completed;

        List<RawStreamEvent> consume(LlmDelta delta) {
            if (delta == null || completed) {
                return List.of();
            }
            List<RawStreamEvent> events = new ArrayList<>();
            if (delta.content() != null && !delta.content().isEmpty()) {
                events.add(new RawStreamEvent.TextDelta(delta.content()));
            }
            if (delta.toolCalls() != null) {
                for (ToolCallDelta toolCall : delta.toolCalls()) {
                    consumeToolCall(toolCall, events);
                }
            }
            if (StringUtils.hasText(delta.finishReason())) {
                events.addAll(finish(delta.finishReason()));
            }
            return events;
        }

        List<RawStreamEvent> finish(String finishReason) {
            if (completed) {
                return List.of();
            }
            completed = true;
            List<RawStreamEvent> events = new ArrayList<>();
            for (Map.Entry<Integer, SlotState> entry : openSlots.entrySet()) {
                int slot = entry.getKey();
                SlotState state = entry.getValue();
                events.add(new RawStreamEvent.ToolCallArgumentsDone(slot, state.callId, null));
                events.add(new RawStreamEvent.ToolCallItemDone(slot, state.callId, state.name, null));
            }
            openSlots.clear();
            slotByCallId.clear();
            events.add(new RawStreamEvent.TurnCompleted(finishReason));
            return events;
        }

        private void consumeToolCall(ToolCallDelta toolCall, List<RawStreamEvent> events) {
            if (toolCall == null) {
                return;
            }
            Integer slot = resolveSlot(toolCall);
            if (slot == null) {
                log.warn("Dropping tool call delta without resolvable slot id={}, name={}",
                        toolCall.id(), toolCall.name());
                return;
            }

            SlotState state = openSlots.get(slot);
            boolean changed = false;
            if (state == null) {
                state = new SlotState();
                openSlots.put(slot, state);
                nextImplicitSlot = Math.max(nextImplicitSlot, slot + 1);
                changed = true;
            }
            if (StringUtils.hasText(toolCall.id()) && state.callId == null) {
                state.callId = toolCall.id();
                slotByCallId.put(toolCall.id(), slot);
                changed = true;
            }
            if (StringUtils.hasText(toolCall.name()) && state.name == null) {
                state.name = toolCall.name();
                changed = true;
            }
            if (changed) {
                events.add(new RawStreamEvent.ToolCallAdded(slot, state.callId, state.name));
            }
            if (toolCall.arguments() != null && !toolCall.arguments().isEmpty()) {
                events.add(new RawStreamEvent.ToolCallArgumentsDelta(slot, state.callId, toolCall.arguments()));
            }
        }

        private Integer resolveSlot(ToolCallDelta toolCall) {
            if (toolCall.index() != null && toolCall.index() >= 0) {
                return toolCall.index();
            }
            if (StringUtils.hasText(toolCall.id())) {
                Integer known = slotByCallId.get(toolCall.id());
                return known != null ? known : nextImplicitSlot;
            }
            // 既无 index 也无 id 的续片只在唯一打开的 slot 上才能确定归属
            if (openSlots.size() == 1) {
                return openSlots.firstKey();
            }
            return null;
        }
    }
}
