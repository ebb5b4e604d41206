package com.linlay.mcpgateway.stream.model;

/**
 * 上游流式事件的统一中间表示。chat completions 与 responses 两种协议都在接入层归一成这组事件，
 * 重组逻辑只面向它。
 * <p>
 * slot 是工具调用在本轮内的位置序号，callId 在上游给出后才可用，两者都可能先于对方到达。
 */
public sealed interface RawStreamEvent permits
        RawStreamEvent.TextDelta,
        RawStreamEvent.ToolCallAdded,
        RawStreamEvent.ToolCallArgumentsDelta,
        RawStreamEvent.ToolCallArgumentsDone,
        RawStreamEvent.ToolCallItemDone,
        RawStreamEvent.TurnCompleted {

    record TextDelta(String text) implements RawStreamEvent {
        public TextDelta {
            requireNonNull(text, "text");
        }
    }

    record ToolCallAdded(int slot, String callId, String name) implements RawStreamEvent {
        public ToolCallAdded {
            requireSlot(slot);
        }
    }

    /**
     * slot 为负表示上游没有给出位置，此时只能按 callId 归属。
     */
    record ToolCallArgumentsDelta(int slot, String callId, String fragment) implements RawStreamEvent {
        public ToolCallArgumentsDelta {
            requireNonNull(fragment, "fragment");
            if (slot < 0 && (callId == null || callId.isBlank())) {
                throw new IllegalArgumentException("slot or callId is required");
            }
        }
    }

    record ToolCallArgumentsDone(int slot, String callId, String arguments) implements RawStreamEvent {
        public ToolCallArgumentsDone {
            requireSlot(slot);
        }
    }

    record ToolCallItemDone(int slot, String callId, String name, String arguments) implements RawStreamEvent {
        public ToolCallItemDone {
            requireSlot(slot);
        }
    }

    record TurnCompleted(String finishReason) implements RawStreamEvent {
    }

    private static void requireSlot(int slot) {
        if (slot < 0) {
            throw new IllegalArgumentException("slot must not be negative");
        }
    }

    private static void requireNonNull(Object value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
    }
}
