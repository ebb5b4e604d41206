package com.linlay.mcpgateway.session;

import java.util.Locale;

/**
 * 对外可见的聊天记录条目，只包含 user/assistant 文本。
 */
public record TranscriptEntry(
        String role,
        String content
) {

    public static final String ROLE_USER = "user";
    public static final String ROLE_ASSISTANT = "assistant";

    public TranscriptEntry {
        role = role == null ? "" : role.trim().toLowerCase(Locale.ROOT);
        content = content == null ? "" : content;
    }

    public boolean isConversational() {
        return ROLE_USER.equals(role) || ROLE_ASSISTANT.equals(role);
    }
}
