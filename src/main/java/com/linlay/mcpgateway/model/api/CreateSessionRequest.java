package com.linlay.mcpgateway.model.api;

import com.fasterxml.jackson.annotation.JsonAlias;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

import java.util.List;

public record CreateSessionRequest(
        @JsonAlias("chat_history")
        List<@Valid HistoryMessage> chatHistory
) {

    public CreateSessionRequest {
        chatHistory = chatHistory == null ? List.of() : chatHistory;
    }

    public record HistoryMessage(
            @NotNull
            String role,
            @NotNull
            String content
    ) {
    }
}
