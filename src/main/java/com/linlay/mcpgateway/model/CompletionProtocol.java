package com.linlay.mcpgateway.model;

/**
 * 上游补全接口的流式协议。
 */
public enum CompletionProtocol {
    /** {@code /v1/chat/completions}，choices[0].delta 增量。 */
    CHAT_COMPLETIONS,
    /** {@code /v1/responses}，response.* 结构化事件流。 */
    RESPONSES
}
