package com.linlay.mcpgateway.stream.service;

/**
 * 参数已完成的工具调用。arguments 为解析后的 JSON 结构，解析失败时为原始文本。
 */
record ResolvedToolCall(
        int slot,
        String callId,
        String name,
        String rawArguments,
        Object arguments
) {
}
