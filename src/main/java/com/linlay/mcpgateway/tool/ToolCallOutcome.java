package com.linlay.mcpgateway.tool;

import java.util.List;

/**
 * 工具服务返回的原始结果。contents 已转为文本，非文本内容以 JSON 表示。
 */
public record ToolCallOutcome(
        boolean error,
        List<String> contents
) {

    public ToolCallOutcome {
        contents = contents == null ? List.of() : List.copyOf(contents);
    }
}
