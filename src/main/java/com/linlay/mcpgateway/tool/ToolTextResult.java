package com.linlay.mcpgateway.tool;

public record ToolTextResult(
        String text,
        boolean error
) {

    public ToolTextResult {
        text = text == null ? "" : text;
    }

    public static ToolTextResult success(String text) {
        return new ToolTextResult(text, false);
    }

    public static ToolTextResult failure(String text) {
        return new ToolTextResult(text, true);
    }
}
