package com.linlay.mcpgateway.tool;

import java.util.Map;

public record ToolDescriptor(
        String name,
        String description,
        Map<String, Object> inputSchema
) {

    public ToolDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be null or blank");
        }
        description = description == null ? "" : description;
        inputSchema = inputSchema == null ? Map.of("type", "object", "properties", Map.of()) : inputSchema;
    }
}
