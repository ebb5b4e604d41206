package com.linlay.mcpgateway.tool.mcp;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.mcpgateway.tool.ToolCallOutcome;
import com.linlay.mcpgateway.tool.ToolDescriptor;
import com.linlay.mcpgateway.tool.ToolProviderConnection;
import com.linlay.mcpgateway.tool.ToolProviderException;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 基于 MCP 同步客户端的连接。client 需已完成 initialize。
 */
public class McpToolProviderConnection implements ToolProviderConnection {

    private static final Logger log = LoggerFactory.getLogger(McpToolProviderConnection.class);
    private static final TypeReference<Map<String, Object>> SCHEMA_TYPE = new TypeReference<>() {
    };

    private final String providerName;
    private final McpSyncClient client;
    private final ObjectMapper objectMapper;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public McpToolProviderConnection(String providerName, McpSyncClient client, ObjectMapper objectMapper) {
        this.providerName = providerName;
        this.client = Objects.requireNonNull(client, "client cannot be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
    }

    @Override
    public String providerName() {
        return providerName;
    }

    @Override
    public List<ToolDescriptor> listTools() {
        ensureOpen();
        List<ToolDescriptor> tools = new ArrayList<>();
        Set<String> seenCursors = new HashSet<>();
        String cursor = null;
        do {
            McpSchema.ListToolsResult page = cursor == null ? client.listTools() : client.listTools(cursor);
            if (page == null) {
                break;
            }
            if (page.tools() != null) {
                for (McpSchema.Tool tool : page.tools()) {
                    tools.add(toDescriptor(tool));
                }
            }
            cursor = StringUtils.hasText(page.nextCursor()) && seenCursors.add(page.nextCursor())
                    ? page.nextCursor()
                    : null;
        } while (cursor != null);
        return tools;
    }

    @Override
    public ToolCallOutcome callTool(String toolName, Map<String, Object> arguments) {
        ensureOpen();
        McpSchema.CallToolResult result = client.callTool(
                new McpSchema.CallToolRequest(toolName, arguments == null ? Map.of() : arguments)
        );
        if (result == null) {
            return new ToolCallOutcome(true, List.of("Tool provider returned no result"));
        }
        List<String> contents = new ArrayList<>();
        if (result.content() != null) {
            for (McpSchema.Content content : result.content()) {
                contents.add(contentText(content));
            }
        }
        return new ToolCallOutcome(Boolean.TRUE.equals(result.isError()), contents);
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        try {
            if (!client.closeGracefully()) {
                log.debug("MCP client [{}] did not close gracefully, forcing close", providerName);
                client.close();
            }
        } catch (RuntimeException ex) {
            log.warn("Failed to close MCP client [{}]", providerName, ex);
            client.close();
        }
    }

    private void ensureOpen() {
        if (closed.get()) {
            throw new ToolProviderException("Tool provider connection is closed: " + providerName);
        }
    }

    private ToolDescriptor toDescriptor(McpSchema.Tool tool) {
        Map<String, Object> schema = tool.inputSchema() == null
                ? null
                : objectMapper.convertValue(tool.inputSchema(), SCHEMA_TYPE);
        if (schema != null) {
            schema.values().removeIf(Objects::isNull);
        }
        return new ToolDescriptor(tool.name(), tool.description(), schema);
    }

    private String contentText(McpSchema.Content content) {
        if (content instanceof McpSchema.TextContent textContent) {
            return textContent.text() == null ? "" : textContent.text();
        }
        try {
            return objectMapper.writeValueAsString(content);
        } catch (Exception ex) {
            return String.valueOf(content);
        }
    }
}
