package com.linlay.mcpgateway.tool.mcp;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.mcpgateway.config.ToolProviderProperties;
import com.linlay.mcpgateway.tool.ToolProviderAttachmentException;
import com.linlay.mcpgateway.tool.ToolProviderConnection;
import com.linlay.mcpgateway.tool.ToolProviderConnector;
import io.modelcontextprotocol.client.McpClient;
import io.modelcontextprotocol.client.McpSyncClient;
import io.modelcontextprotocol.client.transport.HttpClientSseClientTransport;
import io.modelcontextprotocol.spec.McpSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * 每个会话建立一条独立的 MCP over HTTP+SSE 连接。
 */
@Component
public class McpToolProviderConnector implements ToolProviderConnector {

    private static final Logger log = LoggerFactory.getLogger(McpToolProviderConnector.class);

    private final ToolProviderProperties properties;
    private final ObjectMapper objectMapper;

    public McpToolProviderConnector(ToolProviderProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public ToolProviderConnection attach(String sessionId) {
        String serverUrl = properties.getServerUrl();
        McpSyncClient client = null;
        try {
            HttpClientSseClientTransport transport = HttpClientSseClientTransport.builder(serverUrl)
                    .sseEndpoint(properties.getSseEndpoint())
                    .objectMapper(objectMapper)
                    .build();
            client = McpClient.sync(transport)
                    .clientInfo(new McpSchema.Implementation(properties.getClientName(), properties.getClientVersion()))
                    .requestTimeout(properties.getRequestTimeout())
                    .initializationTimeout(properties.getInitializeTimeout())
                    .build();
            McpSchema.InitializeResult initialized = client.initialize();
            String providerName = initialized != null && initialized.serverInfo() != null
                    ? initialized.serverInfo().name()
                    : serverUrl;
            log.info("Attached MCP tool provider [{}] at {} for session {}", providerName, serverUrl, sessionId);
            return new McpToolProviderConnection(providerName, client, objectMapper);
        } catch (RuntimeException ex) {
            if (client != null) {
                closeQuietly(client, sessionId);
            }
            throw new ToolProviderAttachmentException(
                    "Failed to connect to MCP server at " + serverUrl + ": " + ex.getMessage(), ex);
        }
    }

    private void closeQuietly(McpSyncClient client, String sessionId) {
        try {
            client.close();
        } catch (RuntimeException closeEx) {
            log.warn("Failed to release partial MCP client for session {}", sessionId, closeEx);
        }
    }
}
