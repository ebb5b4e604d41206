package com.linlay.mcpgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * MCP 工具服务连接参数。每个会话创建时按这些参数建立一条独立连接。
 */
@ConfigurationProperties(prefix = "gateway.tool-provider")
public class ToolProviderProperties {

    private String serverUrl = "http://localhost:9999";
    private String sseEndpoint = "/mcp/sse";
    private String clientName = "mcp-chat-gateway";
    private String clientVersion = "0.1.0";
    private Duration requestTimeout = Duration.ofMinutes(5);
    private Duration initializeTimeout = Duration.ofSeconds(30);
    private Duration callTimeout = Duration.ofMinutes(5);

    public String getServerUrl() {
        return serverUrl;
    }

    public void setServerUrl(String serverUrl) {
        this.serverUrl = serverUrl;
    }

    public String getSseEndpoint() {
        return sseEndpoint;
    }

    public void setSseEndpoint(String sseEndpoint) {
        this.sseEndpoint = sseEndpoint;
    }

    public String getClientName() {
        return clientName;
    }

    public void setClientName(String clientName) {
        this.clientName = clientName;
    }

    public String getClientVersion() {
        return clientVersion;
    }

    public void setClientVersion(String clientVersion) {
        this.clientVersion = clientVersion;
    }

    public Duration getRequestTimeout() {
        return requestTimeout;
    }

    public void setRequestTimeout(Duration requestTimeout) {
        this.requestTimeout = requestTimeout;
    }

    public Duration getInitializeTimeout() {
        return initializeTimeout;
    }

    public void setInitializeTimeout(Duration initializeTimeout) {
        this.initializeTimeout = initializeTimeout;
    }

    public Duration getCallTimeout() {
        return callTimeout;
    }

    public void setCallTimeout(Duration callTimeout) {
        this.callTimeout = callTimeout;
    }
}
