package com.linlay.mcpgateway.tool;

import java.util.List;
import java.util.Map;

/**
 * 会话独占的一条工具服务连接。
 */
public interface ToolProviderConnection extends AutoCloseable {

    String providerName();

    List<ToolDescriptor> listTools();

    ToolCallOutcome callTool(String toolName, Map<String, Object> arguments);

    /**
     * 释放连接。重复调用无副作用。
     */
    @Override
    void close();
}
