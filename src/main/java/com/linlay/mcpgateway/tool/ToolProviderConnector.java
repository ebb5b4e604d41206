package com.linlay.mcpgateway.tool;

public interface ToolProviderConnector {

    /**
     * 为会话建立并初始化一条连接；失败时不得留下未释放的资源。
     *
     * @throws ToolProviderAttachmentException 工具服务不可达或握手失败
     */
    ToolProviderConnection attach(String sessionId);
}
