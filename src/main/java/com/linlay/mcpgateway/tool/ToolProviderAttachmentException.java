package com.linlay.mcpgateway.tool;

/**
 * 建立会话时无法连上或初始化工具服务。
 */
public class ToolProviderAttachmentException extends ToolProviderException {

    public ToolProviderAttachmentException(String message) {
        super(message);
    }

    public ToolProviderAttachmentException(String message, Throwable cause) {
        super(message, cause);
    }
}
