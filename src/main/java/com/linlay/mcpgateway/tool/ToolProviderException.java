package com.linlay.mcpgateway.tool;

public class ToolProviderException extends RuntimeException {

    public ToolProviderException(String message) {
        super(message);
    }

    public ToolProviderException(String message, Throwable cause) {
        super(message, cause);
    }
}
