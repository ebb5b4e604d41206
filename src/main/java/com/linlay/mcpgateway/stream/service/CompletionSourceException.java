package com.linlay.mcpgateway.stream.service;

/**
 * 补全接口调用失败：HTTP 错误、上游报错事件、流格式不可解析或超时。只终止当前轮次。
 */
public class CompletionSourceException extends RuntimeException {

    public CompletionSourceException(String message) {
        super(message);
    }

    public CompletionSourceException(String message, Throwable cause) {
        super(message, cause);
    }
}
