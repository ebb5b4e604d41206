package com.linlay.mcpgateway.stream.service;

/**
 * 单个 slot 的参数缓冲，只存活于一轮流式响应内。
 */
final class ToolCallBuffer {

    private final int slot;
    private final StringBuilder arguments = new StringBuilder();
    private int fragments;

    ToolCallBuffer(int slot) {
        this.slot = slot;
    }

    int slot() {
        return slot;
    }

    void append(String fragment) {
        arguments.append(fragment);
        fragments++;
    }

    boolean hasFragments() {
        return fragments > 0;
    }

    String text() {
        return arguments.toString();
    }
}
