package com.linlay.mcpgateway.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "gateway.conversation")
public class ConversationProperties {

    private String systemPrompt = "";
    /** 发送给模型的最近消息条数，0 表示不截断。system prompt 始终保留。 */
    private int historyWindow = 0;
    private int maxToolRounds = 20;
    /** 续写请求是否继续携带工具列表。默认不携带，续写只用于总结工具结果。 */
    private boolean continueWithTools = false;

    public String getSystemPrompt() {
        return systemPrompt;
    }

    public void setSystemPrompt(String systemPrompt) {
        this.systemPrompt = systemPrompt;
    }

    public int getHistoryWindow() {
        return historyWindow;
    }

    public void setHistoryWindow(int historyWindow) {
        this.historyWindow = historyWindow;
    }

    public int getMaxToolRounds() {
        return maxToolRounds;
    }

    public void setMaxToolRounds(int maxToolRounds) {
        this.maxToolRounds = maxToolRounds;
    }

    public boolean isContinueWithTools() {
        return continueWithTools;
    }

    public void setContinueWithTools(boolean continueWithTools) {
        this.continueWithTools = continueWithTools;
    }
}
