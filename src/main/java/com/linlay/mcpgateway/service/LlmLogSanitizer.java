package com.linlay.mcpgateway.service;

import java.util.regex.Pattern;

/**
 * 日志脱敏：遮蔽 JSON 中的密钥字段与 Bearer token。
 */
public final class LlmLogSanitizer {

    private static final Pattern JSON_SECRET_VALUE_PATTERN = Pattern.compile(
            "(?i)(\"(?:authorization|api[_-]?key|access[_-]?token|refresh[_-]?token|token|secret|password)\"\\s*:\\s*)\"([^\"]*)\""
    );
    private static final Pattern BEARER_TOKEN_PATTERN = Pattern.compile("(?i)(Bearer\\s+)[A-Za-z0-9._\\-+/=]+");
    private static final Pattern OPENAI_KEY_PATTERN = Pattern.compile("\\bsk-[A-Za-z0-9_\\-]{8,}");

    private LlmLogSanitizer() {
    }

    public static String maskText(String text, boolean maskSensitive) {
        if (text == null || text.isEmpty() || !maskSensitive) {
            return text == null ? "" : text;
        }
        String masked = JSON_SECRET_VALUE_PATTERN.matcher(text).replaceAll("$1\"***\"");
        masked = BEARER_TOKEN_PATTERN.matcher(masked).replaceAll("$1***");
        return OPENAI_KEY_PATTERN.matcher(masked).replaceAll("sk-***");
    }
}
