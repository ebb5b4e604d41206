package com.linlay.mcpgateway.tool;

import com.linlay.mcpgateway.config.ToolProviderProperties;
import com.linlay.mcpgateway.session.Session;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 把一次工具调用转发到会话绑定的工具服务连接，并把所有失败折叠为带错误标记的文本结果。
 * 调用方拿到的永远是 {@link ToolTextResult}，不会抛异常。
 */
@Component
public class ToolInvocationBridge {

    private static final Logger log = LoggerFactory.getLogger(ToolInvocationBridge.class);

    private static final ExecutorService TOOL_CALL_EXECUTOR = Executors.newCachedThreadPool(runnable -> {
        Thread thread = new Thread(runnable, "gateway-tool-call");
        thread.setDaemon(true);
        return thread;
    });

    private final Duration callTimeout;

    public ToolInvocationBridge(ToolProviderProperties properties) {
        this.callTimeout = properties.getCallTimeout() == null
                ? Duration.ofMinutes(5)
                : properties.getCallTimeout();
    }

    /**
     * @param arguments 解析后的参数对象；解析失败时为原始文本，此时直接返回错误结果
     */
    public ToolTextResult invoke(String toolName, Object arguments, Session session) {
        if (!StringUtils.hasText(toolName)) {
            return ToolTextResult.failure("Error: tool name is missing");
        }
        if (session == null || session.isClosed()) {
            return ToolTextResult.failure("Error: session is closed, tool " + toolName + " was not called");
        }
        Map<String, Object> args = toArgumentMap(arguments);
        if (args == null) {
            return ToolTextResult.failure("Error: arguments for tool " + toolName + " must be a JSON object");
        }

        long startNanos = System.nanoTime();
        try {
            ToolCallOutcome outcome = callWithTimeout(session.connection(), toolName, args);
            String text = String.join("\n", outcome.contents());
            log.info("Tool {} finished for session {} in {} ms, error={}",
                    toolName, session.id(), elapsedMs(startNanos), outcome.error());
            if (outcome.error()) {
                return ToolTextResult.failure("Error: " + (StringUtils.hasText(text) ? text : "Tool call failed"));
            }
            return ToolTextResult.success(text);
        } catch (TimeoutException ex) {
            log.warn("Tool {} timed out for session {} after {} ms", toolName, session.id(), elapsedMs(startNanos));
            return ToolTextResult.failure("Error calling tool " + toolName + ": " + ex.getMessage());
        } catch (RuntimeException ex) {
            log.warn("Tool {} failed for session {}", toolName, session.id(), ex);
            return ToolTextResult.failure("Error calling tool " + toolName + ": " + describe(ex));
        }
    }

    private ToolCallOutcome callWithTimeout(
            ToolProviderConnection connection,
            String toolName,
            Map<String, Object> args
    ) throws TimeoutException {
        Future<ToolCallOutcome> future = TOOL_CALL_EXECUTOR.submit(() -> connection.callTool(toolName, args));
        try {
            return future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException ex) {
            future.cancel(true);
            throw new TimeoutException("timed out after " + callTimeout.toMillis() + " ms");
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            throw new ToolProviderException("tool invocation interrupted", ex);
        } catch (ExecutionException ex) {
            Throwable cause = ex.getCause();
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new ToolProviderException(describe(cause == null ? ex : cause), cause == null ? ex : cause);
        }
    }

    private Map<String, Object> toArgumentMap(Object arguments) {
        if (arguments == null) {
            return Map.of();
        }
        if (arguments instanceof Map<?, ?> map) {
            Map<String, Object> args = new LinkedHashMap<>();
            map.forEach((key, value) -> args.put(String.valueOf(key), value));
            return args;
        }
        if (arguments instanceof String text && text.isBlank()) {
            return Map.of();
        }
        return null;
    }

    private String describe(Throwable ex) {
        String message = ex.getMessage();
        return StringUtils.hasText(message) ? message : ex.getClass().getSimpleName();
    }

    private long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000;
    }
}
