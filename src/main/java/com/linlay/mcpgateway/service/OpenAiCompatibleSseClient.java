package com.linlay.mcpgateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.mcpgateway.config.CompletionProviderProperties;
import com.linlay.mcpgateway.model.CompletionProtocol;
import com.linlay.mcpgateway.stream.adapter.openai.ChatCompletionDeltaNormalizer;
import com.linlay.mcpgateway.stream.adapter.openai.OpenAiSseDeltaParser;
import com.linlay.mcpgateway.stream.adapter.openai.ResponsesSseEventParser;
import com.linlay.mcpgateway.stream.model.LlmDelta;
import com.linlay.mcpgateway.stream.model.RawStreamEvent;
import com.linlay.mcpgateway.stream.service.CompletionRequest;
import com.linlay.mcpgateway.stream.service.CompletionSource;
import com.linlay.mcpgateway.stream.service.CompletionSourceException;
import com.linlay.mcpgateway.tool.ToolDescriptor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;
import reactor.netty.resources.ConnectionProvider;
import reactor.util.retry.Retry;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 原生 WebClient SSE 路径：直接构建 OpenAI Compatible HTTP 请求，解析 SSE 并归一为 {@link RawStreamEvent}。
 * 同时支持 chat completions 与 responses 两种流式协议。
 */
@Service
public class OpenAiCompatibleSseClient implements CompletionSource {

    private static final Logger log = LoggerFactory.getLogger(OpenAiCompatibleSseClient.class);
    private static final int ERROR_BODY_LOG_LIMIT = 500;

    private final CompletionProviderProperties properties;
    private final CompletionCallLogger callLogger;
    private final OpenAiSseDeltaParser deltaParser;
    private final ChatCompletionDeltaNormalizer deltaNormalizer;
    private final ResponsesSseEventParser responsesParser;
    private final ConnectionProvider connectionProvider;

    public OpenAiCompatibleSseClient(
            CompletionProviderProperties properties,
            ObjectMapper objectMapper,
            CompletionCallLogger callLogger,
            ConnectionProvider completionConnectionProvider
    ) {
        this.properties = properties;
        this.callLogger = callLogger;
        this.deltaParser = new OpenAiSseDeltaParser(objectMapper);
        this.deltaNormalizer = new ChatCompletionDeltaNormalizer();
        this.responsesParser = new ResponsesSseEventParser(objectMapper);
        this.connectionProvider = completionConnectionProvider;
    }

    @Override
    public Flux<RawStreamEvent> stream(CompletionRequest request) {
        return Flux.defer(() -> {
            validateConfig();
            CompletionProtocol protocol = properties.getProtocol() == null
                    ? CompletionProtocol.CHAT_COMPLETIONS
                    : properties.getProtocol();
            String traceId = StringUtils.hasText(request.traceId()) ? request.traceId() : callLogger.generateTraceId();
            Map<String, Object> body = protocol == CompletionProtocol.RESPONSES
                    ? buildResponsesRequest(request)
                    : buildChatCompletionsRequest(request);
            long startNanos = System.nanoTime();
            StringBuilder responseBuffer = new StringBuilder();
            AtomicBoolean firstChunkReceived = new AtomicBoolean(false);

            callLogger.info(log, "[{}] completion stream request start protocol={}, model={}, messages={}, tools={}",
                    traceId, protocol, properties.getModel(), request.messages().size(), request.tools().size());
            callLogger.logHistoryMessages(log, traceId, request.messages());

            Flux<String> rawChunks = buildWebClient().post()
                    .uri(resolveUri(properties.getBaseUrl(), protocol))
                    .accept(MediaType.TEXT_EVENT_STREAM)
                    .bodyValue(body)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, response -> response.bodyToMono(String.class)
                            .defaultIfEmpty("")
                            .flatMap(errorBody -> Mono.error(new CompletionSourceException(
                                    "Completion endpoint returned HTTP " + response.statusCode().value()
                                            + ": " + truncate(callLogger.sanitizeText(errorBody))))))
                    .bodyToFlux(String.class)
                    .doOnNext(chunk -> firstChunkReceived.set(true))
                    .retryWhen(Retry.max(1)
                            .filter(ex -> !firstChunkReceived.get() && isConnectionError(ex)))
                    .doOnNext(rawChunk -> callLogger.debug(log, "[{}][raw] {}", traceId, callLogger.sanitizeText(rawChunk)));

            Flux<RawStreamEvent> events = protocol == CompletionProtocol.RESPONSES
                    ? rawChunks.concatMapIterable(responsesParser::parse)
                    : deltaNormalizer.normalize(rawChunks.<LlmDelta>handle((rawChunk, sink) -> {
                        LlmDelta delta = deltaParser.parseOrNull(rawChunk);
                        if (delta != null) {
                            sink.next(delta);
                        }
                    }));

            return events
                    .doOnNext(event -> callLogger.appendEventLog(responseBuffer, event))
                    .timeout(Duration.ofMillis(properties.getStreamTimeoutMs()))
                    .onErrorMap(ex -> !(ex instanceof CompletionSourceException), this::toCompletionSourceException)
                    .doOnComplete(() -> callLogger.info(log, "[{}] completion stream finished in {} ms:\n{}",
                            traceId, callLogger.elapsedMs(startNanos), responseBuffer))
                    .doOnError(ex -> log.error("[{}] completion stream failed in {} ms, partial response:\n{}",
                            traceId, callLogger.elapsedMs(startNanos), responseBuffer, ex))
                    .doOnCancel(() -> callLogger.info(log, "[{}] completion stream canceled in {} ms",
                            traceId, callLogger.elapsedMs(startNanos)));
        });
    }

    Map<String, Object> buildChatCompletionsRequest(CompletionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.getModel());
        body.put("stream", true);
        List<Map<String, Object>> messages = new ArrayList<>();
        for (Message message : request.messages()) {
            messages.addAll(toChatMessages(message));
        }
        body.put("messages", messages);
        if (request.hasTools()) {
            List<Map<String, Object>> tools = new ArrayList<>();
            for (ToolDescriptor tool : request.tools()) {
                Map<String, Object> function = new LinkedHashMap<>();
                function.put("name", tool.name());
                if (StringUtils.hasText(tool.description())) {
                    function.put("description", tool.description());
                }
                function.put("parameters", tool.inputSchema());
                Map<String, Object> toolMap = new LinkedHashMap<>();
                toolMap.put("type", "function");
                toolMap.put("function", function);
                tools.add(toolMap);
            }
            body.put("tools", tools);
            body.put("tool_choice", "auto");
            body.put("parallel_tool_calls", properties.isParallelToolCalls());
        }
        return body;
    }

    Map<String, Object> buildResponsesRequest(CompletionRequest request) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", properties.getModel());
        body.put("stream", true);
        List<Map<String, Object>> input = new ArrayList<>();
        for (Message message : request.messages()) {
            input.addAll(toResponsesInput(message));
        }
        body.put("input", input);
        if (request.hasTools()) {
            List<Map<String, Object>> tools = new ArrayList<>();
            for (ToolDescriptor tool : request.tools()) {
                Map<String, Object> toolMap = new LinkedHashMap<>();
                toolMap.put("type", "function");
                toolMap.put("name", tool.name());
                if (StringUtils.hasText(tool.description())) {
                    toolMap.put("description", tool.description());
                }
                toolMap.put("parameters", tool.inputSchema());
                tools.add(toolMap);
            }
            body.put("tools", tools);
            body.put("tool_choice", "auto");
            body.put("parallel_tool_calls", properties.isParallelToolCalls());
        }
        return body;
    }

    private List<Map<String, Object>> toChatMessages(Message message) {
        if (message instanceof SystemMessage systemMessage) {
            return List.of(textMessage("system", systemMessage.getText()));
        }
        if (message instanceof UserMessage userMessage) {
            return List.of(textMessage("user", userMessage.getText()));
        }
        if (message instanceof AssistantMessage assistantMessage) {
            Map<String, Object> assistant = textMessage("assistant", assistantMessage.getText());
            List<Map<String, Object>> toolCalls = new ArrayList<>();
            for (AssistantMessage.ToolCall call : toolCallsOf(assistantMessage)) {
                Map<String, Object> function = new LinkedHashMap<>();
                function.put("name", call.name());
                function.put("arguments", call.arguments() == null ? "" : call.arguments());
                Map<String, Object> toolCall = new LinkedHashMap<>();
                toolCall.put("id", call.id());
                toolCall.put("type", call.type() == null ? "function" : call.type());
                toolCall.put("function", function);
                toolCalls.add(toolCall);
            }
            if (!toolCalls.isEmpty()) {
                assistant.put("tool_calls", toolCalls);
            }
            return List.of(assistant);
        }
        if (message instanceof ToolResponseMessage toolResponseMessage) {
            List<Map<String, Object>> toolMessages = new ArrayList<>();
            for (ToolResponseMessage.ToolResponse response : responsesOf(toolResponseMessage)) {
                Map<String, Object> tool = new LinkedHashMap<>();
                tool.put("role", "tool");
                tool.put("tool_call_id", response.id());
                tool.put("name", response.name());
                tool.put("content", response.responseData() == null ? "" : response.responseData());
                toolMessages.add(tool);
            }
            return toolMessages;
        }
        String role = message.getMessageType() == null
                ? "assistant"
                : message.getMessageType().name().toLowerCase(Locale.ROOT);
        return List.of(textMessage(role, message.getText()));
    }

    private List<Map<String, Object>> toResponsesInput(Message message) {
        if (message instanceof AssistantMessage assistantMessage) {
            List<Map<String, Object>> items = new ArrayList<>();
            if (StringUtils.hasText(assistantMessage.getText())) {
                items.add(textMessage("assistant", assistantMessage.getText()));
            }
            for (AssistantMessage.ToolCall call : toolCallsOf(assistantMessage)) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("type", "function_call");
                item.put("call_id", call.id());
                item.put("name", call.name());
                item.put("arguments", call.arguments() == null ? "" : call.arguments());
                items.add(item);
            }
            return items;
        }
        if (message instanceof ToolResponseMessage toolResponseMessage) {
            List<Map<String, Object>> items = new ArrayList<>();
            for (ToolResponseMessage.ToolResponse response : responsesOf(toolResponseMessage)) {
                Map<String, Object> item = new LinkedHashMap<>();
                item.put("type", "function_call_output");
                item.put("call_id", response.id());
                item.put("output", response.responseData() == null ? "" : response.responseData());
                items.add(item);
            }
            return items;
        }
        return toChatMessages(message);
    }

    private List<AssistantMessage.ToolCall> toolCallsOf(AssistantMessage message) {
        return message.getToolCalls() == null ? List.of() : message.getToolCalls();
    }

    private List<ToolResponseMessage.ToolResponse> responsesOf(ToolResponseMessage message) {
        return message.getResponses() == null ? List.of() : message.getResponses();
    }

    private Map<String, Object> textMessage(String role, String content) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("role", role);
        message.put("content", content == null ? "" : content);
        return message;
    }

    private void validateConfig() {
        if (!StringUtils.hasText(properties.getBaseUrl())) {
            throw new CompletionSourceException("Missing gateway.completion.base-url");
        }
        if (!StringUtils.hasText(properties.getApiKey())) {
            throw new CompletionSourceException("Missing gateway.completion.api-key");
        }
        if (!StringUtils.hasText(properties.getModel())) {
            throw new CompletionSourceException("Missing gateway.completion.model");
        }
    }

    private WebClient buildWebClient() {
        HttpClient httpClient = connectionProvider != null
                ? HttpClient.create(connectionProvider)
                : HttpClient.create();
        return WebClient.builder()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .baseUrl(properties.getBaseUrl())
                .defaultHeader(HttpHeaders.AUTHORIZATION, "Bearer " + properties.getApiKey())
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
    }

    static String resolveUri(String baseUrl, CompletionProtocol protocol) {
        String path = protocol == CompletionProtocol.RESPONSES ? "/responses" : "/chat/completions";
        String normalized = baseUrl == null ? "" : baseUrl.trim().toLowerCase(Locale.ROOT);
        if (normalized.endsWith("/v1") || normalized.endsWith("/v1/")) {
            return path;
        }
        return "/v1" + path;
    }

    private CompletionSourceException toCompletionSourceException(Throwable ex) {
        if (ex instanceof TimeoutException) {
            return new CompletionSourceException(
                    "Completion stream timed out after " + properties.getStreamTimeoutMs() + " ms", ex);
        }
        if (ex instanceof WebClientRequestException) {
            return new CompletionSourceException("Failed to reach completion endpoint: " + ex.getMessage(), ex);
        }
        String message = ex.getMessage();
        return new CompletionSourceException(StringUtils.hasText(message)
                ? "Completion stream error: " + message
                : "Completion stream error: " + ex.getClass().getSimpleName(), ex);
    }

    private String truncate(String text) {
        if (text == null || text.length() <= ERROR_BODY_LOG_LIMIT) {
            return text;
        }
        return text.substring(0, ERROR_BODY_LOG_LIMIT) + "...";
    }

    private boolean isConnectionError(Throwable ex) {
        if (ex instanceof IOException) {
            return true;
        }
        Throwable cause = ex.getCause();
        return cause instanceof IOException;
    }
}
