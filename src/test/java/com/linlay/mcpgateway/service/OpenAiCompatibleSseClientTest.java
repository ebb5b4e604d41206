package com.linlay.mcpgateway.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.mcpgateway.config.CompletionLogProperties;
import com.linlay.mcpgateway.config.CompletionProviderProperties;
import com.linlay.mcpgateway.model.CompletionProtocol;
import com.linlay.mcpgateway.stream.model.RawStreamEvent;
import com.linlay.mcpgateway.stream.service.CompletionRequest;
import com.linlay.mcpgateway.stream.service.CompletionSourceException;
import com.linlay.mcpgateway.tool.ToolDescriptor;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.netty.DisposableServer;
import reactor.netty.http.server.HttpServer;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class OpenAiCompatibleSseClientTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final CompletionProviderProperties properties = new CompletionProviderProperties();
    private DisposableServer server;

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.disposeNow();
        }
    }

    @Test
    void resolveUriShouldNotDuplicateVersionSegment() {
        assertThat(OpenAiCompatibleSseClient.resolveUri("https://api.openai.com/v1", CompletionProtocol.CHAT_COMPLETIONS))
                .isEqualTo("/chat/completions");
        assertThat(OpenAiCompatibleSseClient.resolveUri("https://gateway.example.com", CompletionProtocol.CHAT_COMPLETIONS))
                .isEqualTo("/v1/chat/completions");
        assertThat(OpenAiCompatibleSseClient.resolveUri("https://api.openai.com/v1/", CompletionProtocol.RESPONSES))
                .isEqualTo("/responses");
    }

    @Test
    void chatRequestShouldCarryToolCallsAndToolResults() {
        properties.setModel("gpt-4o");
        Map<String, Object> body = client().buildChatCompletionsRequest(new CompletionRequest(
                conversationWithToolRound(),
                List.of(new ToolDescriptor("get_tables", "List tables", null)),
                null
        ));

        assertThat(body).containsEntry("model", "gpt-4o").containsEntry("stream", true)
                .containsEntry("tool_choice", "auto").containsEntry("parallel_tool_calls", false);
        List<?> messages = (List<?>) body.get("messages");
        assertThat(messages).hasSize(4);
        Map<?, ?> assistant = (Map<?, ?>) messages.get(2);
        assertThat(assistant.get("role")).isEqualTo("assistant");
        Map<?, ?> toolCall = (Map<?, ?>) ((List<?>) assistant.get("tool_calls")).get(0);
        assertThat(toolCall.get("id")).isEqualTo("call_1");
        assertThat(((Map<?, ?>) toolCall.get("function")).get("arguments")).isEqualTo("{}");
        Map<?, ?> tool = (Map<?, ?>) messages.get(3);
        assertThat(tool.get("role")).isEqualTo("tool");
        assertThat(tool.get("tool_call_id")).isEqualTo("call_1");
        assertThat(tool.get("content")).isEqualTo("patients");

        Map<?, ?> function = (Map<?, ?>) ((Map<?, ?>) ((List<?>) body.get("tools")).get(0)).get("function");
        assertThat(function.get("name")).isEqualTo("get_tables");
        assertThat(function.get("parameters")).isEqualTo(Map.of("type", "object", "properties", Map.of()));
    }

    @Test
    void continuationRequestWithoutToolsShouldOmitToolFields() {
        Map<String, Object> body = client().buildChatCompletionsRequest(new CompletionRequest(
                List.of(new UserMessage("hi")), List.of(), null));

        assertThat(body).doesNotContainKeys("tools", "tool_choice", "parallel_tool_calls");
    }

    @Test
    void responsesRequestShouldUseFunctionCallItems() {
        Map<String, Object> body = client().buildResponsesRequest(new CompletionRequest(
                conversationWithToolRound(), List.of(), null));

        List<?> input = (List<?>) body.get("input");
        assertThat(input).hasSize(4);
        Map<?, ?> call = (Map<?, ?>) input.get(2);
        assertThat(call.get("type")).isEqualTo("function_call");
        assertThat(call.get("call_id")).isEqualTo("call_1");
        Map<?, ?> output = (Map<?, ?>) input.get(3);
        assertThat(output.get("type")).isEqualTo("function_call_output");
        assertThat(output.get("output")).isEqualTo("patients");
    }

    @Test
    void streamShouldParseChatCompletionChunksFromServer() {
        AtomicReference<String> authorization = new AtomicReference<>();
        server = HttpServer.create()
                .port(0)
                .route(routes -> routes.post("/v1/chat/completions", (request, response) -> {
                    authorization.set(request.requestHeaders().get("Authorization"));
                    return response.header("Content-Type", "text/event-stream")
                            .sendString(Flux.just(
                                    "data: {\"choices\":[{\"delta\":{\"content\":\"共有\"}}]}\n\n",
                                    "data: {\"choices\":[{\"delta\":{\"content\":\"两张表\"},\"finish_reason\":\"stop\"}]}\n\n",
                                    "data: [DONE]\n\n"
                            ), StandardCharsets.UTF_8);
                }))
                .bindNow();
        properties.setBaseUrl("http://localhost:" + server.port());
        properties.setApiKey("sk-test");

        StepVerifier.create(client().stream(new CompletionRequest(List.of(new UserMessage("hi")), List.of(), "trace-1")))
                .expectNext(new RawStreamEvent.TextDelta("共有"))
                .expectNext(new RawStreamEvent.TextDelta("两张表"))
                .expectNext(new RawStreamEvent.TurnCompleted("stop"))
                .expectComplete()
                .verify(Duration.ofSeconds(10));

        assertThat(authorization.get()).isEqualTo("Bearer sk-test");
    }

    @Test
    void httpErrorShouldSurfaceAsCompletionSourceException() {
        server = HttpServer.create()
                .port(0)
                .route(routes -> routes.post("/v1/chat/completions", (request, response) -> response
                        .status(401)
                        .sendString(Mono.just("{\"error\":{\"message\":\"invalid api key\"}}"))))
                .bindNow();
        properties.setBaseUrl("http://localhost:" + server.port());
        properties.setApiKey("sk-test");

        StepVerifier.create(client().stream(new CompletionRequest(List.of(new UserMessage("hi")), List.of(), null)))
                .expectErrorSatisfies(ex -> assertThat(ex)
                        .isInstanceOf(CompletionSourceException.class)
                        .hasMessageContaining("HTTP 401")
                        .hasMessageContaining("invalid api key"))
                .verify(Duration.ofSeconds(10));
    }

    @Test
    void missingApiKeyShouldFailBeforeAnyRequest() {
        properties.setApiKey(" ");

        StepVerifier.create(client().stream(new CompletionRequest(List.of(new UserMessage("hi")), List.of(), null)))
                .expectErrorMessage("Missing gateway.completion.api-key")
                .verify(Duration.ofSeconds(2));
    }

    private OpenAiCompatibleSseClient client() {
        return new OpenAiCompatibleSseClient(
                properties,
                objectMapper,
                new CompletionCallLogger(new CompletionLogProperties()),
                null
        );
    }

    private List<Message> conversationWithToolRound() {
        return List.of(
                new SystemMessage("sys"),
                new UserMessage("Which tables exist?"),
                new AssistantMessage("", Map.of(),
                        List.of(new AssistantMessage.ToolCall("call_1", "function", "get_tables", "{}"))),
                new ToolResponseMessage(List.of(new ToolResponseMessage.ToolResponse("call_1", "get_tables", "patients")))
        );
    }
}
