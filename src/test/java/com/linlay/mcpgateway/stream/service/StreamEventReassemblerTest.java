package com.linlay.mcpgateway.stream.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.mcpgateway.config.ConversationProperties;
import com.linlay.mcpgateway.config.SessionProperties;
import com.linlay.mcpgateway.config.ToolProviderProperties;
import com.linlay.mcpgateway.session.Session;
import com.linlay.mcpgateway.session.SessionRegistry;
import com.linlay.mcpgateway.stream.adapter.openai.ChatCompletionDeltaNormalizer;
import com.linlay.mcpgateway.stream.model.GatewayEvent;
import com.linlay.mcpgateway.stream.model.LlmDelta;
import com.linlay.mcpgateway.stream.model.RawStreamEvent;
import com.linlay.mcpgateway.stream.model.ToolCallDelta;
import com.linlay.mcpgateway.tool.ToolCallOutcome;
import com.linlay.mcpgateway.tool.ToolDescriptor;
import com.linlay.mcpgateway.tool.ToolInvocationBridge;
import com.linlay.mcpgateway.tool.ToolProviderConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.messages.AssistantMessage;
import org.springframework.ai.chat.messages.Message;
import org.springframework.ai.chat.messages.MessageType;
import org.springframework.ai.chat.messages.SystemMessage;
import org.springframework.ai.chat.messages.ToolResponseMessage;
import org.springframework.ai.chat.messages.UserMessage;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BiFunction;

import static org.assertj.core.api.Assertions.assertThat;

class StreamEventReassemblerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final ExecutorService executor = Executors.newSingleThreadExecutor();
    private final ConversationProperties conversationProperties = new ConversationProperties();
    private final ScriptedCompletionSource completionSource = new ScriptedCompletionSource();
    private final StubConnection connection = new StubConnection();

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void plainAnswerShouldStreamTokensThenCompletionAndRecordAssistantMessage() {
        completionSource.then(Flux.just(
                new RawStreamEvent.TextDelta("Hel"),
                new RawStreamEvent.TextDelta("lo"),
                new RawStreamEvent.TurnCompleted("stop")
        ));
        Session session = session();

        StepVerifier.create(reassembler().run(session))
                .expectNext(new GatewayEvent.Token("Hel"))
                .expectNext(new GatewayEvent.Token("lo"))
                .expectNext(new GatewayEvent.Completion())
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        List<Message> history = session.conversationSnapshot();
        assertThat(history).hasSize(3);
        assertThat(history.get(2)).isInstanceOf(AssistantMessage.class);
        assertThat(history.get(2).getText()).isEqualTo("Hello");
        assertThat(completionSource.requests).hasSize(1);
        assertThat(completionSource.requests.get(0).hasTools()).isTrue();
    }

    @Test
    void singleToolCallShouldProduceContiguousToolBlockBeforeSummary() {
        ChatCompletionDeltaNormalizer normalizer = new ChatCompletionDeltaNormalizer();
        completionSource.then(normalizer.normalize(Flux.just(
                new LlmDelta(null, List.of(new ToolCallDelta("call_1", 0, "get_tables", "")), null),
                new LlmDelta(null, List.of(new ToolCallDelta(null, 0, null, "{}")), null),
                new LlmDelta(null, null, "tool_calls")
        )));
        completionSource.then(Flux.just(
                new RawStreamEvent.TextDelta("Found 2 tables"),
                new RawStreamEvent.TurnCompleted("stop")
        ));
        connection.handler = (name, args) -> new ToolCallOutcome(false, List.of("patients", "visits"));
        Session session = session();

        StepVerifier.create(reassembler().run(session))
                .expectNext(new GatewayEvent.ToolCallStarted("get_tables", "call_1"))
                .expectNext(new GatewayEvent.ToolCall("get_tables", "call_1", Map.of()))
                .expectNext(new GatewayEvent.ToolResponse("get_tables", "call_1", "patients\nvisits", false))
                .expectNext(new GatewayEvent.ToolCallFinished("get_tables", "call_1"))
                .expectNext(new GatewayEvent.Token("Found 2 tables"))
                .expectNext(new GatewayEvent.Completion())
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        List<Message> history = session.conversationSnapshot();
        assertThat(history).extracting(Message::getMessageType).containsExactly(
                MessageType.SYSTEM,
                MessageType.USER,
                MessageType.ASSISTANT,
                MessageType.TOOL,
                MessageType.ASSISTANT
        );
        AssistantMessage toolTurn = (AssistantMessage) history.get(2);
        assertThat(toolTurn.getToolCalls()).hasSize(1);
        assertThat(toolTurn.getToolCalls().get(0).id()).isEqualTo("call_1");
        assertThat(toolTurn.getToolCalls().get(0).name()).isEqualTo("get_tables");
        assertThat(toolTurn.getToolCalls().get(0).arguments()).isEqualTo("{}");

        ToolResponseMessage toolMessage = (ToolResponseMessage) history.get(3);
        assertThat(toolMessage.getResponses().get(0).id()).isEqualTo("call_1");
        assertThat(toolMessage.getResponses().get(0).responseData()).isEqualTo("patients\nvisits");
        assertThat(history.get(4).getText()).isEqualTo("Found 2 tables");

        assertThat(connection.calls).containsExactly("get_tables");
        assertThat(completionSource.requests).hasSize(2);
        assertThat(completionSource.requests.get(1).messages()).hasSize(4);
        assertThat(completionSource.requests.get(1).hasTools()).isFalse();
    }

    @Test
    void interleavedArgumentFragmentsShouldBeRoutedBySlot() {
        completionSource.then(Flux.just(
                new RawStreamEvent.ToolCallAdded(0, "call_a", "lookup"),
                new RawStreamEvent.ToolCallAdded(1, "call_b", "count_rows"),
                new RawStreamEvent.ToolCallArgumentsDelta(1, null, "{\"table\":"),
                new RawStreamEvent.ToolCallArgumentsDelta(0, null, "{\"id\":"),
                new RawStreamEvent.ToolCallArgumentsDelta(1, null, "\"visits\"}"),
                new RawStreamEvent.ToolCallArgumentsDelta(0, null, "7}"),
                new RawStreamEvent.ToolCallArgumentsDone(0, null, "{\"id\":7}"),
                new RawStreamEvent.ToolCallItemDone(0, "call_a", "lookup", "{\"id\":7}"),
                new RawStreamEvent.ToolCallArgumentsDone(1, null, "{\"table\":\"visits\"}"),
                new RawStreamEvent.ToolCallItemDone(1, "call_b", "count_rows", "{\"table\":\"visits\"}"),
                new RawStreamEvent.TurnCompleted("completed")
        ));
        completionSource.then(Flux.just(
                new RawStreamEvent.TextDelta("done"),
                new RawStreamEvent.TurnCompleted("completed")
        ));
        connection.handler = (name, args) -> new ToolCallOutcome(false, List.of(name + " ok"));
        Session session = session();

        List<GatewayEvent> events = reassembler().run(session).collectList().block(Duration.ofSeconds(5));

        assertThat(events).isNotNull();
        assertThat(events).containsSubsequence(
                new GatewayEvent.ToolCall("lookup", "call_a", Map.of("id", 7)),
                new GatewayEvent.ToolCall("count_rows", "call_b", Map.of("table", "visits")),
                new GatewayEvent.Completion()
        );
        assertThat(connection.calls).containsExactly("lookup", "count_rows");
        assertThat(connection.arguments).containsExactly(Map.of("id", 7), Map.of("table", "visits"));
    }

    @Test
    void malformedArgumentsShouldBeReportedRawAndNotDispatched() {
        completionSource.then(Flux.just(
                new RawStreamEvent.ToolCallAdded(0, "call_bad", "lookup"),
                new RawStreamEvent.ToolCallArgumentsDelta(0, null, "{\"id\": 7"),
                new RawStreamEvent.TurnCompleted("tool_calls")
        ));
        completionSource.then(Flux.just(new RawStreamEvent.TurnCompleted("stop")));
        Session session = session();

        List<GatewayEvent> events = reassembler().run(session).collectList().block(Duration.ofSeconds(5));

        assertThat(events).isNotNull();
        assertThat(events).contains(new GatewayEvent.ToolCall("lookup", "call_bad", "{\"id\": 7"));
        GatewayEvent.ToolResponse response = events.stream()
                .filter(GatewayEvent.ToolResponse.class::isInstance)
                .map(GatewayEvent.ToolResponse.class::cast)
                .findFirst()
                .orElseThrow();
        assertThat(response.error()).isTrue();
        assertThat(response.output()).contains("must be a JSON object");
        assertThat(connection.calls).isEmpty();
        assertThat(events.get(events.size() - 1)).isEqualTo(new GatewayEvent.Completion());

        AssistantMessage toolTurn = (AssistantMessage) session.conversationSnapshot().get(2);
        assertThat(toolTurn.getToolCalls().get(0).arguments()).isEqualTo("{\"id\": 7");
    }

    @Test
    void toolFailureShouldBeFoldedIntoErrorResponse() {
        completionSource.then(Flux.just(
                new RawStreamEvent.ToolCallAdded(0, "call_1", "lookup"),
                new RawStreamEvent.ToolCallArgumentsDone(0, null, "{}"),
                new RawStreamEvent.TurnCompleted("tool_calls")
        ));
        completionSource.then(Flux.just(
                new RawStreamEvent.TextDelta("sorry"),
                new RawStreamEvent.TurnCompleted("stop")
        ));
        connection.handler = (name, args) -> {
            throw new IllegalStateException("db down");
        };
        Session session = session();

        List<GatewayEvent> events = reassembler().run(session).collectList().block(Duration.ofSeconds(5));

        assertThat(events).contains(
                new GatewayEvent.ToolResponse("lookup", "call_1", "Error calling tool lookup: db down", true)
        );
        assertThat(events).endsWith(new GatewayEvent.Token("sorry"), new GatewayEvent.Completion());
        ToolResponseMessage toolMessage = (ToolResponseMessage) session.conversationSnapshot().get(3);
        assertThat(toolMessage.getResponses().get(0).responseData()).isEqualTo("Error calling tool lookup: db down");
    }

    @Test
    void completionSourceFailureShouldEndStreamWithErrorEvent() {
        completionSource.then(Flux.concat(
                Flux.<RawStreamEvent>just(new RawStreamEvent.TextDelta("partial")),
                Flux.<RawStreamEvent>error(new CompletionSourceException("Completion endpoint returned HTTP 500: boom"))
        ));
        Session session = session();

        StepVerifier.create(reassembler().run(session))
                .expectNext(new GatewayEvent.Token("partial"))
                .expectNext(new GatewayEvent.Error("Completion endpoint returned HTTP 500: boom"))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(session.historyLength()).isEqualTo(2);
    }

    @Test
    void missingUserMessageShouldYieldErrorWithoutCallingUpstream() {
        Session session = new Session(
                "s-idle",
                Instant.now(),
                connection,
                List.of(),
                List.of(new SystemMessage("sys"), new UserMessage("hi"), new AssistantMessage("hello")),
                List.of()
        );

        StepVerifier.create(reassembler().run(session))
                .expectNext(new GatewayEvent.Error(StreamEventReassembler.NO_PENDING_MESSAGE))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(completionSource.requests).isEmpty();
    }

    @Test
    void toolRoundLimitShouldStopRepeatedToolTurns() {
        conversationProperties.setMaxToolRounds(1);
        conversationProperties.setContinueWithTools(true);
        for (int i = 0; i < 2; i++) {
            completionSource.then(Flux.just(
                    new RawStreamEvent.ToolCallAdded(0, "call_" + i, "lookup"),
                    new RawStreamEvent.ToolCallArgumentsDone(0, null, "{}"),
                    new RawStreamEvent.TurnCompleted("tool_calls")
            ));
        }
        connection.handler = (name, args) -> new ToolCallOutcome(false, List.of("ok"));
        Session session = session();

        List<GatewayEvent> events = reassembler().run(session).collectList().block(Duration.ofSeconds(5));

        assertThat(events).isNotNull();
        assertThat(events.get(events.size() - 1)).isEqualTo(new GatewayEvent.Error("Exceeded maximum tool rounds (1)"));
        assertThat(connection.calls).hasSize(1);
        assertThat(completionSource.requests.get(1).hasTools()).isTrue();
    }

    @Test
    void disconnectDuringToolCallShouldFinishInFlightCallAndSkipTheRest() throws Exception {
        completionSource.then(Flux.just(
                new RawStreamEvent.ToolCallAdded(0, "call_a", "slow_query"),
                new RawStreamEvent.ToolCallArgumentsDone(0, null, "{}"),
                new RawStreamEvent.ToolCallAdded(1, "call_b", "lookup"),
                new RawStreamEvent.ToolCallArgumentsDone(1, null, "{}"),
                new RawStreamEvent.TurnCompleted("tool_calls")
        ));
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        connection.handler = (name, args) -> {
            entered.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException ex) {
                Thread.currentThread().interrupt();
            }
            return new ToolCallOutcome(false, List.of("rows"));
        };
        Session session = session();
        List<GatewayEvent> events = new CopyOnWriteArrayList<>();

        Disposable subscription = reassembler().run(session).subscribe(events::add);
        assertThat(entered.await(5, TimeUnit.SECONDS)).isTrue();
        subscription.dispose();
        release.countDown();
        executor.shutdown();
        assertThat(executor.awaitTermination(5, TimeUnit.SECONDS)).isTrue();

        assertThat(events).containsExactly(
                new GatewayEvent.ToolCallStarted("slow_query", "call_a"),
                new GatewayEvent.ToolCall("slow_query", "call_a", Map.of())
        );
        assertThat(connection.calls).containsExactly("slow_query");
        assertThat(completionSource.requests).hasSize(1);

        List<Message> history = session.conversationSnapshot();
        assertThat(history).extracting(Message::getMessageType).containsExactly(
                MessageType.SYSTEM,
                MessageType.USER,
                MessageType.ASSISTANT,
                MessageType.TOOL,
                MessageType.TOOL
        );
        assertThat(((ToolResponseMessage) history.get(3)).getResponses().get(0).responseData()).isEqualTo("rows");
        assertThat(((ToolResponseMessage) history.get(4)).getResponses().get(0).id()).isEqualTo("call_b");
        assertThat(((ToolResponseMessage) history.get(4)).getResponses().get(0).responseData())
                .isEqualTo(StreamEventReassembler.SKIPPED_TOOL_RESULT);
    }

    @Test
    void sessionRemovedDuringToolCallShouldStopBeforeNextCallAndEndWithError() {
        completionSource.then(Flux.just(
                new RawStreamEvent.ToolCallAdded(0, "call_a", "get_tables"),
                new RawStreamEvent.ToolCallArgumentsDone(0, null, "{}"),
                new RawStreamEvent.ToolCallAdded(1, "call_b", "get_table_columns"),
                new RawStreamEvent.ToolCallArgumentsDone(1, null, "{\"table\":\"visits\"}"),
                new RawStreamEvent.TurnCompleted("tool_calls")
        ));
        completionSource.then(Flux.just(
                new RawStreamEvent.TextDelta("never requested"),
                new RawStreamEvent.TurnCompleted("stop")
        ));
        SessionRegistry registry = new SessionRegistry(
                sessionId -> connection,
                conversationProperties,
                new SessionProperties(),
                Clock.systemUTC()
        );
        Session session = registry.create(List.of());
        session.appendMessage(new UserMessage("Which tables exist?"));
        connection.handler = (name, args) -> {
            registry.remove(session.id());
            return new ToolCallOutcome(false, List.of("patients"));
        };

        StepVerifier.create(reassembler().run(session))
                .expectNext(new GatewayEvent.ToolCallStarted("get_tables", "call_a"))
                .expectNext(new GatewayEvent.ToolCall("get_tables", "call_a", Map.of()))
                .expectNext(new GatewayEvent.ToolResponse("get_tables", "call_a", "patients", false))
                .expectNext(new GatewayEvent.ToolCallFinished("get_tables", "call_a"))
                .expectNext(new GatewayEvent.Error(StreamEventReassembler.SESSION_CLOSED_MESSAGE))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertThat(session.isClosed()).isTrue();
        assertThat(connection.calls).containsExactly("get_tables");
        assertThat(completionSource.requests).hasSize(1);
        ToolResponseMessage skipped = (ToolResponseMessage) session.conversationSnapshot()
                .get(session.historyLength() - 1);
        assertThat(skipped.getResponses().get(0).id()).isEqualTo("call_b");
        assertThat(skipped.getResponses().get(0).responseData()).isEqualTo(StreamEventReassembler.SKIPPED_TOOL_RESULT);
    }

    @Test
    void historyWindowShouldKeepSystemPromptAndNotStartOnToolMessage() {
        conversationProperties.setHistoryWindow(2);
        List<Message> conversation = new ArrayList<>();
        conversation.add(new SystemMessage("sys"));
        conversation.add(new UserMessage("q1"));
        conversation.add(new AssistantMessage("", Map.of(),
                List.of(new AssistantMessage.ToolCall("call_1", "function", "lookup", "{}"))));
        conversation.add(new ToolResponseMessage(List.of(new ToolResponseMessage.ToolResponse("call_1", "lookup", "ok"))));
        conversation.add(new UserMessage("q2"));
        Session session = new Session("s-window", Instant.now(), connection, List.of(), conversation, List.of());

        List<Message> window = reassembler().requestMessages(session);

        assertThat(window).extracting(Message::getMessageType)
                .containsExactly(MessageType.SYSTEM, MessageType.USER);
        assertThat(window.get(1).getText()).isEqualTo("q2");
    }

    private StreamEventReassembler reassembler() {
        return new StreamEventReassembler(
                completionSource,
                new ToolInvocationBridge(new ToolProviderProperties()),
                conversationProperties,
                objectMapper,
                executor
        );
    }

    private Session session() {
        return new Session(
                "s-" + System.nanoTime(),
                Instant.now(),
                connection,
                List.of(new ToolDescriptor("get_tables", "List tables", null)),
                List.of(new SystemMessage("sys"), new UserMessage("Which tables exist?")),
                List.of()
        );
    }

    private static final class ScriptedCompletionSource implements CompletionSource {

        private final ConcurrentLinkedDeque<Flux<RawStreamEvent>> turns = new ConcurrentLinkedDeque<>();
        private final List<CompletionRequest> requests = new CopyOnWriteArrayList<>();

        void then(Flux<RawStreamEvent> turn) {
            turns.add(turn);
        }

        @Override
        public Flux<RawStreamEvent> stream(CompletionRequest request) {
            requests.add(request);
            Flux<RawStreamEvent> turn = turns.poll();
            return turn == null ? Flux.error(new IllegalStateException("no scripted turn")) : turn;
        }
    }

    private static final class StubConnection implements ToolProviderConnection {

        private final List<String> calls = new CopyOnWriteArrayList<>();
        private final List<Map<String, Object>> arguments = new CopyOnWriteArrayList<>();
        private volatile BiFunction<String, Map<String, Object>, ToolCallOutcome> handler =
                (name, args) -> new ToolCallOutcome(false, List.of());

        @Override
        public String providerName() {
            return "stub";
        }

        @Override
        public List<ToolDescriptor> listTools() {
            return List.of();
        }

        @Override
        public ToolCallOutcome callTool(String toolName, Map<String, Object> args) {
            calls.add(toolName);
            arguments.add(args);
            return handler.apply(toolName, args);
        }

        @Override
        public void close() {
        }
    }
}
