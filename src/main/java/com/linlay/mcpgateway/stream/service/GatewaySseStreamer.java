package com.linlay.mcpgateway.stream.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.mcpgateway.config.SseProperties;
import com.linlay.mcpgateway.stream.model.GatewayEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 把事件流编码为 SSE：每个事件一行 JSON data，穿插心跳注释。相邻事件间隔超过 streamTimeout 时以 error 事件收尾。
 */
@Component
public class GatewaySseStreamer {

    private static final Logger log = LoggerFactory.getLogger(GatewaySseStreamer.class);

    private static final String SSE_EVENT_MESSAGE = "message";
    private static final ServerSentEvent<String> HEARTBEAT = ServerSentEvent.<String>builder()
            .comment("heartbeat")
            .build();

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration streamTimeout;
    private final Duration heartbeatInterval;

    public GatewaySseStreamer(ObjectMapper objectMapper, SseProperties properties, Clock clock) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper cannot be null");
        this.clock = clock;
        this.streamTimeout = properties.streamTimeout();
        this.heartbeatInterval = properties.heartbeatInterval();
    }

    public Flux<ServerSentEvent<String>> stream(Flux<GatewayEvent> events) {
        Objects.requireNonNull(events, "events cannot be null");
        AtomicLong seq = new AtomicLong();

        Flux<ServerSentEvent<String>> bodyFlux = events
                .timeout(streamTimeout)
                .onErrorResume(ex -> {
                    String message = ex instanceof TimeoutException
                            ? "Stream timed out after " + streamTimeout
                            : ex.getMessage();
                    log.warn("Event stream terminated with error: {}", message);
                    return Flux.just(new GatewayEvent.Error(message));
                })
                .map(event -> toSse(event, seq.incrementAndGet()));

        return Flux.create(sink -> {
            Disposable heartbeat = Flux.interval(heartbeatInterval, heartbeatInterval)
                    .subscribe(tick -> sink.next(HEARTBEAT));
            Disposable body = bodyFlux.subscribe(
                    sink::next,
                    err -> {
                        heartbeat.dispose();
                        sink.error(err);
                    },
                    () -> {
                        heartbeat.dispose();
                        sink.complete();
                    }
            );
            sink.onDispose(() -> {
                heartbeat.dispose();
                body.dispose();
            });
        });
    }

    private ServerSentEvent<String> toSse(GatewayEvent event, long seq) {
        return ServerSentEvent.<String>builder()
                .event(SSE_EVENT_MESSAGE)
                .data(toJson(event, seq))
                .build();
    }

    private String toJson(GatewayEvent event, long seq) {
        try {
            return objectMapper.writeValueAsString(event.toData(seq, clock.millis()));
        } catch (JsonProcessingException ex) {
            log.error("Cannot serialize {} event", event.type(), ex);
            return "{\"type\":\"error\",\"seq\":" + seq + ",\"message\":\"Internal serialization failure\"}";
        }
    }
}
