package com.linlay.mcpgateway.controller;

import com.linlay.mcpgateway.model.api.ApiResponse;
import com.linlay.mcpgateway.model.api.CreateSessionRequest;
import com.linlay.mcpgateway.model.api.CreateSessionResponse;
import com.linlay.mcpgateway.model.api.DeleteSessionResponse;
import com.linlay.mcpgateway.model.api.HealthResponse;
import com.linlay.mcpgateway.model.api.MessageAckResponse;
import com.linlay.mcpgateway.model.api.PostMessageRequest;
import com.linlay.mcpgateway.model.api.SessionStatusResponse;
import com.linlay.mcpgateway.model.api.ToolListResponse;
import com.linlay.mcpgateway.service.SessionService;
import com.linlay.mcpgateway.service.SessionStreamService;
import com.linlay.mcpgateway.stream.service.SseFlushWriter;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

@RestController
@RequestMapping("/api")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionService sessionService;
    private final SessionStreamService sessionStreamService;
    private final SseFlushWriter sseFlushWriter;

    public SessionController(
            SessionService sessionService,
            SessionStreamService sessionStreamService,
            SseFlushWriter sseFlushWriter
    ) {
        this.sessionService = sessionService;
        this.sessionStreamService = sessionStreamService;
        this.sseFlushWriter = sseFlushWriter;
    }

    /**
     * 建立 MCP 连接是阻塞操作，放到 boundedElastic 上执行。
     */
    @PostMapping("/connect")
    public Mono<ApiResponse<CreateSessionResponse>> connect(
            @Valid @RequestBody(required = false) CreateSessionRequest request
    ) {
        return Mono.fromCallable(() -> sessionService.create(request))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ApiResponse::success);
    }

    @PostMapping("/sessions/{sessionId}/message")
    public ApiResponse<MessageAckResponse> message(
            @PathVariable String sessionId,
            @RequestBody(required = false) PostMessageRequest request
    ) {
        return ApiResponse.success(sessionService.postMessage(sessionId, request == null ? null : request.message()));
    }

    @GetMapping(value = "/sessions/{sessionId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Mono<Void> stream(@PathVariable String sessionId, ServerHttpResponse response) {
        Flux<ServerSentEvent<String>> events = sessionStreamService.open(sessionId);
        return sseFlushWriter.write(response, events);
    }

    @DeleteMapping("/sessions/{sessionId}")
    public ApiResponse<DeleteSessionResponse> delete(@PathVariable String sessionId) {
        DeleteSessionResponse result = sessionService.delete(sessionId);
        log.info("Delete session {} removed={}", sessionId, result.removed());
        return ApiResponse.success(result);
    }

    @GetMapping("/sessions/{sessionId}/status")
    public ApiResponse<SessionStatusResponse> status(@PathVariable String sessionId) {
        return ApiResponse.success(sessionService.status(sessionId));
    }

    @GetMapping("/sessions/{sessionId}/tools")
    public Mono<ApiResponse<ToolListResponse>> tools(@PathVariable String sessionId) {
        return Mono.fromCallable(() -> sessionService.listTools(sessionId))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ApiResponse::success);
    }

    @GetMapping("/health")
    public ApiResponse<HealthResponse> health() {
        return ApiResponse.success(sessionService.health());
    }
}
