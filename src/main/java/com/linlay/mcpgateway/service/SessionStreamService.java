package com.linlay.mcpgateway.service;

import com.linlay.mcpgateway.session.Session;
import com.linlay.mcpgateway.session.SessionRegistry;
import com.linlay.mcpgateway.session.StreamAlreadyActiveException;
import com.linlay.mcpgateway.session.TranscriptEntry;
import com.linlay.mcpgateway.stream.model.GatewayEvent;
import com.linlay.mcpgateway.stream.service.GatewaySseStreamer;
import com.linlay.mcpgateway.stream.service.StreamEventReassembler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

/**
 * 会话事件流的传输适配：校验会话、占用流标记、驱动重组器并编码为 SSE。
 * 正常完成时把最后一条 assistant 回复写入对外聊天记录；任何退出路径都会释放流标记。
 */
@Service
public class SessionStreamService {

    private static final Logger log = LoggerFactory.getLogger(SessionStreamService.class);

    static final String STREAM_ACTIVE_MESSAGE = "Session already has an active stream";

    private final SessionRegistry registry;
    private final StreamEventReassembler reassembler;
    private final GatewaySseStreamer sseStreamer;

    public SessionStreamService(
            SessionRegistry registry,
            StreamEventReassembler reassembler,
            GatewaySseStreamer sseStreamer
    ) {
        this.registry = registry;
        this.reassembler = reassembler;
        this.sseStreamer = sseStreamer;
    }

    /**
     * 会话不存在或已有活动流时同步抛出异常，此时尚未写出任何 SSE 字节。
     * 流标记在订阅时才占用，未被订阅的返回值不会留下占用状态。
     */
    public Flux<ServerSentEvent<String>> open(String sessionId) {
        Session session = registry.touch(sessionId);
        if (session.isStreamActive()) {
            throw new StreamAlreadyActiveException(sessionId);
        }
        return sseStreamer.stream(Flux.<GatewayEvent>defer(() -> {
            if (!session.tryAcquireStream()) {
                log.warn("Session {} stream rejected, another stream is active", sessionId);
                return Flux.<GatewayEvent>just(new GatewayEvent.Error(STREAM_ACTIVE_MESSAGE));
            }
            log.info("Session {} stream opened", sessionId);
            return events(session);
        }));
    }

    private Flux<GatewayEvent> events(Session session) {
        StringBuilder assistantText = new StringBuilder();
        return Flux.defer(() -> reassembler.run(session))
                .doOnNext(event -> {
                    if (event instanceof GatewayEvent.Token token) {
                        assistantText.append(token.content());
                    } else if (event instanceof GatewayEvent.ToolCallStarted) {
                        assistantText.setLength(0);
                    } else if (event instanceof GatewayEvent.Completion) {
                        session.appendTranscript(new TranscriptEntry(TranscriptEntry.ROLE_ASSISTANT, assistantText.toString()));
                    }
                })
                .doFinally(signal -> {
                    session.releaseStream();
                    registry.touchIfPresent(session.id());
                    log.info("Session {} stream closed, signal={}", session.id(), signal);
                });
    }
}
