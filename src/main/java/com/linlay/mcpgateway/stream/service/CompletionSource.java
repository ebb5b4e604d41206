package com.linlay.mcpgateway.stream.service;

import com.linlay.mcpgateway.stream.model.RawStreamEvent;
import reactor.core.publisher.Flux;

public interface CompletionSource {

    /**
     * 发起一轮流式补全。失败以 {@link CompletionSourceException} 终止 Flux。
     */
    Flux<RawStreamEvent> stream(CompletionRequest request);
}
