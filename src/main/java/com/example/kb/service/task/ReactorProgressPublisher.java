package com.example.kb.service.task;

import com.example.kb.dto.ProgressEvent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

/**
 * 基于 Reactor 的进度广播, 供 SSE 订阅
 *
 * 没有订阅者时事件直接丢弃, 观察方可随时通过轮询接口补齐当前状态。
 */
@Slf4j
@Component
public class ReactorProgressPublisher implements ProgressPublisher {

    private final Sinks.Many<ProgressEvent> sink = Sinks.many().multicast().directBestEffort();

    @Override
    public synchronized void publish(ProgressEvent event) {
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            log.debug("进度事件未投递: documentId={}, result={}", event.getDocumentId(), result);
        }
    }

    /**
     * 订阅进度事件
     *
     * @param documentId 为空时订阅全部文档
     */
    public Flux<ProgressEvent> subscribe(String documentId) {
        Flux<ProgressEvent> events = sink.asFlux();
        if (documentId == null || documentId.isEmpty()) {
            return events;
        }
        return events.filter(event -> documentId.equals(event.getDocumentId()));
    }
}
