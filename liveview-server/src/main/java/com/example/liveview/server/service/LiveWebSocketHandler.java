package com.example.liveview.server.service;

import com.example.liveview.server.config.MonitoringConfig.LiveViewMetrics;
import com.example.liveview.shared.context.LiveContext;
import com.example.liveview.shared.model.ContextCloseReason;
import com.example.liveview.shared.model.Patch;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.CloseStatus;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.List;

/**
 * Full-duplex transport: patch batches go out as text frames, callback frames come in on the
 * same socket.
 */
@Component
@Slf4j
public class LiveWebSocketHandler {

    private final PatchEncoder patchEncoder;
    private final LiveCallbackService liveCallbackService;
    private final LiveViewMetrics liveViewMetrics;
    private final Scheduler callbackScheduler;

    public LiveWebSocketHandler(PatchEncoder patchEncoder,
                                LiveCallbackService liveCallbackService,
                                LiveViewMetrics liveViewMetrics,
                                @Qualifier("callbackScheduler") Scheduler callbackScheduler) {
        this.patchEncoder = patchEncoder;
        this.liveCallbackService = liveCallbackService;
        this.liveViewMetrics = liveViewMetrics;
        this.callbackScheduler = callbackScheduler;
    }

    public Mono<Void> handle(WebSocketSession session, LiveContext context) {
        Flux<List<Patch>> patches;
        try {
            patches = context.connect();
        } catch (IllegalStateException e) {
            log.warn("Rejecting WebSocket session {}: {}", session.getId(), e.getMessage());
            return session.close(CloseStatus.POLICY_VIOLATION);
        }
        log.debug("Connected context {} over WebSocket session {}", context.getId(), session.getId());

        Mono<Void> output = session.send(patches
                .doOnNext(batch -> liveViewMetrics.patchesSent(batch.size()))
                .map(batch -> session.textMessage(patchEncoder.encode(batch))));

        // publishOn keeps frames of one session in arrival order while moving callbacks off the event loop
        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .publishOn(callbackScheduler)
                .doOnNext(frame -> liveCallbackService.dispatchFrame(context, frame))
                .then();

        return Mono.firstWithSignal(input, output)
                .doFinally(signal -> {
                    if (context.close(ContextCloseReason.DISCONNECTED)) {
                        log.info("WebSocket session {} closed ({}), context {} cleaned up", session.getId(), signal, context.getId());
                    }
                });
    }
}
