package com.example.liveview.server.service;

import com.example.liveview.server.config.MonitoringConfig.LiveViewMetrics;
import com.example.liveview.shared.config.LiveViewProperties;
import com.example.liveview.shared.context.LiveContext;
import com.example.liveview.shared.model.ContextCloseReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Flux;

/**
 * Half-duplex fallback: patches are pushed as server-sent events, callbacks arrive through the
 * POST endpoint.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LiveSseService {

    private final LiveEventFactory liveEventFactory;
    private final LiveViewProperties liveViewProperties;
    private final LiveViewMetrics liveViewMetrics;

    public Flux<ServerSentEvent<String>> createEventStream(LiveContext context) {
        Flux<ServerSentEvent<String>> patches;
        try {
            patches = context.connect()
                    .doOnNext(batch -> liveViewMetrics.patchesSent(batch.size()))
                    .map(liveEventFactory::createPatchEvent);
        } catch (IllegalStateException e) {
            log.warn("Rejecting event stream: {}", e.getMessage());
            return Flux.error(new ResponseStatusException(HttpStatus.CONFLICT, e.getMessage()));
        }
        log.debug("Connected context {} over Server-Sent Events", context.getId());

        Flux<ServerSentEvent<String>> heartbeats = Flux.interval(liveViewProperties.getSse().getHeartbeatInterval())
                .map(tick -> liveEventFactory.createHeartbeatEvent());

        return Flux.merge(patches, heartbeats)
                .takeUntilOther(context.whenClosed())
                .doFinally(signal -> {
                    if (context.close(ContextCloseReason.DISCONNECTED)) {
                        log.info("Event stream ended ({}), context {} cleaned up", signal, context.getId());
                    }
                });
    }
}
