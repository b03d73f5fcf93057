package com.example.liveview.server.controller;

import com.example.liveview.server.service.LiveCallbackService;
import com.example.liveview.server.service.LiveSseService;
import com.example.liveview.server.service.LiveWebSocketHandler;
import com.example.liveview.shared.context.LiveContext;
import com.example.liveview.shared.context.LiveContextDirectory;
import com.example.liveview.shared.exception.ContextNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.util.UUID;

/**
 * The single live endpoint. GET upgrades to WebSocket when asked to and otherwise serves
 * Server-Sent Events; POST delivers one callback invocation.
 */
@RestController
@Slf4j
public class LiveConnectionController {

    private final LiveContextDirectory liveContextDirectory;
    private final WebSocketService webSocketService;
    private final LiveWebSocketHandler liveWebSocketHandler;
    private final LiveSseService liveSseService;
    private final LiveCallbackService liveCallbackService;
    private final Scheduler callbackScheduler;

    public LiveConnectionController(LiveContextDirectory liveContextDirectory,
                                    WebSocketService webSocketService,
                                    LiveWebSocketHandler liveWebSocketHandler,
                                    LiveSseService liveSseService,
                                    LiveCallbackService liveCallbackService,
                                    @Qualifier("callbackScheduler") Scheduler callbackScheduler) {
        this.liveContextDirectory = liveContextDirectory;
        this.webSocketService = webSocketService;
        this.liveWebSocketHandler = liveWebSocketHandler;
        this.liveSseService = liveSseService;
        this.liveCallbackService = liveCallbackService;
        this.callbackScheduler = callbackScheduler;
    }

    @GetMapping(value = "${liveview.path:/__live}", headers = "Upgrade=websocket")
    public Mono<Void> connectWebSocket(@RequestParam("id") String id, ServerWebExchange exchange) {
        LiveContext context = findContext(id);
        log.info("[CONNECT_START] WebSocket connection request for context '{}'", context.getId());
        return webSocketService.handleRequest(exchange, session -> liveWebSocketHandler.handle(session, context));
    }

    @GetMapping(value = "${liveview.path:/__live}", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<String>> connectEventStream(@RequestParam("id") String id) {
        LiveContext context = findContext(id);
        log.info("[CONNECT_START] SSE connection request for context '{}'", context.getId());
        return liveSseService.createEventStream(context);
    }

    @PostMapping(value = "${liveview.path:/__live}", produces = MediaType.TEXT_PLAIN_VALUE)
    public Mono<ResponseEntity<String>> invokeCallback(@RequestParam("id") String id, @RequestBody String body) {
        LiveContext context = findContext(id);
        return Mono.fromCallable(() -> liveCallbackService.dispatchBody(context, body))
                .subscribeOn(callbackScheduler)
                .map(outcome -> switch (outcome) {
                    case INVOKED -> ResponseEntity.ok("");
                    case NOT_FOUND -> ResponseEntity.status(HttpStatus.NOT_FOUND).body("Unknown callback");
                    case FAILED -> ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body("Callback failed");
                });
    }

    private LiveContext findContext(String id) {
        UUID contextId;
        try {
            contextId = UUID.fromString(id);
        } catch (IllegalArgumentException e) {
            throw new ContextNotFoundException(id);
        }
        return liveContextDirectory.lookup(contextId)
                .orElseThrow(() -> new ContextNotFoundException(id));
    }
}
