package com.example.liveview.server.controller;

import com.example.liveview.shared.context.LiveContext;
import com.example.liveview.shared.context.LiveContextDirectory;
import com.example.liveview.shared.context.LivePageRenderer;
import com.example.liveview.shared.context.PageRenderer;
import com.example.liveview.shared.model.ContextStatus;
import com.example.liveview.shared.registry.ComponentDefinition;
import com.example.liveview.shared.registry.LiveCallback;
import com.example.liveview.shared.registry.RenderScope;
import com.example.liveview.shared.source.LiveSources;
import com.example.liveview.shared.source.VariableSource;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.MediaType;
import org.springframework.test.web.reactive.server.WebTestClient;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.client.ReactorNettyWebSocketClient;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.io.StringWriter;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;

import static org.awaitility.Awaitility.await;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class LiveConnectionControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @Autowired
    private LivePageRenderer livePageRenderer;

    @Autowired
    private LiveContextDirectory liveContextDirectory;

    @LocalServerPort
    private int port;

    @Test
    void postToUnknownContextIsNotFound() {
        webTestClient.post().uri("/__live?id=" + UUID.randomUUID())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("[0]")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody(String.class).isEqualTo("No such live context");
    }

    @Test
    void postWithInvalidContextIdIsNotFound() {
        webTestClient.post().uri("/__live?id=not-a-uuid")
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("[0]")
                .exchange()
                .expectStatus().isNotFound();
    }

    @Test
    void postInvokesCallbackWithArguments() {
        List<Object> received = new CopyOnWriteArrayList<>();
        AtomicLong callbackId = new AtomicLong();
        LiveContext context = render(scope -> {
            live(scope);
            callbackId.set(scope.callback(received::addAll).id());
        });

        webTestClient.post().uri("/__live?id=" + context.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("[" + callbackId.get() + ",\"text\",42]")
                .exchange()
                .expectStatus().isOk();

        assertThat(received, contains("text", 42));
    }

    @Test
    void postReportsUnknownAndFailingCallbacks() {
        AtomicLong failing = new AtomicLong();
        LiveContext context = render(scope -> {
            live(scope);
            failing.set(scope.callback(LiveCallback.of(() -> {
                throw new IllegalStateException("callback bug");
            })).id());
        });

        webTestClient.post().uri("/__live?id=" + context.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("[999]")
                .exchange()
                .expectStatus().isNotFound()
                .expectBody(String.class).isEqualTo("Unknown callback");

        webTestClient.post().uri("/__live?id=" + context.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("[" + failing.get() + "]")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody(String.class).isEqualTo("Callback failed");
    }

    @Test
    void postWithMalformedBodyIsBadRequest() {
        LiveContext context = render(LiveConnectionControllerTest::live);

        webTestClient.post().uri("/__live?id=" + context.getId())
                .contentType(MediaType.APPLICATION_JSON)
                .bodyValue("{\"callback\":1}")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.status").isEqualTo(400);
    }

    @Test
    void eventStreamFlushesBufferedPatches() {
        VariableSource<Integer> counter = LiveSources.variable(0);
        LiveContext context = render(scope ->
                scope.component(ComponentDefinition.markup(LiveSources.view(counter), (s, v) -> s.write("n=" + v))));
        counter.set(5);

        Flux<String> events = webTestClient.get().uri("/__live?id=" + context.getId())
                .accept(MediaType.TEXT_EVENT_STREAM)
                .exchange()
                .expectStatus().isOk()
                .returnResult(String.class)
                .getResponseBody();

        StepVerifier.create(events)
                .assertNext(data -> assertThat(data, containsString("\"payload\":\"n=5\"")))
                .then(() -> counter.set(6))
                .assertNext(data -> assertThat(data, containsString("\"payload\":\"n=6\"")))
                .thenCancel()
                .verify(Duration.ofSeconds(10));
    }

    @Test
    void webSocketCarriesPatchesAndCallbacks() {
        VariableSource<Integer> counter = LiveSources.variable(0);
        AtomicLong increment = new AtomicLong();
        LiveContext context = render(scope -> {
            scope.component(ComponentDefinition.markup(LiveSources.view(counter), (s, v) -> s.write("n=" + v)));
            increment.set(scope.callback(LiveCallback.of(() -> counter.update(v -> v + 1))).id());
        });
        List<String> frames = new CopyOnWriteArrayList<>();

        new ReactorNettyWebSocketClient()
                .execute(URI.create("ws://localhost:" + port + "/__live?id=" + context.getId()), session -> session
                        .send(Mono.just(session.textMessage(increment.get() + ":[]")))
                        .and(session.receive()
                                .map(WebSocketMessage::getPayloadAsText)
                                .doOnNext(frames::add)
                                .take(1)
                                .then()))
                .block(Duration.ofSeconds(10));

        assertThat(frames, hasSize(1));
        assertThat(frames.get(0), containsString("\"payload\":\"n=1\""));
        await().atMost(Duration.ofSeconds(5)).until(() -> liveContextDirectory.lookup(context.getId()).isEmpty());
        assertEquals(ContextStatus.CLOSED, context.getStatus());
    }

    @Test
    void demoPageEmbedsConnectScript() {
        int before = liveContextDirectory.size();

        String page = webTestClient.get().uri("/")
                .accept(MediaType.TEXT_HTML)
                .exchange()
                .expectStatus().isOk()
                .expectBody(String.class)
                .returnResult()
                .getResponseBody();

        assertThat(page, containsString("window._rl.connect(\"/__live\""));
        assertTrue(liveContextDirectory.size() > before);
    }

    @Test
    void healthReportsLiveContexts() {
        webTestClient.get().uri("/actuator/health")
                .header("X-Correlation-ID", "health-check")
                .exchange()
                .expectStatus().isOk()
                .expectHeader().valueEquals("X-Correlation-ID", "health-check")
                .expectBody()
                .jsonPath("$.status").isEqualTo("UP")
                .jsonPath("$.components.liveView.details.liveContexts").isNumber();
    }

    private LiveContext render(PageRenderer page) {
        return livePageRenderer.render(page, new StringWriter()).orElseThrow();
    }

    private static void live(RenderScope scope) throws Exception {
        scope.component(ComponentDefinition.markup(LiveSources.variable("x"), (s, v) -> s.write(v)));
    }
}
