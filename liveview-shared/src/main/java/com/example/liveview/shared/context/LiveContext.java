package com.example.liveview.shared.context;

import com.example.liveview.shared.model.CallbackOutcome;
import com.example.liveview.shared.model.ContextCloseReason;
import com.example.liveview.shared.model.ContextStatus;
import com.example.liveview.shared.model.Patch;
import com.example.liveview.shared.registry.ComponentRegistry;
import com.example.liveview.shared.registry.LiveCallback;
import com.example.liveview.shared.registry.RenderScope;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.io.Writer;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BiConsumer;

/**
 * One browser tab's live session.
 * <p>
 * Patches produced before the transport connects are buffered and flushed in order once it
 * subscribes to {@link #connect()}.
 */
@Slf4j
public class LiveContext {

    @Getter
    private final UUID id;
    @Getter
    private final Instant createdAt;
    @Getter
    private final ComponentRegistry registry;
    private final AtomicReference<ContextStatus> status = new AtomicReference<>(ContextStatus.NOT_CONNECTED);
    private final Sinks.Many<List<Patch>> outbound = Sinks.many().unicast().onBackpressureBuffer();
    private final Sinks.One<ContextCloseReason> closed = Sinks.one();
    private final List<BiConsumer<LiveContext, ContextCloseReason>> closeListeners = new CopyOnWriteArrayList<>();
    private volatile Instant connectDeadline;
    private volatile Disposable connectTimeout;

    public LiveContext() {
        this(UUID.randomUUID(), Instant.now());
    }

    public LiveContext(UUID id, Instant createdAt) {
        this.id = id;
        this.createdAt = createdAt;
        this.registry = new ComponentRegistry(id, this::deliver);
    }

    public ContextStatus getStatus() {
        return status.get();
    }

    public Optional<Instant> getConnectDeadline() {
        return Optional.ofNullable(connectDeadline);
    }

    /**
     * Runs the page with this context as its live context, writing markup to {@code out}.
     * A failing page is logged and reported as {@code false}.
     */
    public boolean render(PageRenderer page, Writer out) {
        try {
            registry.withUpdatesHeld(() -> {
                try (RenderScope scope = registry.rootScope(out)) {
                    page.render(scope);
                }
                return null;
            });
            out.flush();
            return true;
        } catch (Exception e) {
            log.error("Exception while rendering page for context {}", id, e);
            return false;
        }
    }

    /**
     * Marks the context connected and returns its patch stream. Succeeds only once.
     */
    public Flux<List<Patch>> connect() {
        if (!status.compareAndSet(ContextStatus.NOT_CONNECTED, ContextStatus.CONNECTED)) {
            throw new IllegalStateException("Context " + id + " cannot connect while " + status.get());
        }
        Disposable timeout = connectTimeout;
        if (timeout != null) {
            timeout.dispose();
        }
        log.debug("Context {} connected", id);
        return outbound.asFlux();
    }

    public CallbackOutcome dispatchCallback(long callbackId, List<Object> args) {
        if (status.get() == ContextStatus.CLOSED) {
            return CallbackOutcome.NOT_FOUND;
        }
        Optional<LiveCallback> callback = registry.findCallback(callbackId);
        if (callback.isEmpty()) {
            log.warn("Got callback with unrecognized id {} in context {}", callbackId, id);
            return CallbackOutcome.NOT_FOUND;
        }
        try {
            callback.get().invoke(args == null ? List.of() : args);
            return CallbackOutcome.INVOKED;
        } catch (Exception e) {
            log.error("Callback {} in context {} threw", callbackId, id, e);
            return CallbackOutcome.FAILED;
        }
    }

    public void send(List<Patch> patches) {
        registry.emit(patches);
    }

    /**
     * Emits the close reason once the context has been torn down.
     */
    public Mono<ContextCloseReason> whenClosed() {
        return closed.asMono();
    }

    public void onClose(BiConsumer<LiveContext, ContextCloseReason> listener) {
        closeListeners.add(listener);
    }

    /**
     * Closes the context from any state. Returns {@code false} if it was already closed.
     */
    public boolean close(ContextCloseReason reason) {
        if (status.getAndSet(ContextStatus.CLOSED) == ContextStatus.CLOSED) {
            return false;
        }
        teardown(reason);
        return true;
    }

    /**
     * Closes the context only if no transport has connected yet.
     */
    public boolean closeIfNotConnected(ContextCloseReason reason) {
        if (!status.compareAndSet(ContextStatus.NOT_CONNECTED, ContextStatus.CLOSED)) {
            return false;
        }
        teardown(reason);
        return true;
    }

    public boolean isConnectDeadlinePassed(Instant now) {
        Instant deadline = connectDeadline;
        return status.get() == ContextStatus.NOT_CONNECTED && deadline != null && !now.isBefore(deadline);
    }

    void armConnectTimeout(Instant deadline, Disposable timeout) {
        this.connectDeadline = deadline;
        this.connectTimeout = timeout;
        if (status.get() != ContextStatus.NOT_CONNECTED) {
            timeout.dispose();
        }
    }

    private void teardown(ContextCloseReason reason) {
        Disposable timeout = connectTimeout;
        if (timeout != null) {
            timeout.dispose();
        }
        registry.cleanupAll();
        outbound.tryEmitComplete();
        closed.tryEmitValue(reason);
        log.debug("Context {} closed: {}", id, reason);
        for (BiConsumer<LiveContext, ContextCloseReason> listener : closeListeners) {
            try {
                listener.accept(this, reason);
            } catch (RuntimeException e) {
                log.warn("Close listener of context {} failed", id, e);
            }
        }
    }

    private void deliver(List<Patch> batch) {
        if (status.get() == ContextStatus.CLOSED) {
            return;
        }
        Sinks.EmitResult result = outbound.tryEmitNext(batch);
        if (result.isFailure()) {
            log.warn("Failed to queue patch batch for context {}. Result: {}", id, result);
        }
    }
}
