package com.example.liveview.shared.context;

import com.example.liveview.shared.model.ContextCloseReason;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.function.BiConsumer;

/**
 * Process-wide index of live contexts awaiting or holding a connection.
 * Contexts remove themselves from the directory when they close.
 */
@Slf4j
public class LiveContextDirectory {

    private final Map<UUID, LiveContext> contexts = new ConcurrentHashMap<>();
    private final List<BiConsumer<LiveContext, ContextCloseReason>> closeListeners = new CopyOnWriteArrayList<>();
    private final Duration connectTimeout;
    private final Scheduler scheduler;
    private final Clock clock;

    public LiveContextDirectory(Duration connectTimeout, Scheduler scheduler, Clock clock) {
        this.connectTimeout = connectTimeout;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    public void init() {
        log.info("Live context directory started with connect timeout {}", connectTimeout);
    }

    public void publish(LiveContext context) {
        if (contexts.putIfAbsent(context.getId(), context) != null) {
            throw new IllegalStateException("Context " + context.getId() + " is already published");
        }
        context.onClose((closed, reason) -> {
            remove(closed.getId());
            closeListeners.forEach(listener -> listener.accept(closed, reason));
        });
    }

    /**
     * Observes every published context closing, after it has left the directory.
     */
    public void onContextClosed(BiConsumer<LiveContext, ContextCloseReason> listener) {
        closeListeners.add(listener);
    }

    public Optional<LiveContext> lookup(UUID id) {
        return Optional.ofNullable(contexts.get(id));
    }

    public boolean remove(UUID id) {
        return contexts.remove(id) != null;
    }

    /**
     * Starts the connect deadline of a rendered context. The wait is a scheduled task, no
     * thread is held while it runs down.
     */
    public void awaitConnection(LiveContext context) {
        Instant deadline = clock.instant().plus(connectTimeout);
        Disposable timeout = scheduler.schedule(() -> expire(context), connectTimeout.toMillis(), TimeUnit.MILLISECONDS);
        context.armConnectTimeout(deadline, timeout);
    }

    /**
     * Closes every context still unconnected past its deadline. Returns how many were closed.
     */
    public int sweepExpired() {
        Instant now = clock.instant();
        int expired = 0;
        for (LiveContext context : new ArrayList<>(contexts.values())) {
            if (context.isConnectDeadlinePassed(now) && expire(context)) {
                expired++;
            }
        }
        return expired;
    }

    public int size() {
        return contexts.size();
    }

    public void shutdown() {
        log.info("Closing {} live contexts...", contexts.size());
        for (LiveContext context : new ArrayList<>(contexts.values())) {
            context.close(ContextCloseReason.SHUTDOWN);
        }
        contexts.clear();
    }

    private boolean expire(LiveContext context) {
        boolean expired = context.closeIfNotConnected(ContextCloseReason.CONNECT_TIMEOUT);
        if (expired) {
            log.info("Removed context {} that wasn't connected within {}", context.getId(), connectTimeout);
        }
        return expired;
    }
}
