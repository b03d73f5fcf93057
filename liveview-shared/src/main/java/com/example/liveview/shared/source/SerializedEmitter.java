package com.example.liveview.shared.source;

import com.example.liveview.shared.model.SourceValue;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;

import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

/**
 * Multicasts source emissions without holding any lock while listeners run.
 * Emissions from concurrent writers are queued and delivered in offer order by whichever
 * thread currently owns the drain loop.
 */
@Slf4j
class SerializedEmitter<T> {

    private final Sinks.Many<SourceValue<T>> sink = Sinks.many().multicast().directBestEffort();
    private final Queue<SourceValue<T>> pending = new ConcurrentLinkedQueue<>();
    private final AtomicInteger wip = new AtomicInteger();
    private volatile boolean completed;

    Disposable subscribe(Consumer<SourceValue<T>> listener) {
        return sink.asFlux().subscribe(listener);
    }

    /**
     * Queues an emission. Callers that need ordering against their own state must call this
     * while holding the lock that guards that state, and call {@link #drain()} after releasing it.
     */
    void offer(SourceValue<T> emission) {
        pending.offer(emission);
    }

    void complete() {
        completed = true;
    }

    void drain() {
        if (wip.getAndIncrement() != 0) {
            return;
        }
        int missed = 1;
        do {
            SourceValue<T> next;
            while ((next = pending.poll()) != null) {
                Sinks.EmitResult result = sink.tryEmitNext(next);
                if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER
                        && result != Sinks.EmitResult.FAIL_TERMINATED) {
                    log.warn("Failed to emit source value. Result: {}", result);
                }
            }
            if (completed) {
                sink.tryEmitComplete();
            }
            missed = wip.addAndGet(-missed);
        } while (missed != 0);
    }
}
