package com.example.liveview.shared.source;

import com.example.liveview.shared.model.SourceValue;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.UnaryOperator;

/**
 * Mutable holder that pushes every write to its listeners.
 */
@Slf4j
public class VariableSource<T> implements LiveSource<T> {

    private final SerializedEmitter<T> emitter = new SerializedEmitter<>();
    private volatile T value;
    private volatile boolean closed;

    public VariableSource(T initial) {
        this.value = initial;
    }

    @Override
    public Disposable listen(Consumer<SourceValue<T>> listener) {
        return emitter.subscribe(listener);
    }

    @Override
    public Optional<T> current() {
        return Optional.ofNullable(value);
    }

    public T get() {
        return value;
    }

    public void set(T next) {
        synchronized (this) {
            if (closed) {
                log.debug("Ignoring write to closed variable source");
                return;
            }
            value = next;
            emitter.offer(SourceValue.of(next));
        }
        emitter.drain();
    }

    public T update(UnaryOperator<T> fn) {
        T next;
        synchronized (this) {
            if (closed) {
                log.debug("Ignoring update of closed variable source");
                return value;
            }
            next = fn.apply(value);
            value = next;
            emitter.offer(SourceValue.of(next));
        }
        emitter.drain();
        return next;
    }

    /**
     * Asks every component bound to this source to remove itself.
     */
    public void remove() {
        synchronized (this) {
            if (closed) {
                return;
            }
            emitter.offer(SourceValue.removed());
        }
        emitter.drain();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            emitter.complete();
        }
        emitter.drain();
    }
}
