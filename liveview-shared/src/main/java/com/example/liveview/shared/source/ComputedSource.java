package com.example.liveview.shared.source;

import com.example.liveview.shared.model.SourceValue;
import lombok.extern.slf4j.Slf4j;
import reactor.core.Disposable;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Source derived from an upstream source. Emits only when the derived value changes.
 * Closing it detaches from the upstream but leaves the upstream open.
 */
@Slf4j
public class ComputedSource<T, R> implements LiveSource<R> {

    private final SerializedEmitter<R> emitter = new SerializedEmitter<>();
    private final Function<? super T, ? extends R> fn;
    private final Disposable upstream;
    private volatile R last;
    private volatile boolean closed;
    private boolean initialized;

    public ComputedSource(LiveSource<T> upstream, Function<? super T, ? extends R> fn) {
        this.fn = Objects.requireNonNull(fn, "fn");
        // A write racing construction is either in the snapshot or delivered to onUpstream,
        // and a delivered value takes precedence over the snapshot.
        this.upstream = upstream.listen(this::onUpstream);
        R snapshot = upstream.current().map(fn).orElse(null);
        synchronized (this) {
            if (!initialized) {
                last = snapshot;
                initialized = true;
            }
        }
    }

    private void onUpstream(SourceValue<T> emission) {
        synchronized (this) {
            if (closed) {
                return;
            }
            if (emission instanceof SourceValue.Present<T> present) {
                if (present.value() == null) {
                    return;
                }
                R derived;
                try {
                    derived = fn.apply(present.value());
                } catch (RuntimeException e) {
                    log.error("Computed source failed to derive value from {}", present.value(), e);
                    return;
                }
                initialized = true;
                if (Objects.equals(derived, last)) {
                    return;
                }
                last = derived;
                emitter.offer(SourceValue.of(derived));
            } else {
                emitter.offer(SourceValue.removed());
            }
        }
        emitter.drain();
    }

    @Override
    public Disposable listen(Consumer<SourceValue<R>> listener) {
        return emitter.subscribe(listener);
    }

    @Override
    public Optional<R> current() {
        return Optional.ofNullable(last);
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
        upstream.dispose();
        emitter.drain();
    }
}
