package com.example.liveview.shared.source;

import com.example.liveview.shared.model.SourceValue;
import org.reactivestreams.Publisher;
import reactor.core.Disposable;
import reactor.core.Disposables;

import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

public final class LiveSources {

    private LiveSources() {}

    public static <T> VariableSource<T> variable(T initial) {
        return new VariableSource<>(initial);
    }

    public static <T, R> ComputedSource<T, R> computed(LiveSource<T> upstream, Function<? super T, ? extends R> fn) {
        return new ComputedSource<>(upstream, fn);
    }

    /**
     * Per-render view of a shared source. Closing the view leaves the shared source open.
     */
    public static <T> ComputedSource<T, T> view(LiveSource<T> shared) {
        return new ComputedSource<>(shared, Function.identity());
    }

    public static <T> PublisherSource<T> fromPublisher(Publisher<T> publisher) {
        return new PublisherSource<>(publisher);
    }

    public static <T> PublisherSource<T> fromPublisher(Publisher<T> publisher, T initial) {
        return new PublisherSource<>(publisher, initial);
    }

    /**
     * Source that never emits.
     */
    public static <T> LiveSource<T> constant(T value) {
        return new LiveSource<>() {
            @Override
            public Disposable listen(Consumer<SourceValue<T>> listener) {
                return Disposables.disposed();
            }

            @Override
            public Optional<T> current() {
                return Optional.ofNullable(value);
            }

            @Override
            public void close() {
            }
        };
    }
}
