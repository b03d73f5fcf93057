package com.example.liveview.shared.source;

import com.example.liveview.shared.model.SourceValue;
import lombok.extern.slf4j.Slf4j;
import org.reactivestreams.Publisher;
import reactor.core.Disposable;
import reactor.core.Disposables;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Adapts a Reactive Streams publisher. Completion of the publisher removes the bound component.
 */
@Slf4j
public class PublisherSource<T> implements LiveSource<T> {

    private final Publisher<T> publisher;
    private final AtomicReference<T> latest = new AtomicReference<>();
    private final Disposable.Composite subscriptions = Disposables.composite();

    public PublisherSource(Publisher<T> publisher) {
        this.publisher = publisher;
    }

    public PublisherSource(Publisher<T> publisher, T initial) {
        this(publisher);
        latest.set(initial);
    }

    @Override
    public Disposable listen(Consumer<SourceValue<T>> listener) {
        Disposable subscription = Flux.from(publisher)
                .doOnNext(latest::set)
                .map(SourceValue::of)
                .onErrorResume(e -> {
                    log.warn("Publisher source failed, removing bound component: {}", e.getMessage());
                    return Mono.empty();
                })
                .concatWith(Mono.fromSupplier(SourceValue::removed))
                .subscribe(listener);
        subscriptions.add(subscription);
        return subscription;
    }

    @Override
    public Optional<T> current() {
        return Optional.ofNullable(latest.get());
    }

    @Override
    public void close() {
        subscriptions.dispose();
    }
}
