package com.example.liveview.shared.source;

import com.example.liveview.shared.model.SourceValue;
import org.junit.jupiter.api.Test;
import reactor.core.Disposable;
import reactor.core.publisher.Sinks;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class LiveSourcesTest {

    @Test
    void variableNotifiesEveryWrite() {
        VariableSource<Integer> source = LiveSources.variable(1);
        List<SourceValue<Integer>> seen = new CopyOnWriteArrayList<>();
        source.listen(seen::add);

        source.set(2);
        assertEquals(3, source.update(v -> v + 1));

        assertThat(seen, contains(SourceValue.of(2), SourceValue.of(3)));
        assertEquals(Optional.of(3), source.current());
    }

    @Test
    void variableIgnoresWritesAfterClose() {
        VariableSource<String> source = LiveSources.variable("a");
        List<SourceValue<String>> seen = new CopyOnWriteArrayList<>();
        source.listen(seen::add);

        source.close();
        source.set("b");
        source.remove();

        assertTrue(source.isClosed());
        assertEquals("a", source.get());
        assertThat(seen, empty());
    }

    @Test
    void variableListenerMayWriteBack() {
        // A listener writing to the source it listens to must not recurse.
        VariableSource<Integer> source = LiveSources.variable(0);
        List<Integer> seen = new CopyOnWriteArrayList<>();
        source.listen(v -> {
            int value = ((SourceValue.Present<Integer>) v).value();
            seen.add(value);
            if (value < 3) {
                source.set(value + 1);
            }
        });

        source.set(1);

        assertThat(seen, contains(1, 2, 3));
    }

    @Test
    void computedEmitsOnlyChanges() {
        VariableSource<Integer> upstream = LiveSources.variable(2);
        ComputedSource<Integer, Boolean> even = LiveSources.computed(upstream, v -> v % 2 == 0);
        List<SourceValue<Boolean>> seen = new CopyOnWriteArrayList<>();
        even.listen(seen::add);

        assertEquals(Optional.of(true), even.current());
        upstream.set(4);
        upstream.set(5);
        upstream.set(7);
        upstream.set(8);

        assertThat(seen, contains(SourceValue.of(false), SourceValue.of(true)));
    }

    @Test
    void computedForwardsRemoval() {
        VariableSource<Integer> upstream = LiveSources.variable(1);
        ComputedSource<Integer, String> text = LiveSources.computed(upstream, String::valueOf);
        List<SourceValue<String>> seen = new CopyOnWriteArrayList<>();
        text.listen(seen::add);

        upstream.remove();

        assertEquals(1, seen.size());
        assertThat(seen.get(0), instanceOf(SourceValue.Removed.class));
    }

    @Test
    void closingViewLeavesSharedSourceOpen() {
        VariableSource<Integer> shared = LiveSources.variable(1);
        ComputedSource<Integer, Integer> view = LiveSources.view(shared);
        List<SourceValue<Integer>> seen = new CopyOnWriteArrayList<>();
        view.listen(seen::add);

        view.close();
        shared.set(2);

        assertThat(seen, empty());
        assertEquals(false, shared.isClosed());
        assertEquals(Optional.of(2), shared.current());
    }

    @Test
    void publisherCompletionSignalsRemoval() {
        Sinks.Many<String> sink = Sinks.many().multicast().directBestEffort();
        PublisherSource<String> source = LiveSources.fromPublisher(sink.asFlux(), "initial");
        List<SourceValue<String>> seen = new CopyOnWriteArrayList<>();
        source.listen(seen::add);

        assertEquals(Optional.of("initial"), source.current());
        sink.tryEmitNext("next");
        sink.tryEmitComplete();

        assertEquals(2, seen.size());
        assertEquals(SourceValue.of("next"), seen.get(0));
        assertThat(seen.get(1), instanceOf(SourceValue.Removed.class));
        assertEquals(Optional.of("next"), source.current());
    }

    @Test
    void publisherErrorSignalsRemoval() {
        Sinks.Many<String> sink = Sinks.many().multicast().directBestEffort();
        PublisherSource<String> source = LiveSources.fromPublisher(sink.asFlux());
        List<SourceValue<String>> seen = new CopyOnWriteArrayList<>();
        source.listen(seen::add);

        sink.tryEmitError(new IllegalStateException("boom"));

        assertEquals(1, seen.size());
        assertThat(seen.get(0), instanceOf(SourceValue.Removed.class));
    }

    @Test
    void closingPublisherSourceCancelsSubscriptions() {
        Sinks.Many<String> sink = Sinks.many().multicast().directBestEffort();
        PublisherSource<String> source = LiveSources.fromPublisher(sink.asFlux());
        List<SourceValue<String>> seen = new CopyOnWriteArrayList<>();
        Disposable subscription = source.listen(seen::add);

        source.close();
        sink.tryEmitNext("late");

        assertTrue(subscription.isDisposed());
        assertThat(seen, empty());
    }

    @Test
    void constantNeverEmits() {
        LiveSource<String> source = LiveSources.constant("fixed");
        List<SourceValue<String>> seen = new CopyOnWriteArrayList<>();

        Disposable subscription = source.listen(seen::add);
        source.close();

        assertTrue(subscription.isDisposed());
        assertEquals(Optional.of("fixed"), source.current());
        assertThat(seen, empty());
    }

    @Test
    void computedSeesWriteRacingItsConstruction() {
        VariableSource<Integer> shared = LiveSources.variable(0);
        AtomicBoolean raced = new AtomicBoolean();
        LiveSource<Integer> racing = new LiveSource<>() {
            @Override
            public Disposable listen(Consumer<SourceValue<Integer>> listener) {
                return shared.listen(listener);
            }

            @Override
            public Optional<Integer> current() {
                Optional<Integer> snapshot = shared.current();
                if (raced.compareAndSet(false, true)) {
                    shared.set(1);
                }
                return snapshot;
            }

            @Override
            public void close() {
                shared.close();
            }
        };

        ComputedSource<Integer, Integer> view = LiveSources.view(racing);

        assertEquals(Optional.of(1), shared.current());
        assertEquals(Optional.of(1), view.current());
    }
}
