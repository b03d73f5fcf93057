package com.example.liveview.shared.source;

import com.example.liveview.shared.model.SourceValue;
import reactor.core.Disposable;

import java.util.Optional;
import java.util.function.Consumer;

/**
 * Push-based producer of values over time.
 * <p>
 * A source handed to a component is owned by it: the component closes the source when it is
 * torn down. State shared between sessions should be registered through a per-render view,
 * see {@link LiveSources#view(LiveSource)}.
 */
public interface LiveSource<T> extends AutoCloseable {

    /**
     * Subscribes to emissions made after this call. Disposing the result unsubscribes.
     */
    Disposable listen(Consumer<SourceValue<T>> listener);

    /**
     * Value used for the initial render, if one is known.
     */
    Optional<T> current();

    /**
     * Releases the source. Calling it more than once has no effect.
     */
    @Override
    void close();
}
