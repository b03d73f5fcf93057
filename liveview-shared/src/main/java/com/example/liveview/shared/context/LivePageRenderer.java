package com.example.liveview.shared.context;

import com.example.liveview.shared.model.ContextCloseReason;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

import java.io.Writer;
import java.util.Optional;

/**
 * Renders pages inside a fresh live context and decides whether the context is kept.
 */
@Slf4j
@RequiredArgsConstructor
public class LivePageRenderer {

    private final LiveContextDirectory directory;

    /**
     * Returns the context if the page left live components awaiting a connection.
     */
    public Optional<LiveContext> render(PageRenderer page, Writer out) {
        LiveContext context = new LiveContext();
        directory.publish(context);
        if (!context.render(page, out)) {
            context.close(ContextCloseReason.RENDER_FAILED);
            return Optional.empty();
        }
        if (context.getRegistry().sourcedComponentCount() == 0) {
            log.debug("No live components, removing context {}", context.getId());
            context.close(ContextCloseReason.STATIC_PAGE);
            return Optional.empty();
        }
        directory.awaitConnection(context);
        return Optional.of(context);
    }
}
