package com.example.liveview.server.service;

import com.example.liveview.shared.config.LiveViewProperties;
import com.example.liveview.shared.context.LiveContext;
import com.example.liveview.shared.context.LivePageRenderer;
import com.example.liveview.shared.context.PageRenderer;
import com.example.liveview.shared.util.LiveScripts;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.core.io.buffer.DataBufferFactory;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Streams a page as it renders, off the event loop, and appends the connect script when the
 * page left live components behind.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class LivePageService {

    private final LivePageRenderer livePageRenderer;
    private final LiveViewProperties liveViewProperties;

    public Flux<DataBuffer> renderPage(PageRenderer page, DataBufferFactory bufferFactory) {
        return Flux.from(DataBufferUtils.outputStreamPublisher(
                outputStream -> {
                    try (Writer out = new OutputStreamWriter(outputStream, StandardCharsets.UTF_8)) {
                        Optional<LiveContext> context = livePageRenderer.render(page, out);
                        if (context.isPresent()) {
                            out.write(LiveScripts.connectScript(liveViewProperties.getPath(), context.get().getId()));
                            log.debug("Rendered live page for context {}", context.get().getId());
                        }
                    } catch (IOException e) {
                        throw new UncheckedIOException("Failed to write page", e);
                    }
                },
                bufferFactory,
                Schedulers.boundedElastic()::schedule));
    }
}
