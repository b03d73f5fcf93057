package com.example.liveview.server.service;

import com.example.liveview.shared.model.Patch;
import lombok.RequiredArgsConstructor;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.stereotype.Component;

import java.time.OffsetDateTime;
import java.util.List;

@Component
@RequiredArgsConstructor
public class LiveEventFactory {

    private final PatchEncoder patchEncoder;

    /**
     * One patch batch as a plain {@code data:} event.
     */
    public ServerSentEvent<String> createPatchEvent(List<Patch> batch) {
        return ServerSentEvent.<String>builder()
                .data(patchEncoder.encode(batch))
                .build();
    }

    /**
     * Comment-only event, ignored by EventSource but keeps proxies from closing an idle stream.
     */
    public ServerSentEvent<String> createHeartbeatEvent() {
        return ServerSentEvent.<String>builder()
                .comment("heartbeat " + OffsetDateTime.now())
                .build();
    }
}
