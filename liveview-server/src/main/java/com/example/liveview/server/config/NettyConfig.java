package com.example.liveview.server.config;

import com.example.liveview.shared.config.LiveViewProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.embedded.netty.NettyReactiveWebServerFactory;
import org.springframework.boot.web.server.WebServerFactoryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.socket.server.WebSocketService;
import org.springframework.web.reactive.socket.server.support.HandshakeWebSocketService;
import org.springframework.web.reactive.socket.server.upgrade.ReactorNettyRequestUpgradeStrategy;
import reactor.netty.http.server.WebsocketServerSpec;
import reactor.netty.resources.LoopResources;

/**
 * Netty server threads and the WebSocket upgrade used by the live endpoint.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class NettyConfig {

    private final LiveViewProperties liveViewProperties;

    @Bean
    public WebServerFactoryCustomizer<NettyReactiveWebServerFactory> nettyWebServerCustomizer() {
        return factory -> {
            String threadPrefix = liveViewProperties.getService().getName() + "-io";
            LoopResources loopResources = LoopResources.create(threadPrefix, LoopResources.DEFAULT_IO_WORKER_COUNT, true);
            factory.addServerCustomizers(server -> server.runOn(loopResources));
            log.info("Netty event loops named '{}'", threadPrefix);
        };
    }

    /**
     * Callback frames are small; the frame limit bounds what a misbehaving client can push.
     */
    @Bean
    public WebSocketService webSocketService() {
        LiveViewProperties.Websocket websocket = liveViewProperties.getWebsocket();
        log.info("WebSocket upgrade with max frame payload {} bytes, compression {}",
                websocket.getMaxFramePayloadLength(), websocket.isCompression() ? "on" : "off");
        return new HandshakeWebSocketService(new ReactorNettyRequestUpgradeStrategy(() -> WebsocketServerSpec.builder()
                .maxFramePayloadLength(websocket.getMaxFramePayloadLength())
                .compress(websocket.isCompression())));
    }
}
