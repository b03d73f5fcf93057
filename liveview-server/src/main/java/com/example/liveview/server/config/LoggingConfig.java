package com.example.liveview.server.config;

import com.example.liveview.shared.config.LiveViewProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.web.server.WebFilter;

@Configuration
@RequiredArgsConstructor
public class LoggingConfig {

    private static final Logger log = LoggerFactory.getLogger(LoggingConfig.class);

    private final LiveViewProperties liveViewProperties;

    /**
     * Logs every request at debug. Live streams additionally get one info line when they end,
     * since their response status is written long before.
     */
    @Bean
    public WebFilter loggingFilter() {
        return (exchange, chain) -> {
            long startTime = System.currentTimeMillis();
            ServerHttpRequest request = exchange.getRequest();
            String path = request.getPath().value();
            String method = request.getMethod().name();
            String transport = path.equals(liveViewProperties.getPath()) ? transportOf(request) : null;

            if (log.isDebugEnabled()) {
                log.debug("Incoming request: {} {} from {}", method, path, request.getRemoteAddress());
            }

            return chain.filter(exchange)
                .doFinally(signal -> {
                    long duration = System.currentTimeMillis() - startTime;
                    if ("websocket".equals(transport) || "sse".equals(transport)) {
                        log.info("Live {} stream for context {} ended after {}ms ({})",
                            transport,
                            request.getQueryParams().getFirst("id"),
                            duration,
                            signal);
                    } else if (log.isDebugEnabled()) {
                        log.debug("Outgoing response: {} {} - {} in {}ms",
                            method,
                            path,
                            exchange.getResponse().getStatusCode(),
                            duration);
                    }
                });
        };
    }

    private static String transportOf(ServerHttpRequest request) {
        if (HttpMethod.POST.equals(request.getMethod())) {
            return "post";
        }
        if ("websocket".equalsIgnoreCase(request.getHeaders().getUpgrade())) {
            return "websocket";
        }
        return request.getHeaders().getAccept().contains(MediaType.TEXT_EVENT_STREAM) ? "sse" : "http";
    }
}
