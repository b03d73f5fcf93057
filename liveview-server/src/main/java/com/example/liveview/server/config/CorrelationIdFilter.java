package com.example.liveview.server.config;

import com.example.liveview.shared.config.LiveViewProperties;
import lombok.RequiredArgsConstructor;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

/**
 * Tags log lines of a request with a correlation id, and live endpoint requests also with the
 * live context they address.
 */
@Component
@RequiredArgsConstructor
public class CorrelationIdFilter implements WebFilter {

    private static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    private static final String CORRELATION_ID_KEY = "correlation_id";
    private static final String LIVE_CONTEXT_KEY = "live_context";

    private final LiveViewProperties liveViewProperties;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isBlank()) {
            correlationId = UUID.randomUUID().toString();
        }
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);

        MDC.put(CORRELATION_ID_KEY, correlationId);
        String contextId = exchange.getRequest().getQueryParams().getFirst("id");
        if (contextId != null && exchange.getRequest().getPath().value().equals(liveViewProperties.getPath())) {
            MDC.put(LIVE_CONTEXT_KEY, contextId);
        }
        return chain.filter(exchange)
                .doFinally(signalType -> {
                    MDC.remove(CORRELATION_ID_KEY);
                    MDC.remove(LIVE_CONTEXT_KEY);
                });
    }
}
