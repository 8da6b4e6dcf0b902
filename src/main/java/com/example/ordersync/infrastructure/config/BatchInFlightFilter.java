package com.example.ordersync.infrastructure.config;

import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import org.springframework.web.util.pattern.PathPattern;
import org.springframework.web.util.pattern.PathPatternParser;
import reactor.core.publisher.Mono;

/**
 * Counts batch requests between arrival and response so shutdown can wait for them.
 */
@Component
@Order(1)
public class BatchInFlightFilter implements WebFilter {

    private static final PathPattern BATCH_PATHS = PathPatternParser.defaultInstance.parse("/api/order-sync/**");

    private final GracefulShutdownConfig gracefulShutdownConfig;

    public BatchInFlightFilter(GracefulShutdownConfig gracefulShutdownConfig) {
        this.gracefulShutdownConfig = gracefulShutdownConfig;
    }

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!BATCH_PATHS.matches(exchange.getRequest().getPath().pathWithinApplication())) {
            return chain.filter(exchange);
        }
        return Mono.defer(() -> {
            gracefulShutdownConfig.batchStarted();
            return chain.filter(exchange);
        }).doFinally(signal -> gracefulShutdownConfig.batchFinished());
    }
}
