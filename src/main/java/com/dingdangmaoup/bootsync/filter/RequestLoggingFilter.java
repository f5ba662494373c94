package com.dingdangmaoup.bootsync.filter;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Logs file transfers and API calls at debug level.
 * Enable by setting: bootsync.logging.request-logging=true
 */
@Slf4j
@Component
@Order(-1)
@ConditionalOnProperty(name = "bootsync.logging.request-logging", havingValue = "true", matchIfMissing = false)
public class RequestLoggingFilter implements WebFilter {

    @Value("${bootsync.logging.include-headers:false}")
    private boolean includeHeaders;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        if (!log.isDebugEnabled()) {
            return chain.filter(exchange);
        }

        ServerHttpRequest request = exchange.getRequest();
        long start = System.nanoTime();
        log.debug("{} {} from {}", request.getMethod(), request.getURI(), request.getRemoteAddress());

        if (includeHeaders) {
            HttpHeaders headers = request.getHeaders();
            headers.forEach((name, values) -> log.debug("  {}: {}", name, String.join(", ", values)));
        }

        return chain.filter(exchange)
                .doOnSuccess(v -> log.debug("{} {} -> {} in {} ms", request.getMethod(), request.getPath().value(),
                        exchange.getResponse().getStatusCode(), (System.nanoTime() - start) / 1_000_000))
                .doOnError(error -> log.error("Request {} {} failed: {}", request.getMethod(),
                        request.getPath().value(), error.getMessage()));
    }
}
