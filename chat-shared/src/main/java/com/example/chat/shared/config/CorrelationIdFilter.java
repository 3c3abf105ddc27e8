package com.example.chat.shared.config;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Tags every HTTP request and WebSocket upgrade with a correlation id. A client-supplied
 * {@value #CORRELATION_ID_HEADER} is reused when it is a plain token of at most
 * {@value #MAX_LENGTH} characters; anything else is replaced by a fresh UUID.
 *
 * <p>The id is echoed on the response, stored as an exchange attribute and in the Reactor
 * context under {@value #CORRELATION_ID_KEY}, and set in the MDC for the subscribing thread.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter implements WebFilter {

    public static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
    public static final String CORRELATION_ID_KEY = "correlation_id";

    private static final int MAX_LENGTH = 64;
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9._-]+");

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = resolve(exchange.getRequest().getHeaders().getFirst(CORRELATION_ID_HEADER));
        exchange.getResponse().getHeaders().set(CORRELATION_ID_HEADER, correlationId);
        exchange.getAttributes().put(CORRELATION_ID_KEY, correlationId);

        return Mono.defer(() -> {
                    MDC.put(CORRELATION_ID_KEY, correlationId);
                    return chain.filter(exchange);
                })
                .contextWrite(ctx -> ctx.put(CORRELATION_ID_KEY, correlationId))
                .doFinally(signal -> MDC.remove(CORRELATION_ID_KEY));
    }

    static String resolve(String supplied) {
        if (supplied != null) {
            String trimmed = supplied.trim();
            if (!trimmed.isEmpty() && trimmed.length() <= MAX_LENGTH && SAFE_ID.matcher(trimmed).matches()) {
                return trimmed;
            }
        }
        return UUID.randomUUID().toString();
    }
}
