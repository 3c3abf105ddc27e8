package com.example.chat.messaging.auth;

import com.example.chat.shared.dto.ErrorResponse;
import com.example.chat.shared.exception.AuthenticationFailureException;
import com.example.chat.shared.exception.ErrorCode;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.buffer.DataBuffer;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.server.reactive.ServerHttpResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;


/**
 * Authenticates every {@code /api} request and exposes the caller's id as the
 * {@value #USER_ID_ATTRIBUTE} exchange attribute.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
@Slf4j
@RequiredArgsConstructor
public class BearerTokenAuthenticationFilter implements WebFilter {

    public static final String USER_ID_ATTRIBUTE = "chat.userId";
    private static final String BEARER_PREFIX = "Bearer ";

    private final ChatAuthenticator authenticator;
    private final Scheduler jdbcScheduler;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String path = exchange.getRequest().getPath().pathWithinApplication().value();
        if (!path.startsWith("/api/")) {
            return chain.filter(exchange);
        }
        String token = bearerToken(exchange.getRequest().getHeaders().getFirst(HttpHeaders.AUTHORIZATION));
        return Mono.fromCallable(() -> authenticator.authenticate(token))
                .subscribeOn(jdbcScheduler)
                .flatMap(userId -> {
                    exchange.getAttributes().put(USER_ID_ATTRIBUTE, userId);
                    return chain.filter(exchange);
                })
                .onErrorResume(AuthenticationFailureException.class, e -> reject(exchange, path, e));
    }

    static String bearerToken(String header) {
        if (header == null || !header.regionMatches(true, 0, BEARER_PREFIX, 0, BEARER_PREFIX.length())) {
            return null;
        }
        return header.substring(BEARER_PREFIX.length()).trim();
    }

    private Mono<Void> reject(ServerWebExchange exchange, String path, AuthenticationFailureException e) {
        log.warn("Rejected request to {}: {}", path, e.getMessage());
        ServerHttpResponse response = exchange.getResponse();
        ErrorCode code = ErrorCode.AUTHENTICATION_FAILED;
        ErrorResponse body = ErrorResponse.of(code, e.getMessage(), path);
        response.setStatusCode(code.getHttpStatus());
        response.getHeaders().setContentType(MediaType.APPLICATION_JSON);
        response.getHeaders().set(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        byte[] bytes;
        try {
            bytes = objectMapper.writeValueAsBytes(body);
        } catch (JsonProcessingException ex) {
            return Mono.error(ex);
        }
        DataBuffer buffer = response.bufferFactory().wrap(bytes);
        return response.writeWith(Mono.just(buffer));
    }
}
