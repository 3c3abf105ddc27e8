package com.example.chat.shared.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.http.server.reactive.MockServerHttpRequest;
import org.springframework.mock.web.server.MockServerWebExchange;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    @DisplayName("A well-formed client id is echoed and visible in the Reactor context")
    void reusesClientId() {
        MockServerWebExchange exchange = MockServerWebExchange.from(MockServerHttpRequest.get("/api/conversations")
                .header(CorrelationIdFilter.CORRELATION_ID_HEADER, " req-42.a_b ")
                .build());
        AtomicReference<String> seen = new AtomicReference<>();
        WebFilterChain chain = ex -> Mono.deferContextual(ctx -> {
            seen.set(ctx.get(CorrelationIdFilter.CORRELATION_ID_KEY));
            return Mono.empty();
        });

        filter.filter(exchange, chain).block();

        assertThat(seen.get()).isEqualTo("req-42.a_b");
        assertThat(exchange.getResponse().getHeaders().getFirst(CorrelationIdFilter.CORRELATION_ID_HEADER)).isEqualTo("req-42.a_b");
        assertThat((String) exchange.getAttribute(CorrelationIdFilter.CORRELATION_ID_KEY)).isEqualTo("req-42.a_b");
    }

    @Test
    @DisplayName("Missing, oversized or unsafe ids are replaced by a UUID")
    void replacesUnusableIds() {
        assertThat(CorrelationIdFilter.resolve(null)).hasSize(36);
        assertThat(CorrelationIdFilter.resolve("   ")).hasSize(36);
        assertThat(CorrelationIdFilter.resolve("x".repeat(65))).hasSize(36);
        assertThat(CorrelationIdFilter.resolve("bad\r\nheader")).hasSize(36).doesNotContain("bad");
        assertThat(CorrelationIdFilter.resolve("x".repeat(64))).isEqualTo("x".repeat(64));
    }
}
