package com.example.chat.messaging.ratelimit;

import com.example.chat.messaging.ratelimit.ChatRateLimiter.Limit;
import com.example.chat.shared.exception.RateLimitedException;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ChatRateLimiterTest {

    private ChatRateLimiter rateLimiter;

    @BeforeEach
    void setUp() {
        RateLimiterConfig typing = RateLimiterConfig.custom()
                .limitForPeriod(2)
                .limitRefreshPeriod(Duration.ofSeconds(10))
                .timeoutDuration(Duration.ZERO)
                .build();
        RateLimiterConfig send = RateLimiterConfig.custom()
                .limitForPeriod(60)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(Duration.ZERO)
                .build();
        rateLimiter = new ChatRateLimiter(RateLimiterRegistry.of(Map.of("typing", typing, "send", send)));
    }

    @Test
    void rejectsOnceTheWindowIsExhausted() {
        rateLimiter.acquire(Limit.TYPING, "user-001");
        rateLimiter.acquire(Limit.TYPING, "user-001");

        assertThatThrownBy(() -> rateLimiter.acquire(Limit.TYPING, "user-001"))
                .isInstanceOfSatisfying(RateLimitedException.class, e -> {
                    assertThat(e.getLimiterName()).isEqualTo("typing");
                    assertThat(e.getRetryAfter()).isEqualTo(Duration.ofSeconds(10));
                });
    }

    @Test
    void limitsAreTrackedPerUserAndPerAction() {
        rateLimiter.acquire(Limit.TYPING, "user-002");
        rateLimiter.acquire(Limit.TYPING, "user-002");

        assertThatCode(() -> rateLimiter.acquire(Limit.TYPING, "user-003")).doesNotThrowAnyException();
        assertThatCode(() -> rateLimiter.acquire(Limit.SEND, "user-002")).doesNotThrowAnyException();
    }
}
