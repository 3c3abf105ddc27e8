package com.example.chat.messaging.ratelimit;

import com.example.chat.shared.exception.RateLimitedException;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Per-user rate limits. Each (limit, user) pair gets its own limiter built from the named
 * configuration under {@code resilience4j.ratelimiter.configs}.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ChatRateLimiter {

    private final RateLimiterRegistry rateLimiterRegistry;

    public void acquire(Limit limit, String userId) {
        RateLimiter limiter = rateLimiterRegistry.rateLimiter(limit.configName() + ":" + userId, limit.configName());
        if (!limiter.acquirePermission()) {
            log.warn("Rate limit '{}' exceeded for user {}", limit.configName(), userId);
            throw new RateLimitedException(limit.configName(), limiter.getRateLimiterConfig().getLimitRefreshPeriod());
        }
    }

    public enum Limit {
        SEND("send"),
        TYPING("typing"),
        REACTION("reaction"),
        TRANSLATE("translate"),
        SPEECH("speech");

        private final String configName;

        Limit(String configName) {
            this.configName = configName;
        }

        public String configName() {
            return configName;
        }
    }
}
