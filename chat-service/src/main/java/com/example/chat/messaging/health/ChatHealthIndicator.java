package com.example.chat.messaging.health;

import com.example.chat.messaging.session.SessionRegistry;
import com.example.chat.messaging.translation.TranslationCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Reports live sessions on this node and translation cache statistics.
 */
@Component
@RequiredArgsConstructor
public class ChatHealthIndicator implements HealthIndicator {

    private final SessionRegistry sessionRegistry;
    private final TranslationCache translationCache;

    @Override
    public Health health() {
        Map<String, Object> details = new LinkedHashMap<>();
        boolean sessionsHealthy = checkSessions(details);
        boolean cacheHealthy = checkTranslationCache(details);
        Health.Builder builder = sessionsHealthy && cacheHealthy ? Health.up() : Health.down();
        return builder.withDetails(details).build();
    }

    private boolean checkSessions(Map<String, Object> details) {
        try {
            details.put("connectedUsers", sessionRegistry.registeredCount());
            details.put("sessionStatus", "UP");
            return true;
        } catch (RuntimeException e) {
            details.put("sessionStatus", "DOWN");
            details.put("sessionError", e.getMessage());
            return false;
        }
    }

    private boolean checkTranslationCache(Map<String, Object> details) {
        try {
            CacheStats stats = translationCache.stats();
            Map<String, Object> cache = new LinkedHashMap<>();
            cache.put("size", translationCache.estimatedSize());
            cache.put("hitCount", stats.hitCount());
            cache.put("missCount", stats.missCount());
            cache.put("hitRate", stats.hitRate());
            cache.put("evictionCount", stats.evictionCount());
            details.put("translationCache", cache);
            details.put("cacheStatus", "UP");
            return true;
        } catch (RuntimeException e) {
            details.put("cacheStatus", "DOWN");
            details.put("cacheError", e.getMessage());
            return false;
        }
    }
}
