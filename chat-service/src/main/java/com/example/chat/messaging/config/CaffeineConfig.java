package com.example.chat.messaging.config;

import com.example.chat.messaging.translation.TranslationResult;
import com.example.chat.shared.config.AppProperties;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.Caffeine;
import lombok.AllArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Configuration
@AllArgsConstructor
public class CaffeineConfig {

    private final AppProperties appProperties;

    /**
     * Keyed by {@code messageId:language}. Holding the future rather than the value is what
     * lets concurrent requests for the same key share one provider call.
     */
    @Bean
    public AsyncCache<String, TranslationResult> translationResultCache() {
        AppProperties.Translation translation = appProperties.getTranslation();
        return Caffeine.newBuilder()
                .maximumSize(translation.getCacheMaximumSize())
                .expireAfterWrite(Duration.ofMinutes(translation.getCacheExpireAfterWriteMinutes()))
                .recordStats()
                .buildAsync();
    }
}
