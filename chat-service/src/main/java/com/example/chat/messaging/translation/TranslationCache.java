package com.example.chat.messaging.translation;

import com.example.chat.messaging.store.MessageStore;
import com.example.chat.shared.aspect.Monitored;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig;
import com.example.chat.shared.exception.ValidationFailureException;
import com.example.chat.shared.model.Message;
import com.example.chat.shared.model.MessageTranslation;
import com.example.chat.shared.util.Constants;
import com.github.benmanes.caffeine.cache.AsyncCache;
import com.github.benmanes.caffeine.cache.stats.CacheStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Message translation with three layers: translations already stored on the message, an
 * in-memory map of in-flight and recent provider calls, then the provider itself.
 * A provider failure yields the original text flagged as a fallback and leaves nothing
 * behind in either layer.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@Monitored("translation")
public class TranslationCache {

    private final AsyncCache<String, TranslationResult> resultCache;
    private final TranslationProvider translationProvider;
    private final MessageStore messageStore;
    private final Scheduler jdbcScheduler;
    private final AppProperties appProperties;
    private final MonitoringConfig.ChatMetricsCollector metricsCollector;

    public Mono<TranslationResult> getOrTranslate(Message message, String targetLanguage) {
        Language target = Language.fromId(targetLanguage)
                .orElse(null);
        if (target == null) {
            return Mono.error(new ValidationFailureException("Unsupported target language: " + targetLanguage));
        }
        String original = message.getOriginalText() == null ? "" : message.getOriginalText();
        if (target.getId().equals(message.getOriginalLanguage()) || original.isBlank()) {
            return Mono.just(TranslationResult.unchanged(original, target.getId()));
        }

        MessageTranslation stored = message.getTranslations().get(target.getId());
        if (stored != null) {
            metricsCollector.incrementCounter("chat.translation.calls", "result", "stored");
            return Mono.just(new TranslationResult(stored.getText(), target.getId(), stored.getConfidence(), false, true));
        }

        String key = cacheKey(message, target);
        // one waiter cancelling must not cancel the shared call
        return Mono.fromFuture(() -> resultCache.get(key, (k, executor) -> load(message, target).toFuture()), true)
                .onErrorResume(e -> {
                    log.warn("Translation of message {} to {} fell back to the original: {}",
                            message.getId(), target.getId(), e.getMessage());
                    metricsCollector.incrementCounter("chat.translation.calls", "result", "fallback");
                    return Mono.just(TranslationResult.fallback(original, target.getId()));
                });
    }

    /**
     * Drops every cached result for the message. Called after an edit.
     */
    public void invalidate(Long messageId) {
        String prefix = messageId + ":";
        resultCache.synchronous().asMap().keySet().removeIf(key -> key.startsWith(prefix));
    }

    public CacheStats stats() {
        return resultCache.synchronous().stats();
    }

    public long estimatedSize() {
        return resultCache.synchronous().estimatedSize();
    }

    // the edit count keeps results for an older text from matching the current one
    private static String cacheKey(Message message, Language target) {
        return message.getId() + ":" + message.getEditHistory().size() + ":" + target.getId();
    }

    private Mono<TranslationResult> load(Message message, Language target) {
        String sourceCode = Language.fromId(message.getOriginalLanguage())
                .map(Language::getCode)
                .orElse(Constants.AUTO_LANGUAGE);
        Duration timeout = Duration.ofMillis(appProperties.getTranslation().getTimeoutMs());
        log.debug("Translating message {} from {} to {}", message.getId(), sourceCode, target.getCode());
        return translationProvider.translate(message.getOriginalText(), sourceCode, target.getCode())
                .timeout(timeout)
                .flatMap(translated -> Mono.fromCallable(() -> messageStore.addTranslation(
                                message.getId(), target.getId(), message.getOriginalText(), translated.text(), translated.confidence()))
                        .subscribeOn(jdbcScheduler))
                .map(saved -> {
                    metricsCollector.incrementCounter("chat.translation.calls", "result", "success");
                    return new TranslationResult(saved.getText(), target.getId(), saved.getConfidence(), false, false);
                });
    }
}
