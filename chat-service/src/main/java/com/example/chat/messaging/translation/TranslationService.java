package com.example.chat.messaging.translation;

import com.example.chat.shared.aspect.Monitored;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig;
import com.example.chat.shared.exception.ValidationFailureException;
import com.example.chat.shared.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Arrays;
import java.util.List;

/**
 * Translation of free text that is not tied to a stored message. Nothing is cached.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored(value = "translation", slowThresholdMs = 3000)
public class TranslationService {

    private final TranslationProvider translationProvider;
    private final LanguageDetector languageDetector;
    private final AppProperties appProperties;
    private final MonitoringConfig.ChatMetricsCollector metricsCollector;

    public Mono<TranslationResult> translate(String text, String sourceLanguage, String targetLanguage) {
        if (text == null || text.isBlank() || text.length() > Constants.MAX_TEXT_LENGTH) {
            return Mono.error(new ValidationFailureException("Text must be 1-" + Constants.MAX_TEXT_LENGTH + " characters"));
        }
        Language target = Language.fromId(targetLanguage).orElse(null);
        if (target == null) {
            return Mono.error(new ValidationFailureException("Unsupported target language: " + targetLanguage));
        }
        String source = sourceLanguage == null || sourceLanguage.isBlank() ? Constants.AUTO_LANGUAGE : sourceLanguage;
        if (!Language.isSupportedOrAuto(source)) {
            return Mono.error(new ValidationFailureException("Unsupported source language: " + sourceLanguage));
        }
        if (target.getId().equalsIgnoreCase(source)) {
            return Mono.just(TranslationResult.unchanged(text, target.getId()));
        }
        String sourceCode = Language.fromId(source).map(Language::getCode).orElse(Constants.AUTO_LANGUAGE);
        return translationProvider.translate(text, sourceCode, target.getCode())
                .timeout(Duration.ofMillis(appProperties.getTranslation().getTimeoutMs()))
                .map(translated -> new TranslationResult(translated.text(), target.getId(), translated.confidence(), false, false))
                .onErrorResume(e -> {
                    log.warn("Ad-hoc translation to {} fell back to the original: {}", target.getId(), e.getMessage());
                    metricsCollector.incrementCounter("chat.translation.calls", "result", "fallback");
                    return Mono.just(TranslationResult.fallback(text, target.getId()));
                });
    }

    public DetectedLanguage detect(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationFailureException("Text is required");
        }
        Language language = languageDetector.detect(text);
        return new DetectedLanguage(language.getId(), language.getCode(), LanguageDetector.HEURISTIC_CONFIDENCE);
    }

    public List<Language> supportedLanguages() {
        return Arrays.asList(Language.values());
    }

    public record DetectedLanguage(String language, String code, double confidence) {
    }
}
