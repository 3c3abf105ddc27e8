package com.example.chat.messaging.translation;

import com.example.chat.shared.exception.ExternalServiceException;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

/**
 * Translation over the Sarvam {@code /translate} endpoint.
 */
@Component
@Slf4j
public class SarvamTranslationProvider implements TranslationProvider {

    static final String PROVIDER = "sarvam-translate";
    private static final double DEFAULT_CONFIDENCE = 0.9;

    private final WebClient webClient;

    public SarvamTranslationProvider(@Qualifier("translationWebClient") WebClient webClient) {
        this.webClient = webClient;
    }

    @Override
    @CircuitBreaker(name = "translationProvider")
    public Mono<ProviderTranslation> translate(String text, String sourceCode, String targetCode) {
        TranslateRequest request = new TranslateRequest(text, sourceCode, targetCode, "Male", "formal", true);
        return webClient.post()
                .uri("/translate")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(TranslateResponse.class)
                .flatMap(response -> {
                    if (response.translatedText() == null) {
                        return Mono.error(new ExternalServiceException(PROVIDER, "Provider returned no translated text"));
                    }
                    double confidence = response.confidence() == null ? DEFAULT_CONFIDENCE : response.confidence();
                    return Mono.just(new ProviderTranslation(response.translatedText(), response.detectedLanguageCode(), confidence));
                })
                .onErrorMap(WebClientResponseException.class, e -> new ExternalServiceException(PROVIDER,
                        "Translation request failed with HTTP " + e.getStatusCode().value(), e))
                .doOnError(e -> log.warn("Translation {} -> {} failed: {}", sourceCode, targetCode, e.getMessage()));
    }

    record TranslateRequest(
            String input,
            @JsonProperty("source_language_code") String sourceLanguageCode,
            @JsonProperty("target_language_code") String targetLanguageCode,
            @JsonProperty("speaker_gender") String speakerGender,
            String mode,
            @JsonProperty("enable_preprocessing") boolean enablePreprocessing) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TranslateResponse(
            @JsonProperty("translated_text") String translatedText,
            @JsonProperty("source_language_code") String detectedLanguageCode,
            Double confidence) {
    }
}
