package com.example.chat.messaging.voice;

import com.example.chat.shared.config.AppProperties;
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

import java.util.Base64;
import java.util.List;

/**
 * Speech-to-text and text-to-speech over the Sarvam JSON endpoints.
 */
@Component
@Slf4j
public class SarvamSpeechProvider implements SpeechProvider {

    static final String PROVIDER = "sarvam-speech";
    private static final double DEFAULT_CONFIDENCE = 0.9;

    private final WebClient webClient;
    private final AppProperties.Speech speech;

    public SarvamSpeechProvider(@Qualifier("speechWebClient") WebClient webClient, AppProperties appProperties) {
        this.webClient = webClient;
        this.speech = appProperties.getSpeech();
    }

    @Override
    @CircuitBreaker(name = "speechProvider")
    public Mono<Transcript> transcribe(byte[] audio, String languageCode) {
        SpeechToTextRequest request = new SpeechToTextRequest(
                Base64.getEncoder().encodeToString(audio), languageCode, speech.getTranscriptionModel());
        return webClient.post()
                .uri("/speech-to-text")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(SpeechToTextResponse.class)
                .flatMap(response -> {
                    if (response.transcript() == null) {
                        return Mono.error(new ExternalServiceException(PROVIDER, "Provider returned no transcript"));
                    }
                    double confidence = response.confidence() == null ? DEFAULT_CONFIDENCE : response.confidence();
                    String code = response.languageCode() == null ? languageCode : response.languageCode();
                    return Mono.just(new Transcript(response.transcript(), code, confidence));
                })
                .onErrorMap(WebClientResponseException.class, e -> new ExternalServiceException(PROVIDER,
                        "Transcription failed with HTTP " + e.getStatusCode().value(), e))
                .doOnError(e -> log.warn("Transcription ({} bytes, {}) failed: {}", audio.length, languageCode, e.getMessage()));
    }

    @Override
    @CircuitBreaker(name = "speechProvider")
    public Mono<String> synthesize(String text, String languageCode, String speaker) {
        TextToSpeechRequest request = new TextToSpeechRequest(List.of(text), languageCode, speaker,
                0, 1.0, 1.0, speech.getSynthesisSampleRate(), true, speech.getSynthesisModel());
        return webClient.post()
                .uri("/text-to-speech")
                .bodyValue(request)
                .retrieve()
                .bodyToMono(TextToSpeechResponse.class)
                .flatMap(response -> response.audios() == null || response.audios().isEmpty()
                        ? Mono.error(new ExternalServiceException(PROVIDER, "Provider returned no audio"))
                        : Mono.just(response.audios().get(0)))
                .onErrorMap(WebClientResponseException.class, e -> new ExternalServiceException(PROVIDER,
                        "Synthesis failed with HTTP " + e.getStatusCode().value(), e))
                .doOnError(e -> log.warn("Synthesis ({} chars, {}) failed: {}", text.length(), languageCode, e.getMessage()));
    }

    record SpeechToTextRequest(String audio, @JsonProperty("language_code") String languageCode, String model) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SpeechToTextResponse(String transcript, @JsonProperty("language_code") String languageCode, Double confidence) {
    }

    record TextToSpeechRequest(
            List<String> inputs,
            @JsonProperty("target_language_code") String targetLanguageCode,
            String speaker,
            int pitch,
            double pace,
            double loudness,
            @JsonProperty("speech_sample_rate") int speechSampleRate,
            @JsonProperty("enable_preprocessing") boolean enablePreprocessing,
            String model) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record TextToSpeechResponse(List<String> audios) {
    }
}
