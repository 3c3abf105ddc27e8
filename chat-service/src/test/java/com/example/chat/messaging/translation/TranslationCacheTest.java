package com.example.chat.messaging.translation;

import com.example.chat.messaging.store.MessageStore;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig;
import com.example.chat.shared.exception.ExternalServiceException;
import com.example.chat.shared.exception.ValidationFailureException;
import com.example.chat.shared.model.EditRecord;
import com.example.chat.shared.model.Message;
import com.example.chat.shared.model.MessageTranslation;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
@DisplayName("TranslationCache Unit Tests")
class TranslationCacheTest {

    @Mock
    private MessageStore messageStore;

    @Mock
    private MonitoringConfig.ChatMetricsCollector metricsCollector;

    private final AtomicInteger providerCalls = new AtomicInteger();
    private volatile Mono<ProviderTranslation> providerResponse;
    private TranslationCache translationCache;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getTranslation().setTimeoutMs(2_000);
        TranslationProvider provider = (text, source, target) -> Mono.defer(() -> {
            providerCalls.incrementAndGet();
            return providerResponse != null ? providerResponse : Mono.just(new ProviderTranslation("T(" + text + ")", target, 0.9));
        });
        lenient().when(messageStore.addTranslation(anyLong(), anyString(), anyString(), anyString(), anyDouble()))
                .thenAnswer(invocation -> new MessageTranslation(invocation.getArgument(3),
                        invocation.getArgument(4), OffsetDateTime.now()));
        translationCache = new TranslationCache(Caffeine.newBuilder().recordStats().buildAsync(), provider,
                messageStore, Schedulers.immediate(), properties, metricsCollector);
    }

    @Test
    @DisplayName("Concurrent requests for the same message and language share one provider call")
    void concurrentRequestsShareOneProviderCall() {
        providerResponse = Mono.delay(Duration.ofMillis(200))
                .map(tick -> new ProviderTranslation("नमस्ते", "hi-IN", 0.93));
        Message message = message(7L, "Hello", "english");

        List<TranslationResult> results = Flux.range(0, 10)
                .flatMap(i -> translationCache.getOrTranslate(message, "hindi").subscribeOn(Schedulers.parallel()))
                .collectList()
                .block(Duration.ofSeconds(5));

        assertThat(results).hasSize(10).allSatisfy(result -> {
            assertThat(result.text()).isEqualTo("नमस्ते");
            assertThat(result.language()).isEqualTo("hindi");
            assertThat(result.fallback()).isFalse();
        });
        assertThat(providerCalls).hasValue(1);
        verify(messageStore, times(1)).addTranslation(7L, "hindi", "Hello", "नमस्ते", 0.93);
    }

    @Test
    @DisplayName("A provider failure falls back to the original text and is not remembered")
    void failureFallsBackAndIsNotCached() {
        providerResponse = Mono.error(new ExternalServiceException("translation", "503 from provider"));
        Message message = message(8L, "Good morning", "english");

        StepVerifier.create(translationCache.getOrTranslate(message, "tamil"))
                .assertNext(result -> {
                    assertThat(result.text()).isEqualTo("Good morning");
                    assertThat(result.fallback()).isTrue();
                    assertThat(result.confidence()).isEqualTo(0.1);
                })
                .verifyComplete();

        providerResponse = Mono.just(new ProviderTranslation("காலை வணக்கம்", "ta-IN", 0.9));
        StepVerifier.create(translationCache.getOrTranslate(message, "tamil"))
                .assertNext(result -> assertThat(result.fallback()).isFalse())
                .verifyComplete();

        assertThat(providerCalls).hasValue(2);
        verify(messageStore, times(1)).addTranslation(eq(8L), eq("tamil"), eq("Good morning"), anyString(), anyDouble());
        verify(metricsCollector).incrementCounter("chat.translation.calls", "result", "fallback");
    }

    @Test
    @DisplayName("Stored translations are served without calling the provider")
    void storedTranslationIsServedWithoutProvider() {
        Message message = message(9L, "Thank you", "english");
        message.getTranslations().put("hindi", new MessageTranslation("धन्यवाद", 0.95, OffsetDateTime.now()));

        StepVerifier.create(translationCache.getOrTranslate(message, "hindi"))
                .assertNext(result -> {
                    assertThat(result.text()).isEqualTo("धन्यवाद");
                    assertThat(result.cached()).isTrue();
                })
                .verifyComplete();

        assertThat(providerCalls).hasValue(0);
        verify(messageStore, never()).addTranslation(anyLong(), anyString(), anyString(), anyString(), anyDouble());
    }

    @Test
    @DisplayName("After an edit the new text is translated, not the cached old one")
    void editedMessageIsTranslatedAgain() {
        Message message = message(12L, "hello", "english");
        StepVerifier.create(translationCache.getOrTranslate(message, "hindi"))
                .assertNext(result -> assertThat(result.text()).isEqualTo("T(hello)"))
                .verifyComplete();

        message.getEditHistory().add(new EditRecord("hello", OffsetDateTime.now()));
        message.setOriginalText("goodbye");
        message.getTranslations().clear();

        StepVerifier.create(translationCache.getOrTranslate(message, "hindi"))
                .assertNext(result -> assertThat(result.text()).isEqualTo("T(goodbye)"))
                .verifyComplete();
        assertThat(providerCalls).hasValue(2);
        verify(messageStore).addTranslation(eq(12L), eq("hindi"), eq("goodbye"), eq("T(goodbye)"), anyDouble());
    }

    @Test
    @DisplayName("Invalidating a message drops its cached results")
    void invalidateDropsCachedResults() {
        Message message = message(13L, "see you", "english");
        translationCache.getOrTranslate(message, "hindi").block(Duration.ofSeconds(5));
        translationCache.getOrTranslate(message, "tamil").block(Duration.ofSeconds(5));
        translationCache.getOrTranslate(message, "hindi").block(Duration.ofSeconds(5));
        assertThat(providerCalls).hasValue(2);

        translationCache.invalidate(13L);
        translationCache.getOrTranslate(message, "hindi").block(Duration.ofSeconds(5));

        assertThat(providerCalls).hasValue(3);
        assertThat(translationCache.estimatedSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("Same-language requests return the text unchanged")
    void sameLanguageIsReturnedUnchanged() {
        StepVerifier.create(translationCache.getOrTranslate(message(10L, "Hello", "english"), "english"))
                .assertNext(result -> {
                    assertThat(result.text()).isEqualTo("Hello");
                    assertThat(result.confidence()).isEqualTo(1.0);
                })
                .verifyComplete();
        assertThat(providerCalls).hasValue(0);
    }

    @Test
    @DisplayName("Unsupported target languages are rejected")
    void unsupportedTargetIsRejected() {
        StepVerifier.create(translationCache.getOrTranslate(message(11L, "Hello", "english"), "klingon"))
                .expectError(ValidationFailureException.class)
                .verify();
        verifyNoInteractions(messageStore);
    }

    private static Message message(Long id, String text, String language) {
        return Message.builder().id(id).conversationId(1L).senderId("user-001")
                .originalText(text).originalLanguage(language).build();
    }
}
