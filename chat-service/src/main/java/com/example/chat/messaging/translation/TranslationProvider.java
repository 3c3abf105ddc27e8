package com.example.chat.messaging.translation;

import reactor.core.publisher.Mono;

/**
 * Remote machine translation. Implementations signal failures as errors; callers decide
 * how to degrade.
 */
public interface TranslationProvider {

    /**
     * @param sourceCode provider locale code such as {@code hi-IN}, or {@code auto}
     * @param targetCode provider locale code of the wanted language
     */
    Mono<ProviderTranslation> translate(String text, String sourceCode, String targetCode);
}
