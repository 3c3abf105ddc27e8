package com.example.chat.messaging.translation;

import com.example.chat.shared.util.Constants;

/**
 * A translated text, or the original text flagged as a fallback when the provider failed.
 */
public record TranslationResult(String text, String language, double confidence, boolean fallback, boolean cached) {

    public static TranslationResult unchanged(String text, String language) {
        return new TranslationResult(text, language, 1.0, false, false);
    }

    public static TranslationResult fallback(String originalText, String language) {
        return new TranslationResult(originalText, language, Constants.FALLBACK_CONFIDENCE, true, false);
    }
}
