package com.example.chat.messaging.translation;

/**
 * Raw answer of a translation provider.
 */
public record ProviderTranslation(String text, String detectedLanguageCode, double confidence) {
}
