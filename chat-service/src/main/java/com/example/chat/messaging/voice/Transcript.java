package com.example.chat.messaging.voice;

/**
 * Provider transcription of an audio clip. {@code languageCode} is the provider locale code.
 */
public record Transcript(String text, String languageCode, double confidence) {
}
