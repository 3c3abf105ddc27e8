package com.example.chat.messaging.voice;

/**
 * Synthesized speech. A degraded result carries no audio and {@code fallback=true}.
 */
public record SynthesisResult(String audioBase64, String format, int sampleRate, String language, String speaker,
                              boolean fallback) {
}
