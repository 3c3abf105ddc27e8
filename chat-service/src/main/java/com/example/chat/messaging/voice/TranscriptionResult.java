package com.example.chat.messaging.voice;

public record TranscriptionResult(String text, String language, Double confidence, double durationSeconds,
                                  boolean fallback) {
}
