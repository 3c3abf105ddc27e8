package com.example.chat.messaging.dto;

/**
 * A stored voice message. {@code fallback} is set when transcription was unavailable.
 */
public record VoiceMessageResponse(MessageResponse message, boolean fallback) {
}
