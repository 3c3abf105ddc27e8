package com.example.chat.messaging.voice;

import com.example.chat.shared.model.Message;

/**
 * The stored voice message; {@code fallback} is set when no transcript could be produced.
 */
public record VoiceIngestResult(Message message, boolean fallback) {
}
