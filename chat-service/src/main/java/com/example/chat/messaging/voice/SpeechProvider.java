package com.example.chat.messaging.voice;

import reactor.core.publisher.Mono;

/**
 * Remote speech recognition and synthesis.
 */
public interface SpeechProvider {

    Mono<Transcript> transcribe(byte[] audio, String languageCode);

    /**
     * @return base64-encoded WAV audio
     */
    Mono<String> synthesize(String text, String languageCode, String speaker);
}
