package com.example.chat.messaging.voice;

import com.example.chat.messaging.store.ConversationStore;
import com.example.chat.messaging.store.MessageStore;
import com.example.chat.messaging.store.SendMessageCommand;
import com.example.chat.messaging.translation.Language;
import com.example.chat.shared.aspect.Monitored;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig;
import com.example.chat.shared.exception.ValidationFailureException;
import com.example.chat.shared.model.Message;
import com.example.chat.shared.model.VoiceNote;
import com.example.chat.shared.util.Constants;
import com.example.chat.shared.util.Constants.MessageType;
import com.example.chat.shared.util.Constants.TranscriptStatus;
import com.example.chat.shared.util.JsonUtils;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.Locale;

/**
 * Turns an uploaded clip into a voice message: validate, analyse, store, transcribe, send.
 * The message is created even when transcription fails; it then has no text and an
 * unavailable transcript.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Monitored(value = "voice", slowThresholdMs = 5000)
public class VoicePipeline {

    private static final String SYNTHESIS_FORMAT = "wav";

    private final ConversationStore conversationStore;
    private final MessageStore messageStore;
    private final SpeechProvider speechProvider;
    private final MediaStorage mediaStorage;
    private final AudioAnalyzer audioAnalyzer;
    private final Scheduler jdbcScheduler;
    private final AppProperties appProperties;
    private final MonitoringConfig.ChatMetricsCollector metricsCollector;

    public Mono<VoiceIngestResult> ingestVoice(Long conversationId, String senderId, byte[] audio, String mimeType,
                                               String languageHint) {
        return Mono.fromCallable(() -> {
                    String type = validateAudio(audio, mimeType);
                    String hint = normalizeHint(languageHint);
                    conversationStore.getForParticipant(conversationId, senderId);
                    AudioProfile profile = audioAnalyzer.analyze(audio);
                    String reference = mediaStorage.store(audio, type);
                    return new StoredClip(reference, type, hint, profile);
                })
                .subscribeOn(jdbcScheduler)
                .flatMap(clip -> transcribeClip(audio, clip.hint(), clip.profile().durationSeconds())
                        .flatMap(transcript -> Mono.fromCallable(() -> sendVoiceMessage(conversationId, senderId, clip, transcript))
                                .subscribeOn(jdbcScheduler)))
                .doOnNext(result -> log.info("Voice message {} stored in conversation {} (transcript {})",
                        result.message().getId(), conversationId,
                        result.fallback() ? "unavailable" : "completed"));
    }

    /**
     * Transcription without creating a message.
     */
    public Mono<TranscriptionResult> transcribe(byte[] audio, String mimeType, String languageHint) {
        return Mono.fromCallable(() -> {
                    validateAudio(audio, mimeType);
                    String hint = normalizeHint(languageHint);
                    return new StoredClip(null, mimeType, hint, audioAnalyzer.analyze(audio));
                })
                .flatMap(clip -> transcribeClip(audio, clip.hint(), clip.profile().durationSeconds()));
    }

    public Mono<SynthesisResult> synthesize(String text, String language, String speaker) {
        if (text == null || text.isBlank() || text.length() > Constants.MAX_TEXT_LENGTH) {
            return Mono.error(new ValidationFailureException("Text must be 1-" + Constants.MAX_TEXT_LENGTH + " characters"));
        }
        String hint;
        try {
            hint = normalizeHint(language);
        } catch (ValidationFailureException e) {
            return Mono.error(e);
        }
        AppProperties.Speech speech = appProperties.getSpeech();
        String voice = speaker == null || speaker.isBlank() ? speech.getDefaultSpeaker() : speaker;
        return speechProvider.synthesize(text, languageCode(hint), voice)
                .timeout(Duration.ofMillis(speech.getTimeoutMs()))
                .map(audio -> new SynthesisResult(audio, SYNTHESIS_FORMAT, speech.getSynthesisSampleRate(), hint, voice, false))
                .onErrorResume(e -> {
                    log.warn("Speech synthesis degraded for {} chars in {}: {}", text.length(), hint, e.getMessage());
                    metricsCollector.incrementCounter("chat.speech.calls", "result", "fallback");
                    return Mono.just(new SynthesisResult(null, SYNTHESIS_FORMAT, speech.getSynthesisSampleRate(), hint, voice, true));
                });
    }

    private Mono<TranscriptionResult> transcribeClip(byte[] audio, String hint, double durationSeconds) {
        return speechProvider.transcribe(audio, languageCode(hint))
                .timeout(Duration.ofMillis(appProperties.getSpeech().getTimeoutMs()))
                .map(transcript -> {
                    String language = Language.fromCode(transcript.languageCode()).map(Language::getId).orElse(hint);
                    metricsCollector.incrementCounter("chat.speech.calls", "result", "success");
                    return new TranscriptionResult(transcript.text(), language, transcript.confidence(), durationSeconds, false);
                })
                .onErrorResume(e -> {
                    log.warn("Transcription unavailable ({} bytes, hint {}): {}", audio.length, hint, e.getMessage());
                    metricsCollector.incrementCounter("chat.speech.calls", "result", "fallback");
                    return Mono.just(new TranscriptionResult("", hint, null, durationSeconds, true));
                });
    }

    private VoiceIngestResult sendVoiceMessage(Long conversationId, String senderId, StoredClip clip,
                                               TranscriptionResult transcript) {
        VoiceNote voice = VoiceNote.builder()
                .audioRef(clip.reference())
                .mimeType(clip.mimeType())
                .durationSeconds(clip.profile().durationSeconds())
                .transcriptText(transcript.text())
                .transcriptLanguage(transcript.language())
                .transcriptConfidence(transcript.confidence())
                .transcriptStatus(transcript.fallback() ? TranscriptStatus.UNAVAILABLE : TranscriptStatus.COMPLETED)
                .waveform(JsonUtils.toJsonArray(clip.profile().waveform()))
                .build();
        SendMessageCommand command = SendMessageCommand.builder()
                .type(MessageType.VOICE)
                .text(transcript.text())
                .language(transcript.language())
                .voice(voice)
                .build();
        Message message = messageStore.sendMessage(conversationId, senderId, command);
        return new VoiceIngestResult(message, transcript.fallback());
    }

    private String validateAudio(byte[] audio, String mimeType) {
        if (audio == null || audio.length == 0) {
            throw new ValidationFailureException("Audio file is required");
        }
        AppProperties.Media media = appProperties.getMedia();
        if (audio.length > media.getMaxVoiceBytes()) {
            throw new ValidationFailureException("Audio exceeds the " + media.getMaxVoiceBytes() + " byte limit");
        }
        String type = mimeType == null ? "" : mimeType.split(";", 2)[0].trim().toLowerCase(Locale.ROOT);
        if (!media.getAllowedAudioTypes().contains(type)) {
            throw new ValidationFailureException("Unsupported audio type: " + mimeType);
        }
        return type;
    }

    private static String normalizeHint(String languageHint) {
        String hint = languageHint == null || languageHint.isBlank()
                ? Constants.AUTO_LANGUAGE
                : languageHint.trim().toLowerCase(Locale.ROOT);
        if (!Language.isSupportedOrAuto(hint)) {
            throw new ValidationFailureException("Unsupported language: " + languageHint);
        }
        return hint;
    }

    private String languageCode(String hint) {
        return Language.fromId(hint).map(Language::getCode).orElse(appProperties.getSpeech().getAutoLanguageCode());
    }

    private record StoredClip(String reference, String mimeType, String hint, AudioProfile profile) {
    }
}
