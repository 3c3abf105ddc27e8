package com.example.chat.messaging.voice;

import com.example.chat.messaging.store.ConversationStore;
import com.example.chat.messaging.store.MessageStore;
import com.example.chat.messaging.store.SendMessageCommand;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.config.MonitoringConfig;
import com.example.chat.shared.exception.AuthorizationFailureException;
import com.example.chat.shared.exception.ExternalServiceException;
import com.example.chat.shared.exception.ValidationFailureException;
import com.example.chat.shared.model.Message;
import com.example.chat.shared.util.Constants.MessageStatus;
import com.example.chat.shared.util.Constants.MessageType;
import com.example.chat.shared.util.Constants.TranscriptStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.test.StepVerifier;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("VoicePipeline Unit Tests")
class VoicePipelineTest {

    @Mock
    private ConversationStore conversationStore;

    @Mock
    private MessageStore messageStore;

    @Mock
    private SpeechProvider speechProvider;

    @Mock
    private MediaStorage mediaStorage;

    @Mock
    private MonitoringConfig.ChatMetricsCollector metricsCollector;

    private VoicePipeline voicePipeline;

    @BeforeEach
    void setUp() {
        AppProperties properties = new AppProperties();
        properties.getSpeech().setTimeoutMs(2_000);
        voicePipeline = new VoicePipeline(conversationStore, messageStore, speechProvider, mediaStorage,
                new AudioAnalyzer(properties), Schedulers.immediate(), properties, metricsCollector);

        lenient().when(mediaStorage.store(any(), anyString())).thenReturn("2026-10-17/clip.wav");
        lenient().when(messageStore.sendMessage(any(), anyString(), any())).thenAnswer(invocation -> {
            SendMessageCommand command = invocation.getArgument(2);
            return Message.builder()
                    .id(100L)
                    .conversationId(invocation.getArgument(0))
                    .senderId(invocation.getArgument(1))
                    .type(command.getType())
                    .status(MessageStatus.SENT)
                    .originalText(command.getText())
                    .originalLanguage(command.getLanguage())
                    .voice(command.getVoice())
                    .build();
        });
    }

    @Test
    @DisplayName("A transcribed clip becomes a voice message carrying the transcript")
    void transcribedClipBecomesVoiceMessage() {
        // an automatic hint goes to the provider as its default language code
        when(speechProvider.transcribe(any(), eq("hi-IN")))
                .thenReturn(Mono.just(new Transcript("Hello", "en-IN", 0.92)));

        StepVerifier.create(voicePipeline.ingestVoice(5L, "user-001", TestAudio.wav(8000, 3.0, 0.5), "audio/wav", "auto"))
                .assertNext(result -> {
                    assertThat(result.fallback()).isFalse();
                    Message message = result.message();
                    assertThat(message.getType()).isEqualTo(MessageType.VOICE);
                    assertThat(message.getOriginalText()).isEqualTo("Hello");
                    assertThat(message.getOriginalLanguage()).isEqualTo("english");
                    assertThat(message.getVoice().getDurationSeconds()).isEqualTo(3.0);
                    assertThat(message.getVoice().getTranscriptLanguage()).isEqualTo("english");
                    assertThat(message.getVoice().getTranscriptConfidence()).isEqualTo(0.92);
                    assertThat(message.getVoice().getTranscriptStatus()).isEqualTo(TranscriptStatus.COMPLETED);
                    assertThat(message.getVoice().getAudioRef()).isEqualTo("2026-10-17/clip.wav");
                })
                .verifyComplete();

        verify(conversationStore).getForParticipant(5L, "user-001");
    }

    @Test
    @DisplayName("A transcription failure still stores the message, without text")
    void transcriptionFailureStoresUntranscribedMessage() {
        when(speechProvider.transcribe(any(), anyString()))
                .thenReturn(Mono.error(new ExternalServiceException("speech", "provider down")));

        StepVerifier.create(voicePipeline.ingestVoice(5L, "user-001", TestAudio.wav(8000, 2.0, 0.5), "audio/wav", "hindi"))
                .assertNext(result -> {
                    assertThat(result.fallback()).isTrue();
                    assertThat(result.message().getOriginalText()).isEmpty();
                    assertThat(result.message().getVoice().getTranscriptStatus()).isEqualTo(TranscriptStatus.UNAVAILABLE);
                    assertThat(result.message().getVoice().getTranscriptConfidence()).isNull();
                })
                .verifyComplete();

        ArgumentCaptor<SendMessageCommand> command = ArgumentCaptor.forClass(SendMessageCommand.class);
        verify(messageStore).sendMessage(eq(5L), eq("user-001"), command.capture());
        assertThat(command.getValue().getVoice().getDurationSeconds()).isEqualTo(2.0);
    }

    @Test
    void rejectsUnsupportedAudioBeforeStoringAnything() {
        StepVerifier.create(voicePipeline.ingestVoice(5L, "user-001", new byte[] {1, 2, 3}, "video/mp4", null))
                .expectError(ValidationFailureException.class)
                .verify();
        StepVerifier.create(voicePipeline.ingestVoice(5L, "user-001", new byte[0], "audio/wav", null))
                .expectError(ValidationFailureException.class)
                .verify();

        verifyNoInteractions(mediaStorage, speechProvider, messageStore);
    }

    @Test
    void nonParticipantCannotUpload() {
        when(conversationStore.getForParticipant(5L, "user-009"))
                .thenThrow(new AuthorizationFailureException("not a participant"));

        StepVerifier.create(voicePipeline.ingestVoice(5L, "user-009", TestAudio.wav(8000, 1.0, 0.5), "audio/wav; codecs=1", null))
                .expectError(AuthorizationFailureException.class)
                .verify();

        verifyNoInteractions(mediaStorage, speechProvider);
    }

    @Test
    void synthesisFailureYieldsDegradedResult() {
        when(speechProvider.synthesize(anyString(), eq("ta-IN"), eq("meera")))
                .thenReturn(Mono.error(new ExternalServiceException("speech", "timeout")));

        StepVerifier.create(voicePipeline.synthesize("வணக்கம்", "tamil", null))
                .assertNext(result -> {
                    assertThat(result.fallback()).isTrue();
                    assertThat(result.audioBase64()).isNull();
                    assertThat(result.language()).isEqualTo("tamil");
                })
                .verifyComplete();
    }
}
