package com.example.chat.messaging.controller;

import com.example.chat.messaging.auth.BearerTokenAuthenticationFilter;
import com.example.chat.messaging.dto.SynthesizeRequest;
import com.example.chat.messaging.dto.VoiceMessageResponse;
import com.example.chat.messaging.mapper.ChatMapper;
import com.example.chat.messaging.ratelimit.ChatRateLimiter;
import com.example.chat.messaging.service.ChatService;
import com.example.chat.messaging.voice.SynthesisResult;
import com.example.chat.messaging.voice.TranscriptionResult;
import com.example.chat.messaging.voice.VoicePipeline;
import com.example.chat.shared.config.AppProperties;
import com.example.chat.shared.exception.ValidationFailureException;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.buffer.DataBufferUtils;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.multipart.FilePart;
import org.springframework.http.codec.multipart.FormFieldPart;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/speech")
@RequiredArgsConstructor
@Slf4j
public class SpeechController {

    private static final String USER = BearerTokenAuthenticationFilter.USER_ID_ATTRIBUTE;

    private final ChatService chatService;
    private final VoicePipeline voicePipeline;
    private final ChatRateLimiter rateLimiter;
    private final ChatMapper chatMapper;
    private final AppProperties appProperties;

    @PostMapping(value = "/voice-message", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<VoiceMessageResponse>> sendVoiceMessage(
            @RequestAttribute(USER) String userId,
            @RequestPart("audio") FilePart audio,
            @RequestPart("conversationId") FormFieldPart conversationId,
            @RequestPart(value = "language", required = false) FormFieldPart language) {
        Long id = parseConversationId(conversationId.value());
        log.info("Voice message upload from {} to conversation {}", userId, id);
        return readBytes(audio)
                .flatMap(bytes -> chatService.sendVoiceMessage(id, userId, bytes, mimeType(audio), value(language)))
                .map(result -> ResponseEntity.status(HttpStatus.CREATED)
                        .body(new VoiceMessageResponse(chatMapper.toMessageResponse(result.message()), result.fallback())));
    }

    @PostMapping(value = "/transcribe", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public Mono<ResponseEntity<TranscriptionResult>> transcribe(
            @RequestAttribute(USER) String userId,
            @RequestPart("audio") FilePart audio,
            @RequestPart(value = "language", required = false) FormFieldPart language) {
        return Mono.fromRunnable(() -> rateLimiter.acquire(ChatRateLimiter.Limit.SPEECH, userId))
                .then(readBytes(audio))
                .flatMap(bytes -> voicePipeline.transcribe(bytes, mimeType(audio), value(language)))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/synthesize")
    public Mono<ResponseEntity<SynthesisResult>> synthesize(
            @RequestAttribute(USER) String userId,
            @Valid @RequestBody SynthesizeRequest request) {
        return Mono.fromRunnable(() -> rateLimiter.acquire(ChatRateLimiter.Limit.SPEECH, userId))
                .then(voicePipeline.synthesize(request.getText(), request.getLanguage(), request.getVoice()))
                .map(ResponseEntity::ok);
    }

    private Mono<byte[]> readBytes(FilePart part) {
        long maxBytes = appProperties.getMedia().getMaxVoiceBytes();
        return DataBufferUtils.join(part.content())
                .map(buffer -> {
                    try {
                        if (buffer.readableByteCount() > maxBytes) {
                            throw new ValidationFailureException("Audio exceeds " + maxBytes + " bytes");
                        }
                        byte[] bytes = new byte[buffer.readableByteCount()];
                        buffer.read(bytes);
                        return bytes;
                    } finally {
                        DataBufferUtils.release(buffer);
                    }
                })
                .switchIfEmpty(Mono.error(new ValidationFailureException("Audio file is empty")));
    }

    private static String mimeType(FilePart part) {
        MediaType contentType = part.headers().getContentType();
        return contentType == null ? null : contentType.toString();
    }

    private static String value(FormFieldPart part) {
        return part == null ? null : part.value();
    }

    private static Long parseConversationId(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationFailureException("conversationId is required");
        }
        try {
            return Long.valueOf(value.trim());
        } catch (NumberFormatException e) {
            throw new ValidationFailureException("conversationId must be a number");
        }
    }
}
