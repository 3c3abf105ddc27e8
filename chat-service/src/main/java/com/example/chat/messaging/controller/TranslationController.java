package com.example.chat.messaging.controller;

import com.example.chat.messaging.auth.BearerTokenAuthenticationFilter;
import com.example.chat.messaging.dto.DetectLanguageRequest;
import com.example.chat.messaging.dto.LanguageResponse;
import com.example.chat.messaging.dto.TranslateMessageRequest;
import com.example.chat.messaging.dto.TranslateTextRequest;
import com.example.chat.messaging.ratelimit.ChatRateLimiter;
import com.example.chat.messaging.service.ChatService;
import com.example.chat.messaging.translation.Language;
import com.example.chat.messaging.translation.TranslationResult;
import com.example.chat.messaging.translation.TranslationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.util.StringUtils;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/translation")
@RequiredArgsConstructor
public class TranslationController {

    private static final String USER = BearerTokenAuthenticationFilter.USER_ID_ATTRIBUTE;

    private final ChatService chatService;
    private final TranslationService translationService;
    private final ChatRateLimiter rateLimiter;

    @PostMapping("/message/{messageId}")
    public Mono<ResponseEntity<TranslationResult>> translateMessage(
            @RequestAttribute(USER) String userId,
            @PathVariable Long messageId,
            @Valid @RequestBody TranslateMessageRequest request) {
        return chatService.translateMessage(messageId, userId, request.getTargetLanguage()).map(ResponseEntity::ok);
    }

    @PostMapping("/translate")
    public Mono<ResponseEntity<TranslationResult>> translate(
            @RequestAttribute(USER) String userId,
            @Valid @RequestBody TranslateTextRequest request) {
        return Mono.fromRunnable(() -> rateLimiter.acquire(ChatRateLimiter.Limit.TRANSLATE, userId))
                .then(translationService.translate(request.getText(), request.getSourceLanguage(), request.getTargetLanguage()))
                .map(ResponseEntity::ok);
    }

    @PostMapping("/detect")
    public Mono<ResponseEntity<TranslationService.DetectedLanguage>> detect(@Valid @RequestBody DetectLanguageRequest request) {
        return Mono.fromCallable(() -> ResponseEntity.ok(translationService.detect(request.getText())));
    }

    @GetMapping("/languages")
    public Mono<ResponseEntity<List<LanguageResponse>>> languages() {
        List<LanguageResponse> languages = translationService.supportedLanguages().stream()
                .map(TranslationController::toResponse)
                .toList();
        return Mono.just(ResponseEntity.ok(languages));
    }

    private static LanguageResponse toResponse(Language language) {
        return new LanguageResponse(language.getId(), language.getCode(),
                StringUtils.capitalize(language.getId()), language.getNativeName());
    }
}
