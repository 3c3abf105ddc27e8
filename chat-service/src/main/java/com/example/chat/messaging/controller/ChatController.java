package com.example.chat.messaging.controller;

import com.example.chat.messaging.auth.BearerTokenAuthenticationFilter;
import com.example.chat.messaging.dto.ConversationResponse;
import com.example.chat.messaging.dto.CreateConversationRequest;
import com.example.chat.messaging.dto.EditMessageRequest;
import com.example.chat.messaging.dto.MarkReadRequest;
import com.example.chat.messaging.dto.MessageResponse;
import com.example.chat.messaging.dto.PageResponse;
import com.example.chat.messaging.dto.ReactionRequest;
import com.example.chat.messaging.dto.SendMessageRequest;
import com.example.chat.messaging.dto.TypingRequest;
import com.example.chat.messaging.dto.UpdateSettingsRequest;
import com.example.chat.messaging.service.ChatService;
import com.example.chat.messaging.store.SendMessageCommand;
import com.example.chat.messaging.store.SettingsUpdate;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Map;

@RestController
@RequestMapping("/api/chat")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    private static final String USER = BearerTokenAuthenticationFilter.USER_ID_ATTRIBUTE;

    private final ChatService chatService;

    @GetMapping("/conversations")
    public Mono<ResponseEntity<PageResponse<ConversationResponse>>> listConversations(
            @RequestAttribute(USER) String userId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return chatService.listConversations(userId, page, limit).map(ResponseEntity::ok);
    }

    @PostMapping("/conversations")
    public Mono<ResponseEntity<ConversationResponse>> getOrCreateConversation(
            @RequestAttribute(USER) String userId,
            @Valid @RequestBody CreateConversationRequest request) {
        log.info("Opening conversation between {} and {}", userId, request.getUserId());
        return chatService.getOrCreateConversation(userId, request.getUserId()).map(ResponseEntity::ok);
    }

    @GetMapping("/conversations/{conversationId}/messages")
    public Mono<ResponseEntity<PageResponse<MessageResponse>>> listMessages(
            @RequestAttribute(USER) String userId,
            @PathVariable Long conversationId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return chatService.listMessages(conversationId, userId, page, limit).map(ResponseEntity::ok);
    }

    @PostMapping("/conversations/{conversationId}/messages")
    public Mono<ResponseEntity<MessageResponse>> sendMessage(
            @RequestAttribute(USER) String userId,
            @PathVariable Long conversationId,
            @Valid @RequestBody SendMessageRequest request) {
        SendMessageCommand command = SendMessageCommand.builder()
                .type(request.getType())
                .text(request.getText())
                .language(request.getLanguage())
                .replyToId(request.getReplyToId())
                .forwardFromMessageId(request.getForwardFromMessageId())
                .media(request.getMedia())
                .expiresAt(request.getExpiresAt())
                .build();
        return chatService.sendMessage(conversationId, userId, command)
                .map(message -> ResponseEntity.status(HttpStatus.CREATED).body(message));
    }

    @PostMapping("/conversations/{conversationId}/read")
    public Mono<ResponseEntity<Map<String, Object>>> markRead(
            @RequestAttribute(USER) String userId,
            @PathVariable Long conversationId,
            @Valid @RequestBody MarkReadRequest request) {
        return chatService.markRead(conversationId, userId, request.getMessageIds())
                .map(result -> ResponseEntity.ok(Map.<String, Object>of(
                        "conversationId", conversationId,
                        "markedRead", result.newlyRead())));
    }

    @PutMapping("/conversations/{conversationId}/settings")
    public Mono<ResponseEntity<ConversationResponse>> updateSettings(
            @RequestAttribute(USER) String userId,
            @PathVariable Long conversationId,
            @RequestBody UpdateSettingsRequest request) {
        SettingsUpdate update = SettingsUpdate.builder()
                .autoTranslate(request.getAutoTranslate())
                .notifications(request.getNotifications())
                .muted(request.getMuted())
                .blocked(request.getBlocked())
                .build();
        return chatService.updateSettings(conversationId, userId, update).map(ResponseEntity::ok);
    }

    @PutMapping("/conversations/{conversationId}/typing")
    public Mono<ResponseEntity<Void>> setTyping(
            @RequestAttribute(USER) String userId,
            @PathVariable Long conversationId,
            @Valid @RequestBody TypingRequest request) {
        return chatService.setTyping(conversationId, userId, request.getTyping())
                .thenReturn(ResponseEntity.noContent().build());
    }

    @DeleteMapping("/conversations/{conversationId}")
    public Mono<ResponseEntity<ConversationResponse>> leaveConversation(
            @RequestAttribute(USER) String userId,
            @PathVariable Long conversationId) {
        log.info("User {} leaving conversation {}", userId, conversationId);
        return chatService.leaveConversation(conversationId, userId).map(ResponseEntity::ok);
    }

    @PutMapping("/messages/{messageId}")
    public Mono<ResponseEntity<MessageResponse>> editMessage(
            @RequestAttribute(USER) String userId,
            @PathVariable Long messageId,
            @Valid @RequestBody EditMessageRequest request) {
        return chatService.editMessage(messageId, userId, request.getContent()).map(ResponseEntity::ok);
    }

    @DeleteMapping("/messages/{messageId}")
    public Mono<ResponseEntity<Void>> removeMessage(
            @RequestAttribute(USER) String userId,
            @PathVariable Long messageId) {
        return chatService.removeMessage(messageId, userId).thenReturn(ResponseEntity.noContent().build());
    }

    @PutMapping("/messages/{messageId}/react")
    public Mono<ResponseEntity<MessageResponse>> setReaction(
            @RequestAttribute(USER) String userId,
            @PathVariable Long messageId,
            @Valid @RequestBody ReactionRequest request) {
        return chatService.setReaction(messageId, userId, request.getEmoji()).map(ResponseEntity::ok);
    }

    @DeleteMapping("/messages/{messageId}/react")
    public Mono<ResponseEntity<MessageResponse>> clearReaction(
            @RequestAttribute(USER) String userId,
            @PathVariable Long messageId,
            @RequestParam(required = false) String emoji) {
        return chatService.clearReaction(messageId, userId, emoji).map(ResponseEntity::ok);
    }

    @GetMapping("/search")
    public Mono<ResponseEntity<PageResponse<MessageResponse>>> search(
            @RequestAttribute(USER) String userId,
            @RequestParam("q") String query,
            @RequestParam(required = false) Long conversationId,
            @RequestParam(required = false) Integer page,
            @RequestParam(required = false) Integer limit) {
        return chatService.search(userId, query, conversationId, page, limit).map(ResponseEntity::ok);
    }
}
