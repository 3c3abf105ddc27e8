package com.example.chat.shared.exception;

public class ResourceNotFoundException extends ChatException {

    public ResourceNotFoundException(String message) {
        super(ErrorCode.NOT_FOUND, message);
    }

    public static ResourceNotFoundException conversation(Long conversationId) {
        return new ResourceNotFoundException("Conversation not found: " + conversationId);
    }

    public static ResourceNotFoundException message(Long messageId) {
        return new ResourceNotFoundException("Message not found: " + messageId);
    }

    public static ResourceNotFoundException user(String userId) {
        return new ResourceNotFoundException("User not found: " + userId);
    }
}
