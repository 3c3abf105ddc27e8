package com.example.chat.shared.exception;

public class AuthorizationFailureException extends ChatException {

    public AuthorizationFailureException(String message) {
        super(ErrorCode.AUTHORIZATION_FAILED, message);
    }
}
