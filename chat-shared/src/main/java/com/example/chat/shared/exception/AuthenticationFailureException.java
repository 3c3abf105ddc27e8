package com.example.chat.shared.exception;

public class AuthenticationFailureException extends ChatException {

    public AuthenticationFailureException(String message) {
        super(ErrorCode.AUTHENTICATION_FAILED, message);
    }

    public AuthenticationFailureException(String message, Throwable cause) {
        super(ErrorCode.AUTHENTICATION_FAILED, message, cause);
    }
}
