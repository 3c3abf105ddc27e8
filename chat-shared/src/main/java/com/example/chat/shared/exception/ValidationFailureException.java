package com.example.chat.shared.exception;

public class ValidationFailureException extends ChatException {

    public ValidationFailureException(String message) {
        super(ErrorCode.VALIDATION_FAILED, message);
    }
}
