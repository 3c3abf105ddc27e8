package com.example.chat.shared.exception;

import lombok.Getter;

/**
 * Base type for failures the messaging core reports to callers. The {@link ErrorCode}
 * decides the HTTP status and the {@code code} carried in real-time error events.
 */
@Getter
public abstract class ChatException extends RuntimeException {

    private final ErrorCode errorCode;

    protected ChatException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ChatException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
}
