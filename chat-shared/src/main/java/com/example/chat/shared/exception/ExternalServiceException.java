package com.example.chat.shared.exception;

import lombok.Getter;

/**
 * A translation or speech provider could not produce a result. Callers turn this into a
 * flagged fallback value; it is not expected to reach an HTTP client.
 */
@Getter
public class ExternalServiceException extends ChatException {

    private final String provider;

    public ExternalServiceException(String provider, String message) {
        super(ErrorCode.EXTERNAL_SERVICE_FAILED, message);
        this.provider = provider;
    }

    public ExternalServiceException(String provider, String message, Throwable cause) {
        super(ErrorCode.EXTERNAL_SERVICE_FAILED, message, cause);
        this.provider = provider;
    }
}
