package com.example.chat.shared.dto;

import com.example.chat.shared.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;

/**
 * JSON error body of the HTTP API. {@code code} is the {@link ErrorCode} name when the
 * failure maps to one; {@code retryAfterMs} is only set for rate-limited requests.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(OffsetDateTime timestamp, int status, String error, String code, String message,
                            String path, Long retryAfterMs) {

    public static ErrorResponse of(ErrorCode code, String message, String path) {
        return new ErrorResponse(OffsetDateTime.now(ZoneOffset.UTC), code.getHttpStatus().value(),
                code.getHttpStatus().getReasonPhrase(), code.name(), message, path, null);
    }
}
