package com.example.chat.messaging.event;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorPayload(String code, String message, Long retryAfterMs) {
}
