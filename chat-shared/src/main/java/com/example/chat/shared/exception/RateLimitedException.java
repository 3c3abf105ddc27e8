package com.example.chat.shared.exception;

import lombok.Getter;

import java.time.Duration;

@Getter
public class RateLimitedException extends ChatException {

    private final String limiterName;
    private final Duration retryAfter;

    public RateLimitedException(String limiterName, Duration retryAfter) {
        super(ErrorCode.RATE_LIMITED, "Too many " + limiterName + " requests, retry in " + retryAfter.toMillis() + "ms");
        this.limiterName = limiterName;
        this.retryAfter = retryAfter;
    }
}
