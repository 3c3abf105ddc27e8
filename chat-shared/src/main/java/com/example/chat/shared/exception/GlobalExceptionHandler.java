package com.example.chat.shared.exception;

import com.example.chat.shared.dto.ErrorResponse;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.ConstraintViolationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.method.ParameterValidationResult;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.method.annotation.HandlerMethodValidationException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.stream.Collectors;

@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<ErrorResponse> handleRateLimitedException(RateLimitedException ex, ServerWebExchange exchange) {
        long retryAfterMs = ex.getRetryAfter().toMillis();
        ErrorResponse errorResponse = new ErrorResponse(
                now(),
                HttpStatus.TOO_MANY_REQUESTS.value(),
                "Too Many Requests",
                ex.getErrorCode().name(),
                ex.getMessage(),
                path(exchange),
                retryAfterMs
        );
        log.warn("Rate limit '{}' exceeded on path '{}'", ex.getLimiterName(), path(exchange));
        long retryAfterSeconds = Math.max(1, (retryAfterMs + 999) / 1000);
        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(retryAfterSeconds))
                .body(errorResponse);
    }

    @ExceptionHandler(ChatException.class)
    public ResponseEntity<ErrorResponse> handleChatException(ChatException ex, ServerWebExchange exchange) {
        HttpStatus status = ex.getErrorCode().getHttpStatus();
        ErrorResponse errorResponse = ErrorResponse.of(ex.getErrorCode(), ex.getMessage(), path(exchange));
        if (status.is5xxServerError()) {
            log.error("{} on path '{}': {}", ex.getClass().getSimpleName(), path(exchange), ex.getMessage(), ex);
        } else {
            log.warn("{} on path '{}': {}", ex.getClass().getSimpleName(), path(exchange), ex.getMessage());
        }
        return new ResponseEntity<>(errorResponse, status);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<ErrorResponse> handleValidationExceptions(WebExchangeBindException ex, ServerWebExchange exchange) {
        String errors = ex.getBindingResult()
                .getAllErrors().stream()
                .map(error -> error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        log.warn("Validation error: {}", errors);
        return badRequest(errors, exchange);
    }

    @ExceptionHandler(HandlerMethodValidationException.class)
    public ResponseEntity<ErrorResponse> handleMethodValidation(HandlerMethodValidationException ex, ServerWebExchange exchange) {
        String errors = ex.getAllValidationResults().stream()
                .map(ParameterValidationResult::getResolvableErrors)
                .flatMap(list -> list.stream().map(error -> error.getDefaultMessage()))
                .collect(Collectors.joining(", "));
        log.warn("Parameter validation error: {}", errors);
        return badRequest(errors, exchange);
    }

    @ExceptionHandler(ConstraintViolationException.class)
    public ResponseEntity<ErrorResponse> handleConstraintViolation(ConstraintViolationException ex, ServerWebExchange exchange) {
        String errors = ex.getConstraintViolations().stream()
                .map(ConstraintViolation::getMessage)
                .collect(Collectors.joining(", "));
        log.warn("Constraint violation: {}", errors);
        return badRequest(errors, exchange);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<ErrorResponse> handleInputException(ServerWebInputException ex, ServerWebExchange exchange) {
        log.warn("Malformed request on path '{}': {}", path(exchange), ex.getReason());
        return badRequest(ex.getReason(), exchange);
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ErrorResponse> handleResponseStatusException(ResponseStatusException ex, ServerWebExchange exchange) {
        ErrorResponse errorResponse = new ErrorResponse(
                now(),
                ex.getStatusCode().value(),
                ex.getStatusCode().toString(),
                null,
                ex.getReason(),
                path(exchange),
                null
        );
        if (ex.getStatusCode().is5xxServerError()) {
            log.error("Server error occurred on path {}:", path(exchange), ex);
        } else {
            log.warn("Client error: {} on path '{}' - Reason: {}", ex.getStatusCode().value(), path(exchange), ex.getReason());
        }
        return new ResponseEntity<>(errorResponse, ex.getStatusCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleGenericException(Exception ex, ServerWebExchange exchange) {
        ErrorResponse errorResponse = new ErrorResponse(
                now(),
                HttpStatus.INTERNAL_SERVER_ERROR.value(),
                "Internal Server Error",
                null,
                "An unexpected error occurred. Please try again later.",
                path(exchange),
                null
        );
        log.error("An unexpected error occurred at path {}:", path(exchange), ex);
        return new ResponseEntity<>(errorResponse, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<ErrorResponse> badRequest(String message, ServerWebExchange exchange) {
        return new ResponseEntity<>(ErrorResponse.of(ErrorCode.VALIDATION_FAILED, message, path(exchange)),
                HttpStatus.BAD_REQUEST);
    }

    private static String path(ServerWebExchange exchange) {
        return exchange.getRequest().getPath().toString();
    }

    private static OffsetDateTime now() {
        return OffsetDateTime.now(ZoneOffset.UTC);
    }
}
