package com.openforge.invoicemate.error;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.server.ResponseStatusException;

import java.util.stream.Collectors;

/**
 * Maps the exception taxonomy onto HTTP statuses and {@link ApiError} bodies.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(InvoiceMateException.class)
    public ResponseEntity<ApiError> handleDomain(InvoiceMateException ex) {
        HttpStatus status = statusFor(ex.kind());
        if (status.is5xxServerError()) {
            log.warn("[API] {} {}: {}", status.value(), ex.kind(), ex.getMessage());
        } else {
            log.info("[API] {} {}: {}", status.value(), ex.kind(), ex.getMessage());
        }
        return ResponseEntity.status(status).body(ApiError.of(ex.kind(), ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleInvalidBody(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
                .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                .collect(Collectors.joining("; "));
        log.info("[API] Bad request: {}", message);
        return ResponseEntity.badRequest().body(ApiError.of(ErrorKind.VALIDATION_ERROR, message));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiError> handleUnreadableBody(HttpMessageNotReadableException ex) {
        log.info("[API] Unreadable request body: {}", ex.getMostSpecificCause().getMessage());
        return ResponseEntity.badRequest()
                .body(ApiError.of(ErrorKind.VALIDATION_ERROR, "Request body is not valid JSON for this endpoint."));
    }

    @ExceptionHandler(ResponseStatusException.class)
    public ResponseEntity<ApiError> handleResponseStatus(ResponseStatusException ex) {
        HttpStatus status = HttpStatus.valueOf(ex.getStatusCode().value());
        ErrorKind kind = status == HttpStatus.BAD_REQUEST ? ErrorKind.VALIDATION_ERROR : ErrorKind.INTERNAL_ERROR;
        log.warn("[API] {}: {}", status, ex.getReason());
        return ResponseEntity.status(status).body(ApiError.of(kind, ex.getReason()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGeneric(Exception ex) {
        log.error("[API] Internal server error", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(ApiError.of(ErrorKind.INTERNAL_ERROR, "Internal server error"));
    }

    static HttpStatus statusFor(ErrorKind kind) {
        return switch (kind) {
            case VALIDATION_ERROR, REWRITE_ERROR, UNKNOWN_TOOL -> HttpStatus.BAD_REQUEST;
            case NO_PENDING_ACTION -> HttpStatus.NOT_FOUND;
            case ACTION_ALREADY_EXECUTED, PENDING_ACTION_CONFLICT -> HttpStatus.CONFLICT;
            case UPSTREAM_TIMEOUT -> HttpStatus.GATEWAY_TIMEOUT;
            case UPSTREAM_UNAVAILABLE, ISSUER_UNAVAILABLE -> HttpStatus.SERVICE_UNAVAILABLE;
            case SERIALIZATION_ERROR, EXECUTION_FAILED, ROUND_LIMIT_EXCEEDED, INTERNAL_ERROR ->
                    HttpStatus.INTERNAL_SERVER_ERROR;
        };
    }
}
