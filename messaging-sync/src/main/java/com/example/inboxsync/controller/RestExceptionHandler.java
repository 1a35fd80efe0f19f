package com.example.inboxsync.controller;

import com.example.inboxsync.service.exception.SyncErrorType;
import com.example.inboxsync.service.exception.SyncException;
import jakarta.servlet.http.HttpServletRequest;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

/**
 * Maps sync failures to HTTP. Every body carries {@code timestamp}, {@code path},
 * {@code code} and {@code message}; transient failures also advertise {@code Retry-After}.
 */
@Slf4j
@RestControllerAdvice
public class RestExceptionHandler {

    private static final String RETRY_AFTER_SECONDS = "5";

    @ExceptionHandler(SyncException.class)
    public ResponseEntity<Map<String, Object>> handleSyncException(SyncException ex, HttpServletRequest request) {
        String code = ex.getErrorCode() != null ? ex.getErrorCode() : ex.getType().name().toLowerCase(Locale.ROOT);
        ResponseEntity.BodyBuilder response = ResponseEntity.status(ex.getStatus());
        if (ex.getType() == SyncErrorType.TRANSIENT) {
            log.warn("Transient failure on {}: {}", request.getRequestURI(), ex.getMessage());
            response.header(HttpHeaders.RETRY_AFTER, RETRY_AFTER_SECONDS);
        } else {
            log.debug("Rejected {} with {}: {}", request.getRequestURI(), code, ex.getMessage());
        }
        return response.body(body(request, code, ex.getMessage()));
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<Map<String, Object>> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        List<Map<String, String>> violations = ex.getBindingResult().getFieldErrors().stream()
                .map(error -> Map.of(
                        "field", error.getField(),
                        "reason", String.valueOf(error.getDefaultMessage())))
                .toList();
        Map<String, Object> payload = body(request, "validation_error", "Request failed validation");
        payload.put("violations", violations);
        return ResponseEntity.badRequest().body(payload);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        return ResponseEntity.badRequest()
                .body(body(request, "malformed_request", "Request body is not valid JSON for this endpoint"));
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(
            IllegalArgumentException ex, HttpServletRequest request) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(body(request, "invalid_argument", ex.getMessage()));
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleUnexpected(Exception ex, HttpServletRequest request) {
        log.error("Unhandled failure on {}", request.getRequestURI(), ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(body(request, "internal_error", "Unexpected server error"));
    }

    private static Map<String, Object> body(HttpServletRequest request, String code, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("timestamp", Instant.now().toString());
        payload.put("path", request.getRequestURI());
        payload.put("code", code);
        payload.put("message", message != null ? message : code);
        return payload;
    }
}
