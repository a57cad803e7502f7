package com.chicu.botjobs.web.controller.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalArgument(IllegalArgumentException ex) {
        return body(HttpStatus.BAD_REQUEST, "bad_request", ex.getMessage(), "IllegalArgumentException");
    }

    @ExceptionHandler(IllegalStateException.class)
    public ResponseEntity<Map<String, Object>> handleIllegalState(IllegalStateException ex) {
        log.error("❌ API error: {}", ex.getMessage(), ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "error", ex.getMessage(), "IllegalStateException");
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code, String message, String fallback) {
        String msg = message == null ? "" : message;

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", code);
        body.put("message", msg.isBlank() ? fallback : msg);
        body.put("timestamp", Instant.now().toEpochMilli());

        return ResponseEntity.status(status).body(body);
    }
}
