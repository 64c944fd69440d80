package com.example.reconciliation.controller;

import com.example.reconciliation.exception.MalformedInputException;
import com.example.reconciliation.exception.SerializationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.io.UncheckedIOException;
import java.time.Instant;

/**
 * Maps reconciliation failures to HTTP responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(MalformedInputException.class)
    public ResponseEntity<ErrorResponse> handleMalformedInput(MalformedInputException ex) {
        log.warn("Malformed ledger: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Malformed Input", ex.getMessage());
    }

    @ExceptionHandler(IllegalArgumentException.class)
    public ResponseEntity<ErrorResponse> handleIllegalArgument(IllegalArgumentException ex) {
        log.warn("Invalid request: {}", ex.getMessage());
        return build(HttpStatus.BAD_REQUEST, "Invalid Request", ex.getMessage());
    }

    @ExceptionHandler(SerializationException.class)
    public ResponseEntity<ErrorResponse> handleSerialization(SerializationException ex) {
        log.error("Report serialization failed: {}", ex.getMessage(), ex);
        return build(HttpStatus.INTERNAL_SERVER_ERROR, "Serialization Error", ex.getMessage());
    }

    @ExceptionHandler(UncheckedIOException.class)
    public ResponseEntity<ErrorResponse> handleStorage(UncheckedIOException ex) {
        log.error("Storage failure: {}", ex.getMessage(), ex);
        return build(HttpStatus.BAD_GATEWAY, "Storage Error", ex.getMessage());
    }

    private ResponseEntity<ErrorResponse> build(HttpStatus status, String error, String message) {
        ErrorResponse body = ErrorResponse.builder()
                .timestamp(Instant.now())
                .status(status.value())
                .error(error)
                .message(message)
                .build();
        return ResponseEntity.status(status).body(body);
    }
}
