package com.example.reconciliation.controller;

import lombok.Builder;

import java.time.Instant;

/**
 * JSON body returned for failed requests.
 */
@Builder
public record ErrorResponse(
    Instant timestamp,
    int status,
    String error,
    String message
) {}
