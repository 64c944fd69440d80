package com.example.reconciliation.model;

/**
 * A run that aborted, kept alongside the successes of a batch.
 */
public record FailedRun(
    ReconciliationRequest request,
    String errorMessage,
    String exceptionType
) {}
