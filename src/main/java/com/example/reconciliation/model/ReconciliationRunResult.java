package com.example.reconciliation.model;

import java.time.Instant;

/**
 * Outcome of a successful storage-backed run.
 */
public record ReconciliationRunResult(
    String runId,
    String outputLocation,
    ReconciliationSummary summary,
    long durationMs,
    Instant completedAt
) {}
