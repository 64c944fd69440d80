package com.example.reconciliation.model;

import java.util.List;

/**
 * Result of a batch of independent runs with success/failure tracking.
 */
public record BatchResult(
    List<ReconciliationRunResult> successes,
    List<FailedRun> failures,
    long processingTimeMs
) {}
