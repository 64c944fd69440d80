package com.example.reconciliation.service;

import com.example.reconciliation.config.AppMetrics;
import com.example.reconciliation.config.TraceContextManager;
import com.example.reconciliation.model.ReconciliationOptions;
import com.example.reconciliation.model.ReconciliationReport;
import com.example.reconciliation.model.ReconciliationRequest;
import com.example.reconciliation.model.ReconciliationRunResult;
import com.example.reconciliation.model.ReconciliationSummary;
import com.example.reconciliation.storage.LedgerStorage;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;

/**
 * Orchestrates a reconciliation run around the side-effect-free engine.
 *
 * Stages:
 * 1. Load   - read both ledgers from {@link LedgerStorage} into memory
 * 2. Engine - parse, join, classify, serialize ({@link ReconciliationEngine})
 * 3. Write  - store the report atomically
 *
 * The engine raises and never logs; this class logs, records metrics and rethrows.
 */
@Service
@Slf4j
public class ReconciliationOrchestrator {

    private final ReconciliationEngine engine;
    private final LedgerStorage storage;
    private final AppMetrics metrics;
    private final ReconciliationOptions defaultOptions;

    public ReconciliationOrchestrator(
            ReconciliationEngine engine,
            LedgerStorage storage,
            AppMetrics metrics,
            @Qualifier("defaultReconciliationOptions") ReconciliationOptions defaultOptions) {
        this.engine = engine;
        this.storage = storage;
        this.metrics = metrics;
        this.defaultOptions = defaultOptions;
    }

    public ReconciliationOptions getDefaultOptions() {
        return defaultOptions;
    }

    /**
     * Storage-backed run with the default options.
     */
    public ReconciliationRunResult run(ReconciliationRequest request) {
        return run(request, defaultOptions);
    }

    /**
     * Reads both ledgers named by the request, reconciles them and writes the report.
     * Nothing is written when any stage fails.
     *
     * @return the run's summary and where the report went
     */
    public ReconciliationRunResult run(ReconciliationRequest request, ReconciliationOptions options) {
        try {
            validate(request);
        } catch (IllegalArgumentException e) {
            metrics.incrementRunsFailed();
            log.warn("Rejected reconciliation request: {}", e.getMessage());
            throw e;
        }
        String runId = request.runId() != null && !request.runId().isBlank()
                ? request.runId()
                : TraceContextManager.generateRunId();
        String previousRunId = MDC.get(TraceContextManager.RUN_ID);
        TraceContextManager.putRunId(runId);

        long startTime = System.currentTimeMillis();
        try {
            log.info("═══════════════════════════════════════════════════════════════");
            log.info("RUN START: {} | FBA: {} | Storefront: {}", runId, request.fbaLocation(), request.storefrontLocation());
            log.info("═══════════════════════════════════════════════════════════════");

            // STAGE 1: Load both ledgers
            long loadStart = System.currentTimeMillis();
            byte[] fbaContent = storage.read(request.fbaLocation());
            byte[] storefrontContent = storage.read(request.storefrontLocation());
            long loadTime = System.currentTimeMillis() - loadStart;
            metrics.recordLoadTime(loadTime);

            // STAGE 2: Reconcile
            long engineStart = System.currentTimeMillis();
            ReconciliationReport report = engine.reconcile(fbaContent, storefrontContent, options);
            long engineTime = System.currentTimeMillis() - engineStart;
            metrics.recordEngineTime(engineTime);

            // STAGE 3: Write report
            long writeStart = System.currentTimeMillis();
            storage.write(request.outputLocation(), report.content());
            long writeTime = System.currentTimeMillis() - writeStart;
            metrics.recordWriteTime(writeTime);

            long totalTime = System.currentTimeMillis() - startTime;
            metrics.recordTotalRunTime(totalTime);
            metrics.recordRunSucceeded(report.summary());

            logCompletion(runId, report.summary(), totalTime, loadTime, engineTime, writeTime);

            return new ReconciliationRunResult(runId, request.outputLocation(), report.summary(), totalTime, Instant.now());
        } catch (RuntimeException e) {
            metrics.incrementRunsFailed();
            log.error("RUN FAILED: {} after {}ms: {}", runId, System.currentTimeMillis() - startTime, e.getMessage());
            throw e;
        } finally {
            restoreRunId(previousRunId);
        }
    }

    /**
     * Reconciles two ledgers supplied by the caller (e.g. uploaded over HTTP) without touching storage.
     */
    public ReconciliationReport reconcileContent(byte[] fbaContent, byte[] storefrontContent,
                                                 ReconciliationOptions options) {
        long startTime = System.currentTimeMillis();
        try {
            ReconciliationReport report = engine.reconcile(fbaContent, storefrontContent, options);
            long engineTime = System.currentTimeMillis() - startTime;
            metrics.recordEngineTime(engineTime);
            metrics.recordTotalRunTime(engineTime);
            metrics.recordRunSucceeded(report.summary());
            log.info("Reconciled uploaded ledgers in {}ms: {}", engineTime, report.summary());
            return report;
        } catch (RuntimeException e) {
            metrics.incrementRunsFailed();
            log.warn("Reconciliation of uploaded ledgers failed: {}", e.getMessage());
            throw e;
        }
    }

    private void validate(ReconciliationRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Reconciliation request must not be null");
        }
        requireLocation(request.fbaLocation(), "fbaLocation");
        requireLocation(request.storefrontLocation(), "storefrontLocation");
        requireLocation(request.outputLocation(), "outputLocation");
    }

    private static void requireLocation(String location, String field) {
        if (location == null || location.isBlank()) {
            throw new IllegalArgumentException(field + " must not be blank");
        }
    }

    private static void restoreRunId(String previousRunId) {
        if (previousRunId != null) {
            TraceContextManager.putRunId(previousRunId);
        } else {
            MDC.remove(TraceContextManager.RUN_ID);
        }
    }

    private void logCompletion(String runId, ReconciliationSummary summary,
                               long totalTime, long loadTime, long engineTime, long writeTime) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("RUN COMPLETE: {} | Total: {}ms", runId, totalTime);
        log.info("  Load: {}ms | Reconcile: {}ms | Write: {}ms", loadTime, engineTime, writeTime);
        log.info("  Keys: {} | Match: {} | Mismatch: {} | MissingInFBA: {} | MissingInStorefront: {}",
                summary.totalKeys(), summary.matched(), summary.mismatched(),
                summary.missingInFba(), summary.missingInStorefront());
        log.info("═══════════════════════════════════════════════════════════════");
    }
}
