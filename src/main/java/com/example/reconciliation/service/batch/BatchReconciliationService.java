package com.example.reconciliation.service.batch;

import com.example.reconciliation.model.BatchResult;
import com.example.reconciliation.model.FailedRun;
import com.example.reconciliation.model.ReconciliationRequest;
import com.example.reconciliation.model.ReconciliationRunResult;
import com.example.reconciliation.service.ReconciliationOrchestrator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Runs independent ledger pairs in parallel.
 *
 * Runs share no state, so the only limit is memory: a Semaphore caps how many pairs are
 * materialized at once. A failing run is recorded and never stops the others.
 */
@Service
@Slf4j
public class BatchReconciliationService {

    private final ReconciliationOrchestrator orchestrator;
    private final Semaphore runSemaphore;

    public BatchReconciliationService(
            ReconciliationOrchestrator orchestrator,
            @Value("${app.executor.reconciliation-concurrency:4}") int reconciliationConcurrency) {
        this.orchestrator = orchestrator;
        this.runSemaphore = new Semaphore(reconciliationConcurrency);
        log.info("BatchReconciliationService initialized with concurrency limit: {}", reconciliationConcurrency);
    }

    /**
     * Run every request and wait for all of them.
     *
     * @param requests Runs to execute
     * @param executor Executor for parallel runs
     * @return successes and failures, in completion order
     */
    public BatchResult runAll(List<ReconciliationRequest> requests, ExecutorService executor) {
        if (requests.isEmpty()) {
            return new BatchResult(List.of(), List.of(), 0);
        }

        long startTime = System.currentTimeMillis();
        log.info("Running {} reconciliations in PARALLEL (max {} concurrent)...",
                requests.size(), runSemaphore.availablePermits());

        List<ReconciliationRunResult> successes = new CopyOnWriteArrayList<>();
        List<FailedRun> failures = new CopyOnWriteArrayList<>();

        List<CompletableFuture<Void>> futures = requests.stream()
                .map(request -> CompletableFuture.runAsync(() ->
                        runWithSemaphore(request, successes, failures), executor))
                .toList();

        // Wait for all to complete
        CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("Batch complete in {}ms: {} successes, {} failures", elapsed, successes.size(), failures.size());
        return new BatchResult(List.copyOf(successes), List.copyOf(failures), elapsed);
    }

    private void runWithSemaphore(ReconciliationRequest request,
                                  List<ReconciliationRunResult> successes, List<FailedRun> failures) {
        try {
            runSemaphore.acquire();
            try {
                successes.add(orchestrator.run(request));
            } finally {
                runSemaphore.release();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Reconciliation interrupted for run {}", request.runId());
            failures.add(new FailedRun(request, "Run interrupted", "InterruptedException"));
        } catch (Exception e) {
            log.warn("Reconciliation failed for run {}: {}", request.runId(), e.getMessage());
            failures.add(new FailedRun(request, e.getMessage(), e.getClass().getSimpleName()));
        }
    }
}
