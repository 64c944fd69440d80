package com.example.reconciliation.controller;

import com.example.reconciliation.model.BatchResult;
import com.example.reconciliation.model.ReconciliationOptions;
import com.example.reconciliation.model.ReconciliationReport;
import com.example.reconciliation.model.ReconciliationRequest;
import com.example.reconciliation.model.ReconciliationRunResult;
import com.example.reconciliation.model.ReportFormat;
import com.example.reconciliation.service.ReconciliationOrchestrator;
import com.example.reconciliation.service.batch.BatchReconciliationService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * REST endpoints for triggering reconciliations.
 *
 * POST /api/reconciliations          - upload both ledgers, receive the report
 * POST /api/reconciliations/runs     - reconcile ledgers already in storage
 * POST /api/reconciliations/batch    - several storage-backed runs in parallel
 */
@RestController
@RequestMapping("/api/reconciliations")
@Slf4j
public class ReconciliationController {

    static final String TOTAL_HEADER = "X-Reconciliation-Total";
    static final String DISCREPANCIES_HEADER = "X-Reconciliation-Discrepancies";

    private final ReconciliationOrchestrator orchestrator;
    private final BatchReconciliationService batchService;
    private final ExecutorService executor;

    public ReconciliationController(ReconciliationOrchestrator orchestrator,
                                    BatchReconciliationService batchService,
                                    @Qualifier("reconciliationExecutor") ExecutorService executor) {
        this.orchestrator = orchestrator;
        this.batchService = batchService;
        this.executor = executor;
    }

    /**
     * Reconcile two uploaded CSV ledgers and return the report in the response body.
     */
    @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<byte[]> reconcileUpload(
            @RequestPart("fba") MultipartFile fba,
            @RequestPart("storefront") MultipartFile storefront,
            @RequestParam(value = "format", required = false) ReportFormat format) {
        log.info("Upload reconciliation: fba={} ({} bytes), storefront={} ({} bytes)",
                fba.getOriginalFilename(), fba.getSize(), storefront.getOriginalFilename(), storefront.getSize());

        ReconciliationOptions options = orchestrator.getDefaultOptions();
        if (format != null) {
            options = options.toBuilder().reportFormat(format).build();
        }

        ReconciliationReport report = orchestrator.reconcileContent(bytesOf(fba), bytesOf(storefront), options);

        return ResponseEntity.ok()
                .contentType(MediaType.parseMediaType(report.format().contentType()))
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"reconciliation." + report.format().name().toLowerCase() + "\"")
                .header(TOTAL_HEADER, String.valueOf(report.summary().totalKeys()))
                .header(DISCREPANCIES_HEADER, String.valueOf(report.summary().discrepancies()))
                .body(report.content());
    }

    @PostMapping(value = "/runs", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ReconciliationRunResult run(@RequestBody ReconciliationRequest request) {
        return orchestrator.run(request);
    }

    @PostMapping(value = "/batch", consumes = MediaType.APPLICATION_JSON_VALUE)
    public BatchResult runBatch(@RequestBody List<ReconciliationRequest> requests) {
        log.info("Batch reconciliation requested for {} runs", requests.size());
        return batchService.runAll(requests, executor);
    }

    private static byte[] bytesOf(MultipartFile file) {
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read uploaded ledger " + file.getOriginalFilename(), e);
        }
    }
}
