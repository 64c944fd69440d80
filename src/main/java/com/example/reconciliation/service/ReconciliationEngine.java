package com.example.reconciliation.service;

import com.example.reconciliation.exception.MalformedInputException;
import com.example.reconciliation.exception.SerializationException;
import com.example.reconciliation.model.InventoryRecord;
import com.example.reconciliation.model.LedgerSource;
import com.example.reconciliation.model.ReconciledRow;
import com.example.reconciliation.model.ReconciliationOptions;
import com.example.reconciliation.model.ReconciliationReport;
import com.example.reconciliation.model.ReconciliationSummary;
import com.example.reconciliation.service.classification.StatusClassifier;
import com.example.reconciliation.service.loading.RecordLoader;
import com.example.reconciliation.service.merge.Reconciler;
import com.example.reconciliation.service.reporting.ReportEmitter;

import java.util.List;

/**
 * Entry point of the reconciliation core: join, classify, serialize.
 *
 * <p>The engine does no I/O, keeps no state between calls and does not log; callers supply
 * already-materialized ledgers and decide what to do with the report or the error. Independent
 * calls may run concurrently.
 */
public class ReconciliationEngine {

    private final RecordLoader recordLoader;
    private final Reconciler reconciler;
    private final StatusClassifier classifier;
    private final ReportEmitter reportEmitter;

    public ReconciliationEngine(RecordLoader recordLoader, Reconciler reconciler,
                                StatusClassifier classifier, ReportEmitter reportEmitter) {
        this.recordLoader = recordLoader;
        this.reconciler = reconciler;
        this.classifier = classifier;
        this.reportEmitter = reportEmitter;
    }

    /**
     * Reconciles two parsed ledgers.
     *
     * @throws MalformedInputException if the duplicate-key policy rejects a ledger
     * @throws SerializationException  if the report cannot be written
     */
    public ReconciliationReport reconcile(List<InventoryRecord> fbaRecords,
                                          List<InventoryRecord> storefrontRecords,
                                          ReconciliationOptions options) {
        List<ReconciledRow> joined = reconciler.reconcile(
                fbaRecords, storefrontRecords, options.duplicateKeyPolicy(), options.displayKeyPolicy());
        List<ReconciledRow> classified = classifier.applyAll(joined);
        byte[] content = reportEmitter.emit(classified, options.reportFormat());
        return new ReconciliationReport(classified, ReconciliationSummary.of(classified), content, options.reportFormat());
    }

    /**
     * Parses both raw CSV ledgers with the configured column names, then reconciles them.
     * The FBA ledger is parsed first; the first malformed ledger aborts the run.
     */
    public ReconciliationReport reconcile(byte[] fbaContent, byte[] storefrontContent,
                                          ReconciliationOptions options) {
        List<InventoryRecord> fba = recordLoader.load(fbaContent, options.columnsFor(LedgerSource.FBA), LedgerSource.FBA);
        List<InventoryRecord> storefront =
                recordLoader.load(storefrontContent, options.columnsFor(LedgerSource.STOREFRONT), LedgerSource.STOREFRONT);
        return reconcile(fba, storefront, options);
    }
}
