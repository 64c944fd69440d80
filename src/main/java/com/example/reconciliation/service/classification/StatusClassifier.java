package com.example.reconciliation.service.classification;

import com.example.reconciliation.model.ReconciledRow;
import com.example.reconciliation.model.ReconciliationStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Assigns each joined row exactly one {@link ReconciliationStatus}.
 *
 * <p>A missing side always wins over a quantity comparison, so a row with one ledger absent is
 * never a {@link ReconciliationStatus#MISMATCH}.
 */
public class StatusClassifier {

    public ReconciliationStatus classify(ReconciledRow row) {
        if (!row.hasFbaQuantity() && !row.hasStorefrontQuantity()) {
            throw new IllegalArgumentException("Row " + row.key() + " has no quantity in either ledger");
        }
        if (!row.hasStorefrontQuantity()) {
            return ReconciliationStatus.MISSING_IN_STOREFRONT;
        }
        if (!row.hasFbaQuantity()) {
            return ReconciliationStatus.MISSING_IN_FBA;
        }
        return row.fbaQuantity().equals(row.storefrontQuantity())
                ? ReconciliationStatus.MATCH
                : ReconciliationStatus.MISMATCH;
    }

    public ReconciledRow apply(ReconciledRow row) {
        return row.withStatus(classify(row));
    }

    public List<ReconciledRow> applyAll(List<ReconciledRow> rows) {
        List<ReconciledRow> classified = new ArrayList<>(rows.size());
        for (ReconciledRow row : rows) {
            classified.add(apply(row));
        }
        return classified;
    }
}
