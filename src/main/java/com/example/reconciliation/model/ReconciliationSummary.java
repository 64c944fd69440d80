package com.example.reconciliation.model;

import java.util.List;

/**
 * Per-status counts of a finished reconciliation.
 */
public record ReconciliationSummary(
    int totalKeys,
    int matched,
    int mismatched,
    int missingInFba,
    int missingInStorefront
) {
    public static ReconciliationSummary of(List<ReconciledRow> rows) {
        int matched = 0;
        int mismatched = 0;
        int missingInFba = 0;
        int missingInStorefront = 0;
        for (ReconciledRow row : rows) {
            if (row.status() == null) {
                continue;
            }
            switch (row.status()) {
                case MATCH -> matched++;
                case MISMATCH -> mismatched++;
                case MISSING_IN_FBA -> missingInFba++;
                case MISSING_IN_STOREFRONT -> missingInStorefront++;
            }
        }
        return new ReconciliationSummary(rows.size(), matched, mismatched, missingInFba, missingInStorefront);
    }

    public int discrepancies() {
        return mismatched + missingInFba + missingInStorefront;
    }

    public boolean hasDiscrepancies() {
        return discrepancies() > 0;
    }

    public int countFor(ReconciliationStatus status) {
        return switch (status) {
            case MATCH -> matched;
            case MISMATCH -> mismatched;
            case MISSING_IN_FBA -> missingInFba;
            case MISSING_IN_STOREFRONT -> missingInStorefront;
        };
    }
}
