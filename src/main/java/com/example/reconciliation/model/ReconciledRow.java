package com.example.reconciliation.model;

import java.util.Objects;

/**
 * One row of the outer join: a normalized key with the quantity each ledger holds for it.
 * A null quantity means the ledger has no record for the key. The status stays null until
 * the row has been classified, and can be assigned only once.
 */
public record ReconciledRow(
    String key,
    String displayKey,
    Integer fbaQuantity,
    Integer storefrontQuantity,
    ReconciliationStatus status
) {
    public ReconciledRow {
        Objects.requireNonNull(key, "key");
        if (displayKey == null) {
            displayKey = key;
        }
    }

    /**
     * Creates an unclassified row.
     */
    public static ReconciledRow unclassified(String key, String displayKey,
                                             Integer fbaQuantity, Integer storefrontQuantity) {
        return new ReconciledRow(key, displayKey, fbaQuantity, storefrontQuantity, null);
    }

    public boolean hasFbaQuantity() {
        return fbaQuantity != null;
    }

    public boolean hasStorefrontQuantity() {
        return storefrontQuantity != null;
    }

    public boolean isClassified() {
        return status != null;
    }

    /**
     * Returns the classified copy of this row.
     *
     * @throws IllegalStateException if the row already carries a status
     */
    public ReconciledRow withStatus(ReconciliationStatus newStatus) {
        Objects.requireNonNull(newStatus, "status");
        if (status != null) {
            throw new IllegalStateException("Row " + key + " is already classified as " + status);
        }
        return new ReconciledRow(key, displayKey, fbaQuantity, storefrontQuantity, newStatus);
    }
}
