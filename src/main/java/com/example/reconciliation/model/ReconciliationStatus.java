package com.example.reconciliation.model;

/**
 * Agreement status of one product across both ledgers.
 *
 * <ul>
 *   <li>MATCH                 - Both ledgers carry the product with the same quantity.</li>
 *   <li>MISMATCH              - Both ledgers carry the product with different quantities.</li>
 *   <li>MISSING_IN_FBA        - Only the storefront ledger carries the product.</li>
 *   <li>MISSING_IN_STOREFRONT - Only the FBA ledger carries the product.</li>
 * </ul>
 */
public enum ReconciliationStatus {

    MATCH("Match"),
    MISMATCH("Mismatch"),
    MISSING_IN_FBA("MissingInFBA"),
    MISSING_IN_STOREFRONT("MissingInStorefront");

    private final String label;

    ReconciliationStatus(String label) {
        this.label = label;
    }

    /**
     * Value written to the report's status column.
     */
    public String label() {
        return label;
    }
}
