package com.example.reconciliation.model;

/**
 * How a normalized key that recurs within the same ledger is resolved.
 */
public enum DuplicateKeyPolicy {

    /** The later record replaces the earlier one. */
    LAST_WRITE_WINS,

    /** The ledger is rejected as malformed. */
    REJECT,

    /** The quantities are added together. */
    SUM
}
