package com.example.reconciliation.model;

/**
 * Which spelling of a product identifier is written to the report.
 */
public enum DisplayKeyPolicy {

    /** The trimmed, upper-cased key used for matching, even when the ledgers spell it differently. */
    NORMALIZED,

    /** The storefront's raw spelling, or the FBA spelling when the storefront lacks the key. */
    PREFER_STOREFRONT,

    /** The FBA raw spelling, or the storefront spelling when FBA lacks the key. */
    PREFER_FBA
}
