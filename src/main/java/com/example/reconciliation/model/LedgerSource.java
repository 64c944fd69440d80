package com.example.reconciliation.model;

/**
 * The two ledgers being reconciled.
 */
public enum LedgerSource {

    FBA("FBA"),
    STOREFRONT("Storefront");

    private final String displayName;

    LedgerSource(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }
}
