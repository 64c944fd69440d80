package com.example.reconciliation.model;

import java.util.Objects;

/**
 * One ledger line: a raw product identifier and its on-hand quantity.
 * An unknown quantity is expressed by leaving the product out of the ledger, never by a null.
 */
public record InventoryRecord(
    String key,
    int quantity,
    LedgerSource source
) {
    public InventoryRecord {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(source, "source");
        if (quantity < 0) {
            throw new IllegalArgumentException("quantity must be >= 0 but was " + quantity + " for key " + key);
        }
    }
}
