package com.example.reconciliation.model;

/**
 * Names of the header columns that hold the product identifier and the quantity in one ledger.
 */
public record ColumnMapping(
    String identifierColumn,
    String quantityColumn
) {
    public ColumnMapping {
        if (identifierColumn == null || identifierColumn.isBlank()) {
            throw new IllegalArgumentException("identifierColumn must not be blank");
        }
        if (quantityColumn == null || quantityColumn.isBlank()) {
            throw new IllegalArgumentException("quantityColumn must not be blank");
        }
        identifierColumn = identifierColumn.strip();
        quantityColumn = quantityColumn.strip();
    }

    public static ColumnMapping defaults() {
        return new ColumnMapping("sku", "quantity");
    }
}
