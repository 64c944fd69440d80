package com.example.reconciliation.model;

import lombok.Builder;

/**
 * Everything a single reconciliation needs beyond the two ledgers themselves.
 * Passed explicitly into every invocation; the engine reads no ambient configuration.
 */
@Builder(toBuilder = true)
public record ReconciliationOptions(
    ColumnMapping fbaColumns,
    ColumnMapping storefrontColumns,
    DuplicateKeyPolicy duplicateKeyPolicy,
    DisplayKeyPolicy displayKeyPolicy,
    ReportFormat reportFormat
) {
    public ReconciliationOptions {
        if (fbaColumns == null) fbaColumns = ColumnMapping.defaults();
        if (storefrontColumns == null) storefrontColumns = ColumnMapping.defaults();
        if (duplicateKeyPolicy == null) duplicateKeyPolicy = DuplicateKeyPolicy.LAST_WRITE_WINS;
        if (displayKeyPolicy == null) displayKeyPolicy = DisplayKeyPolicy.PREFER_STOREFRONT;
        if (reportFormat == null) reportFormat = ReportFormat.CSV;
    }

    public static ReconciliationOptions defaults() {
        return ReconciliationOptions.builder().build();
    }

    public ColumnMapping columnsFor(LedgerSource source) {
        return source == LedgerSource.FBA ? fbaColumns : storefrontColumns;
    }
}
