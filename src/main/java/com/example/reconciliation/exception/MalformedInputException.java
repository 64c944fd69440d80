package com.example.reconciliation.exception;

import com.example.reconciliation.model.LedgerSource;

/**
 * A ledger could not be used as reconciliation input. Aborts the run; nothing is reconciled.
 *
 * <p>{@link #getSource()}, {@link #getColumn()} and {@link #getRowIndex()} identify the
 * offending ledger, column and 1-based data row where they apply, and are null otherwise.
 */
public class MalformedInputException extends ReconciliationException {

    private final LedgerSource source;
    private final String column;
    private final Integer rowIndex;

    public MalformedInputException(String message, LedgerSource source, String column, Integer rowIndex) {
        super(message);
        this.source = source;
        this.column = column;
        this.rowIndex = rowIndex;
    }

    public MalformedInputException(String message, LedgerSource source, Throwable cause) {
        super(message, cause);
        this.source = source;
        this.column = null;
        this.rowIndex = null;
    }

    public static MalformedInputException missingColumn(LedgerSource source, String column) {
        return new MalformedInputException(
                String.format("%s ledger is missing required column '%s'", label(source), column),
                source, column, null);
    }

    public static MalformedInputException invalidQuantity(LedgerSource source, String column, int rowIndex, String value) {
        return new MalformedInputException(
                String.format("%s ledger row %d: quantity '%s' in column '%s' is not an integer",
                        label(source), rowIndex, value, column),
                source, column, rowIndex);
    }

    public static MalformedInputException negativeQuantity(LedgerSource source, String column, int rowIndex, int value) {
        return new MalformedInputException(
                String.format("%s ledger row %d: quantity %d in column '%s' is negative",
                        label(source), rowIndex, value, column),
                source, column, rowIndex);
    }

    public static MalformedInputException blankIdentifier(LedgerSource source, String column, int rowIndex) {
        return new MalformedInputException(
                String.format("%s ledger row %d: identifier column '%s' is blank", label(source), rowIndex, column),
                source, column, rowIndex);
    }

    public static MalformedInputException duplicateKey(LedgerSource source, String key) {
        return new MalformedInputException(
                String.format("%s ledger contains identifier '%s' more than once", label(source), key),
                source, null, null);
    }

    public static MalformedInputException quantityOverflow(LedgerSource source, String key) {
        return new MalformedInputException(
                String.format("%s ledger: summed quantity for identifier '%s' overflows", label(source), key),
                source, null, null);
    }

    public LedgerSource getSource() {
        return source;
    }

    public String getColumn() {
        return column;
    }

    public Integer getRowIndex() {
        return rowIndex;
    }

    private static String label(LedgerSource source) {
        return source != null ? source.displayName() : "Unknown";
    }
}
