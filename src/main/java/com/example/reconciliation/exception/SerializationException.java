package com.example.reconciliation.exception;

/**
 * The report could not be serialized. Raised when a row reaches the emitter without a status,
 * which points at a defect in classification rather than at bad input.
 */
public class SerializationException extends ReconciliationException {

    public SerializationException(String message) {
        super(message);
    }

    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
