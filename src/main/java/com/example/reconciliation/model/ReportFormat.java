package com.example.reconciliation.model;

/**
 * Serialization format of the audit report.
 */
public enum ReportFormat {

    CSV("text/csv"),
    JSON("application/json");

    private final String contentType;

    ReportFormat(String contentType) {
        this.contentType = contentType;
    }

    public String contentType() {
        return contentType;
    }
}
