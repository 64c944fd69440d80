package com.example.reconciliation.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A storage-backed reconciliation run: where to read both ledgers and where to write the report.
 * Received as JSON by the REST API and the file-drop route.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ReconciliationRequest(
    String runId,
    String fbaLocation,
    String storefrontLocation,
    String outputLocation
) {}
