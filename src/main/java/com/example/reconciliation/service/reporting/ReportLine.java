package com.example.reconciliation.service.reporting;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * One serialized report row. Field order is the report's column order.
 */
@JsonPropertyOrder({"identifier", "fba_quantity", "storefront_quantity", "status"})
public record ReportLine(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("fba_quantity") Integer fbaQuantity,
    @JsonProperty("storefront_quantity") Integer storefrontQuantity,
    @JsonProperty("status") String status
) {}
