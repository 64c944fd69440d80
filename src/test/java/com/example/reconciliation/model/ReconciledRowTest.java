package com.example.reconciliation.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconciledRowTest {

    @Test
    @DisplayName("Display key defaults to the match key")
    void shouldDefaultDisplayKey() {
        assertThat(ReconciledRow.unclassified("A", null, 1, null).displayKey()).isEqualTo("A");
    }

    @Test
    @DisplayName("Status can be assigned only once")
    void shouldAssignStatusOnce() {
        ReconciledRow classified = ReconciledRow.unclassified("A", "A", 1, 1).withStatus(ReconciliationStatus.MATCH);

        assertThat(classified.isClassified()).isTrue();
        assertThatThrownBy(() -> classified.withStatus(ReconciliationStatus.MISMATCH))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("Inventory record rejects negative quantities")
    void shouldRejectNegativeQuantity() {
        assertThatThrownBy(() -> new InventoryRecord("A", -1, LedgerSource.FBA))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Summary counts rows per status")
    void shouldSummarizeRows() {
        List<ReconciledRow> rows = List.of(
                ReconciledRow.unclassified("A", "A", 1, 1).withStatus(ReconciliationStatus.MATCH),
                ReconciledRow.unclassified("B", "B", 1, 2).withStatus(ReconciliationStatus.MISMATCH),
                ReconciledRow.unclassified("C", "C", null, 2).withStatus(ReconciliationStatus.MISSING_IN_FBA),
                ReconciledRow.unclassified("D", "D", 4, null).withStatus(ReconciliationStatus.MISSING_IN_STOREFRONT),
                ReconciledRow.unclassified("E", "E", 4, null).withStatus(ReconciliationStatus.MISSING_IN_STOREFRONT));

        ReconciliationSummary summary = ReconciliationSummary.of(rows);

        assertThat(summary).isEqualTo(new ReconciliationSummary(5, 1, 1, 1, 2));
        assertThat(summary.discrepancies()).isEqualTo(4);
        assertThat(summary.countFor(ReconciliationStatus.MISSING_IN_STOREFRONT)).isEqualTo(2);
    }

    @Test
    @DisplayName("Options fill in defaults for unset fields")
    void shouldDefaultOptions() {
        ReconciliationOptions options = ReconciliationOptions.builder()
                .duplicateKeyPolicy(DuplicateKeyPolicy.REJECT)
                .build();

        assertThat(options.fbaColumns()).isEqualTo(ColumnMapping.defaults());
        assertThat(options.displayKeyPolicy()).isEqualTo(DisplayKeyPolicy.PREFER_STOREFRONT);
        assertThat(options.reportFormat()).isEqualTo(ReportFormat.CSV);
        assertThat(options.duplicateKeyPolicy()).isEqualTo(DuplicateKeyPolicy.REJECT);
    }
}
