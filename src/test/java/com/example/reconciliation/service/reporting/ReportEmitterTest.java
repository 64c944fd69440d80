package com.example.reconciliation.service.reporting;

import com.example.reconciliation.exception.SerializationException;
import com.example.reconciliation.model.ReconciledRow;
import com.example.reconciliation.model.ReconciliationStatus;
import com.example.reconciliation.model.ReportFormat;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ReportEmitter.
 *
 * Tests verify:
 * - Fixed column order and status labels
 * - Absent quantities render as blank cells / JSON nulls
 * - Unclassified rows are refused
 */
class ReportEmitterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ReportEmitter emitter;

    @BeforeEach
    void setUp() {
        emitter = new ReportEmitter(new CsvMapper(), objectMapper);
    }

    @Test
    @DisplayName("Should write CSV with header, blanks for absent quantities and status labels")
    void shouldWriteCsv() {
        // Given
        List<ReconciledRow> rows = List.of(
                classified("ABC-1", 5, 5, ReconciliationStatus.MATCH),
                classified("X", 3, 7, ReconciliationStatus.MISMATCH),
                classified("Y", 2, null, ReconciliationStatus.MISSING_IN_STOREFRONT),
                classified("Z", null, 1, ReconciliationStatus.MISSING_IN_FBA));

        // When
        String csv = new String(emitter.emit(rows, ReportFormat.CSV), StandardCharsets.UTF_8);

        // Then
        assertThat(csv).isEqualTo(
                "identifier,fba_quantity,storefront_quantity,status\n" +
                "ABC-1,5,5,Match\n" +
                "X,3,7,Mismatch\n" +
                "Y,2,,MissingInStorefront\n" +
                "Z,,1,MissingInFBA\n");
    }

    @Test
    @DisplayName("Should write the display key, not the match key")
    void shouldWriteDisplayKey() {
        ReconciledRow row = ReconciledRow.unclassified("ABC-1", "Abc-1", 1, 1)
                .withStatus(ReconciliationStatus.MATCH);

        String csv = new String(emitter.emit(List.of(row), ReportFormat.CSV), StandardCharsets.UTF_8);

        assertThat(csv).contains("Abc-1,1,1,Match");
    }

    @Test
    @DisplayName("Should write JSON with nulls for absent quantities")
    void shouldWriteJson() throws Exception {
        // Given
        List<ReconciledRow> rows = List.of(
                classified("Y", 2, null, ReconciliationStatus.MISSING_IN_STOREFRONT));

        // When
        JsonNode json = objectMapper.readTree(emitter.emit(rows, ReportFormat.JSON));

        // Then
        assertThat(json.isArray()).isTrue();
        JsonNode first = json.get(0);
        assertThat(first.get("identifier").asText()).isEqualTo("Y");
        assertThat(first.get("fba_quantity").asInt()).isEqualTo(2);
        assertThat(first.get("storefront_quantity").isNull()).isTrue();
        assertThat(first.get("status").asText()).isEqualTo("MissingInStorefront");
    }

    @Test
    @DisplayName("Row without status fails with a serialization error naming the key")
    void shouldRejectUnclassifiedRow() {
        List<ReconciledRow> rows = List.of(
                classified("A", 1, 1, ReconciliationStatus.MATCH),
                ReconciledRow.unclassified("B", "B", 1, 2));

        assertThatThrownBy(() -> emitter.emit(rows, ReportFormat.CSV))
                .isInstanceOf(SerializationException.class)
                .hasMessageContaining("B");
    }

    private static ReconciledRow classified(String key, Integer fba, Integer storefront, ReconciliationStatus status) {
        return ReconciledRow.unclassified(key, key, fba, storefront).withStatus(status);
    }
}
