package com.example.reconciliation.service.reporting;

import com.example.reconciliation.exception.SerializationException;
import com.example.reconciliation.model.ReconciledRow;
import com.example.reconciliation.model.ReportFormat;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.util.ArrayList;
import java.util.List;

/**
 * Serializes classified rows into the audit report.
 *
 * <p>Columns, in order: identifier, FBA quantity, storefront quantity, status. An absent
 * quantity is an empty CSV cell or a JSON null. The whole report is rendered in memory, so a
 * failure never leaves partial output behind.
 */
public class ReportEmitter {

    private final CsvMapper csvMapper;
    private final ObjectMapper objectMapper;
    private final CsvSchema csvSchema;

    public ReportEmitter(CsvMapper csvMapper, ObjectMapper objectMapper) {
        this.csvMapper = csvMapper;
        this.objectMapper = objectMapper;
        this.csvSchema = csvMapper.schemaFor(ReportLine.class)
                .withHeader()
                .withLineSeparator("\n");
    }

    /**
     * @throws SerializationException if a row has no status or the writer fails
     */
    public byte[] emit(List<ReconciledRow> rows, ReportFormat format) {
        List<ReportLine> lines = toLines(rows);
        try {
            return switch (format) {
                case CSV -> csvMapper.writer(csvSchema).writeValueAsBytes(lines);
                case JSON -> objectMapper.writeValueAsBytes(lines);
            };
        } catch (JsonProcessingException e) {
            throw new SerializationException("Failed to write " + format + " report", e);
        }
    }

    private List<ReportLine> toLines(List<ReconciledRow> rows) {
        List<ReportLine> lines = new ArrayList<>(rows.size());
        for (ReconciledRow row : rows) {
            if (!row.isClassified()) {
                throw new SerializationException("Row " + row.key() + " reached the report without a status");
            }
            lines.add(new ReportLine(
                    row.displayKey(),
                    row.fbaQuantity(),
                    row.storefrontQuantity(),
                    row.status().label()));
        }
        return lines;
    }
}
