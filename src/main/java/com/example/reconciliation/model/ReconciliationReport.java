package com.example.reconciliation.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Output of one reconciliation: the classified rows in key order and their serialized form.
 * Equality compares the serialized content byte by byte.
 */
public record ReconciliationReport(
    List<ReconciledRow> rows,
    ReconciliationSummary summary,
    byte[] content,
    ReportFormat format
) {
    public ReconciliationReport {
        rows = List.copyOf(rows);
        content = content.clone();
    }

    @Override
    public byte[] content() {
        return content.clone();
    }

    public String contentAsString() {
        return new String(content, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ReconciliationReport other)) return false;
        return rows.equals(other.rows)
                && summary.equals(other.summary)
                && Arrays.equals(content, other.content)
                && format == other.format;
    }

    @Override
    public int hashCode() {
        int result = rows.hashCode();
        result = 31 * result + summary.hashCode();
        result = 31 * result + Arrays.hashCode(content);
        result = 31 * result + Objects.hashCode(format);
        return result;
    }

    @Override
    public String toString() {
        return "ReconciliationReport[rows=" + rows.size() + ", summary=" + summary
                + ", format=" + format + ", contentBytes=" + content.length + "]";
    }
}
