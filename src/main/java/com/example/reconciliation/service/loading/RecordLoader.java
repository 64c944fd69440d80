package com.example.reconciliation.service.loading;

import com.example.reconciliation.exception.MalformedInputException;
import com.example.reconciliation.model.ColumnMapping;
import com.example.reconciliation.model.InventoryRecord;
import com.example.reconciliation.model.LedgerSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Parses a CSV ledger with a header row into inventory records.
 *
 * <p>Only the identifier and quantity columns named by the {@link ColumnMapping} are read;
 * other columns are ignored. Records keep their input order and duplicate identifiers are
 * kept as separate records. Any structural or value problem fails the whole ledger with a
 * {@link MalformedInputException}.
 */
public class RecordLoader {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    // Optional minus sign and ASCII digits; no '+' and no non-ASCII digits
    private static final Pattern INTEGER = Pattern.compile("-?[0-9]+");

    private final CsvMapper csvMapper;

    public RecordLoader(CsvMapper csvMapper) {
        this.csvMapper = csvMapper;
    }

    /**
     * Reads the stream to the end and parses it.
     */
    public List<InventoryRecord> load(InputStream in, ColumnMapping columns, LedgerSource source) {
        try {
            return load(in.readAllBytes(), columns, source);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + source.displayName() + " ledger", e);
        }
    }

    public List<InventoryRecord> load(byte[] content, ColumnMapping columns, LedgerSource source) {
        List<String[]> lines = readLines(content, source);
        if (lines.isEmpty()) {
            throw MalformedInputException.missingColumn(source, columns.identifierColumn());
        }

        Map<String, Integer> header = indexHeader(lines.get(0));
        int keyIndex = requireColumn(header, columns.identifierColumn(), source);
        int quantityIndex = requireColumn(header, columns.quantityColumn(), source);

        List<InventoryRecord> records = new ArrayList<>(lines.size() - 1);
        for (int i = 1; i < lines.size(); i++) {
            String[] line = lines.get(i);
            int rowIndex = i;

            String key = cell(line, keyIndex);
            if (key.isEmpty()) {
                throw MalformedInputException.blankIdentifier(source, columns.identifierColumn(), rowIndex);
            }
            int quantity = parseQuantity(cell(line, quantityIndex), columns.quantityColumn(), rowIndex, source);
            records.add(new InventoryRecord(key, quantity, source));
        }
        return records;
    }

    private List<String[]> readLines(byte[] content, LedgerSource source) {
        List<String[]> lines = new ArrayList<>();
        try (MappingIterator<String[]> it = csvMapper.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .readValues(content)) {
            while (it.hasNextValue()) {
                String[] line = it.nextValue();
                if (!isBlank(line)) {
                    lines.add(line);
                }
            }
        } catch (JsonProcessingException e) {
            throw new MalformedInputException(
                    source.displayName() + " ledger is not valid CSV: " + e.getOriginalMessage(), source, e);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to parse " + source.displayName() + " ledger", e);
        }
        return lines;
    }

    private Map<String, Integer> indexHeader(String[] headerLine) {
        Map<String, Integer> header = new HashMap<>();
        for (int i = 0; i < headerLine.length; i++) {
            String name = headerLine[i] == null ? "" : headerLine[i];
            if (i == 0 && name.startsWith(BYTE_ORDER_MARK)) {
                name = name.substring(BYTE_ORDER_MARK.length());
            }
            header.putIfAbsent(name.strip(), i);
        }
        return header;
    }

    private int requireColumn(Map<String, Integer> header, String column, LedgerSource source) {
        Integer index = header.get(column);
        if (index == null) {
            throw MalformedInputException.missingColumn(source, column);
        }
        return index;
    }

    private int parseQuantity(String value, String column, int rowIndex, LedgerSource source) {
        if (!INTEGER.matcher(value).matches()) {
            throw MalformedInputException.invalidQuantity(source, column, rowIndex, value);
        }
        int quantity;
        try {
            quantity = Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw MalformedInputException.invalidQuantity(source, column, rowIndex, value);
        }
        if (quantity < 0) {
            throw MalformedInputException.negativeQuantity(source, column, rowIndex, quantity);
        }
        return quantity;
    }

    private static String cell(String[] line, int index) {
        if (index >= line.length || line[index] == null) {
            return "";
        }
        return line[index].strip();
    }

    private static boolean isBlank(String[] line) {
        for (String value : line) {
            if (value != null && !value.isBlank()) {
                return false;
            }
        }
        return true;
    }
}
