package com.transitbot.output;

import com.transitbot.model.LightCurveRecord;
import com.transitbot.model.TransitRecord;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVPrinter;
import org.apache.commons.csv.CSVRecord;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Merges new rows into the persistent CSV summary tables.
 *
 * <p>Rows are keyed; a new row replaces any existing row with the same key, all other rows are
 * kept, and the table is rewritten sorted by key with a fixed column order.
 */
public class SummaryTableWriter {
    private static final Logger LOG = LogManager.getLogger(SummaryTableWriter.class);

    private static final CSVFormat READ_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreEmptyLines(true)
            .build();

    /**
     * Merges per-transit rows keyed by (file, transit_index). Returns the number of rows written,
     * or 0 without touching the file when {@code records} is empty.
     */
    public int mergeTransits(Path path, List<TransitRecord> records) throws IOException {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        List<List<String>> rows = new ArrayList<>(records.size());
        for (TransitRecord record : records) {
            rows.add(record.toRow());
        }
        return merge(path, TransitRecord.COLUMNS, rows, true);
    }

    /**
     * Merges per-light-curve rows keyed by file.
     */
    public int mergeCurves(Path path, List<LightCurveRecord> records) throws IOException {
        if (records == null || records.isEmpty()) {
            return 0;
        }
        List<List<String>> rows = new ArrayList<>(records.size());
        for (LightCurveRecord record : records) {
            rows.add(record.toRow());
        }
        return merge(path, LightCurveRecord.COLUMNS, rows, false);
    }

    int merge(Path path, List<String> columns, List<List<String>> newRows, boolean indexed) throws IOException {
        TreeMap<RowKey, List<String>> table = new TreeMap<>();
        if (Files.exists(path)) {
            for (List<String> row : readExisting(path, columns)) {
                RowKey key = keyOf(row, indexed);
                if (key == null) {
                    LOG.warn("Dropping row with unreadable key from {}: {}", path, row);
                    continue;
                }
                table.put(key, row);
            }
        }
        for (List<String> row : newRows) {
            table.put(Objects.requireNonNull(keyOf(row, indexed), "row key"), row);
        }

        if (path.getParent() != null) {
            Files.createDirectories(path.getParent());
        }
        CSVFormat writeFormat = CSVFormat.DEFAULT.builder()
                .setHeader(columns.toArray(new String[0]))
                .setRecordSeparator('\n')
                .build();
        try (Writer out = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(out, writeFormat)) {
            for (List<String> row : table.values()) {
                printer.printRecord(row);
            }
        }
        LOG.info("Wrote {} rows to {}", table.size(), path);
        return table.size();
    }

    // Existing rows are projected onto the current column order; unknown columns are dropped.
    private static List<List<String>> readExisting(Path path, List<String> columns) throws IOException {
        List<List<String>> rows = new ArrayList<>();
        try (Reader in = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             CSVParser parser = CSVParser.parse(in, READ_FORMAT)) {
            Map<String, Integer> header = parser.getHeaderMap();
            if (header == null) {
                return rows;
            }
            for (CSVRecord record : parser) {
                List<String> row = new ArrayList<>(columns.size());
                for (String column : columns) {
                    Integer idx = header.get(column);
                    row.add(idx != null && idx < record.size() ? record.get(idx) : "");
                }
                rows.add(row);
            }
        }
        return rows;
    }

    private static RowKey keyOf(List<String> row, boolean indexed) {
        String file = row.get(0);
        if (!indexed) {
            return new RowKey(file, 0L);
        }
        try {
            return new RowKey(file, (long) Double.parseDouble(row.get(1).trim()));
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static final class RowKey implements Comparable<RowKey> {
        final String file;
        final long index;

        RowKey(String file, long index) {
            this.file = file == null ? "" : file;
            this.index = index;
        }

        @Override
        public int compareTo(RowKey other) {
            int c = file.compareTo(other.file);
            return c != 0 ? c : Long.compare(index, other.index);
        }

        @Override
        public boolean equals(Object o) {
            if (!(o instanceof RowKey)) {
                return false;
            }
            RowKey other = (RowKey) o;
            return file.equals(other.file) && index == other.index;
        }

        @Override
        public int hashCode() {
            return Objects.hash(file, index);
        }
    }
}
