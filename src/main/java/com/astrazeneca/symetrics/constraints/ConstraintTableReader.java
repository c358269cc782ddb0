package com.astrazeneca.symetrics.constraints;

import com.astrazeneca.symetrics.data.MetricGroup;
import com.opencsv.CSVReader;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.astrazeneca.symetrics.Utils.toDouble;

/**
 * Reads comma-separated constraint tables. Text cells may be quoted and contain commas. The gene column name
 * depends on the group (GENES or GENE), the statistic columns are pval, fdr and z. Other columns are ignored.
 */
public class ConstraintTableReader {
    static final char SEPARATOR = ',';
    static final char QUOTE = '"';

    /**
     * @param path path to the table
     * @param group metric group the table belongs to
     * @return whole table
     * @throws UncheckedIOException if the file can't be read
     * @throws IllegalArgumentException if one of the required columns is missing
     */
    public ConstraintTable read(String path, MetricGroup group) {
        List<ConstraintTable.Entry> entries = new ArrayList<>();
        try (CSVReader reader = new CSVReader(
                new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8), SEPARATOR, QUOTE)) {
            String[] header = reader.readNext();
            if (header == null) {
                return new ConstraintTable(entries);
            }
            List<String> columns = trim(header);
            int geneIdx = columnIndex(columns, group.getGeneColumn(), path);
            int pvalIdx = columnIndex(columns, MetricGroup.PVALUE_COLUMN, path);
            int fdrIdx = columnIndex(columns, MetricGroup.FDR_COLUMN, path);
            int zIdx = columnIndex(columns, MetricGroup.STATISTIC_COLUMN, path);

            String[] values;
            while ((values = reader.readNext()) != null) {
                if (values.length == 1 && values[0].trim().isEmpty()) {
                    continue;
                }
                if (values.length < columns.size()) {
                    System.err.println("Skipped malformed line of " + path + ": " + Arrays.toString(values));
                    continue;
                }
                entries.add(new ConstraintTable.Entry(
                        values[geneIdx].trim(),
                        toDouble(values[pvalIdx]),
                        toDouble(values[fdrIdx]),
                        toDouble(values[zIdx])));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't read constraint table: " + path, e);
        }
        return new ConstraintTable(entries);
    }

    private static List<String> trim(String[] header) {
        List<String> columns = new ArrayList<>();
        for (String column : header) {
            columns.add(column.trim());
        }
        return columns;
    }

    private static int columnIndex(List<String> columns, String column, String path) {
        int idx = columns.indexOf(column);
        if (idx < 0) {
            throw new IllegalArgumentException("Column " + column + " is missing in constraint table " + path
                    + ". Found columns: " + columns);
        }
        return idx;
    }
}
