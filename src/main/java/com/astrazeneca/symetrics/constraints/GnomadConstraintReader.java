package com.astrazeneca.symetrics.constraints;

import com.astrazeneca.symetrics.data.GnomadConstraintRecord;
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
 * Reads gene constraints (synonymous, missense and loss of function z scores, pLI) from the tab-separated
 * gnomAD constraint table.
 */
public class GnomadConstraintReader {
    static final char SEPARATOR = '\t';
    static final char QUOTE = '"';
    static final String[] COLUMNS = {"gene", "transcript", "syn_z", "mis_z", "lof_z", "pLI"};

    private final String path;

    public GnomadConstraintReader(String path) {
        this.path = path;
    }

    /**
     * @param gene HGNC symbol of the gene
     * @return rows of all transcripts of the gene, empty list if the gene is absent
     */
    public List<GnomadConstraintRecord> find(String gene) {
        List<GnomadConstraintRecord> records = new ArrayList<>();
        try (CSVReader reader = new CSVReader(
                new InputStreamReader(new FileInputStream(path), StandardCharsets.UTF_8), SEPARATOR, QUOTE)) {
            String[] header = reader.readNext();
            if (header == null) {
                return records;
            }
            List<String> columns = Arrays.asList(header);
            int[] idx = new int[COLUMNS.length];
            for (int i = 0; i < COLUMNS.length; i++) {
                idx[i] = columns.indexOf(COLUMNS[i]);
                if (idx[i] < 0) {
                    throw new IllegalArgumentException("Column " + COLUMNS[i] + " is missing in gnomAD constraint table " + path);
                }
            }
            String[] values;
            while ((values = reader.readNext()) != null) {
                if (values.length < columns.size() || !gene.equals(values[idx[0]])) {
                    continue;
                }
                records.add(new GnomadConstraintRecord(values[idx[0]], values[idx[1]],
                        toDouble(values[idx[2]]), toDouble(values[idx[3]]),
                        toDouble(values[idx[4]]), toDouble(values[idx[5]])));
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Couldn't read gnomAD constraint table: " + path, e);
        }
        return records;
    }
}
