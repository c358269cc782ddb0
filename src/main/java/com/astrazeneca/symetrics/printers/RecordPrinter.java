package com.astrazeneca.symetrics.printers;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.util.Map;

/**
 * Universal class for printing records, one JSON object per line. The "out" stream can be set by implementing
 * new type in enum PrinterType, adding it to method createPrinter() and creating new child RecordPrinter class
 * extending this class. The choice of printer can be made by parameter -DP (PrinterType.OUT by default).
 */
public abstract class RecordPrinter {
    private static final ObjectMapper MAPPER = JsonMapper.builder().build();

    protected PrintStream out;

    /**
     * Prints record as one line of JSON
     * @param record ordered map of the record fields
     */
    public void print(Map<String, Object> record) {
        try {
            out.println(MAPPER.writeValueAsString(record));
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Set out stream to the parameter.
     * @param printStream print stream where to print records
     */
    public void setOut(PrintStream printStream) {
        out = printStream;
    }

    public PrintStream getOut() {
        return out;
    }

    /**
     * Factory method for creating needed printer classes for each printer type set in configuration.
     * @param type needed type
     * @return created specific RecordPrinter
     */
    public static RecordPrinter createPrinter(PrinterType type) {
        switch (type) {
            case OUT: return new SystemOutRecordPrinter();
            case ERR: return new SystemErrRecordPrinter();
            default:  return new SystemOutRecordPrinter();
        }
    }
}
