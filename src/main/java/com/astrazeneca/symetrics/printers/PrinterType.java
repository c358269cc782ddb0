package com.astrazeneca.symetrics.printers;

/**
 * Printer types for further extending of possible types to rule them through command line. The needed record
 * printer will be created for each type of PrinterType.
 */
public enum PrinterType {
    OUT,
    ERR
}
