package com.astrazeneca.symetrics;

import com.astrazeneca.symetrics.data.GenomeBuild;
import com.astrazeneca.symetrics.data.MetricGroup;
import com.astrazeneca.symetrics.data.ScoreFamily;
import com.astrazeneca.symetrics.printers.PrinterType;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

public class Configuration {
    /**
     * Path to JSON configuration file with locations of the stores and constraint tables
     */
    public String configPath; // -c

    /**
     * Location (path to SQLite file or JDBC URL) of the store with SILVA, SURF, SYNVEP and SPLICEAI tables
     */
    public String scoreDatabase;
    /**
     * Location of the store with gnomAD allele frequencies
     */
    public String populationDatabase;
    /**
     * Constraint table of each metric group
     */
    public Map<MetricGroup, String> constraintFiles = new EnumMap<>(MetricGroup.class);
    /**
     * Tab-separated gnomAD gene constraint table
     */
    public String gnomadConstraints;

    /**
     * Variant in the format chr-pos-ref-alt
     */
    public String variant; // -v
    /**
     * Genome build of the variant
     */
    public GenomeBuild genome = GenomeBuild.HG38; // -r
    /**
     * Score families to look the variant up in
     */
    public List<ScoreFamily> families = new ArrayList<>(); // -s
    /**
     * Translate the variant to the opposite build
     */
    public boolean liftover; // -l
    /**
     * Liftover the variant to the build of the table before lookup if the table doesn't index its build
     */
    public boolean liftoverBeforeLookup; // -L
    /**
     * HGNC symbol of gene for constraint scores
     */
    public String gene; // -g
    /**
     * Metric group of normalized constraint score. Kept as given to reject unknown groups with a clear message.
     */
    public String metricGroup; // -m
    /**
     * Print gnomAD constraints of the gene
     */
    public boolean gnomadConstraintsRequested; // -gc

    public PrinterType printerType = PrinterType.OUT; // -DP

    public boolean hasVariantRequest() {
        return !families.isEmpty() || liftover;
    }

    public boolean hasGeneRequest() {
        return metricGroup != null || gnomadConstraintsRequested;
    }
}
