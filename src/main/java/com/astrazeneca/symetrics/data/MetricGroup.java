package com.astrazeneca.symetrics.data;

import com.astrazeneca.symetrics.exception.InvalidGroupException;

/**
 * Closed set of metric groups with a precomputed per-gene constraint table. The group defines the name of the
 * gene column in its table and the score family the statistic was derived from.
 */
public enum MetricGroup {
    SYNVEP("SYNVEP", "GENES", ScoreFamily.SYNONYMOUS_PATHOGENICITY),
    SURF("SURF", "GENES", ScoreFamily.SURFACE_ACCESSIBILITY),
    GERP("GERP", "GENE", ScoreFamily.CONSERVATION),
    CPG("CpG", "GENE", ScoreFamily.CONSERVATION),
    CPG_EXON("CpG_exon", "GENE", ScoreFamily.CONSERVATION),
    RSCU("RSCU", "GENE", ScoreFamily.CONSERVATION),
    DRSCU("dRSCU", "GENE", ScoreFamily.CONSERVATION),
    SPLICEAI("SpliceAI", "GENE", ScoreFamily.SPLICE_EFFECT);

    /**
     * Statistic columns shared by all constraint tables
     */
    public static final String PVALUE_COLUMN = "pval";
    public static final String FDR_COLUMN = "fdr";
    public static final String STATISTIC_COLUMN = "z";

    private final String groupName;
    private final String geneColumn;
    private final ScoreFamily family;

    MetricGroup(String groupName, String geneColumn, ScoreFamily family) {
        this.groupName = groupName;
        this.geneColumn = geneColumn;
        this.family = family;
    }

    /**
     * @return name of the group as it's used in configuration and output (e.g. CpG_exon)
     */
    public String getGroupName() {
        return groupName;
    }

    public String getGeneColumn() {
        return geneColumn;
    }

    public ScoreFamily getFamily() {
        return family;
    }

    /**
     * Finds the group by its name. Both the configuration name (CpG_exon) and the enum name (CPG_EXON) are accepted.
     * @param name group name
     * @return metric group
     * @throws InvalidGroupException if the name is not in the enumeration
     */
    public static MetricGroup fromName(String name) {
        if (name != null) {
            for (MetricGroup group : values()) {
                if (group.groupName.equals(name) || group.name().equals(name)) {
                    return group;
                }
            }
        }
        throw new InvalidGroupException(name);
    }

    @Override
    public String toString() {
        return groupName;
    }
}
