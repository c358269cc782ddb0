package com.astrazeneca.symetrics.constraints;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Complete constraint table of one metric group: one entry per gene of the group.
 */
public class ConstraintTable {
    private final List<Entry> entries;

    public ConstraintTable(List<Entry> entries) {
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
    }

    public List<Entry> getEntries() {
        return entries;
    }

    /**
     * @return raw statistics of all entries in table order
     */
    public double[] statistics() {
        double[] statistics = new double[entries.size()];
        for (int i = 0; i < entries.size(); i++) {
            statistics[i] = entries.get(i).statistic;
        }
        return statistics;
    }

    /**
     * Row of the table with canonical column names
     */
    public static class Entry {
        public final String gene;
        public final double pValue;
        public final double fdr;
        public final double statistic;

        public Entry(String gene, double pValue, double fdr, double statistic) {
            this.gene = gene;
            this.pValue = pValue;
            this.fdr = fdr;
            this.statistic = statistic;
        }

        @Override
        public String toString() {
            return "Entry [gene=" + gene + ", pval=" + pValue + ", fdr=" + fdr + ", z=" + statistic + "]";
        }
    }
}
