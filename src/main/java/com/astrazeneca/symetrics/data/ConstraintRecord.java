package com.astrazeneca.symetrics.data;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Result of the pooled proportion test of one gene in one metric group together with the statistic scaled
 * against the whole group.
 */
public class ConstraintRecord {
    public final String gene;
    public final double pValue;
    public final double fdr;

    /**
     * z statistic of the proportion test as read from the table
     */
    public final double rawStatistic;

    /**
     * z statistic scaled to zero mean and unit variance over all genes of the group
     */
    public final double normalizedStatistic;

    public final MetricGroup group;

    public ConstraintRecord(String gene, double pValue, double fdr, double rawStatistic, double normalizedStatistic,
                            MetricGroup group) {
        this.gene = gene;
        this.pValue = pValue;
        this.fdr = fdr;
        this.rawStatistic = rawStatistic;
        this.normalizedStatistic = normalizedStatistic;
        this.group = group;
    }

    /**
     * @return ordered map for printing: GENE, PVAL, FDR, SYMETRIC_SCORE, NORM_SYMETRIC_SCORE, GROUP
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("GENE", gene);
        map.put("PVAL", pValue);
        map.put("FDR", fdr);
        map.put("SYMETRIC_SCORE", rawStatistic);
        map.put("NORM_SYMETRIC_SCORE", normalizedStatistic);
        map.put("GROUP", group.getGroupName());
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ConstraintRecord that = (ConstraintRecord) o;
        return Double.compare(that.pValue, pValue) == 0 &&
                Double.compare(that.fdr, fdr) == 0 &&
                Double.compare(that.rawStatistic, rawStatistic) == 0 &&
                Double.compare(that.normalizedStatistic, normalizedStatistic) == 0 &&
                Objects.equals(gene, that.gene) &&
                group == that.group;
    }

    @Override
    public int hashCode() {
        return Objects.hash(gene, pValue, fdr, rawStatistic, normalizedStatistic, group);
    }

    @Override
    public String toString() {
        return "ConstraintRecord [gene=" + gene + ", group=" + group + ", pval=" + pValue + ", fdr=" + fdr
                + ", z=" + rawStatistic + ", scaled_z=" + normalizedStatistic + "]";
    }
}
