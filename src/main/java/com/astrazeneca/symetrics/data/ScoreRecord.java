package com.astrazeneca.symetrics.data;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Scores of one variant read from one score table. Metrics keep the order declared by the table adapter.
 */
public class ScoreRecord {
    public final String chr;
    public final int position;
    public final String ref;
    public final String alt;

    /**
     * Gene symbol, null if the table doesn't carry one
     */
    public final String gene;

    public final ScoreFamily family;

    private final Map<String, Number> metrics;

    public ScoreRecord(VariantKey variant, String gene, ScoreFamily family, Map<String, Number> metrics) {
        this.chr = variant.chr;
        this.position = variant.position;
        this.ref = variant.ref;
        this.alt = variant.alt;
        this.gene = gene;
        this.family = family;
        this.metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
    }

    public Map<String, Number> getMetrics() {
        return metrics;
    }

    /**
     * @param name canonical metric name (e.g. MAX_DS, SYNVEP, AF)
     * @return value of the metric or null if the record has no such metric
     */
    public Number getMetric(String name) {
        return metrics.get(name);
    }

    /**
     * @return ordered map for printing: CHR, POS, REF, ALT, GENE (if present) and the metrics
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("CHR", chr);
        map.put("POS", position);
        map.put("REF", ref);
        map.put("ALT", alt);
        if (gene != null) {
            map.put("GENE", gene);
        }
        map.putAll(metrics);
        return map;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ScoreRecord that = (ScoreRecord) o;
        return position == that.position &&
                Objects.equals(chr, that.chr) &&
                Objects.equals(ref, that.ref) &&
                Objects.equals(alt, that.alt) &&
                Objects.equals(gene, that.gene) &&
                family == that.family &&
                Objects.equals(metrics, that.metrics);
    }

    @Override
    public int hashCode() {
        return Objects.hash(chr, position, ref, alt, gene, family, metrics);
    }

    @Override
    public String toString() {
        return "ScoreRecord [" + family + " " + chr + ":" + position + " " + ref + ">" + alt + ", gene=" + gene
                + ", metrics=" + metrics + "]";
    }
}
