package com.astrazeneca.symetrics.constraints;

import com.astrazeneca.symetrics.data.ConstraintRecord;
import com.astrazeneca.symetrics.data.MetricGroup;
import com.astrazeneca.symetrics.exception.ConstraintSourceMissedException;
import com.astrazeneca.symetrics.exception.InvalidGroupException;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Normalized gene constraint (SYMETRICS) score. The z statistic of the pooled proportion test is scaled
 * against all genes of the metric group, so the whole table is loaded and fitted before the gene is picked.
 */
public class ConstraintNormalizer {
    private final Map<MetricGroup, String> constraintFiles;
    private final ConstraintTableReader reader;

    /**
     * @param constraintFiles path of the constraint table of each configured group
     */
    public ConstraintNormalizer(Map<MetricGroup, String> constraintFiles) {
        this(constraintFiles, new ConstraintTableReader());
    }

    public ConstraintNormalizer(Map<MetricGroup, String> constraintFiles, ConstraintTableReader reader) {
        this.constraintFiles = constraintFiles.isEmpty()
                ? Collections.<MetricGroup, String>emptyMap()
                : Collections.unmodifiableMap(new EnumMap<>(constraintFiles));
        this.reader = reader;
    }

    /**
     * @param groupName name of metric group, e.g. SYNVEP or CpG_exon
     * @param gene HGNC symbol of the gene
     * @return normalized record or empty if the gene is absent from the group's table
     * @throws InvalidGroupException if the group is unknown, no table is read in this case
     */
    public Optional<ConstraintRecord> normalize(String groupName, String gene) {
        return normalize(MetricGroup.fromName(groupName), gene);
    }

    /**
     * @param group metric group
     * @param gene HGNC symbol of the gene
     * @return normalized record or empty if the gene is absent from the group's table
     * @throws ConstraintSourceMissedException if no table is configured for the group
     */
    public Optional<ConstraintRecord> normalize(MetricGroup group, String gene) {
        String path = constraintFiles.get(group);
        if (path == null) {
            throw new ConstraintSourceMissedException(group);
        }
        ConstraintTable table = reader.read(path, group);
        StandardScaler scaler = StandardScaler.fit(table.statistics());
        for (ConstraintTable.Entry entry : table.getEntries()) {
            if (entry.gene.equals(gene)) {
                return Optional.of(new ConstraintRecord(entry.gene, entry.pValue, entry.fdr, entry.statistic,
                        scaler.transform(entry.statistic), group));
            }
        }
        return Optional.empty();
    }
}
