package com.astrazeneca.symetrics.adapters;

import com.astrazeneca.symetrics.data.GenomeBuild;
import com.astrazeneca.symetrics.data.ScoreFamily;
import com.astrazeneca.symetrics.data.ScoreRecord;
import com.astrazeneca.symetrics.data.VariantKey;
import com.astrazeneca.symetrics.exception.BuildMismatchException;
import com.astrazeneca.symetrics.store.Row;
import com.astrazeneca.symetrics.store.TableQuery;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Lookup strategy of one score table. The adapter declares the table schema (key columns, position column per
 * supported build, gene and metric columns), translates a variant into an exact-match query and converts the
 * matched row into a {@link ScoreRecord} with canonical metric names.
 */
public abstract class ScoreTableAdapter {
    /**
     * Canonical names of key columns in the result rows
     */
    public static final String CHR = "CHR";
    public static final String POS = "POS";
    public static final String REF = "REF";
    public static final String ALT = "ALT";
    public static final String GENE = "GENE";

    private final ScoreFamily family;
    private final String table;
    private final String chrColumn;
    private final Map<GenomeBuild, String> positionColumns;
    private final String refColumn;
    private final String altColumn;
    private final String geneColumn;
    private final Map<String, String> metricColumns;

    /**
     * @param family score family stored in the table
     * @param table table name
     * @param chrColumn chromosome column
     * @param positionColumns position column for each build the table indexes
     * @param refColumn reference allele column
     * @param altColumn alternative allele column
     * @param geneColumn gene symbol column or null if there is none
     * @param metricColumns canonical metric name to table column, in output order
     */
    protected ScoreTableAdapter(ScoreFamily family, String table, String chrColumn,
                                Map<GenomeBuild, String> positionColumns, String refColumn, String altColumn,
                                String geneColumn, Map<String, String> metricColumns) {
        this.family = family;
        this.table = table;
        this.chrColumn = chrColumn;
        this.positionColumns = Collections.unmodifiableMap(new EnumMap<>(positionColumns));
        this.refColumn = refColumn;
        this.altColumn = altColumn;
        this.geneColumn = geneColumn;
        this.metricColumns = Collections.unmodifiableMap(new LinkedHashMap<>(metricColumns));
    }

    /**
     * @return adapters of all score tables, one per family
     */
    public static Map<ScoreFamily, ScoreTableAdapter> defaultAdapters() {
        Map<ScoreFamily, ScoreTableAdapter> adapters = new EnumMap<>(ScoreFamily.class);
        for (ScoreTableAdapter adapter : new ScoreTableAdapter[]{
                new SilvaTableAdapter(),
                new SurfTableAdapter(),
                new SynvepTableAdapter(),
                new SpliceAiTableAdapter(),
                new GnomadTableAdapter()}) {
            adapters.put(adapter.getFamily(), adapter);
        }
        return adapters;
    }

    public ScoreFamily getFamily() {
        return family;
    }

    public String getTable() {
        return table;
    }

    public String getChrColumn() {
        return chrColumn;
    }

    public String getRefColumn() {
        return refColumn;
    }

    public String getAltColumn() {
        return altColumn;
    }

    public Set<GenomeBuild> getSupportedBuilds() {
        return positionColumns.keySet();
    }

    public boolean supports(GenomeBuild build) {
        return positionColumns.containsKey(build);
    }

    /**
     * @param build genome build
     * @return name of the position column indexed in this build
     */
    public String getPositionColumn(GenomeBuild build) {
        String column = positionColumns.get(build);
        if (column == null) {
            throw new IllegalArgumentException("Table " + table + " has no position column for " + build);
        }
        return column;
    }

    /**
     * Rejects variants of a build the table doesn't index.
     * @param variant variant to look up
     * @throws BuildMismatchException if table has no position column for the variant's build
     */
    public void checkBuild(VariantKey variant) {
        if (!supports(variant.genome)) {
            throw new BuildMismatchException(table, getSupportedBuilds(), variant, variant.genome);
        }
    }

    /**
     * Builds exact-match query on chromosome, position (in the variant's build), reference and alternative alleles.
     * @param variant variant to look up
     * @return query selecting key, gene and score columns under canonical names
     */
    public TableQuery query(VariantKey variant) {
        checkBuild(variant);
        String positionColumn = positionColumns.get(variant.genome);
        TableQuery query = TableQuery.from(table)
                .select(chrColumn, CHR)
                .select(positionColumn, POS)
                .select(refColumn, REF)
                .select(altColumn, ALT);
        if (geneColumn != null) {
            query.select(geneColumn, GENE);
        }
        selectScores(query);
        return query
                .where(chrColumn, variant.chr)
                .where(positionColumn, variant.position)
                .where(refColumn, variant.ref)
                .where(altColumn, variant.alt);
    }

    /**
     * Adds score columns to the query. By default all metric columns under their canonical names.
     * @param query query to extend
     */
    protected void selectScores(TableQuery query) {
        for (Map.Entry<String, String> metric : metricColumns.entrySet()) {
            query.select(metric.getValue(), metric.getKey());
        }
    }

    /**
     * Converts the matched row to the record. Key fields of the record are taken from the variant, as the
     * query matched them exactly.
     * @param variant looked up variant
     * @param row row returned for the query of {@link #query(VariantKey)}
     * @return score record
     */
    public ScoreRecord toRecord(VariantKey variant, Row row) {
        String gene = geneColumn == null ? null : row.getString(GENE);
        return new ScoreRecord(variant, gene, family, readScores(row));
    }

    protected Map<String, Number> readScores(Row row) {
        Map<String, Number> scores = new LinkedHashMap<>();
        for (String metric : metricColumns.keySet()) {
            scores.put(metric, row.getNumber(metric));
        }
        return scores;
    }

    static Map<GenomeBuild, String> positions(GenomeBuild build, String column) {
        Map<GenomeBuild, String> positions = new EnumMap<>(GenomeBuild.class);
        positions.put(build, column);
        return positions;
    }

    static Map<String, String> metrics(String... canonicalAndColumn) {
        Map<String, String> metrics = new LinkedHashMap<>();
        for (int i = 0; i + 1 < canonicalAndColumn.length; i += 2) {
            metrics.put(canonicalAndColumn[i], canonicalAndColumn[i + 1]);
        }
        return metrics;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + " [table=" + table + ", family=" + family
                + ", builds=" + getSupportedBuilds() + "]";
    }
}
