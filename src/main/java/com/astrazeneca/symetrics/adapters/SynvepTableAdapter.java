package com.astrazeneca.symetrics.adapters;

import com.astrazeneca.symetrics.data.GenomeBuild;
import com.astrazeneca.symetrics.data.ScoreFamily;
import com.astrazeneca.symetrics.data.VariantKey;
import com.astrazeneca.symetrics.store.TableQuery;

import java.util.EnumMap;
import java.util.Map;

/**
 * SYNVEP table: synonymous variant effect predictions. The only table that holds positions of both builds
 * ("pos" for hg19 and "pos_GRCh38" for hg38), so it's also the bridge table for liftover.
 */
public class SynvepTableAdapter extends ScoreTableAdapter {
    public static final String TABLE = "SYNVEP";
    public static final String HG19_POSITION = "pos";
    public static final String HG38_POSITION = "pos_GRCh38";

    public SynvepTableAdapter() {
        super(ScoreFamily.SYNONYMOUS_PATHOGENICITY, TABLE, "chr", bothBuilds(), "ref", "alt",
                "HGNC_gene_symbol", metrics("SYNVEP", "synVep"));
    }

    private static Map<GenomeBuild, String> bothBuilds() {
        Map<GenomeBuild, String> positions = new EnumMap<>(GenomeBuild.class);
        positions.put(GenomeBuild.HG19, HG19_POSITION);
        positions.put(GenomeBuild.HG38, HG38_POSITION);
        return positions;
    }

    /**
     * Query for liftover: matches the variant by the position column of its own build and returns the
     * position column of the opposite build as POS.
     * @param variant variant to translate
     * @return query selecting CHR, POS (opposite build), REF, ALT
     */
    public TableQuery bridgeQuery(VariantKey variant) {
        checkBuild(variant);
        String sourcePosition = getPositionColumn(variant.genome);
        String targetPosition = getPositionColumn(variant.genome.opposite());
        return TableQuery.from(getTable())
                .select(getChrColumn(), CHR)
                .select(targetPosition, POS)
                .select(getRefColumn(), REF)
                .select(getAltColumn(), ALT)
                .where(getChrColumn(), variant.chr)
                .where(sourcePosition, variant.position)
                .where(getRefColumn(), variant.ref)
                .where(getAltColumn(), variant.alt);
    }
}
