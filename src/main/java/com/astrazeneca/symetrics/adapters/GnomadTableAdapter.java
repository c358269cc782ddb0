package com.astrazeneca.symetrics.adapters;

import com.astrazeneca.symetrics.data.GenomeBuild;
import com.astrazeneca.symetrics.data.ScoreFamily;
import com.astrazeneca.symetrics.data.VariantKey;
import com.astrazeneca.symetrics.exception.UnsupportedBuildException;

/**
 * gnomAD allele counts (AC), allele numbers (AN) and frequencies (AF). Lives in the population store and
 * is available for hg38 only.
 */
public class GnomadTableAdapter extends ScoreTableAdapter {
    public static final String TABLE = "gnomad_db";

    public GnomadTableAdapter() {
        super(ScoreFamily.POPULATION_FREQUENCY, TABLE, "chr",
                positions(GenomeBuild.HG38, "pos"), "ref", "alt", null,
                metrics("AC", "AC",
                        "AN", "AN",
                        "AF", "AF"));
    }

    @Override
    public void checkBuild(VariantKey variant) {
        if (!supports(variant.genome)) {
            throw new UnsupportedBuildException(getTable(), variant.genome, GenomeBuild.HG38, variant);
        }
    }
}
