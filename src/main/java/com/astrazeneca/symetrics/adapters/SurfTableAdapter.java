package com.astrazeneca.symetrics.adapters;

import com.astrazeneca.symetrics.data.GenomeBuild;
import com.astrazeneca.symetrics.data.ScoreFamily;

/**
 * SURF table (hg38): surface accessibility of the residue affected by the variant.
 */
public class SurfTableAdapter extends ScoreTableAdapter {
    public static final String TABLE = "SURF";

    public SurfTableAdapter() {
        super(ScoreFamily.SURFACE_ACCESSIBILITY, TABLE, "CHR",
                positions(GenomeBuild.HG38, "POS"), "REF", "ALT", "GENE",
                metrics("SURF", "SURF"));
    }
}
