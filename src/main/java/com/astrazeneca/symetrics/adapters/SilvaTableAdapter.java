package com.astrazeneca.symetrics.adapters;

import com.astrazeneca.symetrics.data.GenomeBuild;
import com.astrazeneca.symetrics.data.ScoreFamily;

/**
 * SILVA table (hg19): codon usage (RSCU, dRSCU), GERP++ conservation and CpG context of synonymous variants.
 */
public class SilvaTableAdapter extends ScoreTableAdapter {
    public static final String TABLE = "SILVA";

    public SilvaTableAdapter() {
        super(ScoreFamily.CONSERVATION, TABLE, "#chrom",
                positions(GenomeBuild.HG19, "pos"), "ref", "alt", "gene",
                metrics("RSCU", "#RSCU",
                        "dRSCU", "dRSCU",
                        "GERP", "#GERP++",
                        "CPG", "#CpG?",
                        "CPGX", "CpG_exon"));
    }
}
