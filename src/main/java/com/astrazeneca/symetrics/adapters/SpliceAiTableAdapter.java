package com.astrazeneca.symetrics.adapters;

import com.astrazeneca.symetrics.data.GenomeBuild;
import com.astrazeneca.symetrics.data.ScoreFamily;
import com.astrazeneca.symetrics.data.ScoreRecord;
import com.astrazeneca.symetrics.data.SpliceAiAnnotation;
import com.astrazeneca.symetrics.data.VariantKey;
import com.astrazeneca.symetrics.store.Row;
import com.astrazeneca.symetrics.store.TableQuery;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * SPLICEAI table (hg38). Scores are packed into the INFO column; the record carries only MAX_DS, the maximum
 * of the four delta scores, and the gene symbol of the annotation.
 */
public class SpliceAiTableAdapter extends ScoreTableAdapter {
    public static final String TABLE = "SPLICEAI";
    public static final String INFO = "INFO";
    public static final String MAX_DS = "MAX_DS";

    public SpliceAiTableAdapter() {
        super(ScoreFamily.SPLICE_EFFECT, TABLE, "chr",
                positions(GenomeBuild.HG38, "pos"), "ref", "alt", null,
                Collections.<String, String>emptyMap());
    }

    @Override
    protected void selectScores(TableQuery query) {
        query.select(INFO, INFO);
    }

    @Override
    public ScoreRecord toRecord(VariantKey variant, Row row) {
        SpliceAiAnnotation annotation = SpliceAiAnnotation.parse(row.getString(INFO));
        Map<String, Number> scores = new LinkedHashMap<>();
        scores.put(MAX_DS, annotation.maxDeltaScore());
        String gene = annotation.symbol == null || annotation.symbol.isEmpty() ? null : annotation.symbol;
        return new ScoreRecord(variant, gene, getFamily(), scores);
    }
}
