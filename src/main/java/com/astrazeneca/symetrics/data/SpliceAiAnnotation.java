package com.astrazeneca.symetrics.data;

import com.astrazeneca.symetrics.exception.WrongAnnotationFormatException;

import static com.astrazeneca.symetrics.data.Patterns.PIPE;

/**
 * Unpacked SpliceAI INFO subfield: ALLELE|SYMBOL|DS_AG|DS_AL|DS_DG|DS_DL|DP_AG|DP_AL|DP_DG|DP_DL.
 * DS are delta scores of acceptor gain/loss and donor gain/loss, DP are the positions of the change
 * relative to the variant.
 */
public class SpliceAiAnnotation {
    public static final String INFO_HEADER = "ALLELE|SYMBOL|DS_AG|DS_AL|DS_DG|DS_DL|DP_AG|DP_AL|DP_DG|DP_DL";
    private static final int FIELDS_COUNT = 10;

    public final String allele;
    public final String symbol;
    public final double dsAg;
    public final double dsAl;
    public final double dsDg;
    public final double dsDl;
    public final int dpAg;
    public final int dpAl;
    public final int dpDg;
    public final int dpDl;

    public SpliceAiAnnotation(String allele, String symbol, double dsAg, double dsAl, double dsDg, double dsDl,
                              int dpAg, int dpAl, int dpDg, int dpDl) {
        this.allele = allele;
        this.symbol = symbol;
        this.dsAg = dsAg;
        this.dsAl = dsAl;
        this.dsDg = dsDg;
        this.dsDl = dsDl;
        this.dpAg = dpAg;
        this.dpAl = dpAl;
        this.dpDg = dpDg;
        this.dpDl = dpDl;
    }

    /**
     * Parses the pipe-delimited INFO value. Only the first annotation is used if the value holds several
     * comma-separated ones.
     * @param info INFO value from SPLICEAI table
     * @return parsed annotation
     * @throws WrongAnnotationFormatException if the value has less than 10 fields or scores aren't numbers
     */
    public static SpliceAiAnnotation parse(String info) {
        if (info == null) {
            throw new WrongAnnotationFormatException(info);
        }
        String annotation = info.split(",", 2)[0].trim();
        String[] fields = PIPE.split(annotation, -1);
        if (fields.length < FIELDS_COUNT) {
            throw new WrongAnnotationFormatException(info);
        }
        try {
            return new SpliceAiAnnotation(fields[0], fields[1],
                    Double.parseDouble(fields[2]), Double.parseDouble(fields[3]),
                    Double.parseDouble(fields[4]), Double.parseDouble(fields[5]),
                    Integer.parseInt(fields[6]), Integer.parseInt(fields[7]),
                    Integer.parseInt(fields[8]), Integer.parseInt(fields[9]));
        } catch (NumberFormatException e) {
            throw new WrongAnnotationFormatException(info, e);
        }
    }

    /**
     * @return MAX_DS, maximum of the four delta scores
     */
    public double maxDeltaScore() {
        return Math.max(Math.max(dsAg, dsAl), Math.max(dsDg, dsDl));
    }

    @Override
    public String toString() {
        return String.join("|", allele, symbol, String.valueOf(dsAg), String.valueOf(dsAl), String.valueOf(dsDg),
                String.valueOf(dsDl), String.valueOf(dpAg), String.valueOf(dpAl), String.valueOf(dpDg),
                String.valueOf(dpDl));
    }
}
