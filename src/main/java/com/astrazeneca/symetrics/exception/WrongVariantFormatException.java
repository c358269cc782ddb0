package com.astrazeneca.symetrics.exception;


public class WrongVariantFormatException extends IllegalArgumentException {
    public final static String WRONG_NOTATION = "The variant \"%s\" is wrong. It must be in the format " +
            "chr-pos-ref-alt, e.g. 7-91763673-C-A.";
    public final static String WRONG_ALLELE = "The allele \"%s\" is wrong. Only A, C, G, T and N bases are allowed.";
    public final static String WRONG_POSITION = "The position %d is wrong. Positions are 1-based.";
    public final static String EMPTY_CHROMOSOME = "The chromosome \"%s\" is empty.";
    public final static String UNKNOWN_BUILD = "The genome build \"%s\" is unknown. Supported builds: hg19 (GRCh37), hg38 (GRCh38).";

    public WrongVariantFormatException(String message) {
            super(message);
    }
}
