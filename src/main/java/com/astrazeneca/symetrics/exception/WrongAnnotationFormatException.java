package com.astrazeneca.symetrics.exception;


import java.util.Locale;

public class WrongAnnotationFormatException extends RuntimeException {
    public final static String WrongAnnotationFormatExceptionMessage = "The SpliceAI annotation \"%s\" can't be " +
            "unpacked. Expected format: ALLELE|SYMBOL|DS_AG|DS_AL|DS_DG|DS_DL|DP_AG|DP_AL|DP_DG|DP_DL";

    public WrongAnnotationFormatException(String info) {
            super(String.format(Locale.US, WrongAnnotationFormatExceptionMessage, info));
    }

    public WrongAnnotationFormatException(String info, Throwable e) {
            super(String.format(Locale.US, WrongAnnotationFormatExceptionMessage, info), e);
    }
}
