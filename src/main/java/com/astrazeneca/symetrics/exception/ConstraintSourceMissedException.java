package com.astrazeneca.symetrics.exception;


import java.util.Locale;

public class ConstraintSourceMissedException extends RuntimeException {
    public final static String ConstraintSourceMissedMessage = "The constraint table for group %s missed, please, " +
            "set it in the \"constraints\" section of the configuration file.";

    public ConstraintSourceMissedException(Object group) {
            super(String.format(Locale.US, ConstraintSourceMissedMessage, group));
    }
}
