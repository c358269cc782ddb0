package com.astrazeneca.symetrics.exception;


import java.util.Locale;

public class BuildMismatchException extends RuntimeException {
    public final static String BuildMismatchExceptionMessage = "The table %s is indexed by %s only, but the variant " +
            "%s is in %s. Please, liftover the variant before the lookup.";

    public BuildMismatchException(String table, Object supportedBuilds, Object variant, Object build) {
            super(String.format(Locale.US, BuildMismatchExceptionMessage, table, supportedBuilds, variant, build));
    }
}
