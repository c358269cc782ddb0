package com.astrazeneca.symetrics.exception;


import java.util.Locale;

public class UnsupportedBuildException extends RuntimeException {
    public final static String UnsupportedBuildExceptionMessage = "Lookup in %s is not possible for %s in the " +
            "current version, please use the %s version of the variant %s.";

    public UnsupportedBuildException(String table, Object build, Object supportedBuild, Object variant) {
            super(String.format(Locale.US, UnsupportedBuildExceptionMessage, table, build, supportedBuild, variant));
    }
}
