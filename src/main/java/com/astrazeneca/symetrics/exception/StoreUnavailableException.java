package com.astrazeneca.symetrics.exception;


import java.util.Locale;

public class StoreUnavailableException extends RuntimeException {
    public final static String StoreUnavailableExceptionMessage = "Connection to %s failed: %s";

    public StoreUnavailableException(String descriptor, Throwable e) {
            super(String.format(Locale.US, StoreUnavailableExceptionMessage, descriptor, e.getMessage()), e);
    }
}
