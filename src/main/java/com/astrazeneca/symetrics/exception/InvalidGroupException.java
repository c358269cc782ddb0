package com.astrazeneca.symetrics.exception;


import java.util.Locale;

public class InvalidGroupException extends RuntimeException {
    public final static String InvalidGroupExceptionMessage = "Group: %s is not valid";

    public InvalidGroupException(String group) {
            super(String.format(Locale.US, InvalidGroupExceptionMessage, group));
    }
}
