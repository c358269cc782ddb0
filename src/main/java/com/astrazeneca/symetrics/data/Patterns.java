package com.astrazeneca.symetrics.data;

import java.util.regex.Pattern;

/**
 * Regex Patterns used by parsers of variants and annotation fields.
 */
public class Patterns {
    // Variant patterns
    public static final Pattern CHR_PREFIX = Pattern.compile("^chr", Pattern.CASE_INSENSITIVE);
    public static final Pattern VARIANT_NOTATION = Pattern.compile("^([^-:\\s]+)[-:](\\d+)[-:]([A-Za-z]+)[-:>]([A-Za-z]+)$");
    public static final Pattern ALLELE = Pattern.compile("^[ACGTN]+$");

    // Annotation patterns
    public static final Pattern PIPE = Pattern.compile("\\|");

    // Store patterns
    public static final Pattern JDBC_URL = Pattern.compile("^jdbc:");
}
