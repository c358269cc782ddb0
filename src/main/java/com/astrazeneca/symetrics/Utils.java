package com.astrazeneca.symetrics;

public final class Utils {
    private Utils() {}

    /**
     * Parses number from table cell. Empty cells and NA/NaN/"." markers are returned as NaN.
     * @param value cell value
     * @return parsed double or NaN
     */
    public static double toDouble(String value) {
        if (value == null) {
            return Double.NaN;
        }
        String trimmed = value.trim();
        if (isMissing(trimmed)) {
            return Double.NaN;
        }
        return Double.parseDouble(trimmed);
    }

    /**
     * @param value trimmed cell value
     * @return true for empty cells and missing value markers (NA, NaN, .)
     */
    public static boolean isMissing(String value) {
        return value.isEmpty() || ".".equals(value) || "NA".equalsIgnoreCase(value) || "NaN".equalsIgnoreCase(value);
    }
}
