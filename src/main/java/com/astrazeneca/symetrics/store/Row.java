package com.astrazeneca.symetrics.store;

import com.astrazeneca.symetrics.Utils;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One result row keyed by canonical column names. Values keep the types the store returned, the getters
 * convert between numbers and strings since the score tables are not consistently typed.
 */
public class Row {
    private final Map<String, Object> values;

    public Row(Map<String, Object> values) {
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public Object get(String column) {
        if (!values.containsKey(column)) {
            throw new IllegalArgumentException("No column " + column + " in row " + values.keySet());
        }
        return values.get(column);
    }

    public String getString(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Double || value instanceof Float) {
            double number = ((Number) value).doubleValue();
            if (number == Math.rint(number)) {
                return String.valueOf((long) number);
            }
        }
        return value.toString();
    }

    public int getInt(String column) {
        Object value = get(column);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value == null) {
            throw new IllegalStateException("Column " + column + " is null");
        }
        try {
            return Integer.parseInt(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Column " + column + " is not an integer: " + value, e);
        }
    }

    /**
     * @param column canonical column name
     * @return value as number, null for SQL NULL and missing value markers (NA, NaN, .), other strings are
     * parsed as doubles
     * @throws IllegalStateException if the string is not a number
     */
    public Number getNumber(String column) {
        Object value = get(column);
        if (value == null || value instanceof Number) {
            return (Number) value;
        }
        String text = value.toString().trim();
        if (Utils.isMissing(text)) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Column " + column + " is not a number: " + value, e);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return values.equals(((Row) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "Row " + values;
    }
}
