package com.astrazeneca.symetrics.store;

import org.testng.annotations.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;

public class RowTest {

    private Row row() {
        Map<String, Object> values = new LinkedHashMap<>();
        values.put("CHR", 7);
        values.put("CHR_REAL", 7.0);
        values.put("POS", "91763673");
        values.put("SCORE", "0.25");
        values.put("EMPTY", null);
        values.put("NA", "NA");
        values.put("DOT", ".");
        values.put("TEXT", "high");
        return new Row(values);
    }

    @Test
    public void testConversions() {
        Row row = row();
        assertEquals(row.getString("CHR"), "7");
        assertEquals(row.getString("CHR_REAL"), "7");
        assertEquals(row.getInt("POS"), 91763673);
        assertEquals(row.getNumber("SCORE").doubleValue(), 0.25);
        assertEquals(row.getNumber("CHR"), 7);
        assertNull(row.getNumber("EMPTY"));
        assertNull(row.getString("EMPTY"));
        assertNull(row.getNumber("NA"));
        assertNull(row.getNumber("DOT"));
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testTextIsNotNumber() {
        row().getNumber("TEXT");
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testTextIsNotInteger() {
        row().getInt("TEXT");
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testUnknownColumn() {
        row().get("GENE");
    }
}
