package com.astrazeneca.symetrics.data;

import com.astrazeneca.symetrics.exception.WrongAnnotationFormatException;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;

public class SpliceAiAnnotationTest {

    @Test
    public void testParse() {
        SpliceAiAnnotation annotation = SpliceAiAnnotation.parse("A|CYP51A1|0.20|0.90|0.10|0.05|-12|3|8|-40");
        assertEquals(annotation.allele, "A");
        assertEquals(annotation.symbol, "CYP51A1");
        assertEquals(annotation.dsAg, 0.2);
        assertEquals(annotation.dsAl, 0.9);
        assertEquals(annotation.dsDg, 0.1);
        assertEquals(annotation.dsDl, 0.05);
        assertEquals(annotation.dpAg, -12);
        assertEquals(annotation.dpDl, -40);
    }

    @DataProvider(name = "maxDs")
    public Object[][] maxDs() {
        return new Object[][] {
                {"A|G|0.2|0.9|0.1|0.05|0|0|0|0", 0.9},
                {"A|G|0.71|0.00|0.02|0.00|1|2|3|4", 0.71},
                {"A|G|0.00|0.00|0.00|0.33|1|2|3|4", 0.33},
                {"A|G|0.00|0.00|0.00|0.00|1|2|3|4", 0.0},
                {"A|G|0.10|0.20|0.50|0.00|1|2|3|4,T|G|0.99|0.99|0.99|0.99|1|2|3|4", 0.5},
        };
    }

    @Test(dataProvider = "maxDs")
    public void testMaxDeltaScore(String info, double expected) {
        assertEquals(SpliceAiAnnotation.parse(info).maxDeltaScore(), expected);
    }

    @Test(expectedExceptions = WrongAnnotationFormatException.class)
    public void testTooFewFields() {
        SpliceAiAnnotation.parse("A|CYP51A1|0.20|0.90");
    }

    @Test(expectedExceptions = WrongAnnotationFormatException.class)
    public void testScoreIsNotNumber() {
        SpliceAiAnnotation.parse("A|CYP51A1|.|0.90|0.10|0.05|-12|3|8|-40");
    }
}
