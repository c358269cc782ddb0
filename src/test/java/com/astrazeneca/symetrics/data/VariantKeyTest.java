package com.astrazeneca.symetrics.data;

import com.astrazeneca.symetrics.exception.WrongVariantFormatException;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;

public class VariantKeyTest {

    @DataProvider(name = "notations")
    public Object[][] notations() {
        return new Object[][] {
                {"7-91763673-C-A", new VariantKey("7", 91763673, "C", "A", GenomeBuild.HG38)},
                {"chr7-91763673-C-A", new VariantKey("7", 91763673, "C", "A", GenomeBuild.HG38)},
                {"X:155000:g:t", new VariantKey("X", 155000, "G", "T", GenomeBuild.HG38)},
                {"19:10194837:G>T", new VariantKey("19", 10194837, "G", "T", GenomeBuild.HG38)},
                {" 1-100-AC-A ", new VariantKey("1", 100, "AC", "A", GenomeBuild.HG38)},
        };
    }

    @Test(dataProvider = "notations")
    public void testParse(String notation, VariantKey expected) {
        assertEquals(VariantKey.parse(notation, GenomeBuild.HG38), expected);
    }

    @DataProvider(name = "wrongNotations")
    public Object[][] wrongNotations() {
        return new Object[][] {
                {"7-91763673-C"},
                {"7-pos-C-A"},
                {"7-91763673-C-Z"},
                {"7-0-C-A"},
                {"7-99999999999-C-A"},
                {""},
        };
    }

    @Test(dataProvider = "wrongNotations", expectedExceptions = WrongVariantFormatException.class)
    public void testParseWrongNotation(String notation) {
        VariantKey.parse(notation, GenomeBuild.HG19);
    }

    @Test
    public void testBuildIsPartOfIdentity() {
        VariantKey hg19 = new VariantKey("7", 91763673, "C", "A", GenomeBuild.HG19);
        VariantKey hg38 = new VariantKey("7", 91763673, "C", "A", GenomeBuild.HG38);
        assertNotEquals(hg19, hg38);
    }

    @Test
    public void testLocatable() {
        VariantKey variant = new VariantKey("chr2", 1000, "ACG", "A", GenomeBuild.HG19);
        assertEquals(variant.getContig(), "2");
        assertEquals(variant.getStart(), 1000);
        assertEquals(variant.getEnd(), 1002);
    }

    @Test
    public void testToMap() {
        VariantKey variant = new VariantKey("7", 91763673, "C", "A", GenomeBuild.HG19);
        assertEquals(variant.toMap().keySet().toString(), "[CHR, POS, REF, ALT, GENOME]");
        assertEquals(variant.toMap().get("GENOME"), "hg19");
    }
}
