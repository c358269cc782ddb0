package com.astrazeneca.symetrics;

import com.astrazeneca.symetrics.data.GenomeBuild;
import com.astrazeneca.symetrics.data.ScoreFamily;
import com.astrazeneca.symetrics.printers.PrinterType;
import org.apache.commons.cli.ParseException;
import org.testng.annotations.DataProvider;
import org.testng.annotations.Test;

import java.util.Arrays;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

public class CmdParserTest {

    @Test
    public void testVariantRequest() throws ParseException {
        Configuration config = new CmdParser().parseParams(new String[]{
                "-c", "config.json", "-v", "7-91763673-C-A", "-r", "GRCh37",
                "-s", "SPLICE_EFFECT,conservation,splice-effect", "-l", "-L"});
        assertEquals(config.configPath, "config.json");
        assertEquals(config.variant, "7-91763673-C-A");
        assertEquals(config.genome, GenomeBuild.HG19);
        assertEquals(config.families, Arrays.asList(ScoreFamily.SPLICE_EFFECT, ScoreFamily.CONSERVATION));
        assertTrue(config.liftover);
        assertTrue(config.liftoverBeforeLookup);
        assertFalse(config.hasGeneRequest());
        assertEquals(config.printerType, PrinterType.OUT);
    }

    @Test
    public void testGeneRequest() throws ParseException {
        Configuration config = new CmdParser().parseParams(new String[]{
                "-c", "config.json", "-g", "CYP51A1", "-m", "CpG_exon", "-gc", "-DP", "ERR"});
        assertEquals(config.gene, "CYP51A1");
        assertEquals(config.metricGroup, "CpG_exon");
        assertTrue(config.gnomadConstraintsRequested);
        assertFalse(config.hasVariantRequest());
        assertNull(config.variant);
        assertEquals(config.genome, GenomeBuild.HG38);
        assertEquals(config.printerType, PrinterType.ERR);
    }

    @Test
    public void testAllFamilies() throws ParseException {
        Configuration config = new CmdParser().parseParams(new String[]{
                "--config", "config.json", "--variant", "7-91763673-C-A", "--scores", "ALL"});
        assertEquals(config.families, Arrays.asList(ScoreFamily.values()));
    }

    @DataProvider(name = "wrongParams")
    public Object[][] wrongParams() {
        return new Object[][]{
                {new String[]{"-c", "config.json", "-s", "SURFACE_ACCESSIBILITY"}},
                {new String[]{"-c", "config.json", "-m", "SYNVEP"}},
                {new String[]{"-c", "config.json", "-v", "7-91763673-C-A"}},
                {new String[]{"-c", "config.json", "-v", "7-91763673-C-A", "-s", "NOT_A_FAMILY"}},
                {new String[]{"-c", "config.json", "-v", "7-91763673-C-A", "-r", "hg18", "-l"}},
        };
    }

    @Test(dataProvider = "wrongParams", expectedExceptions = ParseException.class)
    public void testWrongParams(String[] args) throws ParseException {
        new CmdParser().parseParams(args);
    }
}
