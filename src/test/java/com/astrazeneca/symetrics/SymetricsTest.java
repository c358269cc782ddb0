package com.astrazeneca.symetrics;

import com.astrazeneca.symetrics.data.GenomeBuild;
import com.astrazeneca.symetrics.data.ScoreFamily;
import com.astrazeneca.symetrics.data.ScoreRecord;
import com.astrazeneca.symetrics.data.VariantKey;
import com.astrazeneca.symetrics.exception.UnsupportedBuildException;
import com.astrazeneca.symetrics.utils.SqliteTestDatabase;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.Optional;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertFalse;

public class SymetricsTest {
    private static final VariantKey HG19_VARIANT = new VariantKey("7", 91763673, "C", "A", GenomeBuild.HG19);
    private static final VariantKey HG38_VARIANT = new VariantKey("7", 92134359, "C", "A", GenomeBuild.HG38);

    private SqliteTestDatabase scores;
    private SqliteTestDatabase population;
    private Symetrics symetrics;

    @BeforeMethod
    public void setUp() throws Exception {
        scores = SqliteTestDatabase.create()
                .execute(SqliteTestDatabase.SILVA)
                .execute(SqliteTestDatabase.SYNVEP)
                .execute(SqliteTestDatabase.SURF)
                .execute(SqliteTestDatabase.SPLICEAI)
                .execute("INSERT INTO SILVA VALUES (7, 91763673, 'C', 'A', 'CYP51A1', 0.85, -0.12, 4.5, 1, 0)")
                .execute("INSERT INTO SYNVEP VALUES ('7', 91763673, 'C', 'A', 'CYP51A1', 0.31, 92134359)")
                .execute("INSERT INTO SURF VALUES ('7', 92134359, 'C', 'A', 'CYP51A1', 0.42)");
        population = SqliteTestDatabase.create()
                .execute(SqliteTestDatabase.GNOMAD)
                .execute("INSERT INTO gnomad_db VALUES ('7', 92134359, 'C', 'A', 3, 152000, 0.0000197)");
        Configuration conf = new Configuration();
        conf.scoreDatabase = scores.getPath();
        conf.populationDatabase = population.getPath();
        symetrics = new Symetrics(conf);
    }

    @AfterMethod
    public void tearDown() {
        scores.delete();
        population.delete();
    }

    @Test
    public void testScoresInIndexedBuilds() {
        assertEquals(symetrics.getSilvaScore(HG19_VARIANT).get().getMetric("RSCU").doubleValue(), 0.85);
        assertEquals(symetrics.getSurfScore(HG38_VARIANT).get().getMetric("SURF").doubleValue(), 0.42);
        assertEquals(symetrics.getSynvepScore(HG19_VARIANT).get().getMetric("SYNVEP").doubleValue(), 0.31);
        assertEquals(symetrics.getSynvepScore(HG38_VARIANT).get().getMetric("SYNVEP").doubleValue(), 0.31);
        assertEquals(symetrics.getGnomadData(HG38_VARIANT).get().getMetric("AN").intValue(), 152000);
    }

    @Test
    public void testSpliceAiNotFound() {
        assertFalse(symetrics.getSpliceAiScore(HG38_VARIANT).isPresent());
    }

    @Test(expectedExceptions = UnsupportedBuildException.class)
    public void testGnomadHg19() {
        symetrics.getGnomadData(HG19_VARIANT);
    }

    @Test
    public void testLiftover() {
        assertEquals(symetrics.liftover(HG19_VARIANT).get(), HG38_VARIANT);
        assertEquals(symetrics.liftover(HG38_VARIANT).get(), HG19_VARIANT);
    }

    @Test
    public void testResolveLiftedCarriesLiftedCoordinates() {
        ScoreRecord silva = symetrics.resolveLifted(
                ScoreFamily.CONSERVATION, HG38_VARIANT).get();
        assertEquals(silva.position, HG19_VARIANT.position);
        assertEquals(silva.getMetric("GERP").doubleValue(), 4.5);

        ScoreRecord surf = symetrics.resolveLifted(
                ScoreFamily.SURFACE_ACCESSIBILITY, HG19_VARIANT).get();
        assertEquals(surf.position, HG38_VARIANT.position);
    }

    @Test
    public void testResolveLiftedNotInBridgeTable() {
        Optional<ScoreRecord> record = symetrics.resolveLifted(
                ScoreFamily.CONSERVATION,
                new VariantKey("7", 1, "C", "A", GenomeBuild.HG38));
        assertFalse(record.isPresent());
    }

    @Test(expectedExceptions = IllegalStateException.class)
    public void testGnomadConstraintsNotConfigured() {
        symetrics.getGnomadConstraints("CYP51A1");
    }
}
