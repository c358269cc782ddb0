package com.astrazeneca.symetrics;

import com.astrazeneca.symetrics.data.MetricGroup;
import com.astrazeneca.symetrics.exception.InvalidGroupException;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNull;
import static org.testng.Assert.assertTrue;

public class ConfigurationReaderTest {
    private Path dir;

    @BeforeMethod
    public void setUp() throws IOException {
        dir = Files.createTempDirectory("symetrics-config");
    }

    @AfterMethod
    public void tearDown() {
        File[] files = dir.toFile().listFiles();
        if (files != null) {
            for (File file : files) {
                file.delete();
            }
        }
        dir.toFile().delete();
    }

    private String config(String json) throws IOException {
        Path path = dir.resolve("config.json");
        Files.write(path, Collections.singletonList(json), StandardCharsets.UTF_8);
        return path.toString();
    }

    @Test
    public void testRelativePathsResolvedAgainstConfigDirectory() throws IOException {
        String path = config("{\"collection\": {"
                + "\"symetrics\": {\"database\": \"symetrics.db\", "
                + "\"constraints\": {\"SYNVEP\": \"synvep.csv\", \"CpG_exon\": \"/data/cpg_exon.csv\"}}, "
                + "\"gnomad\": {\"database\": \"jdbc:sqlite:/data/gnomad.db\", \"constraints\": \"gnomad.tsv\"}}}");

        Configuration conf = new ConfigurationReader().read(path, new Configuration());

        assertEquals(conf.configPath, path);
        assertEquals(conf.scoreDatabase, new File(dir.toFile(), "symetrics.db").getPath());
        assertEquals(conf.populationDatabase, "jdbc:sqlite:/data/gnomad.db");
        assertEquals(conf.gnomadConstraints, new File(dir.toFile(), "gnomad.tsv").getPath());
        assertEquals(conf.constraintFiles.size(), 2);
        assertEquals(conf.constraintFiles.get(MetricGroup.SYNVEP), new File(dir.toFile(), "synvep.csv").getPath());
        assertEquals(conf.constraintFiles.get(MetricGroup.CPG_EXON), new File("/data/cpg_exon.csv").getPath());
    }

    @Test
    public void testOptionalSections() throws IOException {
        String path = config("{\"collection\": {\"symetrics\": {\"database\": \"jdbc:sqlite::memory:\"}}}");
        Configuration conf = new ConfigurationReader().read(path, new Configuration());
        assertEquals(conf.scoreDatabase, "jdbc:sqlite::memory:");
        assertNull(conf.populationDatabase);
        assertNull(conf.gnomadConstraints);
        assertTrue(conf.constraintFiles.isEmpty());
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testMissingScoreDatabase() throws IOException {
        new ConfigurationReader().read(config("{\"collection\": {\"gnomad\": {\"database\": \"gnomad.db\"}}}"),
                new Configuration());
    }

    @Test(expectedExceptions = InvalidGroupException.class)
    public void testUnknownConstraintGroup() throws IOException {
        new ConfigurationReader().read(config("{\"collection\": {\"symetrics\": {\"database\": \"s.db\", "
                + "\"constraints\": {\"NOT_A_GROUP\": \"x.csv\"}}}}"), new Configuration());
    }

    @Test(expectedExceptions = IOException.class)
    public void testMalformedJson() throws IOException {
        new ConfigurationReader().read(config("{\"collection\": "), new Configuration());
    }
}
