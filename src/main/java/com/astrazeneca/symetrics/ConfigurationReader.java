package com.astrazeneca.symetrics;

import com.astrazeneca.symetrics.data.MetricGroup;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.json.JsonMapper;

import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import java.util.Map;

import static com.astrazeneca.symetrics.data.Patterns.JDBC_URL;

/**
 * Reads locations of the stores and constraint tables from the JSON configuration file:
 * <pre>
 * {"collection": {
 *     "symetrics": {"database": "symetrics.db", "constraints": {"SYNVEP": "synvep.csv", ...}},
 *     "gnomad": {"database": "gnomad.db", "constraints": "gnomad_constraints.tsv"}}}
 * </pre>
 * Relative paths are resolved against the directory of the configuration file.
 */
public class ConfigurationReader {

    /**
     * Fills store and table locations of the configuration.
     * @param configPath path to the JSON file
     * @param conf configuration to fill
     * @return the same configuration
     * @throws IOException if the file can't be read or parsed
     * @throws IllegalArgumentException if the required "collection.symetrics.database" entry is missing
     */
    public Configuration read(String configPath, Configuration conf) throws IOException {
        File configFile = new File(configPath);
        JsonNode root = JsonMapper.builder().build().readTree(configFile);
        File baseDir = configFile.getAbsoluteFile().getParentFile();

        JsonNode collection = root.path("collection");
        JsonNode symetrics = collection.path("symetrics");
        JsonNode gnomad = collection.path("gnomad");

        String scoreDatabase = symetrics.path("database").asText(null);
        if (scoreDatabase == null) {
            throw new IllegalArgumentException("Entry collection.symetrics.database is missing in " + configPath);
        }
        conf.configPath = configPath;
        conf.scoreDatabase = resolveDatabase(baseDir, scoreDatabase);
        conf.populationDatabase = resolveDatabase(baseDir, gnomad.path("database").asText(null));
        conf.gnomadConstraints = resolvePath(baseDir, gnomad.path("constraints").asText(null));

        Iterator<Map.Entry<String, JsonNode>> constraints = symetrics.path("constraints").fields();
        while (constraints.hasNext()) {
            Map.Entry<String, JsonNode> entry = constraints.next();
            MetricGroup group = MetricGroup.fromName(entry.getKey());
            conf.constraintFiles.put(group, resolvePath(baseDir, entry.getValue().asText()));
        }
        return conf;
    }

    static String resolveDatabase(File baseDir, String location) {
        if (location == null || JDBC_URL.matcher(location).find()) {
            return location;
        }
        return resolvePath(baseDir, location);
    }

    static String resolvePath(File baseDir, String path) {
        if (path == null) {
            return null;
        }
        File file = new File(path);
        if (file.isAbsolute() || baseDir == null) {
            return file.getPath();
        }
        return new File(baseDir, path).getPath();
    }
}
